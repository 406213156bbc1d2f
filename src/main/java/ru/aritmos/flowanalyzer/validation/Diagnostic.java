package ru.aritmos.flowanalyzer.validation;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.FlowSource;

/**
 * Диагностика валидации.
 * <p>
 * Текст {@code message} — часть внешнего контракта: потребители (редактор, ассистент) сопоставляют его
 * по подстрокам, поэтому формулировки стабильны и не локализуются.
 *
 * @param code    стабильный идентификатор правила ({@code FLOW_xxx} или имя lint-правила)
 * @param message текст диагностики
 * @param line    строка (с единицы) или {@code null}
 * @param column  колонка (с единицы) или {@code null}
 */
public record Diagnostic(String code, String message, Integer line, Integer column) {

    public static Diagnostic of(String code, String message) {
        return new Diagnostic(code, message, null, null);
    }

    public static Diagnostic at(String code, String message, FlowSource source, Ast.Node node) {
        if (source == null || node == null) {
            return of(code, message);
        }
        return new Diagnostic(code, message, source.line(node), source.column(node));
    }

    /**
     * Подсказка о положении в формате {@code line:column} (или {@code null}).
     */
    public String locationHint() {
        return line == null ? null : line + ":" + column;
    }
}
