package ru.aritmos.flowanalyzer.validation.lint;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.List;

/**
 * Lint-правило flow.
 * <p>
 * Правила независимы друг от друга и получают общий, заранее разобранный {@link FlowContext}.
 * Код диагностики правила совпадает с его именем.
 */
public interface LintRule {

    /**
     * Стабильное имя правила (используется в конфигурации и как код диагностики).
     */
    String name();

    List<Diagnostic> check(FlowContext context);

    default Diagnostic diagnostic(FlowContext context, Ast.Node node, String message) {
        return Diagnostic.at(name(), message, context.source(), node);
    }
}
