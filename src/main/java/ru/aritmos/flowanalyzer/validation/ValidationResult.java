package ru.aritmos.flowanalyzer.validation;

import java.util.List;

/**
 * Вердикт валидации.
 * <p>
 * Инвариант: {@code errors} не пуст тогда и только тогда, когда {@code valid == false}. Порядок ошибок
 * соответствует фиксированному порядку правил.
 */
public record ValidationResult(boolean valid, List<Diagnostic> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid=" + valid + " contradicts errors=" + errors.size());
        }
    }

    public static ValidationResult success() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult of(List<Diagnostic> errors) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors);
    }

    public List<String> messages() {
        return errors.stream().map(Diagnostic::message).toList();
    }
}
