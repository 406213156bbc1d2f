package ru.aritmos.flowanalyzer.extraction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.ValidationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Результат валидации и извлечения параметров.
 * <p>
 * При {@code valid == false} карты пусты, а схема и тип триггера отсутствуют.
 *
 * @param bubbleParameters    записи по {@code variableId} в порядке обхода
 * @param requiredCredentials виды учётных данных по имени примитива
 * @param inputSchema         JSON Schema входного payload или {@code null}
 * @param triggerEventType    ключ события-триггера из {@code BubbleFlow<...>} или {@code null}
 */
public record ExtractionResult(boolean valid,
                               List<Diagnostic> errors,
                               Map<Integer, BubbleParameterRecord> bubbleParameters,
                               Map<String, Set<String>> requiredCredentials,
                               ObjectNode inputSchema,
                               String triggerEventType) {

    public ExtractionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        bubbleParameters = bubbleParameters == null ? Map.of() : new LinkedHashMap<>(bubbleParameters);
        requiredCredentials = requiredCredentials == null ? Map.of() : new LinkedHashMap<>(requiredCredentials);
    }

    public static ExtractionResult failed(ValidationResult validation) {
        return new ExtractionResult(false, validation.errors(), Map.of(), Map.of(), null, null);
    }

    public ValidationResult validation() {
        return new ValidationResult(valid, errors);
    }
}
