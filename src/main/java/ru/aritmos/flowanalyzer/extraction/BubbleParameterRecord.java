package ru.aritmos.flowanalyzer.extraction;

import java.util.List;
import java.util.Optional;

/**
 * Нормализованная запись об инстанцировании примитива.
 *
 * @param variableId    стабильный идентификатор (с единицы, в порядке обхода дерева)
 * @param variableName  имя переменной или синтетическое {@code _anonymous_<Class>_<n>}
 * @param primitiveName имя примитива в каталоге
 * @param operation     литерал дискриминатора для tagged-union примитивов (или {@code null})
 * @param hasAwait      выражение находится под {@code await}
 * @param hasActionCall сразу вызывается {@code .action()}
 */
public record BubbleParameterRecord(int variableId,
                                    String variableName,
                                    String primitiveName,
                                    String className,
                                    String nodeType,
                                    String operation,
                                    List<ExtractedParameter> parameters,
                                    boolean hasAwait,
                                    boolean hasActionCall,
                                    SourceLocation location) {

    public BubbleParameterRecord {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public Optional<ExtractedParameter> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public BubbleParameterRecord withParameters(List<ExtractedParameter> replacement) {
        return new BubbleParameterRecord(variableId, variableName, primitiveName, className, nodeType, operation,
                replacement, hasAwait, hasActionCall, location);
    }
}
