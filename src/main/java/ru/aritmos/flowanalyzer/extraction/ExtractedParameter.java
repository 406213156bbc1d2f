package ru.aritmos.flowanalyzer.extraction;

/**
 * Параметр инстанцирования примитива.
 *
 * @param name         имя свойства (или имя переменной / {@code arg0} для необъектного аргумента)
 * @param kind         синтаксический класс значения
 * @param value        значение: декодированная строка, число, boolean или исходный текст для ссылок и выражений
 * @param sourceText   исходный текст значения
 * @param semanticType подсказка UI
 * @param editable     можно ли редактировать значение в UI без изменения смысла кода
 * @param location     положение значения ({@code null} для синтетических параметров)
 */
public record ExtractedParameter(String name,
                                 ParameterKind kind,
                                 Object value,
                                 String sourceText,
                                 SemanticType semanticType,
                                 boolean editable,
                                 SourceLocation location) {
}
