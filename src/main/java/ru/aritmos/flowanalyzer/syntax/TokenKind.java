package ru.aritmos.flowanalyzer.syntax;

/**
 * Виды лексем. Ключевые слова не выделяются в отдельный вид: в TypeScript большинство из них
 * контекстные, поэтому парсер различает их по тексту {@link TokenKind#IDENTIFIER}.
 */
public enum TokenKind {
    IDENTIFIER,
    PRIVATE_NAME,
    NUMBER,
    BIGINT,
    STRING,
    /** Шаблонная строка без подстановок: {@code `text`}. */
    TEMPLATE,
    /** Начало шаблона до первой подстановки: {@code `text${}. */
    TEMPLATE_HEAD,
    /** Фрагмент между подстановками: {@code }text${}. */
    TEMPLATE_MIDDLE,
    /** Хвост шаблона: {@code }text`}. */
    TEMPLATE_TAIL,
    REGEX,
    PUNCTUATOR,
    EOF
}
