package ru.aritmos.flowanalyzer.syntax;

/**
 * Лексема.
 *
 * @param kind          вид лексемы
 * @param text          исходный текст лексемы (как в коде)
 * @param value         декодированное значение: строка для строк/шаблонов, {@link Double} для чисел
 * @param start         смещение начала
 * @param end           смещение конца (исключительно)
 * @param newlineBefore был ли перевод строки между предыдущей лексемой и этой (нужно для ASI)
 * @param docComment    текст JSDoc-комментария непосредственно перед лексемой (или {@code null})
 */
public record Token(TokenKind kind,
                   String text,
                   Object value,
                   int start,
                   int end,
                   boolean newlineBefore,
                   String docComment) {

    public boolean is(TokenKind expected, String expectedText) {
        return kind == expected && text.equals(expectedText);
    }

    public boolean isPunct(String punct) {
        return kind == TokenKind.PUNCTUATOR && text.equals(punct);
    }

    public boolean isWord(String word) {
        return kind == TokenKind.IDENTIFIER && text.equals(word);
    }

    public String stringValue() {
        return value == null ? text : String.valueOf(value);
    }
}
