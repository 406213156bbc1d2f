package ru.aritmos.flowanalyzer.extraction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Подсказка UI о виде редактора значения.
 */
public enum SemanticType {
    BOOLEAN,
    NUMBER,
    SHORT_TEXT,
    /** Многострочный текст: есть перевод строки или длина больше порога. */
    LONG_TEXT,
    STRUCTURED,
    REFERENCE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
