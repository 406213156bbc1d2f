package ru.aritmos.flowanalyzer.extraction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Синтаксический класс значения параметра.
 */
public enum ParameterKind {
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    /** Ссылка на переменную окружения ({@code process.env.X}). */
    ENV,
    /** Ссылка на переменную или поле. */
    VARIABLE,
    /** Вычисляемое выражение (вызов, шаблон с подстановками, стрелочная функция и т.п.). */
    EXPRESSION,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
