package ru.aritmos.flowanalyzer;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа Flow Analyzer.
 * <p>
 * Сервис принимает исходный код flow (TypeScript-подмножество), сгенерированный ассистентом,
 * и до исполнения выполняет: структурную валидацию, проверку типов параметров примитивов,
 * извлечение редактируемой модели параметров и нормализацию control-flow для инструментирования.
 * <p>
 * Важно: сервис ничего не исполняет. Выполнение flow и сами примитивы находятся во внешних контурах.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
