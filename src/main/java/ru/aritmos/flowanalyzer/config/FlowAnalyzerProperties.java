package ru.aritmos.flowanalyzer.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.util.List;

/**
 * Typed-конфигурация анализатора flow.
 * <p>
 * Единая точка чтения настроек конвейера из application.yml/ENV: имя базового класса flow,
 * имя entry-метода, модули «ядра», из которых импортируются примитивы, путь к каталогу примитивов,
 * пороги извлечения параметров и набор lint-правил.
 */
@ConfigurationProperties("flowanalyzer")
public class FlowAnalyzerProperties {

    private String baseClass = "BubbleFlow";
    private String entryMethod = "handle";
    private List<String> coreModules = List.of("@bubblelab/bubble-core");

    private Catalog catalog = new Catalog();
    private Extraction extraction = new Extraction();
    private Lint lint = new Lint();

    public String getBaseClass() {
        return baseClass;
    }

    public void setBaseClass(String baseClass) {
        this.baseClass = normalize(baseClass, "BubbleFlow");
    }

    public String getEntryMethod() {
        return entryMethod;
    }

    public void setEntryMethod(String entryMethod) {
        this.entryMethod = normalize(entryMethod, "handle");
    }

    public List<String> getCoreModules() {
        return coreModules;
    }

    public void setCoreModules(List<String> coreModules) {
        this.coreModules = (coreModules == null || coreModules.isEmpty())
                ? List.of("@bubblelab/bubble-core")
                : coreModules.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog == null ? new Catalog() : catalog;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction == null ? new Extraction() : extraction;
    }

    public Lint getLint() {
        return lint;
    }

    public void setLint(Lint lint) {
        this.lint = lint == null ? new Lint() : lint;
    }

    private static String normalize(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    @ConfigurationProperties("catalog")
    public static class Catalog {
        private String path = "classpath:catalog/primitives.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = normalize(path, "classpath:catalog/primitives.json");
        }
    }

    @ConfigurationProperties("extraction")
    public static class Extraction {
        /**
         * Строковое значение длиннее порога считается «длинным текстом» (многострочный редактор в UI).
         */
        private int longTextThreshold = 120;

        public int getLongTextThreshold() {
            return longTextThreshold;
        }

        public void setLongTextThreshold(int longTextThreshold) {
            this.longTextThreshold = longTextThreshold <= 0 ? 120 : longTextThreshold;
        }
    }

    @ConfigurationProperties("lint")
    public static class Lint {
        private boolean enabled = true;
        private int maxComplexity = 30;
        private List<String> disabledRules = List.of("no-direct-instantiation-in-handle");

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxComplexity() {
            return maxComplexity;
        }

        public void setMaxComplexity(int maxComplexity) {
            this.maxComplexity = maxComplexity <= 0 ? 30 : maxComplexity;
        }

        public List<String> getDisabledRules() {
            return disabledRules;
        }

        public void setDisabledRules(List<String> disabledRules) {
            this.disabledRules = disabledRules == null
                    ? List.of()
                    : disabledRules.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        }
    }
}
