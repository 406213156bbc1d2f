package ru.aritmos.flowanalyzer.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowAnalyzerPropertiesTest {

    @Test
    void shouldHaveExpectedDefaults() {
        FlowAnalyzerProperties props = new FlowAnalyzerProperties();

        assertEquals("BubbleFlow", props.getBaseClass());
        assertEquals("handle", props.getEntryMethod());
        assertEquals(List.of("@bubblelab/bubble-core"), props.getCoreModules());
        assertEquals("classpath:catalog/primitives.json", props.getCatalog().getPath());
        assertEquals(120, props.getExtraction().getLongTextThreshold());
        assertTrue(props.getLint().isEnabled());
        assertEquals(30, props.getLint().getMaxComplexity());
        assertEquals(List.of("no-direct-instantiation-in-handle"), props.getLint().getDisabledRules());
    }

    @Test
    void shouldNormalizeInputValues() {
        FlowAnalyzerProperties props = new FlowAnalyzerProperties();

        props.setBaseClass("  ");
        props.setEntryMethod(" run ");
        props.setCoreModules(Arrays.asList(" @acme/core ", " "));
        props.getCatalog().setPath(null);
        props.getExtraction().setLongTextThreshold(0);
        props.getLint().setMaxComplexity(-5);
        props.getLint().setDisabledRules(Arrays.asList(" max-method-complexity ", ""));

        assertEquals("BubbleFlow", props.getBaseClass());
        assertEquals("run", props.getEntryMethod());
        assertEquals(List.of("@acme/core"), props.getCoreModules());
        assertEquals("classpath:catalog/primitives.json", props.getCatalog().getPath());
        assertEquals(120, props.getExtraction().getLongTextThreshold());
        assertEquals(List.of("max-method-complexity"), props.getLint().getDisabledRules());
        assertEquals(30, props.getLint().getMaxComplexity());
    }

    @Test
    void shouldFallBackToDefaultCoreModuleWhenListIsEmpty() {
        FlowAnalyzerProperties props = new FlowAnalyzerProperties();

        props.setCoreModules(List.of());

        assertEquals(List.of("@bubblelab/bubble-core"), props.getCoreModules());
    }

    @Test
    void shouldResetNestedSectionsToDefaults() {
        FlowAnalyzerProperties props = new FlowAnalyzerProperties();
        props.getLint().setMaxComplexity(5);

        props.setLint(null);
        props.setCatalog(null);

        assertEquals(30, props.getLint().getMaxComplexity());
        assertEquals("classpath:catalog/primitives.json", props.getCatalog().getPath());
    }
}
