package ru.aritmos.flowanalyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import ru.aritmos.flowanalyzer.catalog.PrimitiveCatalogStore;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;
import ru.aritmos.flowanalyzer.credentials.CredentialResolver;
import ru.aritmos.flowanalyzer.extraction.BubbleParameterRecord;
import ru.aritmos.flowanalyzer.extraction.ExtractionResult;
import ru.aritmos.flowanalyzer.validation.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сквозные сценарии конвейера на поднятом контексте Micronaut.
 */
@MicronautTest
class FlowAnalysisServiceTest {

    @Inject
    FlowAnalysisService service;

    @Inject
    PrimitiveCatalogStore catalogStore;

    @Inject
    FlowAnalyzerProperties properties;

    @Inject
    ObjectMapper objectMapper;

    @Test
    void shouldBindConfigurationFromApplicationYaml() {
        assertEquals("BubbleFlow", properties.getBaseClass());
        assertEquals(List.of("@bubblelab/bubble-core"), properties.getCoreModules());
        assertEquals(30, properties.getLint().getMaxComplexity());
        assertEquals(List.of("no-direct-instantiation-in-handle"), properties.getLint().getDisabledRules());
    }

    @Test
    void shouldLoadBundledCatalogAtStartup() {
        assertEquals(FlowFixtures.catalog().size(), catalogStore.getCatalog().size());
        assertTrue(catalogStore.getCatalog().containsClass("ResendBubble"));
    }

    @Test
    void validate_shouldReturnVerdict() {
        assertTrue(service.validate(FlowFixtures.flow("hello-world-flow.ts")).valid());

        ValidationResult broken = service.validate("");
        assertFalse(broken.valid());
        assertEquals("FLOW_000", broken.errors().get(0).code());
    }

    @Test
    void extract_shouldProduceFullModelForValidFlow() {
        ExtractionResult result = service.extract(FlowFixtures.flow("daily-news-digest.ts"));

        assertTrue(result.valid(), result.errors()::toString);
        assertEquals(4, result.bubbleParameters().size());
        assertEquals("webhook/http", result.triggerEventType());
        assertEquals(Set.of("RESEND_CRED"), result.requiredCredentials().get("resend"));
        assertNotNull(result.inputSchema());
        assertEquals("email", result.inputSchema().get("required").get(0).asText());
        assertEquals("Email address to send the daily news digest to",
                result.inputSchema().get("properties").get("email").get("description").asText());
        assertEquals(3, result.inputSchema().get("properties").get("subreddits").get("default").size());
    }

    @Test
    void extract_shouldReturnOnlyErrorsForInvalidFlow() {
        ExtractionResult result = service.extract("export class Nothing {}");

        assertFalse(result.valid());
        assertFalse(result.errors().isEmpty());
        assertTrue(result.bubbleParameters().isEmpty());
        assertTrue(result.requiredCredentials().isEmpty());
        assertNull(result.inputSchema());
        assertNull(result.triggerEventType());
    }

    @Test
    void extract_shouldReportCronTrigger() {
        ExtractionResult result = service.extract(FlowFixtures.flow("nightly-report-flow.ts"));

        assertTrue(result.valid(), result.errors()::toString);
        assertEquals("schedule/cron", result.triggerEventType());
        assertNull(result.inputSchema());
        assertEquals(Set.of("DATABASE_CRED"), result.requiredCredentials().get("postgresql"));
        assertEquals(Set.of("SLACK_CRED"), result.requiredCredentials().get("slack"));
    }

    @Test
    void injectCredentials_shouldFillCredentialsParameter() {
        ExtractionResult result = service.injectCredentials(FlowFixtures.flow("nightly-report-flow.ts"),
                Map.of("DATABASE_CRED", "postgres://u:p@db/app", "SLACK_CRED", "xoxb-1"));

        BubbleParameterRecord postgres = result.bubbleParameters().get(1);
        BubbleParameterRecord slack = result.bubbleParameters().get(2);
        assertEquals(Map.of("DATABASE_CRED", "postgres://u:p@db/app"),
                postgres.parameter(CredentialResolver.CREDENTIALS_PARAMETER).orElseThrow().value());
        assertEquals(Map.of("SLACK_CRED", "xoxb-1"),
                slack.parameter(CredentialResolver.CREDENTIALS_PARAMETER).orElseThrow().value());
    }

    @Test
    void injectCredentials_shouldPassInvalidExtractionThrough() {
        ExtractionResult failed = service.extract("class {");

        assertSame(failed, service.injectCredentials(failed, Map.of("SLACK_CRED", "x")));
    }

    @Test
    void normalize_shouldDelegateToNormalizer() {
        assertEquals("while (x) {\n  x--;\n}", service.normalize("while (x) x--;"));
    }

    @Test
    void extractionResult_shouldSerializeWithLowercaseEnums() throws Exception {
        ExtractionResult result = service.extract(FlowFixtures.flow("hello-world-flow.ts"));

        String json = objectMapper.writeValueAsString(result);

        assertTrue(json.contains("\"kind\":\"string\""), json);
        assertTrue(json.contains("\"semanticType\":\"short_text\""), json);
        assertTrue(json.contains("\"variableName\":\"greeter\""), json);
    }
}
