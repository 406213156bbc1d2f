package ru.aritmos.flowanalyzer.extraction;

import org.junit.jupiter.api.Test;
import ru.aritmos.flowanalyzer.FlowFixtures;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterExtractorTest {

    private final ParameterExtractor extractor = new ParameterExtractor(new FlowAnalyzerProperties());

    private Map<Integer, BubbleParameterRecord> extract(String code) {
        return extractor.extract(FlowFixtures.context(code));
    }

    @Test
    void extract_shouldNumberInstantiationsInSourceOrder() {
        Map<Integer, BubbleParameterRecord> records = extract(FlowFixtures.flow("slack-notifier-flow.ts"));

        assertEquals(List.of(1, 2), List.copyOf(records.keySet()));
        BubbleParameterRecord agent = records.get(1);
        assertEquals("agent", agent.variableName());
        assertEquals("ai-agent", agent.primitiveName());
        assertEquals("AIAgentBubble", agent.className());
        assertEquals("service", agent.nodeType());
        assertNull(agent.operation());
        assertFalse(agent.hasAwait());
        assertFalse(agent.hasActionCall());
        assertEquals(17, agent.location().startLine());
        assertEquals(19, agent.location().startColumn());

        BubbleParameterRecord slack = records.get(2);
        assertEquals("posted", slack.variableName());
        assertEquals("send_message", slack.operation());
        assertTrue(slack.hasAwait());
        assertTrue(slack.hasActionCall());
        assertEquals(29, slack.location().startLine());
    }

    @Test
    void extract_shouldBeDeterministic() {
        String code = FlowFixtures.flow("daily-news-digest.ts");

        Map<Integer, BubbleParameterRecord> first = extract(code);
        Map<Integer, BubbleParameterRecord> second = extract(code);

        assertEquals(first, second);
        assertEquals(List.of("redditScraper", "webScraper", "digestAgent", "emailSender"),
                first.values().stream().map(BubbleParameterRecord::variableName).toList());
        assertEquals("tool", first.get(1).nodeType());
    }

    @Test
    void extract_shouldNameAnonymousInstantiations() {
        Map<Integer, BubbleParameterRecord> records = extract(FlowFixtures.flow("nightly-report-flow.ts"));

        assertEquals("rows", records.get(1).variableName());
        assertEquals("_anonymous_SlackBubble_1", records.get(2).variableName());
        assertTrue(records.get(2).hasAwait());
        assertTrue(records.get(2).hasActionCall());
    }

    @Test
    void extract_shouldClassifyParameterValues() {
        Map<Integer, BubbleParameterRecord> records = extract(FlowFixtures.flow("slack-notifier-flow.ts"));
        BubbleParameterRecord agent = records.get(1);
        BubbleParameterRecord slack = records.get(2);

        ExtractedParameter message = agent.parameter("message").orElseThrow();
        assertEquals(ParameterKind.EXPRESSION, message.kind());
        assertEquals("`Write a short update about ${topic}`", message.value());
        assertFalse(message.editable());

        ExtractedParameter model = agent.parameter("model").orElseThrow();
        assertEquals(ParameterKind.OBJECT, model.kind());
        assertEquals(SemanticType.STRUCTURED, model.semanticType());
        assertTrue(model.editable());

        ExtractedParameter operation = slack.parameter("operation").orElseThrow();
        assertEquals(ParameterKind.STRING, operation.kind());
        assertEquals("send_message", operation.value());
        assertEquals("'send_message'", operation.sourceText());
        assertEquals(SemanticType.SHORT_TEXT, operation.semanticType());
        assertTrue(operation.editable());

        ExtractedParameter channel = slack.parameter("channel").orElseThrow();
        assertEquals(ParameterKind.VARIABLE, channel.kind());
        assertEquals(SemanticType.REFERENCE, channel.semanticType());
        assertFalse(channel.editable());
    }

    @Test
    void extract_shouldClassifyLiteralsEnvAndLongText() {
        String longText = "x".repeat(130);
        String code = "import { BubbleFlow, HttpBubble, type WebhookEvent } from '@bubblelab/bubble-core';\n"
                + "export class KindsFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const r = new HttpBubble({\n"
                + "      url: process.env.TARGET_URL,\n"
                + "      timeout: -1500,\n"
                + "      followRedirects: false,\n"
                + "      body: '" + longText + "',\n"
                + "      headers: { Authorization: payload.path },\n"
                + "      method: 'GET' as const,\n"
                + "    });\n"
                + "    return r;\n"
                + "  }\n"
                + "}\n";

        BubbleParameterRecord record = extract(code).get(1);

        assertEquals(ParameterKind.ENV, record.parameter("url").orElseThrow().kind());
        ExtractedParameter timeout = record.parameter("timeout").orElseThrow();
        assertEquals(ParameterKind.NUMBER, timeout.kind());
        assertEquals(-1500L, timeout.value());
        assertEquals(Boolean.FALSE, record.parameter("followRedirects").orElseThrow().value());
        assertEquals(SemanticType.LONG_TEXT, record.parameter("body").orElseThrow().semanticType());
        assertFalse(record.parameter("headers").orElseThrow().editable());
        assertEquals("GET", record.parameter("method").orElseThrow().value());
        assertEquals(6, record.parameters().size());
    }

    @Test
    void extract_shouldSkipUnregisteredAndBuiltinClasses() {
        String code = "import { BubbleFlow, HelloWorldBubble, type WebhookEvent } from '@bubblelab/bubble-core';\n"
                + "export class SkipFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const when = new Date();\n"
                + "    const hello = new HelloWorldBubble({ name: 'World' });\n"
                + "    return { when, hello };\n"
                + "  }\n"
                + "}\n";

        Map<Integer, BubbleParameterRecord> records = extract(code);

        assertEquals(1, records.size());
        assertEquals("hello", records.get(1).variableName());
    }

    @Test
    void isPureLiteral_shouldRejectReferences() {
        String code = "const a = { x: 1, y: ['a', -2] }; const b = { x: y }; const c = [...items];";
        List<Ast.VariableDeclarator> declarators =
                AstWalker.collect(FlowFixtures.context(code).source().program(), Ast.VariableDeclarator.class);

        assertTrue(ParameterExtractor.isPureLiteral(declarators.get(0).initializer()));
        assertFalse(ParameterExtractor.isPureLiteral(declarators.get(1).initializer()));
        assertFalse(ParameterExtractor.isPureLiteral(declarators.get(2).initializer()));
    }
}
