package ru.aritmos.flowanalyzer.validation;

import org.junit.jupiter.api.Test;
import ru.aritmos.flowanalyzer.FlowFixtures;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.syntax.FlowSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuralValidatorTest {

    private static final String HEADER =
            "import { BubbleFlow, HelloWorldBubble, SlackBubble, type WebhookEvent } from '@bubblelab/bubble-core';\n\n";

    private static ValidationResult validate(String code) {
        return FlowFixtures.validator().validate(code, FlowFixtures.catalog());
    }

    private static List<Diagnostic> errorsWithCode(ValidationResult result, FlowDiagnostic diagnostic) {
        return result.errors().stream().filter(d -> diagnostic.code().equals(d.code())).toList();
    }

    @Test
    void validate_shouldAcceptWellFormedFlows() {
        for (String fixture : List.of("hello-world-flow.ts", "slack-notifier-flow.ts", "nightly-report-flow.ts",
                "daily-news-digest.ts", "braceless-control-flow.ts")) {
            ValidationResult result = validate(FlowFixtures.flow(fixture));

            assertTrue(result.valid(), () -> fixture + ": " + result.messages());
            assertTrue(result.errors().isEmpty());
        }
    }

    @Test
    void validate_shouldRejectEmptySource() {
        ValidationResult result = validate("   \n");

        assertFalse(result.valid());
        assertEquals(List.of("Code cannot be empty"), result.messages());
        assertEquals("FLOW_000", result.errors().get(0).code());
    }

    @Test
    void validate_shouldReportSyntaxErrorOnly() {
        ValidationResult result = validate(HEADER + "export class Broken extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const x = ;\n"
                + "  }\n"
                + "}\n");

        assertEquals(1, result.errors().size());
        Diagnostic error = result.errors().get(0);
        assertEquals("FLOW_001", error.code());
        assertEquals(5, error.line());
        assertTrue(error.message().startsWith("Line 5, Column "));
    }

    @Test
    void validate_shouldRequireFlowClass() {
        ValidationResult result = validate(HEADER + "export class Helper {\n  run() { return 1; }\n}\n");

        assertEquals(List.of("Code must contain a class that extends BubbleFlow"), result.messages());
    }

    @Test
    void validate_shouldRejectMultipleFlowClasses() {
        String code = HEADER
                + "export class FirstFlow extends BubbleFlow<'webhook/http'> {\n  async handle(payload: WebhookEvent) { return {}; }\n}\n"
                + "export class SecondFlow extends BubbleFlow<'webhook/http'> {\n  async handle(payload: WebhookEvent) { return {}; }\n}\n";

        ValidationResult result = validate(code);

        assertEquals(1, result.errors().size());
        assertEquals("Code must contain exactly one class that extends BubbleFlow, but found 2: FirstFlow, SecondFlow",
                result.errors().get(0).message());
    }

    @Test
    void validate_shouldRequireBaseClassImport() {
        String code = "export class LonelyFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: any) { return {}; }\n"
                + "}\n";

        ValidationResult result = validate(code);

        assertEquals(1, errorsWithCode(result, FlowDiagnostic.UNRESOLVED_BASE_CLASS).size());
        assertTrue(result.messages().contains("Cannot find name 'BubbleFlow'. Import it from '@bubblelab/bubble-core'."));
    }

    @Test
    void validate_shouldRejectUnknownTriggerType() {
        String code = HEADER + "export class OddFlow extends BubbleFlow<'webhook/ftp'> {\n"
                + "  async handle(payload: WebhookEvent) { return {}; }\n"
                + "}\n";

        ValidationResult result = validate(code);

        List<Diagnostic> errors = errorsWithCode(result, FlowDiagnostic.INVALID_TRIGGER_TYPE);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().startsWith("Type 'webhook/ftp' does not satisfy the constraint"));
        assertTrue(errors.get(0).message().contains("webhook/http"));
    }

    @Test
    void validate_shouldRequireEntryMethod() {
        String code = HEADER + "export class IdleFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async run(payload: WebhookEvent) { return {}; }\n"
                + "}\n";

        ValidationResult result = validate(code);

        assertFalse(result.valid());
        assertTrue(result.messages().get(0).contains("does not implement inherited abstract member"));
        assertTrue(result.messages().get(0).contains("'handle'"));
        assertEquals(3, result.errors().get(0).line());
    }

    @Test
    void validate_shouldUseConfiguredEntryMethodName() {
        FlowAnalyzerProperties props = new FlowAnalyzerProperties();
        props.setEntryMethod("run");
        String code = HEADER + "export class RunFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async run(payload: WebhookEvent) { return {}; }\n"
                + "}\n";

        ValidationResult result = FlowFixtures.validator(props).validate(code, FlowFixtures.catalog());

        assertTrue(result.valid(), result.messages()::toString);
    }

    @Test
    void validate_shouldRejectThrowDirectlyInEntryMethod() {
        String code = HEADER + "export class ThrowingFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    if (!payload.body) throw new Error('no body');\n"
                + "    throw new Error('boom');\n"
                + "  }\n"
                + "}\n";

        ValidationResult result = validate(code);

        List<Diagnostic> errors = errorsWithCode(result, FlowDiagnostic.THROW_IN_ENTRY_METHOD);
        assertEquals(2, errors.size());
        assertEquals("throw statements are not allowed directly in handle method. Move error handling into another step.",
                errors.get(0).message());
        assertEquals(5, errors.get(0).line());
        assertEquals(6, errors.get(1).line());
    }

    @Test
    void validate_shouldAllowThrowInsideBracedBlocksAndOtherMethods() {
        String code = HEADER + "export class GuardedFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  private check(value: unknown) {\n"
                + "    throw new Error('invalid');\n"
                + "  }\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    if (!payload.body) {\n"
                + "      throw new Error('no body');\n"
                + "    }\n"
                + "    try {\n"
                + "      this.check(payload.body);\n"
                + "    } catch (e) {\n"
                + "      throw e;\n"
                + "    }\n"
                + "    return {};\n"
                + "  }\n"
                + "}\n";

        ValidationResult result = validate(code);

        assertTrue(errorsWithCode(result, FlowDiagnostic.THROW_IN_ENTRY_METHOD).isEmpty(), result.messages()::toString);
    }

    @Test
    void validate_shouldRejectNestedMethodCalls() {
        String code = HEADER + "export class ChainFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  private first() {\n"
                + "    return this.second();\n"
                + "  }\n"
                + "  private second() {\n"
                + "    return 2;\n"
                + "  }\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const a = this.first();\n"
                + "    const b = this.second();\n"
                + "    return { a, b };\n"
                + "  }\n"
                + "}\n";

        ValidationResult result = validate(code);

        List<Diagnostic> errors = errorsWithCode(result, FlowDiagnostic.NESTED_METHOD_CALL);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().startsWith("Method 'second' cannot be called from another method."));
        assertTrue(errors.get(0).message().contains("called from 'first'"));
        assertEquals(5, errors.get(0).line());
    }

    @Test
    void validate_shouldRejectLiteralCredentialsOnce() {
        String code = HEADER + "export class LeakyFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const a = new SlackBubble({ operation: 'send_message', channel: 'x', text: 'y',\n"
                + "      credentials: { SLACK_CRED: 'xoxb-123' } });\n"
                + "    const b = new SlackBubble({ operation: 'send_message', channel: 'x', text: 'y',\n"
                + "      credentials: { SLACK_CRED: 'xoxb-456' } });\n"
                + "    return {};\n"
                + "  }\n"
                + "}\n";

        ValidationResult result = validate(code);

        List<String> mentions = result.messages().stream().filter(m -> m.contains("credentials")).toList();
        assertEquals(1, mentions.size());
        assertEquals("credentials parameter is not allowed in bubble instantiation. "
                + "Credentials should be injected at runtime, not passed as parameters.", mentions.get(0));
    }

    @Test
    void isLiteralSecret_shouldIgnoreReferencesAndEmptyValues() {
        assertFalse(StructuralValidator.isLiteralSecret(expression("''")));
        assertFalse(StructuralValidator.isLiteralSecret(expression("null")));
        assertFalse(StructuralValidator.isLiteralSecret(expression("{}")));
        assertFalse(StructuralValidator.isLiteralSecret(expression("creds")));
        assertTrue(StructuralValidator.isLiteralSecret(expression("'secret'")));
        assertTrue(StructuralValidator.isLiteralSecret(expression("['a']")));
        assertTrue(StructuralValidator.isLiteralSecret(expression("`token-${id}`")));
    }

    @Test
    void validate_shouldReportEveryUnregisteredInstantiation() {
        String code = HEADER + "export class MysteryFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const a = new MysteryBubble({});\n"
                + "    const b = new MysteryBubble({});\n"
                + "    const when = new Date();\n"
                + "    return { a, b, when };\n"
                + "  }\n"
                + "}\n";

        ValidationResult result = validate(code);

        List<Diagnostic> errors = errorsWithCode(result, FlowDiagnostic.UNREGISTERED_PRIMITIVE);
        assertEquals(2, errors.size());
        assertTrue(errors.get(0).message().startsWith("Class 'MysteryBubble' is not registered in the primitive catalog."));
        assertTrue(errors.get(0).message().contains("HelloWorldBubble"));
        assertEquals(5, errors.get(0).line());
        assertEquals(6, errors.get(1).line());
    }

    @Test
    void validate_shouldRequireImportOfRegisteredPrimitive() {
        String code = HEADER + "export class ForgetfulFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const r = await new HttpBubble({ url: 'https://example.com' }).action();\n"
                + "    return r;\n"
                + "  }\n"
                + "}\n";

        ValidationResult result = validate(code);

        List<Diagnostic> errors = errorsWithCode(result, FlowDiagnostic.UNIMPORTED_PRIMITIVE);
        assertEquals(1, errors.size());
        assertEquals("Cannot find name 'HttpBubble'. Import it from '@bubblelab/bubble-core'.", errors.get(0).message());
    }

    @Test
    void validate_shouldIgnoreLocalAndForeignClasses() {
        String code = "import { BubbleFlow, type WebhookEvent } from '@bubblelab/bubble-core';\n"
                + "import { Client } from 'some-sdk';\n\n"
                + "class Counter {\n  value = 0;\n}\n\n"
                + "export class LocalFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const counter = new Counter();\n"
                + "    const client = new Client();\n"
                + "    return { counter, client };\n"
                + "  }\n"
                + "}\n";

        ValidationResult result = validate(code);

        assertTrue(result.valid(), result.messages()::toString);
    }

    @Test
    void validate_shouldIgnoreLocalFunctionsAndClassExpressions() {
        String code = "import { BubbleFlow, type WebhookEvent } from '@bubblelab/bubble-core';\n\n"
                + "function Foo() {\n  return;\n}\n\n"
                + "const Point = class {\n  x = 1;\n};\n\n"
                + "export class LocalFlow extends BubbleFlow<'webhook/http'> {\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const foo = new Foo();\n"
                + "    const point = new Point();\n"
                + "    return { foo, point };\n"
                + "  }\n"
                + "}\n";

        StructuralValidator.Analysis analysis = FlowFixtures.validator().analyze(code, FlowFixtures.catalog());

        assertTrue(analysis.result().valid(), analysis.result().messages()::toString);
        assertTrue(analysis.context().instantiations().isEmpty());
        assertTrue(analysis.context().localNames().containsAll(List.of("Foo", "Point")));
    }

    @Test
    void analyze_shouldReturnContextForParsedCode() {
        StructuralValidator.Analysis analysis = FlowFixtures.validator()
                .analyze(FlowFixtures.flow("hello-world-flow.ts"), FlowFixtures.catalog());

        assertTrue(analysis.result().valid());
        assertNotNull(analysis.context());
        assertEquals("webhook/http", analysis.context().triggerEventType());
        assertEquals(1, analysis.context().instantiations().size());
    }

    @Test
    void analyze_shouldReturnNoContextForSyntaxError() {
        StructuralValidator.Analysis analysis = FlowFixtures.validator().analyze("class {", FlowFixtures.catalog());

        assertFalse(analysis.result().valid());
        assertNull(analysis.context());
    }

    private static Ast.Expression expression(String text) {
        FlowSource source = FlowSource.parse("const v = " + text + ";");
        return AstWalker.collect(source.program(), Ast.VariableDeclarator.class).get(0).initializer();
    }
}
