package ru.aritmos.flowanalyzer.validation.lint;

import org.junit.jupiter.api.Test;
import ru.aritmos.flowanalyzer.FlowFixtures;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LintRulesTest {

    private static final String HEADER =
            "import { BubbleFlow, SlackBubble, type WebhookEvent, type CronEvent } from '@bubblelab/bubble-core';\n\n";

    private static FlowContext webhookFlow(String body) {
        return FlowFixtures.context(HEADER + "export class LintFlow extends BubbleFlow<'webhook/http'> {\n"
                + body
                + "}\n");
    }

    private static FlowContext cronFlow(String members) {
        return FlowFixtures.context(HEADER + "export class CronFlow extends BubbleFlow<'schedule/cron'> {\n"
                + members
                + "  async handle(payload: CronEvent) { return {}; }\n"
                + "}\n");
    }

    @Test
    void bulkEnvAccess_shouldAllowSingleReads() {
        FlowContext context = webhookFlow("  async handle(payload: WebhookEvent) {\n"
                + "    const key = process.env.API_KEY;\n"
                + "    const other = process.env['OTHER_KEY'];\n"
                + "    const { REGION } = process.env;\n"
                + "    return { key, other, REGION };\n"
                + "  }\n");

        assertTrue(new NoBulkEnvAccessRule().check(context).isEmpty());
    }

    @Test
    void bulkEnvAccess_shouldRejectWholeObjectUsage() {
        FlowContext context = webhookFlow("  async handle(payload: WebhookEvent) {\n"
                + "    const all = process.env;\n"
                + "    const copy = { ...process.env };\n"
                + "    const { ...rest } = process.env;\n"
                + "    return { all, copy, rest };\n"
                + "  }\n");

        List<Diagnostic> errors = new NoBulkEnvAccessRule().check(context);

        assertEquals(3, errors.size());
        assertEquals(NoBulkEnvAccessRule.NAME, errors.get(0).code());
        assertTrue(errors.get(0).message().startsWith("Bulk access to process.env is not allowed."));
        assertEquals(5, errors.get(0).line());
    }

    @Test
    void maxComplexity_shouldCountBranches() {
        FlowContext context = webhookFlow("  async handle(payload: WebhookEvent) {\n"
                + "    if (payload.body) { return 1; }\n"
                + "    const v = payload.path ? 1 : 2;\n"
                + "    for (const x of [1, 2]) { if (x > v && v > 0) { return x; } }\n"
                + "    return 0;\n"
                + "  }\n");

        assertTrue(new MaxMethodComplexityRule(10).check(context).isEmpty());
        List<Diagnostic> errors = new MaxMethodComplexityRule(4).check(context);
        assertEquals(1, errors.size());
        assertEquals("Method 'handle' has a cyclomatic complexity of 6. Maximum allowed is 4. Split it into smaller steps.",
                errors.get(0).message());
    }

    @Test
    void complexExpression_shouldRejectStepCallInsideTernaryAndObjectLiteral() {
        FlowContext context = webhookFlow("  private load() { return 1; }\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const a = payload.body ? this.load() : 0;\n"
                + "    const b = { value: this.load() };\n"
                + "    const c = this.load();\n"
                + "    return { a, b, c };\n"
                + "  }\n");

        List<Diagnostic> errors = new NoMethodInvocationInComplexExpressionRule().check(context);

        assertEquals(2, errors.size());
        assertEquals("Method invocation 'this.load()' inside ternary operator cannot be instrumented. "
                + "Extract to a separate variable before using in ternary operator.", errors.get(0).message());
        assertTrue(errors.get(1).message().contains("inside object property"));
    }

    @Test
    void dynamicCode_shouldRejectEvalAndFunctionConstructor() {
        FlowContext context = webhookFlow("  async handle(payload: WebhookEvent) {\n"
                + "    const a = eval('1 + 1');\n"
                + "    const f = new Function('return 1');\n"
                + "    return { a, f };\n"
                + "  }\n");

        List<Diagnostic> errors = new NoDynamicCodeRule().check(context);

        assertEquals(2, errors.size());
        assertEquals("Dynamic code evaluation ('eval') is not allowed in flows.", errors.get(0).message());
        assertEquals("Dynamic code evaluation ('new Function') is not allowed in flows.", errors.get(1).message());
    }

    @Test
    void cronSchedule_shouldRequireProperty() {
        List<Diagnostic> errors = new RequireCronScheduleRule().check(cronFlow(""));

        assertEquals(1, errors.size());
        assertEquals("BubbleFlow with 'schedule/cron' event type must define a readonly cronSchedule property. "
                + "Example: readonly cronSchedule = '0 0 * * *';", errors.get(0).message());
    }

    @Test
    void cronSchedule_shouldRequireStringLiteral() {
        List<Diagnostic> errors = new RequireCronScheduleRule().check(cronFlow("  readonly cronSchedule = SCHEDULE;\n"));

        assertEquals(List.of("cronSchedule must be initialized with a string literal, not a variable or expression"),
                errors.stream().map(Diagnostic::message).toList());
    }

    @Test
    void cronSchedule_shouldRejectInvalidExpression() {
        List<Diagnostic> errors = new RequireCronScheduleRule().check(cronFlow("  readonly cronSchedule = '61 * * * *';\n"));

        assertEquals(1, errors.size());
        assertEquals("cronSchedule must be a string literal containing a valid 5-part cron expression. "
                + "Invalid minute: 61 (must be 0-59)", errors.get(0).message());
    }

    @Test
    void cronSchedule_shouldIgnoreWebhookFlows() {
        FlowContext context = webhookFlow("  async handle(payload: WebhookEvent) { return {}; }\n");

        assertTrue(new RequireCronScheduleRule().check(context).isEmpty());
    }

    @Test
    void validateCron_shouldAcceptCommonForms() {
        assertNull(RequireCronScheduleRule.validateCron("0 0 * * *"));
        assertNull(RequireCronScheduleRule.validateCron("*/15 9-17 * * 1-5"));
        assertNull(RequireCronScheduleRule.validateCron("0,30 8 1 1,6 0"));
        assertNull(RequireCronScheduleRule.validateCron("0 0-12/2 * * *"));
    }

    @Test
    void validateCron_shouldExplainErrors() {
        assertEquals("Cron expression must have exactly 5 parts (minute hour day month day-of-week), got 3",
                RequireCronScheduleRule.validateCron("0 0 *"));
        assertEquals("Invalid step value in minute: */0", RequireCronScheduleRule.validateCron("*/0 * * * *"));
        assertEquals("Invalid range in hour: 5-2 (must be 0-23)", RequireCronScheduleRule.validateCron("0 5-2 * * *"));
        assertEquals("Invalid value in day of week list: 9 (must be 0-6)", RequireCronScheduleRule.validateCron("0 0 * * 1,9"));
        assertEquals("Invalid month: 13 (must be 1-12)", RequireCronScheduleRule.validateCron("0 0 1 13 *"));
    }

    @Test
    void directInstantiation_shouldFlagTopLevelPrimitiveInHandle() {
        FlowContext context = webhookFlow("  private async notify() {\n"
                + "    return new SlackBubble({ operation: 'send_message', channel: 'a', text: 'b' }).action();\n"
                + "  }\n"
                + "  async handle(payload: WebhookEvent) {\n"
                + "    const r = await new SlackBubble({ operation: 'send_message', channel: 'a', text: 'b' }).action();\n"
                + "    const when = new Date();\n"
                + "    return { r, when };\n"
                + "  }\n");

        List<Diagnostic> errors = new NoDirectInstantiationInHandleRule().check(context);

        assertEquals(1, errors.size());
        assertEquals(8, errors.get(0).line());
        assertTrue(errors.get(0).message().startsWith("Direct bubble instantiation is not allowed in handle method."));
    }

    @Test
    void registry_shouldSkipDisabledRulesByDefault() {
        LintRuleRegistry registry = new LintRuleRegistry(new FlowAnalyzerProperties());

        assertFalse(registry.activeRuleNames().contains(NoDirectInstantiationInHandleRule.NAME));
        assertTrue(registry.activeRuleNames().contains(RequireCronScheduleRule.NAME));
        assertEquals(5, registry.activeRuleNames().size());
    }

    @Test
    void registry_shouldRunNothingWhenDisabled() {
        FlowAnalyzerProperties props = new FlowAnalyzerProperties();
        props.getLint().setEnabled(false);
        LintRuleRegistry registry = new LintRuleRegistry(props);

        assertTrue(registry.activeRuleNames().isEmpty());
        assertTrue(registry.run(cronFlow("")).isEmpty());
    }

    @Test
    void registry_shouldSurviveFailingRule() {
        LintRule failing = new LintRule() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public List<Diagnostic> check(FlowContext context) {
                throw new IllegalStateException("boom");
            }
        };
        LintRuleRegistry registry = LintRuleRegistry.of(List.of(failing, new RequireCronScheduleRule()), Set.of());

        List<Diagnostic> errors = registry.run(cronFlow(""));

        assertEquals(1, errors.size());
        assertEquals(RequireCronScheduleRule.NAME, errors.get(0).code());
    }
}
