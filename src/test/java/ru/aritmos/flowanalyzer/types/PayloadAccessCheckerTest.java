package ru.aritmos.flowanalyzer.types;

import org.junit.jupiter.api.Test;
import ru.aritmos.flowanalyzer.FlowFixtures;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PayloadAccessCheckerTest {

    private static final String HEADER = "import { BubbleFlow, type WebhookEvent, type CronEvent } from '@bubblelab/bubble-core';\n\n"
            + "interface OrderPayload extends WebhookEvent {\n"
            + "  orderId: string;\n"
            + "  customer: { name: string; email?: string };\n"
            + "}\n\n";

    private static List<Diagnostic> check(String handle) {
        FlowContext context = FlowFixtures.context(HEADER
                + "export class AccessFlow extends BubbleFlow<'webhook/http'> {\n"
                + handle
                + "}\n");
        return new PayloadAccessChecker(context.source(), new TypeShapeResolver(context)).check(context);
    }

    @Test
    void check_shouldRejectUnknownPropertyOnBuiltinEvent() {
        List<Diagnostic> errors = check("  async handle(payload: WebhookEvent) {\n"
                + "    const greeting = payload.customGreeting;\n"
                + "    return { greeting };\n"
                + "  }\n");

        assertEquals(1, errors.size());
        assertEquals("Property 'customGreeting' does not exist on type 'WebhookEvent'.", errors.get(0).message());
        assertEquals(10, errors.get(0).line());
    }

    @Test
    void check_shouldAcceptInheritedAndOwnProperties() {
        List<Diagnostic> errors = check("  async handle(payload: OrderPayload) {\n"
                + "    const a = payload.orderId;\n"
                + "    const b = payload?.executionId;\n"
                + "    const c = payload['timestamp'];\n"
                + "    const d = payload.customer!.name;\n"
                + "    const e = payload.body;\n"
                + "    return { a, b, c, d, e };\n"
                + "  }\n");

        assertTrue(errors.isEmpty(), errors::toString);
    }

    @Test
    void check_shouldRejectUnknownNestedProperty() {
        List<Diagnostic> errors = check("  async handle(payload: OrderPayload) {\n"
                + "    const phone = payload.customer.phone;\n"
                + "    return { phone };\n"
                + "  }\n");

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().startsWith("Property 'phone' does not exist on type "));
    }

    @Test
    void check_shouldCheckDestructuring() {
        List<Diagnostic> inBody = check("  async handle(payload: OrderPayload) {\n"
                + "    const { orderId, coupon = 'none' } = payload;\n"
                + "    return { orderId, coupon };\n"
                + "  }\n");
        List<Diagnostic> inParameter = check("  async handle({ orderId, customer: { nickname } }: OrderPayload) {\n"
                + "    return { orderId, nickname };\n"
                + "  }\n");

        assertEquals(List.of("Property 'coupon' does not exist on type 'OrderPayload'."),
                inBody.stream().map(Diagnostic::message).toList());
        assertEquals(1, inParameter.size());
        assertTrue(inParameter.get(0).message().startsWith("Property 'nickname' does not exist on type "));
    }

    @Test
    void check_shouldIgnoreOpenTypes() {
        List<Diagnostic> anyPayload = check("  async handle(payload: any) {\n"
                + "    return payload.whatever;\n"
                + "  }\n");
        List<Diagnostic> untyped = check("  async handle(payload) {\n"
                + "    return payload.whatever;\n"
                + "  }\n");
        List<Diagnostic> indexed = check("  async handle(payload: { [key: string]: unknown }) {\n"
                + "    return payload.whatever;\n"
                + "  }\n");

        assertTrue(anyPayload.isEmpty());
        assertTrue(untyped.isEmpty());
        assertTrue(indexed.isEmpty());
    }

    @Test
    void check_shouldFollowCastTargetType() {
        List<Diagnostic> toAny = check("  async handle(payload: OrderPayload) {\n"
                + "    return (payload as any).extra;\n"
                + "  }\n");
        List<Diagnostic> toRecord = check("  async handle(payload: OrderPayload) {\n"
                + "    return (payload as Record<string, unknown>)['extra'];\n"
                + "  }\n");
        List<Diagnostic> toDeclared = check("  async handle(payload: WebhookEvent) {\n"
                + "    return (payload as OrderPayload).coupon;\n"
                + "  }\n");

        assertTrue(toAny.isEmpty(), toAny::toString);
        assertTrue(toRecord.isEmpty(), toRecord::toString);
        assertEquals(List.of("Property 'coupon' does not exist on type 'OrderPayload'."),
                toDeclared.stream().map(Diagnostic::message).toList());
    }

    @Test
    void check_shouldSkipShadowingBindings() {
        List<Diagnostic> arrowParameter = check("  async handle(payload: OrderPayload) {\n"
                + "    const others = [{ other: 1 }].map((payload) => payload.other);\n"
                + "    return { others, id: payload.orderId };\n"
                + "  }\n");
        List<Diagnostic> blockLocal = check("  async handle(payload: OrderPayload) {\n"
                + "    {\n"
                + "      const payload = { zzz: 1 };\n"
                + "      console.log(payload.zzz);\n"
                + "    }\n"
                + "    return payload.missing;\n"
                + "  }\n");

        assertTrue(arrowParameter.isEmpty(), arrowParameter::toString);
        assertEquals(List.of("Property 'missing' does not exist on type 'OrderPayload'."),
                blockLocal.stream().map(Diagnostic::message).toList());
    }
}
