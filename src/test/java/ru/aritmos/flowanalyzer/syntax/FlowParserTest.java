package ru.aritmos.flowanalyzer.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowParserTest {

    private static final String FLOW = """
            import { BubbleFlow, SlackBubble, type WebhookEvent } from '@bubblelab/bubble-core';

            export interface GreetingPayload extends WebhookEvent {
              /** Имя для приветствия */
              name: string;
              channel?: string;
            }

            export class GreetingFlow extends BubbleFlow<'webhook/http'> {
              async handle(payload: GreetingPayload): Promise<{ ok: boolean }> {
                const result = await new SlackBubble({
                  operation: 'send_message',
                  channel: payload.channel ?? 'general',
                  text: `Hello, ${payload.name}!`,
                }).action();
                return { ok: result?.success === true };
              }
            }
            """;

    @Test
    void parse_shouldBuildImportsClassAndInterface() {
        FlowSource source = FlowParser.parse(FLOW);

        Ast.ImportDeclaration imports = AstWalker.collect(source.program(), Ast.ImportDeclaration.class).get(0);
        assertEquals("@bubblelab/bubble-core", imports.moduleName());
        assertEquals(3, imports.specifiers().size());
        assertTrue(imports.specifiers().get(2).typeOnly());
        assertFalse(imports.specifiers().get(0).typeOnly());

        Ast.InterfaceDeclaration payload = AstWalker.collect(source.program(), Ast.InterfaceDeclaration.class).get(0);
        assertEquals("GreetingPayload", payload.name());
        assertEquals(2, payload.members().size());
        Ast.PropertySignature name = (Ast.PropertySignature) payload.members().get(0);
        assertEquals("Имя для приветствия", name.doc());
        assertTrue(((Ast.PropertySignature) payload.members().get(1)).optional());

        Ast.ClassDeclaration flow = AstWalker.collect(source.program(), Ast.ClassDeclaration.class).get(0);
        assertEquals("GreetingFlow", flow.name());
        assertTrue(flow.exported());
        assertEquals("BubbleFlow", ((Ast.Identifier) flow.superClass()).name());
        Ast.LiteralType trigger = (Ast.LiteralType) flow.superTypeArguments().get(0);
        assertEquals("webhook/http", trigger.value());
    }

    @Test
    void parse_shouldBuildEntryMethodWithAwaitedInstantiation() {
        FlowSource source = FlowParser.parse(FLOW);

        Ast.MethodDeclaration handle = AstWalker.collect(source.program(), Ast.MethodDeclaration.class).get(0);
        assertEquals("handle", handle.name());
        assertEquals("method", handle.kind());
        assertTrue(handle.async());
        assertEquals("payload", handle.parameters().get(0).name());
        assertTrue(handle.parameters().get(0).required());

        List<Ast.NewExpression> instantiations = AstWalker.collect(handle, Ast.NewExpression.class);
        assertEquals(1, instantiations.size());
        Ast.NewExpression slack = instantiations.get(0);
        assertEquals("SlackBubble", ((Ast.Identifier) slack.callee()).name());
        Ast.ObjectLiteral params = (Ast.ObjectLiteral) slack.arguments().get(0);
        assertEquals(3, params.properties().size());
        Ast.PropertyAssignment text = (Ast.PropertyAssignment) params.properties().get(2);
        Ast.TemplateLiteral template = (Ast.TemplateLiteral) text.value();
        assertEquals(List.of("Hello, ", "!"), template.quasis());
        assertEquals(1, AstWalker.collect(handle, Ast.AwaitExpression.class).size());
    }

    @Test
    void parse_shouldTrackLinesAndColumns() {
        FlowSource source = FlowParser.parse(FLOW);

        Ast.NewExpression slack = AstWalker.collect(source.program(), Ast.NewExpression.class).get(0);
        assertEquals(11, source.line(slack));
        assertEquals(26, source.column(slack));
        assertTrue(source.textOf(slack).startsWith("new SlackBubble({"));
    }

    @Test
    void parse_shouldRecordBracelessBodyAnchors() {
        String code = "if (ready) run();\nelse wait();\nfor (const x of items) use(x);";
        FlowSource source = FlowParser.parse(code);

        Ast.IfStatement ifs = (Ast.IfStatement) source.program().body().get(0);
        assertEquals(code.indexOf(')') + 1, ifs.consequentAnchor());
        assertEquals(code.indexOf("else") + 4, ifs.alternateAnchor());
        assertInstanceOf(Ast.ExpressionStatement.class, ifs.consequent());

        Ast.ForOfStatement loop = (Ast.ForOfStatement) source.program().body().get(1);
        assertEquals(code.indexOf("items)") + "items)".length(), loop.bodyAnchor());
    }

    @Test
    void parse_shouldHandleNestedGenericsAndArrowFunctions() {
        String code = """
                const grouped: Map<string, Array<Record<string, number>>> = new Map();
                const sum = (values: number[]) => values.reduce((a, b) => a + b, 0);
                const shifted = total >> 2;
                """;

        FlowSource source = FlowParser.parse(code);

        assertEquals(3, source.program().body().size());
        assertEquals(2, AstWalker.collect(source.program(), Ast.ArrowFunction.class).size());
        Ast.BinaryExpression shift = AstWalker.collect(source.program(), Ast.BinaryExpression.class).stream()
                .filter(b -> b.operator().equals(">>"))
                .findFirst()
                .orElseThrow();
        assertEquals("total >> 2", source.textOf(shift));
    }

    @Test
    void parse_shouldApplyAutomaticSemicolonInsertion() {
        FlowSource source = FlowParser.parse("const a = 1\nconst b = a + 1\nreturnValue(b)");

        assertEquals(3, source.program().body().size());
    }

    @Test
    void parse_shouldReportSyntaxErrorWithLineAndColumn() {
        FlowSyntaxException e = assertThrows(FlowSyntaxException.class,
                () -> FlowParser.parse("const ok = 1;\nconst broken = ;"));

        assertEquals(2, e.getLine());
        assertEquals(16, e.getColumn());
        assertTrue(e.getMessage().startsWith("Line 2, Column 16: "));
    }

    @Test
    void parse_shouldRejectUnclosedClassBody() {
        assertThrows(FlowSyntaxException.class,
                () -> FlowParser.parse("class Broken extends BubbleFlow<'webhook/http'> {\n  async handle() {}\n"));
    }
}
