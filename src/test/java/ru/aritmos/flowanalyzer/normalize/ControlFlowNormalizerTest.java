package ru.aritmos.flowanalyzer.normalize;

import org.junit.jupiter.api.Test;
import ru.aritmos.flowanalyzer.FlowFixtures;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.syntax.FlowSource;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowNormalizerTest {

    private final ControlFlowNormalizer normalizer = new ControlFlowNormalizer();

    @Test
    void normalize_shouldWrapBracelessIfBody() {
        assertEquals("if (x) {\n  doY();\n}", normalizer.normalize("if (x) doY();"));
    }

    @Test
    void normalize_shouldWrapIfAndElseBranches() {
        String result = normalizer.normalize("if (a) b();\nelse c();");

        assertEquals("if (a) {\n  b();\n}\nelse {\n  c();\n}", result);
    }

    @Test
    void normalize_shouldKeepElseIfChainFlat() {
        String result = normalizer.normalize("if (a) one();\nelse if (b) two();\nelse three();");

        assertEquals("if (a) {\n  one();\n}\nelse if (b) {\n  two();\n}\nelse {\n  three();\n}", result);
    }

    @Test
    void normalize_shouldWrapNestedBodiesWithIndentation() {
        String result = normalizer.normalize("for (const x of xs) if (x) f(x);");

        assertEquals("for (const x of xs) {\n  if (x) {\n    f(x);\n  }\n}", result);
    }

    @Test
    void normalize_shouldWrapLoopsInsideIndentedMethod() {
        String code = "class A {\n"
                + "  run() {\n"
                + "    while (busy()) tick();\n"
                + "    do step(); while (more());\n"
                + "  }\n"
                + "}";

        String result = normalizer.normalize(code);

        assertTrue(result.contains("    while (busy()) {\n      tick();\n    }\n"), result);
        assertTrue(result.contains("    do {\n      step();\n    } while (more());"), result);
    }

    @Test
    void normalize_shouldLeaveBlocksAndEmptyBodiesAlone() {
        String code = "if (a) {\n  b();\n}\nfor (;;);\nwhile (x) {}";

        assertSame(code, normalizer.normalize(code));
    }

    @Test
    void normalize_shouldReturnUnparsableCodeUnchanged() {
        String broken = "if (x) doY(;";

        assertSame(broken, normalizer.normalize(broken));
        assertNull(normalizer.normalize(null));
        assertEquals("", normalizer.normalize(""));
    }

    @Test
    void normalize_shouldBeIdempotent() {
        String once = normalizer.normalize(FlowFixtures.flow("braceless-control-flow.ts"));

        assertEquals(once, normalizer.normalize(once));
    }

    @Test
    void normalize_shouldProduceParsableCodeWithBlockBodies() {
        String result = normalizer.normalize(FlowFixtures.flow("braceless-control-flow.ts"));

        FlowSource source = FlowSource.parse(result);
        for (Ast.IfStatement ifs : AstWalker.collect(source.program(), Ast.IfStatement.class)) {
            assertInstanceOf(Ast.Block.class, ifs.consequent());
            assertTrue(ifs.alternate() == null || ifs.alternate() instanceof Ast.Block
                    || ifs.alternate() instanceof Ast.IfStatement);
        }
        for (Ast.ForOfStatement loop : AstWalker.collect(source.program(), Ast.ForOfStatement.class)) {
            assertInstanceOf(Ast.Block.class, loop.body());
        }
        for (Ast.WhileStatement loop : AstWalker.collect(source.program(), Ast.WhileStatement.class)) {
            assertInstanceOf(Ast.Block.class, loop.body());
        }
        assertTrue(FlowFixtures.validator().validate(result, FlowFixtures.catalog()).valid());
    }
}
