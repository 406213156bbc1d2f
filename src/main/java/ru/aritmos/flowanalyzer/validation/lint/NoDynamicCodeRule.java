package ru.aritmos.flowanalyzer.validation.lint;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Запрет динамического исполнения кода: {@code eval(...)}, {@code new Function(...)}, {@code Function(...)}.
 */
public final class NoDynamicCodeRule implements LintRule {

    public static final String NAME = "no-dynamic-code";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        AstWalker.walk(context.source().program(), (node, ancestors) -> {
            String callee = null;
            if (node instanceof Ast.CallExpression call) {
                callee = identifierName(call.callee());
            } else if (node instanceof Ast.NewExpression ne) {
                callee = identifierName(ne.callee());
                callee = "Function".equals(callee) ? "new Function" : null;
            }
            if ("eval".equals(callee) || "Function".equals(callee) || "new Function".equals(callee)) {
                out.add(diagnostic(context, node, String.format(
                        "Dynamic code evaluation ('%s') is not allowed in flows.", callee)));
            }
            return true;
        });
        return out;
    }

    private static String identifierName(Ast.Expression expression) {
        return Ast.unwrap(expression) instanceof Ast.Identifier id ? id.name() : null;
    }
}
