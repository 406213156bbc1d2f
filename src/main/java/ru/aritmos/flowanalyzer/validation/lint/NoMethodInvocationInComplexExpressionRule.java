package ru.aritmos.flowanalyzer.validation.lint;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Вызов шага {@code this.step()} внутри тернарного оператора, объектного или массивного литерала,
 * значения свойства или spread нельзя инструментировать: его нужно вынести в отдельную переменную.
 */
public final class NoMethodInvocationInComplexExpressionRule implements LintRule {

    public static final String NAME = "no-method-invocation-in-complex-expression";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        AstWalker.walk(context.source().program(), (node, ancestors) -> {
            String method = Ast.thisMethodCallName(node);
            if (method == null) {
                return true;
            }
            for (Ast.Node parent : ancestors) {
                if (parent instanceof Ast.VariableDeclarator
                        || parent instanceof Ast.ExpressionStatement
                        || parent instanceof Ast.ReturnStatement
                        || parent instanceof Ast.Block) {
                    break;
                }
                String where = describe(parent);
                if (where != null) {
                    out.add(diagnostic(context, node, String.format(
                            "Method invocation 'this.%s()' inside %s cannot be instrumented. "
                                    + "Extract to a separate variable before using in %s.",
                            method, where, where)));
                    break;
                }
            }
            return true;
        });
        return out;
    }

    private static String describe(Ast.Node node) {
        if (node instanceof Ast.ConditionalExpression) {
            return "ternary operator";
        }
        if (node instanceof Ast.PropertyAssignment) {
            return "object property";
        }
        if (node instanceof Ast.ObjectLiteral) {
            return "object literal";
        }
        if (node instanceof Ast.ArrayLiteral) {
            return "array literal";
        }
        if (node instanceof Ast.SpreadElement) {
            return "spread expression";
        }
        return null;
    }
}
