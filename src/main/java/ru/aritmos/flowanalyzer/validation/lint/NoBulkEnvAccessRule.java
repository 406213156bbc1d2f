package ru.aritmos.flowanalyzer.validation.lint;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Запрещает массовый доступ к {@code process.env}: разрешено только чтение одной именованной переменной
 * ({@code process.env.API_KEY}, {@code process.env['API_KEY']}) или деструктуризация отдельных имён.
 */
public final class NoBulkEnvAccessRule implements LintRule {

    public static final String NAME = "no-bulk-env-access";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        AstWalker.walk(context.source().program(), (node, ancestors) -> {
            if (isProcessEnv(node) && !isSingleRead(node, ancestors.peek())) {
                out.add(diagnostic(context, node,
                        "Bulk access to process.env is not allowed. Read a single variable instead, e.g. process.env.API_KEY."));
                return false;
            }
            return true;
        });
        return out;
    }

    static boolean isProcessEnv(Ast.Node node) {
        return node instanceof Ast.MemberExpression m
                && "env".equals(m.property())
                && Ast.unwrap(m.object()) instanceof Ast.Identifier id
                && "process".equals(id.name());
    }

    private static boolean isSingleRead(Ast.Node env, Ast.Node parent) {
        if (parent instanceof Ast.MemberExpression m) {
            return m.object() == env;
        }
        if (parent instanceof Ast.ElementAccess e) {
            return e.object() == env;
        }
        if (parent instanceof Ast.VariableDeclarator d && d.initializer() == env
                && d.target() instanceof Ast.ObjectPattern pattern) {
            return pattern.properties().stream().noneMatch(p -> p instanceof Ast.RestElement);
        }
        return false;
    }
}
