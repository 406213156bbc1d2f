package ru.aritmos.flowanalyzer.validation.lint;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Запрет прямого инстанцирования примитива на верхнем уровне entry-метода
 * (объявление переменной, выражение, braceless-ветка {@code if}). По умолчанию выключено.
 */
public final class NoDirectInstantiationInHandleRule implements LintRule {

    public static final String NAME = "no-direct-instantiation-in-handle";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        Ast.MethodDeclaration entry = context.entryMethod();
        if (entry == null || entry.body() == null) {
            return out;
        }
        for (Ast.Statement statement : entry.body().statements()) {
            Ast.NewExpression found = findInStatement(statement, context);
            if (found != null) {
                out.add(diagnostic(context, found,
                        "Direct bubble instantiation is not allowed in handle method. "
                                + "Move bubble creation into another step."));
            }
        }
        return out;
    }

    private Ast.NewExpression findInStatement(Ast.Statement statement, FlowContext context) {
        if (statement instanceof Ast.VariableStatement vars) {
            for (Ast.VariableDeclarator d : vars.declarations()) {
                Ast.NewExpression found = d.initializer() == null ? null : findInExpression(d.initializer(), context);
                if (found != null) {
                    return found;
                }
            }
        } else if (statement instanceof Ast.ExpressionStatement es) {
            return findInExpression(es.expression(), context);
        } else if (statement instanceof Ast.IfStatement ifs) {
            if (ifs.consequent() instanceof Ast.ExpressionStatement es) {
                Ast.NewExpression found = findInExpression(es.expression(), context);
                if (found != null) {
                    return found;
                }
            }
            if (ifs.alternate() instanceof Ast.ExpressionStatement es) {
                return findInExpression(es.expression(), context);
            }
        }
        return null;
    }

    private Ast.NewExpression findInExpression(Ast.Expression expression, FlowContext context) {
        Ast.Expression e = Ast.unwrap(expression);
        if (e instanceof Ast.AwaitExpression await) {
            return findInExpression(await.argument(), context);
        }
        if (e instanceof Ast.CallExpression call && Ast.unwrap(call.callee()) instanceof Ast.MemberExpression m) {
            return findInExpression(m.object(), context);
        }
        if (e instanceof Ast.NewExpression ne) {
            boolean primitive = context.instantiations().stream().anyMatch(i -> i.expression() == ne);
            return primitive ? ne : null;
        }
        return null;
    }
}
