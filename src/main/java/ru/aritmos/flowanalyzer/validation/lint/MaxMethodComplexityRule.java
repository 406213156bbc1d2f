package ru.aritmos.flowanalyzer.validation.lint;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Ограничение цикломатической сложности методов класса flow.
 * <p>
 * Сложность = 1 + число ветвлений: {@code if}, тернарный оператор, циклы, {@code catch},
 * непустые {@code case}, логические {@code && || ??} и их составные присваивания.
 */
public final class MaxMethodComplexityRule implements LintRule {

    public static final String NAME = "max-method-complexity";

    private static final Set<String> LOGICAL = Set.of("&&", "||", "??", "&&=", "||=", "??=");

    private final int maxComplexity;

    public MaxMethodComplexityRule(int maxComplexity) {
        this.maxComplexity = maxComplexity;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        Ast.ClassDeclaration cls = context.flowClass();
        if (cls == null) {
            return out;
        }
        for (Ast.ClassMember member : cls.members()) {
            String name = null;
            Ast.Node body = null;
            if (member instanceof Ast.MethodDeclaration m && m.body() != null) {
                name = m.name();
                body = m.body();
            } else if (member instanceof Ast.PropertyDeclaration p
                    && p.initializer() != null
                    && (Ast.unwrap(p.initializer()) instanceof Ast.ArrowFunction
                    || Ast.unwrap(p.initializer()) instanceof Ast.FunctionExpression)) {
                name = p.name();
                body = p.initializer();
            }
            if (body == null) {
                continue;
            }
            int complexity = complexity(body);
            if (complexity > maxComplexity) {
                out.add(diagnostic(context, member, String.format(
                        "Method '%s' has a cyclomatic complexity of %d. Maximum allowed is %d. Split it into smaller steps.",
                        name == null ? "<computed>" : name, complexity, maxComplexity)));
            }
        }
        return out;
    }

    static int complexity(Ast.Node body) {
        int[] count = {1};
        AstWalker.walk(body, (node, ancestors) -> {
            if (node instanceof Ast.IfStatement
                    || node instanceof Ast.ConditionalExpression
                    || node instanceof Ast.ForStatement
                    || node instanceof Ast.ForInStatement
                    || node instanceof Ast.ForOfStatement
                    || node instanceof Ast.WhileStatement
                    || node instanceof Ast.DoWhileStatement
                    || node instanceof Ast.CatchClause) {
                count[0]++;
            } else if (node instanceof Ast.SwitchCase c && c.test() != null) {
                count[0]++;
            } else if (node instanceof Ast.BinaryExpression b && LOGICAL.contains(b.operator())) {
                count[0]++;
            } else if (node instanceof Ast.AssignmentExpression a && LOGICAL.contains(a.operator())) {
                count[0]++;
            }
            return true;
        });
        return count[0];
    }
}
