package ru.aritmos.flowanalyzer.types;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.syntax.FlowSource;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;
import ru.aritmos.flowanalyzer.validation.FlowDiagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка обращений к полям payload в entry-методе по объявленному типу payload.
 * <p>
 * Поддерживаются точечный доступ, доступ по строковому ключу, optional chaining, non-null assertion,
 * вложенный доступ к объектным полям и деструктуризация (в параметре и в объявлении переменной).
 * Открытые формы ошибок не дают.
 */
public final class PayloadAccessChecker {

    private final FlowSource source;
    private final TypeShapeResolver resolver;

    public PayloadAccessChecker(FlowSource source, TypeShapeResolver resolver) {
        this.source = source;
        this.resolver = resolver;
    }

    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        Ast.MethodDeclaration entry = context.entryMethod();
        if (entry == null || entry.parameters().isEmpty()) {
            return out;
        }
        Ast.Parameter payload = entry.parameters().get(0);
        if (payload.type() == null) {
            return out;
        }
        TypeShape root = resolver.resolve(payload.type());
        if (root == null || root.open()) {
            return out;
        }
        if (payload.target() instanceof Ast.ObjectPattern pattern) {
            checkPattern(pattern, root, out);
            return out;
        }
        String payloadName = payload.name();
        if (payloadName == null || entry.body() == null) {
            return out;
        }
        AstWalker.walk(entry.body(), (node, ancestors) -> {
            if (Ast.declares(node, payloadName)) {
                // своя привязка с тем же именем перекрывает параметр
                return false;
            }
            if (node instanceof Ast.MemberExpression member) {
                report(member.object(), member.property(), member, payloadName, root, out);
            } else if (node instanceof Ast.ElementAccess access) {
                String key = ParameterContractChecker.stringLiteral(access.index());
                if (key != null) {
                    report(access.object(), key, access, payloadName, root, out);
                }
            } else if (node instanceof Ast.VariableDeclarator declarator
                    && declarator.target() instanceof Ast.ObjectPattern pattern
                    && declarator.initializer() != null) {
                TypeShape shape = shapeOf(declarator.initializer(), payloadName, root);
                if (shape != null && !shape.open()) {
                    checkPattern(pattern, shape, out);
                }
            }
            return true;
        });
        return out;
    }

    private void report(Ast.Expression object, String property, Ast.Node at, String payloadName, TypeShape root,
                        List<Diagnostic> out) {
        TypeShape shape = shapeOf(object, payloadName, root);
        if (shape != null && !shape.has(property)) {
            out.add(FlowDiagnostic.UNKNOWN_PAYLOAD_PROPERTY.at(source, at, property, shape.displayName()));
        }
    }

    private void checkPattern(Ast.ObjectPattern pattern, TypeShape shape, List<Diagnostic> out) {
        for (Ast.Node p : pattern.properties()) {
            if (!(p instanceof Ast.BindingProperty bp) || bp.key() == null) {
                continue;
            }
            if (!shape.has(bp.key())) {
                out.add(FlowDiagnostic.UNKNOWN_PAYLOAD_PROPERTY.at(source, bp, bp.key(), shape.displayName()));
                continue;
            }
            if (bp.value() instanceof Ast.ObjectPattern nested) {
                TypeShape nestedShape = resolver.resolveMember(shape.member(bp.key()));
                if (nestedShape != null && !nestedShape.open()) {
                    checkPattern(nested, nestedShape, out);
                }
            }
        }
    }

    /**
     * Форма значения выражения, если оно выводится из payload; иначе {@code null}.
     * Приведение {@code as T} заменяет форму на {@code T}; {@code satisfies} тип не меняет.
     */
    private TypeShape shapeOf(Ast.Expression expression, String payloadName, TypeShape root) {
        Ast.Expression e = expression;
        while (true) {
            if (e instanceof Ast.ParenthesizedExpression p) {
                e = p.expression();
            } else if (e instanceof Ast.NonNullExpression n) {
                e = n.expression();
            } else if (e instanceof Ast.AsExpression cast && cast.satisfies()) {
                e = cast.expression();
            } else {
                break;
            }
        }
        if (e instanceof Ast.AsExpression cast) {
            if (shapeOf(cast.expression(), payloadName, root) == null) {
                return null;
            }
            TypeShape target = cast.type() == null ? null : resolver.resolve(cast.type());
            return target == null || target.open() ? null : target;
        }
        if (e instanceof Ast.Identifier id) {
            return payloadName.equals(id.name()) ? root : null;
        }
        String property = null;
        Ast.Expression object = null;
        if (e instanceof Ast.MemberExpression member) {
            property = member.property();
            object = member.object();
        } else if (e instanceof Ast.ElementAccess access) {
            property = ParameterContractChecker.stringLiteral(access.index());
            object = access.object();
        }
        if (property == null) {
            return null;
        }
        TypeShape parent = shapeOf(object, payloadName, root);
        if (parent == null || parent.open()) {
            return null;
        }
        TypeShape nested = resolver.resolveMember(parent.member(property));
        return nested == null || nested.open() ? null : nested;
    }
}
