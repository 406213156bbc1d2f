package ru.aritmos.flowanalyzer.extraction;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.catalog.CatalogModels.PrimitiveDefinition;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.syntax.FlowSource;
import ru.aritmos.flowanalyzer.types.ParameterContractChecker;
import ru.aritmos.flowanalyzer.validation.FlowContext;
import ru.aritmos.flowanalyzer.validation.FlowContext.PrimitiveInstantiation;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Извлечение параметров инстанцирований примитивов из провалидированного кода flow.
 * <p>
 * {@code variableId} назначается по порядку прямого обхода дерева, поэтому для текстуально одинакового
 * кода идентификаторы совпадают между запусками.
 */
@Singleton
public class ParameterExtractor {

    private static final Logger log = LoggerFactory.getLogger(ParameterExtractor.class);

    private final FlowAnalyzerProperties properties;

    public ParameterExtractor(FlowAnalyzerProperties properties) {
        this.properties = properties;
    }

    public Map<Integer, BubbleParameterRecord> extract(FlowContext context) {
        Map<Ast.NewExpression, PrimitiveInstantiation> registered = new IdentityHashMap<>();
        for (PrimitiveInstantiation inst : context.registeredInstantiations()) {
            registered.put(inst.expression(), inst);
        }
        Map<Integer, BubbleParameterRecord> out = new LinkedHashMap<>();
        FlowSource source = context.source();
        AstWalker.walk(source.program(), (node, ancestors) -> {
            if (node instanceof Ast.NewExpression expr && registered.containsKey(expr)) {
                int variableId = out.size() + 1;
                out.put(variableId, toRecord(variableId, registered.get(expr), ancestors.iterator(), source));
            }
            return true;
        });
        log.debug("Извлечено записей параметров: {}", out.size());
        return out;
    }

    private BubbleParameterRecord toRecord(int variableId,
                                           PrimitiveInstantiation inst,
                                           Iterator<Ast.Node> ancestors,
                                           FlowSource source) {
        Ast.Node current = inst.expression();
        boolean hasAwait = false;
        boolean hasActionCall = false;
        String variableName = null;
        while (ancestors.hasNext()) {
            Ast.Node parent = ancestors.next();
            if (parent instanceof Ast.ParenthesizedExpression
                    || parent instanceof Ast.AsExpression
                    || parent instanceof Ast.NonNullExpression) {
                current = parent;
                continue;
            }
            if (parent instanceof Ast.AwaitExpression) {
                hasAwait = true;
                current = parent;
                continue;
            }
            if (!hasActionCall && parent instanceof Ast.MemberExpression m && m.object() == current
                    && "action".equals(m.property())) {
                hasActionCall = true;
                current = parent;
                continue;
            }
            if (parent instanceof Ast.CallExpression call && call.callee() == current && hasActionCall) {
                current = parent;
                continue;
            }
            if (parent instanceof Ast.VariableDeclarator d && d.initializer() == current
                    && d.target() instanceof Ast.Identifier id) {
                variableName = id.name();
            } else if (parent instanceof Ast.AssignmentExpression a && a.value() == current
                    && Ast.unwrap(a.target()) instanceof Ast.Identifier id) {
                variableName = id.name();
            }
            break;
        }
        if (variableName == null) {
            variableName = "_anonymous_" + inst.className() + "_" + (variableId - 1);
        }
        PrimitiveDefinition definition = inst.definition();
        return new BubbleParameterRecord(
                variableId,
                variableName,
                definition.name(),
                definition.className(),
                definition.nodeType(),
                operationOf(inst),
                parameters(inst, source),
                hasAwait,
                hasActionCall,
                SourceLocation.of(source, inst.expression()));
    }

    private static String operationOf(PrimitiveInstantiation inst) {
        if (!inst.definition().contract().isTaggedUnion()
                || !(inst.firstArgument() instanceof Ast.ObjectLiteral params)) {
            return null;
        }
        Ast.Node property = ParameterContractChecker.suppliedProperties(params)
                .get(inst.definition().contract().discriminator());
        return ParameterContractChecker.stringLiteral(ParameterContractChecker.valueOf(property));
    }

    private List<ExtractedParameter> parameters(PrimitiveInstantiation inst, FlowSource source) {
        List<ExtractedParameter> out = new ArrayList<>();
        List<Ast.Expression> args = inst.expression().arguments();
        if (args.isEmpty()) {
            return out;
        }
        Ast.Expression first = args.get(0);
        if (Ast.unwrap(first) instanceof Ast.ObjectLiteral params) {
            for (Ast.Node p : params.properties()) {
                if (p instanceof Ast.PropertyAssignment pa && pa.key() != null) {
                    out.add(describe(pa.key(), pa.value(), source));
                } else if (p instanceof Ast.ShorthandProperty sp) {
                    out.add(describe(sp.name().name(), sp.name(), source));
                }
            }
        } else {
            String name = Ast.unwrap(first) instanceof Ast.Identifier id ? id.name() : "arg0";
            out.add(describe(name, first, source));
        }
        return out;
    }

    /**
     * Классификация значения параметра.
     */
    ExtractedParameter describe(String name, Ast.Expression raw, FlowSource source) {
        String text = source.textOf(raw);
        SourceLocation location = SourceLocation.of(source, raw);
        Ast.Expression value = Ast.unwrap(raw);

        if (value instanceof Ast.Literal lit) {
            return switch (lit.kind()) {
                case STRING -> textParameter(name, (String) lit.value(), text, location);
                case NUMBER -> new ExtractedParameter(name, ParameterKind.NUMBER, number((Double) lit.value()), text,
                        SemanticType.NUMBER, true, location);
                case BOOLEAN -> new ExtractedParameter(name, ParameterKind.BOOLEAN, lit.value(), text,
                        SemanticType.BOOLEAN, true, location);
                case NULL -> new ExtractedParameter(name, ParameterKind.UNKNOWN, null, text,
                        SemanticType.REFERENCE, false, location);
                default -> new ExtractedParameter(name, ParameterKind.EXPRESSION, text, text,
                        SemanticType.REFERENCE, false, location);
            };
        }
        if (value instanceof Ast.UnaryExpression u && ("-".equals(u.operator()) || "+".equals(u.operator()))
                && Ast.unwrap(u.argument()) instanceof Ast.Literal lit && lit.value() instanceof Double d) {
            return new ExtractedParameter(name, ParameterKind.NUMBER, number("-".equals(u.operator()) ? -d : d), text,
                    SemanticType.NUMBER, true, location);
        }
        if (value instanceof Ast.TemplateLiteral tpl) {
            if (tpl.expressions().isEmpty()) {
                return textParameter(name, tpl.quasis().get(0), text, location);
            }
            return new ExtractedParameter(name, ParameterKind.EXPRESSION, text, text, textType(text), false, location);
        }
        if (value instanceof Ast.ObjectLiteral) {
            return new ExtractedParameter(name, ParameterKind.OBJECT, text, text, SemanticType.STRUCTURED,
                    isPureLiteral(value), location);
        }
        if (value instanceof Ast.ArrayLiteral) {
            return new ExtractedParameter(name, ParameterKind.ARRAY, text, text, SemanticType.STRUCTURED,
                    isPureLiteral(value), location);
        }
        if (value instanceof Ast.Identifier) {
            return new ExtractedParameter(name, ParameterKind.VARIABLE, text, text, SemanticType.REFERENCE, false,
                    location);
        }
        if (value instanceof Ast.MemberExpression || value instanceof Ast.ElementAccess) {
            ParameterKind kind = isEnvReference(value) ? ParameterKind.ENV : ParameterKind.VARIABLE;
            return new ExtractedParameter(name, kind, text, text, SemanticType.REFERENCE, false, location);
        }
        return new ExtractedParameter(name, ParameterKind.EXPRESSION, text, text, SemanticType.REFERENCE, false,
                location);
    }

    private ExtractedParameter textParameter(String name, String decoded, String text, SourceLocation location) {
        return new ExtractedParameter(name, ParameterKind.STRING, decoded, text, textType(decoded), true, location);
    }

    private SemanticType textType(String value) {
        boolean longText = value.indexOf('\n') >= 0 || value.length() > properties.getExtraction().getLongTextThreshold();
        return longText ? SemanticType.LONG_TEXT : SemanticType.SHORT_TEXT;
    }

    private static Number number(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.007199254740992E15) {
            return (long) d;
        }
        return d;
    }

    private static boolean isEnvReference(Ast.Expression value) {
        Ast.Expression object = value instanceof Ast.MemberExpression m ? m.object() : ((Ast.ElementAccess) value).object();
        Ast.Expression e = Ast.unwrap(object);
        return e instanceof Ast.MemberExpression env
                && "env".equals(env.property())
                && Ast.unwrap(env.object()) instanceof Ast.Identifier id
                && "process".equals(id.name());
    }

    /**
     * Значение состоит только из литералов (без ссылок, вызовов, spread и вычисляемых ключей).
     */
    static boolean isPureLiteral(Ast.Expression expression) {
        Ast.Expression e = Ast.unwrap(expression);
        if (e instanceof Ast.Literal lit) {
            return lit.kind() != Ast.LiteralKind.REGEX;
        }
        if (e instanceof Ast.TemplateLiteral tpl) {
            return tpl.expressions().isEmpty();
        }
        if (e instanceof Ast.UnaryExpression u) {
            return ("-".equals(u.operator()) || "+".equals(u.operator()))
                    && Ast.unwrap(u.argument()) instanceof Ast.Literal lit && lit.kind() == Ast.LiteralKind.NUMBER;
        }
        if (e instanceof Ast.ArrayLiteral arr) {
            return arr.elements().stream().allMatch(el -> !(el instanceof Ast.OmittedExpression) && isPureLiteral(el));
        }
        if (e instanceof Ast.ObjectLiteral obj) {
            for (Ast.Node p : obj.properties()) {
                if (!(p instanceof Ast.PropertyAssignment pa) || pa.key() == null || !isPureLiteral(pa.value())) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
