package ru.aritmos.flowanalyzer.types;

import ru.aritmos.flowanalyzer.catalog.CatalogModels.FieldSpec;
import ru.aritmos.flowanalyzer.catalog.CatalogModels.ParameterContract;
import ru.aritmos.flowanalyzer.catalog.CatalogModels.PrimitiveDefinition;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.FlowSource;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;
import ru.aritmos.flowanalyzer.validation.FlowContext.PrimitiveInstantiation;
import ru.aritmos.flowanalyzer.validation.FlowDiagnostic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Проверка параметров инстанцирования примитива по контракту из каталога.
 * <p>
 * Для tagged union сначала разрешается литерал дискриминатора, затем проверяется набор полей только
 * выбранного варианта. Проверяются только объектные литералы: значение-переменную статически
 * сопоставить с контрактом нельзя.
 */
public final class ParameterContractChecker {

    /** Неявное поле, которое знает любой примитив. */
    public static final String CREDENTIALS_FIELD = "credentials";

    private final FlowSource source;

    public ParameterContractChecker(FlowSource source) {
        this.source = source;
    }

    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        for (PrimitiveInstantiation inst : context.registeredInstantiations()) {
            check(inst, out);
        }
        return out;
    }

    void check(PrimitiveInstantiation inst, List<Diagnostic> out) {
        PrimitiveDefinition definition = inst.definition();
        ParameterContract contract = definition.contract();
        Ast.Expression arg = inst.firstArgument();
        Ast.ObjectLiteral params;
        if (arg == null) {
            params = new Ast.ObjectLiteral(inst.expression().span(), List.of());
        } else if (arg instanceof Ast.ObjectLiteral literal) {
            params = literal;
        } else {
            return;
        }
        Map<String, Ast.Node> supplied = suppliedProperties(params);
        boolean hasSpread = params.properties().stream().anyMatch(p -> p instanceof Ast.SpreadElement);
        String typeName = inst.className() + "Params";

        Map<String, FieldSpec> fields;
        String discriminator = null;
        if (contract.isTaggedUnion()) {
            discriminator = contract.discriminator();
            String expected = String.join(", ", contract.variantNames());
            Ast.Node discriminant = supplied.get(discriminator);
            if (discriminant == null) {
                if (!hasSpread) {
                    out.add(FlowDiagnostic.MISSING_DISCRIMINATOR.at(source, inst.expression(),
                            discriminator, inst.className(), expected));
                }
                return;
            }
            String operation = stringLiteral(valueOf(discriminant));
            if (operation == null) {
                out.add(FlowDiagnostic.NON_LITERAL_DISCRIMINATOR.at(source, discriminant,
                        discriminator, inst.className()));
                return;
            }
            if (!contract.variants().containsKey(operation)) {
                out.add(FlowDiagnostic.UNKNOWN_DISCRIMINATOR.at(source, discriminant,
                        discriminator, operation, inst.className(), expected));
                return;
            }
            fields = contract.fieldsFor(operation);
            typeName = inst.className() + "Params<'" + operation + "'>";
        } else {
            fields = contract.fields();
        }

        checkObject(params, supplied, hasSpread, fields, discriminator, typeName, "", inst.className(), out);
    }

    private void checkObject(Ast.ObjectLiteral literal,
                             Map<String, Ast.Node> supplied,
                             boolean hasSpread,
                             Map<String, FieldSpec> fields,
                             String discriminator,
                             String typeName,
                             String pathPrefix,
                             String className,
                             List<Diagnostic> out) {
        boolean topLevel = pathPrefix.isEmpty();
        for (Map.Entry<String, Ast.Node> e : supplied.entrySet()) {
            String name = e.getKey();
            if (name.equals(discriminator) || (topLevel && CREDENTIALS_FIELD.equals(name))) {
                continue;
            }
            FieldSpec spec = fields.get(name);
            if (spec == null) {
                out.add(FlowDiagnostic.UNKNOWN_PARAMETER.at(source, e.getValue(), name, typeName));
                continue;
            }
            Ast.Expression value = valueOf(e.getValue());
            if (value != null) {
                checkValue(spec, value, pathPrefix + name, className, out);
            }
        }
        if (hasSpread) {
            return;
        }
        for (Map.Entry<String, FieldSpec> f : fields.entrySet()) {
            if (f.getValue().required() && !supplied.containsKey(f.getKey())) {
                out.add(FlowDiagnostic.MISSING_PARAMETER.at(source, literal,
                        f.getKey(), String.join("; ", supplied.keySet()), typeName));
            }
        }
    }

    private void checkValue(FieldSpec spec, Ast.Expression raw, String path, String className, List<Diagnostic> out) {
        Ast.Expression value = Ast.unwrap(raw);
        String type = spec.type();
        if ("any".equals(type)) {
            return;
        }
        String actual = literalTypeOf(value);
        if (actual == null) {
            return;
        }
        boolean ok = switch (type) {
            case "string" -> "string".equals(actual);
            case "number" -> "number".equals(actual);
            case "boolean" -> "boolean".equals(actual);
            case "enum" -> "string".equals(actual) && enumAccepts(spec, value);
            case "object" -> "object".equals(actual);
            case "array" -> "array".equals(actual);
            default -> true;
        };
        if (!ok) {
            out.add(FlowDiagnostic.PARAMETER_TYPE_MISMATCH.at(source, value,
                    describe(value, actual), spec.displayType(), path, className));
            return;
        }
        if (value instanceof Ast.ObjectLiteral nested && !spec.properties().isEmpty()) {
            Map<String, Ast.Node> supplied = suppliedProperties(nested);
            boolean spread = nested.properties().stream().anyMatch(p -> p instanceof Ast.SpreadElement);
            checkObject(nested, supplied, spread, spec.properties(), null, path, path + ".", className, out);
        } else if (value instanceof Ast.ArrayLiteral array && spec.items() != null) {
            List<Ast.Expression> elements = array.elements();
            for (int i = 0; i < elements.size(); i++) {
                Ast.Expression element = elements.get(i);
                if (!(element instanceof Ast.SpreadElement) && !(element instanceof Ast.OmittedExpression)) {
                    checkValue(spec.items(), element, path + "[" + i + "]", className, out);
                }
            }
        }
    }

    private static boolean enumAccepts(FieldSpec spec, Ast.Expression value) {
        String literal = stringLiteral(value);
        return literal == null || spec.values().isEmpty() || spec.values().contains(literal);
    }

    private String describe(Ast.Expression value, String actual) {
        if (value instanceof Ast.Literal lit && lit.kind() != Ast.LiteralKind.NULL) {
            return lit.kind() == Ast.LiteralKind.STRING ? "\"" + lit.value() + "\"" : lit.raw();
        }
        return actual;
    }

    /**
     * Тип значения, если он определяется синтаксически, иначе {@code null}.
     */
    static String literalTypeOf(Ast.Expression value) {
        if (value instanceof Ast.Literal lit) {
            return switch (lit.kind()) {
                case STRING -> "string";
                case NUMBER, BIGINT -> "number";
                case BOOLEAN -> "boolean";
                default -> null;
            };
        }
        if (value instanceof Ast.TemplateLiteral) {
            return "string";
        }
        if (value instanceof Ast.ObjectLiteral) {
            return "object";
        }
        if (value instanceof Ast.ArrayLiteral) {
            return "array";
        }
        if (value instanceof Ast.UnaryExpression u && ("-".equals(u.operator()) || "+".equals(u.operator()))
                && Ast.unwrap(u.argument()) instanceof Ast.Literal lit && lit.kind() == Ast.LiteralKind.NUMBER) {
            return "number";
        }
        return null;
    }

    /**
     * Значение строкового литерала (в т.ч. шаблона без подстановок) или {@code null}.
     */
    public static String stringLiteral(Ast.Expression expression) {
        if (expression == null) {
            return null;
        }
        Ast.Expression e = Ast.unwrap(expression);
        if (e instanceof Ast.Literal lit && lit.kind() == Ast.LiteralKind.STRING) {
            return (String) lit.value();
        }
        if (e instanceof Ast.TemplateLiteral tpl && tpl.expressions().isEmpty()) {
            return tpl.quasis().get(0);
        }
        return null;
    }

    /**
     * Свойства объектного литерала с именованными ключами в порядке объявления.
     */
    public static Map<String, Ast.Node> suppliedProperties(Ast.ObjectLiteral literal) {
        Map<String, Ast.Node> out = new LinkedHashMap<>();
        for (Ast.Node p : literal.properties()) {
            if (p instanceof Ast.PropertyAssignment pa && pa.key() != null) {
                out.put(pa.key(), pa);
            } else if (p instanceof Ast.ShorthandProperty sp) {
                out.put(sp.name().name(), sp);
            } else if (p instanceof Ast.MethodDeclaration m && m.name() != null) {
                out.put(m.name(), m);
            }
        }
        return out;
    }

    /**
     * Выражение-значение свойства ({@code null} для методов).
     */
    public static Ast.Expression valueOf(Ast.Node property) {
        if (property instanceof Ast.PropertyAssignment pa) {
            return pa.value();
        }
        if (property instanceof Ast.ShorthandProperty sp) {
            return sp.name();
        }
        return null;
    }
}
