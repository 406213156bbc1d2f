package ru.aritmos.flowanalyzer.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.FlowSource;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Построение JSON Schema входного payload flow.
 * <p>
 * В схему попадают собственные свойства объявленного типа payload (поля встроенной базы события
 * исключаются), JSDoc-описания и значения по умолчанию из деструктуризации payload в entry-методе.
 * Если тип payload не объявлен или состоит только из встроенных полей, схемы нет.
 */
public final class InputSchemaBuilder {

    private static final int MAX_DEPTH = 6;

    private final ObjectMapper objectMapper;

    public InputSchemaBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return схема или {@code null}
     */
    public ObjectNode build(FlowContext context, TypeShapeResolver resolver) {
        Ast.MethodDeclaration entry = context.entryMethod();
        if (entry == null || entry.parameters().isEmpty()) {
            return null;
        }
        Ast.Parameter payload = entry.parameters().get(0);
        if (payload.type() == null) {
            return null;
        }
        TypeShape shape = resolver.resolve(payload.type());
        if (shape == null) {
            return null;
        }
        List<TypeShape.Member> own = shape.members().values().stream().filter(m -> !m.builtin()).toList();
        if (own.isEmpty()) {
            return null;
        }

        Map<String, JsonNode> defaults = collectDefaults(entry, payload);
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = objectMapper.createArrayNode();
        for (TypeShape.Member member : own) {
            ObjectNode property = memberSchema(member, resolver, 0);
            JsonNode defaultValue = defaults.get(member.name());
            if (defaultValue != null) {
                property.set("default", defaultValue);
            }
            properties.set(member.name(), property);
            if (!member.optional()) {
                required.add(member.name());
            }
        }
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        return schema;
    }

    private ObjectNode memberSchema(TypeShape.Member member, TypeShapeResolver resolver, int depth) {
        ObjectNode node = member.type() == null
                ? objectMapper.createObjectNode()
                : typeSchema(member.type(), member.origin(), resolver, depth);
        if (member.description() != null && !member.description().isBlank()) {
            node.put("description", member.description());
        }
        return node;
    }

    private ObjectNode typeSchema(Ast.TypeNode type, FlowSource origin, TypeShapeResolver resolver, int depth) {
        ObjectNode node = objectMapper.createObjectNode();
        if (depth > MAX_DEPTH) {
            return node;
        }
        if (type instanceof Ast.KeywordType kw) {
            switch (kw.keyword()) {
                case "string", "number", "boolean", "null", "object" -> node.put("type", kw.keyword());
                default -> {
                    // any, unknown, undefined: без ограничений
                }
            }
            return node;
        }
        if (type instanceof Ast.LiteralType lit) {
            node.set("const", literalNode(lit.value()));
            return node;
        }
        if (type instanceof Ast.ArrayType array) {
            node.put("type", "array");
            node.set("items", typeSchema(array.elementType(), origin, resolver, depth + 1));
            return node;
        }
        if (type instanceof Ast.UnionType union) {
            return unionSchema(union, origin, resolver, depth);
        }
        if (type instanceof Ast.TypeOperator op && "readonly".equals(op.operator())) {
            return typeSchema(op.type(), origin, resolver, depth);
        }
        if (type instanceof Ast.TypeReference ref) {
            switch (ref.name()) {
                case "Array", "ReadonlyArray" -> {
                    node.put("type", "array");
                    node.set("items", ref.typeArguments().isEmpty()
                            ? objectMapper.createObjectNode()
                            : typeSchema(ref.typeArguments().get(0), origin, resolver, depth + 1));
                    return node;
                }
                case "Record" -> {
                    node.put("type", "object");
                    return node;
                }
                case "Date" -> {
                    node.put("type", "string");
                    return node;
                }
                default -> {
                    // интерфейс или псевдоним: ниже, как объект
                }
            }
        }
        TypeShape shape = resolver.resolve(type, origin);
        if (shape == null) {
            return node;
        }
        node.put("type", "object");
        if (shape.members().isEmpty()) {
            return node;
        }
        ObjectNode properties = node.putObject("properties");
        ArrayNode required = objectMapper.createArrayNode();
        for (TypeShape.Member member : shape.members().values()) {
            properties.set(member.name(), memberSchema(member, resolver, depth + 1));
            if (!member.optional()) {
                required.add(member.name());
            }
        }
        if (!required.isEmpty()) {
            node.set("required", required);
        }
        return node;
    }

    private ObjectNode unionSchema(Ast.UnionType union, FlowSource origin, TypeShapeResolver resolver, int depth) {
        List<Ast.TypeNode> parts = new ArrayList<>();
        for (Ast.TypeNode t : union.types()) {
            if (t instanceof Ast.KeywordType kw && "undefined".equals(kw.keyword())) {
                continue;
            }
            parts.add(t);
        }
        if (parts.size() == 1) {
            return typeSchema(parts.get(0), origin, resolver, depth);
        }
        ObjectNode node = objectMapper.createObjectNode();
        if (!parts.isEmpty() && parts.stream().allMatch(t -> t instanceof Ast.LiteralType lit && lit.value() instanceof String)) {
            node.put("type", "string");
            ArrayNode values = node.putArray("enum");
            parts.forEach(t -> values.add((String) ((Ast.LiteralType) t).value()));
            return node;
        }
        ArrayNode anyOf = node.putArray("anyOf");
        for (Ast.TypeNode t : parts) {
            anyOf.add(typeSchema(t, origin, resolver, depth + 1));
        }
        return node;
    }

    private static JsonNode literalNode(Object value) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        if (value instanceof String s) {
            return f.textNode(s);
        }
        if (value instanceof Double d) {
            return numberNode(d);
        }
        if (value instanceof Boolean b) {
            return f.booleanNode(b);
        }
        return f.nullNode();
    }

    private static JsonNode numberNode(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < Long.MAX_VALUE) {
            return JsonNodeFactory.instance.numberNode((long) d);
        }
        return JsonNodeFactory.instance.numberNode(d);
    }

    // ---------------------------------------------------------------- значения по умолчанию

    private Map<String, JsonNode> collectDefaults(Ast.MethodDeclaration entry, Ast.Parameter payload) {
        Map<String, JsonNode> defaults = new LinkedHashMap<>();
        if (payload.target() instanceof Ast.ObjectPattern pattern) {
            collectPatternDefaults(pattern, defaults);
            return defaults;
        }
        String name = payload.name();
        if (name == null || entry.body() == null) {
            return defaults;
        }
        for (Ast.Statement statement : entry.body().statements()) {
            if (!(statement instanceof Ast.VariableStatement vars)) {
                continue;
            }
            for (Ast.VariableDeclarator d : vars.declarations()) {
                if (d.target() instanceof Ast.ObjectPattern pattern
                        && d.initializer() != null
                        && Ast.unwrap(d.initializer()) instanceof Ast.Identifier id
                        && name.equals(id.name())) {
                    collectPatternDefaults(pattern, defaults);
                }
            }
        }
        return defaults;
    }

    private static void collectPatternDefaults(Ast.ObjectPattern pattern, Map<String, JsonNode> into) {
        for (Ast.Node p : pattern.properties()) {
            if (p instanceof Ast.BindingProperty bp && bp.key() != null && bp.defaultValue() != null) {
                JsonNode value = evaluate(bp.defaultValue());
                if (value != null) {
                    into.putIfAbsent(bp.key(), value);
                }
            }
        }
    }

    /**
     * Значение выражения по умолчанию как JSON, если оно вычисляется статически; иначе {@code null}.
     */
    static JsonNode evaluate(Ast.Expression expression) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        Ast.Expression e = Ast.unwrap(expression);
        if (e instanceof Ast.Literal lit) {
            return lit.kind() == Ast.LiteralKind.REGEX || lit.kind() == Ast.LiteralKind.BIGINT
                    ? null
                    : literalNode(lit.value());
        }
        if (e instanceof Ast.TemplateLiteral tpl) {
            return tpl.expressions().isEmpty() ? f.textNode(tpl.quasis().get(0)) : null;
        }
        if (e instanceof Ast.UnaryExpression u && Ast.unwrap(u.argument()) instanceof Ast.Literal lit) {
            if (("-".equals(u.operator()) || "+".equals(u.operator())) && lit.value() instanceof Double d) {
                return numberNode("-".equals(u.operator()) ? -d : d);
            }
            if ("!".equals(u.operator()) && lit.value() instanceof Boolean b) {
                return f.booleanNode(!b);
            }
            return null;
        }
        if (e instanceof Ast.ArrayLiteral array) {
            ArrayNode out = f.arrayNode();
            for (Ast.Expression element : array.elements()) {
                JsonNode value = element instanceof Ast.Literal ? evaluate(element) : null;
                if (value == null) {
                    return null;
                }
                out.add(value);
            }
            return out;
        }
        if (e instanceof Ast.ObjectLiteral object) {
            ObjectNode out = f.objectNode();
            for (Ast.Node p : object.properties()) {
                if (!(p instanceof Ast.PropertyAssignment pa) || pa.key() == null
                        || !(Ast.unwrap(pa.value()) instanceof Ast.Literal)) {
                    return null;
                }
                JsonNode value = evaluate(pa.value());
                if (value == null) {
                    return null;
                }
                out.set(pa.key(), value);
            }
            return out;
        }
        return null;
    }
}
