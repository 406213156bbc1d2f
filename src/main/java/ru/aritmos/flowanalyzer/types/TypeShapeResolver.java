package ru.aritmos.flowanalyzer.types;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.syntax.FlowSource;
import ru.aritmos.flowanalyzer.syntax.Span;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Структурное разрешение аннотаций типов в {@link TypeShape}.
 * <p>
 * Поиск имён: сначала объявления в коде flow (интерфейсы с учётом слияния, псевдонимы), затем встроенные
 * типы событий. Результат {@code null} означает «не объектный тип» (строка, число, массив, функция):
 * такие значения дальше не проверяются.
 */
public final class TypeShapeResolver {

    private static final int MAX_DEPTH = 16;

    private final FlowContext context;
    private final Map<String, List<Ast.InterfaceDeclaration>> builtinInterfaces = new LinkedHashMap<>();
    private final Set<String> resolving = new HashSet<>();
    private int depth;

    public TypeShapeResolver(FlowContext context) {
        this.context = context;
        for (Ast.InterfaceDeclaration itf : AstWalker.collect(TriggerEvents.builtinSource().program(),
                Ast.InterfaceDeclaration.class)) {
            builtinInterfaces.computeIfAbsent(itf.name(), k -> new ArrayList<>()).add(itf);
        }
    }

    /**
     * Разрешить аннотацию из кода flow.
     */
    public TypeShape resolve(Ast.TypeNode type) {
        return resolve(type, context == null ? TriggerEvents.builtinSource() : context.source());
    }

    /**
     * Разрешить аннотацию, объявленную в исходнике {@code origin}.
     */
    public TypeShape resolve(Ast.TypeNode type, FlowSource origin) {
        if (type == null) {
            return null;
        }
        if (depth > MAX_DEPTH) {
            return TypeShape.open(origin.textOf(type));
        }
        depth++;
        try {
            return doResolve(type, origin);
        } finally {
            depth--;
        }
    }

    /**
     * Форма типа свойства.
     */
    public TypeShape resolveMember(TypeShape.Member member) {
        if (member == null || member.type() == null) {
            return null;
        }
        return resolve(member.type(), member.origin());
    }

    /**
     * Разрешить имя типа (интерфейс или псевдоним) без аннотации.
     */
    public TypeShape resolveName(String name) {
        Ast.TypeReference ref = new Ast.TypeReference(new Span(0, 0), name, List.of());
        return resolveReference(ref, null, name);
    }

    /**
     * Встроенный ли тип (объявлен среди типов событий и не переопределён в коде flow).
     */
    public boolean isBuiltinName(String name) {
        return builtinInterfaces.containsKey(name) && (context == null || context.interfaces(name).isEmpty());
    }

    private TypeShape doResolve(Ast.TypeNode type, FlowSource origin) {
        String text = origin.textOf(type);
        if (type instanceof Ast.KeywordType kw) {
            return switch (kw.keyword()) {
                case "any", "unknown", "object" -> TypeShape.open(text);
                default -> null;
            };
        }
        if (type instanceof Ast.TypeLiteral literal) {
            return shapeOfMembers(text, literal.members(), origin, new LinkedHashMap<>(), false);
        }
        if (type instanceof Ast.TypeReference ref) {
            return resolveReference(ref, origin, text);
        }
        if (type instanceof Ast.IntersectionType intersection) {
            return resolveIntersection(intersection.types(), origin, text);
        }
        if (type instanceof Ast.UnionType union) {
            return resolveUnion(union, origin, text);
        }
        if (type instanceof Ast.IndexedAccessType indexed) {
            return resolveIndexedAccess(indexed, origin, text);
        }
        if (type instanceof Ast.TypeOperator op) {
            return "readonly".equals(op.operator()) ? resolve(op.type(), origin) : null;
        }
        if (type instanceof Ast.MappedType || type instanceof Ast.ConditionalType
                || type instanceof Ast.ImportType || type instanceof Ast.TypeQuery) {
            return TypeShape.open(text);
        }
        return null;
    }

    private TypeShape resolveReference(Ast.TypeReference ref, FlowSource origin, String text) {
        String name = ref.name();
        if (name.contains(".")) {
            return TypeShape.open(text);
        }
        List<Ast.TypeNode> args = ref.typeArguments();
        switch (name) {
            case "Partial", "Required", "Readonly", "NonNullable" -> {
                if (args.isEmpty()) {
                    return TypeShape.open(text);
                }
                TypeShape inner = resolve(args.get(0), origin);
                if (inner == null || "Readonly".equals(name) || "NonNullable".equals(name)) {
                    return inner == null ? null : rename(inner, text);
                }
                boolean optional = "Partial".equals(name);
                Map<String, TypeShape.Member> members = new LinkedHashMap<>();
                inner.members().forEach((k, v) -> members.put(k, v.withOptional(optional)));
                return new TypeShape(text, members, inner.open());
            }
            case "Pick", "Omit" -> {
                if (args.size() < 2) {
                    return TypeShape.open(text);
                }
                TypeShape inner = resolve(args.get(0), origin);
                Set<String> keys = literalKeys(args.get(1));
                if (inner == null || keys == null) {
                    return TypeShape.open(text);
                }
                Map<String, TypeShape.Member> members = new LinkedHashMap<>();
                boolean pick = "Pick".equals(name);
                inner.members().forEach((k, v) -> {
                    if (keys.contains(k) == pick) {
                        members.put(k, v);
                    }
                });
                return new TypeShape(text, members, inner.open() && !pick);
            }
            case "Record" -> {
                Set<String> keys = args.size() < 2 ? null : literalKeys(args.get(0));
                if (keys == null) {
                    return TypeShape.open(text);
                }
                Map<String, TypeShape.Member> members = new LinkedHashMap<>();
                for (String key : keys) {
                    members.put(key, new TypeShape.Member(key, args.get(1), origin, false, null,
                            origin == TriggerEvents.builtinSource()));
                }
                return new TypeShape(text, members, false);
            }
            case "Array", "ReadonlyArray", "Promise", "Set", "Map", "Date", "Function", "String", "Number",
                    "Boolean" -> {
                return null;
            }
            default -> {
                return resolveDeclared(name, origin, text);
            }
        }
    }

    private TypeShape resolveDeclared(String name, FlowSource origin, String text) {
        boolean fromBuiltin = origin == TriggerEvents.builtinSource();
        if (!resolving.add(name)) {
            return TypeShape.open(text);
        }
        try {
            if (!fromBuiltin && context != null) {
                List<Ast.InterfaceDeclaration> local = context.interfaces(name);
                if (!local.isEmpty()) {
                    return shapeOfInterfaces(name, local, context.source());
                }
                Ast.TypeAliasDeclaration alias = context.typeAlias(name);
                if (alias != null) {
                    if (!alias.typeParameters().isEmpty()) {
                        return TypeShape.open(text);
                    }
                    TypeShape shape = resolve(alias.type(), context.source());
                    return shape == null ? null : rename(shape, name);
                }
            }
            List<Ast.InterfaceDeclaration> builtin = builtinInterfaces.get(name);
            if (builtin != null) {
                return shapeOfInterfaces(name, builtin, TriggerEvents.builtinSource());
            }
            return TypeShape.open(text);
        } finally {
            resolving.remove(name);
        }
    }

    private TypeShape shapeOfInterfaces(String name, List<Ast.InterfaceDeclaration> declarations, FlowSource origin) {
        Map<String, TypeShape.Member> inherited = new LinkedHashMap<>();
        boolean open = false;
        for (Ast.InterfaceDeclaration declaration : declarations) {
            if (!declaration.typeParameters().isEmpty()) {
                open = true;
            }
            for (Ast.TypeNode parent : declaration.extendsTypes()) {
                TypeShape parentShape = resolve(parent, origin);
                if (parentShape == null) {
                    continue;
                }
                open |= parentShape.open();
                parentShape.members().forEach(inherited::putIfAbsent);
            }
        }
        Map<String, TypeShape.Member> own = new LinkedHashMap<>();
        for (Ast.InterfaceDeclaration declaration : declarations) {
            TypeShape part = shapeOfMembers(name, declaration.members(), origin, new LinkedHashMap<>(), false);
            open |= part.open();
            part.members().forEach(own::putIfAbsent);
        }
        Map<String, TypeShape.Member> all = new LinkedHashMap<>(inherited);
        all.putAll(own);
        return new TypeShape(name, all, open);
    }

    private TypeShape shapeOfMembers(String name,
                                     List<Ast.TypeMember> typeMembers,
                                     FlowSource origin,
                                     Map<String, TypeShape.Member> into,
                                     boolean open) {
        boolean builtin = origin == TriggerEvents.builtinSource();
        for (Ast.TypeMember m : typeMembers) {
            if (m instanceof Ast.PropertySignature p && p.name() != null) {
                into.put(p.name(), new TypeShape.Member(p.name(), p.type(), origin, p.optional(), p.doc(), builtin));
            } else if (m instanceof Ast.MethodSignature ms && ms.name() != null) {
                into.put(ms.name(), new TypeShape.Member(ms.name(), null, origin, ms.optional(), null, builtin));
            } else if (m instanceof Ast.IndexSignature) {
                open = true;
            }
        }
        return new TypeShape(name, into, open);
    }

    private TypeShape resolveIntersection(List<Ast.TypeNode> parts, FlowSource origin, String text) {
        Map<String, TypeShape.Member> members = new LinkedHashMap<>();
        boolean open = false;
        boolean any = false;
        for (Ast.TypeNode part : parts) {
            TypeShape shape = resolve(part, origin);
            if (shape == null) {
                continue;
            }
            any = true;
            open |= shape.open();
            members.putAll(shape.members());
        }
        return any ? new TypeShape(text, members, open) : null;
    }

    private TypeShape resolveUnion(Ast.UnionType union, FlowSource origin, String text) {
        List<Ast.TypeNode> meaningful = new ArrayList<>();
        for (Ast.TypeNode t : union.types()) {
            if (t instanceof Ast.KeywordType kw && ("null".equals(kw.keyword()) || "undefined".equals(kw.keyword()))) {
                continue;
            }
            meaningful.add(t);
        }
        if (meaningful.size() == 1) {
            return resolve(meaningful.get(0), origin);
        }
        List<TypeShape> shapes = new ArrayList<>();
        for (Ast.TypeNode t : meaningful) {
            TypeShape shape = resolve(t, origin);
            if (shape == null) {
                return null;
            }
            if (shape.open()) {
                return TypeShape.open(text);
            }
            shapes.add(shape);
        }
        if (shapes.isEmpty()) {
            return null;
        }
        Map<String, TypeShape.Member> common = new LinkedHashMap<>(shapes.get(0).members());
        for (TypeShape shape : shapes.subList(1, shapes.size())) {
            common.keySet().retainAll(shape.members().keySet());
        }
        return new TypeShape(text, common, false);
    }

    private TypeShape resolveIndexedAccess(Ast.IndexedAccessType indexed, FlowSource origin, String text) {
        TypeShape object = resolve(indexed.objectType(), origin);
        if (object == null) {
            return null;
        }
        if (indexed.indexType() instanceof Ast.LiteralType lit && lit.value() instanceof String key) {
            TypeShape.Member member = object.member(key);
            if (member == null) {
                return TypeShape.open(text);
            }
            return resolveMember(member);
        }
        return TypeShape.open(text);
    }

    private static TypeShape rename(TypeShape shape, String name) {
        return new TypeShape(name, shape.members(), shape.open());
    }

    /**
     * Набор строковых литералов из {@code 'a' | 'b'}, либо {@code null}, если ключи не литеральные.
     */
    private static Set<String> literalKeys(Ast.TypeNode node) {
        Set<String> keys = new LinkedHashSet<>();
        if (node instanceof Ast.LiteralType lit && lit.value() instanceof String s) {
            keys.add(s);
            return keys;
        }
        if (node instanceof Ast.UnionType union) {
            for (Ast.TypeNode t : union.types()) {
                if (t instanceof Ast.LiteralType lit && lit.value() instanceof String s) {
                    keys.add(s);
                } else {
                    return null;
                }
            }
            return keys;
        }
        return null;
    }
}
