package ru.aritmos.flowanalyzer.validation;

import ru.aritmos.flowanalyzer.catalog.CatalogModels;
import ru.aritmos.flowanalyzer.catalog.PrimitiveCatalog;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.syntax.FlowSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Контекст анализа одного исходника: разобранное дерево плюс заранее собранные факты о нём
 * (импорты, локальные объявления, класс flow, entry-метод, инстанцирования примитивов).
 * <p>
 * Строится один раз на проход и разделяется правилами валидации, проверкой типов и извлечением.
 */
public final class FlowContext {

    /**
     * Встроенные классы среды исполнения: их инстанцирование не является использованием примитива.
     */
    public static final Set<String> BUILTIN_CLASSES = Set.of(
            "Date", "Array", "Object", "Set", "Map", "WeakSet", "WeakMap", "WeakRef", "Number", "BigInt",
            "Math", "String", "RegExp", "Boolean", "Symbol", "Promise", "JSON", "Proxy", "Function",
            "Error", "TypeError", "ReferenceError", "SyntaxError", "RangeError", "EvalError", "URIError",
            "AggregateError", "URL", "URLSearchParams", "ArrayBuffer", "SharedArrayBuffer", "DataView",
            "Int8Array", "Uint8Array", "Uint8ClampedArray", "Int16Array", "Uint16Array", "Int32Array",
            "Uint32Array", "Float32Array", "Float64Array", "BigInt64Array", "BigUint64Array",
            "FormData", "Headers", "Request", "Response", "TextEncoder", "TextDecoder", "AbortController",
            "Blob", "File", "Buffer", "ReadableStream", "WritableStream", "TransformStream", "Event"
    );

    /**
     * Привязка импорта.
     *
     * @param moduleName   модуль
     * @param importedName имя в модуле ({@code default} / {@code *} для default/namespace-импорта)
     * @param typeOnly     импорт только типа
     */
    public record ImportBinding(String moduleName, String importedName, boolean typeOnly) {
    }

    /**
     * Инстанцирование класса, похожего на примитив.
     *
     * @param expression  выражение {@code new}
     * @param localName   имя класса в коде flow
     * @param className   имя класса в каталоге (с учётом переименования при импорте)
     * @param definition  элемент каталога или {@code null}, если класс не зарегистрирован
     * @param imported    импортирован ли класс из модуля ядра
     */
    public record PrimitiveInstantiation(Ast.NewExpression expression,
                                         String localName,
                                         String className,
                                         CatalogModels.PrimitiveDefinition definition,
                                         boolean imported) {
        public boolean registered() {
            return definition != null;
        }

        /**
         * Первый аргумент конструктора без обёрток ({@code as}, скобки) или {@code null}.
         */
        public Ast.Expression firstArgument() {
            List<Ast.Expression> args = expression.arguments();
            return args.isEmpty() ? null : Ast.unwrap(args.get(0));
        }
    }

    private final FlowSource source;
    private final PrimitiveCatalog catalog;
    private final FlowAnalyzerProperties properties;

    private final Map<String, ImportBinding> imports = new LinkedHashMap<>();
    private final Set<String> localNames = new LinkedHashSet<>();
    private final Map<String, List<Ast.InterfaceDeclaration>> interfaces = new LinkedHashMap<>();
    private final Map<String, Ast.TypeAliasDeclaration> typeAliases = new LinkedHashMap<>();
    private final List<Ast.ClassDeclaration> flowClasses = new ArrayList<>();
    private final List<PrimitiveInstantiation> instantiations = new ArrayList<>();

    private FlowContext(FlowSource source, PrimitiveCatalog catalog, FlowAnalyzerProperties properties) {
        this.source = source;
        this.catalog = catalog;
        this.properties = properties;
    }

    public static FlowContext build(FlowSource source, PrimitiveCatalog catalog, FlowAnalyzerProperties properties) {
        FlowContext ctx = new FlowContext(source, catalog, properties);
        ctx.collectDeclarations();
        ctx.collectInstantiations();
        return ctx;
    }

    private void collectDeclarations() {
        AstWalker.walk(source.program(), (node, ancestors) -> {
            if (node instanceof Ast.ImportDeclaration imp) {
                if (imp.defaultBinding() != null) {
                    imports.put(imp.defaultBinding(), new ImportBinding(imp.moduleName(), "default", imp.typeOnly()));
                }
                if (imp.namespaceBinding() != null) {
                    imports.put(imp.namespaceBinding(), new ImportBinding(imp.moduleName(), "*", imp.typeOnly()));
                }
                for (Ast.ImportSpecifier spec : imp.specifiers()) {
                    imports.put(spec.localName(), new ImportBinding(imp.moduleName(), spec.importedName(), spec.typeOnly()));
                }
                return false;
            }
            if (node instanceof Ast.FunctionDeclaration fn && fn.name() != null) {
                localNames.add(fn.name());
            } else if (node instanceof Ast.VariableDeclarator declarator) {
                localNames.addAll(Ast.boundNames(declarator.target()));
            } else if (node instanceof Ast.Parameter parameter) {
                localNames.addAll(Ast.boundNames(parameter));
            }
            if (node instanceof Ast.ClassDeclaration cls) {
                if (cls.name() != null) {
                    localNames.add(cls.name());
                }
                if (extendsBaseClass(cls)) {
                    flowClasses.add(cls);
                }
            } else if (node instanceof Ast.InterfaceDeclaration itf) {
                interfaces.computeIfAbsent(itf.name(), k -> new ArrayList<>()).add(itf);
            } else if (node instanceof Ast.TypeAliasDeclaration alias) {
                typeAliases.putIfAbsent(alias.name(), alias);
            }
            return true;
        });
    }

    private boolean extendsBaseClass(Ast.ClassDeclaration cls) {
        return cls.superClass() != null && properties.getBaseClass().equals(resolveClassName(cls.superClass()));
    }

    /**
     * Имя класса, на который ссылается выражение, с учётом переименования при импорте.
     */
    public String resolveClassName(Ast.Expression expression) {
        Ast.Expression e = Ast.unwrap(expression);
        if (!(e instanceof Ast.Identifier id)) {
            return null;
        }
        ImportBinding binding = imports.get(id.name());
        if (binding != null && !"default".equals(binding.importedName()) && !"*".equals(binding.importedName())) {
            return binding.importedName();
        }
        return id.name();
    }

    private void collectInstantiations() {
        for (Ast.NewExpression expr : AstWalker.collect(source.program(), Ast.NewExpression.class)) {
            PrimitiveInstantiation inst = classify(expr);
            if (inst != null) {
                instantiations.add(inst);
            }
        }
    }

    private PrimitiveInstantiation classify(Ast.NewExpression expr) {
        if (!(Ast.unwrap(expr.callee()) instanceof Ast.Identifier id)) {
            return null;
        }
        String localName = id.name();
        if (BUILTIN_CLASSES.contains(localName) || localNames.contains(localName)) {
            return null;
        }
        ImportBinding binding = imports.get(localName);
        if (binding != null && !isCoreModule(binding.moduleName())) {
            return null;
        }
        String className = binding == null ? localName : binding.importedName();
        CatalogModels.PrimitiveDefinition definition = catalog.findByClassName(className).orElse(null);
        return new PrimitiveInstantiation(expr, localName, className, definition, binding != null);
    }

    public boolean isCoreModule(String moduleName) {
        if (moduleName == null) {
            return false;
        }
        for (String core : properties.getCoreModules()) {
            if (moduleName.equals(core) || moduleName.startsWith(core + "/")) {
                return true;
            }
        }
        return false;
    }

    public FlowSource source() {
        return source;
    }

    public PrimitiveCatalog catalog() {
        return catalog;
    }

    public FlowAnalyzerProperties properties() {
        return properties;
    }

    public Map<String, ImportBinding> imports() {
        return imports;
    }

    /**
     * Имена, объявленные в самом файле flow: классы, функции, переменные и параметры.
     * {@code new} по такому имени примитивом не считается.
     */
    public Set<String> localNames() {
        return localNames;
    }

    /**
     * Все объявления интерфейса с данным именем (declaration merging).
     */
    public List<Ast.InterfaceDeclaration> interfaces(String name) {
        return interfaces.getOrDefault(name, List.of());
    }

    public Ast.TypeAliasDeclaration typeAlias(String name) {
        return typeAliases.get(name);
    }

    public List<Ast.ClassDeclaration> flowClasses() {
        return flowClasses;
    }

    /**
     * Класс flow, если он единственный; иначе первый найденный (или {@code null}).
     */
    public Ast.ClassDeclaration flowClass() {
        return flowClasses.isEmpty() ? null : flowClasses.get(0);
    }

    /**
     * Entry-метод класса flow (экземплярный метод с телом) или {@code null}.
     */
    public Ast.MethodDeclaration entryMethod() {
        return entryMethod(flowClass());
    }

    public Ast.MethodDeclaration entryMethod(Ast.ClassDeclaration cls) {
        if (cls == null) {
            return null;
        }
        for (Ast.ClassMember member : cls.members()) {
            if (member instanceof Ast.MethodDeclaration m
                    && properties.getEntryMethod().equals(m.name())
                    && "method".equals(m.kind())
                    && !m.isStatic()
                    && m.body() != null) {
                return m;
            }
        }
        return null;
    }

    /**
     * Литерал-аргумент базового класса ({@code BubbleFlow<'webhook/http'>}) или {@code null}.
     */
    public String triggerEventType() {
        Ast.ClassDeclaration cls = flowClass();
        if (cls == null || cls.superTypeArguments().isEmpty()) {
            return null;
        }
        if (cls.superTypeArguments().get(0) instanceof Ast.LiteralType lit && lit.value() instanceof String s) {
            return s;
        }
        return null;
    }

    public List<PrimitiveInstantiation> instantiations() {
        return instantiations;
    }

    public List<PrimitiveInstantiation> registeredInstantiations() {
        return instantiations.stream().filter(PrimitiveInstantiation::registered).toList();
    }
}
