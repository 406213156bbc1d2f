package ru.aritmos.flowanalyzer.syntax;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Узлы синтаксического дерева TypeScript-подмножества.
 * <p>
 * Все узлы — неизменяемые record. {@link Node#children()} возвращает дочерние узлы строго в порядке
 * следования в исходном тексте: на этом порядке основана детерминированная нумерация экземпляров
 * примитивов.
 * <p>
 * Поля {@code *Anchor} у управляющих конструкций — смещение конца лексемы, после которой начинается
 * тело (закрывающая скобка условия, {@code else} или {@code do}). Нормализатор использует их как точку
 * вставки открывающей фигурной скобки.
 */
public final class Ast {

    private Ast() {
        // утилитарный класс
    }

    public interface Node {
        Span span();

        List<Node> children();
    }

    public interface Statement extends Node {
    }

    public interface Expression extends Node {
    }

    /** Цель привязки: идентификатор или деструктуризация. */
    public interface Pattern extends Node {
    }

    public interface TypeNode extends Node {
    }

    public interface ClassMember extends Node {
    }

    public interface TypeMember extends Node {
    }

    static List<Node> nodes(Object... parts) {
        List<Node> out = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node n) {
                out.add(n);
            } else if (part instanceof Collection<?> c) {
                for (Object o : c) {
                    if (o instanceof Node n) {
                        out.add(n);
                    }
                }
            }
        }
        return out;
    }

    // ---------------------------------------------------------------- программа и объявления

    public record Program(Span span, List<Statement> body) implements Node {
        public List<Node> children() {
            return nodes(body);
        }
    }

    public record ImportSpecifier(Span span, String importedName, String localName, boolean typeOnly) implements Node {
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * @param defaultBinding   имя default-импорта или {@code null}
     * @param namespaceBinding имя {@code * as ns} или {@code null}
     */
    public record ImportDeclaration(Span span,
                                    String moduleName,
                                    String defaultBinding,
                                    String namespaceBinding,
                                    List<ImportSpecifier> specifiers,
                                    boolean typeOnly) implements Statement {
        public List<Node> children() {
            return nodes(specifiers);
        }
    }

    /** {@code export { a, b as c } [from 'm']}, {@code export * from 'm'}, {@code export = x}. */
    public record ExportNamed(Span span, List<String> names, String moduleName) implements Statement {
        public List<Node> children() {
            return List.of();
        }
    }

    public record ExportDefault(Span span, Node declaration) implements Statement {
        public List<Node> children() {
            return nodes(declaration);
        }
    }

    public record TypeParameter(Span span, String name, TypeNode constraint, TypeNode defaultType) implements Node {
        public List<Node> children() {
            return nodes(constraint, defaultType);
        }
    }

    /**
     * Класс. Используется и как объявление, и как выражение.
     *
     * @param superClass         выражение после {@code extends} (или {@code null})
     * @param superTypeArguments generic-аргументы базового класса
     */
    public record ClassDeclaration(Span span,
                                   String name,
                                   List<TypeParameter> typeParameters,
                                   Expression superClass,
                                   List<TypeNode> superTypeArguments,
                                   List<TypeNode> implementsTypes,
                                   List<ClassMember> members,
                                   Set<String> modifiers,
                                   boolean exported) implements Statement, Expression {
        public List<Node> children() {
            return nodes(typeParameters, superClass, superTypeArguments, implementsTypes, members);
        }
    }

    public record InterfaceDeclaration(Span span,
                                       String name,
                                       List<TypeParameter> typeParameters,
                                       List<TypeNode> extendsTypes,
                                       List<TypeMember> members,
                                       boolean exported) implements Statement {
        public List<Node> children() {
            return nodes(typeParameters, extendsTypes, members);
        }
    }

    public record TypeAliasDeclaration(Span span,
                                       String name,
                                       List<TypeParameter> typeParameters,
                                       TypeNode type,
                                       boolean exported) implements Statement {
        public List<Node> children() {
            return nodes(typeParameters, type);
        }
    }

    public record EnumMember(Span span, String name, Expression initializer) implements Node {
        public List<Node> children() {
            return nodes(initializer);
        }
    }

    public record EnumDeclaration(Span span, String name, List<EnumMember> members, boolean exported) implements Statement {
        public List<Node> children() {
            return nodes(members);
        }
    }

    /** {@code namespace X { ... }} / {@code declare module 'x' { ... }}. */
    public record NamespaceDeclaration(Span span, String name, List<Statement> body) implements Statement {
        public List<Node> children() {
            return nodes(body);
        }
    }

    public record Parameter(Span span,
                            Pattern target,
                            TypeNode type,
                            Expression defaultValue,
                            boolean optional,
                            boolean rest,
                            Set<String> modifiers) implements Node {
        public List<Node> children() {
            return nodes(target, type, defaultValue);
        }

        /** Имя параметра, если он объявлен простым идентификатором. */
        public String name() {
            return target instanceof Identifier id ? id.name() : null;
        }

        public boolean required() {
            return !optional && !rest && defaultValue == null;
        }
    }

    /**
     * @param body {@code null} для перегрузок и {@code declare}
     */
    public record FunctionDeclaration(Span span,
                                      String name,
                                      List<TypeParameter> typeParameters,
                                      List<Parameter> parameters,
                                      TypeNode returnType,
                                      Block body,
                                      boolean async,
                                      boolean generator,
                                      boolean exported) implements Statement {
        public List<Node> children() {
            return nodes(typeParameters, parameters, returnType, body);
        }
    }

    public record VariableDeclarator(Span span, Pattern target, TypeNode type, Expression initializer) implements Node {
        public List<Node> children() {
            return nodes(target, type, initializer);
        }
    }

    /**
     * @param kind {@code var}, {@code let}, {@code const} или {@code using}
     */
    public record VariableStatement(Span span, String kind, List<VariableDeclarator> declarations, boolean exported)
            implements Statement {
        public List<Node> children() {
            return nodes(declarations);
        }
    }

    // ---------------------------------------------------------------- члены класса

    /**
     * Метод класса или объектного литерала.
     *
     * @param kind {@code method}, {@code get}, {@code set} или {@code constructor}
     * @param body {@code null} для abstract-методов и перегрузок
     */
    public record MethodDeclaration(Span span,
                                    String name,
                                    Expression computedKey,
                                    Set<String> modifiers,
                                    String kind,
                                    List<TypeParameter> typeParameters,
                                    List<Parameter> parameters,
                                    TypeNode returnType,
                                    Block body,
                                    boolean async,
                                    boolean generator,
                                    boolean optional) implements ClassMember, Node {
        public List<Node> children() {
            return nodes(computedKey, typeParameters, parameters, returnType, body);
        }

        public boolean isStatic() {
            return modifiers.contains("static");
        }
    }

    public record PropertyDeclaration(Span span,
                                      String name,
                                      Expression computedKey,
                                      Set<String> modifiers,
                                      TypeNode type,
                                      Expression initializer,
                                      boolean optional) implements ClassMember {
        public List<Node> children() {
            return nodes(computedKey, type, initializer);
        }
    }

    /** {@code static { ... }} */
    public record StaticBlock(Span span, Block body) implements ClassMember {
        public List<Node> children() {
            return nodes(body);
        }
    }

    // ---------------------------------------------------------------- члены типов

    public record PropertySignature(Span span,
                                    String name,
                                    TypeNode type,
                                    boolean optional,
                                    boolean readonly,
                                    String doc) implements TypeMember {
        public List<Node> children() {
            return nodes(type);
        }
    }

    public record MethodSignature(Span span,
                                  String name,
                                  List<TypeParameter> typeParameters,
                                  List<Parameter> parameters,
                                  TypeNode returnType,
                                  boolean optional) implements TypeMember {
        public List<Node> children() {
            return nodes(typeParameters, parameters, returnType);
        }
    }

    public record IndexSignature(Span span, String keyName, TypeNode keyType, TypeNode valueType)
            implements TypeMember, ClassMember {
        public List<Node> children() {
            return nodes(keyType, valueType);
        }
    }

    /** Сигнатура вызова или конструирования внутри типа. */
    public record CallSignature(Span span,
                                List<TypeParameter> typeParameters,
                                List<Parameter> parameters,
                                TypeNode returnType,
                                boolean construct) implements TypeMember {
        public List<Node> children() {
            return nodes(typeParameters, parameters, returnType);
        }
    }

    // ---------------------------------------------------------------- типы

    /**
     * @param keyword {@code any}, {@code unknown}, {@code string}, {@code number}, {@code boolean},
     *                {@code bigint}, {@code symbol}, {@code object}, {@code void}, {@code undefined},
     *                {@code null}, {@code never}, {@code this}, {@code const}
     */
    public record KeywordType(Span span, String keyword) implements TypeNode {
        public List<Node> children() {
            return List.of();
        }
    }

    public record TypeReference(Span span, String name, List<TypeNode> typeArguments) implements TypeNode {
        public List<Node> children() {
            return nodes(typeArguments);
        }
    }

    /**
     * @param value {@link String}, {@link Double} или {@link Boolean}
     */
    public record LiteralType(Span span, Object value, String raw) implements TypeNode {
        public List<Node> children() {
            return List.of();
        }
    }

    public record ArrayType(Span span, TypeNode elementType) implements TypeNode {
        public List<Node> children() {
            return nodes(elementType);
        }
    }

    public record TupleType(Span span, List<TypeNode> elements) implements TypeNode {
        public List<Node> children() {
            return nodes(elements);
        }
    }

    public record UnionType(Span span, List<TypeNode> types) implements TypeNode {
        public List<Node> children() {
            return nodes(types);
        }
    }

    public record IntersectionType(Span span, List<TypeNode> types) implements TypeNode {
        public List<Node> children() {
            return nodes(types);
        }
    }

    public record TypeLiteral(Span span, List<TypeMember> members) implements TypeNode {
        public List<Node> children() {
            return nodes(members);
        }
    }

    public record FunctionType(Span span,
                               List<TypeParameter> typeParameters,
                               List<Parameter> parameters,
                               TypeNode returnType,
                               boolean construct) implements TypeNode {
        public List<Node> children() {
            return nodes(typeParameters, parameters, returnType);
        }
    }

    /**
     * @param operator {@code keyof}, {@code readonly} или {@code unique}
     */
    public record TypeOperator(Span span, String operator, TypeNode type) implements TypeNode {
        public List<Node> children() {
            return nodes(type);
        }
    }

    /** {@code typeof expr.path} в позиции типа. */
    public record TypeQuery(Span span, String expressionName) implements TypeNode {
        public List<Node> children() {
            return List.of();
        }
    }

    public record IndexedAccessType(Span span, TypeNode objectType, TypeNode indexType) implements TypeNode {
        public List<Node> children() {
            return nodes(objectType, indexType);
        }
    }

    public record ConditionalType(Span span, TypeNode checkType, TypeNode extendsType, TypeNode trueType, TypeNode falseType)
            implements TypeNode {
        public List<Node> children() {
            return nodes(checkType, extendsType, trueType, falseType);
        }
    }

    /** {@code { [K in keyof T]?: X }} */
    public record MappedType(Span span, String keyName, TypeNode constraint, TypeNode valueType) implements TypeNode {
        public List<Node> children() {
            return nodes(constraint, valueType);
        }
    }

    public record InferType(Span span, String name) implements TypeNode {
        public List<Node> children() {
            return List.of();
        }
    }

    /** {@code x is T}, {@code asserts x is T}, {@code asserts x}. */
    public record TypePredicate(Span span, String parameterName, TypeNode type, boolean asserts) implements TypeNode {
        public List<Node> children() {
            return nodes(type);
        }
    }

    /** {@code import('module').Name} */
    public record ImportType(Span span, String moduleName, String qualifier, List<TypeNode> typeArguments)
            implements TypeNode {
        public List<Node> children() {
            return nodes(typeArguments);
        }
    }

    /** Шаблонный литеральный тип ({@code `prefix-${string}`}); хранится только исходный текст. */
    public record TemplateLiteralType(Span span, String raw) implements TypeNode {
        public List<Node> children() {
            return List.of();
        }
    }

    // ---------------------------------------------------------------- операторы

    public record Block(Span span, List<Statement> statements) implements Statement {
        public List<Node> children() {
            return nodes(statements);
        }
    }

    public record EmptyStatement(Span span) implements Statement {
        public List<Node> children() {
            return List.of();
        }
    }

    public record ExpressionStatement(Span span, Expression expression) implements Statement {
        public List<Node> children() {
            return nodes(expression);
        }
    }

    public record IfStatement(Span span,
                              Expression test,
                              Statement consequent,
                              Statement alternate,
                              int consequentAnchor,
                              int alternateAnchor) implements Statement {
        public List<Node> children() {
            return nodes(test, consequent, alternate);
        }
    }

    /**
     * @param init {@link VariableStatement}, {@link Expression} или {@code null}
     */
    public record ForStatement(Span span,
                               Node init,
                               Expression test,
                               Expression update,
                               Statement body,
                               int bodyAnchor) implements Statement {
        public List<Node> children() {
            return nodes(init, test, update, body);
        }
    }

    public record ForInStatement(Span span, Node left, Expression right, Statement body, int bodyAnchor)
            implements Statement {
        public List<Node> children() {
            return nodes(left, right, body);
        }
    }

    public record ForOfStatement(Span span, Node left, Expression right, Statement body, boolean await, int bodyAnchor)
            implements Statement {
        public List<Node> children() {
            return nodes(left, right, body);
        }
    }

    public record WhileStatement(Span span, Expression test, Statement body, int bodyAnchor) implements Statement {
        public List<Node> children() {
            return nodes(test, body);
        }
    }

    public record DoWhileStatement(Span span, Statement body, Expression test, int bodyAnchor) implements Statement {
        public List<Node> children() {
            return nodes(body, test);
        }
    }

    public record ReturnStatement(Span span, Expression argument) implements Statement {
        public List<Node> children() {
            return nodes(argument);
        }
    }

    public record ThrowStatement(Span span, Expression argument) implements Statement {
        public List<Node> children() {
            return nodes(argument);
        }
    }

    public record CatchClause(Span span, Pattern parameter, TypeNode parameterType, Block body) implements Node {
        public List<Node> children() {
            return nodes(parameter, parameterType, body);
        }
    }

    public record TryStatement(Span span, Block block, CatchClause handler, Block finalizer) implements Statement {
        public List<Node> children() {
            return nodes(block, handler, finalizer);
        }
    }

    /**
     * @param test {@code null} для {@code default}
     */
    public record SwitchCase(Span span, Expression test, List<Statement> consequent) implements Node {
        public List<Node> children() {
            return nodes(test, consequent);
        }
    }

    public record SwitchStatement(Span span, Expression discriminant, List<SwitchCase> cases) implements Statement {
        public List<Node> children() {
            return nodes(discriminant, cases);
        }
    }

    public record BreakStatement(Span span, String label) implements Statement {
        public List<Node> children() {
            return List.of();
        }
    }

    public record ContinueStatement(Span span, String label) implements Statement {
        public List<Node> children() {
            return List.of();
        }
    }

    public record LabeledStatement(Span span, String label, Statement body) implements Statement {
        public List<Node> children() {
            return nodes(body);
        }
    }

    public record DebuggerStatement(Span span) implements Statement {
        public List<Node> children() {
            return List.of();
        }
    }

    // ---------------------------------------------------------------- выражения

    public record Identifier(Span span, String name) implements Expression, Pattern {
        public List<Node> children() {
            return List.of();
        }
    }

    public record ThisExpression(Span span) implements Expression {
        public List<Node> children() {
            return List.of();
        }
    }

    public record SuperExpression(Span span) implements Expression {
        public List<Node> children() {
            return List.of();
        }
    }

    public enum LiteralKind {
        STRING,
        NUMBER,
        BIGINT,
        BOOLEAN,
        NULL,
        REGEX
    }

    /**
     * @param value {@link String}, {@link Double}, {@link Boolean} или {@code null}
     * @param raw   исходный текст литерала
     */
    public record Literal(Span span, LiteralKind kind, Object value, String raw) implements Expression {
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * @param quasis      декодированные фрагменты (их на один больше, чем подстановок)
     * @param expressions подстановки
     */
    public record TemplateLiteral(Span span, List<String> quasis, List<Expression> expressions) implements Expression {
        public List<Node> children() {
            return nodes(expressions);
        }
    }

    public record TaggedTemplate(Span span, Expression tag, List<TypeNode> typeArguments, TemplateLiteral quasi)
            implements Expression {
        public List<Node> children() {
            return nodes(tag, typeArguments, quasi);
        }
    }

    /** Пропуск в массиве: {@code [a, , b]}. */
    public record OmittedExpression(Span span) implements Expression, Pattern {
        public List<Node> children() {
            return List.of();
        }
    }

    public record ArrayLiteral(Span span, List<Expression> elements) implements Expression {
        public List<Node> children() {
            return nodes(elements);
        }
    }

    public record SpreadElement(Span span, Expression argument) implements Expression {
        public List<Node> children() {
            return nodes(argument);
        }
    }

    /**
     * @param key         имя свойства ({@code null}, если ключ вычисляемый)
     * @param computedKey выражение вычисляемого ключа
     */
    public record PropertyAssignment(Span span, String key, Expression computedKey, Expression value) implements Node {
        public List<Node> children() {
            return nodes(computedKey, value);
        }
    }

    /** {@code { name }}; в деструктуризации присваиванием может иметь значение по умолчанию. */
    public record ShorthandProperty(Span span, Identifier name, Expression defaultValue) implements Node {
        public List<Node> children() {
            return nodes(name, defaultValue);
        }
    }

    /**
     * @param properties {@link PropertyAssignment}, {@link ShorthandProperty}, {@link SpreadElement}
     *                   или {@link MethodDeclaration}
     */
    public record ObjectLiteral(Span span, List<Node> properties) implements Expression {
        public List<Node> children() {
            return nodes(properties);
        }
    }

    public record FunctionExpression(Span span,
                                     String name,
                                     List<TypeParameter> typeParameters,
                                     List<Parameter> parameters,
                                     TypeNode returnType,
                                     Block body,
                                     boolean async,
                                     boolean generator) implements Expression {
        public List<Node> children() {
            return nodes(typeParameters, parameters, returnType, body);
        }
    }

    /**
     * @param body {@link Block} или {@link Expression}
     */
    public record ArrowFunction(Span span,
                                List<TypeParameter> typeParameters,
                                List<Parameter> parameters,
                                TypeNode returnType,
                                Node body,
                                boolean async) implements Expression {
        public List<Node> children() {
            return nodes(typeParameters, parameters, returnType, body);
        }
    }

    /** Префиксный оператор: {@code ! - + ~ typeof void delete ++ --}. */
    public record UnaryExpression(Span span, String operator, Expression argument) implements Expression {
        public List<Node> children() {
            return nodes(argument);
        }
    }

    public record PostfixExpression(Span span, String operator, Expression argument) implements Expression {
        public List<Node> children() {
            return nodes(argument);
        }
    }

    public record AwaitExpression(Span span, Expression argument) implements Expression {
        public List<Node> children() {
            return nodes(argument);
        }
    }

    public record YieldExpression(Span span, Expression argument, boolean delegate) implements Expression {
        public List<Node> children() {
            return nodes(argument);
        }
    }

    /** Бинарный и логический оператор, включая {@code in}, {@code instanceof}, {@code ??}. */
    public record BinaryExpression(Span span, String operator, Expression left, Expression right) implements Expression {
        public List<Node> children() {
            return nodes(left, right);
        }
    }

    public record AssignmentExpression(Span span, String operator, Expression target, Expression value)
            implements Expression {
        public List<Node> children() {
            return nodes(target, value);
        }
    }

    public record ConditionalExpression(Span span, Expression test, Expression consequent, Expression alternate)
            implements Expression {
        public List<Node> children() {
            return nodes(test, consequent, alternate);
        }
    }

    public record CallExpression(Span span,
                                 Expression callee,
                                 List<TypeNode> typeArguments,
                                 List<Expression> arguments,
                                 boolean optional) implements Expression {
        public List<Node> children() {
            return nodes(callee, typeArguments, arguments);
        }
    }

    public record NewExpression(Span span, Expression callee, List<TypeNode> typeArguments, List<Expression> arguments)
            implements Expression {
        public List<Node> children() {
            return nodes(callee, typeArguments, arguments);
        }
    }

    /** {@code obj.prop} / {@code obj?.prop}; приватные имена хранятся с {@code #}. */
    public record MemberExpression(Span span, Expression object, String property, boolean optional)
            implements Expression {
        public List<Node> children() {
            return nodes(object);
        }
    }

    public record ElementAccess(Span span, Expression object, Expression index, boolean optional) implements Expression {
        public List<Node> children() {
            return nodes(object, index);
        }
    }

    public record NonNullExpression(Span span, Expression expression) implements Expression {
        public List<Node> children() {
            return nodes(expression);
        }
    }

    /**
     * {@code expr as T} или {@code expr satisfies T}; {@code <T>expr} в .ts-коде flow не поддерживается.
     */
    public record AsExpression(Span span, Expression expression, TypeNode type, boolean satisfies)
            implements Expression {
        public List<Node> children() {
            return nodes(expression, type);
        }
    }

    public record ParenthesizedExpression(Span span, Expression expression) implements Expression {
        public List<Node> children() {
            return nodes(expression);
        }
    }

    public record SequenceExpression(Span span, List<Expression> expressions) implements Expression {
        public List<Node> children() {
            return nodes(expressions);
        }
    }

    /** {@code import('x')} и {@code import.meta}. */
    public record ImportCall(Span span, List<Expression> arguments, boolean meta) implements Expression {
        public List<Node> children() {
            return nodes(arguments);
        }
    }

    // ---------------------------------------------------------------- деструктуризация

    public record BindingProperty(Span span, String key, Expression computedKey, Pattern value, Expression defaultValue)
            implements Node {
        public List<Node> children() {
            return nodes(computedKey, value, defaultValue);
        }
    }

    public record BindingElement(Span span, Pattern target, Expression defaultValue) implements Node {
        public List<Node> children() {
            return nodes(target, defaultValue);
        }
    }

    public record RestElement(Span span, Pattern target) implements Node {
        public List<Node> children() {
            return nodes(target);
        }
    }

    /**
     * @param properties {@link BindingProperty} или {@link RestElement}
     */
    public record ObjectPattern(Span span, List<Node> properties) implements Pattern {
        public List<Node> children() {
            return nodes(properties);
        }
    }

    /**
     * @param elements {@link BindingElement}, {@link RestElement} или {@link OmittedExpression}
     */
    public record ArrayPattern(Span span, List<Node> elements) implements Pattern {
        public List<Node> children() {
            return nodes(elements);
        }
    }

    // ---------------------------------------------------------------- вспомогательное

    /**
     * Снять обёртки, не меняющие значение выражения: скобки, {@code as}, {@code satisfies}, {@code !}.
     */
    public static Expression unwrap(Expression expression) {
        Expression e = expression;
        while (true) {
            if (e instanceof ParenthesizedExpression p) {
                e = p.expression();
            } else if (e instanceof AsExpression a) {
                e = a.expression();
            } else if (e instanceof NonNullExpression n) {
                e = n.expression();
            } else {
                return e;
            }
        }
    }

    /** Вызов вида {@code this.name(...)}: возвращает имя метода или {@code null}. */
    public static String thisMethodCallName(Node node) {
        if (node instanceof CallExpression call
                && unwrap(call.callee()) instanceof MemberExpression member
                && unwrap(member.object()) instanceof ThisExpression) {
            return member.property();
        }
        return null;
    }

    /** Имена, которые связывает шаблон деструктуризации или идентификатор. */
    public static List<String> boundNames(Node pattern) {
        List<String> out = new ArrayList<>();
        collectBoundNames(pattern, out);
        return out;
    }

    private static void collectBoundNames(Node node, List<String> out) {
        if (node instanceof Identifier id) {
            out.add(id.name());
        } else if (node instanceof ObjectPattern pattern) {
            pattern.properties().forEach(p -> collectBoundNames(p, out));
        } else if (node instanceof ArrayPattern pattern) {
            pattern.elements().forEach(e -> collectBoundNames(e, out));
        } else if (node instanceof BindingProperty property) {
            collectBoundNames(property.value(), out);
        } else if (node instanceof BindingElement element) {
            collectBoundNames(element.target(), out);
        } else if (node instanceof RestElement rest) {
            collectBoundNames(rest.target(), out);
        } else if (node instanceof Parameter parameter) {
            collectBoundNames(parameter.target(), out);
        } else if (node instanceof VariableStatement statement) {
            statement.declarations().forEach(d -> collectBoundNames(d.target(), out));
        }
    }

    /**
     * Объявляет ли узел собственную привязку с данным именем: параметр функции, переменную или функцию
     * блока, переменную заголовка цикла, параметр catch.
     */
    public static boolean declares(Node scope, String name) {
        if (scope instanceof FunctionDeclaration f) {
            return declaresAmong(f.parameters(), name);
        }
        if (scope instanceof FunctionExpression f) {
            return name.equals(f.name()) || declaresAmong(f.parameters(), name);
        }
        if (scope instanceof ArrowFunction f) {
            return declaresAmong(f.parameters(), name);
        }
        if (scope instanceof MethodDeclaration m) {
            return declaresAmong(m.parameters(), name);
        }
        if (scope instanceof Block block) {
            for (Statement statement : block.statements()) {
                if (statement instanceof VariableStatement v && boundNames(v).contains(name)
                        || statement instanceof FunctionDeclaration f && name.equals(f.name())
                        || statement instanceof ClassDeclaration c && name.equals(c.name())) {
                    return true;
                }
            }
            return false;
        }
        if (scope instanceof ForStatement loop) {
            return boundNames(loop.init()).contains(name);
        }
        if (scope instanceof ForOfStatement loop) {
            return boundNames(loop.left()).contains(name);
        }
        if (scope instanceof ForInStatement loop) {
            return boundNames(loop.left()).contains(name);
        }
        if (scope instanceof CatchClause clause) {
            return boundNames(clause.parameter()).contains(name);
        }
        return false;
    }

    private static boolean declaresAmong(List<Parameter> parameters, String name) {
        for (Parameter parameter : parameters) {
            if (boundNames(parameter).contains(name)) {
                return true;
            }
        }
        return false;
    }
}
