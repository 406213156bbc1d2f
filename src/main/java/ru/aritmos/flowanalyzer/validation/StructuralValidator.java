package ru.aritmos.flowanalyzer.validation;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.catalog.PrimitiveCatalog;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.syntax.FlowSource;
import ru.aritmos.flowanalyzer.syntax.FlowSyntaxException;
import ru.aritmos.flowanalyzer.types.ParameterContractChecker;
import ru.aritmos.flowanalyzer.types.TriggerEvents;
import ru.aritmos.flowanalyzer.types.TypeResolver;
import ru.aritmos.flowanalyzer.validation.lint.LintRuleRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Структурная валидация кода flow.
 * <p>
 * Правила выполняются в фиксированном порядке, поэтому список диагностик детерминирован:
 * <ol>
 *     <li>пустой код / синтаксическая ошибка (дальше ничего не выполняется);</li>
 *     <li>ровно один класс flow, импорт базового класса, ключ события-триггера;</li>
 *     <li>entry-метод и его сигнатура;</li>
 *     <li>{@code throw} непосредственно в entry-методе;</li>
 *     <li>вызовы шагов только из entry-метода;</li>
 *     <li>литералы в параметре {@code credentials};</li>
 *     <li>инстанцируемые примитивы зарегистрированы и импортированы;</li>
 *     <li>проверка типов;</li>
 *     <li>lint-правила.</li>
 * </ol>
 * Валидатор не бросает исключений на некорректном коде: все ошибки возвращаются в {@link ValidationResult}.
 */
@Singleton
public class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private final FlowAnalyzerProperties properties;
    private final TypeResolver typeResolver;
    private final LintRuleRegistry lintRules;

    public StructuralValidator(FlowAnalyzerProperties properties, TypeResolver typeResolver, LintRuleRegistry lintRules) {
        this.properties = properties;
        this.typeResolver = typeResolver;
        this.lintRules = lintRules;
    }

    /**
     * Результат анализа: вердикт и контекст (если код удалось разобрать).
     */
    public record Analysis(ValidationResult result, FlowContext context) {
    }

    public ValidationResult validate(String code, PrimitiveCatalog catalog) {
        return analyze(code, catalog).result();
    }

    public Analysis analyze(String code, PrimitiveCatalog catalog) {
        if (code == null || code.isBlank()) {
            return new Analysis(ValidationResult.of(List.of(FlowDiagnostic.EMPTY_SOURCE.create())), null);
        }
        FlowSource source;
        try {
            source = FlowSource.parse(code);
        } catch (FlowSyntaxException e) {
            log.debug("Синтаксическая ошибка в коде flow: {}", e.getMessage());
            Diagnostic d = new Diagnostic(FlowDiagnostic.SYNTAX_ERROR.code(), e.getMessage(), e.getLine(), e.getColumn());
            return new Analysis(ValidationResult.of(List.of(d)), null);
        }

        FlowContext context = FlowContext.build(source, catalog, properties);
        List<Diagnostic> errors = new ArrayList<>();

        if (!checkFlowClass(context, errors)) {
            return finish(context, errors);
        }
        Ast.MethodDeclaration entry = checkEntryMethod(context, errors);
        if (entry != null) {
            checkThrowInEntryMethod(context, entry, errors);
            checkCallGraph(context, errors);
        }
        checkLiteralCredentials(context, errors);
        checkPrimitiveRegistration(context, errors);
        errors.addAll(typeResolver.check(context));
        errors.addAll(lintRules.run(context));
        return finish(context, errors);
    }

    private Analysis finish(FlowContext context, List<Diagnostic> errors) {
        ValidationResult result = ValidationResult.of(errors);
        if (result.valid()) {
            log.debug("Код flow прошёл валидацию");
        } else {
            log.debug("Код flow не прошёл валидацию: ошибок {}", errors.size());
        }
        return new Analysis(result, context);
    }

    // ---------------------------------------------------------------- класс flow

    private boolean checkFlowClass(FlowContext context, List<Diagnostic> errors) {
        String base = properties.getBaseClass();
        List<Ast.ClassDeclaration> flowClasses = context.flowClasses();
        if (flowClasses.isEmpty()) {
            errors.add(FlowDiagnostic.MISSING_FLOW_CLASS.create(base));
            return false;
        }
        FlowSource source = context.source();
        if (flowClasses.size() > 1) {
            String names = flowClasses.stream()
                    .map(c -> c.name() == null ? "<anonymous>" : c.name())
                    .collect(Collectors.joining(", "));
            errors.add(FlowDiagnostic.MULTIPLE_FLOW_CLASSES.at(source, flowClasses.get(1), base, flowClasses.size(), names));
            return false;
        }

        Ast.ClassDeclaration cls = flowClasses.get(0);
        Ast.Expression superClass = Ast.unwrap(cls.superClass());
        if (superClass instanceof Ast.Identifier id) {
            FlowContext.ImportBinding binding = context.imports().get(id.name());
            if (binding == null || binding.typeOnly() || !context.isCoreModule(binding.moduleName())) {
                errors.add(FlowDiagnostic.UNRESOLVED_BASE_CLASS.at(source, superClass, base, coreModule()));
            }
        }

        if (!cls.superTypeArguments().isEmpty()) {
            Ast.TypeNode argument = cls.superTypeArguments().get(0);
            String expected = String.join(", ", TriggerEvents.keys());
            String key = context.triggerEventType();
            if (key == null) {
                errors.add(FlowDiagnostic.NON_LITERAL_TRIGGER_TYPE.at(source, argument, base, expected));
            } else if (!TriggerEvents.isKnown(key)) {
                errors.add(FlowDiagnostic.INVALID_TRIGGER_TYPE.at(source, argument, key, expected));
            }
        }
        return true;
    }

    // ---------------------------------------------------------------- entry-метод

    private Ast.MethodDeclaration checkEntryMethod(FlowContext context, List<Diagnostic> errors) {
        Ast.ClassDeclaration cls = context.flowClass();
        String entryName = properties.getEntryMethod();
        String className = cls.name() == null ? "<anonymous>" : cls.name();
        String baseText = baseTypeText(context, cls);
        FlowSource source = context.source();

        for (Ast.ClassMember member : cls.members()) {
            if (member instanceof Ast.PropertyDeclaration p && entryName.equals(p.name()) && !p.modifiers().contains("static")) {
                errors.add(FlowDiagnostic.ENTRY_METHOD_NOT_METHOD.at(source, p, baseText, entryName, className));
                return null;
            }
        }
        Ast.MethodDeclaration entry = context.entryMethod(cls);
        if (entry == null) {
            errors.add(FlowDiagnostic.MISSING_ENTRY_METHOD.at(source, cls, className, entryName, baseText));
            return null;
        }
        long required = entry.parameters().stream().filter(Ast.Parameter::required).count();
        if (required > 1) {
            errors.add(FlowDiagnostic.ENTRY_METHOD_SIGNATURE.at(source, entry, entryName, className, baseText, required));
        }
        return entry;
    }

    private static String baseTypeText(FlowContext context, Ast.ClassDeclaration cls) {
        StringBuilder sb = new StringBuilder(context.source().textOf(cls.superClass()));
        if (!cls.superTypeArguments().isEmpty()) {
            sb.append('<')
                    .append(cls.superTypeArguments().stream()
                            .map(t -> context.source().textOf(t))
                            .collect(Collectors.joining(", ")))
                    .append('>');
        }
        return sb.toString();
    }

    private void checkThrowInEntryMethod(FlowContext context, Ast.MethodDeclaration entry, List<Diagnostic> errors) {
        for (Ast.Statement statement : entry.body().statements()) {
            if (statement instanceof Ast.ThrowStatement) {
                errors.add(FlowDiagnostic.THROW_IN_ENTRY_METHOD.at(context.source(), statement));
            } else if (statement instanceof Ast.IfStatement ifs) {
                checkBracelessThrow(context, ifs, errors);
            }
        }
    }

    private void checkBracelessThrow(FlowContext context, Ast.IfStatement ifs, List<Diagnostic> errors) {
        if (ifs.consequent() instanceof Ast.ThrowStatement t) {
            errors.add(FlowDiagnostic.THROW_IN_ENTRY_METHOD.at(context.source(), t));
        }
        if (ifs.alternate() instanceof Ast.ThrowStatement t) {
            errors.add(FlowDiagnostic.THROW_IN_ENTRY_METHOD.at(context.source(), t));
        } else if (ifs.alternate() instanceof Ast.IfStatement elseIf) {
            checkBracelessThrow(context, elseIf, errors);
        }
    }

    // ---------------------------------------------------------------- граф вызовов

    private void checkCallGraph(FlowContext context, List<Diagnostic> errors) {
        Ast.ClassDeclaration cls = context.flowClass();
        String entryName = properties.getEntryMethod();
        Set<String> methods = new LinkedHashSet<>();
        for (Ast.ClassMember member : cls.members()) {
            if (member instanceof Ast.MethodDeclaration m && m.name() != null && !"constructor".equals(m.kind())) {
                methods.add(m.name());
            } else if (member instanceof Ast.PropertyDeclaration p && p.name() != null && isCallable(p.initializer())) {
                methods.add(p.name());
            }
        }
        for (Ast.ClassMember member : cls.members()) {
            String caller = memberName(member);
            if (entryName.equals(caller)) {
                continue;
            }
            AstWalker.walk(member, (node, ancestors) -> {
                String callee = Ast.thisMethodCallName(node);
                if (callee != null && methods.contains(callee)) {
                    errors.add(FlowDiagnostic.NESTED_METHOD_CALL.at(context.source(), node, callee, caller, entryName));
                }
                return true;
            });
        }
    }

    private static boolean isCallable(Ast.Expression initializer) {
        if (initializer == null) {
            return false;
        }
        Ast.Expression e = Ast.unwrap(initializer);
        return e instanceof Ast.ArrowFunction || e instanceof Ast.FunctionExpression;
    }

    private static String memberName(Ast.ClassMember member) {
        if (member instanceof Ast.MethodDeclaration m) {
            return "constructor".equals(m.kind()) ? "constructor" : String.valueOf(m.name());
        }
        if (member instanceof Ast.PropertyDeclaration p) {
            return String.valueOf(p.name());
        }
        return "static initializer";
    }

    // ---------------------------------------------------------------- учётные данные и каталог

    private void checkLiteralCredentials(FlowContext context, List<Diagnostic> errors) {
        for (FlowContext.PrimitiveInstantiation inst : context.instantiations()) {
            if (!(inst.firstArgument() instanceof Ast.ObjectLiteral params)) {
                continue;
            }
            Ast.Node property = ParameterContractChecker.suppliedProperties(params)
                    .get(ParameterContractChecker.CREDENTIALS_FIELD);
            if (property instanceof Ast.PropertyAssignment pa && isLiteralSecret(pa.value())) {
                errors.add(FlowDiagnostic.LITERAL_CREDENTIALS.at(context.source(), pa));
                return;
            }
        }
    }

    /**
     * Непустой литерал (не ссылка): строка, число, шаблон, объект или массив.
     */
    static boolean isLiteralSecret(Ast.Expression value) {
        Ast.Expression e = Ast.unwrap(value);
        if (e instanceof Ast.Literal lit) {
            return lit.kind() != Ast.LiteralKind.NULL
                    && !(lit.kind() == Ast.LiteralKind.STRING && ((String) lit.value()).isEmpty());
        }
        if (e instanceof Ast.TemplateLiteral tpl) {
            return !tpl.expressions().isEmpty() || !tpl.quasis().get(0).isEmpty();
        }
        if (e instanceof Ast.ObjectLiteral obj) {
            return !obj.properties().isEmpty();
        }
        if (e instanceof Ast.ArrayLiteral arr) {
            return !arr.elements().isEmpty();
        }
        return false;
    }

    private void checkPrimitiveRegistration(FlowContext context, List<Diagnostic> errors) {
        String available = String.join(", ", context.catalog().classNames());
        for (FlowContext.PrimitiveInstantiation inst : context.instantiations()) {
            if (!inst.registered()) {
                errors.add(FlowDiagnostic.UNREGISTERED_PRIMITIVE.at(context.source(), inst.expression(),
                        inst.className(), available));
            } else if (!inst.imported()) {
                errors.add(FlowDiagnostic.UNIMPORTED_PRIMITIVE.at(context.source(), inst.expression(),
                        inst.localName(), coreModule()));
            }
        }
    }

    private String coreModule() {
        return properties.getCoreModules().get(0);
    }
}
