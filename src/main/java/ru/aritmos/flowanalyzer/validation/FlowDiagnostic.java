package ru.aritmos.flowanalyzer.validation;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.FlowSource;

/**
 * Каталог встроенных диагностик: стабильный код и шаблон текста.
 */
public enum FlowDiagnostic {

    EMPTY_SOURCE("FLOW_000", "Code cannot be empty"),
    SYNTAX_ERROR("FLOW_001", "%s"),

    MISSING_FLOW_CLASS("FLOW_100", "Code must contain a class that extends %s"),
    MULTIPLE_FLOW_CLASSES("FLOW_101", "Code must contain exactly one class that extends %s, but found %d: %s"),
    UNRESOLVED_BASE_CLASS("FLOW_102", "Cannot find name '%s'. Import it from '%s'."),
    NON_LITERAL_TRIGGER_TYPE("FLOW_103", "Type argument of '%s' must be a trigger event key literal. Expected one of: %s"),
    INVALID_TRIGGER_TYPE("FLOW_104", "Type '%s' does not satisfy the constraint 'keyof BubbleTriggerEventRegistry'. Expected one of: %s"),

    MISSING_ENTRY_METHOD("FLOW_110", "Non-abstract class '%s' does not implement inherited abstract member '%s' from class '%s'."),
    ENTRY_METHOD_NOT_METHOD("FLOW_111", "Class '%s' defines instance member function '%s', but extended class '%s' defines it as instance member property."),
    ENTRY_METHOD_SIGNATURE("FLOW_112", "Property '%s' in type '%s' is not assignable to the same property in base type '%s'. Target signature provides too few arguments. Expected %d or more, but got 1."),

    THROW_IN_ENTRY_METHOD("FLOW_120", "throw statements are not allowed directly in handle method. Move error handling into another step."),

    NESTED_METHOD_CALL("FLOW_130", "Method '%s' cannot be called from another method. It is called from '%s', but only '%s' may invoke other methods of the flow."),

    LITERAL_CREDENTIALS("FLOW_140", "credentials parameter is not allowed in bubble instantiation. Credentials should be injected at runtime, not passed as parameters."),

    UNREGISTERED_PRIMITIVE("FLOW_150", "Class '%s' is not registered in the primitive catalog. Available classes: %s"),
    UNIMPORTED_PRIMITIVE("FLOW_151", "Cannot find name '%s'. Import it from '%s'."),

    UNKNOWN_PARAMETER("FLOW_200", "Object literal may only specify known properties, and '%s' does not exist in type '%s'."),
    MISSING_PARAMETER("FLOW_201", "Property '%s' is missing in type '{ %s }' but required in type '%s'."),
    PARAMETER_TYPE_MISMATCH("FLOW_202", "Type '%s' is not assignable to type '%s'. Parameter '%s' of %s."),
    MISSING_DISCRIMINATOR("FLOW_203", "Property '%s' is missing in parameters of %s. Expected one of: %s"),
    UNKNOWN_DISCRIMINATOR("FLOW_204", "Invalid %s '%s' for %s. Expected one of: %s"),
    NON_LITERAL_DISCRIMINATOR("FLOW_205", "Property '%s' of %s must be a string literal so the variant can be resolved statically."),

    UNKNOWN_PAYLOAD_PROPERTY("FLOW_210", "Property '%s' does not exist on type '%s'.");

    private final String code;
    private final String template;

    FlowDiagnostic(String code, String template) {
        this.code = code;
        this.template = template;
    }

    public String code() {
        return code;
    }

    public String format(Object... args) {
        return args.length == 0 ? template : String.format(template, args);
    }

    public Diagnostic create(Object... args) {
        return Diagnostic.of(code, format(args));
    }

    public Diagnostic at(FlowSource source, Ast.Node node, Object... args) {
        return Diagnostic.at(code, format(args), source, node);
    }
}
