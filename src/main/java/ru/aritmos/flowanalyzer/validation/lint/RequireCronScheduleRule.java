package ru.aritmos.flowanalyzer.validation.lint;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.types.ParameterContractChecker;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Flow с триггером {@code schedule/cron} обязан объявить свойство {@code cronSchedule}, инициализированное
 * строковым литералом с корректным cron-выражением из пяти полей.
 */
public final class RequireCronScheduleRule implements LintRule {

    public static final String NAME = "require-cron-schedule";
    public static final String CRON_EVENT = "schedule/cron";
    public static final String PROPERTY = "cronSchedule";

    private static final String[] FIELD_NAMES = {"minute", "hour", "day of month", "month", "day of week"};
    private static final int[][] RANGES = {{0, 59}, {0, 23}, {1, 31}, {1, 12}, {0, 6}};

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        Ast.ClassDeclaration cls = context.flowClass();
        if (cls == null || !CRON_EVENT.equals(context.triggerEventType())) {
            return out;
        }
        Ast.PropertyDeclaration property = null;
        for (Ast.ClassMember member : cls.members()) {
            if (member instanceof Ast.PropertyDeclaration p && PROPERTY.equals(p.name())) {
                property = p;
                break;
            }
        }
        if (property == null || property.initializer() == null) {
            out.add(diagnostic(context, property == null ? cls : property,
                    "BubbleFlow with 'schedule/cron' event type must define a readonly cronSchedule property. "
                            + "Example: readonly cronSchedule = '0 0 * * *';"));
            return out;
        }
        String expression = ParameterContractChecker.stringLiteral(property.initializer());
        if (expression == null) {
            out.add(diagnostic(context, property.initializer(),
                    "cronSchedule must be initialized with a string literal, not a variable or expression"));
            return out;
        }
        String error = validateCron(expression);
        if (error != null) {
            out.add(diagnostic(context, property.initializer(),
                    "cronSchedule must be a string literal containing a valid 5-part cron expression. " + error));
        }
        return out;
    }

    /**
     * Проверка cron-выражения.
     *
     * @return текст ошибки или {@code null}, если выражение корректно
     */
    static String validateCron(String expression) {
        String trimmed = expression.trim();
        String[] parts = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        if (parts.length != 5) {
            return "Cron expression must have exactly 5 parts (minute hour day month day-of-week), got "
                    + parts.length;
        }
        for (int i = 0; i < parts.length; i++) {
            String error = validateField(parts[i], RANGES[i][0], RANGES[i][1], FIELD_NAMES[i]);
            if (error != null) {
                return error;
            }
        }
        return null;
    }

    private static String validateField(String field, int min, int max, String fieldName) {
        if ("*".equals(field)) {
            return null;
        }
        if (field.startsWith("*/")) {
            Integer step = parse(field.substring(2));
            return step == null || step <= 0 ? "Invalid step value in " + fieldName + ": " + field : null;
        }
        if (field.contains(",")) {
            for (String part : field.split(",", -1)) {
                String error = validateField(part.trim(), min, max, fieldName);
                if (error != null) {
                    return "Invalid value in " + fieldName + " list: " + part.trim()
                            + " (must be " + min + "-" + max + ")";
                }
            }
            return null;
        }
        String base = field;
        int slash = field.indexOf('/');
        if (slash > 0) {
            Integer step = parse(field.substring(slash + 1));
            if (step == null || step <= 0) {
                return "Invalid step value in " + fieldName + ": " + field;
            }
            base = field.substring(0, slash);
        }
        if (base.contains("-")) {
            String[] bounds = base.split("-", -1);
            Integer start = bounds.length == 2 ? parse(bounds[0]) : null;
            Integer end = bounds.length == 2 ? parse(bounds[1]) : null;
            if (start == null || end == null || start < min || end > max || start > end) {
                return "Invalid range in " + fieldName + ": " + field + " (must be " + min + "-" + max + ")";
            }
            return null;
        }
        Integer value = parse(base);
        if (value == null || value < min || value > max) {
            return "Invalid " + fieldName + ": " + field + " (must be " + min + "-" + max + ")";
        }
        return null;
    }

    private static Integer parse(String text) {
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
