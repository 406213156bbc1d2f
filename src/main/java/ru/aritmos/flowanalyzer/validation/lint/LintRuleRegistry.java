package ru.aritmos.flowanalyzer.validation.lint;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Реестр lint-правил.
 * <p>
 * Состав правил фиксирован, включение/выключение — через {@code flowanalyzer.lint.*}.
 * Правило, упавшее с исключением, логируется и пропускается: остальные правила продолжают работу.
 */
@Singleton
public class LintRuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(LintRuleRegistry.class);

    private final boolean enabled;
    private final List<LintRule> rules;

    @Inject
    public LintRuleRegistry(FlowAnalyzerProperties properties) {
        this(properties.getLint().isEnabled(), defaultRules(properties), Set.copyOf(properties.getLint().getDisabledRules()));
    }

    LintRuleRegistry(boolean enabled, List<LintRule> rules, Set<String> disabled) {
        this.enabled = enabled;
        this.rules = rules.stream().filter(r -> !disabled.contains(r.name())).toList();
    }

    /**
     * Все встроенные правила в порядке выполнения.
     */
    public static List<LintRule> defaultRules(FlowAnalyzerProperties properties) {
        return List.of(
                new NoBulkEnvAccessRule(),
                new MaxMethodComplexityRule(properties.getLint().getMaxComplexity()),
                new NoMethodInvocationInComplexExpressionRule(),
                new NoDynamicCodeRule(),
                new RequireCronScheduleRule(),
                new NoDirectInstantiationInHandleRule()
        );
    }

    /**
     * Набор правил с явным списком выключенных (для тестов и встраивания).
     */
    public static LintRuleRegistry of(List<LintRule> rules, Set<String> disabled) {
        return new LintRuleRegistry(true, rules, disabled);
    }

    public List<String> activeRuleNames() {
        return enabled ? rules.stream().map(LintRule::name).toList() : List.of();
    }

    public List<Diagnostic> run(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        if (!enabled) {
            return out;
        }
        for (LintRule rule : rules) {
            try {
                out.addAll(rule.check(context));
            } catch (RuntimeException e) {
                log.warn("Lint-правило {} завершилось ошибкой и пропущено: {}", rule.name(), e.getMessage(), e);
            }
        }
        return out;
    }
}
