package ru.aritmos.flowanalyzer.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.catalog.PrimitiveCatalog;
import ru.aritmos.flowanalyzer.extraction.BubbleParameterRecord;
import ru.aritmos.flowanalyzer.extraction.ExtractedParameter;
import ru.aritmos.flowanalyzer.extraction.ParameterKind;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.FlowSource;
import ru.aritmos.flowanalyzer.syntax.FlowSyntaxException;
import ru.aritmos.flowanalyzer.types.ParameterContractChecker;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Сужение требований AI-агента к учётным данным.
 * <p>
 * Из всех LLM-провайдеров остаются только провайдеры основной и резервной модели ({@code model.model},
 * {@code model.backupModel.model} в формате {@code provider/name}). Без параметра {@code model} агент работает на
 * модели по умолчанию (Gemini). Модель, заданная выражением, или неизвестный провайдер сужения не дают.
 * Дополнительно собираются учётные данные инструментов из {@code tools[].name}.
 */
final class AgentCredentialNarrower {

    private static final Logger log = LoggerFactory.getLogger(AgentCredentialNarrower.class);

    static final String AGENT_PRIMITIVE = "ai-agent";

    static final String DEFAULT_MODEL_CREDENTIAL = "GOOGLE_GEMINI_CRED";

    private static final Map<String, String> PROVIDER_CREDENTIALS = Map.of(
            "openai", "OPENAI_CRED",
            "google", "GOOGLE_GEMINI_CRED",
            "anthropic", "ANTHROPIC_CRED",
            "openrouter", "OPENROUTER_CRED");

    private AgentCredentialNarrower() {
        // утилитарный класс
    }

    /**
     * Требования агента: объявленные виды, суженные по моделям, плюс учётные данные инструментов.
     */
    static Set<String> requirements(BubbleParameterRecord record, Set<String> declared, PrimitiveCatalog catalog) {
        Set<String> out = new LinkedHashSet<>();
        Set<String> models = modelCredentials(record);
        for (String kind : declared) {
            if (models == null || models.contains(kind)) {
                out.add(kind);
            }
        }
        out.addAll(toolCredentials(record, catalog));
        return out;
    }

    /**
     * Виды учётных данных моделей агента или {@code null}, если модель статически не определяется.
     */
    static Set<String> modelCredentials(BubbleParameterRecord record) {
        ExtractedParameter model = record.parameter("model").orElse(null);
        if (model == null) {
            return Set.of(DEFAULT_MODEL_CREDENTIAL);
        }
        Ast.ObjectLiteral literal = model.kind() == ParameterKind.OBJECT
                && parseLiteral(model.sourceText()) instanceof Ast.ObjectLiteral o ? o : null;
        if (literal == null) {
            return null;
        }
        Map<String, Ast.Node> props = ParameterContractChecker.suppliedProperties(literal);
        String primary = ParameterContractChecker.stringLiteral(ParameterContractChecker.valueOf(props.get("model")));
        String primaryKind = providerCredential(primary);
        if (primaryKind == null) {
            return null;
        }
        Set<String> out = new LinkedHashSet<>();
        out.add(primaryKind);
        Ast.Expression backup = ParameterContractChecker.valueOf(props.get("backupModel"));
        if (backup != null && Ast.unwrap(backup) instanceof Ast.ObjectLiteral backupLiteral) {
            Map<String, Ast.Node> backupProps = ParameterContractChecker.suppliedProperties(backupLiteral);
            String backupModel = ParameterContractChecker.stringLiteral(
                    ParameterContractChecker.valueOf(backupProps.get("model")));
            if (backupModel != null) {
                String backupKind = providerCredential(backupModel);
                if (backupKind == null) {
                    return null;
                }
                out.add(backupKind);
            }
        }
        return out;
    }

    /**
     * Учётные данные инструментов, перечисленных литералами в {@code tools}.
     */
    static Set<String> toolCredentials(BubbleParameterRecord record, PrimitiveCatalog catalog) {
        Set<String> out = new LinkedHashSet<>();
        ExtractedParameter tools = record.parameter("tools").orElse(null);
        if (tools == null || tools.kind() != ParameterKind.ARRAY) {
            return out;
        }
        if (!(parseLiteral(tools.sourceText()) instanceof Ast.ArrayLiteral array)) {
            return out;
        }
        for (Ast.Expression element : array.elements()) {
            if (element == null || !(Ast.unwrap(element) instanceof Ast.ObjectLiteral tool)) {
                continue;
            }
            String name = ParameterContractChecker.stringLiteral(
                    ParameterContractChecker.valueOf(ParameterContractChecker.suppliedProperties(tool).get("name")));
            if (name == null) {
                continue;
            }
            catalog.findByName(name).ifPresentOrElse(
                    definition -> out.addAll(definition.credentialsFor(null)),
                    () -> log.debug("Инструмент агента {} отсутствует в каталоге", name));
        }
        return out;
    }

    static String providerCredential(String modelName) {
        if (modelName == null) {
            return null;
        }
        int slash = modelName.indexOf('/');
        if (slash <= 0) {
            return null;
        }
        return PROVIDER_CREDENTIALS.get(modelName.substring(0, slash).toLowerCase(Locale.ROOT));
    }

    private static Ast.Expression parseLiteral(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            List<Ast.Statement> body = FlowSource.parse("(" + text + ");").program().body();
            if (body.size() == 1 && body.get(0) instanceof Ast.ExpressionStatement statement) {
                return Ast.unwrap(statement.expression());
            }
            return null;
        } catch (FlowSyntaxException e) {
            log.debug("Значение параметра агента не разобрано как литерал: {}", e.getMessage());
            return null;
        }
    }
}
