package ru.aritmos.flowanalyzer.credentials;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.catalog.CatalogModels.PrimitiveDefinition;
import ru.aritmos.flowanalyzer.catalog.PrimitiveCatalog;
import ru.aritmos.flowanalyzer.extraction.BubbleParameterRecord;
import ru.aritmos.flowanalyzer.extraction.ExtractedParameter;
import ru.aritmos.flowanalyzer.extraction.ParameterKind;
import ru.aritmos.flowanalyzer.extraction.SemanticType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Требования к учётным данным и их внедрение в записи параметров.
 * <p>
 * Требования считаются по имени примитива, а не по {@code variableId}: значение внедряется во все
 * инстанцирования данного примитива одинаково. Значения учётных данных в лог не попадают.
 */
@Singleton
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    /** Имя параметра, в который внедряются учётные данные. */
    public static final String CREDENTIALS_PARAMETER = "credentials";

    /**
     * Виды учётных данных, требуемые использованными операциями, по имени примитива.
     * <p>
     * Примитивы без учётных данных в результат не попадают. Для AI-агента учитываются только провайдеры
     * указанных моделей и инструменты из {@code tools}.
     */
    public Map<String, Set<String>> resolveRequirements(Collection<BubbleParameterRecord> records,
                                                        PrimitiveCatalog catalog) {
        Map<String, Set<String>> out = new LinkedHashMap<>();
        if (records == null) {
            return out;
        }
        for (BubbleParameterRecord record : records) {
            PrimitiveDefinition definition = catalog.findByName(record.primitiveName())
                    .or(() -> catalog.findByClassName(record.className()))
                    .orElse(null);
            if (definition == null) {
                log.warn("Примитив {} отсутствует в каталоге, требования к учётным данным не определены",
                        record.primitiveName());
                continue;
            }
            Set<String> kinds = definition.credentialsFor(record.operation());
            if (AgentCredentialNarrower.AGENT_PRIMITIVE.equals(definition.name())) {
                kinds = AgentCredentialNarrower.requirements(record, kinds, catalog);
            }
            if (kinds.isEmpty()) {
                continue;
            }
            out.computeIfAbsent(definition.name(), k -> new LinkedHashSet<>()).addAll(kinds);
        }
        return out;
    }

    /**
     * Внедрить значения учётных данных.
     * <p>
     * Для каждой записи, чей примитив есть в {@code requirements}, параметр {@code credentials} создаётся
     * (или заменяется) нередактируемым значением — подмножеством {@code credentialValues} по требуемым видам.
     * Запись, для которой не нашлось ни одного значения, остаётся без изменений. Исходные записи не меняются.
     *
     * @return новые записи в том же порядке
     */
    public Map<Integer, BubbleParameterRecord> injectCredentials(Map<Integer, BubbleParameterRecord> records,
                                                                 Map<String, Set<String>> requirements,
                                                                 Map<String, String> credentialValues) {
        Map<Integer, BubbleParameterRecord> out = new LinkedHashMap<>();
        if (records == null) {
            return out;
        }
        Map<String, Set<String>> reqs = requirements == null ? Map.of() : requirements;
        Map<String, String> values = credentialValues == null ? Map.of() : credentialValues;

        for (Map.Entry<Integer, BubbleParameterRecord> e : records.entrySet()) {
            BubbleParameterRecord record = e.getValue();
            Set<String> kinds = reqs.get(record.primitiveName());
            if (kinds == null || kinds.isEmpty()) {
                out.put(e.getKey(), record);
                continue;
            }
            Map<String, String> subset = new LinkedHashMap<>();
            for (String kind : kinds) {
                String value = values.get(kind);
                if (value != null) {
                    subset.put(kind, value);
                }
            }
            if (subset.isEmpty()) {
                log.debug("Для примитива {} (variableId={}) значения учётных данных не переданы",
                        record.primitiveName(), record.variableId());
                out.put(e.getKey(), record);
                continue;
            }
            out.put(e.getKey(), record.withParameters(withCredentials(record.parameters(), subset)));
            log.info("Внедрены учётные данные: primitive={}, variableId={}, credentials={}",
                    record.primitiveName(), record.variableId(), SensitiveDataSanitizer.maskCredentials(subset));
        }
        return out;
    }

    private static List<ExtractedParameter> withCredentials(List<ExtractedParameter> parameters,
                                                            Map<String, String> subset) {
        ExtractedParameter credentials = new ExtractedParameter(
                CREDENTIALS_PARAMETER,
                ParameterKind.OBJECT,
                Map.copyOf(subset),
                null,
                SemanticType.STRUCTURED,
                false,
                null);
        List<ExtractedParameter> out = new ArrayList<>();
        boolean replaced = false;
        for (ExtractedParameter p : parameters) {
            if (CREDENTIALS_PARAMETER.equals(p.name())) {
                out.add(credentials);
                replaced = true;
            } else {
                out.add(p);
            }
        }
        if (!replaced) {
            out.add(credentials);
        }
        return out;
    }
}
