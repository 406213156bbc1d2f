package ru.aritmos.flowanalyzer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.catalog.PrimitiveCatalog;
import ru.aritmos.flowanalyzer.catalog.PrimitiveCatalogStore;
import ru.aritmos.flowanalyzer.credentials.CredentialResolver;
import ru.aritmos.flowanalyzer.extraction.BubbleParameterRecord;
import ru.aritmos.flowanalyzer.extraction.ExtractionResult;
import ru.aritmos.flowanalyzer.extraction.ParameterExtractor;
import ru.aritmos.flowanalyzer.normalize.ControlFlowNormalizer;
import ru.aritmos.flowanalyzer.types.TypeResolver;
import ru.aritmos.flowanalyzer.validation.FlowContext;
import ru.aritmos.flowanalyzer.validation.StructuralValidator;
import ru.aritmos.flowanalyzer.validation.ValidationResult;

import java.util.Map;
import java.util.Set;

/**
 * Фасад конвейера анализа flow.
 * <p>
 * Операции:
 * <ul>
 *   <li>{@link #validate(String)} — структурные правила, проверка типов и lint;</li>
 *   <li>{@link #extract(String)} — валидация плюс модель параметров, требования к учётным данным,
 *   JSON Schema входного payload и тип события-триггера;</li>
 *   <li>{@link #normalize(String)} — однострочные тела операторов в блоки;</li>
 *   <li>{@link #injectCredentials(String, Map)} — извлечение плюс внедрение значений учётных данных.</li>
 * </ul>
 * Все операции синхронны и не хранят состояния между вызовами; каталог примитивов берётся из
 * {@link PrimitiveCatalogStore}.
 */
@Singleton
public class FlowAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FlowAnalysisService.class);

    private final StructuralValidator validator;
    private final TypeResolver typeResolver;
    private final ParameterExtractor extractor;
    private final CredentialResolver credentialResolver;
    private final ControlFlowNormalizer normalizer;
    private final PrimitiveCatalogStore catalogStore;

    public FlowAnalysisService(StructuralValidator validator,
                               TypeResolver typeResolver,
                               ParameterExtractor extractor,
                               CredentialResolver credentialResolver,
                               ControlFlowNormalizer normalizer,
                               PrimitiveCatalogStore catalogStore) {
        this.validator = validator;
        this.typeResolver = typeResolver;
        this.extractor = extractor;
        this.credentialResolver = credentialResolver;
        this.normalizer = normalizer;
        this.catalogStore = catalogStore;
    }

    public ValidationResult validate(String code) {
        ValidationResult result = validator.validate(code, catalogStore.getCatalog());
        log.debug("Валидация flow завершена: valid={}, errors={}", result.valid(), result.errors().size());
        return result;
    }

    /**
     * Валидация и извлечение.
     * <p>
     * При невалидном коде возвращается результат с ошибками и пустыми картами.
     */
    public ExtractionResult extract(String code) {
        PrimitiveCatalog catalog = catalogStore.getCatalog();
        StructuralValidator.Analysis analysis = validator.analyze(code, catalog);
        if (!analysis.result().valid()) {
            log.debug("Извлечение пропущено: код flow не прошёл валидацию ({} ошибок)",
                    analysis.result().errors().size());
            return ExtractionResult.failed(analysis.result());
        }
        FlowContext context = analysis.context();
        Map<Integer, BubbleParameterRecord> records = extractor.extract(context);
        Map<String, Set<String>> credentials = credentialResolver.resolveRequirements(records.values(), catalog);
        ObjectNode inputSchema = typeResolver.inputSchema(context);
        String trigger = context.triggerEventType();
        log.info("Извлечение flow завершено: primitives={}, credentialKinds={}, trigger={}",
                records.size(), credentials.keySet(), trigger);
        return new ExtractionResult(true, analysis.result().errors(), records, credentials, inputSchema, trigger);
    }

    public String normalize(String code) {
        return normalizer.normalize(code);
    }

    /**
     * Извлечь параметры и внедрить значения учётных данных.
     *
     * @param credentials значения по виду учётных данных (например {@code SLACK_CRED -> token})
     */
    public ExtractionResult injectCredentials(String code, Map<String, String> credentials) {
        return injectCredentials(extract(code), credentials);
    }

    /**
     * Внедрить значения учётных данных в уже полученный результат извлечения.
     */
    public ExtractionResult injectCredentials(ExtractionResult extraction, Map<String, String> credentials) {
        if (!extraction.valid()) {
            return extraction;
        }
        Map<Integer, BubbleParameterRecord> injected = credentialResolver.injectCredentials(
                extraction.bubbleParameters(), extraction.requiredCredentials(), credentials);
        return new ExtractionResult(true, extraction.errors(), injected, extraction.requiredCredentials(),
                extraction.inputSchema(), extraction.triggerEventType());
    }
}
