package ru.aritmos.flowanalyzer.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.core.io.ResourceResolver;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.config.FlowAnalyzerProperties;

import java.io.InputStream;
import java.util.Optional;

/**
 * Хранилище каталога примитивов.
 * <p>
 * Каталог загружается один раз при старте из ресурса {@code flowanalyzer.catalog.path}
 * (по умолчанию {@code classpath:catalog/primitives.json}) и далее только читается.
 * Отсутствующий или битый каталог — ошибка конфигурации: сервис не стартует.
 */
@Singleton
public class PrimitiveCatalogStore {

    private static final Logger log = LoggerFactory.getLogger(PrimitiveCatalogStore.class);

    private final ResourceResolver resourceResolver;
    private final ObjectMapper objectMapper;
    private final String path;

    private volatile PrimitiveCatalog catalog;

    public PrimitiveCatalogStore(ResourceResolver resourceResolver,
                                 ObjectMapper objectMapper,
                                 FlowAnalyzerProperties properties) {
        this.resourceResolver = resourceResolver;
        this.objectMapper = objectMapper;
        this.path = properties.getCatalog().getPath();
    }

    @PostConstruct
    void init() {
        this.catalog = load();
        log.info("Каталог примитивов загружен: path={}, primitives={}", path, catalog.size());
    }

    /**
     * @return каталог (никогда не {@code null} после init)
     */
    public PrimitiveCatalog getCatalog() {
        PrimitiveCatalog current = catalog;
        if (current == null) {
            current = load();
            catalog = current;
        }
        return current;
    }

    private PrimitiveCatalog load() {
        Optional<InputStream> stream = resourceResolver.getResourceAsStream(path);
        if (stream.isEmpty()) {
            throw new IllegalStateException("Не найден каталог примитивов: " + path);
        }
        try (InputStream in = stream.get()) {
            return PrimitiveCatalog.read(in, objectMapper);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Некорректный каталог примитивов " + path + ": " + e.getMessage(), e);
        }
    }
}
