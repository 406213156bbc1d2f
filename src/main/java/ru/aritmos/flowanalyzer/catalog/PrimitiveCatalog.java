package ru.aritmos.flowanalyzer.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Неизменяемый реестр примитивов с поиском по имени и по имени класса.
 */
public final class PrimitiveCatalog {

    private final Map<String, CatalogModels.PrimitiveDefinition> byName;
    private final Map<String, CatalogModels.PrimitiveDefinition> byClassName;

    private PrimitiveCatalog(List<CatalogModels.PrimitiveDefinition> primitives) {
        Map<String, CatalogModels.PrimitiveDefinition> names = new LinkedHashMap<>();
        Map<String, CatalogModels.PrimitiveDefinition> classes = new LinkedHashMap<>();
        for (CatalogModels.PrimitiveDefinition p : primitives) {
            if (p.name() == null || p.name().isBlank() || p.className() == null || p.className().isBlank()) {
                throw new IllegalStateException("Primitive definition must declare name and className: " + p);
            }
            if (names.putIfAbsent(p.name(), p) != null) {
                throw new IllegalStateException("Duplicate primitive name in catalog: " + p.name());
            }
            if (classes.putIfAbsent(p.className(), p) != null) {
                throw new IllegalStateException("Duplicate primitive class in catalog: " + p.className());
            }
        }
        this.byName = Map.copyOf(names);
        this.byClassName = classes;
    }

    public static PrimitiveCatalog of(List<CatalogModels.PrimitiveDefinition> primitives) {
        return new PrimitiveCatalog(primitives == null ? List.of() : primitives);
    }

    public static PrimitiveCatalog empty() {
        return of(List.of());
    }

    /**
     * Прочитать каталог из JSON.
     *
     * @throws IOException при ошибке чтения или разбора
     */
    public static PrimitiveCatalog read(InputStream in, ObjectMapper objectMapper) throws IOException {
        CatalogModels.CatalogDocument document = objectMapper
                .readerFor(CatalogModels.CatalogDocument.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .readValue(in);
        return of(document.primitives());
    }

    public Optional<CatalogModels.PrimitiveDefinition> findByName(String name) {
        return Optional.ofNullable(name == null ? null : byName.get(name));
    }

    public Optional<CatalogModels.PrimitiveDefinition> findByClassName(String className) {
        return Optional.ofNullable(className == null ? null : byClassName.get(className));
    }

    public boolean containsClass(String className) {
        return className != null && byClassName.containsKey(className);
    }

    /**
     * Имена классов в порядке каталога — для текста диагностики «Available classes».
     */
    public List<String> classNames() {
        return List.copyOf(byClassName.keySet());
    }

    public Collection<CatalogModels.PrimitiveDefinition> all() {
        return List.copyOf(byClassName.values());
    }

    public int size() {
        return byClassName.size();
    }
}
