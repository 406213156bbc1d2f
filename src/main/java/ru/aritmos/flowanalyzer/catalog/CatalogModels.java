package ru.aritmos.flowanalyzer.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Модели каталога примитивов (bubble).
 * <p>
 * Каталог поставляется извне (JSON-ресурс) и после загрузки не меняется.
 */
public final class CatalogModels {

    private CatalogModels() {
        // утилитарный класс
    }

    /**
     * Корневой документ каталога.
     */
    public record CatalogDocument(String version, List<PrimitiveDefinition> primitives) {
        public CatalogDocument {
            primitives = primitives == null ? List.of() : List.copyOf(primitives);
        }
    }

    /**
     * Описание поля контракта параметров.
     *
     * @param type        {@code string}, {@code number}, {@code boolean}, {@code object}, {@code array},
     *                    {@code enum} или {@code any}
     * @param required    обязательность
     * @param description описание для UI
     * @param values      допустимые значения для {@code enum}
     * @param items       спецификация элементов для {@code array}
     * @param properties  вложенные поля для {@code object}; пустая карта — объект без ограничений
     */
    public record FieldSpec(String type,
                            boolean required,
                            String description,
                            List<String> values,
                            FieldSpec items,
                            Map<String, FieldSpec> properties) {
        public FieldSpec {
            type = type == null || type.isBlank() ? "any" : type.trim();
            values = values == null ? List.of() : List.copyOf(values);
            properties = properties == null ? Map.of() : new LinkedHashMap<>(properties);
        }

        public static FieldSpec of(String type, boolean required) {
            return new FieldSpec(type, required, null, List.of(), null, Map.of());
        }

        /**
         * Тип в нотации TypeScript — для текста диагностик.
         */
        public String displayType() {
            return switch (type) {
                case "enum" -> values.stream().map(v -> "\"" + v + "\"").collect(Collectors.joining(" | "));
                case "array" -> (items == null ? "unknown" : items.displayType()) + "[]";
                case "object" -> properties.isEmpty() ? "Record<string, unknown>" : "object";
                default -> type;
            };
        }
    }

    /**
     * Вариант tagged-union контракта (операция).
     *
     * @param credentials виды учётных данных, требуемые операцией; {@code null} — как у примитива
     */
    public record OperationVariant(String description,
                                   Map<String, FieldSpec> fields,
                                   List<String> credentials) {
        public OperationVariant {
            fields = fields == null ? Map.of() : new LinkedHashMap<>(fields);
            credentials = credentials == null ? null : List.copyOf(credentials);
        }
    }

    /**
     * Контракт параметров примитива: либо плоский набор полей, либо tagged union по полю-дискриминатору.
     */
    public record ParameterContract(String discriminator,
                                    Map<String, FieldSpec> fields,
                                    Map<String, OperationVariant> variants) {
        public ParameterContract {
            fields = fields == null ? Map.of() : new LinkedHashMap<>(fields);
            variants = variants == null ? Map.of() : new LinkedHashMap<>(variants);
        }

        public boolean isTaggedUnion() {
            return discriminator != null && !discriminator.isBlank() && !variants.isEmpty();
        }

        public List<String> variantNames() {
            return List.copyOf(variants.keySet());
        }

        /**
         * Поля, проверяемые для данной операции: общие поля контракта плюс поля варианта.
         */
        public Map<String, FieldSpec> fieldsFor(String operation) {
            Map<String, FieldSpec> out = new LinkedHashMap<>(fields);
            if (isTaggedUnion() && operation != null) {
                OperationVariant variant = variants.get(operation);
                if (variant != null) {
                    out.putAll(variant.fields());
                }
            }
            return out;
        }
    }

    /**
     * Элемент каталога.
     *
     * @param name        стабильное имя примитива (ключ требований к учётным данным)
     * @param className   имя класса, которое инстанцируется в коде flow
     * @param nodeType    {@code service}, {@code tool} или {@code workflow}
     * @param credentials виды учётных данных уровня примитива
     */
    public record PrimitiveDefinition(String name,
                                      String className,
                                      String displayName,
                                      String nodeType,
                                      String description,
                                      ParameterContract contract,
                                      List<String> credentials) {
        public PrimitiveDefinition {
            nodeType = nodeType == null || nodeType.isBlank() ? "service" : nodeType;
            contract = contract == null ? new ParameterContract(null, Map.of(), Map.of()) : contract;
            credentials = credentials == null ? List.of() : List.copyOf(credentials);
        }

        /**
         * Виды учётных данных для операции.
         * <p>
         * Вариант без собственного списка наследует список примитива. Если операция не определена
         * (или неизвестна) у tagged-union примитива — объединение по всем вариантам.
         */
        public Set<String> credentialsFor(String operation) {
            Set<String> out = new LinkedHashSet<>();
            if (!contract.isTaggedUnion()) {
                out.addAll(credentials);
                return out;
            }
            OperationVariant variant = operation == null ? null : contract.variants().get(operation);
            if (variant != null) {
                out.addAll(variant.credentials() == null ? credentials : variant.credentials());
                return out;
            }
            out.addAll(credentials);
            for (OperationVariant v : contract.variants().values()) {
                if (v.credentials() != null) {
                    out.addAll(v.credentials());
                }
            }
            return out;
        }

        public List<String> allCredentialKinds() {
            return new ArrayList<>(credentialsFor(null));
        }
    }
}
