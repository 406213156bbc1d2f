package ru.aritmos.flowanalyzer.types;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.validation.Diagnostic;
import ru.aritmos.flowanalyzer.validation.FlowContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка типов flow: параметры примитивов по контрактам каталога и обращения к payload
 * по объявленному типу. Также строит JSON Schema входного payload.
 */
@Singleton
public class TypeResolver {

    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    private final ObjectMapper objectMapper;

    public TypeResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Диагностики типов: сначала контракты параметров (в порядке инстанцирований), затем payload.
     */
    public List<Diagnostic> check(FlowContext context) {
        List<Diagnostic> out = new ArrayList<>();
        out.addAll(new ParameterContractChecker(context.source()).check(context));
        out.addAll(new PayloadAccessChecker(context.source(), new TypeShapeResolver(context)).check(context));
        if (!out.isEmpty()) {
            log.debug("Проверка типов: найдено ошибок {}", out.size());
        }
        return out;
    }

    /**
     * JSON Schema входного payload или {@code null}, если собственный тип payload не объявлен.
     */
    public ObjectNode inputSchema(FlowContext context) {
        return new InputSchemaBuilder(objectMapper).build(context, new TypeShapeResolver(context));
    }
}
