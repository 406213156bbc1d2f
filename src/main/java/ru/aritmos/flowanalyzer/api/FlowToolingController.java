package ru.aritmos.flowanalyzer.api;

import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Consumes;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.security.annotation.Secured;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.flowanalyzer.FlowAnalysisService;
import ru.aritmos.flowanalyzer.extraction.ExtractionResult;
import ru.aritmos.flowanalyzer.validation.ValidationResult;

import java.util.Map;

/**
 * Инструменты редактора flow.
 * <p>
 * Доступ по bearer-токену с ролью {@code FLOW_EDITOR} или {@code FLOW_ADMIN}; внедрение учётных данных
 * возвращает их значения в ответе, поэтому доступно только {@code FLOW_ADMIN}.
 */
@Secured({"FLOW_EDITOR", "FLOW_ADMIN"})
@Controller("/admin/flow-tooling")
@Tag(name = "Flow Tooling", description = "Валидация, извлечение параметров и нормализация кода flow для редактора")
public class FlowToolingController {

    private final FlowAnalysisService analysisService;

    public FlowToolingController(FlowAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @Post("/validate")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Проверить код flow: структура, типы параметров примитивов, lint")
    public ValidationResult validate(@Body CodeRequest request) {
        return analysisService.validate(request == null ? null : request.code());
    }

    @Post("/extract")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Проверить код flow и извлечь параметры примитивов, учётные данные и схему payload")
    public ExtractionResult extract(@Body CodeRequest request) {
        return analysisService.extract(request == null ? null : request.code());
    }

    @Post("/normalize")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Обернуть однострочные тела if/for/while в блоки")
    public CodeResponse normalize(@Body CodeRequest request) {
        return new CodeResponse(analysisService.normalize(request == null ? null : request.code()));
    }

    @Secured("FLOW_ADMIN")
    @Post("/inject-credentials")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Извлечь параметры и внедрить значения учётных данных по видам")
    public ExtractionResult injectCredentials(@Body CredentialsRequest request) {
        if (request == null) {
            return analysisService.extract(null);
        }
        return analysisService.injectCredentials(request.code(), request.credentials());
    }

    public record CodeRequest(String code) {
    }

    public record CodeResponse(String code) {
    }

    public record CredentialsRequest(String code, Map<String, String> credentials) {
    }
}
