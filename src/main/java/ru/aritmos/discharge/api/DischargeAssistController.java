package ru.aritmos.discharge.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.discharge.core.CorrelationContext;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.core.SensitiveDataSanitizer;
import ru.aritmos.discharge.instructions.InstructionModels;
import ru.aritmos.discharge.qa.QaExchange;

import java.util.function.Supplier;

/**
 * HTTP API ядра выписных инструкций и Q&A (используется UI).
 * <p>
 * Ошибки ядра возвращаются телом {@link ErrorResponse} с санитизированным сообщением и correlationId.
 */
@Controller("/api")
@Tag(name = "Discharge Assist", description = "Персональные выписные инструкции и ответы на вопросы пациента.")
public class DischargeAssistController {

    private static final Logger log = LoggerFactory.getLogger(DischargeAssistController.class);

    private final DischargeAssistService service;

    public DischargeAssistController(DischargeAssistService service) {
        this.service = service;
    }

    @Post(uri = "/generate-instructions/{patientId}", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Сгенерировать персональные выписные инструкции",
            description = "Повторный вызов для тех же данных возвращает закэшированный результат. "
                    + "Одновременные вызовы для одной записи приводят к одной генерации.")
    @ApiResponse(responseCode = "200", description = "Инструкции", content = @Content(schema = @Schema(implementation = InstructionModels.PersonalizedInstructions.class)))
    @ApiResponse(responseCode = "404", description = "Пациент или запись не найдены")
    @ApiResponse(responseCode = "422", description = "Нет выписного эпикриза или содержимое заблокировано проверкой безопасности")
    @ApiResponse(responseCode = "502", description = "Модель дважды вернула некорректный документ")
    @ApiResponse(responseCode = "503", description = "Модель недоступна")
    public HttpResponse<?> generateInstructions(@PathVariable String patientId,
                                                @Nullable @QueryValue Long medicalRecordId,
                                                @Nullable @Header("X-Correlation-Id") String correlationId,
                                                @Nullable @Header("X-Request-Id") String requestId) {
        return handle(CorrelationContext.resolve(correlationId, requestId),
                () -> service.generateInstructions(patientId, medicalRecordId));
    }

    @Post(uri = "/ask-question/{patientId}", consumes = MediaType.APPLICATION_JSON, produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Задать вопрос по выписным инструкциям",
            description = "Если указан medicalRecordId, ответ строится по одной записи, иначе по полной истории.")
    @ApiResponse(responseCode = "200", description = "Ответ", content = @Content(schema = @Schema(implementation = QaExchange.class)))
    @ApiResponse(responseCode = "400", description = "Пустой или слишком длинный вопрос")
    public HttpResponse<?> askQuestion(@PathVariable String patientId,
                                       @Body QuestionRequest request,
                                       @Nullable @Header("X-Correlation-Id") String correlationId,
                                       @Nullable @Header("X-Request-Id") String requestId) {
        return handle(CorrelationContext.resolve(correlationId, requestId),
                () -> service.askQuestion(patientId,
                        request == null ? null : request.question(),
                        request == null ? null : request.medicalRecordId()));
    }

    @Post(uri = "/ask-question-enhanced/{patientId}", consumes = MediaType.APPLICATION_JSON, produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Задать вопрос по полной истории пациента")
    @ApiResponse(responseCode = "200", description = "Ответ", content = @Content(schema = @Schema(implementation = QaExchange.class)))
    public HttpResponse<?> askQuestionEnhanced(@PathVariable String patientId,
                                               @Body QuestionRequest request,
                                               @Nullable @Header("X-Correlation-Id") String correlationId,
                                               @Nullable @Header("X-Request-Id") String requestId) {
        return handle(CorrelationContext.resolve(correlationId, requestId),
                () -> service.askQuestionEnhanced(patientId, request == null ? null : request.question()));
    }

    @Get(uri = "/patients/{patientId}/safe-summary", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Сводка по пациенту без персональных данных",
            description = "Строится детерминированно, без обращения к модели.")
    public HttpResponse<?> safeSummary(@PathVariable String patientId,
                                       @Nullable @Header("X-Correlation-Id") String correlationId,
                                       @Nullable @Header("X-Request-Id") String requestId) {
        return handle(CorrelationContext.resolve(correlationId, requestId), () -> service.safeSummary(patientId));
    }

    @Delete(uri = "/instructions-cache/{patientId}", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Сбросить кэш инструкций пациента (или одной записи)")
    public HttpResponse<?> invalidate(@PathVariable String patientId,
                                      @Nullable @QueryValue Long medicalRecordId) {
        service.invalidate(patientId, medicalRecordId);
        return HttpResponse.noContent();
    }

    @Get(uri = "/app-status", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Состояние ядра: сконфигурирована ли модель, размер кэша")
    public HttpResponse<DischargeAssistService.AppStatus> status() {
        return HttpResponse.ok(service.status());
    }

    private HttpResponse<?> handle(CorrelationContext correlation, Supplier<?> action) {
        try {
            return HttpResponse.ok(action.get());
        } catch (DischargeAssistException ex) {
            HttpStatus status = statusOf(ex.kind());
            log.warn("Запрос завершился ошибкой: correlationId={} kind={} code={} message={}",
                    correlation.correlationId(), ex.kind(), ex.errorCode(), ex.getMessage());
            return HttpResponse.status(status).body(new ErrorResponse(ex.errorCode(), ex.getMessage(), correlation.correlationId()));
        } catch (Exception ex) {
            String msg = SensitiveDataSanitizer.sanitizeText(ex.getMessage());
            log.error("Непредвиденная ошибка: correlationId={} error={}", correlation.correlationId(), msg, ex);
            return HttpResponse.serverError(new ErrorResponse("INTERNAL_ERROR", "Внутренняя ошибка", correlation.correlationId()));
        }
    }

    static HttpStatus statusOf(DischargeAssistException.ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INCOMPLETE_CONTEXT, UNSAFE_GENERATION_BLOCKED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_QUESTION -> HttpStatus.BAD_REQUEST;
            case MALFORMED_GENERATION, GENERATION_FAILED -> HttpStatus.BAD_GATEWAY;
            case SERVICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    @Schema(description = "Вопрос пациента.")
    public record QuestionRequest(
            @Schema(description = "Текст вопроса (не пустой, ограниченной длины)")
            String question,
            @Nullable
            @Schema(description = "Медицинская запись; если не указана, используется полная история")
            Long medicalRecordId
    ) {
    }

    @Schema(description = "Ошибка ядра.")
    public record ErrorResponse(String errorCode, String message, String correlationId) {
    }
}
