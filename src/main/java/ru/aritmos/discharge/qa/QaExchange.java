package ru.aritmos.discharge.qa;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Результат ответа на вопрос пациента. История диалога не хранится.
 */
@Schema(description = "Ответ на вопрос пациента с оценкой уверенности, источниками и флагами безопасности.")
public record QaExchange(
        @JsonProperty("patient_id")
        String patientId,
        String question,
        String answer,
        @Schema(description = "Уверенность в диапазоне [0,1] с учётом обоснованности и флагов безопасности.")
        double confidence,
        @JsonProperty("safety_flags")
        List<String> safetyFlags,
        @Schema(description = "Разделы контекста пациента, на которых основан ответ.")
        List<String> sources,
        String disclaimer,
        @JsonProperty("related_topics")
        List<String> relatedTopics,
        @JsonProperty("medications_mentioned")
        List<String> medicationsMentioned,
        @JsonProperty("context_mode")
        String contextMode,
        @JsonProperty("medical_record_id")
        Long medicalRecordId,
        @JsonProperty("answered_at")
        Instant answeredAt
) {
    public QaExchange {
        safetyFlags = safetyFlags == null ? List.of() : List.copyOf(safetyFlags);
        sources = sources == null ? List.of() : List.copyOf(sources);
        relatedTopics = relatedTopics == null ? List.of() : List.copyOf(relatedTopics);
        medicationsMentioned = medicationsMentioned == null ? List.of() : List.copyOf(medicationsMentioned);
    }
}
