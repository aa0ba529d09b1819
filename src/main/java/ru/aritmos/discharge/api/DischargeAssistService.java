package ru.aritmos.discharge.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.inject.Singleton;
import ru.aritmos.discharge.clinical.SafeSummaryService;
import ru.aritmos.discharge.generation.GenerativeModelClient;
import ru.aritmos.discharge.instructions.GenerationCoalescer;
import ru.aritmos.discharge.instructions.GenerationKey;
import ru.aritmos.discharge.instructions.InstructionModels;
import ru.aritmos.discharge.instructions.InstructionSynthesizer;
import ru.aritmos.discharge.qa.QaEngine;
import ru.aritmos.discharge.qa.QaExchange;

/**
 * Фасад ядра для UI/API.
 */
@Singleton
public class DischargeAssistService {

    private final InstructionSynthesizer synthesizer;
    private final QaEngine qaEngine;
    private final SafeSummaryService safeSummaryService;
    private final GenerationCoalescer coalescer;
    private final GenerativeModelClient modelClient;

    public DischargeAssistService(InstructionSynthesizer synthesizer,
                                  QaEngine qaEngine,
                                  SafeSummaryService safeSummaryService,
                                  GenerationCoalescer coalescer,
                                  GenerativeModelClient modelClient) {
        this.synthesizer = synthesizer;
        this.qaEngine = qaEngine;
        this.safeSummaryService = safeSummaryService;
        this.coalescer = coalescer;
        this.modelClient = modelClient;
    }

    public InstructionModels.PersonalizedInstructions generateInstructions(String patientId, Long medicalRecordId) {
        return synthesizer.synthesize(patientId, medicalRecordId);
    }

    /**
     * Вопрос в контексте записи (или полной истории, если запись не указана).
     */
    public QaExchange askQuestion(String patientId, String question, Long medicalRecordId) {
        return qaEngine.answer(patientId, question, medicalRecordId);
    }

    /**
     * Вопрос в контексте полной истории пациента.
     */
    public QaExchange askQuestionEnhanced(String patientId, String question) {
        return qaEngine.answer(patientId, question, null);
    }

    public SafeSummaryService.SafeSummary safeSummary(String patientId) {
        return safeSummaryService.summarize(patientId);
    }

    /**
     * Сбросить кэш инструкций пациента (или одной записи).
     */
    public void invalidate(String patientId, Long medicalRecordId) {
        if (medicalRecordId == null) {
            coalescer.invalidatePatient(patientId);
        } else {
            coalescer.invalidate(new GenerationKey(patientId, medicalRecordId));
        }
    }

    public AppStatus status() {
        return new AppStatus(modelClient.isConfigured(), coalescer.size());
    }

    @Schema(description = "Состояние ядра.")
    public record AppStatus(
            @Schema(description = "Сконфигурирована ли генеративная модель")
            boolean aiConfigured,
            @Schema(description = "Количество записей кэша инструкций")
            int cachedInstructions
    ) {
    }
}
