package ru.aritmos.discharge.instructions;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.discharge.clinical.ClinicalContext;
import ru.aritmos.discharge.clinical.ClinicalContextAssembler;
import ru.aritmos.discharge.clinical.ClinicalModels;
import ru.aritmos.discharge.core.AuditTrail;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.generation.GenerationRequest;
import ru.aritmos.discharge.generation.GenerativeModelClient;
import ru.aritmos.discharge.generation.ParsedGeneration;
import ru.aritmos.discharge.generation.PromptContract;
import ru.aritmos.discharge.redaction.PiiRedactor;
import ru.aritmos.discharge.redaction.RedactedContext;
import ru.aritmos.discharge.safety.SafetyFlag;
import ru.aritmos.discharge.safety.SafetyValidator;
import ru.aritmos.discharge.safety.SafetyVerdict;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Синтез персональных выписных инструкций.
 * <p>
 * Порядок: сборка контекста → кэш/коалесцер → редактирование ПДн → генерация (один повтор при
 * некорректном ответе) → проверка безопасности (один повтор при блокировке) → регидратация →
 * пересборка экстренных контактов из структурированных данных.
 */
@Singleton
public class InstructionSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(InstructionSynthesizer.class);

    private static final String EMERGENCY_WHEN_TO_CALL =
            "Call immediately for chest pain, trouble breathing, fainting or any life-threatening symptom";
    private static final String FACILITY_WHEN_TO_CALL =
            "Call with questions about your care, medications or follow-up appointments";
    private static final String PERSONAL_WHEN_TO_CALL =
            "Let them know if you need help or your condition changes";

    private final ClinicalContextAssembler assembler;
    private final PiiRedactor redactor;
    private final PromptContract contract;
    private final GenerativeModelClient modelClient;
    private final SafetyValidator validator;
    private final GenerationCoalescer coalescer;
    private final AuditTrail auditTrail;
    private final Clock clock;

    @Inject
    public InstructionSynthesizer(ClinicalContextAssembler assembler,
                                  PiiRedactor redactor,
                                  PromptContract contract,
                                  GenerativeModelClient modelClient,
                                  SafetyValidator validator,
                                  GenerationCoalescer coalescer,
                                  AuditTrail auditTrail) {
        this(assembler, redactor, contract, modelClient, validator, coalescer, auditTrail, Clock.systemUTC());
    }

    public InstructionSynthesizer(ClinicalContextAssembler assembler,
                                  PiiRedactor redactor,
                                  PromptContract contract,
                                  GenerativeModelClient modelClient,
                                  SafetyValidator validator,
                                  GenerationCoalescer coalescer,
                                  AuditTrail auditTrail,
                                  Clock clock) {
        this.assembler = assembler;
        this.redactor = redactor;
        this.contract = contract;
        this.modelClient = modelClient;
        this.validator = validator;
        this.coalescer = coalescer;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    /**
     * Получить инструкции для пациента и записи.
     *
     * @param patientId идентификатор пациента
     * @param medicalRecordId запись или null (самая свежая запись с эпикризом)
     * @return инструкции, прошедшие проверку безопасности
     */
    public InstructionModels.PersonalizedInstructions synthesize(String patientId, Long medicalRecordId) {
        ClinicalContext context = assembler.assembleForRecord(patientId, medicalRecordId);
        GenerationKey key = new GenerationKey(patientId, context.medicalRecordId());
        return coalescer.getOrGenerate(key, context.sourceVersion(), () -> generate(context));
    }

    InstructionModels.PersonalizedInstructions generate(ClinicalContext context) {
        RedactedContext redacted = redactor.redact(context);
        GenerationRequest base = contract.instructionsRequest(redacted);

        List<String> extraInstructions = new ArrayList<>();
        boolean malformedRetried = false;
        boolean unsafeRetried = false;
        while (true) {
            GenerationRequest request = base;
            for (String extra : extraInstructions) {
                request = request.withAppendedInstruction(extra);
            }

            String raw = modelClient.generate(request);
            ParsedGeneration<InstructionModels.InstructionDocument> parsed = contract.parseInstructions(raw);
            if (!parsed.isValid()) {
                if (malformedRetried) {
                    log.warn("Модель повторно вернула некорректный документ: patientId={} reason={}",
                            context.patientId(), parsed.malformedReason());
                    throw DischargeAssistException.generationFailed(
                            "Модель вернула некорректный документ инструкций: " + parsed.malformedReason());
                }
                log.info("Некорректный ответ модели, повтор: patientId={} reason={}", context.patientId(), parsed.malformedReason());
                malformedRetried = true;
                extraInstructions.add(PromptContract.correctiveInstruction(parsed.malformedReason()));
                continue;
            }

            SafetyVerdict verdict = validator.validateInstructions(parsed.document(), context);
            if (verdict.isBlocked()) {
                if (unsafeRetried) {
                    log.warn("Инструкции повторно заблокированы проверкой безопасности: patientId={} findings={}",
                            context.patientId(), verdict.describe());
                    throw DischargeAssistException.unsafeBlocked(
                            "Сгенерированные инструкции заблокированы проверкой безопасности", verdict.describe());
                }
                log.info("Инструкции заблокированы, повтор с усиленными ограничениями: patientId={}", context.patientId());
                unsafeRetried = true;
                extraInstructions.add(PromptContract.safetyReinforcement(verdict.describe()));
                continue;
            }

            return finish(context, redacted, parsed.document(), verdict);
        }
    }

    private InstructionModels.PersonalizedInstructions finish(ClinicalContext context,
                                                              RedactedContext redacted,
                                                              InstructionModels.InstructionDocument document,
                                                              SafetyVerdict verdict) {
        InstructionModels.InstructionDocument doc = document.mapText(s -> redactor.rehydrate(s, redacted.mapping()));
        List<String> warnings = new ArrayList<>();

        List<InstructionModels.MedicationEntry> meds = new ArrayList<>();
        int position = 0;
        for (InstructionModels.MedicationEntry m : doc.medicationSchedule()) {
            position++;
            if (m.isEmpty()) {
                warnings.add("Удалена пустая позиция графика приёма препаратов #" + position);
            } else {
                meds.add(m);
            }
        }

        List<InstructionModels.EmergencyContactEntry> contacts = emergencyContacts(context, doc, redacted, warnings);
        List<String> flags = verdict.flags().stream().map(SafetyFlag::kind).toList();
        warnings.addAll(verdict.describe());

        InstructionModels.PersonalizedInstructions result = new InstructionModels.PersonalizedInstructions(
                context.patientId(),
                context.medicalRecordId(),
                meds,
                doc.lifestyleRecommendations(),
                doc.followUpReminders(),
                doc.warningSigns(),
                doc.activityGuidelines(),
                doc.dietRecommendations(),
                doc.woundCareInstructions(),
                contacts,
                doc.summary(),
                flags,
                warnings,
                clock.instant(),
                context.sourceVersion()
        );

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("medicalRecordId", context.medicalRecordId());
        details.put("sourceVersion", context.sourceVersion());
        details.put("medications", meds.size());
        details.put("safetyFlags", flags);
        auditTrail.record(context.patientId(), AuditTrail.ActivityType.INSTRUCTION_GENERATED, details);
        log.info("Инструкции сгенерированы: patientId={} medicalRecordId={} flags={}",
                context.patientId(), context.medicalRecordId(), flags);
        return result;
    }

    /**
     * Экстренные контакты из конфигурации и карточки пациента. Контакты, предложенные моделью,
     * сверяются по телефону: неизвестные отбрасываются с предупреждением.
     */
    private List<InstructionModels.EmergencyContactEntry> emergencyContacts(ClinicalContext context,
                                                                            InstructionModels.InstructionDocument doc,
                                                                            RedactedContext redacted,
                                                                            List<String> warnings) {
        List<InstructionModels.EmergencyContactEntry> out = new ArrayList<>();
        Set<String> knownPhones = new HashSet<>();
        for (ClinicalContext.CareContact c : context.careTeamContacts()) {
            String whenToCall = "emergency".equals(c.role()) ? EMERGENCY_WHEN_TO_CALL : FACILITY_WHEN_TO_CALL;
            String relationship = "emergency".equals(c.role()) ? "Emergency services" : "Care team";
            out.add(new InstructionModels.EmergencyContactEntry(c.name(), relationship, c.phone(), whenToCall));
            knownPhones.add(digits(c.phone()));
        }
        ClinicalModels.EmergencyContact ec = context.identity() == null ? null : context.identity().emergencyContact();
        if (ec != null && ec.name() != null && !ec.name().isBlank() && ec.phone() != null && !ec.phone().isBlank()) {
            out.add(new InstructionModels.EmergencyContactEntry(ec.name(), ec.relationship(), ec.phone(), PERSONAL_WHEN_TO_CALL));
            knownPhones.add(digits(ec.phone()));
        }

        for (InstructionModels.EmergencyContactEntry proposed : doc.emergencyContacts()) {
            String phone = redactor.rehydrate(proposed.phone(), redacted.mapping());
            if (phone == null || !knownPhones.contains(digits(phone))) {
                warnings.add("Отброшен экстренный контакт, телефон которого отсутствует в данных пациента");
            }
        }
        return out;
    }

    private static String digits(String phone) {
        return phone == null ? "" : phone.replaceAll("\\D", "");
    }
}
