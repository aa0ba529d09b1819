package ru.aritmos.discharge.qa;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.discharge.clinical.ClinicalContext;
import ru.aritmos.discharge.clinical.ClinicalContextAssembler;
import ru.aritmos.discharge.clinical.ContextSection;
import ru.aritmos.discharge.config.DischargeProperties;
import ru.aritmos.discharge.core.AuditTrail;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.core.SensitiveDataSanitizer;
import ru.aritmos.discharge.generation.GenerativeModelClient;
import ru.aritmos.discharge.generation.ParsedGeneration;
import ru.aritmos.discharge.generation.PromptContract;
import ru.aritmos.discharge.generation.QaDocument;
import ru.aritmos.discharge.redaction.PiiRedactor;
import ru.aritmos.discharge.redaction.RedactedContext;
import ru.aritmos.discharge.safety.SafetyFlag;
import ru.aritmos.discharge.safety.SafetyValidator;
import ru.aritmos.discharge.safety.SafetyVerdict;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ответы на вопросы пациента с проверкой безопасности, оценкой уверенности и указанием источников.
 * <p>
 * Ровно одно обращение к модели на вопрос. Недоступность модели, некорректный ответ и блокировка
 * возвращаются как ошибки; «запасной» ответ не подставляется.
 */
@Singleton
public class QaEngine {

    private static final Logger log = LoggerFactory.getLogger(QaEngine.class);

    static final int PREVIEW_LENGTH = 100;

    private static final Pattern DOSING = Pattern.compile(
            "(?i)\\b(dose|doses|dosage|dosing|mg|mcg|how much|how many|overdose|missed|extra pill|pills?|tablets?)\\b");
    private static final Pattern EMERGENCY = Pattern.compile(
            "(?i)\\b(emergency|emergencies|911|chest pain|can't breathe|cannot breathe|trouble breathing|shortness of breath|"
                    + "bleeding|unconscious|faint\\w*|seizure|stroke|heart attack|severe)\\b");
    private static final Pattern DIAGNOSIS_CHANGE = Pattern.compile(
            "(?i)\\b(diagnos\\w*|new symptom\\w*|getting worse|worsen\\w*|condition chang\\w*|relapse|recurr\\w*)\\b");

    private final ClinicalContextAssembler assembler;
    private final PiiRedactor redactor;
    private final PromptContract contract;
    private final GenerativeModelClient modelClient;
    private final SafetyValidator validator;
    private final AuditTrail auditTrail;
    private final DischargeProperties.Qa config;
    private final Clock clock;

    @Inject
    public QaEngine(ClinicalContextAssembler assembler,
                    PiiRedactor redactor,
                    PromptContract contract,
                    GenerativeModelClient modelClient,
                    SafetyValidator validator,
                    AuditTrail auditTrail,
                    DischargeProperties properties) {
        this(assembler, redactor, contract, modelClient, validator, auditTrail, properties, Clock.systemUTC());
    }

    public QaEngine(ClinicalContextAssembler assembler,
                    PiiRedactor redactor,
                    PromptContract contract,
                    GenerativeModelClient modelClient,
                    SafetyValidator validator,
                    AuditTrail auditTrail,
                    DischargeProperties properties,
                    Clock clock) {
        this.assembler = assembler;
        this.redactor = redactor;
        this.contract = contract;
        this.modelClient = modelClient;
        this.validator = validator;
        this.auditTrail = auditTrail;
        this.config = properties.getQa();
        this.clock = clock;
    }

    /**
     * Ответить на вопрос.
     *
     * @param patientId идентификатор пациента
     * @param question вопрос
     * @param medicalRecordId запись (контекст одной записи) или null (полная история)
     * @return ответ
     */
    public QaExchange answer(String patientId, String question, Long medicalRecordId) {
        String q = validateQuestion(question);

        ClinicalContext context = medicalRecordId != null
                ? assembler.assembleForRecord(patientId, medicalRecordId)
                : assembler.assembleComprehensive(patientId);

        RedactedContext redacted = redactor.redact(context);
        // Значения из вопроса получают токены только в копии: регидратация знает лишь значения контекста.
        String redactedQuestion = redactor.redactText(q, redacted.mapping().copy());

        String raw = modelClient.generate(contract.questionRequest(redacted, redactedQuestion));
        ParsedGeneration<QaDocument> parsed = contract.parseAnswer(raw);
        if (!parsed.isValid()) {
            log.warn("Некорректный ответ модели на вопрос: patientId={} reason={}", patientId, parsed.malformedReason());
            throw DischargeAssistException.generationFailed("Модель вернула некорректный ответ: " + parsed.malformedReason());
        }
        QaDocument doc = parsed.document();

        SafetyVerdict verdict = validator.validateAnswer(doc, context);
        if (verdict.isBlocked()) {
            log.warn("Ответ заблокирован проверкой безопасности: patientId={} findings={}", patientId, verdict.describe());
            throw DischargeAssistException.unsafeBlocked("Ответ заблокирован проверкой безопасности", verdict.describe());
        }

        List<String> sources = groundedSources(doc.sources(), context);
        double confidence = confidence(doc.confidence(), sources.size(), verdict.findings().size());

        List<String> flags = new ArrayList<>(verdict.flags().stream().map(SafetyFlag::kind).toList());
        if (confidence < config.getLowConfidenceThreshold()) {
            flags.add(SafetyFlag.LOW_CONFIDENCE.kind());
        }

        String answer = redactor.rehydrate(doc.answer(), redacted.mapping());
        List<String> related = doc.relatedTopics().stream()
                .map(t -> redactor.rehydrate(t, redacted.mapping()))
                .toList();

        String disclaimer = null;
        if (!flags.isEmpty() || needsDisclaimer(q) || needsDisclaimer(answer)) {
            disclaimer = disclaimer(context, flags);
        }

        QaExchange exchange = new QaExchange(
                patientId,
                q,
                answer,
                confidence,
                flags,
                sources,
                disclaimer,
                related,
                doc.medicationsMentioned(),
                context.mode().name().toLowerCase(Locale.ROOT),
                context.medicalRecordId(),
                clock.instant()
        );

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("questionPreview", SensitiveDataSanitizer.preview(redactedQuestion, PREVIEW_LENGTH));
        details.put("contextMode", exchange.contextMode());
        details.put("confidence", Math.round(confidence * 100) / 100.0);
        details.put("safetyFlags", flags);
        auditTrail.record(patientId, AuditTrail.ActivityType.QUESTION_ASKED, details);
        log.info("Ответ на вопрос сформирован: patientId={} mode={} confidence={} flags={}",
                patientId, exchange.contextMode(), exchange.confidence(), flags);
        return exchange;
    }

    private String validateQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw DischargeAssistException.invalidQuestion("Вопрос не должен быть пустым");
        }
        String q = question.trim();
        if (q.length() > config.getMaxQuestionLength()) {
            throw DischargeAssistException.invalidQuestion(
                    "Вопрос длиннее допустимого (" + config.getMaxQuestionLength() + " символов)");
        }
        return q;
    }

    /**
     * Источники, которые модель заявила и которые реально присутствуют и непусты в контексте.
     */
    static List<String> groundedSources(List<String> declared, ClinicalContext context) {
        Set<ContextSection> available = context.availableSections();
        Set<String> out = new LinkedHashSet<>();
        for (String d : declared) {
            ContextSection.fromWire(d)
                    .filter(available::contains)
                    .ifPresent(s -> out.add(s.wireName()));
        }
        return new ArrayList<>(out);
    }

    /**
     * Уверенность = уверенность модели × коэффициент обоснованности − 0.1 за каждое нарушение, в [0,1].
     */
    static double confidence(double modelConfidence, int groundedSources, int findings) {
        double c;
        if (groundedSources == 0) {
            c = Math.min(modelConfidence * 0.5, 0.3);
        } else if (groundedSources == 1) {
            c = modelConfidence * 0.7;
        } else if (groundedSources == 2) {
            c = modelConfidence * 0.9;
        } else {
            c = modelConfidence;
        }
        c -= 0.1 * findings;
        return Math.max(0.0, Math.min(1.0, c));
    }

    static boolean needsDisclaimer(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return DOSING.matcher(text).find() || EMERGENCY.matcher(text).find() || DIAGNOSIS_CHANGE.matcher(text).find();
    }

    private static String disclaimer(ClinicalContext context, List<String> flags) {
        String emergencyPhone = context.careTeamContacts().stream()
                .filter(c -> "emergency".equals(c.role()))
                .map(ClinicalContext.CareContact::phone)
                .findFirst()
                .orElse("emergency services");
        StringBuilder sb = new StringBuilder();
        if (flags.contains(SafetyFlag.OUT_OF_SCOPE_REQUEST.kind())) {
            sb.append("This question goes beyond the information in your medical records. ");
        }
        sb.append("This answer is for information only and is not a substitute for advice from your healthcare provider. ")
                .append("Contact your care team before changing any medication or treatment. ")
                .append("If you think you are having an emergency, call ").append(emergencyPhone).append(" immediately.");
        return sb.toString();
    }
}
