package ru.aritmos.discharge.qa;

import org.junit.jupiter.api.Test;
import ru.aritmos.discharge.clinical.ClinicalContext;
import ru.aritmos.discharge.core.AuditTrail;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.generation.PromptContract;
import ru.aritmos.discharge.redaction.PiiRedactor;
import ru.aritmos.discharge.safety.SafetyValidator;
import ru.aritmos.discharge.support.RecordingAuditTrail;
import ru.aritmos.discharge.support.ScriptedModelClient;
import ru.aritmos.discharge.support.TestClinicalData;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class QaEngineTest {

    private final ScriptedModelClient model = new ScriptedModelClient();
    private final RecordingAuditTrail audit = new RecordingAuditTrail();
    private final QaEngine engine = new QaEngine(
            TestClinicalData.assembler(TestClinicalData.store()),
            new PiiRedactor(TestClinicalData.objectMapper()),
            new PromptContract(TestClinicalData.objectMapper(), TestClinicalData.properties()),
            model,
            new SafetyValidator(TestClinicalData.properties()),
            audit,
            TestClinicalData.properties(),
            TestClinicalData.CLOCK);

    @Test
    void answer_shouldRejectBlankOrOversizedQuestionWithoutCallingModel() {
        DischargeAssistException blank = assertThrows(DischargeAssistException.class,
                () -> engine.answer(TestClinicalData.PATIENT_1, "   ", 1L));
        DischargeAssistException tooLong = assertThrows(DischargeAssistException.class,
                () -> engine.answer(TestClinicalData.PATIENT_1, "why ".repeat(600), 1L));

        assertEquals(DischargeAssistException.ErrorKind.INVALID_QUESTION, blank.kind());
        assertEquals(DischargeAssistException.ErrorKind.INVALID_QUESTION, tooLong.kind());
        assertEquals(0, model.calls());
    }

    @Test
    void answer_shouldGroundSourcesAndRehydrateAnswer() {
        model.reply(TestClinicalData.answerJson("PATIENT_NAME, keep taking Lisinopril every morning.", 0.9,
                List.of("discharge_medications", "current_medications", "allergies", "made_up_section", "vital_signs"),
                List.of("Lisinopril"), true));

        QaExchange exchange = engine.answer(TestClinicalData.PATIENT_1, "Should I keep taking my blood pressure pills?", 1L);

        assertEquals("Margaret Holloway, keep taking Lisinopril every morning.", exchange.answer());
        assertEquals(List.of("discharge_medications", "current_medications", "allergies"), exchange.sources());
        assertEquals(0.9, exchange.confidence(), 1e-9);
        assertTrue(exchange.safetyFlags().isEmpty());
        assertNotNull(exchange.disclaimer());
        assertEquals("record", exchange.contextMode());
        assertEquals(1L, exchange.medicalRecordId());
        assertEquals(TestClinicalData.CLOCK.instant(), exchange.answeredAt());
        assertEquals(1, model.calls());
    }

    @Test
    void answer_shouldOmitDisclaimerForRoutineGroundedAnswer() {
        model.reply(TestClinicalData.answerJson("Follow a regular diabetic diet and drink plenty of fluids.", 0.8,
                List.of("discharge_instructions", "medical_history", "diagnoses"), List.of(), true));

        QaExchange exchange = engine.answer(TestClinicalData.PATIENT_1, "What should I eat at home?", 1L);

        assertEquals(0.8, exchange.confidence(), 1e-9);
        assertTrue(exchange.safetyFlags().isEmpty());
        assertNull(exchange.disclaimer());
    }

    @Test
    void answer_shouldMarkUngroundedAnswerAsLowConfidence() {
        model.reply(TestClinicalData.answerJson("Light walking is fine.", 0.9, List.of(), List.of(), true));

        QaExchange exchange = engine.answer(TestClinicalData.PATIENT_1, "Can I go for a walk?", 1L);

        assertEquals(0.3, exchange.confidence(), 1e-9);
        assertEquals(List.of("low-confidence"), exchange.safetyFlags());
        assertNotNull(exchange.disclaimer());
    }

    @Test
    void answer_shouldFlagOutOfScopeQuestionWithoutBlocking() {
        model.reply(TestClinicalData.answerJson("Your records do not cover travel plans.", 0.6,
                List.of("allergies"), List.of(), false));

        QaExchange exchange = engine.answer(TestClinicalData.PATIENT_1, "Can I fly to Spain next month?", 1L);

        assertEquals(0.32, exchange.confidence(), 1e-9);
        assertEquals(List.of("out-of-scope-request", "low-confidence"), exchange.safetyFlags());
        assertTrue(exchange.disclaimer().startsWith("This question goes beyond"));
        assertTrue(exchange.disclaimer().contains("911"));
    }

    @Test
    void answer_shouldBlockAllergyConflictAfterSingleCall() {
        model.reply(TestClinicalData.answerJson("You can take Amoxicillin for the cough.", 0.9,
                List.of("allergies"), List.of("Amoxicillin"), true));

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> engine.answer(TestClinicalData.PATIENT_1, "What antibiotic can I take?", 1L));

        assertEquals(DischargeAssistException.ErrorKind.UNSAFE_GENERATION_BLOCKED, e.kind());
        assertEquals(1, model.calls());
        assertTrue(audit.events().isEmpty());
    }

    @Test
    void answer_shouldFailOnMalformedAnswerWithoutRetry() {
        model.reply("I think you should rest.");

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> engine.answer(TestClinicalData.PATIENT_1, "Can I rest?", 1L));

        assertEquals(DischargeAssistException.ErrorKind.GENERATION_FAILED, e.kind());
        assertEquals(1, model.calls());
    }

    @Test
    void answer_shouldPropagateUnavailableModel() {
        model.fail(DischargeAssistException.serviceUnavailable("AI_UNAVAILABLE", "down", null));

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> engine.answer(TestClinicalData.PATIENT_2, "When is my follow-up?", null));

        assertEquals(DischargeAssistException.ErrorKind.SERVICE_UNAVAILABLE, e.kind());
        assertEquals("AI_UNAVAILABLE", e.errorCode());
    }

    @Test
    void answer_shouldUseComprehensiveContextWithoutRecord() {
        model.reply(TestClinicalData.answerJson("You were treated for an asthma exacerbation.", 0.7,
                List.of("diagnoses", "treatment_summary"), List.of(), true));

        QaExchange exchange = engine.answer(TestClinicalData.PATIENT_2, "Why was I in the hospital?", null);

        assertEquals("comprehensive", exchange.contextMode());
        assertNull(exchange.medicalRecordId());
        assertEquals(0.63, exchange.confidence(), 1e-9);
        assertTrue(model.requests().get(0).userPrompt().contains("comprehensive"));
    }

    @Test
    void answer_shouldNotRehydrateValuesThatOnlyAppearInQuestion() {
        model.always(request -> {
            Matcher m = Pattern.compile("PHONE_\\d+").matcher(request.userPrompt());
            String questionToken = null;
            while (m.find()) {
                questionToken = m.group();
            }
            return TestClinicalData.answerJson("Please call " + questionToken + " to reach the clinic.", 0.8,
                    List.of("discharge_instructions", "diagnoses", "medical_history"), List.of(), true);
        });

        QaExchange exchange = engine.answer(TestClinicalData.PATIENT_1, "Can I call 555-777-1234 if I feel tired?", 1L);

        String prompt = model.requests().get(0).userPrompt();
        assertFalse(prompt.contains("555-777-1234"));
        assertFalse(exchange.answer().contains("555-777-1234"));
        assertTrue(exchange.answer().matches("Please call PHONE_\\d+ to reach the clinic\\."));
    }

    @Test
    void answer_shouldRedactQuestionAndAuditOnlyPreview() {
        model.reply(TestClinicalData.answerJson("Yes, PATIENT_NAME.", 0.8,
                List.of("discharge_instructions", "diagnoses", "medical_history"), List.of(), true));
        String question = "This is Margaret Holloway, phone 555-201-3344. " + "Is it normal to feel tired after discharge? ".repeat(5);

        QaExchange exchange = engine.answer(TestClinicalData.PATIENT_1, question, 1L);

        String prompt = model.requests().get(0).userPrompt();
        assertFalse(prompt.contains("Margaret"));
        assertFalse(prompt.contains("555-201-3344"));
        assertTrue(prompt.contains("This is PATIENT_NAME, phone PHONE_1."));
        assertEquals("Yes, Margaret Holloway.", exchange.answer());

        RecordingAuditTrail.Event event = audit.events().get(0);
        assertEquals(AuditTrail.ActivityType.QUESTION_ASKED, event.type());
        String preview = (String) event.details().get("questionPreview");
        assertFalse(preview.contains("Margaret"));
        assertTrue(preview.length() <= QaEngine.PREVIEW_LENGTH + 3);
        assertEquals("record", event.details().get("contextMode"));
        assertEquals(List.of(), event.details().get("safetyFlags"));
    }

    @Test
    void confidence_shouldScaleBySourcesAndPenalizeFindings() {
        assertEquals(0.3, QaEngine.confidence(0.9, 0, 0), 1e-9);
        assertEquals(0.2, QaEngine.confidence(0.4, 0, 0), 1e-9);
        assertEquals(0.56, QaEngine.confidence(0.8, 1, 0), 1e-9);
        assertEquals(0.62, QaEngine.confidence(0.8, 2, 1), 1e-9);
        assertEquals(1.0, QaEngine.confidence(1.0, 5, 0), 1e-9);
        assertEquals(0.0, QaEngine.confidence(0.1, 1, 2), 1e-9);
    }

    @Test
    void groundedSources_shouldAcceptLooseSpellingAndDropEmptySections() {
        ClinicalContext ctx = TestClinicalData.assembler(TestClinicalData.store())
                .assembleForRecord(TestClinicalData.PATIENT_1, 1L);

        List<String> sources = QaEngine.groundedSources(
                List.of("Lab Results", "lab-results", "vital_signs", "timeline", "Allergies"), ctx);

        assertEquals(List.of("lab_results", "allergies"), sources);
    }

    @Test
    void needsDisclaimer_shouldDetectDosingEmergencyAndDiagnosisTopics() {
        assertTrue(QaEngine.needsDisclaimer("Can I take an extra dose tonight?"));
        assertTrue(QaEngine.needsDisclaimer("I have chest pain"));
        assertTrue(QaEngine.needsDisclaimer("My cough is getting worse"));
        assertFalse(QaEngine.needsDisclaimer("What should I eat?"));
        assertFalse(QaEngine.needsDisclaimer(null));
    }
}
