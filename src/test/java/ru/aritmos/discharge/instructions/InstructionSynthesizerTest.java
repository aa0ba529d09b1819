package ru.aritmos.discharge.instructions;

import org.junit.jupiter.api.Test;
import ru.aritmos.discharge.clinical.ClinicalModels;
import ru.aritmos.discharge.clinical.InMemoryClinicalStore;
import ru.aritmos.discharge.core.AuditTrail;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.generation.GenerationRequest;
import ru.aritmos.discharge.generation.PromptContract;
import ru.aritmos.discharge.redaction.PiiRedactor;
import ru.aritmos.discharge.safety.SafetyValidator;
import ru.aritmos.discharge.support.RecordingAuditTrail;
import ru.aritmos.discharge.support.ScriptedModelClient;
import ru.aritmos.discharge.support.TestClinicalData;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InstructionSynthesizerTest {

    private final InMemoryClinicalStore store = TestClinicalData.store();
    private final ScriptedModelClient model = new ScriptedModelClient();
    private final GenerationCoalescer coalescer = new GenerationCoalescer(5000);
    private final RecordingAuditTrail audit = new RecordingAuditTrail();
    private final InstructionSynthesizer synthesizer = new InstructionSynthesizer(
            TestClinicalData.assembler(store),
            new PiiRedactor(TestClinicalData.objectMapper()),
            new PromptContract(TestClinicalData.objectMapper(), TestClinicalData.properties()),
            model,
            new SafetyValidator(TestClinicalData.properties()),
            coalescer,
            audit,
            TestClinicalData.CLOCK);

    @Test
    void synthesize_shouldRehydrateAndRebuildEmergencyContacts() {
        model.reply(TestClinicalData.instructionsJson("Azithromycin", "Lisinopril"));

        InstructionModels.PersonalizedInstructions result = synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L);

        assertEquals(TestClinicalData.PATIENT_1, result.patientId());
        assertEquals(1L, result.medicalRecordId());
        assertEquals("Margaret Holloway, you are recovering well.", result.summary());
        assertEquals("Dr. Alan Pierce", result.followUpReminders().get(0).provider());
        assertEquals(List.of("Rest well, Margaret Holloway"), result.lifestyleRecommendations());
        assertTrue(result.safetyFlags().isEmpty());
        assertTrue(result.validationWarnings().isEmpty());
        assertEquals(TestClinicalData.CLOCK.instant(), result.generatedAt());

        assertEquals(2, result.emergencyContacts().size());
        assertEquals("911", result.emergencyContacts().get(0).phone());
        assertEquals("Emergency services", result.emergencyContacts().get(0).relationship());
        assertEquals("Daniel Holloway", result.emergencyContacts().get(1).name());
        assertEquals("555-201-9988", result.emergencyContacts().get(1).phone());

        RecordingAuditTrail.Event event = audit.events().get(0);
        assertEquals(AuditTrail.ActivityType.INSTRUCTION_GENERATED, event.type());
        assertEquals(1L, event.details().get("medicalRecordId"));
    }

    @Test
    void synthesize_shouldNeverSendIdentityToModel() {
        model.reply(TestClinicalData.instructionsJson("Azithromycin"));

        synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L);

        GenerationRequest request = model.requests().get(0);
        String prompt = request.systemPrompt() + request.userPrompt();
        assertFalse(prompt.contains("Margaret"));
        assertFalse(prompt.contains("Holloway"));
        assertFalse(prompt.contains("555-201-3344"));
        assertFalse(prompt.contains("555-201-9988"));
        assertFalse(prompt.contains("margaret.holloway@example.com"));
        assertFalse(prompt.contains("Alan Pierce"));
    }

    @Test
    void synthesize_shouldReturnCachedResultUntilSourceChanges() {
        model.always(r -> TestClinicalData.instructionsJson("Azithromycin"));

        InstructionModels.PersonalizedInstructions first = synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L);
        InstructionModels.PersonalizedInstructions second = synthesizer.synthesize(TestClinicalData.PATIENT_1, null);
        assertSame(first, second);
        assertEquals(1, model.calls());

        store.putDischargeNote(TestClinicalData.note(1L, TestClinicalData.PATIENT_1, 1L, "Dr. Alan Pierce",
                List.of(TestClinicalData.med("Azithromycin", "500mg")), "2024-02-20T09:00:00Z"));

        InstructionModels.PersonalizedInstructions third = synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L);
        assertNotSame(first, third);
        assertNotEquals(first.sourceVersion(), third.sourceVersion());
        assertEquals(2, model.calls());
    }

    @Test
    void synthesize_shouldBlockAfterSecondUnsafeDocument() {
        model.reply(TestClinicalData.instructionsJson("Amoxicillin"))
                .reply(TestClinicalData.instructionsJson("Amoxicillin"));

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L));

        assertEquals(DischargeAssistException.ErrorKind.UNSAFE_GENERATION_BLOCKED, e.kind());
        assertFalse(e.details().isEmpty());
        assertEquals(2, model.calls());
        assertTrue(model.requests().get(1).userPrompt().contains("rejected by the safety review"));
        assertEquals(0, coalescer.size());
        assertTrue(audit.events().isEmpty());
    }

    @Test
    void synthesize_shouldRecoverWhenRetryIsSafe() {
        model.reply(TestClinicalData.instructionsJson("Amoxicillin"))
                .reply(TestClinicalData.instructionsJson("Azithromycin"));

        InstructionModels.PersonalizedInstructions result = synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L);

        assertEquals("Azithromycin", result.medicationSchedule().get(0).name());
        assertEquals(2, model.calls());
    }

    @Test
    void synthesize_shouldRetryOnceOnMalformedDocument() {
        model.reply("Sure! Here are the instructions: rest and drink water.")
                .reply(TestClinicalData.instructionsJson("Azithromycin"));

        InstructionModels.PersonalizedInstructions result = synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L);

        assertEquals(1, result.medicationSchedule().size());
        assertEquals(2, model.calls());
        assertTrue(model.requests().get(1).userPrompt().contains("could not be used"));
    }

    @Test
    void synthesize_shouldFailAfterSecondMalformedDocument() {
        model.reply("not json").reply("{\"summary\":\"still incomplete\"}");

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L));

        assertEquals(DischargeAssistException.ErrorKind.GENERATION_FAILED, e.kind());
        assertEquals(2, model.calls());
        assertEquals(0, coalescer.size());
    }

    @Test
    void synthesize_shouldPropagateUnavailableModelWithoutCaching() {
        model.fail(DischargeAssistException.serviceUnavailable("AI_TIMEOUT", "timeout", null))
                .reply(TestClinicalData.instructionsJson("Prednisone", "Albuterol"));

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> synthesizer.synthesize(TestClinicalData.PATIENT_2, 2L));
        assertEquals(DischargeAssistException.ErrorKind.SERVICE_UNAVAILABLE, e.kind());
        assertEquals(1, model.calls());
        assertEquals(0, coalescer.size());

        InstructionModels.PersonalizedInstructions result = synthesizer.synthesize(TestClinicalData.PATIENT_2, 2L);
        assertEquals(2L, result.medicalRecordId());
        assertEquals("Robert Nakamura, you are recovering well.", result.summary());
        assertEquals(2, model.calls());
    }

    @Test
    void synthesize_shouldCoalesceConcurrentRequests() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        model.always(r -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TestClinicalData.instructionsJson("Azithromycin");
        });
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<InstructionModels.PersonalizedInstructions> a = pool.submit(() -> synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L));
            Future<InstructionModels.PersonalizedInstructions> b = pool.submit(() -> synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L));
            GenerationKey key = new GenerationKey(TestClinicalData.PATIENT_1, 1L);
            long deadline = System.currentTimeMillis() + 5000;
            while (coalescer.waiters(key) < 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            release.countDown();

            assertSame(a.get(5, TimeUnit.SECONDS), b.get(5, TimeUnit.SECONDS));
            assertEquals(1, model.calls());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void synthesize_shouldDropEmptyMedicationAndUnknownContact() {
        String json = TestClinicalData.instructionsJson("Azithromycin")
                .replace("\"medication_schedule\":[", "\"medication_schedule\":[{\"name\":null,\"dosage\":\"\",\"timing\":null,\"instructions\":\"x\"},")
                .replace("\"phone\":\"CONTACT_1_PHONE\"", "\"phone\":\"555-999-0000\"");
        model.reply(json);

        InstructionModels.PersonalizedInstructions result = synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L);

        assertEquals(1, result.medicationSchedule().size());
        assertTrue(result.validationWarnings().contains("Удалена пустая позиция графика приёма препаратов #1"));
        assertTrue(result.validationWarnings().contains("Отброшен экстренный контакт, телефон которого отсутствует в данных пациента"));
        assertTrue(result.emergencyContacts().stream().noneMatch(c -> "555-999-0000".equals(c.phone())));
    }

    @Test
    void synthesize_shouldAttachFlagsForUntraceableMedication() {
        model.reply(TestClinicalData.instructionsJson("Azithromycin", "Warfarin"));

        InstructionModels.PersonalizedInstructions result = synthesizer.synthesize(TestClinicalData.PATIENT_1, 1L);

        assertEquals(List.of("possible-hallucination"), result.safetyFlags());
        assertTrue(result.validationWarnings().stream().anyMatch(w -> w.startsWith("possible-hallucination:") && w.contains("Warfarin")));
    }

    @Test
    void synthesize_shouldNotCallModelWithoutDischargeNote() {
        store.putMedicalRecord(new ClinicalModels.MedicalRecord(7L, TestClinicalData.PATIENT_2, null, null, "Observation",
                List.of(), List.of(), null, null, null, List.of(), List.of(), "low", null, null));

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> synthesizer.synthesize(TestClinicalData.PATIENT_2, 7L));

        assertEquals(DischargeAssistException.ErrorKind.INCOMPLETE_CONTEXT, e.kind());
        assertEquals(0, model.calls());
    }
}
