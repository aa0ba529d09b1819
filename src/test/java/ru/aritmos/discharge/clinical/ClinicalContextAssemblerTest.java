package ru.aritmos.discharge.clinical;

import org.junit.jupiter.api.Test;
import ru.aritmos.discharge.config.DischargeProperties;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.support.TestClinicalData;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClinicalContextAssemblerTest {

    @Test
    void assembleForRecord_shouldFailWithNotFoundForUnknownPatient() {
        ClinicalContextAssembler assembler = TestClinicalData.assembler(TestClinicalData.store());

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> assembler.assembleForRecord("P999999", null));
        assertEquals(DischargeAssistException.ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void assembleForRecord_shouldNotExposeRecordOfAnotherPatient() {
        ClinicalContextAssembler assembler = TestClinicalData.assembler(TestClinicalData.store());

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> assembler.assembleForRecord(TestClinicalData.PATIENT_1, 2L));
        assertEquals(DischargeAssistException.ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void assembleForRecord_shouldRequireDischargeNote() {
        InMemoryClinicalStore store = TestClinicalData.store();
        store.putMedicalRecord(TestClinicalData.record(3L, TestClinicalData.PATIENT_1, "2024-05-01T08:00:00Z",
                "Ankle sprain", "low", "2024-05-01T10:00:00Z"));
        ClinicalContextAssembler assembler = TestClinicalData.assembler(store);

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> assembler.assembleForRecord(TestClinicalData.PATIENT_1, 3L));
        assertEquals(DischargeAssistException.ErrorKind.INCOMPLETE_CONTEXT, e.kind());
    }

    @Test
    void assembleForRecord_shouldFailWhenPatientHasNoNotes() {
        InMemoryClinicalStore store = InMemoryClinicalStore.empty();
        store.putPatient(TestClinicalData.patient1());
        ClinicalContextAssembler assembler = TestClinicalData.assembler(store);

        DischargeAssistException e = assertThrows(DischargeAssistException.class,
                () -> assembler.assembleForRecord(TestClinicalData.PATIENT_1, null));
        assertEquals(DischargeAssistException.ErrorKind.INCOMPLETE_CONTEXT, e.kind());
    }

    @Test
    void assembleForRecord_shouldPickLatestRecordWithNote() {
        InMemoryClinicalStore store = TestClinicalData.store();
        // Более свежая запись без эпикриза пропускается.
        store.putMedicalRecord(TestClinicalData.record(3L, TestClinicalData.PATIENT_1, "2024-05-01T08:00:00Z",
                "Ankle sprain", "low", "2024-05-01T10:00:00Z"));
        ClinicalContextAssembler assembler = TestClinicalData.assembler(store);

        ClinicalContext ctx = assembler.assembleForRecord(TestClinicalData.PATIENT_1, null);

        assertEquals(ClinicalContext.Mode.RECORD, ctx.mode());
        assertEquals(1L, ctx.medicalRecordId());
        assertEquals(1, ctx.medicalRecords().size());
        assertEquals(1, ctx.dischargeNotes().size());
        assertEquals("senior", ctx.ageGroup());
        assertEquals("female", ctx.sex());
        assertEquals(List.of("Dr. Alan Pierce"), ctx.identity().clinicianNames());
        assertEquals(ClinicalModels.Severity.MODERATE, ctx.effectiveSeverity());
        assertTrue(ctx.recentActivities().isEmpty());
        assertTrue(ctx.timeline().isEmpty());
    }

    @Test
    void assembleForRecord_shouldExposeSectionsAndMedications() {
        ClinicalContext ctx = TestClinicalData.assembler(TestClinicalData.store())
                .assembleForRecord(TestClinicalData.PATIENT_1, 1L);

        Set<ContextSection> sections = ctx.availableSections();
        assertTrue(sections.contains(ContextSection.ALLERGIES));
        assertTrue(sections.contains(ContextSection.DISCHARGE_MEDICATIONS));
        assertTrue(sections.contains(ContextSection.LAB_RESULTS));
        assertFalse(sections.contains(ContextSection.VITAL_SIGNS));
        assertFalse(sections.contains(ContextSection.TIMELINE));

        List<String> known = ctx.knownMedications().stream().map(ClinicalModels.Medication::name).toList();
        assertTrue(known.containsAll(List.of("Lisinopril", "Metformin", "Azithromycin")));
    }

    @Test
    void assembleComprehensive_shouldFilterActivitiesAndLimitTimeline() {
        InMemoryClinicalStore store = TestClinicalData.store();
        Instant base = Instant.parse("2024-04-01T00:00:00Z");
        for (int i = 0; i < 15; i++) {
            store.addActivity(new ClinicalModels.PatientActivity(i, TestClinicalData.PATIENT_1, "medication_added",
                    "Medication change " + i, "Nurse Kim Lee", base.plusSeconds(i * 60L)));
        }
        store.addActivity(new ClinicalModels.PatientActivity(100, TestClinicalData.PATIENT_1, "login",
                "Portal login", null, base.plusSeconds(3600)));
        for (int i = 0; i < 25; i++) {
            store.addTimelineEvent(new ClinicalModels.TimelineEvent(i, TestClinicalData.PATIENT_1, "note", "Event " + i,
                    "Description", base.plusSeconds(i * 60L), "low", "care", null, "Ward"));
        }
        ClinicalContextAssembler assembler = TestClinicalData.assembler(store);

        ClinicalContext ctx = assembler.assembleComprehensive(TestClinicalData.PATIENT_1);

        assertEquals(ClinicalContext.Mode.COMPREHENSIVE, ctx.mode());
        assertNull(ctx.medicalRecordId());
        assertEquals(ClinicalContextAssembler.COMPREHENSIVE_ACTIVITIES_LIMIT, ctx.recentActivities().size());
        assertTrue(ctx.recentActivities().stream().allMatch(a -> a.activityType().equals("medication_added")));
        assertEquals(ClinicalContextAssembler.COMPREHENSIVE_TIMELINE_LIMIT, ctx.timeline().size());
        assertTrue(ctx.identity().clinicianNames().contains("Nurse Kim Lee"));
    }

    @Test
    void assembleComprehensive_shouldTakeMaxSeverityAcrossRecords() {
        InMemoryClinicalStore store = TestClinicalData.store();
        store.putMedicalRecord(TestClinicalData.record(3L, TestClinicalData.PATIENT_1, "2024-05-01T08:00:00Z",
                "Syncope", "critical", "2024-05-01T10:00:00Z"));

        ClinicalContext ctx = TestClinicalData.assembler(store).assembleComprehensive(TestClinicalData.PATIENT_1);

        assertEquals(2, ctx.medicalRecords().size());
        assertEquals(ClinicalModels.Severity.CRITICAL, ctx.effectiveSeverity());
    }

    @Test
    void sourceVersion_shouldChangeWhenRecordIsUpdated() {
        InMemoryClinicalStore store = TestClinicalData.store();
        ClinicalContextAssembler assembler = TestClinicalData.assembler(store);
        String before = assembler.assembleForRecord(TestClinicalData.PATIENT_1, 1L).sourceVersion();
        assertEquals(before, assembler.assembleForRecord(TestClinicalData.PATIENT_1, 1L).sourceVersion());

        store.putMedicalRecord(TestClinicalData.record(1L, TestClinicalData.PATIENT_1, "2024-02-10T08:30:00Z",
                "Community-acquired pneumonia", "moderate", "2024-02-20T09:00:00Z"));

        assertNotEquals(before, assembler.assembleForRecord(TestClinicalData.PATIENT_1, 1L).sourceVersion());
    }

    @Test
    void ageGroup_shouldUseBands() {
        ClinicalContextAssembler assembler = TestClinicalData.assembler(TestClinicalData.store());

        assertEquals("pediatric", assembler.ageGroup(LocalDate.parse("2010-01-01")));
        assertEquals("young_adult", assembler.ageGroup(LocalDate.parse("2000-01-01")));
        assertEquals("middle_aged", assembler.ageGroup(LocalDate.parse("1979-11-02")));
        assertEquals("senior", assembler.ageGroup(LocalDate.parse("1956-03-14")));
        assertEquals("elderly", assembler.ageGroup(LocalDate.parse("1940-01-01")));
        assertEquals("unknown", assembler.ageGroup(null));
    }

    @Test
    void careTeamContacts_shouldIncludeFacilityOnlyWhenConfigured() {
        InMemoryClinicalStore store = TestClinicalData.store();
        ClinicalContext plain = TestClinicalData.assembler(store).assembleForRecord(TestClinicalData.PATIENT_2, 2L);
        assertEquals(List.of("emergency"), plain.careTeamContacts().stream().map(ClinicalContext.CareContact::role).toList());

        DischargeProperties props = TestClinicalData.properties();
        props.getCareTeam().setFacilityName("Springfield General");
        props.getCareTeam().setFacilityPhone("555-100-2000");
        ClinicalContext withFacility = new ClinicalContextAssembler(store, props, TestClinicalData.CLOCK)
                .assembleForRecord(TestClinicalData.PATIENT_2, 2L);

        assertEquals(List.of("emergency", "facility"),
                withFacility.careTeamContacts().stream().map(ClinicalContext.CareContact::role).toList());
        assertEquals("555-100-2000", withFacility.careTeamContacts().get(1).phone());
    }
}
