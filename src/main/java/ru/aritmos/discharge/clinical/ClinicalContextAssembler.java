package ru.aritmos.discharge.clinical;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.discharge.config.DischargeProperties;
import ru.aritmos.discharge.core.DischargeAssistException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Сборщик клинического контекста.
 * <p>
 * Читает данные пациента из {@link ClinicalStore} и строит неизменяемый {@link ClinicalContext}:
 * <ul>
 *   <li>для одной медицинской записи и её эпикриза ({@link #assembleForRecord(String, Long)});</li>
 *   <li>для полной истории пациента ({@link #assembleComprehensive(String)}).</li>
 * </ul>
 * Хранилище только читается, побочных эффектов нет.
 */
@Singleton
public class ClinicalContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ClinicalContextAssembler.class);

    static final int COMPREHENSIVE_ACTIVITIES_LIMIT = 10;
    static final int COMPREHENSIVE_TIMELINE_LIMIT = 20;

    private static final Set<String> CLINICAL_ACTIVITY_TYPES = Set.of(
            "medication_added",
            "medication_removed",
            "diagnosis_updated",
            "procedure_performed"
    );

    private final ClinicalStore store;
    private final DischargeProperties properties;
    private final Clock clock;

    @Inject
    public ClinicalContextAssembler(ClinicalStore store, DischargeProperties properties) {
        this(store, properties, Clock.systemUTC());
    }

    public ClinicalContextAssembler(ClinicalStore store, DischargeProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Собрать контекст одной медицинской записи.
     * <p>
     * Если {@code medicalRecordId} не задан, берётся самая свежая запись, у которой есть эпикриз.
     *
     * @param patientId идентификатор пациента
     * @param medicalRecordId идентификатор записи или null
     * @return контекст в режиме {@link ClinicalContext.Mode#RECORD}
     * @throws DischargeAssistException NOT_FOUND, если пациента/записи нет; INCOMPLETE_CONTEXT, если нет эпикриза
     */
    public ClinicalContext assembleForRecord(String patientId, Long medicalRecordId) {
        ClinicalModels.Patient patient = requirePatient(patientId);
        List<ClinicalModels.MedicalRecord> records = store.getMedicalRecords(patientId);
        List<ClinicalModels.DischargeNote> notes = store.getDischargeNotes(patientId);

        ClinicalModels.MedicalRecord record;
        List<ClinicalModels.DischargeNote> recordNotes;
        if (medicalRecordId != null) {
            record = records.stream()
                    .filter(r -> r.id() == medicalRecordId)
                    .findFirst()
                    .orElseThrow(() -> DischargeAssistException.notFound(
                            "Медицинская запись " + medicalRecordId + " не найдена у пациента " + patientId));
            recordNotes = notesFor(notes, record.id());
            if (recordNotes.isEmpty()) {
                throw DischargeAssistException.incompleteContext(
                        "У медицинской записи " + medicalRecordId + " нет выписного эпикриза");
            }
        } else {
            record = null;
            recordNotes = List.of();
            for (ClinicalModels.MedicalRecord r : records) {
                List<ClinicalModels.DischargeNote> rn = notesFor(notes, r.id());
                if (!rn.isEmpty()) {
                    record = r;
                    recordNotes = rn;
                    break;
                }
            }
            if (record == null) {
                throw DischargeAssistException.incompleteContext(
                        "У пациента " + patientId + " нет медицинской записи с выписным эпикризом");
            }
        }

        List<String> clinicians = new ArrayList<>();
        recordNotes.forEach(n -> clinicians.add(n.dischargePhysician()));

        ClinicalContext ctx = new ClinicalContext(
                patientId,
                ClinicalContext.Mode.RECORD,
                record.id(),
                versionOf(patient, List.of(record), recordNotes),
                ageGroup(patient.dateOfBirth()),
                normalizeSex(patient.gender()),
                identityOf(patient, clinicians),
                patient.medicalHistory(),
                patient.allergies(),
                patient.currentMedications(),
                List.of(record),
                recordNotes,
                ClinicalContext.VisitSummary.none(),
                List.of(),
                List.of(),
                careTeamContacts()
        );
        log.debug("Собран контекст записи: patientId={} medicalRecordId={} version={}", patientId, record.id(), ctx.sourceVersion());
        return ctx;
    }

    /**
     * Собрать контекст полной истории пациента.
     *
     * @param patientId идентификатор пациента
     * @return контекст в режиме {@link ClinicalContext.Mode#COMPREHENSIVE}
     * @throws DischargeAssistException NOT_FOUND, если пациента нет
     */
    public ClinicalContext assembleComprehensive(String patientId) {
        requirePatient(patientId);
        ClinicalModels.ComprehensiveHistory history = store.getComprehensiveHistory(patientId)
                .orElseThrow(() -> DischargeAssistException.notFound("Пациент " + patientId + " не найден"));
        ClinicalModels.Patient patient = history.patient();

        List<ClinicalModels.PatientActivity> activities = history.activities().stream()
                .filter(a -> a.activityType() != null
                        && CLINICAL_ACTIVITY_TYPES.contains(a.activityType().trim().toLowerCase(Locale.ROOT)))
                .limit(COMPREHENSIVE_ACTIVITIES_LIMIT)
                .toList();
        List<ClinicalModels.TimelineEvent> timeline = history.timeline().stream()
                .limit(COMPREHENSIVE_TIMELINE_LIMIT)
                .toList();

        String lastVisitType = history.visits().isEmpty() ? null : history.visits().get(0).visitType();
        ClinicalContext.VisitSummary visitSummary = new ClinicalContext.VisitSummary(
                history.totalVisits(),
                history.totalDaysInHospital(),
                history.currentStatus(),
                lastVisitType,
                history.lastVisitDate()
        );

        List<String> clinicians = new ArrayList<>();
        history.dischargeNotes().forEach(n -> clinicians.add(n.dischargePhysician()));
        history.visits().forEach(v -> clinicians.add(v.attendingPhysician()));
        activities.forEach(a -> clinicians.add(a.performedBy()));
        timeline.forEach(t -> clinicians.add(t.performedBy()));

        ClinicalContext ctx = new ClinicalContext(
                patientId,
                ClinicalContext.Mode.COMPREHENSIVE,
                null,
                versionOf(patient, history.medicalRecords(), history.dischargeNotes()),
                ageGroup(patient.dateOfBirth()),
                normalizeSex(patient.gender()),
                identityOf(patient, clinicians),
                patient.medicalHistory(),
                patient.allergies(),
                patient.currentMedications(),
                history.medicalRecords(),
                history.dischargeNotes(),
                visitSummary,
                activities,
                timeline,
                careTeamContacts()
        );
        log.debug("Собран полный контекст: patientId={} records={} notes={}", patientId,
                ctx.medicalRecords().size(), ctx.dischargeNotes().size());
        return ctx;
    }

    /**
     * Возрастная группа вместо точного возраста.
     */
    public String ageGroup(LocalDate dateOfBirth) {
        if (dateOfBirth == null) {
            return "unknown";
        }
        int age = Period.between(dateOfBirth, LocalDate.now(clock)).getYears();
        if (age < 18) {
            return "pediatric";
        }
        if (age < 35) {
            return "young_adult";
        }
        if (age < 55) {
            return "middle_aged";
        }
        if (age < 75) {
            return "senior";
        }
        return "elderly";
    }

    private ClinicalModels.Patient requirePatient(String patientId) {
        if (patientId == null || patientId.isBlank()) {
            throw DischargeAssistException.notFound("Не задан идентификатор пациента");
        }
        return store.getPatient(patientId)
                .orElseThrow(() -> DischargeAssistException.notFound("Пациент " + patientId + " не найден"));
    }

    private List<ClinicalContext.CareContact> careTeamContacts() {
        DischargeProperties.CareTeam cfg = properties.getCareTeam();
        List<ClinicalContext.CareContact> out = new ArrayList<>();
        out.add(new ClinicalContext.CareContact(cfg.getEmergencyServicesName(), cfg.getEmergencyServicesPhone(), "emergency"));
        if (cfg.getFacilityName() != null && cfg.getFacilityPhone() != null) {
            out.add(new ClinicalContext.CareContact(cfg.getFacilityName(), cfg.getFacilityPhone(), "facility"));
        }
        return out;
    }

    static ClinicalContext.Identity identityOf(ClinicalModels.Patient p, List<String> clinicianNames) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String name : clinicianNames) {
            if (name != null && !name.isBlank()) {
                distinct.add(name.trim());
            }
        }
        return new ClinicalContext.Identity(
                p.firstName(),
                p.lastName(),
                p.phone(),
                p.email(),
                p.address(),
                p.emergencyContact(),
                new ArrayList<>(distinct)
        );
    }

    private static List<ClinicalModels.DischargeNote> notesFor(List<ClinicalModels.DischargeNote> notes, long recordId) {
        return notes.stream().filter(n -> n.medicalRecordId() == recordId).toList();
    }

    private static String normalizeSex(String gender) {
        if (gender == null || gender.isBlank()) {
            return "unknown";
        }
        return gender.trim().toLowerCase(Locale.ROOT);
    }

    static String versionOf(ClinicalModels.Patient patient,
                            List<ClinicalModels.MedicalRecord> records,
                            List<ClinicalModels.DischargeNote> notes) {
        StringBuilder sb = new StringBuilder("p@").append(millis(patient.updatedAt()));
        for (ClinicalModels.MedicalRecord r : records) {
            sb.append("|r").append(r.id()).append('@').append(millis(r.lastModified()));
        }
        for (ClinicalModels.DischargeNote n : notes) {
            sb.append("|n").append(n.id()).append('@').append(millis(n.lastModified()));
        }
        return sb.toString();
    }

    private static long millis(Instant instant) {
        return instant == null ? 0L : instant.toEpochMilli();
    }
}
