package ru.aritmos.discharge.clinical;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Value;
import io.micronaut.core.io.ResourceResolver;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory реализация {@link ClinicalStore}.
 * <p>
 * Baseline-данные загружаются из classpath (fixture), что позволяет запускать ядро и UI без внешней БД.
 * Методы {@code put*}/{@code add*} изображают тонкий CRUD-слой: ядро их не вызывает, но изменения,
 * сделанные через них, видны ядру (в том числе для инвалидации кэша инструкций).
 */
@Singleton
public class InMemoryClinicalStore implements ClinicalStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryClinicalStore.class);

    private static final int ACTIVITIES_LIMIT = 50;
    private static final int TIMELINE_LIMIT = 100;

    private final ResourceResolver resourceResolver;
    private final ObjectMapper objectMapper;
    private final String fixturePath;

    private final Map<String, ClinicalModels.Patient> patients = new ConcurrentHashMap<>();
    private final Map<Long, ClinicalModels.MedicalRecord> records = new ConcurrentHashMap<>();
    private final Map<Long, ClinicalModels.DischargeNote> notes = new ConcurrentHashMap<>();
    private final List<ClinicalModels.PatientVisit> visits = new CopyOnWriteArrayList<>();
    private final List<ClinicalModels.PatientActivity> activities = new CopyOnWriteArrayList<>();
    private final List<ClinicalModels.TimelineEvent> timeline = new CopyOnWriteArrayList<>();

    public InMemoryClinicalStore(ResourceResolver resourceResolver,
                                 ObjectMapper objectMapper,
                                 @Value("${discharge.store.fixture-path:classpath:fixtures/clinical-data.json}") String fixturePath) {
        this.resourceResolver = resourceResolver;
        this.objectMapper = objectMapper;
        this.fixturePath = fixturePath;
    }

    /**
     * Пустое хранилище без fixture (для тестов и встраивания).
     */
    public static InMemoryClinicalStore empty() {
        return new InMemoryClinicalStore(null, null, null);
    }

    @PostConstruct
    void init() {
        if (fixturePath == null || fixturePath.isBlank() || resourceResolver == null) {
            return;
        }
        Optional<InputStream> streamOpt = resourceResolver.getResourceAsStream(fixturePath);
        if (streamOpt.isEmpty() && fixturePath.startsWith("classpath:")) {
            String stripped = fixturePath.substring("classpath:".length());
            if (stripped.startsWith("/")) {
                stripped = stripped.substring(1);
            }
            streamOpt = resourceResolver.getResourceAsStream(stripped);
        }
        if (streamOpt.isEmpty()) {
            log.warn("Fixture клинических данных не найден по пути {}. Хранилище остаётся пустым.", fixturePath);
            return;
        }
        try (InputStream is = streamOpt.get()) {
            load(objectMapper.readValue(is, Snapshot.class));
        } catch (Exception e) {
            throw new IllegalStateException("Не удалось загрузить fixture клинических данных: " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить снимок данных (поверх уже имеющихся).
     */
    public void load(Snapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        nullSafe(snapshot.patients()).forEach(this::putPatient);
        nullSafe(snapshot.medicalRecords()).forEach(this::putMedicalRecord);
        nullSafe(snapshot.dischargeNotes()).forEach(this::putDischargeNote);
        nullSafe(snapshot.visits()).forEach(this::addVisit);
        nullSafe(snapshot.activities()).forEach(this::addActivity);
        nullSafe(snapshot.timeline()).forEach(this::addTimelineEvent);
        log.info("Загружены клинические данные: patients={} records={} notes={}", patients.size(), records.size(), notes.size());
    }

    public void putPatient(ClinicalModels.Patient patient) {
        patients.put(patient.patientId(), patient);
    }

    public void putMedicalRecord(ClinicalModels.MedicalRecord record) {
        records.put(record.id(), record);
    }

    public void putDischargeNote(ClinicalModels.DischargeNote note) {
        notes.put(note.id(), note);
    }

    public void addVisit(ClinicalModels.PatientVisit visit) {
        visits.add(visit);
    }

    public void addActivity(ClinicalModels.PatientActivity activity) {
        activities.add(activity);
    }

    public void addTimelineEvent(ClinicalModels.TimelineEvent event) {
        timeline.add(event);
    }

    @Override
    public Optional<ClinicalModels.Patient> getPatient(String patientId) {
        if (patientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(patients.get(patientId));
    }

    @Override
    public List<ClinicalModels.MedicalRecord> getMedicalRecords(String patientId) {
        return records.values().stream()
                .filter(r -> r.patientId() != null && r.patientId().equals(patientId))
                .sorted(Comparator.comparing(ClinicalModels.MedicalRecord::admissionDate, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(ClinicalModels.MedicalRecord::id, Comparator.reverseOrder()))
                .toList();
    }

    @Override
    public List<ClinicalModels.DischargeNote> getDischargeNotes(String patientId) {
        return notes.values().stream()
                .filter(n -> n.patientId() != null && n.patientId().equals(patientId))
                .sorted(Comparator.comparing(ClinicalModels.DischargeNote::dischargeDate, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(ClinicalModels.DischargeNote::id, Comparator.reverseOrder()))
                .toList();
    }

    @Override
    public Optional<ClinicalModels.ComprehensiveHistory> getComprehensiveHistory(String patientId) {
        Optional<ClinicalModels.Patient> patient = getPatient(patientId);
        if (patient.isEmpty()) {
            return Optional.empty();
        }

        List<ClinicalModels.PatientVisit> patientVisits = visits.stream()
                .filter(v -> patientId.equals(v.patientId()))
                .sorted(Comparator.comparing(ClinicalModels.PatientVisit::admissionDate, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        List<ClinicalModels.PatientActivity> patientActivities = activities.stream()
                .filter(a -> patientId.equals(a.patientId()))
                .sorted(Comparator.comparing(ClinicalModels.PatientActivity::timestamp, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(ACTIVITIES_LIMIT)
                .toList();
        List<ClinicalModels.TimelineEvent> patientTimeline = timeline.stream()
                .filter(t -> patientId.equals(t.patientId()))
                .sorted(Comparator.comparing(ClinicalModels.TimelineEvent::eventDate, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(TIMELINE_LIMIT)
                .toList();

        int totalDays = 0;
        Instant lastVisit = null;
        String status = "outpatient";
        for (ClinicalModels.PatientVisit v : patientVisits) {
            if (v.admissionDate() != null && v.dischargeDate() != null) {
                long days = Duration.between(v.admissionDate(), v.dischargeDate()).toDays();
                // Минимум один день на завершённый визит.
                totalDays += (int) Math.max(days, 1);
            }
            if (v.admissionDate() != null && (lastVisit == null || v.admissionDate().isAfter(lastVisit))) {
                lastVisit = v.admissionDate();
            }
            if ("active".equalsIgnoreCase(v.status())) {
                status = "inpatient";
            }
        }

        return Optional.of(new ClinicalModels.ComprehensiveHistory(
                patient.get(),
                patientVisits,
                patientActivities,
                patientTimeline,
                getMedicalRecords(patientId),
                getDischargeNotes(patientId),
                patientVisits.size(),
                totalDays,
                lastVisit,
                status
        ));
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? new ArrayList<>() : list;
    }

    /**
     * Формат fixture-файла.
     */
    public record Snapshot(
            List<ClinicalModels.Patient> patients,
            List<ClinicalModels.MedicalRecord> medicalRecords,
            List<ClinicalModels.DischargeNote> dischargeNotes,
            List<ClinicalModels.PatientVisit> visits,
            List<ClinicalModels.PatientActivity> activities,
            List<ClinicalModels.TimelineEvent> timeline
    ) {
    }
}
