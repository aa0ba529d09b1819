package ru.aritmos.discharge.clinical;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Нормализованный клинический контекст одного запроса.
 * <p>
 * Принадлежит исключительно запросу, который его построил, и никогда не сохраняется как есть.
 * Блок {@link Identity} содержит идентифицирующие данные и не передаётся модели: в модель уходит
 * только {@code RedactedContext}.
 *
 * @param patientId идентификатор пациента
 * @param mode режим (одна запись или полная история)
 * @param medicalRecordId целевая запись (null в режиме полной истории)
 * @param sourceVersion токен версии исходных данных (для инвалидации кэша)
 * @param ageGroup возрастная группа вместо точного возраста
 * @param sex пол
 * @param identity идентифицирующие данные (только для редактирования/регидратации)
 * @param medicalHistory анамнез
 * @param allergies аллергии
 * @param currentMedications текущие препараты
 * @param medicalRecords записи; в режиме RECORD ровно одна целевая запись, иначе все, новые первыми
 * @param dischargeNotes эпикризы; в режиме RECORD эпикризы целевой записи
 * @param visitSummary сводка визитов (для режима полной истории)
 * @param recentActivities последние клинические события журнала
 * @param timeline хронология
 * @param careTeamContacts контакты учреждения/экстренных служб из конфигурации
 */
public record ClinicalContext(
        String patientId,
        Mode mode,
        Long medicalRecordId,
        String sourceVersion,
        String ageGroup,
        String sex,
        Identity identity,
        List<String> medicalHistory,
        List<ClinicalModels.Allergy> allergies,
        List<ClinicalModels.Medication> currentMedications,
        List<ClinicalModels.MedicalRecord> medicalRecords,
        List<ClinicalModels.DischargeNote> dischargeNotes,
        VisitSummary visitSummary,
        List<ClinicalModels.PatientActivity> recentActivities,
        List<ClinicalModels.TimelineEvent> timeline,
        List<CareContact> careTeamContacts
) {

    public ClinicalContext {
        medicalHistory = medicalHistory == null ? List.of() : List.copyOf(medicalHistory);
        allergies = allergies == null ? List.of() : List.copyOf(allergies);
        currentMedications = currentMedications == null ? List.of() : List.copyOf(currentMedications);
        medicalRecords = medicalRecords == null ? List.of() : List.copyOf(medicalRecords);
        dischargeNotes = dischargeNotes == null ? List.of() : List.copyOf(dischargeNotes);
        recentActivities = recentActivities == null ? List.of() : List.copyOf(recentActivities);
        timeline = timeline == null ? List.of() : List.copyOf(timeline);
        careTeamContacts = careTeamContacts == null ? List.of() : List.copyOf(careTeamContacts);
    }

    public enum Mode {
        /** Контекст одной медицинской записи и её эпикриза. */
        RECORD,
        /** Полная история пациента. */
        COMPREHENSIVE
    }

    /**
     * Идентифицирующие данные пациента. Используются только слоем редактирования.
     */
    public record Identity(
            String firstName,
            String lastName,
            String phone,
            String email,
            String address,
            ClinicalModels.EmergencyContact emergencyContact,
            List<String> clinicianNames
    ) {
        public Identity {
            clinicianNames = clinicianNames == null ? List.of() : List.copyOf(clinicianNames);
        }

        public String fullName() {
            String f = firstName == null ? "" : firstName.trim();
            String l = lastName == null ? "" : lastName.trim();
            return (f + " " + l).trim();
        }
    }

    public record VisitSummary(
            int totalVisits,
            int totalDaysInHospital,
            String currentStatus,
            String lastVisitType,
            Instant lastVisitDate
    ) {
        public static VisitSummary none() {
            return new VisitSummary(0, 0, "outpatient", null, null);
        }
    }

    /**
     * Контакт учреждения (например, экстренные службы), заданный конфигурацией.
     */
    public record CareContact(String name, String phone, String role) {
    }

    /**
     * Целевая (или самая свежая) медицинская запись.
     */
    public ClinicalModels.MedicalRecord primaryRecord() {
        return medicalRecords.isEmpty() ? null : medicalRecords.get(0);
    }

    /**
     * Препараты, назначенные при выписке, по всем эпикризам контекста.
     */
    public List<ClinicalModels.Medication> dischargeMedications() {
        List<ClinicalModels.Medication> out = new ArrayList<>();
        for (ClinicalModels.DischargeNote n : dischargeNotes) {
            out.addAll(n.medicationsAtDischarge());
        }
        return out;
    }

    /**
     * Все препараты, которые известны из истории пациента (текущие + при выписке).
     */
    public List<ClinicalModels.Medication> knownMedications() {
        List<ClinicalModels.Medication> out = new ArrayList<>(currentMedications);
        out.addAll(dischargeMedications());
        return out;
    }

    /**
     * Тяжесть, по которой применяются правила безопасности: целевая запись в режиме RECORD,
     * максимальная по всем записям в режиме полной истории.
     */
    public ClinicalModels.Severity effectiveSeverity() {
        if (medicalRecords.isEmpty()) {
            return ClinicalModels.Severity.LOW;
        }
        if (mode == Mode.RECORD) {
            return medicalRecords.get(0).severity();
        }
        ClinicalModels.Severity max = ClinicalModels.Severity.LOW;
        for (ClinicalModels.MedicalRecord r : medicalRecords) {
            if (r.severity().atLeast(max)) {
                max = r.severity();
            }
        }
        return max;
    }

    /**
     * Разделы, в которых есть данные: только на них ответ может сослаться как на источник.
     */
    public Set<ContextSection> availableSections() {
        Set<ContextSection> out = EnumSet.noneOf(ContextSection.class);
        if (!medicalHistory.isEmpty()) {
            out.add(ContextSection.MEDICAL_HISTORY);
        }
        if (!allergies.isEmpty()) {
            out.add(ContextSection.ALLERGIES);
        }
        if (!currentMedications.isEmpty()) {
            out.add(ContextSection.CURRENT_MEDICATIONS);
        }
        if (!dischargeMedications().isEmpty()) {
            out.add(ContextSection.DISCHARGE_MEDICATIONS);
        }
        for (ClinicalModels.MedicalRecord r : medicalRecords) {
            if (notBlank(r.primaryDiagnosis()) || !r.secondaryDiagnoses().isEmpty()) {
                out.add(ContextSection.DIAGNOSES);
            }
            if (!r.proceduresPerformed().isEmpty()) {
                out.add(ContextSection.PROCEDURES);
            }
            if (notBlank(r.treatmentSummary())) {
                out.add(ContextSection.TREATMENT_SUMMARY);
            }
            if (!r.labResults().isEmpty()) {
                out.add(ContextSection.LAB_RESULTS);
            }
            if (!r.vitalSigns().isEmpty()) {
                out.add(ContextSection.VITAL_SIGNS);
            }
        }
        for (ClinicalModels.DischargeNote n : dischargeNotes) {
            if (notBlank(n.followUpInstructions()) || notBlank(n.activityRestrictions())
                    || notBlank(n.dietInstructions()) || notBlank(n.warningSigns()) || notBlank(n.dischargeSummary())) {
                out.add(ContextSection.DISCHARGE_INSTRUCTIONS);
            }
        }
        if (visitSummary != null && visitSummary.totalVisits() > 0) {
            out.add(ContextSection.VISIT_HISTORY);
        }
        if (!recentActivities.isEmpty()) {
            out.add(ContextSection.RECENT_ACTIVITIES);
        }
        if (!timeline.isEmpty()) {
            out.add(ContextSection.TIMELINE);
        }
        return out;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
