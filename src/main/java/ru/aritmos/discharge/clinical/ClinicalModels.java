package ru.aritmos.discharge.clinical;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Контракты клинических сущностей, которые поставляет слой хранения.
 * <p>
 * Важно:
 * <ul>
 *   <li>ядро получает сущности только на чтение и никогда не сохраняет их в изменённом виде;</li>
 *   <li>поля с ПДн (ФИО, телефон, email, адрес, контакты) перед обращением к модели проходят через слой редактирования;</li>
 *   <li>списки никогда не равны null: отсутствующие значения нормализуются в пустой список.</li>
 * </ul>
 */
public final class ClinicalModels {

    private ClinicalModels() {
        // утилитарный класс
    }

    /**
     * Уровень тяжести медицинской записи.
     */
    public enum Severity {
        LOW,
        MODERATE,
        HIGH,
        CRITICAL;

        /**
         * Разобрать строковое значение (регистр не важен). Неизвестное значение трактуется как MODERATE.
         */
        public static Severity parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return MODERATE;
            }
            try {
                return Severity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return MODERATE;
            }
        }

        public boolean atLeast(Severity other) {
            return this.ordinal() >= other.ordinal();
        }
    }

    @Schema(description = "Контакт для экстренной связи, указанный пациентом.")
    public record EmergencyContact(
            String name,
            String relationship,
            String phone,
            String email
    ) {
    }

    @Schema(description = "Аллергия пациента.")
    public record Allergy(
            @Schema(description = "Аллерген (вещество или класс препаратов).")
            String allergen,
            @Schema(description = "Реакция.")
            String reaction,
            @Schema(description = "Тяжесть: low/moderate/high/critical.")
            String severity
    ) {
    }

    @Schema(description = "Назначенный препарат.")
    public record Medication(
            String name,
            String dosage,
            String frequency,
            String route,
            String instructions
    ) {
    }

    @Schema(description = "Результат лабораторного исследования.")
    public record LabResult(
            String testName,
            String value,
            String unit,
            String referenceRange,
            @Schema(description = "normal/abnormal/critical")
            String status
    ) {
    }

    @Schema(description = "Показатели жизнедеятельности.")
    public record VitalSigns(
            Double temperature,
            Integer bloodPressureSystolic,
            Integer bloodPressureDiastolic,
            Integer heartRate,
            Integer respiratoryRate,
            Double oxygenSaturation,
            Instant recordedAt
    ) {
    }

    @Schema(description = "Карточка пациента в слое хранения.")
    public record Patient(
            String patientId,
            String firstName,
            String lastName,
            LocalDate dateOfBirth,
            String gender,
            String phone,
            String email,
            String address,
            EmergencyContact emergencyContact,
            List<String> medicalHistory,
            List<Allergy> allergies,
            List<Medication> currentMedications,
            Instant createdAt,
            Instant updatedAt
    ) {
        public Patient {
            medicalHistory = medicalHistory == null ? List.of() : List.copyOf(medicalHistory);
            allergies = allergies == null ? List.of() : List.copyOf(allergies);
            currentMedications = currentMedications == null ? List.of() : List.copyOf(currentMedications);
        }
    }

    @Schema(description = "Медицинская запись (госпитализация/обращение).")
    public record MedicalRecord(
            long id,
            String patientId,
            Instant admissionDate,
            Instant dischargeDate,
            String primaryDiagnosis,
            List<String> secondaryDiagnoses,
            List<String> proceduresPerformed,
            String treatmentSummary,
            String physicianNotes,
            String nursingNotes,
            List<LabResult> labResults,
            List<VitalSigns> vitalSigns,
            String severityLevel,
            Instant createdAt,
            Instant updatedAt
    ) {
        public MedicalRecord {
            secondaryDiagnoses = secondaryDiagnoses == null ? List.of() : List.copyOf(secondaryDiagnoses);
            proceduresPerformed = proceduresPerformed == null ? List.of() : List.copyOf(proceduresPerformed);
            labResults = labResults == null ? List.of() : List.copyOf(labResults);
            vitalSigns = vitalSigns == null ? List.of() : List.copyOf(vitalSigns);
        }

        public Severity severity() {
            return Severity.parse(severityLevel);
        }

        /**
         * Момент последнего изменения записи (updatedAt, иначе createdAt).
         */
        public Instant lastModified() {
            return updatedAt != null ? updatedAt : createdAt;
        }
    }

    @Schema(description = "Выписной эпикриз, привязанный к медицинской записи.")
    public record DischargeNote(
            long id,
            String patientId,
            long medicalRecordId,
            String dischargeSummary,
            List<Medication> medicationsAtDischarge,
            String followUpInstructions,
            String activityRestrictions,
            String dietInstructions,
            String warningSigns,
            String dischargePhysician,
            Instant dischargeDate,
            Instant createdAt,
            Instant updatedAt
    ) {
        public DischargeNote {
            medicationsAtDischarge = medicationsAtDischarge == null ? List.of() : List.copyOf(medicationsAtDischarge);
        }

        public Instant lastModified() {
            return updatedAt != null ? updatedAt : createdAt;
        }
    }

    @Schema(description = "Визит/пребывание пациента.")
    public record PatientVisit(
            long id,
            String patientId,
            String visitNumber,
            Instant admissionDate,
            Instant dischargeDate,
            String visitType,
            String department,
            String attendingPhysician,
            String status,
            String chiefComplaint,
            String visitSummary,
            String dischargeDisposition
    ) {
    }

    @Schema(description = "Событие журнала действий пациента.")
    public record PatientActivity(
            long id,
            String patientId,
            String activityType,
            String description,
            String performedBy,
            Instant timestamp
    ) {
    }

    @Schema(description = "Событие хронологии пациента.")
    public record TimelineEvent(
            long id,
            String patientId,
            String eventType,
            String eventTitle,
            String eventDescription,
            Instant eventDate,
            String severity,
            String category,
            String performedBy,
            String location
    ) {
    }

    @Schema(description = "Полная история пациента для расширенного режима Q&A.")
    public record ComprehensiveHistory(
            Patient patient,
            List<PatientVisit> visits,
            List<PatientActivity> activities,
            List<TimelineEvent> timeline,
            List<MedicalRecord> medicalRecords,
            List<DischargeNote> dischargeNotes,
            int totalVisits,
            int totalDaysInHospital,
            Instant lastVisitDate,
            String currentStatus
    ) {
        public ComprehensiveHistory {
            visits = visits == null ? List.of() : List.copyOf(visits);
            activities = activities == null ? List.of() : List.copyOf(activities);
            timeline = timeline == null ? List.of() : List.copyOf(timeline);
            medicalRecords = medicalRecords == null ? List.of() : List.copyOf(medicalRecords);
            dischargeNotes = dischargeNotes == null ? List.of() : List.copyOf(dischargeNotes);
        }
    }
}
