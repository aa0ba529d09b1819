package ru.aritmos.discharge.clinical;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.inject.Singleton;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.redaction.PiiRedactor;
import ru.aritmos.discharge.redaction.RedactionMapping;

import java.util.List;
import java.util.Locale;

/**
 * Детерминированная сводка по пациенту без ПДн и без обращения к модели.
 * <p>
 * Используется UI как «безопасный предпросмотр» того, что видит модель. Свободный текст (анамнез,
 * реакции, диагноз, процедуры) проходит то же редактирование, что и контекст модели.
 */
@Singleton
public class SafeSummaryService {

    private final ClinicalStore store;
    private final ClinicalContextAssembler assembler;
    private final PiiRedactor redactor;

    public SafeSummaryService(ClinicalStore store, ClinicalContextAssembler assembler, PiiRedactor redactor) {
        this.store = store;
        this.assembler = assembler;
        this.redactor = redactor;
    }

    /**
     * Построить сводку.
     *
     * @param patientId идентификатор пациента
     * @return сводка без имени, телефона, email и адреса
     * @throws DischargeAssistException NOT_FOUND, если пациента нет
     */
    public SafeSummary summarize(String patientId) {
        ClinicalModels.Patient patient = store.getPatient(patientId)
                .orElseThrow(() -> DischargeAssistException.notFound("Пациент " + patientId + " не найден"));
        List<ClinicalModels.MedicalRecord> records = store.getMedicalRecords(patientId);
        ClinicalModels.MedicalRecord latest = records.isEmpty() ? null : records.get(0);

        List<String> clinicians = store.getDischargeNotes(patientId).stream()
                .map(ClinicalModels.DischargeNote::dischargePhysician)
                .toList();
        RedactionMapping mapping = redactor.mappingFor(ClinicalContextAssembler.identityOf(patient, clinicians));

        List<String> meds = patient.currentMedications().stream()
                .map(SafeSummaryService::describe)
                .toList();
        List<String> allergies = patient.allergies().stream()
                .map(a -> a.reaction() == null || a.reaction().isBlank()
                        ? redactor.redactText(a.allergen(), mapping)
                        : redactor.redactText(a.allergen() + " (" + a.reaction() + ")", mapping))
                .toList();

        return new SafeSummary(
                patient.patientId(),
                assembler.ageGroup(patient.dateOfBirth()),
                patient.gender() == null ? "unknown" : patient.gender(),
                patient.medicalHistory().stream().map(h -> redactor.redactText(h, mapping)).toList(),
                meds,
                allergies,
                latest == null ? null : redactor.redactText(latest.primaryDiagnosis(), mapping),
                latest == null ? List.of() : latest.proceduresPerformed().stream().map(pr -> redactor.redactText(pr, mapping)).toList(),
                latest == null ? null : latest.severity().name().toLowerCase(Locale.ROOT),
                records.size()
        );
    }

    private static String describe(ClinicalModels.Medication m) {
        StringBuilder sb = new StringBuilder(m.name() == null ? "" : m.name());
        if (m.dosage() != null && !m.dosage().isBlank()) {
            sb.append(' ').append(m.dosage());
        }
        if (m.frequency() != null && !m.frequency().isBlank()) {
            sb.append(", ").append(m.frequency());
        }
        return sb.toString().trim();
    }

    @Schema(description = "Сводка по пациенту без персональных данных.")
    public record SafeSummary(
            String patientId,
            @Schema(description = "Возрастная группа: pediatric/young_adult/middle_aged/senior/elderly/unknown")
            String ageGroup,
            String sex,
            List<String> medicalHistory,
            List<String> currentMedications,
            List<String> allergies,
            String latestDiagnosis,
            List<String> latestProcedures,
            String latestSeverity,
            int medicalRecordCount
    ) {
    }
}
