package ru.aritmos.discharge.instructions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Модели документа персональных выписных инструкций.
 * <p>
 * Все списки нормализуются в пустые (никогда не null), порядок элементов сохраняется.
 */
public final class InstructionModels {

    private InstructionModels() {
        // утилитарный класс
    }

    @Schema(description = "Элемент графика приёма препаратов.")
    public record MedicationEntry(
            String name,
            String dosage,
            String timing,
            String instructions
    ) {
        /**
         * Элемент без имени, дозировки и времени приёма не несёт информации и отбрасывается.
         */
        public boolean isEmpty() {
            return isBlank(name) && isBlank(dosage) && isBlank(timing);
        }

        MedicationEntry map(UnaryOperator<String> f) {
            return new MedicationEntry(f.apply(name), f.apply(dosage), f.apply(timing), f.apply(instructions));
        }
    }

    @Schema(description = "Напоминание о контрольном визите.")
    public record FollowUpReminder(
            String purpose,
            String timeframe,
            String provider
    ) {
        FollowUpReminder map(UnaryOperator<String> f) {
            return new FollowUpReminder(f.apply(purpose), f.apply(timeframe), f.apply(provider));
        }
    }

    @Schema(description = "Экстренный контакт. Всегда строится из структурированных данных пациента и конфигурации.")
    public record EmergencyContactEntry(
            String name,
            String relationship,
            String phone,
            @JsonProperty("when_to_call")
            String whenToCall
    ) {
    }

    /**
     * Разобранный ответ модели. Содержит токены-заглушки до регидратации.
     */
    public record InstructionDocument(
            List<MedicationEntry> medicationSchedule,
            List<String> lifestyleRecommendations,
            List<FollowUpReminder> followUpReminders,
            List<String> warningSigns,
            List<String> activityGuidelines,
            List<String> dietRecommendations,
            List<String> woundCareInstructions,
            List<EmergencyContactEntry> emergencyContacts,
            String summary
    ) {
        public InstructionDocument {
            medicationSchedule = copy(medicationSchedule);
            lifestyleRecommendations = copy(lifestyleRecommendations);
            followUpReminders = copy(followUpReminders);
            warningSigns = copy(warningSigns);
            activityGuidelines = copy(activityGuidelines);
            dietRecommendations = copy(dietRecommendations);
            woundCareInstructions = copy(woundCareInstructions);
            emergencyContacts = copy(emergencyContacts);
            summary = summary == null ? "" : summary;
        }

        /**
         * Применить преобразование ко всем текстовым полям (кроме экстренных контактов).
         */
        public InstructionDocument mapText(UnaryOperator<String> f) {
            return new InstructionDocument(
                    medicationSchedule.stream().map(m -> m.map(f)).toList(),
                    lifestyleRecommendations.stream().map(f).toList(),
                    followUpReminders.stream().map(r -> r.map(f)).toList(),
                    warningSigns.stream().map(f).toList(),
                    activityGuidelines.stream().map(f).toList(),
                    dietRecommendations.stream().map(f).toList(),
                    woundCareInstructions.stream().map(f).toList(),
                    emergencyContacts,
                    f.apply(summary)
            );
        }

        /**
         * Весь текст документа одной строкой (для текстовых проверок безопасности).
         */
        public String allText() {
            StringBuilder sb = new StringBuilder();
            for (MedicationEntry m : medicationSchedule) {
                append(sb, m.name(), m.dosage(), m.timing(), m.instructions());
            }
            lifestyleRecommendations.forEach(s -> append(sb, s));
            for (FollowUpReminder r : followUpReminders) {
                append(sb, r.purpose(), r.timeframe(), r.provider());
            }
            warningSigns.forEach(s -> append(sb, s));
            activityGuidelines.forEach(s -> append(sb, s));
            dietRecommendations.forEach(s -> append(sb, s));
            woundCareInstructions.forEach(s -> append(sb, s));
            append(sb, summary);
            return sb.toString();
        }
    }

    @Schema(description = "Персональные выписные инструкции пациента.")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record PersonalizedInstructions(
            @JsonProperty("patient_id")
            String patientId,
            @JsonProperty("medical_record_id")
            long medicalRecordId,
            @JsonProperty("medication_schedule")
            List<MedicationEntry> medicationSchedule,
            @JsonProperty("lifestyle_recommendations")
            List<String> lifestyleRecommendations,
            @JsonProperty("follow_up_reminders")
            List<FollowUpReminder> followUpReminders,
            @JsonProperty("warning_signs")
            List<String> warningSigns,
            @JsonProperty("activity_guidelines")
            List<String> activityGuidelines,
            @JsonProperty("diet_recommendations")
            List<String> dietRecommendations,
            @JsonProperty("wound_care_instructions")
            List<String> woundCareInstructions,
            @JsonProperty("emergency_contacts")
            List<EmergencyContactEntry> emergencyContacts,
            String summary,
            @Schema(description = "Флаги безопасности (possible-hallucination, missing-disclaimer, ...).")
            @JsonProperty("safety_flags")
            List<String> safetyFlags,
            @JsonProperty("validation_warnings")
            List<String> validationWarnings,
            @JsonProperty("generated_at")
            Instant generatedAt,
            @JsonProperty("source_version")
            String sourceVersion
    ) {
        public PersonalizedInstructions {
            medicationSchedule = copy(medicationSchedule);
            lifestyleRecommendations = copy(lifestyleRecommendations);
            followUpReminders = copy(followUpReminders);
            warningSigns = copy(warningSigns);
            activityGuidelines = copy(activityGuidelines);
            dietRecommendations = copy(dietRecommendations);
            woundCareInstructions = copy(woundCareInstructions);
            emergencyContacts = copy(emergencyContacts);
            safetyFlags = copy(safetyFlags);
            validationWarnings = copy(validationWarnings);
            summary = summary == null ? "" : summary;
        }
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    private static void append(StringBuilder sb, String... parts) {
        for (String p : parts) {
            if (p != null && !p.isBlank()) {
                sb.append(p).append('\n');
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
