package ru.aritmos.discharge.clinical;

import java.util.Locale;
import java.util.Optional;

/**
 * Разделы клинического контекста, на которые модель может сослаться как на источник ответа.
 */
public enum ContextSection {
    MEDICAL_HISTORY("medical_history"),
    ALLERGIES("allergies"),
    CURRENT_MEDICATIONS("current_medications"),
    DISCHARGE_MEDICATIONS("discharge_medications"),
    DIAGNOSES("diagnoses"),
    PROCEDURES("procedures"),
    TREATMENT_SUMMARY("treatment_summary"),
    LAB_RESULTS("lab_results"),
    VITAL_SIGNS("vital_signs"),
    DISCHARGE_INSTRUCTIONS("discharge_instructions"),
    VISIT_HISTORY("visit_history"),
    RECENT_ACTIVITIES("recent_activities"),
    TIMELINE("timeline");

    private final String wireName;

    ContextSection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Найти раздел по имени из ответа модели (регистр, пробелы и дефисы не важны).
     */
    public static Optional<ContextSection> fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String norm = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ContextSection s : values()) {
            if (s.wireName.equals(norm)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
