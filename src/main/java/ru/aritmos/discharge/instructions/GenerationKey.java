package ru.aritmos.discharge.instructions;

/**
 * Ключ кэша и коалесцирования генерации инструкций.
 *
 * @param patientId идентификатор пациента
 * @param medicalRecordId идентификатор медицинской записи
 */
public record GenerationKey(String patientId, long medicalRecordId) {

    public GenerationKey {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("patientId не задан");
        }
    }
}
