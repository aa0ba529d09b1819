package ru.aritmos.discharge.core;

import java.util.Map;

/**
 * Журнал действий над данными пациента (генерация инструкций, вопросы).
 * <p>
 * Вынесено в интерфейс, чтобы хранилище аудита (БД, шина событий) подключалось без изменения ядра.
 * Реализации не должны получать сырые ПДн: вызывающая сторона передаёт только санитизированные атрибуты.
 */
public interface AuditTrail {

    /**
     * Типы событий аудита.
     */
    enum ActivityType {
        INSTRUCTION_GENERATED,
        QUESTION_ASKED
    }

    /**
     * Зафиксировать событие.
     *
     * @param patientId идентификатор пациента
     * @param type тип события
     * @param details санитизированные атрибуты события
     */
    void record(String patientId, ActivityType type, Map<String, Object> details);
}
