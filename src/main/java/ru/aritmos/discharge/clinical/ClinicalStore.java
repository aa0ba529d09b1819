package ru.aritmos.discharge.clinical;

import java.util.List;
import java.util.Optional;

/**
 * Контракт слоя хранения клинических данных (CRUD-часть системы).
 * <p>
 * Для ядра все операции только читающие. Реальные хранилища (БД, EMR, FHIR) должны реализовывать
 * этот интерфейс и возвращать сущности в терминах {@link ClinicalModels}.
 */
public interface ClinicalStore {

    /**
     * Получить пациента.
     *
     * @param patientId идентификатор пациента
     * @return пациент или пусто
     */
    Optional<ClinicalModels.Patient> getPatient(String patientId);

    /**
     * Медицинские записи пациента, самые новые (по дате госпитализации) первыми.
     */
    List<ClinicalModels.MedicalRecord> getMedicalRecords(String patientId);

    /**
     * Выписные эпикризы пациента, самые новые (по дате выписки) первыми.
     */
    List<ClinicalModels.DischargeNote> getDischargeNotes(String patientId);

    /**
     * Полная история пациента: визиты, журнал действий, хронология, записи и эпикризы.
     *
     * @param patientId идентификатор пациента
     * @return история или пусто, если пациента нет
     */
    Optional<ClinicalModels.ComprehensiveHistory> getComprehensiveHistory(String patientId);
}
