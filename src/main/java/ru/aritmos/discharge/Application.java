package ru.aritmos.discharge;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа Discharge Assist.
 * <p>
 * Сервис строит персональные выписные инструкции по данным пациента и отвечает на вопросы пациента
 * с проверкой безопасности. Данные пациента передаются модели только в отредактированном виде.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
