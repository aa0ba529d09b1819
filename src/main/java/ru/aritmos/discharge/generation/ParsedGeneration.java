package ru.aritmos.discharge.generation;

/**
 * Результат строгого разбора ответа модели: либо валидный документ, либо причина отказа.
 *
 * @param document разобранный документ (null, если ответ некорректен)
 * @param malformedReason причина некорректности (null для валидного документа)
 * @param <T> тип документа
 */
public record ParsedGeneration<T>(T document, String malformedReason) {

    public static <T> ParsedGeneration<T> valid(T document) {
        return new ParsedGeneration<>(document, null);
    }

    public static <T> ParsedGeneration<T> malformed(String reason) {
        return new ParsedGeneration<>(null, reason == null ? "unknown" : reason);
    }

    public boolean isValid() {
        return document != null;
    }
}
