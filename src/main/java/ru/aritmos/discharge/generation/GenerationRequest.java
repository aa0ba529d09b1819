package ru.aritmos.discharge.generation;

/**
 * Запрос к генеративной модели.
 *
 * @param operation вид операции (для логов и метрик)
 * @param systemPrompt системный промпт
 * @param userPrompt пользовательский промпт (только отредактированные данные)
 * @param temperature температура генерации
 * @param maxTokens ограничение длины ответа
 */
public record GenerationRequest(
        Operation operation,
        String systemPrompt,
        String userPrompt,
        double temperature,
        int maxTokens
) {

    public enum Operation {
        INSTRUCTIONS,
        QUESTION
    }

    /**
     * Копия запроса с дополнительной инструкцией в конце пользовательского промпта (для повторов).
     */
    public GenerationRequest withAppendedInstruction(String instruction) {
        return new GenerationRequest(operation, systemPrompt, userPrompt + "\n\n" + instruction, temperature, maxTokens);
    }
}
