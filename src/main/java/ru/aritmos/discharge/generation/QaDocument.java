package ru.aritmos.discharge.generation;

import java.util.List;

/**
 * Разобранный ответ модели на вопрос пациента (до регидратации и проверок безопасности).
 *
 * @param answer текст ответа
 * @param confidence уверенность модели в диапазоне [0,1]
 * @param sources разделы контекста, на которые модель сослалась
 * @param medicationsMentioned препараты, упомянутые в ответе
 * @param inScope можно ли ответить по данным пациента
 * @param relatedTopics связанные темы
 */
public record QaDocument(
        String answer,
        double confidence,
        List<String> sources,
        List<String> medicationsMentioned,
        boolean inScope,
        List<String> relatedTopics
) {
    public QaDocument {
        sources = sources == null ? List.of() : List.copyOf(sources);
        medicationsMentioned = medicationsMentioned == null ? List.of() : List.copyOf(medicationsMentioned);
        relatedTopics = relatedTopics == null ? List.of() : List.copyOf(relatedTopics);
    }
}
