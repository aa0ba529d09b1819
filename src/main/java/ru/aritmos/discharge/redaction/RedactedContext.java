package ru.aritmos.discharge.redaction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.aritmos.discharge.clinical.ClinicalContext;

/**
 * Проекция клинического контекста, которую видит модель.
 * <p>
 * Все идентифицирующие значения в {@link #projection()} заменены токенами-заглушками.
 * {@link #mapping()} хранится только в памяти запроса и используется для регидратации ответа.
 *
 * @param patientId идентификатор пациента (служебный, в проекцию не входит)
 * @param mode режим контекста
 * @param projection JSON-проекция для промпта
 * @param mapping обратимое соответствие токенов
 */
public record RedactedContext(
        String patientId,
        ClinicalContext.Mode mode,
        ObjectNode projection,
        RedactionMapping mapping
) {
}
