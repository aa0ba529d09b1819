package ru.aritmos.discharge.core;

import java.util.UUID;

/**
 * Контекст корреляции HTTP-запроса к ядру.
 * <p>
 * Идентификатор попадает в логи и в тело ошибок, чтобы UI мог сослаться на конкретный запрос.
 */
public record CorrelationContext(String correlationId, String requestId) {

    public static CorrelationContext resolve(String correlationId, String requestId) {
        String corr = normalize(correlationId);
        String req = normalize(requestId);

        if (corr == null && req == null) {
            String generated = "da-" + UUID.randomUUID();
            return new CorrelationContext(generated, generated);
        }
        if (corr == null) {
            return new CorrelationContext(req, req);
        }
        if (req == null) {
            return new CorrelationContext(corr, corr);
        }
        return new CorrelationContext(corr, req);
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        if (t.isEmpty()) {
            return null;
        }
        // Идентификатор уходит в логи: ограничиваем длину и убираем переводы строк.
        t = t.replaceAll("[\\r\\n\\t]", "");
        return t.length() > 128 ? t.substring(0, 128) : t;
    }
}
