package ru.aritmos.discharge.core;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Аудит "logging": реализация по умолчанию без внешнего хранилища.
 * <p>
 * Значения атрибутов дополнительно проходят через {@link SensitiveDataSanitizer}.
 */
@Singleton
public class LoggingAuditTrail implements AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(LoggingAuditTrail.class);

    @Override
    public void record(String patientId, ActivityType type, Map<String, Object> details) {
        Map<String, Object> safe = new LinkedHashMap<>();
        if (details != null) {
            for (Map.Entry<String, Object> e : details.entrySet()) {
                if (e.getKey() == null) {
                    continue;
                }
                Object v = e.getValue();
                safe.put(e.getKey(), v instanceof String s ? SensitiveDataSanitizer.sanitizeText(s) : v);
            }
        }
        log.info("[AUDIT] patientId={} activity={} details={}", patientId, type, safe);
    }
}
