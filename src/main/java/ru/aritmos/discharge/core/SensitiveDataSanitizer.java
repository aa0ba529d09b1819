package ru.aritmos.discharge.core;

import java.util.regex.Pattern;

/**
 * Санитайзер чувствительных данных для логов и сообщений об ошибках.
 * <p>
 * Назначение:
 * <ul>
 *   <li>не допустить попадания API-ключей и Bearer-токенов в логи и HTTP-ответы;</li>
 *   <li>маскировать очевидные контактные данные (email, телефоны) в диагностике.</li>
 * </ul>
 * <p>
 * Важно: санитайзер работает эвристически и не заменяет слой редактирования ПДн
 * ({@code ru.aritmos.discharge.redaction}), который отвечает за данные, уходящие в модель.
 */
public final class SensitiveDataSanitizer {

    private static final String MASK = "***";

    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+[^\\s]+");
    private static final Pattern KEY_VALUE = Pattern.compile("(?i)(api_key|apikey|access_token|client_secret)\\s*[=:]\\s*[^\\s&,]+");
    private static final Pattern OPENAI_STYLE_KEY = Pattern.compile("\\bsk-[A-Za-z0-9_-]{8,}\\b");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE = Pattern.compile("\\b\\d{3}[-. ]?\\d{3}[-. ]?\\d{4}\\b");

    private SensitiveDataSanitizer() {
    }

    /**
     * Санитизировать текст (сообщения об ошибках, диагностические строки).
     *
     * @param text исходный текст
     * @return санитизированный однострочный текст
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = text;
        t = BEARER.matcher(t).replaceAll("Bearer " + MASK);
        t = KEY_VALUE.matcher(t).replaceAll("$1=" + MASK);
        t = OPENAI_STYLE_KEY.matcher(t).replaceAll(MASK);
        t = EMAIL.matcher(t).replaceAll(MASK);
        t = PHONE.matcher(t).replaceAll(MASK);

        // Избегаем многострочности в сообщениях.
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }

    /**
     * Короткое превью произвольного текста для аудита: санитизация + обрезка.
     *
     * @param text исходный текст
     * @param maxLen максимальная длина превью
     * @return превью или пустая строка
     */
    public static String preview(String text, int maxLen) {
        String s = sanitizeText(text);
        if (s == null) {
            return "";
        }
        if (s.length() <= maxLen) {
            return s;
        }
        return s.substring(0, Math.max(0, maxLen)) + "...";
    }
}
