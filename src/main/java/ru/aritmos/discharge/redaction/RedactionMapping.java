package ru.aritmos.discharge.redaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Обратимое соответствие «токен-заглушка ↔ исходное значение» в пределах одного запроса.
 * <p>
 * Живёт только в памяти запроса, не сериализуется и не логируется. Класс не потокобезопасен:
 * один запрос владеет одним экземпляром.
 */
public final class RedactionMapping {

    private final Map<String, String> tokenToValue = new LinkedHashMap<>();
    private final Map<String, String> valueToToken = new HashMap<>();
    private final Map<String, Integer> counters = new HashMap<>();

    /**
     * Зарегистрировать значение с фиксированным токеном (например, {@code PATIENT_NAME}).
     */
    public String registerFixed(String token, String value) {
        if (isBlank(value)) {
            return token;
        }
        String existing = valueToToken.get(key(value));
        if (existing != null) {
            return existing;
        }
        tokenToValue.putIfAbsent(token, value.trim());
        valueToToken.put(key(value), token);
        return token;
    }

    /**
     * Зарегистрировать вариант написания значения, уже закреплённого за токеном
     * (например, только имя пациента для {@code PATIENT_NAME}).
     */
    public void registerAlias(String alias, String token) {
        if (isBlank(alias) || !tokenToValue.containsKey(token)) {
            return;
        }
        valueToToken.putIfAbsent(key(alias), token);
    }

    /**
     * Получить токен для значения, выделив новый номер в категории при первом появлении.
     *
     * @param value исходное значение
     * @param category префикс токена (PHONE, EMAIL, CLINICIAN, ...)
     * @return токен вида {@code CATEGORY_n}; одинаковое значение всегда даёт одинаковый токен
     */
    public String tokenFor(String value, String category) {
        if (isBlank(value)) {
            return null;
        }
        String existing = valueToToken.get(key(value));
        if (existing != null) {
            return existing;
        }
        int n = counters.merge(category, 1, Integer::sum);
        String token = category + "_" + n;
        tokenToValue.put(token, value.trim());
        valueToToken.put(key(value), token);
        return token;
    }

    /**
     * Независимая копия: токены, выданные копии, не попадают в это соответствие.
     */
    public RedactionMapping copy() {
        RedactionMapping c = new RedactionMapping();
        c.tokenToValue.putAll(tokenToValue);
        c.valueToToken.putAll(valueToToken);
        c.counters.putAll(counters);
        return c;
    }

    public Optional<String> originalOf(String token) {
        return Optional.ofNullable(tokenToValue.get(token));
    }

    /**
     * Все зарегистрированные токены.
     */
    public Map<String, String> tokens() {
        return Collections.unmodifiableMap(tokenToValue);
    }

    /**
     * Все известные чувствительные написания (значения и алиасы), самые длинные первыми.
     */
    List<Map.Entry<String, String>> knownValuesLongestFirst() {
        List<Map.Entry<String, String>> out = new ArrayList<>();
        for (Map.Entry<String, String> e : tokenToValue.entrySet()) {
            out.add(Map.entry(e.getValue(), e.getKey()));
        }
        for (Map.Entry<String, String> e : valueToToken.entrySet()) {
            boolean alreadyPresent = out.stream().anyMatch(x -> key(x.getKey()).equals(e.getKey()));
            if (!alreadyPresent) {
                out.add(Map.entry(e.getKey(), e.getValue()));
            }
        }
        out.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed());
        return out;
    }

    public int size() {
        return tokenToValue.size();
    }

    private static String key(String value) {
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
