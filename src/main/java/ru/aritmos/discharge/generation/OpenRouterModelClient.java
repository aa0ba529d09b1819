package ru.aritmos.discharge.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.discharge.config.DischargeProperties;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.core.SensitiveDataSanitizer;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Клиент OpenAI-совместимого chat-completions endpoint (по умолчанию OpenRouter) на базе JDK {@link HttpClient}.
 * <p>
 * Ограничения:
 * <ul>
 *   <li>промпты и ответы не логируются (только операция, статус и длительность);</li>
 *   <li>повторы не выполняются: недоступность модели сразу становится SERVICE_UNAVAILABLE.</li>
 * </ul>
 */
@Singleton
public class OpenRouterModelClient implements GenerativeModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterModelClient.class);

    private final DischargeProperties.Model config;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public OpenRouterModelClient(DischargeProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getModel();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .build();
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public String generate(GenerationRequest request) {
        if (!config.isConfigured()) {
            throw DischargeAssistException.serviceUnavailable("AI_NOT_CONFIGURED",
                    "Генеративная модель не сконфигурирована (не задан API-ключ)", null);
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(buildBody(request));
        } catch (IOException e) {
            throw DischargeAssistException.serviceUnavailable("AI_REQUEST_BUILD_FAILED",
                    "Не удалось сформировать запрос к модели", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(endpoint()))
                .timeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.getApiKey())
                .header("X-Title", "Discharge Assist")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        long started = System.nanoTime();
        HttpResponse<String> resp;
        try {
            resp = client.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("Модель не ответила вовремя: operation={} timeoutMs={}", request.operation(), config.getRequestTimeoutMs());
            throw DischargeAssistException.serviceUnavailable("AI_TIMEOUT",
                    "Генеративная модель не ответила за отведённое время", e);
        } catch (IOException e) {
            log.warn("Ошибка обращения к модели: operation={} error={}", request.operation(),
                    SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            throw DischargeAssistException.serviceUnavailable("AI_UNAVAILABLE",
                    "Генеративная модель недоступна", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DischargeAssistException.serviceUnavailable("AI_UNAVAILABLE",
                    "Обращение к генеративной модели прервано", e);
        }

        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("Модель вернула неуспешный статус: operation={} status={} tookMs={}", request.operation(), status, tookMs);
            throw DischargeAssistException.serviceUnavailable("AI_HTTP_" + status,
                    "Генеративная модель вернула статус " + status, null);
        }
        log.info("Ответ модели получен: operation={} model={} tookMs={}", request.operation(), config.getName(), tookMs);
        return extractContent(resp.body());
    }

    private ObjectNode buildBody(GenerationRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getName());
        ArrayNode messages = root.putArray("messages");
        ObjectNode system = messages.addObject();
        system.put("role", "system");
        system.put("content", request.systemPrompt());
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", request.userPrompt());
        root.put("temperature", request.temperature());
        root.put("max_tokens", request.maxTokens());
        return root;
    }

    private String extractContent(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (IOException e) {
            throw DischargeAssistException.serviceUnavailable("AI_BAD_RESPONSE",
                    "Ответ модели не является корректным JSON-конвертом", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw DischargeAssistException.serviceUnavailable("AI_BAD_RESPONSE", "Пустой ответ модели", null);
        }
        if (root.hasNonNull("error")) {
            String msg = root.path("error").path("message").asText("unknown");
            throw DischargeAssistException.serviceUnavailable("AI_PROVIDER_ERROR",
                    "Провайдер модели вернул ошибку: " + msg, null);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw DischargeAssistException.serviceUnavailable("AI_BAD_RESPONSE", "В ответе модели нет choices", null);
        }
        JsonNode content = choices.get(0).path("message").path("content");
        // Нестроковое содержимое отдаём как есть: его отвергнет строгий разбор.
        return content.isTextual() ? content.asText() : content.toString();
    }

    private String endpoint() {
        String base = config.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/chat/completions";
    }
}
