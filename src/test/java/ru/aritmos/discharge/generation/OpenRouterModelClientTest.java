package ru.aritmos.discharge.generation;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import ru.aritmos.discharge.config.DischargeProperties;
import ru.aritmos.discharge.core.DischargeAssistException;
import ru.aritmos.discharge.support.TestClinicalData;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OpenRouterModelClientTest {

    private static final GenerationRequest REQUEST = new GenerationRequest(
            GenerationRequest.Operation.QUESTION, "system", "user", 0.2, 100);

    @Test
    void generate_shouldPostChatCompletionAndReturnContent() throws Exception {
        AtomicReference<String> auth = new AtomicReference<>();
        AtomicReference<String> body = new AtomicReference<>();
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/v1/chat/completions", exchange -> {
            auth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"ok\\\":true}\"}}]}");
        });
        server.start();
        try {
            OpenRouterModelClient client = client(server, 5000);

            String content = client.generate(REQUEST);

            assertEquals("{\"ok\":true}", content);
            assertEquals("Bearer sk-test-key-123456", auth.get());
            assertTrue(body.get().contains("\"max_tokens\":100"));
            assertTrue(body.get().contains("\"role\":\"system\""));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void generate_shouldMapServerErrorToServiceUnavailable() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/v1/chat/completions", exchange -> respond(exchange, 500, "{\"error\":\"boom\"}"));
        server.start();
        try {
            DischargeAssistException e = assertThrows(DischargeAssistException.class,
                    () -> client(server, 5000).generate(REQUEST));

            assertEquals(DischargeAssistException.ErrorKind.SERVICE_UNAVAILABLE, e.kind());
            assertEquals("AI_HTTP_500", e.errorCode());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void generate_shouldMapProviderErrorEnvelope() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/v1/chat/completions",
                exchange -> respond(exchange, 200, "{\"error\":{\"message\":\"rate limited\"}}"));
        server.start();
        try {
            DischargeAssistException e = assertThrows(DischargeAssistException.class,
                    () -> client(server, 5000).generate(REQUEST));

            assertEquals("AI_PROVIDER_ERROR", e.errorCode());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void generate_shouldTimeOut() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/v1/chat/completions", exchange -> {
            try {
                Thread.sleep(1500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "{}");
        });
        server.start();
        try {
            DischargeAssistException e = assertThrows(DischargeAssistException.class,
                    () -> client(server, 200).generate(REQUEST));

            assertEquals(DischargeAssistException.ErrorKind.SERVICE_UNAVAILABLE, e.kind());
            assertEquals("AI_TIMEOUT", e.errorCode());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void generate_shouldFailFastWithoutApiKey() {
        DischargeProperties props = new DischargeProperties();
        OpenRouterModelClient client = new OpenRouterModelClient(props, TestClinicalData.objectMapper());

        assertFalse(client.isConfigured());
        DischargeAssistException e = assertThrows(DischargeAssistException.class, () -> client.generate(REQUEST));
        assertEquals("AI_NOT_CONFIGURED", e.errorCode());
    }

    private static OpenRouterModelClient client(HttpServer server, long requestTimeoutMs) {
        DischargeProperties props = TestClinicalData.properties();
        props.getModel().setBaseUrl("http://localhost:" + server.getAddress().getPort() + "/api/v1/");
        props.getModel().setRequestTimeoutMs(requestTimeoutMs);
        return new OpenRouterModelClient(props, TestClinicalData.objectMapper());
    }

    private static void respond(HttpExchange exchange, int status, String response) throws IOException {
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
