package com.gateprep.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.config.WebClientConfig;
import com.gateprep.llm.provider.LlmProvider;
import com.gateprep.llm.provider.ProviderOutcome;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiProviderClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockWebServer;
    private LlmProperties properties;
    private GeminiProviderClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        properties = new LlmProperties();
        properties.getGemini().setApiKey("test-gemini-key");
        properties.getGemini().setBaseUrl(mockWebServer.url("/v1beta").toString());

        client = new GeminiProviderClient(properties, WebClientConfig.createBuilder(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }

    @Test
    @DisplayName("Success extracts the first candidate's text and sends the key header")
    void success() throws Exception {
        mockWebServer.enqueue(json(200, """
            {"candidates":[{"content":{"parts":[{"text":"{\\"fact\\":\\"Darcy's law\\"}"}]}}]}
            """));

        ProviderOutcome outcome = client.generate("Give me a fact", TIMEOUT);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getProvider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(outcome.getRawText()).isEqualTo("{\"fact\":\"Darcy's law\"}");

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/v1beta/models/gemini-2.0-flash:generateContent");
        assertThat(request.getHeader("x-goog-api-key")).isEqualTo("test-gemini-key");

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.at("/contents/0/parts/0/text").asText()).isEqualTo("Give me a fact");
        assertThat(body.at("/generationConfig/responseMimeType").asText()).isEqualTo("application/json");
    }

    @Test
    @DisplayName("HTTP 429 is classified as rate limited")
    void tooManyRequests() {
        mockWebServer.enqueue(json(429, "{\"error\":{\"code\":429,\"message\":\"Quota exceeded\"}}"));

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.RATE_LIMITED);
        assertThat(outcome.getReason()).isEqualTo("Quota exceeded");
    }

    @Test
    @DisplayName("A RESOURCE_EXHAUSTED body counts as a rate limit whatever the status")
    void resourceExhaustedBody() {
        mockWebServer.enqueue(json(403, "{\"error\":{\"status\":\"RESOURCE_EXHAUSTED\",\"message\":\"limit\"}}"));

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.isRateLimited()).isTrue();
    }

    @Test
    @DisplayName("Server errors are fatal and keep the HTTP status")
    void serverError() {
        mockWebServer.enqueue(json(500, "{\"error\":{\"message\":\"Internal error\"}}"));

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.FATAL);
        assertThat(outcome.getHttpStatus()).isEqualTo(500);
        assertThat(outcome.getReason()).isEqualTo("Internal error");
    }

    @Test
    @DisplayName("An envelope without candidates is fatal")
    void unexpectedEnvelope() {
        mockWebServer.enqueue(json(200, "{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}"));

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.FATAL);
        assertThat(outcome.getReason()).contains("Unexpected Gemini response shape");
    }

    @Test
    @DisplayName("A body that is not JSON is fatal")
    void malformedEnvelope() {
        mockWebServer.enqueue(json(200, "<html>bad gateway</html>"));

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.FATAL);
    }

    @Test
    @DisplayName("No response within the deadline is transient")
    void timeout() {
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        ProviderOutcome outcome = client.generate("prompt", Duration.ofMillis(300));

        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.TRANSIENT);
        assertThat(outcome.getReason()).contains("Timed out");
    }

    @Test
    @DisplayName("Connection refused is transient")
    void connectionFailure() throws IOException {
        mockWebServer.shutdown();

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.TRANSIENT);
    }

    @Test
    @DisplayName("Without an API key the client is unavailable and makes no call")
    void noApiKey() {
        properties.getGemini().setApiKey("  ");
        GeminiProviderClient unconfigured = new GeminiProviderClient(properties, WebClientConfig.createBuilder(), objectMapper);

        ProviderOutcome outcome = unconfigured.generate("prompt", TIMEOUT);

        assertThat(unconfigured.isAvailable()).isFalse();
        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.FATAL);
        assertThat(mockWebServer.getRequestCount()).isZero();
    }
}
