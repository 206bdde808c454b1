package com.gateprep.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.config.WebClientConfig;
import com.gateprep.llm.provider.ProviderOutcome;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChatCompletionProviderClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockWebServer;
    private LlmProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        properties = new LlmProperties();
        properties.getGroq().setApiKey("groq-key");
        properties.getGroq().setBaseUrl(mockWebServer.url("/openai/v1").toString());
        properties.getOpenrouter().setApiKey("openrouter-key");
        properties.getOpenrouter().setModel("meta-llama/llama-3.1-8b-instruct:free");
        properties.getOpenrouter().setBaseUrl(mockWebServer.url("/api/v1").toString());
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
    @DisplayName("Groq request uses bearer auth, JSON mode and returns the message content")
    void groqSuccess() throws Exception {
        mockWebServer.enqueue(json(200,
            "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"title\\\":\\\"Bernoulli\\\"}\"}}]}"));
        GroqProviderClient client = new GroqProviderClient(properties, WebClientConfig.createBuilder(), objectMapper);

        ProviderOutcome outcome = client.generate("formula please", TIMEOUT);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getRawText()).isEqualTo("{\"title\":\"Bernoulli\"}");

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/openai/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer groq-key");

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("llama-3.3-70b-versatile");
        assertThat(body.at("/messages/0/content").asText()).isEqualTo("formula please");
        assertThat(body.at("/response_format/type").asText()).isEqualTo("json_object");
    }

    @Test
    @DisplayName("OpenRouter uses the configured model and sends the attribution header")
    void openRouterRequest() throws Exception {
        mockWebServer.enqueue(json(200, "{\"choices\":[{\"message\":{\"content\":\"{}\"}}]}"));
        OpenRouterProviderClient client = new OpenRouterProviderClient(properties, WebClientConfig.createBuilder(), objectMapper);

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.isSuccess()).isTrue();
        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/api/v1/chat/completions");
        assertThat(request.getHeader("X-Title")).isNotBlank();
        assertThat(objectMapper.readTree(request.getBody().readUtf8()).path("model").asText())
            .isEqualTo("meta-llama/llama-3.1-8b-instruct:free");
    }

    @Test
    @DisplayName("A rate_limit_exceeded error body is a rate limit")
    void rateLimitBody() {
        mockWebServer.enqueue(json(429,
            "{\"error\":{\"message\":\"Rate limit reached for model\",\"type\":\"tokens\",\"code\":\"rate_limit_exceeded\"}}"));
        GroqProviderClient client = new GroqProviderClient(properties, WebClientConfig.createBuilder(), objectMapper);

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.isRateLimited()).isTrue();
        assertThat(outcome.getReason()).isEqualTo("Rate limit reached for model");
    }

    @Test
    @DisplayName("Unauthorized is fatal")
    void unauthorized() {
        mockWebServer.enqueue(json(401, "{\"error\":{\"message\":\"Invalid API Key\"}}"));
        GroqProviderClient client = new GroqProviderClient(properties, WebClientConfig.createBuilder(), objectMapper);

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.FATAL);
        assertThat(outcome.getHttpStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("Empty choices are fatal")
    void emptyChoices() {
        mockWebServer.enqueue(json(200, "{\"choices\":[]}"));
        GroqProviderClient client = new GroqProviderClient(properties, WebClientConfig.createBuilder(), objectMapper);

        ProviderOutcome outcome = client.generate("prompt", TIMEOUT);

        assertThat(outcome.getStatus()).isEqualTo(ProviderOutcome.Status.FATAL);
    }
}
