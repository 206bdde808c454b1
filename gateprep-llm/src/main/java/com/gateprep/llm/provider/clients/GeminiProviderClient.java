package com.gateprep.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.provider.LlmProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Primary provider. Uses the direct {@code generateContent} endpoint with the
 * response MIME type pinned to JSON.
 */
@Component
public class GeminiProviderClient extends AbstractProviderClient {

    public GeminiProviderClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(LlmProvider.GEMINI, properties, webClientBuilder, objectMapper);
    }

    @Override
    protected String requestUri(String model) {
        return "/models/" + model + ":generateContent";
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.set("x-goog-api-key", settings.getApiKey());
    }

    @Override
    protected Object buildRequestBody(String prompt, String model) {
        return Map.of(
            "contents", List.of(
                Map.of("parts", List.of(
                    Map.of("text", prompt)
                ))
            ),
            "generationConfig", Map.of(
                "temperature", settings.getTemperature(),
                "topP", 0.95,
                "topK", 40,
                "maxOutputTokens", settings.getMaxOutputTokens(),
                "responseMimeType", "application/json"
            )
        );
    }

    @Override
    protected String extractContent(JsonNode root) {
        JsonNode text = root.path("candidates")
            .path(0)
            .path("content")
            .path("parts")
            .path(0)
            .path("text");
        return text.isTextual() ? text.asText() : null;
    }
}
