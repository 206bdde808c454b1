package com.gateprep.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.provider.LlmProvider;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible {@code /chat/completions} providers with JSON object mode.
 */
public abstract class ChatCompletionProviderClient extends AbstractProviderClient {

    protected ChatCompletionProviderClient(
            LlmProvider provider,
            LlmProperties properties,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper) {
        super(provider, properties, webClientBuilder, objectMapper);
    }

    @Override
    protected String requestUri(String model) {
        return "/chat/completions";
    }

    @Override
    protected Object buildRequestBody(String prompt, String model) {
        return Map.of(
            "model", model,
            "messages", List.of(
                Map.of("role", "user", "content", prompt)
            ),
            "max_tokens", settings.getMaxOutputTokens(),
            "temperature", settings.getTemperature(),
            "response_format", Map.of("type", "json_object")
        );
    }

    @Override
    protected String extractContent(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
