package com.gateprep.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.provider.LlmProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Text-generation inference endpoint. There is no JSON mode, so the JSON-only
 * directive is appended to the prompt instead.
 */
@Component
public class HuggingFaceProviderClient extends AbstractProviderClient {

    public HuggingFaceProviderClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(LlmProvider.HUGGINGFACE, properties, webClientBuilder, objectMapper);
    }

    @Override
    protected String requestUri(String model) {
        return "/" + model;
    }

    @Override
    protected Object buildRequestBody(String prompt, String model) {
        return Map.of(
            "inputs", prompt + JSON_ONLY_DIRECTIVE,
            "parameters", Map.of(
                "max_new_tokens", settings.getMaxOutputTokens(),
                "temperature", settings.getTemperature(),
                "return_full_text", false
            )
        );
    }

    @Override
    protected String extractContent(JsonNode root) {
        JsonNode generation = root.isArray() ? root.path(0) : root;
        JsonNode text = generation.path("generated_text");
        return text.isTextual() ? text.asText() : null;
    }
}
