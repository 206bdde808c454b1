package com.gateprep.llm.provider.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.provider.LlmProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class OpenRouterProviderClient extends ChatCompletionProviderClient {

    private static final String APP_TITLE = "GATE Civil Bot";

    public OpenRouterProviderClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(LlmProvider.OPENROUTER, properties, webClientBuilder, objectMapper);
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        super.applyHeaders(headers);
        // app attribution
        headers.set("X-Title", APP_TITLE);
    }
}
