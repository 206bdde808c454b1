package com.gateprep.llm.provider.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.provider.LlmProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class GroqProviderClient extends ChatCompletionProviderClient {

    public GroqProviderClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(LlmProvider.GROQ, properties, webClientBuilder, objectMapper);
    }
}
