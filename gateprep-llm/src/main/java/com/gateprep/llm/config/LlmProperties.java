package com.gateprep.llm.config;

import com.gateprep.llm.provider.LlmProvider;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Provider credentials and failover tuning. Credentials are read once at start-up;
 * a blank api key makes that provider unavailable.
 */
@Configuration
@ConfigurationProperties(prefix = "llm")
@Getter
@Setter
public class LlmProperties {

    private int requestTimeoutSeconds = 30;
    private Router router = new Router();

    private ProviderSettings gemini = new ProviderSettings();
    private ProviderSettings groq = new ProviderSettings();
    private ProviderSettings openrouter = new ProviderSettings();
    private ProviderSettings huggingface = new ProviderSettings();

    public ProviderSettings settingsFor(LlmProvider provider) {
        switch (provider) {
            case GEMINI:
                return gemini;
            case GROQ:
                return groq;
            case OPENROUTER:
                return openrouter;
            case HUGGINGFACE:
                return huggingface;
            default:
                throw new IllegalArgumentException("Unknown provider: " + provider);
        }
    }

    @Getter
    @Setter
    public static class Router {
        private int primaryMaxAttempts = 3;
        private long retryBaseDelayMs = 2000;
    }

    @Getter
    @Setter
    public static class ProviderSettings {
        private String apiKey;
        private String model;
        private String baseUrl;
        private int maxOutputTokens = 1024;
        private double temperature = 1.0;

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String effectiveModel(LlmProvider provider) {
            return model != null && !model.isBlank() ? model : provider.getDefaultModel();
        }

        public String effectiveBaseUrl(LlmProvider provider) {
            return baseUrl != null && !baseUrl.isBlank() ? baseUrl : provider.getBaseUrl();
        }
    }
}
