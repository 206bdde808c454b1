package com.gateprep.llm.provider.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.provider.LlmProvider;
import com.gateprep.llm.provider.ProviderClient;
import com.gateprep.llm.provider.ProviderOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Shared request/classification plumbing for provider clients. Subclasses supply
 * the provider-specific request shape and pull the generated text out of the
 * response envelope.
 */
@Slf4j
public abstract class AbstractProviderClient implements ProviderClient {

    protected static final String JSON_ONLY_DIRECTIVE =
        "\n\nRespond with valid JSON only. No markdown, no code blocks.";

    protected final LlmProvider provider;
    protected final LlmProperties.ProviderSettings settings;
    protected final ObjectMapper objectMapper;
    private final WebClient webClient;
    private final String tag;

    protected AbstractProviderClient(
            LlmProvider provider,
            LlmProperties properties,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper) {
        this.provider = provider;
        this.settings = properties.settingsFor(provider);
        this.objectMapper = objectMapper;
        this.tag = "[" + provider.name() + "]";
        this.webClient = webClientBuilder.clone()
            .baseUrl(settings.effectiveBaseUrl(provider))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    protected abstract String requestUri(String model);

    protected abstract Object buildRequestBody(String prompt, String model);

    /**
     * @return the generated text, or null when the envelope does not carry it
     */
    protected abstract String extractContent(JsonNode root);

    protected void applyHeaders(HttpHeaders headers) {
        headers.setBearerAuth(settings.getApiKey());
    }

    @Override
    public ProviderOutcome generate(String prompt, Duration timeout) {
        if (!isAvailable()) {
            return ProviderOutcome.fatal(provider, "No API key configured", 0);
        }

        long startTime = System.currentTimeMillis();
        String model = getModel();

        log.info("{} Starting content generation | model={} | promptLength={} | timeoutMs={}",
            tag, model, prompt.length(), timeout.toMillis());

        String response;
        try {
            response = webClient.post()
                .uri(requestUri(model))
                .headers(this::applyHeaders)
                .bodyValue(buildRequestBody(prompt, model))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("{} HTTP error | model={} | statusCode={} | statusText={} | durationMs={}",
                tag, model, e.getStatusCode().value(), e.getStatusText(), duration);
            return classifyHttpError(e);
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            Throwable cause = Exceptions.unwrap(e);
            log.error("{} Request failed | model={} | durationMs={} | errorType={} | error={}",
                tag, model, duration, cause.getClass().getSimpleName(), cause.getMessage());
            return classifyTransportError(e, cause, timeout);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.debug("{} Received response | model={} | durationMs={} | responseLength={}",
            tag, model, duration, response != null ? response.length() : 0);

        return decodeEnvelope(response, model, duration);
    }

    private ProviderOutcome decodeEnvelope(String response, String model, long duration) {
        if (response == null || response.isBlank()) {
            log.warn("{} Empty response body | model={}", tag, model);
            return ProviderOutcome.fatal(provider, "Empty response body", 200);
        }
        String content;
        try {
            content = extractContent(objectMapper.readTree(response));
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to decode response envelope | model={} | error={}", tag, model, e.getOriginalMessage());
            return ProviderOutcome.fatal(provider, "Failed to parse " + provider.getDisplayName() + " response", 200);
        }
        if (content == null || content.isBlank()) {
            log.warn("{} Response envelope carries no generated text | model={}", tag, model);
            return ProviderOutcome.fatal(provider, "Unexpected " + provider.getDisplayName() + " response shape", 200);
        }

        log.info("{} Content generated successfully | model={} | durationMs={} | responseLength={}",
            tag, model, duration, content.length());
        return ProviderOutcome.success(provider, content);
    }

    private ProviderOutcome classifyHttpError(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        String message = extractErrorMessage(body)
            .orElse(String.format("%s API error: %d %s", provider.getDisplayName(), status, e.getStatusText()));

        if (status == 429 || hasRateLimitSignal(body)) {
            log.warn("{} Rate limited | statusCode={} | message={}", tag, status, message);
            return ProviderOutcome.rateLimited(provider, message);
        }
        return ProviderOutcome.fatal(provider, message, status);
    }

    private ProviderOutcome classifyTransportError(RuntimeException e, Throwable cause, Duration timeout) {
        if (cause instanceof TimeoutException) {
            return ProviderOutcome.transientFailure(provider, "Timed out after " + timeout.toMillis() + "ms");
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return ProviderOutcome.transientFailure(provider, "Interrupted");
        }
        if (e instanceof WebClientRequestException || hasIoCause(cause)) {
            return ProviderOutcome.transientFailure(provider, "Connection failure: " + cause.getMessage());
        }
        return ProviderOutcome.fatal(provider, provider.getDisplayName() + " request failed: " + cause.getMessage(), 0);
    }

    private Optional<String> extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode error = objectMapper.readTree(body);
            JsonNode nested = error.path("error");
            if (nested.isTextual()) {
                return Optional.of(nested.asText());
            }
            if (nested.path("message").isTextual()) {
                return Optional.of(nested.path("message").asText());
            }
            if (error.path("message").isTextual()) {
                return Optional.of(error.path("message").asText());
            }
        } catch (JsonProcessingException e) {
            log.debug("{} Error body is not JSON | error={}", tag, e.getOriginalMessage());
        }
        return Optional.empty();
    }

    private static boolean hasRateLimitSignal(String body) {
        if (body == null) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("resource_exhausted")
            || lower.contains("rate_limit")
            || lower.contains("rate limit");
    }

    private static boolean hasIoCause(Throwable t) {
        while (t != null) {
            if (t instanceof IOException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    @Override
    public LlmProvider getProvider() {
        return provider;
    }

    @Override
    public boolean isAvailable() {
        return settings.hasApiKey();
    }

    @Override
    public String getModel() {
        return settings.effectiveModel(provider);
    }
}
