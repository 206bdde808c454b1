package com.gateprep.llm.router;

import com.gateprep.llm.config.LlmProperties;
import com.gateprep.llm.provider.LlmProvider;
import com.gateprep.llm.provider.ProviderClient;
import com.gateprep.llm.provider.ProviderOutcome;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Ordered failover across generation providers.
 *
 * <p>The primary (highest priority available) provider gets a bounded number of attempts with
 * linear backoff ({@code baseDelay * attemptNumber}); a rate-limit response ends
 * its attempts at once with no delay. Every backup gets exactly one attempt.
 * Providers without credentials are skipped and do not count as failures.</p>
 */
@Service
@Slf4j
public class FailoverLlmRouter {

    private final List<ProviderClient> providerClients;
    private final Map<LlmProvider, ProviderState> providerStates = new LinkedHashMap<>();
    private final int primaryMaxAttempts;
    private final long retryBaseDelayMs;
    private final Duration requestTimeout;

    public FailoverLlmRouter(List<ProviderClient> clients, LlmProperties properties) {
        List<ProviderClient> ordered = new ArrayList<>(clients);
        ordered.sort(Comparator.comparingInt(c -> c.getProvider().getPriority()));
        this.providerClients = Collections.unmodifiableList(ordered);
        this.primaryMaxAttempts = Math.max(1, properties.getRouter().getPrimaryMaxAttempts());
        this.retryBaseDelayMs = Math.max(0, properties.getRouter().getRetryBaseDelayMs());
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());

        for (ProviderClient client : providerClients) {
            providerStates.put(client.getProvider(), new ProviderState(client.getProvider(), client.getModel()));
            if (client.isAvailable()) {
                log.info("[ROUTER] Provider registered | provider={} | priority={} | model={}",
                    client.getProvider().getDisplayName(), client.getProvider().getPriority(), client.getModel());
            } else {
                log.warn("[ROUTER] Provider has no API key and will be skipped | provider={}",
                    client.getProvider().getDisplayName());
            }
        }

        if (!hasConfiguredProviders()) {
            log.warn("[ROUTER] No generation provider is configured - every request will be served from the cache");
        } else {
            log.info("[ROUTER] Initialized | availableProviders={} | primaryMaxAttempts={} | retryBaseDelayMs={} | timeoutSeconds={}",
                availableProviders().stream().map(LlmProvider::getDisplayName).collect(Collectors.joining(", ")),
                primaryMaxAttempts, retryBaseDelayMs, requestTimeout.getSeconds());
        }
    }

    public boolean hasConfiguredProviders() {
        return providerClients.stream().anyMatch(ProviderClient::isAvailable);
    }

    public List<LlmProvider> availableProviders() {
        return providerClients.stream()
            .filter(ProviderClient::isAvailable)
            .map(ProviderClient::getProvider)
            .collect(Collectors.toList());
    }

    public String generateContent(String prompt) throws LlmRouterException {
        return generateContent(prompt, rawText -> rawText);
    }

    public <T> T generateContent(String prompt, ResponseHandler<T> handler) throws LlmRouterException {
        long requestStartTime = System.currentTimeMillis();
        String requestId = "req-" + requestStartTime + "-" + Thread.currentThread().getId();

        log.info("[ROUTER] Starting LLM request | requestId={} | promptLength={} | availableProviders={}",
            requestId, prompt.length(), availableProviders().size());

        List<LlmProvider> attemptedProviders = new ArrayList<>();
        Map<LlmProvider, String> lastErrors = new LinkedHashMap<>();
        LlmProvider primary = providerClients.stream()
            .filter(ProviderClient::isAvailable)
            .map(ProviderClient::getProvider)
            .findFirst()
            .orElse(null);

        for (ProviderClient client : providerClients) {
            LlmProvider provider = client.getProvider();

            if (!client.isAvailable()) {
                log.debug("[ROUTER] Skipping provider without credentials | requestId={} | provider={}",
                    requestId, provider.getDisplayName());
                continue;
            }

            attemptedProviders.add(provider);
            int maxAttempts = provider == primary ? primaryMaxAttempts : 1;

            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                checkNotInterrupted(requestId, attemptedProviders, lastErrors);

                log.info("[ROUTER] Attempting provider | requestId={} | provider={} | attempt={}/{} | model={}",
                    requestId, provider.getDisplayName(), attempt, maxAttempts, client.getModel());

                long providerStartTime = System.currentTimeMillis();
                ProviderOutcome outcome = client.generate(prompt, requestTimeout);
                long providerDuration = System.currentTimeMillis() - providerStartTime;
                ProviderState state = providerStates.get(provider);

                if (outcome.isSuccess()) {
                    try {
                        T result = handler.handle(outcome.getRawText());
                        state.recordSuccess();
                        log.info("[ROUTER] Request succeeded | requestId={} | provider={} | attempt={} | providerDurationMs={} | totalDurationMs={}",
                            requestId, provider.getDisplayName(), attempt, providerDuration,
                            System.currentTimeMillis() - requestStartTime);
                        return result;
                    } catch (RejectedResponseException e) {
                        String error = "ParseError: " + e.getMessage();
                        state.recordFailure(error, false);
                        lastErrors.put(provider, error);
                        log.warn("[ROUTER] Provider response rejected, moving to next provider | requestId={} | provider={} | reason={}",
                            requestId, provider.getDisplayName(), e.getMessage());
                        break;
                    }
                }

                state.recordFailure(outcome.describe(), outcome.isRateLimited());
                lastErrors.put(provider, outcome.describe());

                log.warn("[ROUTER] Provider request failed | requestId={} | provider={} | attempt={}/{} | status={} | httpStatus={} | durationMs={} | error={}",
                    requestId, provider.getDisplayName(), attempt, maxAttempts, outcome.getStatus(),
                    outcome.getHttpStatus(), providerDuration, outcome.getReason());

                if (outcome.isRateLimited()) {
                    log.info("[ROUTER] Rate limited - failing over without retry | requestId={} | provider={}",
                        requestId, provider.getDisplayName());
                    break;
                }

                if (attempt < maxAttempts) {
                    long delay = retryBaseDelayMs * attempt;
                    log.info("[ROUTER] Waiting before retry | requestId={} | provider={} | waitMs={}",
                        requestId, provider.getDisplayName(), delay);
                    try {
                        pause(delay);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw cancelled(requestId, attemptedProviders, lastErrors);
                    }
                }
            }
        }

        long totalDuration = System.currentTimeMillis() - requestStartTime;
        log.error("[ROUTER] All providers failed | requestId={} | attemptedProviders={} | totalDurationMs={} | lastErrors={}",
            requestId,
            attemptedProviders.stream().map(LlmProvider::getDisplayName).collect(Collectors.joining(",")),
            totalDuration, describeErrors(lastErrors));

        throw new LlmRouterException(
            attemptedProviders.isEmpty()
                ? "No generation provider is configured"
                : "All providers failed after trying " + attemptedProviders.size() + " provider(s)",
            attemptedProviders,
            lastErrors
        );
    }

    /**
     * Backoff wait between primary attempts.
     */
    protected void pause(long delayMs) throws InterruptedException {
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }
    }

    private void checkNotInterrupted(String requestId, List<LlmProvider> attempted, Map<LlmProvider, String> lastErrors) {
        if (Thread.currentThread().isInterrupted()) {
            throw cancelled(requestId, attempted, lastErrors);
        }
    }

    private LlmRouterException cancelled(String requestId, List<LlmProvider> attempted, Map<LlmProvider, String> lastErrors) {
        log.warn("[ROUTER] Request cancelled | requestId={} | attemptedProviders={}", requestId, attempted.size());
        return new LlmRouterException("Request cancelled", attempted, lastErrors);
    }

    private static String describeErrors(Map<LlmProvider, String> lastErrors) {
        return lastErrors.entrySet().stream()
            .map(e -> e.getKey().getDisplayName() + "=" + e.getValue())
            .collect(Collectors.joining("; ", "[", "]"));
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalProviders", providerClients.size());
        stats.put("configuredProviders", availableProviders().size());
        stats.put("primaryMaxAttempts", primaryMaxAttempts);
        stats.put("retryBaseDelayMs", retryBaseDelayMs);

        Map<String, Object> providerStats = new LinkedHashMap<>();
        for (ProviderClient client : providerClients) {
            ProviderState state = providerStates.get(client.getProvider());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("configured", client.isAvailable());
            entry.put("priority", client.getProvider().getPriority());
            entry.put("model", state.getModel());
            entry.put("attempts", state.getAttempts().get());
            entry.put("successes", state.getSuccesses().get());
            entry.put("failures", state.getFailures().get());
            entry.put("rateLimited", state.getRateLimited().get());
            entry.put("lastError", state.getLastError().get());
            providerStats.put(client.getProvider().getDisplayName(), entry);
        }
        stats.put("providers", providerStats);
        return stats;
    }

    @Getter
    public static class ProviderState {
        private final LlmProvider provider;
        private final String model;

        private final AtomicLong attempts = new AtomicLong(0);
        private final AtomicLong successes = new AtomicLong(0);
        private final AtomicLong failures = new AtomicLong(0);
        private final AtomicLong rateLimited = new AtomicLong(0);
        private final AtomicReference<String> lastError = new AtomicReference<>();

        ProviderState(LlmProvider provider, String model) {
            this.provider = provider;
            this.model = model;
        }

        void recordSuccess() {
            attempts.incrementAndGet();
            successes.incrementAndGet();
        }

        void recordFailure(String error, boolean wasRateLimited) {
            attempts.incrementAndGet();
            failures.incrementAndGet();
            if (wasRateLimited) {
                rateLimited.incrementAndGet();
            }
            lastError.set(error);
        }
    }

    public static class LlmRouterException extends RuntimeException {
        @Getter private final List<LlmProvider> attemptedProviders;
        @Getter private final Map<LlmProvider, String> lastErrors;

        public LlmRouterException(String message, List<LlmProvider> attempted, Map<LlmProvider, String> lastErrors) {
            super(message);
            this.attemptedProviders = List.copyOf(attempted);
            this.lastErrors = Collections.unmodifiableMap(new LinkedHashMap<>(lastErrors));
        }
    }
}
