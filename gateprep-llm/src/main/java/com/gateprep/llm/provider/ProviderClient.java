package com.gateprep.llm.provider;

import java.time.Duration;

public interface ProviderClient {

    /**
     * Performs exactly one network call. Never throws for HTTP, timeout or
     * envelope errors; those are reported as the outcome's status.
     */
    ProviderOutcome generate(String prompt, Duration timeout);

    LlmProvider getProvider();

    /**
     * False when the provider has no credential configured; the router skips it.
     */
    boolean isAvailable();

    String getModel();
}
