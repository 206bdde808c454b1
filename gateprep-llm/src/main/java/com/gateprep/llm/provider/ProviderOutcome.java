package com.gateprep.llm.provider;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of a single provider attempt. Providers report failures through the
 * status instead of throwing.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProviderOutcome {

    public enum Status {
        SUCCESS,
        RATE_LIMITED,
        TRANSIENT,
        FATAL
    }

    private final LlmProvider provider;
    private final Status status;
    private final String rawText;
    private final String reason;
    private final int httpStatus;

    public static ProviderOutcome success(LlmProvider provider, String rawText) {
        return new ProviderOutcome(provider, Status.SUCCESS, rawText, null, 200);
    }

    public static ProviderOutcome rateLimited(LlmProvider provider, String reason) {
        return new ProviderOutcome(provider, Status.RATE_LIMITED, null, reason, 429);
    }

    public static ProviderOutcome transientFailure(LlmProvider provider, String reason) {
        return new ProviderOutcome(provider, Status.TRANSIENT, null, reason, 0);
    }

    public static ProviderOutcome fatal(LlmProvider provider, String reason, int httpStatus) {
        return new ProviderOutcome(provider, Status.FATAL, null, reason, httpStatus);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRateLimited() {
        return status == Status.RATE_LIMITED;
    }

    public String describe() {
        if (isSuccess()) {
            return "Success";
        }
        String code = httpStatus > 0 ? " (HTTP " + httpStatus + ")" : "";
        return status + code + ": " + reason;
    }

    @Override
    public String toString() {
        return provider.getDisplayName() + " -> " + describe();
    }
}
