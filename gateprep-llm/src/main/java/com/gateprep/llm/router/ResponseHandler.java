package com.gateprep.llm.router;

/**
 * Turns a provider's raw text into a result. Throwing
 * {@link RejectedResponseException} counts as a failure of that provider and
 * sends the request on to the next one.
 */
@FunctionalInterface
public interface ResponseHandler<T> {

    T handle(String rawText) throws RejectedResponseException;
}
