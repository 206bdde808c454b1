package com.gateprep.llm.router;

/**
 * A provider answered successfully but its text could not be used.
 */
public class RejectedResponseException extends Exception {

    public RejectedResponseException(String message) {
        super(message);
    }

    public RejectedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
