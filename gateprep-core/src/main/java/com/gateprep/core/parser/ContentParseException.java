package com.gateprep.core.parser;

import com.gateprep.llm.router.RejectedResponseException;

/**
 * Provider text that could not be repaired into valid content.
 */
public class ContentParseException extends RejectedResponseException {

    public ContentParseException(String message) {
        super(message);
    }

    public ContentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
