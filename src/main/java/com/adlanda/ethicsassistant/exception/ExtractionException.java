package com.adlanda.ethicsassistant.exception;

/**
 * Raised when a document cannot be turned into text (corrupt or unsupported input).
 */
public class ExtractionException extends AssistantException {

    public ExtractionException(String message) {
        super(ErrorKind.EXTRACTION, message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION, message, cause);
    }
}
