package com.adlanda.ethicsassistant.exception;

/**
 * Raised when an upsert, search or delete against the vector index fails.
 */
public class IndexException extends AssistantException {

    public IndexException(String message) {
        super(ErrorKind.INDEX, message);
    }

    public IndexException(String message, Throwable cause) {
        super(ErrorKind.INDEX, message, cause);
    }
}
