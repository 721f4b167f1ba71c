package com.adlanda.ethicsassistant.exception;

/**
 * Base class for every failure raised by the assistant's pipelines and collaborator adapters.
 */
public abstract class AssistantException extends RuntimeException {

    private final ErrorKind kind;

    protected AssistantException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AssistantException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
