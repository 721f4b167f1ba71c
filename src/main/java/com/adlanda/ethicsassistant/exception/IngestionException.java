package com.adlanda.ethicsassistant.exception;

/**
 * Wraps the first unrecoverable failure while ingesting one document.
 */
public class IngestionException extends AssistantException {

    private final String documentKey;
    private final ErrorKind causeKind;

    public IngestionException(String documentKey, Throwable cause) {
        super(ErrorKind.INGESTION, "Failed to process " + documentKey + ": " + cause.getMessage(), cause);
        this.documentKey = documentKey;
        this.causeKind = cause instanceof AssistantException ae ? ae.kind() : ErrorKind.INGESTION;
    }

    public String documentKey() {
        return documentKey;
    }

    /**
     * The kind of the underlying failure (extraction, embedding, index...).
     */
    public ErrorKind causeKind() {
        return causeKind;
    }
}
