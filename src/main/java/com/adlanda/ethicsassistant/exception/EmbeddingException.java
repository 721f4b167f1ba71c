package com.adlanda.ethicsassistant.exception;

/**
 * Raised when the embedding backend fails or returns misaligned vectors.
 */
public class EmbeddingException extends AssistantException {

    public EmbeddingException(String message) {
        super(ErrorKind.EMBEDDING, message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING, message, cause);
    }
}
