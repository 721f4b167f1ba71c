package com.adlanda.ethicsassistant.exception;

/**
 * Raised when the text-generation backend fails.
 */
public class GenerationException extends AssistantException {

    public GenerationException(String message) {
        super(ErrorKind.GENERATION, message);
    }

    public GenerationException(String message, Throwable cause) {
        super(ErrorKind.GENERATION, message, cause);
    }
}
