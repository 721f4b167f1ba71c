package com.adlanda.ethicsassistant.exception;

/**
 * Raised when a collaborator cannot be reached.
 */
public class ConnectivityException extends AssistantException {

    public ConnectivityException(String message) {
        super(ErrorKind.CONNECTIVITY, message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(ErrorKind.CONNECTIVITY, message, cause);
    }
}
