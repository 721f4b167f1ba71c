package com.adlanda.ethicsassistant.exception;

/**
 * Raised when listing or reading source documents fails.
 */
public class StorageException extends AssistantException {

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
