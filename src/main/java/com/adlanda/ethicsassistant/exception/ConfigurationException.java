package com.adlanda.ethicsassistant.exception;

/**
 * Raised when settings make the service unusable. Aborts startup.
 */
public class ConfigurationException extends AssistantException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
