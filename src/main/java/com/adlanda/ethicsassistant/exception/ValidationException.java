package com.adlanda.ethicsassistant.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Caller input outside the contract (blank query, topK out of range, unknown document key).
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ValidationException extends AssistantException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
