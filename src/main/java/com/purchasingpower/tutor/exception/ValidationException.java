package com.purchasingpower.tutor.exception;

import org.springframework.http.HttpStatus;

/**
 * Client input rejected before any side effect.
 */
public class ValidationException extends TutorException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
