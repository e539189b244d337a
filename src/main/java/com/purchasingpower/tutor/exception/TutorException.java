package com.purchasingpower.tutor.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base for every failure the tutoring core surfaces to its callers.
 * The status is what the REST layer answers with.
 */
@Getter
public abstract class TutorException extends RuntimeException {

    private final HttpStatus status;

    protected TutorException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected TutorException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
