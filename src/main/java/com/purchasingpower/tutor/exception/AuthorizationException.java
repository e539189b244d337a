package com.purchasingpower.tutor.exception;

import org.springframework.http.HttpStatus;

public class AuthorizationException extends TutorException {

    public AuthorizationException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
