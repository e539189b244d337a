package com.purchasingpower.tutor.exception;

import org.springframework.http.HttpStatus;

public class AuthenticationRequiredException extends TutorException {

    public AuthenticationRequiredException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
