package com.purchasingpower.tutor.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends TutorException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
