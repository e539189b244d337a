package com.purchasingpower.tutor.exception;

import org.springframework.http.HttpStatus;

/**
 * No LLM provider could be resolved from either the configuration table or the environment.
 */
public class ConfigurationException extends TutorException {

    public ConfigurationException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
