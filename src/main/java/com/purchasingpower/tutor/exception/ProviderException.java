package com.purchasingpower.tutor.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * An upstream LLM backend call failed (rate limit, network fault, malformed payload).
 * The message is the upstream one; no retry has been attempted.
 */
@Getter
public class ProviderException extends TutorException {

    private final String provider;

    private final Integer upstreamStatus;

    public ProviderException(String provider, Integer upstreamStatus, String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
        this.provider = provider;
        this.upstreamStatus = upstreamStatus;
    }

    public ProviderException(String provider, String message) {
        this(provider, null, message, null);
    }
}
