package com.purchasingpower.tutor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.tutor.exception.ProviderException;
import com.purchasingpower.tutor.model.provider.ProviderType;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Turns whatever a backend call threw into a {@link ProviderException} carrying the upstream message.
 */
final class UpstreamErrors {

    private UpstreamErrors() {
    }

    static ProviderException wrap(ProviderType provider, Throwable error, ObjectMapper objectMapper) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            String message = upstreamMessage(responseException.getResponseBodyAsString(), objectMapper);
            if (message == null) {
                message = responseException.getStatusText();
            }
            return new ProviderException(provider.getServiceName(), status,
                    provider.getServiceName() + " API error (" + status + "): " + message, responseException);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ProviderException(provider.getServiceName(), null,
                provider.getServiceName() + " call failed: " + message, error);
    }

    /**
     * Both backends report failures as {"error": {"message": ...}}.
     */
    private static String upstreamMessage(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : body;
        } catch (Exception e) {
            return body;
        }
    }
}
