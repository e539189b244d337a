package com.purchasingpower.tutor.model.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum InteractionEventType {
    SESSION_START("session_start"),
    MESSAGE_SENT("message_sent"),
    MESSAGE_RECEIVED("message_received"),
    MODE_CHANGE("mode_change"),
    AGENT_SWITCH("agent_switch"),
    CONVERSATION_CLEAR("conversation_clear"),
    ERROR("error");

    private final String value;

    InteractionEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts the wire value or the constant name, case-insensitively.
     */
    public static Optional<InteractionEventType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
