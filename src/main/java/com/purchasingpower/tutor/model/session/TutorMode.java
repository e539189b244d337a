package com.purchasingpower.tutor.model.session;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * How the agent answering an unaddressed message is chosen.
 */
public enum TutorMode {

    /** The agent addressed by the request answers. */
    MANUAL("manual"),

    /** An {@link com.purchasingpower.tutor.service.AgentSelector} picks the agent. */
    ROUTER("router");

    private final String value;

    TutorMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<TutorMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(mode -> mode.value.equals(value))
                .findFirst();
    }
}
