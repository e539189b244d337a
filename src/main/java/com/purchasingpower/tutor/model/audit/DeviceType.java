package com.purchasingpower.tutor.model.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum DeviceType {
    MOBILE("mobile"),
    TABLET("tablet"),
    DESKTOP("desktop");

    private final String value;

    DeviceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<DeviceType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
