package com.agentos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Priority fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("priority must not be null");
        }
        return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
