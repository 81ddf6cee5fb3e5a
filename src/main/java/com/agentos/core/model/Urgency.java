package com.agentos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Urgency attached to a clarifying question.
 */
public enum Urgency {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Urgency fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("urgency must not be null");
        }
        return Urgency.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
