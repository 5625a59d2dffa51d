package com.krishnamouli.cohort.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubjectType {
    USER, SESSION, DEVICE, ANONYMOUS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SubjectType fromString(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
