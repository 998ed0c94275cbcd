package com.hvacops.copilot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChatRole {
    SYSTEM,
    USER,
    ASSISTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChatRole fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return ChatRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
