package com.example.mediasync.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MediaCategory {
    IMAGE,
    DOCUMENT,
    AUDIO,
    VIDEO,
    ARCHIVE,
    OTHER;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MediaCategory fromWire(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
