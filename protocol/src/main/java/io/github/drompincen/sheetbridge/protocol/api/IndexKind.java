package io.github.drompincen.sheetbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IndexKind {
    UNIQUE, ASCENDING, DESCENDING, TEXT;

    @JsonValue
    public String value() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static IndexKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Index kind is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
