package io.github.drompincen.sheetbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FieldType {
    STRING("String"),
    NUMBER("Number"),
    DATE("Date"),
    BOOLEAN("Boolean");

    private final String label;

    FieldType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() { return label; }

    /** Accepts both the display label ("Number") and the constant name ("NUMBER"). */
    @JsonCreator
    public static FieldType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Field type is required");
        }
        String trimmed = value.trim();
        for (FieldType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed) || type.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + value);
    }
}
