package io.github.drompincen.sheetbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Policy applied when an incoming row matches an existing document on the
 * schema's duplicate-detection key.
 */
public enum DuplicateStrategy {
    /** Matched rows are skipped; unmatched rows are inserted. */
    SKIP,
    /** Matched rows replace the existing document; unmatched rows are errored, never inserted. */
    UPDATE,
    /** Matched rows replace the existing document; unmatched rows are inserted. */
    UPSERT;

    @JsonValue
    public String value() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static DuplicateStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duplicate strategy is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown duplicate strategy: " + value
                    + " (expected skip, update or upsert)");
        }
    }
}
