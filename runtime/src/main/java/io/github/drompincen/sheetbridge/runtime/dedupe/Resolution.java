package io.github.drompincen.sheetbridge.runtime.dedupe;

import java.util.Map;

/**
 * Decision for one incoming document. {@code existing} is the matched stored document for
 * SKIP and REPLACE, null otherwise.
 */
public record Resolution(Outcome outcome, Map<String, Object> existing) {

    public enum Outcome { INSERT, REPLACE, SKIP, REJECT }

    public static Resolution insert() { return new Resolution(Outcome.INSERT, null); }

    public static Resolution replace(Map<String, Object> existing) { return new Resolution(Outcome.REPLACE, existing); }

    public static Resolution skip(Map<String, Object> existing) { return new Resolution(Outcome.SKIP, existing); }

    public static Resolution reject() { return new Resolution(Outcome.REJECT, null); }

    public String existingId() {
        return existing == null ? null : String.valueOf(existing.get("_id"));
    }
}
