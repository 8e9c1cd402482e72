package io.github.drompincen.sheetbridge.runtime.rows;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A raw cell as read from a file, tagged with the kind of value the reader saw.
 * Conversion to a schema type is always explicit, see
 * {@link io.github.drompincen.sheetbridge.runtime.mapping.TypeCoercer}.
 */
public record CellValue(Kind kind, Object value) {

    public enum Kind { EMPTY, TEXT, NUMBER, DATE, BOOLEAN }

    private static final CellValue EMPTY = new CellValue(Kind.EMPTY, null);

    public static CellValue empty() { return EMPTY; }

    public static CellValue text(String text) {
        return text == null ? EMPTY : new CellValue(Kind.TEXT, text);
    }

    public static CellValue number(double number) { return new CellValue(Kind.NUMBER, number); }

    public static CellValue date(Instant date) {
        return date == null ? EMPTY : new CellValue(Kind.DATE, date);
    }

    public static CellValue bool(boolean b) { return new CellValue(Kind.BOOLEAN, b); }

    /** True for empty cells and for text cells holding only whitespace. */
    public boolean isBlank() {
        return kind == Kind.EMPTY || (kind == Kind.TEXT && ((String) value).isBlank());
    }

    public String asText() { return (String) value; }

    public double asNumber() { return (Double) value; }

    public Instant asDate() { return (Instant) value; }

    public boolean asBoolean() { return (Boolean) value; }

    /** The value as a user would have typed it, for issue reports. */
    public String raw() {
        return switch (kind) {
            case EMPTY -> "";
            case TEXT -> asText();
            case NUMBER -> BigDecimal.valueOf(asNumber()).stripTrailingZeros().toPlainString();
            case DATE -> asDate().toString();
            case BOOLEAN -> String.valueOf(asBoolean());
        };
    }
}
