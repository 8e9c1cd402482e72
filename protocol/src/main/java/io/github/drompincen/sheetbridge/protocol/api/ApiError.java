package io.github.drompincen.sheetbridge.protocol.api;

/** Error body returned to API callers; {@code rowNumber} and {@code column} are null when not row-scoped. */
public record ApiError(
        String code,
        String message,
        Integer rowNumber,
        String column
) {
    public static ApiError of(String code, String message) {
        return new ApiError(code, message, null, null);
    }
}
