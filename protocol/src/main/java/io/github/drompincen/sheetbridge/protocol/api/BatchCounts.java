package io.github.drompincen.sheetbridge.protocol.api;

public record BatchCounts(
        int total,
        int inserted,
        int updated,
        int skipped,
        int errored
) {
    public static BatchCounts empty() {
        return new BatchCounts(0, 0, 0, 0, 0);
    }

    /** Rows that produced a forward ledger entry. */
    public int ledgered() {
        return inserted + updated + skipped;
    }
}
