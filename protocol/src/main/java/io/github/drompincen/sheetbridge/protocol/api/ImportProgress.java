package io.github.drompincen.sheetbridge.protocol.api;

public record ImportProgress(
        String batchId,
        BatchStatus status,
        int processedRows,
        int estimatedTotalRows,
        BatchCounts counts,
        long elapsedMs,
        long estimatedRemainingMs
) {
    public double percentComplete() {
        if (estimatedTotalRows <= 0) return 0.0;
        return Math.min(100.0, processedRows * 100.0 / estimatedTotalRows);
    }
}
