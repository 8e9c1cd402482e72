package io.github.drompincen.sheetbridge.protocol.api;

import java.util.List;

public record RollbackReport(
        String batchId,
        int restored,
        int failed,
        int skipped,
        List<String> failures,
        BatchStatus status
) {
    public boolean isComplete() {
        return failed == 0;
    }
}
