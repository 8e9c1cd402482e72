package io.github.drompincen.sheetbridge.protocol.api;

public record RollbackEligibility(
        String batchId,
        boolean eligible,
        String reason
) {}
