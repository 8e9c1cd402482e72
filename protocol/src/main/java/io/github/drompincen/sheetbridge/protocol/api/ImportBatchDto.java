package io.github.drompincen.sheetbridge.protocol.api;

import java.time.Instant;
import java.util.List;

public record ImportBatchDto(
        String batchId,
        String schemaId,
        String schemaName,
        String sourceName,
        String sourceHash,
        int dataStartRow,
        String collectionName,
        DuplicateStrategy duplicateStrategy,
        BatchStatus status,
        BatchCounts counts,
        Instant startedAt,
        Instant endedAt,
        List<String> errorSummaries,
        String failureReason,
        int rollbackAttempts
) {}
