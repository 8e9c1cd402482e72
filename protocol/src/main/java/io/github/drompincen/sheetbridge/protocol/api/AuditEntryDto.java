package io.github.drompincen.sheetbridge.protocol.api;

import java.time.Instant;
import java.util.Map;

public record AuditEntryDto(
        long seq,
        AuditOperation operation,
        String collectionName,
        String targetId,
        Map<String, Object> priorState,
        Map<String, Object> newState,
        int rowNumber,
        Instant timestamp,
        boolean pending
) {}
