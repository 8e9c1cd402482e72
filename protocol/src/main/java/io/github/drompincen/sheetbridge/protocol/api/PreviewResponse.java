package io.github.drompincen.sheetbridge.protocol.api;

import java.util.List;
import java.util.Map;

public record PreviewResponse(
        String schemaId,
        List<ColumnMatchDto> columns,
        List<String> unclaimedLabels,
        List<Map<String, Object>> documents,
        List<DataQualityIssue> issues
) {}
