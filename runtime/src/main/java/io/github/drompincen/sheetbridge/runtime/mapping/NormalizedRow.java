package io.github.drompincen.sheetbridge.runtime.mapping;

import io.github.drompincen.sheetbridge.protocol.api.DataQualityIssue;
import io.github.drompincen.sheetbridge.protocol.api.IssueSeverity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A row after mapping and validation. {@code fields} holds converted values keyed by field
 * name; a row with any FATAL issue is errored and must not be written.
 */
public record NormalizedRow(int rowNumber, Map<String, Object> fields, List<DataQualityIssue> issues) {

    public boolean isErrored() {
        return issues.stream().anyMatch(i -> i.severity() == IssueSeverity.FATAL);
    }

    public Optional<DataQualityIssue> firstFatal() {
        return issues.stream().filter(i -> i.severity() == IssueSeverity.FATAL).findFirst();
    }
}
