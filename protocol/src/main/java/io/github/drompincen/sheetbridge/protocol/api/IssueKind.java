package io.github.drompincen.sheetbridge.protocol.api;

public enum IssueKind {
    UNMAPPED_COLUMN,
    FUZZY_MATCH,
    CONVERSION_FAILED,
    MISSING_REQUIRED_VALUE,
    DUPLICATE_UNRESOLVED,
    UPDATE_TARGET_MISSING
}
