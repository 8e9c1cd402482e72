package io.github.drompincen.sheetbridge.protocol.api;

public enum IssueSeverity {
    INFO, WARNING, ERROR, FATAL
}
