package io.github.drompincen.sheetbridge.protocol.api;

public enum AuditOperation {
    INSERT, UPDATE, SKIP, ROLLBACK_DELETE, ROLLBACK_RESTORE;

    public boolean isRollback() {
        return this == ROLLBACK_DELETE || this == ROLLBACK_RESTORE;
    }
}
