package io.github.drompincen.sheetbridge.protocol.api;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an import batch.
 * <pre>
 * CREATED -> RUNNING -> COMPLETED -> ROLLED_BACK
 *    |          \-> FAILED
 *    \-> FAILED | COMPLETED (empty source)
 * </pre>
 */
public enum BatchStatus {
    CREATED, RUNNING, COMPLETED, FAILED, ROLLED_BACK;

    public Set<BatchStatus> allowedTransitions() {
        return switch (this) {
            case CREATED -> EnumSet.of(RUNNING, COMPLETED, FAILED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED -> EnumSet.of(ROLLED_BACK);
            case FAILED, ROLLED_BACK -> EnumSet.noneOf(BatchStatus.class);
        };
    }

    public boolean canTransitionTo(BatchStatus next) {
        return allowedTransitions().contains(next);
    }

    /** True once no further row processing can happen. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ROLLED_BACK;
    }
}
