package io.github.drompincen.sheetbridge.runtime.batch;

import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;

import java.time.Instant;

/** Guards every status change of an import batch. */
public final class BatchLifecycle {

    private BatchLifecycle() {}

    /**
     * Moves {@code batch} to {@code next}, stamping {@code endedAt} when the batch stops running.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public static void transition(ImportBatchDocument batch, BatchStatus next) {
        BatchStatus current = batch.getStatus();
        if (current == null || !current.canTransitionTo(next)) {
            throw new IllegalStateException("Batch " + batch.getBatchId() + " cannot move from " + current + " to " + next);
        }
        batch.setStatus(next);
        if (next == BatchStatus.COMPLETED || next == BatchStatus.FAILED) {
            batch.setEndedAt(Instant.now());
        }
    }
}
