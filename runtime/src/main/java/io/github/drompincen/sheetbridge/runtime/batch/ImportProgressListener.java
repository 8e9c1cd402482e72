package io.github.drompincen.sheetbridge.runtime.batch;

import io.github.drompincen.sheetbridge.protocol.api.ImportProgress;

/** Receives progress snapshots from a running batch, on the batch's worker thread. */
@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NONE = progress -> { };

    void onProgress(ImportProgress progress);
}
