package io.github.drompincen.sheetbridge.runtime.batch;

import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.protocol.api.ImportRequest;
import io.github.drompincen.sheetbridge.runtime.rows.RowSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs batches on a fixed pool. Each batch gets one worker so rows stay in file order;
 * independent batches run side by side.
 */
@Service
public class BatchWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(BatchWorkerPool.class);

    private final BatchOrchestrator orchestrator;
    private final ExecutorService executor;
    private final ConcurrentHashMap<String, RunningImport> running = new ConcurrentHashMap<>();

    private record RunningImport(Future<?> future, AtomicBoolean cancelRequested, AtomicBoolean started) {}

    public BatchWorkerPool(BatchOrchestrator orchestrator,
                           @Value("${sheetbridge.import.worker-threads:4}") int workerThreads) {
        this.orchestrator = orchestrator;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, workerThreads), r -> {
            Thread t = new Thread(r, "import-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Persists the batch and queues it. Returns the CREATED batch without waiting.
     */
    public ImportBatchDocument submit(ImportRequest request, RowSource source, ImportProgressListener listener) {
        ImportBatchDocument batch = orchestrator.createBatch(request, source);
        String batchId = batch.getBatchId();
        AtomicBoolean cancelRequested = new AtomicBoolean();
        AtomicBoolean started = new AtomicBoolean();
        Future<?> future;
        synchronized (running) {
            future = executor.submit(() -> {
                if (!started.compareAndSet(false, true)) return;
                try {
                    orchestrator.execute(batch, source, listener, cancelRequested);
                } catch (RuntimeException e) {
                    log.error("Worker for import batch {} ended abnormally", batchId, e);
                } finally {
                    synchronized (running) {
                        running.remove(batchId);
                    }
                }
            });
            running.put(batchId, new RunningImport(future, cancelRequested, started));
        }
        return batch;
    }

    /**
     * Cancels a queued or running batch. The batch ends FAILED; rows already written stay.
     *
     * @return false if the batch is not queued or running here
     */
    public boolean cancel(String batchId) {
        RunningImport run;
        synchronized (running) {
            run = running.get(batchId);
        }
        if (run == null) return false;
        run.cancelRequested().set(true);
        if (run.started().compareAndSet(false, true)) {
            run.future().cancel(false);
            synchronized (running) {
                running.remove(batchId);
            }
            orchestrator.markCancelled(batchId);
        } else {
            run.future().cancel(true);
        }
        log.info("Cancellation requested for import batch {}", batchId);
        return true;
    }

    public boolean isActive(String batchId) {
        return running.containsKey(batchId);
    }

    public int activeCount() {
        return running.size();
    }

    @PreDestroy
    void shutdown() {
        running.values().forEach(r -> r.cancelRequested().set(true));
        executor.shutdownNow();
    }
}
