package io.github.drompincen.sheetbridge.persistence.document;

import java.time.Instant;
import java.util.List;

public class RollbackAttempt {

    private Instant attemptedAt;
    private int restored;
    private int failed;
    private List<String> failures;

    public RollbackAttempt() {}

    public RollbackAttempt(Instant attemptedAt, int restored, int failed, List<String> failures) {
        this.attemptedAt = attemptedAt;
        this.restored = restored;
        this.failed = failed;
        this.failures = failures;
    }

    public Instant getAttemptedAt() { return attemptedAt; }
    public void setAttemptedAt(Instant attemptedAt) { this.attemptedAt = attemptedAt; }

    public int getRestored() { return restored; }
    public void setRestored(int restored) { this.restored = restored; }

    public int getFailed() { return failed; }
    public void setFailed(int failed) { this.failed = failed; }

    public List<String> getFailures() { return failures; }
    public void setFailures(List<String> failures) { this.failures = failures; }
}
