package io.github.drompincen.sheetbridge.protocol.error;

/** One ledger entry could not be compensated. The batch stays eligible for another attempt. */
public class RollbackException extends IngestionException {

    private final long seq;

    public RollbackException(String message, long seq, Integer rowNumber, Throwable cause) {
        super(message, rowNumber, null, cause);
        this.seq = seq;
    }

    public long getSeq() { return seq; }
}
