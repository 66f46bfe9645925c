package io.trialforge.lock;

/**
 * Another process already holds the named lock. Callers retry with their own backoff or yield the
 * turn; {@link LockManager} never waits.
 */
public final class LockContentionException extends RuntimeException {
    private final String lockName;
    private final long holderPid;
    private final double startedAt;

    public LockContentionException(String lockName, long holderPid, double startedAt) {
        super("Lock '" + lockName + "' is held by another process (pid=" + holderPid + ", started_at=" + startedAt + ")");
        this.lockName = lockName;
        this.holderPid = holderPid;
        this.startedAt = startedAt;
    }

    public String lockName() {
        return lockName;
    }

    public long holderPid() {
        return holderPid;
    }

    public double startedAt() {
        return startedAt;
    }
}
