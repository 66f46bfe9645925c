package io.trialforge.lock;

import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Proof of ownership for one acquired lock. Closing the handle releases the lock, so scoped
 * acquisition reads as try-with-resources.
 */
public final class LockHandle implements AutoCloseable {
    private final LockManager owner;
    private final String name;
    private final Path file;
    private final double startedAt;
    private final long holderPid;
    private FileChannel channel;

    LockHandle(LockManager owner, String name, Path file, double startedAt, long holderPid, FileChannel channel) {
        this.owner = owner;
        this.name = name;
        this.file = file;
        this.startedAt = startedAt;
        this.holderPid = holderPid;
        this.channel = channel;
    }

    public String name() {
        return name;
    }

    public Path file() {
        return file;
    }

    public double startedAt() {
        return startedAt;
    }

    public long holderPid() {
        return holderPid;
    }

    public synchronized boolean isReleased() {
        return channel == null;
    }

    synchronized FileChannel detachChannel() {
        FileChannel current = channel;
        channel = null;
        return current;
    }

    @Override
    public void close() {
        owner.release(this);
    }
}
