package io.trialforge.lock;

/**
 * What {@link LockManager#reapStaleLocks(long)} requires before removing an old lock file.
 */
public enum ReapPolicy {
    /** Old enough and the recorded holder process is gone. */
    REQUIRE_DEAD_HOLDER,
    /** Old enough; holder liveness is not consulted. */
    AGE_ONLY
}
