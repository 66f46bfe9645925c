/**
 * Runtime wiring package.
 *
 * <p>{@link io.trialforge.runtime.TrialForgeRuntime} owns the per-process component graph and the
 * audit trail for scheduling, shaping, regret replay, lock reaping and evidence intake.
 */
package io.trialforge.runtime;
