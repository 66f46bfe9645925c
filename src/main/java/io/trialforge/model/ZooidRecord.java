package io.trialforge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registry entry for one worker process. Records are never removed; a DEMOTED record keeps its
 * last evidence for audit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ZooidRecord(
        @JsonProperty("name") String name,
        @JsonProperty("lifecycle_state") LifecycleState lifecycleState,
        @JsonProperty("fitness_mean") double fitnessMean,
        @JsonProperty("evidence_count") int evidenceCount,
        @JsonProperty("last_transition_ts") double lastTransitionTs
) {
    public ZooidRecord {
        lifecycleState = lifecycleState == null ? LifecycleState.PROBATION : lifecycleState;
    }

    public static ZooidRecord probation(String name, double fitnessMean, int evidenceCount, double now) {
        return new ZooidRecord(name, LifecycleState.PROBATION, fitnessMean, evidenceCount, now);
    }

    public ZooidRecord withState(LifecycleState next, double now) {
        return new ZooidRecord(name, next, fitnessMean, evidenceCount, now);
    }

    public ZooidRecord withName(String nextName) {
        return new ZooidRecord(nextName, lifecycleState, fitnessMean, evidenceCount, lastTransitionTs);
    }

    public ZooidRecord withEvidence(double nextFitnessMean, int nextEvidenceCount) {
        return new ZooidRecord(name, lifecycleState, nextFitnessMean, nextEvidenceCount, lastTransitionTs);
    }
}
