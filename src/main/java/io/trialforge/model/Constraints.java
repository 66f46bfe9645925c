package io.trialforge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acceptance limits handed to a trial executor.
 */
public record Constraints(
        @JsonProperty("diff_limit") int diffLimit,
        @JsonProperty("timeout_s") int timeoutS,
        @JsonProperty("context_lines") int contextLines
) {
}
