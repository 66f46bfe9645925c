package io.trialforge.lock;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-disk lock body.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record LockFile(
        @JsonProperty("name") String name,
        @JsonProperty("started_at") double startedAt,
        @JsonProperty("holder_pid") long holderPid
) {
}
