package io.trialforge.lock;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LockInfo(
        @JsonProperty("name") String name,
        @JsonProperty("started_at") double startedAt,
        @JsonProperty("holder_pid") long holderPid,
        @JsonProperty("holder_alive") boolean holderAlive,
        @JsonProperty("age_s") double ageS
) {
}
