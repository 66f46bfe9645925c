package io.trialforge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One completed trial. {@code timestamp} is epoch seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrialRecord(
        @JsonProperty("family") String family,
        @JsonProperty("passed") boolean passed,
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("metrics") Map<String, Object> metrics
) {
    public TrialRecord {
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("family must not be blank");
        }
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static TrialRecord of(String family, boolean passed, double timestamp) {
        return new TrialRecord(family, passed, timestamp, Map.of());
    }
}
