package io.trialforge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RegretItem(
        @JsonProperty("family") String family,
        @JsonProperty("hint") String hint
) {
}
