package io.trialforge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ShapeResult(
        @JsonProperty("constraints") Constraints constraints,
        @JsonProperty("mode") ShapeMode mode,
        @JsonProperty("rate") double rate,
        @JsonProperty("evidence") int evidence
) {
}
