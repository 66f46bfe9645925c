package io.trialforge.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ShapeMode {
    COLD_START("cold_start"),
    HARDEN("harden"),
    SOFTEN("soften"),
    IN_BAND("in_band");

    private final String wireName;

    ShapeMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
