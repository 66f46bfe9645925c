package io.trialforge.model;

/**
 * Pass rate over a family's most recent window of trials; {@code evidence} is the number of trials
 * actually inside the window.
 */
public record RollingRate(double rate, int evidence) {
    public static final RollingRate NONE = new RollingRate(0.0d, 0);
}
