package io.trialforge.model;

public record FamilyStats(int successes, int attempts, double lastSeen) {
    public static final FamilyStats EMPTY = new FamilyStats(0, 0, 0.0d);

    public FamilyStats plus(boolean passed, double timestamp) {
        return new FamilyStats(
                successes + (passed ? 1 : 0),
                attempts + 1,
                Math.max(lastSeen, timestamp)
        );
    }

    public double mean() {
        return attempts == 0 ? 0.0d : (double) successes / attempts;
    }
}
