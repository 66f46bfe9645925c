package io.trialforge.scheduling;

import io.trialforge.config.SchedulingPolicy;
import io.trialforge.ledger.Ledger;
import io.trialforge.model.FamilyStats;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Chooses the next family to exercise. Branches are tried in order: explore (uniform), review
 * (unseen first, then stalest), exploit (UCB1). Statistics are read from the ledger on every call.
 */
public final class BanditScheduler {
    private final Ledger ledger;
    private final SchedulingPolicy.Scheduler settings;
    private final Random random;

    public BanditScheduler(Ledger ledger, SchedulingPolicy.Scheduler settings, Random random) {
        this.ledger = ledger;
        this.settings = settings;
        this.random = random;
    }

    public String pick(List<String> families) {
        return decide(families).family();
    }

    public Decision decide(List<String> families) {
        List<String> candidates = candidates(families);
        if (random.nextDouble() < settings.explorePct()) {
            return new Decision(uniform(candidates), Branch.EXPLORE);
        }
        Map<String, FamilyStats> stats = ledger.aggregateAll();
        if (random.nextDouble() < settings.reviewPct()) {
            return new Decision(review(candidates, stats), Branch.REVIEW);
        }
        boolean anyEvidence = false;
        for (String family : candidates) {
            if (statsFor(stats, family).attempts() > 0) {
                anyEvidence = true;
                break;
            }
        }
        if (!anyEvidence) {
            return new Decision(uniform(candidates), Branch.RANDOM);
        }
        return new Decision(exploit(candidates, stats), Branch.EXPLOIT);
    }

    String review(List<String> candidates, Map<String, FamilyStats> stats) {
        List<String> unseen = new ArrayList<>();
        for (String family : candidates) {
            if (statsFor(stats, family).attempts() == 0) {
                unseen.add(family);
            }
        }
        if (!unseen.isEmpty()) {
            return uniform(unseen);
        }
        String oldest = candidates.get(0);
        double oldestSeen = statsFor(stats, oldest).lastSeen();
        for (String family : candidates) {
            double lastSeen = statsFor(stats, family).lastSeen();
            if (lastSeen < oldestSeen) {
                oldest = family;
                oldestSeen = lastSeen;
            }
        }
        return oldest;
    }

    String exploit(List<String> candidates, Map<String, FamilyStats> stats) {
        long totalAttempts = 0L;
        for (String family : candidates) {
            totalAttempts += statsFor(stats, family).attempts();
        }
        double logN = Math.log(totalAttempts + 1.0d);
        String best = candidates.get(0);
        double bestScore = Double.NEGATIVE_INFINITY;
        for (String family : candidates) {
            double score = ucb1(statsFor(stats, family), logN);
            // Strict comparison keeps the first maximum in list order.
            if (score > bestScore) {
                best = family;
                bestScore = score;
            }
        }
        return best;
    }

    static double ucb1(FamilyStats stats, double logN) {
        if (stats.attempts() == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double bonus = Math.sqrt(2.0d * logN / stats.attempts());
        return stats.mean() + bonus;
    }

    private String uniform(List<String> candidates) {
        return candidates.get(random.nextInt(candidates.size()));
    }

    private static FamilyStats statsFor(Map<String, FamilyStats> stats, String family) {
        return stats.getOrDefault(family, FamilyStats.EMPTY);
    }

    private static List<String> candidates(List<String> families) {
        if (families == null || families.isEmpty()) {
            throw new IllegalArgumentException("BanditScheduler requires at least one candidate family");
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String family : families) {
            if (family == null || family.isBlank()) {
                throw new IllegalArgumentException("Candidate family names must not be blank");
            }
            unique.add(family);
        }
        return new ArrayList<>(unique);
    }

    public enum Branch {
        EXPLORE,
        REVIEW,
        EXPLOIT,
        RANDOM
    }

    public record Decision(String family, Branch branch) {
    }
}
