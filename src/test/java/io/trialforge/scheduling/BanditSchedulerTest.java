package io.trialforge.scheduling;

import io.trialforge.config.SchedulingPolicy;
import io.trialforge.ledger.Ledger;
import io.trialforge.model.FamilyStats;
import io.trialforge.model.TrialRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

final class BanditSchedulerTest {
    private static final SchedulingPolicy.Scheduler EXPLOIT_ONLY = new SchedulingPolicy.Scheduler(0.0d, 0.0d);

    @Test
    void fullExplorationIsUniformAcrossCandidates() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-bandit-uniform-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            ledger.append(TrialRecord.of("a", true, 1.0d));
            BanditScheduler scheduler = new BanditScheduler(
                    ledger, new SchedulingPolicy.Scheduler(0.0d, 1.0d), new Random(7L));
            List<String> families = List.of("a", "b", "c", "d");
            Map<String, Integer> counts = new LinkedHashMap<>();
            int samples = 4_000;
            for (int i = 0; i < samples; i++) {
                BanditScheduler.Decision decision = scheduler.decide(families);
                Assertions.assertEquals(BanditScheduler.Branch.EXPLORE, decision.branch());
                counts.merge(decision.family(), 1, Integer::sum);
            }
            double expected = samples / (double) families.size();
            double chiSquare = 0.0d;
            for (String family : families) {
                double observed = counts.getOrDefault(family, 0);
                chiSquare += (observed - expected) * (observed - expected) / expected;
            }
            // df = 3, p = 0.001
            Assertions.assertTrue(chiSquare < 16.27d, "chi-square too large: " + chiSquare);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exploitPrefersHigherMeanAtEqualEvidence() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-bandit-exploit-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "a", 8, 2);
            record(ledger, "b", 2, 8);
            BanditScheduler scheduler = new BanditScheduler(ledger, EXPLOIT_ONLY, new Random(1L));
            BanditScheduler.Decision decision = scheduler.decide(List.of("a", "b"));
            Assertions.assertEquals("a", decision.family());
            Assertions.assertEquals(BanditScheduler.Branch.EXPLOIT, decision.branch());
            Assertions.assertEquals("a", scheduler.pick(List.of("b", "a")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exploitTriesUnseenFamilyFirst() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-bandit-unseen-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "a", 10, 0);
            BanditScheduler scheduler = new BanditScheduler(ledger, EXPLOIT_ONLY, new Random(1L));
            Assertions.assertEquals("fresh", scheduler.pick(List.of("a", "fresh")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exploitTieGoesToFirstCandidate() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-bandit-tie-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "a", 1, 1);
            record(ledger, "b", 1, 1);
            BanditScheduler scheduler = new BanditScheduler(ledger, EXPLOIT_ONLY, new Random(1L));
            Assertions.assertEquals("a", scheduler.pick(List.of("a", "b")));
            Assertions.assertEquals("b", scheduler.pick(List.of("b", "a")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reviewPicksUnseenThenStalest() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-bandit-review-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            ledger.append(TrialRecord.of("a", true, 100.0d));
            ledger.append(TrialRecord.of("b", true, 50.0d));
            BanditScheduler scheduler = new BanditScheduler(
                    ledger, new SchedulingPolicy.Scheduler(1.0d, 0.0d), new Random(3L));

            BanditScheduler.Decision unseen = scheduler.decide(List.of("a", "b", "c"));
            Assertions.assertEquals("c", unseen.family());
            Assertions.assertEquals(BanditScheduler.Branch.REVIEW, unseen.branch());

            Assertions.assertEquals("b", scheduler.pick(List.of("a", "b")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void noEvidenceFallsBackToRandomBranch() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-bandit-random-");
        try {
            BanditScheduler scheduler = new BanditScheduler(
                    new Ledger(root.resolve("trials.jsonl")), EXPLOIT_ONLY, new Random(5L));
            BanditScheduler.Decision decision = scheduler.decide(List.of("x", "y"));
            Assertions.assertEquals(BanditScheduler.Branch.RANDOM, decision.branch());
            Assertions.assertTrue(List.of("x", "y").contains(decision.family()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void candidateListIsValidated() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-bandit-validate-");
        try {
            BanditScheduler scheduler = new BanditScheduler(
                    new Ledger(root.resolve("trials.jsonl")), EXPLOIT_ONLY, new Random(5L));
            Assertions.assertThrows(IllegalArgumentException.class, () -> scheduler.pick(List.of()));
            Assertions.assertThrows(IllegalArgumentException.class, () -> scheduler.pick(null));
            Assertions.assertThrows(IllegalArgumentException.class, () -> scheduler.pick(List.of("a", " ")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ucbScoreAddsExplorationBonusToMean() {
        Assertions.assertEquals(Double.POSITIVE_INFINITY, BanditScheduler.ucb1(FamilyStats.EMPTY, Math.log(5.0d)));
        FamilyStats stats = new FamilyStats(3, 4, 0.0d);
        double logN = Math.log(11.0d);
        Assertions.assertEquals(0.75d + Math.sqrt(2.0d * logN / 4.0d), BanditScheduler.ucb1(stats, logN), 1e-12);
    }

    private static void record(Ledger ledger, String family, int passes, int failures) {
        double ts = 1_000.0d;
        for (int i = 0; i < passes; i++) {
            ledger.append(TrialRecord.of(family, true, ts++));
        }
        for (int i = 0; i < failures; i++) {
            ledger.append(TrialRecord.of(family, false, ts++));
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
