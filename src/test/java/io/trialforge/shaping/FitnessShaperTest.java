package io.trialforge.shaping;

import io.trialforge.config.SchedulingPolicy;
import io.trialforge.ledger.Ledger;
import io.trialforge.model.Constraints;
import io.trialforge.model.ShapeMode;
import io.trialforge.model.ShapeResult;
import io.trialforge.model.TrialRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class FitnessShaperTest {
    private static final Constraints BASELINE = new Constraints(200, 600, 10);

    @Test
    void unseenFamilyIsColdStartWithBaselineUnchanged() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-shaper-cold-");
        try {
            FitnessShaper shaper = new FitnessShaper(new Ledger(root.resolve("trials.jsonl")), SchedulingPolicy.defaults());
            ShapeResult result = shaper.shape("never-run", BASELINE);
            Assertions.assertEquals(ShapeMode.COLD_START, result.mode());
            Assertions.assertEquals(BASELINE, result.constraints());
            Assertions.assertEquals(0, result.evidence());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tooFewTrialsStayInColdStart() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-shaper-thin-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "a", 4, 0);
            ShapeResult result = new FitnessShaper(ledger, SchedulingPolicy.defaults()).shape("a", BASELINE);
            Assertions.assertEquals(ShapeMode.COLD_START, result.mode());
            Assertions.assertEquals(4, result.evidence());
            Assertions.assertEquals(BASELINE, result.constraints());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void passRateAboveBandHardensEveryAxis() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-shaper-harden-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "a", 10, 0);
            ShapeResult result = new FitnessShaper(ledger, SchedulingPolicy.defaults()).shape("a", BASELINE);
            Assertions.assertEquals(ShapeMode.HARDEN, result.mode());
            Assertions.assertEquals(1.0d, result.rate());
            Assertions.assertEquals(new Constraints(220, 750, 12), result.constraints());
            Assertions.assertTrue(result.constraints().diffLimit() > BASELINE.diffLimit());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void passRateBelowBandSoftens() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-shaper-soften-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "a", 1, 9);
            ShapeResult result = new FitnessShaper(ledger, SchedulingPolicy.defaults()).shape("a", BASELINE);
            Assertions.assertEquals(ShapeMode.SOFTEN, result.mode());
            Assertions.assertEquals(new Constraints(180, 480, 8), result.constraints());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void softeningNeverDropsBelowFloors() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-shaper-floor-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "a", 0, 10);
            ShapeResult result = new FitnessShaper(ledger, SchedulingPolicy.defaults())
                    .shape("a", new Constraints(15, 20, 1));
            Assertions.assertEquals(ShapeMode.SOFTEN, result.mode());
            Assertions.assertEquals(new Constraints(10, 30, 1), result.constraints());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rateInsideBandKeepsBaseline() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-shaper-band-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "a", 7, 3);
            ShapeResult result = new FitnessShaper(ledger, SchedulingPolicy.defaults()).shape("a", BASELINE);
            Assertions.assertEquals(ShapeMode.IN_BAND, result.mode());
            Assertions.assertEquals(BASELINE, result.constraints());
            Assertions.assertEquals(0.7d, result.rate(), 1e-9);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void otherFamiliesDoNotInfluenceTheRate() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-shaper-isolated-");
        try {
            Ledger ledger = new Ledger(root.resolve("trials.jsonl"));
            record(ledger, "noisy", 0, 20);
            record(ledger, "a", 10, 0);
            ShapeResult result = new FitnessShaper(ledger, SchedulingPolicy.defaults()).shape("a", BASELINE);
            Assertions.assertEquals(ShapeMode.HARDEN, result.mode());
            Assertions.assertEquals(10, result.evidence());
        } finally {
            deleteRecursively(root);
        }
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
