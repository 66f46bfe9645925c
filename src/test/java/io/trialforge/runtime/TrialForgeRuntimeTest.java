package io.trialforge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.trialforge.config.SchedulingPolicy;
import io.trialforge.config.TrialForgeConfig;
import io.trialforge.model.ShapeMode;
import io.trialforge.model.TrialRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

final class TrialForgeRuntimeTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void initCreatesLayoutAndRecordTrialAppendsAndAudits() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-runtime-record-");
        try {
            TrialForgeRuntime runtime = new TrialForgeRuntime(TrialForgeConfig.fromRoot(root.toString()));
            runtime.init();
            Assertions.assertTrue(Files.isDirectory(runtime.config().lockDir()));
            Assertions.assertTrue(Files.isDirectory(runtime.config().ledgerRoot()));

            TrialRecord record = runtime.recordTrial("rename", false, Map.of("error", "compile failed"));
            Assertions.assertFalse(record.passed());
            Assertions.assertEquals(1, runtime.stats("rename").attempts());

            JsonNode row = runtime.auditLogger().tail(1).get(0);
            Assertions.assertEquals("ledger.append", row.path("action").asText());
            Assertions.assertEquals("failed", row.path("result").asText());
            Assertions.assertTrue(runtime.auditLogger().verify().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void planNextPrefersReplayedRegretAmongCandidates() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-runtime-regret-");
        try {
            TrialForgeRuntime runtime = runtime(root, withReplay(1.0d));
            runtime.recordTrial("x", false, Map.of("stderr", "segfault in parser"));
            runtime.recordTrial("y", true, Map.of());
            Assertions.assertEquals(1, runtime.enqueueRegrets());

            TrialForgeRuntime.NextTrialPlan plan = runtime.planNext(List.of("x", "y"));
            Assertions.assertEquals("x", plan.family());
            Assertions.assertEquals("regret", plan.source());
            Assertions.assertEquals("segfault in parser", plan.hint());
            Assertions.assertEquals(ShapeMode.COLD_START, plan.shaped().mode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void planNextIgnoresRegretOutsideCandidates() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-runtime-foreign-");
        try {
            TrialForgeRuntime runtime = runtime(root, withReplay(1.0d));
            runtime.recordTrial("x", false, Map.of());
            runtime.enqueueRegrets();

            TrialForgeRuntime.NextTrialPlan plan = runtime.planNext(List.of("y", "z"));
            Assertions.assertTrue(List.of("y", "z").contains(plan.family()));
            Assertions.assertNotEquals("regret", plan.source());
            Assertions.assertNull(plan.hint());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void shapeUsesConfiguredBaseline() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-runtime-shape-");
        try {
            TrialForgeRuntime runtime = runtime(root, SchedulingPolicy.defaults());
            for (int i = 0; i < 10; i++) {
                runtime.recordTrial("easy", true, Map.of());
            }
            Assertions.assertEquals(ShapeMode.HARDEN, runtime.shape("easy").mode());
            Assertions.assertEquals(220, runtime.shape("easy").constraints().diffLimit());
            Assertions.assertEquals("shaper.shape", runtime.auditLogger().tail(1).get(0).path("action").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedLedgerLinesAreAuditedPerRead() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-runtime-malformed-");
        try {
            TrialForgeRuntime runtime = runtime(root, SchedulingPolicy.defaults());
            runtime.recordTrial("a", true, Map.of());
            Files.writeString(runtime.config().ledgerFile(), "not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            runtime.stats("a");
            long malformedRows = countActions(runtime, "ledger.malformed");
            Assertions.assertEquals(1L, malformedRows);

            runtime.recordTrial("a", true, Map.of());
            Assertions.assertEquals(2, runtime.stats("a").attempts());
            Assertions.assertEquals(2L, countActions(runtime, "ledger.malformed"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void undecodableLedgerBytesDoNotBreakPickOrShape() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-runtime-bytes-");
        try {
            TrialForgeRuntime runtime = runtime(root, SchedulingPolicy.defaults());
            runtime.recordTrial("a", true, Map.of());
            Files.write(runtime.config().ledgerFile(), new byte[]{(byte) 0xFF, (byte) 0xFE, '\n'}, StandardOpenOption.APPEND);
            runtime.recordTrial("b", false, Map.of());

            Assertions.assertTrue(List.of("a", "b").contains(runtime.pick(List.of("a", "b")).family()));
            Assertions.assertEquals(ShapeMode.COLD_START, runtime.shape("a").mode());
            Assertions.assertTrue(countActions(runtime, "ledger.malformed") >= 1L);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void evidenceAndPromotionFlowThroughRegistry() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-runtime-evidence-");
        try {
            TrialForgeRuntime runtime = runtime(root, SchedulingPolicy.defaults());
            Assertions.assertEquals("registered", runtime.recordEvidence("z1", 0.95d, 5).result());
            Assertions.assertEquals("applied", runtime.validator().promote().result());
            Assertions.assertEquals("updated", runtime.recordEvidence("z1", 0.96d, 6).result());
            Assertions.assertTrue(runtime.locks().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reapStaleLocksIsAudited() throws Exception {
        Path root = Files.createTempDirectory("trialforge-test-runtime-reap-");
        try {
            TrialForgeRuntime runtime = runtime(root, SchedulingPolicy.defaults());
            Assertions.assertTrue(runtime.reapStaleLocks(3_600L).isEmpty());
            JsonNode row = runtime.auditLogger().tail(1).get(0);
            Assertions.assertEquals("locks.reap", row.path("action").asText());
            Assertions.assertEquals("none", row.path("result").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    private static long countActions(TrialForgeRuntime runtime, String action) {
        return runtime.auditLogger().tail(0).stream().filter(row -> action.equals(row.path("action").asText())).count();
    }

    private static TrialForgeRuntime runtime(Path root, SchedulingPolicy policy) {
        TrialForgeRuntime runtime = new TrialForgeRuntime(TrialForgeConfig.fromRoot(root.toString()), policy, CLOCK, new Random(11L));
        runtime.init();
        return runtime;
    }

    private static SchedulingPolicy withReplay(double replayPct) {
        SchedulingPolicy d = SchedulingPolicy.defaults();
        return new SchedulingPolicy(
                d.targetBand(),
                d.hardener(),
                d.softener(),
                d.scheduler(),
                d.promotion(),
                d.baseline(),
                d.shaper(),
                new SchedulingPolicy.Regret(d.regret().window(), replayPct),
                d.locks(),
                d.validator()
        );
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
