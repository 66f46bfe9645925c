package io.trialforge.cli;

import io.trialforge.config.SchedulingPolicy;
import io.trialforge.config.TrialForgeConfig;
import io.trialforge.lifecycle.PromotionValidator;
import io.trialforge.lock.ReapPolicy;
import io.trialforge.model.Constraints;
import io.trialforge.model.RegretItem;
import io.trialforge.runtime.TrialForgeRuntime;
import io.trialforge.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Callable;

@Command(
        name = "trialforge",
        mixinStandardHelpOptions = true,
        description = "Adaptive trial scheduling and worker lifecycle CLI",
        subcommands = {
                TrialForgeCommand.InitCommand.class,
                TrialForgeCommand.RecordCommand.class,
                TrialForgeCommand.RecentCommand.class,
                TrialForgeCommand.StatsCommand.class,
                TrialForgeCommand.PickCommand.class,
                TrialForgeCommand.ShapeCommand.class,
                TrialForgeCommand.NextCommand.class,
                TrialForgeCommand.RegretHarvestCommand.class,
                TrialForgeCommand.RegretReplayCommand.class,
                TrialForgeCommand.LocksCommand.class,
                TrialForgeCommand.ReapLocksCommand.class,
                TrialForgeCommand.EvidenceCommand.class,
                TrialForgeCommand.ValidateCommand.class,
                TrialForgeCommand.SettingsCommand.class
        }
)
public final class TrialForgeCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace scope under the data root", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | record | recent | stats | pick | shape | next | regret-harvest | regret-replay | locks | reap-locks | evidence | validate | settings");
    }

    TrialForgeConfig config() {
        return TrialForgeConfig.fromRoot(root, namespace);
    }

    TrialForgeRuntime runtime() {
        TrialForgeRuntime runtime = new TrialForgeRuntime(config());
        runtime.init();
        return runtime;
    }

    TrialForgeRuntime runtime(ReapPolicy reapPolicy) {
        TrialForgeConfig config = config();
        SchedulingPolicy policy = SchedulingPolicy.load(config.settingsFile());
        TrialForgeRuntime runtime = new TrialForgeRuntime(config, policy, Clock.systemUTC(), new Random(), reapPolicy);
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Create the data root layout")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Override
        public Integer call() {
            TrialForgeRuntime runtime = parent.runtime();
            System.out.println("Initialized TrialForge at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "record", description = "Append one trial outcome to the ledger")
    static final class RecordCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Parameters(index = "0", description = "Family name")
        String family;

        @Option(names = {"--failed"}, defaultValue = "false", description = "Record a failure (default is a pass)")
        boolean failed;

        @Option(names = {"--metric"}, description = "Metric as key=value; repeatable")
        Map<String, String> metrics;

        @Override
        public Integer call() {
            TrialForgeRuntime runtime = parent.runtime();
            Map<String, Object> values = new LinkedHashMap<>();
            if (metrics != null) {
                values.putAll(metrics);
            }
            System.out.println(Jsons.toJson(runtime.recordTrial(family, !failed, values)));
            return 0;
        }
    }

    @Command(name = "recent", description = "Print the most recent ledger records")
    static final class RecentCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Option(names = {"-n", "--limit"}, defaultValue = "20", description = "Number of records")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().ledger().readRecent(limit)));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show aggregate statistics for a family")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Parameters(index = "0", description = "Family name")
        String family;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().stats(family)));
            return 0;
        }
    }

    @Command(name = "pick", description = "Choose the next family to exercise")
    static final class PickCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Parameters(arity = "1..*", description = "Candidate families")
        List<String> families;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().pick(families)));
            return 0;
        }
    }

    @Command(name = "shape", description = "Compute shaped constraints for a family")
    static final class ShapeCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Parameters(index = "0", description = "Family name")
        String family;

        @Option(names = {"--diff-limit"}, description = "Baseline diff limit (default from settings)")
        Integer diffLimit;

        @Option(names = {"--timeout-s"}, description = "Baseline timeout seconds (default from settings)")
        Integer timeoutS;

        @Option(names = {"--context-lines"}, description = "Baseline context lines (default from settings)")
        Integer contextLines;

        @Override
        public Integer call() {
            TrialForgeRuntime runtime = parent.runtime();
            Constraints defaults = runtime.policy().baseline();
            Constraints baseline = new Constraints(
                    diffLimit == null ? defaults.diffLimit() : diffLimit,
                    timeoutS == null ? defaults.timeoutS() : timeoutS,
                    contextLines == null ? defaults.contextLines() : contextLines
            );
            System.out.println(Jsons.toJson(runtime.shape(family, baseline)));
            return 0;
        }
    }

    @Command(name = "next", description = "Plan the next trial: pick, merge regret replay, shape")
    static final class NextCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Parameters(arity = "1..*", description = "Candidate families")
        List<String> families;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().planNext(families)));
            return 0;
        }
    }

    @Command(name = "regret-harvest", description = "Append recent ledger failures to the regret queue")
    static final class RegretHarvestCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Print harvested items without enqueueing")
        boolean dryRun;

        @Override
        public Integer call() {
            TrialForgeRuntime runtime = parent.runtime();
            if (dryRun) {
                System.out.println(Jsons.toJson(runtime.harvestRegrets()));
                return 0;
            }
            int added = runtime.enqueueRegrets();
            System.out.println(Jsons.toJson(Map.of("added", added, "queue_size", runtime.regretQueue().size())));
            return 0;
        }
    }

    @Command(name = "regret-replay", description = "Sample one regret item with the given probability")
    static final class RegretReplayCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Option(names = {"--p"}, description = "Replay probability (default from settings)")
        Double probability;

        @Override
        public Integer call() {
            TrialForgeRuntime runtime = parent.runtime();
            double p = probability == null ? runtime.policy().regret().replayPct() : probability;
            Optional<RegretItem> item = runtime.replayRegret(p);
            if (item.isEmpty()) {
                System.out.println("{}");
                return 0;
            }
            System.out.println(Jsons.toJson(item.get()));
            return 0;
        }
    }

    @Command(name = "locks", description = "List lock files with holder liveness")
    static final class LocksCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().locks()));
            return 0;
        }
    }

    @Command(name = "reap-locks", description = "Remove stale locks (supervisor use only)")
    static final class ReapLocksCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Option(names = {"--max-age-s"}, description = "Age threshold in seconds (default from settings)")
        Long maxAgeS;

        @Option(names = {"--age-only"}, defaultValue = "false", description = "Skip the holder liveness check")
        boolean ageOnly;

        @Override
        public Integer call() {
            TrialForgeRuntime runtime = ageOnly ? parent.runtime(ReapPolicy.AGE_ONLY) : parent.runtime();
            long threshold = maxAgeS == null ? runtime.policy().locks().maxAgeS() : maxAgeS;
            System.out.println(Jsons.toJson(Map.of("reaped", runtime.reapStaleLocks(threshold))));
            return 0;
        }
    }

    @Command(name = "evidence", description = "Record fitness evidence for a zooid")
    static final class EvidenceCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Parameters(index = "0", description = "Zooid name")
        String name;

        @Option(names = {"--fitness"}, required = true, description = "Fitness mean")
        double fitness;

        @Option(names = {"--evidence"}, required = true, description = "Evidence count")
        int evidence;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().recordEvidence(name, fitness, evidence)));
            return 0;
        }
    }

    @Command(name = "validate", description = "Scan or apply promotions once, or loop on an interval")
    static final class ValidateCommand implements Callable<Integer> {
        // Bounded: the worker may already be blocked in System.exit once shutdown has begun.
        private static final long SHUTDOWN_GRACE_MS = 5_000L;

        @ParentCommand
        TrialForgeCommand parent;

        @Option(names = {"--apply"}, defaultValue = "false", description = "Write GRADUATED/DEMOTED back to the registry")
        boolean apply;

        @Option(names = {"--loop"}, defaultValue = "false", description = "Keep running every interval")
        boolean loop;

        @Option(names = {"--interval-s"}, description = "Loop interval in seconds (default from settings)")
        Long intervalS;

        @Override
        public Integer call() throws Exception {
            TrialForgeRuntime runtime = parent.runtime();
            PromotionValidator validator = runtime.validator();
            if (!loop) {
                PromotionValidator.CycleOutcome outcome = apply ? validator.promote() : validator.scan();
                System.out.println(Jsons.toJson(outcome));
                return "lock_held".equals(outcome.result()) ? 2 : 0;
            }
            long seconds = intervalS == null ? runtime.policy().validator().intervalS() : intervalS;
            Thread worker = Thread.currentThread();
            Thread hook = new Thread(() -> {
                validator.stop();
                try {
                    worker.join(SHUTDOWN_GRACE_MS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "trialforge-validator-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            validator.runLoop(Duration.ofSeconds(seconds), apply, outcome -> System.out.println(Jsons.toJson(outcome)));
            return 0;
        }
    }

    @Command(name = "settings", description = "Print the effective scheduling policy")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        TrialForgeCommand parent;

        @Override
        public Integer call() {
            TrialForgeConfig config = parent.config();
            System.out.println(Jsons.toJson(SchedulingPolicy.load(config.settingsFile())));
            return 0;
        }
    }
}
