package io.trialforge.runtime;

import io.trialforge.config.SchedulingPolicy;
import io.trialforge.config.TrialForgeConfig;
import io.trialforge.ledger.Ledger;
import io.trialforge.lifecycle.PromotionValidator;
import io.trialforge.lock.LockInfo;
import io.trialforge.lock.LockManager;
import io.trialforge.lock.ReapPolicy;
import io.trialforge.model.Constraints;
import io.trialforge.model.FamilyStats;
import io.trialforge.model.RegretItem;
import io.trialforge.model.ShapeResult;
import io.trialforge.model.TrialRecord;
import io.trialforge.observability.AuditLogger;
import io.trialforge.regret.RegretQueue;
import io.trialforge.registry.LifecycleRegistry;
import io.trialforge.scheduling.BanditScheduler;
import io.trialforge.shaping.FitnessShaper;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Wires every component over one data root and records decisions in the audit log. One instance per
 * process; nothing here is shared between instances except the files themselves.
 */
public final class TrialForgeRuntime {
    private static final String ACTOR = "runtime";

    private final TrialForgeConfig config;
    private final SchedulingPolicy policy;
    private final Clock clock;
    private final Ledger ledger;
    private final FitnessShaper shaper;
    private final BanditScheduler scheduler;
    private final RegretQueue regretQueue;
    private final LockManager lockManager;
    private final LifecycleRegistry registry;
    private final AuditLogger auditLogger;
    private final PromotionValidator validator;
    private long reportedMalformed;

    public TrialForgeRuntime(TrialForgeConfig config) {
        this(config, SchedulingPolicy.load(config.settingsFile()), Clock.systemUTC(), new Random());
    }

    public TrialForgeRuntime(TrialForgeConfig config, SchedulingPolicy policy, Clock clock, Random random) {
        this(config, policy, clock, random, policy.locks().reapPolicy());
    }

    public TrialForgeRuntime(TrialForgeConfig config, SchedulingPolicy policy, Clock clock, Random random, ReapPolicy reapPolicy) {
        this.config = config;
        this.policy = policy;
        this.clock = clock;
        this.ledger = new Ledger(config.ledgerFile());
        this.shaper = new FitnessShaper(ledger, policy);
        this.scheduler = new BanditScheduler(ledger, policy.scheduler(), random);
        this.regretQueue = new RegretQueue(ledger, config.regretFile(), random);
        this.lockManager = new LockManager(config.lockDir(), clock, reapPolicy);
        this.registry = new LifecycleRegistry(config.registryFile(), lockManager, TrialForgeConfig.REGISTRY_LOCK_NAME, clock);
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), clock);
        this.validator = new PromotionValidator(registry, policy.promotion(), auditLogger, clock);
        this.reportedMalformed = 0L;
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.ledgerRoot());
            Files.createDirectories(config.regretRoot());
            Files.createDirectories(config.lockDir());
            Files.createDirectories(config.registryRoot());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize data root: " + config.rootDir(), e);
        }
    }

    public TrialForgeConfig config() {
        return config;
    }

    public SchedulingPolicy policy() {
        return policy;
    }

    public Ledger ledger() {
        return ledger;
    }

    public RegretQueue regretQueue() {
        return regretQueue;
    }

    public LockManager lockManager() {
        return lockManager;
    }

    public LifecycleRegistry registry() {
        return registry;
    }

    public PromotionValidator validator() {
        return validator;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public TrialRecord recordTrial(String family, boolean passed, Map<String, Object> metrics) {
        TrialRecord record = new TrialRecord(family, passed, nowSeconds(), metrics);
        ledger.append(record);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("family", family);
        details.put("passed", passed);
        details.put("metric_keys", List.copyOf(record.metrics().keySet()));
        auditLogger.log(AuditLogger.AuditEvent.of("ledger.append", ACTOR, "family/" + family, passed ? "passed" : "failed", details));
        return record;
    }

    public FamilyStats stats(String family) {
        FamilyStats stats = ledger.aggregate(family);
        reportMalformed();
        return stats;
    }

    public BanditScheduler.Decision pick(List<String> families) {
        BanditScheduler.Decision decision = scheduler.decide(families);
        reportMalformed();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("candidates", families);
        details.put("branch", decision.branch().name());
        auditLogger.log(AuditLogger.AuditEvent.of("scheduler.pick", ACTOR, "family/" + decision.family(), "ok", details));
        return decision;
    }

    public ShapeResult shape(String family) {
        return shape(family, policy.baseline());
    }

    public ShapeResult shape(String family, Constraints baseline) {
        ShapeResult result = shaper.shape(family, baseline);
        reportMalformed();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mode", result.mode().wireName());
        details.put("rate", result.rate());
        details.put("evidence", result.evidence());
        details.put("diff_limit", result.constraints().diffLimit());
        details.put("timeout_s", result.constraints().timeoutS());
        details.put("context_lines", result.constraints().contextLines());
        auditLogger.log(AuditLogger.AuditEvent.of("shaper.shape", ACTOR, "family/" + family, result.mode().wireName(), details));
        return result;
    }

    /**
     * Orchestrator view of the next trial: a replayed regret item wins when its family is among the
     * candidates, otherwise the scheduler's pick stands. The chosen family is then shaped.
     */
    public NextTrialPlan planNext(List<String> families) {
        BanditScheduler.Decision decision = pick(families);
        Optional<RegretItem> replay = regretQueue.maybeReplay(policy.regret().replayPct())
                .filter(item -> families.contains(item.family()));
        String family = replay.map(RegretItem::family).orElse(decision.family());
        String source = replay.isPresent() ? "regret" : decision.branch().name().toLowerCase(Locale.ROOT);
        ShapeResult shaped = shape(family);
        return new NextTrialPlan(family, source, replay.map(RegretItem::hint).orElse(null), shaped);
    }

    public List<RegretItem> harvestRegrets() {
        return regretQueue.harvest(policy.regret().window());
    }

    public int enqueueRegrets() {
        int added = regretQueue.enqueue(policy.regret().window());
        reportMalformed();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("window", policy.regret().window());
        details.put("added", added);
        auditLogger.log(AuditLogger.AuditEvent.of("regret.enqueue", ACTOR, "regret/queue", "ok", details));
        return added;
    }

    public Optional<RegretItem> replayRegret(double probability) {
        return regretQueue.maybeReplay(probability);
    }

    public List<LockInfo> locks() {
        return lockManager.list();
    }

    public List<String> reapStaleLocks(long maxAgeS) {
        List<String> reaped = lockManager.reapStaleLocks(maxAgeS);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("max_age_s", maxAgeS);
        details.put("policy", lockManager.reapPolicy().name());
        details.put("reaped", reaped);
        auditLogger.log(AuditLogger.AuditEvent.of("locks.reap", "reaper", "locks/", reaped.isEmpty() ? "none" : "reaped", details));
        return reaped;
    }

    public LifecycleRegistry.EvidenceOutcome recordEvidence(String name, double fitnessMean, int evidenceCount) {
        LifecycleRegistry.EvidenceOutcome outcome = registry.recordEvidence(name, fitnessMean, evidenceCount);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fitness_mean", fitnessMean);
        details.put("evidence_count", evidenceCount);
        details.put("state", outcome.record().lifecycleState().name());
        auditLogger.log(AuditLogger.AuditEvent.of("registry.evidence", "evidence-accumulator", "zooid/" + name, outcome.result(), details));
        return outcome;
    }

    private void reportMalformed() {
        long skipped = ledger.malformedSkipped();
        if (skipped <= reportedMalformed) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("skipped_total", skipped);
        details.put("skipped_new", skipped - reportedMalformed);
        auditLogger.log(AuditLogger.AuditEvent.of("ledger.malformed", ACTOR, "ledger/" + config.ledgerFile().getFileName(), "skipped", details));
        reportedMalformed = skipped;
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0d;
    }

    public record NextTrialPlan(String family, String source, String hint, ShapeResult shaped) {
    }
}
