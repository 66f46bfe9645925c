package io.trialforge.lifecycle;

import io.trialforge.config.SchedulingPolicy;
import io.trialforge.lock.LockContentionException;
import io.trialforge.lock.LockHandle;
import io.trialforge.model.LifecycleState;
import io.trialforge.model.ZooidRecord;
import io.trialforge.observability.AuditLogger;
import io.trialforge.registry.LifecycleRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodic reclassification of probationary zooids. Only PROBATION records are considered;
 * graduated and demoted ones are left as they are.
 */
public final class PromotionValidator {
    private static final String ACTOR = "promotion-validator";

    private final LifecycleRegistry registry;
    private final SchedulingPolicy.Promotion thresholds;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final CountDownLatch stopSignal;

    public PromotionValidator(
            LifecycleRegistry registry,
            SchedulingPolicy.Promotion thresholds,
            AuditLogger auditLogger,
            Clock clock
    ) {
        this.registry = registry;
        this.thresholds = thresholds;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.stopSignal = new CountDownLatch(1);
    }

    public Classification classify(Map<String, ZooidRecord> zooids) {
        List<String> promote = new ArrayList<>();
        List<String> demote = new ArrayList<>();
        List<String> untouched = new ArrayList<>();
        // Keyed by registry entry, not by the record's own name field.
        for (Map.Entry<String, ZooidRecord> entry : zooids.entrySet()) {
            ZooidRecord record = entry.getValue();
            if (record == null || record.lifecycleState() != LifecycleState.PROBATION) {
                continue;
            }
            if (record.fitnessMean() >= thresholds.maxFitnessThreshold()
                    && record.evidenceCount() >= thresholds.minEvidence()) {
                promote.add(entry.getKey());
            } else if (record.fitnessMean() <= thresholds.minFitnessThreshold()
                    && record.evidenceCount() >= thresholds.demotionMinEvidence()) {
                demote.add(entry.getKey());
            } else {
                untouched.add(entry.getKey());
            }
        }
        return new Classification(promote, demote, untouched);
    }

    /**
     * Reports candidates without changing the registry.
     */
    public CycleOutcome scan() {
        Classification classification;
        try (LockHandle ignored = registry.lockManager().acquire(registry.lockName())) {
            classification = classify(registry.load());
        } catch (LockContentionException e) {
            return lockHeld("validator.scan", e);
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "validator.scan",
                ACTOR,
                "registry/" + registry.registryFile().getFileName(),
                "ok",
                summary(classification)
        ));
        return new CycleOutcome("ok", classification, List.of(), -1L);
    }

    /**
     * Classifies and writes GRADUATED / DEMOTED back in one critical section. A contended lock
     * skips the cycle; the next interval is the retry.
     */
    public CycleOutcome promote() {
        double now = clock.millis() / 1000.0d;
        List<Transition> transitions = new ArrayList<>();
        LifecycleRegistry.Committed<Classification> committed;
        try {
            committed = registry.commit(zooids -> {
                Classification c = classify(zooids);
                for (String name : c.promote()) {
                    transitions.add(transition(zooids, name, LifecycleState.GRADUATED, now));
                }
                for (String name : c.demote()) {
                    transitions.add(transition(zooids, name, LifecycleState.DEMOTED, now));
                }
                return transitions.isEmpty()
                        ? LifecycleRegistry.Mutation.unchanged(c)
                        : LifecycleRegistry.Mutation.changed(c);
            });
        } catch (LockContentionException e) {
            return lockHeld("validator.promote", e);
        }
        Classification classification = committed.result();
        long version = committed.version();
        for (Transition t : transitions) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("zooid", t.name());
            details.put("from", t.from().name());
            details.put("to", t.to().name());
            details.put("fitness_mean", t.fitnessMean());
            details.put("evidence_count", t.evidenceCount());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "validator.promote",
                    ACTOR,
                    "zooid/" + t.name(),
                    t.to() == LifecycleState.GRADUATED ? "graduated" : "demoted",
                    details
            ));
        }
        Map<String, Object> details = summary(classification);
        details.put("registry_version", version);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "validator.cycle",
                ACTOR,
                "registry/" + registry.registryFile().getFileName(),
                transitions.isEmpty() ? "no_change" : "applied",
                details
        ));
        return new CycleOutcome(transitions.isEmpty() ? "no_change" : "applied", classification, transitions, version);
    }

    /**
     * Runs cycles every {@code interval} until {@link #stop()}. Stop requests are honoured between
     * cycles only.
     */
    public void runLoop(Duration interval, boolean apply, Consumer<CycleOutcome> onCycle) throws InterruptedException {
        long waitMs = Math.max(1L, interval.toMillis());
        while (stopSignal.getCount() > 0L) {
            CycleOutcome outcome = apply ? promote() : scan();
            if (onCycle != null) {
                onCycle.accept(outcome);
            }
            if (stopSignal.await(waitMs, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
    }

    public void stop() {
        stopSignal.countDown();
    }

    private static Transition transition(Map<String, ZooidRecord> zooids, String name, LifecycleState to, double now) {
        ZooidRecord current = zooids.get(name);
        zooids.put(name, current.withState(to, now));
        return new Transition(name, current.lifecycleState(), to, current.fitnessMean(), current.evidenceCount());
    }

    private CycleOutcome lockHeld(String action, LockContentionException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lock", e.lockName());
        details.put("holder_pid", e.holderPid());
        auditLogger.log(AuditLogger.AuditEvent.of(action, ACTOR, "lock/" + e.lockName(), "lock_held", details));
        return new CycleOutcome("lock_held", Classification.EMPTY, List.of(), -1L);
    }

    private Map<String, Object> summary(Classification classification) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("promotion_candidates", classification.promote());
        details.put("demotion_candidates", classification.demote());
        details.put("untouched", classification.untouched().size());
        details.put("max_fitness_threshold", thresholds.maxFitnessThreshold());
        details.put("min_fitness_threshold", thresholds.minFitnessThreshold());
        details.put("min_evidence", thresholds.minEvidence());
        return details;
    }

    public record Classification(List<String> promote, List<String> demote, List<String> untouched) {
        public static final Classification EMPTY = new Classification(List.of(), List.of(), List.of());
    }

    public record Transition(String name, LifecycleState from, LifecycleState to, double fitnessMean, int evidenceCount) {
    }

    public record CycleOutcome(String result, Classification classification, List<Transition> transitions, long registryVersion) {
    }
}
