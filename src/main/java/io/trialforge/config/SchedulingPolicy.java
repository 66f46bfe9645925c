package io.trialforge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.trialforge.lock.ReapPolicy;
import io.trialforge.model.Constraints;
import io.trialforge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Tuning knobs for shaping, scheduling, replay, locking and promotion, read once from
 * {@code trialforge-settings.json}. Missing groups or out-of-range values fall back to defaults.
 */
public record SchedulingPolicy(
        TargetBand targetBand,
        Adjustment hardener,
        Adjustment softener,
        Scheduler scheduler,
        Promotion promotion,
        Constraints baseline,
        Shaper shaper,
        Regret regret,
        Locks locks,
        Validator validator
) {
    public static SchedulingPolicy defaults() {
        return new SchedulingPolicy(
                new TargetBand(0.55d, 0.85d),
                new Adjustment(20, 1.25d, 2),
                new Adjustment(20, 1.25d, 2),
                new Scheduler(0.2d, 0.1d),
                new Promotion(0.91d, 0.47d, 3, 3),
                new Constraints(200, 600, 10),
                new Shaper(50, 5, 10, 30, 1),
                new Regret(200, 0.25d),
                new Locks(3_600L, ReapPolicy.REQUIRE_DEAD_HOLDER),
                new Validator(300L)
        );
    }

    public static SchedulingPolicy load(Path settingsFile) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            PolicyFile file = Jsons.mapper().readValue(settingsFile.toFile(), PolicyFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load scheduling policy: " + settingsFile, e);
        }
    }

    static SchedulingPolicy fromFile(PolicyFile file, SchedulingPolicy defaults) {
        if (file == null) {
            return defaults;
        }
        TargetBand band = defaults.targetBand();
        if (file.targetBand() != null) {
            double min = sanitizeFraction(file.targetBand().min(), band.min());
            double max = sanitizeFraction(file.targetBand().max(), band.max());
            band = min <= max ? new TargetBand(min, max) : band;
        }
        Promotion promotionDefaults = defaults.promotion();
        Promotion promotion = promotionDefaults;
        if (file.promotion() != null) {
            PromotionFile p = file.promotion();
            double max = sanitizeFraction(p.maxFitnessThreshold(), promotionDefaults.maxFitnessThreshold());
            double min = sanitizeFraction(p.minFitnessThreshold(), promotionDefaults.minFitnessThreshold());
            if (min > max) {
                min = promotionDefaults.minFitnessThreshold();
                max = promotionDefaults.maxFitnessThreshold();
            }
            int minEvidence = sanitizeInt(p.minEvidence(), promotionDefaults.minEvidence(), 0);
            int demotionMinEvidence = sanitizeInt(p.demotionMinEvidence(), minEvidence, 0);
            promotion = new Promotion(max, min, minEvidence, demotionMinEvidence);
        }
        Scheduler scheduler = defaults.scheduler();
        if (file.scheduler() != null) {
            scheduler = new Scheduler(
                    sanitizeFraction(file.scheduler().reviewPct(), scheduler.reviewPct()),
                    sanitizeFraction(file.scheduler().explorePct(), scheduler.explorePct())
            );
        }
        Constraints baseline = defaults.baseline();
        if (file.baseline() != null) {
            baseline = new Constraints(
                    sanitizeInt(file.baseline().diffLimit(), baseline.diffLimit(), 1),
                    sanitizeInt(file.baseline().timeoutS(), baseline.timeoutS(), 1),
                    sanitizeInt(file.baseline().contextLines(), baseline.contextLines(), 0)
            );
        }
        Shaper shaper = defaults.shaper();
        if (file.shaper() != null) {
            ShaperFile s = file.shaper();
            shaper = new Shaper(
                    sanitizeInt(s.window(), shaper.window(), 1),
                    sanitizeInt(s.coldStartMinEvidence(), shaper.coldStartMinEvidence(), 1),
                    sanitizeInt(s.minDiffLimit(), shaper.minDiffLimit(), 1),
                    sanitizeInt(s.minTimeoutS(), shaper.minTimeoutS(), 1),
                    sanitizeInt(s.minContextLines(), shaper.minContextLines(), 0)
            );
        }
        Regret regret = defaults.regret();
        if (file.regret() != null) {
            regret = new Regret(
                    sanitizeInt(file.regret().window(), regret.window(), 1),
                    sanitizeFraction(file.regret().replayPct(), regret.replayPct())
            );
        }
        Locks locks = defaults.locks();
        if (file.locks() != null) {
            locks = new Locks(
                    sanitizeLong(file.locks().maxAgeS(), locks.maxAgeS(), 1L),
                    sanitizeReapPolicy(file.locks().reapPolicy(), locks.reapPolicy())
            );
        }
        Validator validator = defaults.validator();
        if (file.validator() != null) {
            validator = new Validator(sanitizeLong(file.validator().intervalS(), validator.intervalS(), 1L));
        }
        return new SchedulingPolicy(
                band,
                sanitizeAdjustment(file.hardener(), defaults.hardener()),
                sanitizeAdjustment(file.softener(), defaults.softener()),
                scheduler,
                promotion,
                baseline,
                shaper,
                regret,
                locks,
                validator
        );
    }

    private static Adjustment sanitizeAdjustment(AdjustmentFile file, Adjustment defaults) {
        if (file == null) {
            return defaults;
        }
        int diffDelta = sanitizeInt(file.diffLimitDelta(), defaults.diffLimitDelta(), 1);
        double scale = file.timeoutScale() == null || !Double.isFinite(file.timeoutScale()) || file.timeoutScale() < 1.0d
                ? defaults.timeoutScale()
                : file.timeoutScale();
        int contextDelta = sanitizeInt(file.contextLinesDelta(), defaults.contextLinesDelta(), 1);
        return new Adjustment(diffDelta, scale, contextDelta);
    }

    private static double sanitizeFraction(Double value, double fallback) {
        if (value == null || !Double.isFinite(value) || value < 0.0d || value > 1.0d) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static ReapPolicy sanitizeReapPolicy(String raw, ReapPolicy fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return ReapPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    public record TargetBand(double min, double max) {
    }

    public record Adjustment(int diffLimitDelta, double timeoutScale, int contextLinesDelta) {
    }

    public record Scheduler(double reviewPct, double explorePct) {
    }

    public record Promotion(
            double maxFitnessThreshold,
            double minFitnessThreshold,
            int minEvidence,
            int demotionMinEvidence
    ) {
    }

    public record Shaper(int window, int coldStartMinEvidence, int minDiffLimit, int minTimeoutS, int minContextLines) {
    }

    public record Regret(int window, double replayPct) {
    }

    public record Locks(long maxAgeS, ReapPolicy reapPolicy) {
    }

    public record Validator(long intervalS) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PolicyFile(
            @JsonProperty("target_band") BandFile targetBand,
            @JsonProperty("hardener") AdjustmentFile hardener,
            @JsonProperty("softener") AdjustmentFile softener,
            @JsonProperty("scheduler") SchedulerFile scheduler,
            @JsonProperty("promotion") PromotionFile promotion,
            @JsonProperty("baseline") BaselineFile baseline,
            @JsonProperty("shaper") ShaperFile shaper,
            @JsonProperty("regret") RegretFile regret,
            @JsonProperty("locks") LocksFile locks,
            @JsonProperty("validator") ValidatorFile validator
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BandFile(@JsonProperty("min") Double min, @JsonProperty("max") Double max) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AdjustmentFile(
            @JsonProperty("diff_limit_delta") Integer diffLimitDelta,
            @JsonProperty("timeout_scale") Double timeoutScale,
            @JsonProperty("context_lines_delta") Integer contextLinesDelta
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SchedulerFile(
            @JsonProperty("review_pct") Double reviewPct,
            @JsonProperty("explore_pct") Double explorePct
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PromotionFile(
            @JsonProperty("max_fitness_threshold") Double maxFitnessThreshold,
            @JsonProperty("min_fitness_threshold") Double minFitnessThreshold,
            @JsonProperty("min_evidence") Integer minEvidence,
            @JsonProperty("demotion_min_evidence") Integer demotionMinEvidence
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BaselineFile(
            @JsonProperty("diff_limit") Integer diffLimit,
            @JsonProperty("timeout_s") Integer timeoutS,
            @JsonProperty("context_lines") Integer contextLines
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ShaperFile(
            @JsonProperty("window") Integer window,
            @JsonProperty("cold_start_min_evidence") Integer coldStartMinEvidence,
            @JsonProperty("min_diff_limit") Integer minDiffLimit,
            @JsonProperty("min_timeout_s") Integer minTimeoutS,
            @JsonProperty("min_context_lines") Integer minContextLines
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegretFile(@JsonProperty("window") Integer window, @JsonProperty("replay_pct") Double replayPct) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LocksFile(@JsonProperty("max_age_s") Long maxAgeS, @JsonProperty("reap_policy") String reapPolicy) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ValidatorFile(@JsonProperty("interval_s") Long intervalS) {
    }
}
