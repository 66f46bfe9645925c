package io.trialforge.shaping;

import io.trialforge.config.SchedulingPolicy;
import io.trialforge.ledger.Ledger;
import io.trialforge.model.Constraints;
import io.trialforge.model.RollingRate;
import io.trialforge.model.ShapeMode;
import io.trialforge.model.ShapeResult;

/**
 * Bang-bang difficulty controller. A family passing above the target band gets larger limits on
 * every axis; one below the band gets smaller ones. Adjusted values never drop below their floors.
 */
public final class FitnessShaper {
    private final Ledger ledger;
    private final SchedulingPolicy.TargetBand band;
    private final SchedulingPolicy.Adjustment hardener;
    private final SchedulingPolicy.Adjustment softener;
    private final SchedulingPolicy.Shaper shaper;

    public FitnessShaper(Ledger ledger, SchedulingPolicy policy) {
        this.ledger = ledger;
        this.band = policy.targetBand();
        this.hardener = policy.hardener();
        this.softener = policy.softener();
        this.shaper = policy.shaper();
    }

    public ShapeResult shape(String family, Constraints baseline) {
        RollingRate rolling = ledger.rollingPassRate(family, shaper.window());
        double rate = rolling.rate();
        int evidence = rolling.evidence();
        if (evidence < shaper.coldStartMinEvidence()) {
            return new ShapeResult(baseline, ShapeMode.COLD_START, rate, evidence);
        }
        if (rate > band.max()) {
            return new ShapeResult(harden(baseline), ShapeMode.HARDEN, rate, evidence);
        }
        if (rate < band.min()) {
            return new ShapeResult(soften(baseline), ShapeMode.SOFTEN, rate, evidence);
        }
        return new ShapeResult(baseline, ShapeMode.IN_BAND, rate, evidence);
    }

    Constraints harden(Constraints baseline) {
        return new Constraints(
                Math.max(shaper.minDiffLimit(), baseline.diffLimit() + hardener.diffLimitDelta()),
                Math.max(shaper.minTimeoutS(), (int) Math.round(baseline.timeoutS() * hardener.timeoutScale())),
                Math.max(shaper.minContextLines(), baseline.contextLines() + hardener.contextLinesDelta())
        );
    }

    Constraints soften(Constraints baseline) {
        return new Constraints(
                Math.max(shaper.minDiffLimit(), baseline.diffLimit() - softener.diffLimitDelta()),
                Math.max(shaper.minTimeoutS(), (int) Math.round(baseline.timeoutS() / softener.timeoutScale())),
                Math.max(shaper.minContextLines(), baseline.contextLines() - softener.contextLinesDelta())
        );
    }
}
