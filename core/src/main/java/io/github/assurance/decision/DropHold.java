package io.github.assurance.decision;

/**
 * Latched drop: the baseline level in force when a drop was detected.
 *
 * <p>The drop stays reported until the signal comes back within
 * {@code nearFraction} of the reference level. Re-arming before that is the
 * caller's decision (detector reset).</p>
 *
 * @param referenceLevel expected level before the drop
 * @param nearFraction recovery band, as a fraction of the reference level
 * @param openedAtTick tick of the vote that opened the hold
 */
public record DropHold(double referenceLevel, double nearFraction, long openedAtTick) {

    /**
     * Relative deviation of {@code sample} below the reference level, 0 if not below.
     */
    public double deviation(double sample) {
        if (referenceLevel <= 0) {
            return 0.0;
        }
        double d = (referenceLevel - sample) / referenceLevel;
        return d > 0 ? d : 0.0;
    }

    /**
     * Whether {@code sample} is back inside the recovery band.
     */
    public boolean recovered(double sample) {
        return deviation(sample) <= nearFraction;
    }

    /**
     * Lowest sample value that counts as recovered.
     */
    public double recoveryLevel() {
        return referenceLevel * (1.0 - nearFraction);
    }
}
