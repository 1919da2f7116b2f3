package io.github.assurance.policy;

/**
 * One classifier verdict: the incoming sample compared against a single baseline level.
 *
 * @param lag how many ticks back the baseline level was recorded, 0 for the seed sample
 * @param baseLevel the level the sample was compared against
 * @param deviation relative deviation {@code (baseLevel - sample) / baseLevel}, 0 when stable
 * @param deviationClass classification of the deviation
 * @param severity magnitude used to rank drops, between 0.0 and 1.0
 */
public record Checkpoint(
    int lag,
    double baseLevel,
    double deviation,
    DeviationClass deviationClass,
    double severity
) {

    /**
     * Neutral verdict for the first sample, which has nothing to be compared against.
     */
    public static Checkpoint seed(double sample) {
        return new Checkpoint(0, sample, 0.0, DeviationClass.STABLE, 0.0);
    }

    /**
     * "Drop observed" flag counted by the quorum vote.
     */
    public boolean drop() {
        return deviationClass.isDrop();
    }
}
