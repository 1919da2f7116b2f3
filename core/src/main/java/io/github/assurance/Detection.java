package io.github.assurance;

import io.github.assurance.policy.DeviationClass;

/**
 * A detected drop of the monitored signal.
 *
 * @param tag detector that produced the detection
 * @param tick zero-based index of the sample that produced it
 * @param sample the sample value
 * @param referenceLevel expected level the sample was judged against
 * @param severity magnitude of the drop, 0.0 to 1.0
 * @param fraction share of drop checkpoints in the vote (1.0 for sustained detections)
 * @param deviationClass classification of the strongest evidence
 * @param sustained true when reported from an already held drop rather than a fresh vote
 */
public record Detection(
    Tag tag,
    long tick,
    double sample,
    double referenceLevel,
    double severity,
    double fraction,
    DeviationClass deviationClass,
    boolean sustained
) {

    public boolean isSevere() {
        return deviationClass == DeviationClass.SEVERE_DROP;
    }
}
