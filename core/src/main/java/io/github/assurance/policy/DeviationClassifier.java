package io.github.assurance.policy;

import io.github.assurance.config.AssuranceConfig;

/**
 * Classifies a sample against a baseline level by its relative deviation
 * {@code d = (baseline - sample) / baseline}.
 *
 * <pre>
 * d &lt; fractionThreshold                                -&gt; STABLE
 * d &gt;= fractionThreshold and d &gt;= severityFraction     -&gt; SEVERE_DROP
 * fractionThreshold &lt;= d &lt; fractionThreshold + near    -&gt; NEAR_DROP
 * otherwise                                             -&gt; DROP
 * </pre>
 *
 * <p>A baseline that is zero, negative or not finite gives no usable reference,
 * so the sample is classified STABLE. A sample that is not below its baseline
 * is always STABLE.</p>
 *
 * <p>Pure and stateless apart from the thresholds.</p>
 */
public class DeviationClassifier {

    /** Share of the deviation reported as severity for near drops. */
    public static final double NEAR_DROP_WEIGHT = 0.5;

    private final double fractionThreshold;
    private final double severityFraction;
    private final double nearFraction;

    public DeviationClassifier(double fractionThreshold, double severityFraction, double nearFraction) {
        this.fractionThreshold = fractionThreshold;
        this.severityFraction = severityFraction;
        this.nearFraction = nearFraction;
    }

    public DeviationClassifier(AssuranceConfig config) {
        this(config.fractionThreshold(), config.severityFraction(), config.nearFraction());
    }

    /**
     * Relative deviation of {@code sample} below {@code baseline}.
     * Returns 0 when there is no usable baseline or the sample is not below it.
     */
    public static double deviation(double baseline, double sample) {
        if (!Double.isFinite(baseline) || !Double.isFinite(sample) || baseline <= 0) {
            return 0.0;
        }
        double d = (baseline - sample) / baseline;
        return d > 0 ? d : 0.0;
    }

    /**
     * Classify {@code sample} against a baseline level recorded {@code lag} ticks ago.
     */
    public Checkpoint classify(int lag, double baseline, double sample) {
        double d = deviation(baseline, sample);
        DeviationClass deviationClass = classOf(d);
        return new Checkpoint(lag, baseline, d, deviationClass, severityOf(deviationClass, d));
    }

    /**
     * Classification of an already computed relative deviation.
     */
    public DeviationClass classOf(double deviation) {
        if (deviation <= 0 || deviation < fractionThreshold) {
            return DeviationClass.STABLE;
        }
        if (deviation >= severityFraction) {
            return DeviationClass.SEVERE_DROP;
        }
        if (deviation < fractionThreshold + nearFraction) {
            return DeviationClass.NEAR_DROP;
        }
        return DeviationClass.DROP;
    }

    static double severityOf(DeviationClass deviationClass, double deviation) {
        return switch (deviationClass) {
            case STABLE -> 0.0;
            case NEAR_DROP -> Math.min(deviation, 1.0) * NEAR_DROP_WEIGHT;
            case DROP, SEVERE_DROP -> Math.min(deviation, 1.0);
        };
    }

    public double getFractionThreshold() {
        return fractionThreshold;
    }

    public double getSeverityFraction() {
        return severityFraction;
    }

    public double getNearFraction() {
        return nearFraction;
    }
}
