package io.github.assurance.config;

/**
 * Immutable configuration of one assurance detector.
 *
 * <ul>
 *   <li><b>windowSize</b>: samples kept for the baseline (&gt;= 1)</li>
 *   <li><b>maxCheckpoints</b>: checkpoints per vote, ledger capacity (&gt;= 1)</li>
 *   <li><b>fractionThreshold</b>: minimum relative drop counted as anomalous</li>
 *   <li><b>severityFraction</b>: relative drop classified as severe</li>
 *   <li><b>nearFraction</b>: band above the threshold for weak drops, and the
 *       recovery band around the pre-drop level</li>
 *   <li><b>quorum</b>: minimum share of drop checkpoints needed to detect</li>
 * </ul>
 *
 * <p>All fractions must lie in [0, 1]. Invalid values fail at construction.</p>
 *
 * <pre>{@code
 * AssuranceConfig config = AssuranceConfig.builder()
 *     .windowSize(16)
 *     .maxCheckpoints(5)
 *     .quorum(0.7)
 *     .build();
 * }</pre>
 */
public record AssuranceConfig(
    int windowSize,
    int maxCheckpoints,
    double fractionThreshold,
    double severityFraction,
    double nearFraction,
    double quorum
) {

    public static final int DEFAULT_WINDOW_SIZE = 8;
    public static final int DEFAULT_MAX_CHECKPOINTS = 4;
    public static final double DEFAULT_FRACTION_THRESHOLD = 0.5;
    public static final double DEFAULT_SEVERITY_FRACTION = 1.0;
    public static final double DEFAULT_NEAR_FRACTION = 0.1;
    public static final double DEFAULT_QUORUM = 0.7;

    public AssuranceConfig {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
        }
        if (maxCheckpoints < 1) {
            throw new IllegalArgumentException("maxCheckpoints must be >= 1, got " + maxCheckpoints);
        }
        requireFraction("fractionThreshold", fractionThreshold);
        requireFraction("severityFraction", severityFraction);
        requireFraction("nearFraction", nearFraction);
        requireFraction("quorum", quorum);
    }

    private static void requireFraction(String name, double value) {
        // also rejects NaN
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
        }
    }

    /**
     * Configuration with every default.
     */
    public static AssuranceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
            .windowSize(windowSize)
            .maxCheckpoints(maxCheckpoints)
            .fractionThreshold(fractionThreshold)
            .severityFraction(severityFraction)
            .nearFraction(nearFraction)
            .quorum(quorum);
    }

    public AssuranceConfig withQuorum(double quorum) {
        return toBuilder().quorum(quorum).build();
    }

    public AssuranceConfig withWindow(int windowSize, int maxCheckpoints) {
        return toBuilder().windowSize(windowSize).maxCheckpoints(maxCheckpoints).build();
    }

    // ============ Builder ============

    public static class Builder {
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private int maxCheckpoints = DEFAULT_MAX_CHECKPOINTS;
        private double fractionThreshold = DEFAULT_FRACTION_THRESHOLD;
        private double severityFraction = DEFAULT_SEVERITY_FRACTION;
        private double nearFraction = DEFAULT_NEAR_FRACTION;
        private double quorum = DEFAULT_QUORUM;

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder maxCheckpoints(int maxCheckpoints) {
            this.maxCheckpoints = maxCheckpoints;
            return this;
        }

        public Builder fractionThreshold(double fractionThreshold) {
            this.fractionThreshold = fractionThreshold;
            return this;
        }

        public Builder severityFraction(double severityFraction) {
            this.severityFraction = severityFraction;
            return this;
        }

        public Builder nearFraction(double nearFraction) {
            this.nearFraction = nearFraction;
            return this;
        }

        public Builder quorum(double quorum) {
            this.quorum = quorum;
            return this;
        }

        public AssuranceConfig build() {
            return new AssuranceConfig(
                windowSize, maxCheckpoints, fractionThreshold, severityFraction, nearFraction, quorum);
        }
    }
}
