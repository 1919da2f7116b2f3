package io.github.assurance.scenario;

/**
 * Deterministic bounded noise alternating between {@code +amplitude} (even
 * iterations) and {@code -amplitude} (odd iterations).
 */
public record SymmetricNoise(double amplitude) implements SignalGenerator {

    public SymmetricNoise {
        if (amplitude < 0) {
            throw new IllegalArgumentException("amplitude must be >= 0, got " + amplitude);
        }
    }

    @Override
    public double valueAt(int iteration) {
        return iteration % 2 == 0 ? amplitude : -amplitude;
    }
}
