package io.github.assurance.scenario;

/**
 * Produces the input value for a given call index (0 = first sample).
 */
@FunctionalInterface
public interface SignalGenerator {

    double valueAt(int iteration);
}
