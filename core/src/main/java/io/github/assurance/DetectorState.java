package io.github.assurance;

/**
 * Lifecycle of an {@link AssuranceDetector}.
 *
 * <pre>
 * UNINITIALIZED -&gt; CALIBRATING -&gt; ARMED &lt;-&gt; DETECTING
 *                       ^                     |
 *                       +------ reset() ------+
 * </pre>
 */
public enum DetectorState {
    /** No sample seen yet. */
    UNINITIALIZED,

    /** Window still filling, or no vote since construction or reset. */
    CALIBRATING,

    /** Steady state, voting on every sample. */
    ARMED,

    /** A drop is held until the signal recovers or the detector is reset. */
    DETECTING
}
