package io.github.assurance.demo;

import java.util.Random;

/**
 * Simulates the instructions-per-cycle of a latency-critical task sharing a
 * machine with best-effort work.
 *
 * <p>The task runs at a steady base IPC with bounded jitter. Co-located
 * best-effort load contends for caches and memory bandwidth and pulls the IPC
 * down in proportion to its intensity:</p>
 * <ul>
 *   <li>load 0.0: base IPC (alone on the machine)</li>
 *   <li>load 0.5: roughly 35% below base</li>
 *   <li>load 1.0: roughly 70% below base</li>
 * </ul>
 *
 * <p>Not thread-safe; driven by the demo's sampling loop.</p>
 */
public class InterferenceSimulator {

    private static final double DEFAULT_BASE_IPC = 1.8;
    private static final double DEFAULT_JITTER = 0.03;
    // share of IPC lost at full best-effort load
    private static final double CONTENTION_PENALTY = 0.7;

    private final Random random;
    private final double baseIpc;
    private final double jitter;
    private double load;

    public InterferenceSimulator() {
        this(new Random(), DEFAULT_BASE_IPC, DEFAULT_JITTER);
    }

    /**
     * @param random source of jitter; seed it for reproducible runs
     * @param baseIpc IPC of the task running alone
     * @param jitter relative half-width of the noise band, e.g. 0.03 for +/-3%
     */
    public InterferenceSimulator(Random random, double baseIpc, double jitter) {
        if (baseIpc <= 0) {
            throw new IllegalArgumentException("baseIpc must be > 0, got " + baseIpc);
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1), got " + jitter);
        }
        this.random = random;
        this.baseIpc = baseIpc;
        this.jitter = jitter;
    }

    /**
     * Start best-effort work next to the task.
     *
     * @param load intensity in [0, 1]
     */
    public void colocate(double load) {
        if (!(load >= 0 && load <= 1)) {
            throw new IllegalArgumentException("load must be in [0, 1], got " + load);
        }
        this.load = load;
    }

    /**
     * Evict all best-effort work.
     */
    public void revoke() {
        this.load = 0;
    }

    /**
     * Sample the task's IPC for the next monitoring interval.
     */
    public double sampleIpc() {
        double contended = baseIpc * (1.0 - CONTENTION_PENALTY * load);
        double noise = (random.nextDouble() * 2 - 1) * jitter;
        return contended * (1.0 + noise);
    }

    public double getLoad() {
        return load;
    }

    public boolean isColocated() {
        return load > 0;
    }
}
