package io.github.assurance.policy;

import java.util.Arrays;

/**
 * Positions of the checkpoints inside the baseline window, as lags
 * (1 = the most recent sample before the current one).
 *
 * <p>Checkpoints are spaced geometrically so that a few of them cover the whole
 * window: recent ones catch sudden drops, older ones catch progressive declines.</p>
 *
 * <pre>
 * windowSize=8,  maxCheckpoints=4  -&gt; lags 1, 2, 4, 8
 * windowSize=16, maxCheckpoints=5  -&gt; lags 1, 2, 4, 8, 16
 * windowSize=8,  maxCheckpoints=1  -&gt; lag 8
 * </pre>
 *
 * <p>Lags are strictly increasing and never exceed the window size, so a
 * schedule may hold fewer lags than {@code maxCheckpoints} when the window is
 * too short to give each checkpoint its own sample.</p>
 */
public final class CheckpointSchedule {

    private final int[] lags;

    private CheckpointSchedule(int[] lags) {
        this.lags = lags;
    }

    public static CheckpointSchedule geometric(int windowSize, int maxCheckpoints) {
        if (windowSize < 1 || maxCheckpoints < 1) {
            throw new IllegalArgumentException(
                "windowSize and maxCheckpoints must be >= 1, got " + windowSize + "/" + maxCheckpoints);
        }
        if (maxCheckpoints == 1) {
            return new CheckpointSchedule(new int[]{windowSize});
        }

        int[] lags = new int[maxCheckpoints];
        int count = 0;
        int previous = 0;
        for (int k = 0; k < maxCheckpoints; k++) {
            double exponent = (double) k / (maxCheckpoints - 1);
            int lag = Math.max((int) Math.round(Math.pow(windowSize, exponent)), previous + 1);
            if (lag > windowSize) {
                break;
            }
            lags[count++] = lag;
            previous = lag;
        }
        return new CheckpointSchedule(Arrays.copyOf(lags, count));
    }

    public int size() {
        return lags.length;
    }

    public int lag(int index) {
        return lags[index];
    }

    /**
     * Copy of the lags, ascending.
     */
    public int[] lags() {
        return lags.clone();
    }

    @Override
    public String toString() {
        return "CheckpointSchedule" + Arrays.toString(lags);
    }
}
