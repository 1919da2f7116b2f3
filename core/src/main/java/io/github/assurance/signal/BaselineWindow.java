package io.github.assurance.signal;

import java.util.Arrays;

/**
 * Rolling baseline over the most recent samples of one signal.
 * Fixed-capacity ring buffer with strict FIFO eviction.
 *
 * <p>The window never grows past its capacity. It is empty only right after
 * construction or {@link #clear()}.</p>
 *
 * <pre>{@code
 * BaselineWindow window = new BaselineWindow(8);
 * window.update(10.0);          // null - first sample only seeds the window
 * Double expected = window.update(5.0);  // 10.0 - average before 5.0 was added
 * }</pre>
 *
 * <p>Not thread-safe. Owned by a single detector.</p>
 */
public class BaselineWindow {

    private final double[] samples;
    private int head;   // slot the next sample is written to
    private int size;

    public BaselineWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be >= 1, got " + capacity);
        }
        this.samples = new double[capacity];
    }

    // ============ Write ============

    /**
     * Append a sample, evicting the oldest one when the window is full.
     *
     * @param sample the new sample
     * @return the average of the window before the sample was added,
     *         or null if the window was empty
     */
    public Double update(double sample) {
        Double before = average();
        samples[head] = sample;
        head = (head + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
        return before;
    }

    /**
     * Drop all samples. Capacity is unchanged.
     */
    public void clear() {
        Arrays.fill(samples, 0.0);
        head = 0;
        size = 0;
    }

    // ============ Read ============

    /**
     * Arithmetic mean of the current contents. Each sample is scaled by the
     * size before summing, so finite samples always give a finite mean.
     *
     * @return the mean, or null if the window is empty
     */
    public Double average() {
        if (size == 0) {
            return null;
        }
        double mean = 0;
        for (int i = 1; i <= size; i++) {
            mean += lag(i) / size;
        }
        return mean;
    }

    /**
     * Sample recorded {@code lag} updates ago; 1 is the most recent one.
     */
    public double lag(int lag) {
        if (lag < 1 || lag > size) {
            throw new IndexOutOfBoundsException("Lag " + lag + " outside 1.." + size);
        }
        int index = Math.floorMod(head - lag, samples.length);
        return samples[index];
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return samples.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == samples.length;
    }

    /**
     * Copy of the contents, oldest first.
     */
    public double[] toArray() {
        double[] copy = new double[size];
        for (int i = 0; i < size; i++) {
            copy[i] = lag(size - i);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "BaselineWindow{size=" + size + ", capacity=" + samples.length
            + ", average=" + average() + '}';
    }
}
