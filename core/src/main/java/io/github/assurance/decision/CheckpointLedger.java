package io.github.assurance.decision;

import io.github.assurance.policy.Checkpoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity ring buffer of checkpoint verdicts.
 * Appending to a full ledger evicts the oldest checkpoint.
 *
 * <p>Not thread-safe. Owned by a single detector.</p>
 */
public class CheckpointLedger {

    private final Checkpoint[] entries;
    private int head;
    private int size;

    public CheckpointLedger(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Ledger capacity must be >= 1, got " + capacity);
        }
        this.entries = new Checkpoint[capacity];
    }

    public void append(Checkpoint checkpoint) {
        entries[head] = checkpoint;
        head = (head + 1) % entries.length;
        if (size < entries.length) {
            size++;
        }
    }

    public void clear() {
        Arrays.fill(entries, null);
        head = 0;
        size = 0;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return entries.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Number of checkpoints flagged as a drop.
     */
    public int trueCount() {
        int count = 0;
        for (int i = 0; i < size; i++) {
            if (get(i).drop()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Share of checkpoints flagged as a drop; 0.0 for an empty ledger.
     */
    public double trueFraction() {
        return size == 0 ? 0.0 : (double) trueCount() / size;
    }

    /**
     * The drop checkpoint with the highest severity, the most recent one on ties.
     */
    public Optional<Checkpoint> mostSevere() {
        Checkpoint best = null;
        for (int i = 0; i < size; i++) {
            Checkpoint c = get(i);
            if (c.drop() && (best == null || c.severity() >= best.severity())) {
                best = c;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Copy of the contents, oldest first.
     */
    public List<Checkpoint> snapshot() {
        List<Checkpoint> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(get(i));
        }
        return copy;
    }

    // index 0 is the oldest entry
    private Checkpoint get(int index) {
        int start = Math.floorMod(head - size, entries.length);
        return entries[(start + index) % entries.length];
    }

    @Override
    public String toString() {
        return "CheckpointLedger{size=" + size + ", capacity=" + entries.length
            + ", trueFraction=" + trueFraction() + '}';
    }
}
