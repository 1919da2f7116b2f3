package io.github.assurance.decision;

import io.github.assurance.policy.Checkpoint;

/**
 * Outcome of a positive quorum vote.
 *
 * @param trueCount checkpoints that observed a drop
 * @param total checkpoints that took part in the vote
 * @param fraction {@code trueCount / total}
 * @param strongest the most severe drop checkpoint
 */
public record QuorumVote(int trueCount, int total, double fraction, Checkpoint strongest) {

    public double severity() {
        return strongest.severity();
    }
}
