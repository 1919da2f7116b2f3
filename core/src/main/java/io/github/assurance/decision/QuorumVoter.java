package io.github.assurance.decision;

import io.github.assurance.policy.Checkpoint;

import java.util.Optional;

/**
 * Turns the checkpoints in a ledger into a single detect / no-detect decision.
 *
 * <p>The vote is taken over whatever entries exist; the ledger does not need
 * to be full. A vote is positive when the share of drop checkpoints reaches
 * the quorum.</p>
 */
public class QuorumVoter {

    private final double quorum;

    public QuorumVoter(double quorum) {
        if (!(quorum >= 0.0 && quorum <= 1.0)) {
            throw new IllegalArgumentException("quorum must be in [0, 1], got " + quorum);
        }
        this.quorum = quorum;
    }

    public Optional<QuorumVote> vote(CheckpointLedger ledger) {
        if (ledger.isEmpty()) {
            return Optional.empty();
        }
        int trueCount = ledger.trueCount();
        double fraction = (double) trueCount / ledger.size();
        if (trueCount == 0 || fraction < quorum) {
            return Optional.empty();
        }
        Checkpoint strongest = ledger.mostSevere().orElseThrow();
        return Optional.of(new QuorumVote(trueCount, ledger.size(), fraction, strongest));
    }

    public double getQuorum() {
        return quorum;
    }
}
