package io.github.assurance;

import io.github.assurance.config.AssuranceConfig;
import io.github.assurance.decision.CheckpointLedger;
import io.github.assurance.decision.DropHold;
import io.github.assurance.decision.QuorumVote;
import io.github.assurance.decision.QuorumVoter;
import io.github.assurance.policy.Checkpoint;
import io.github.assurance.policy.CheckpointSchedule;
import io.github.assurance.policy.DeviationClass;
import io.github.assurance.policy.DeviationClassifier;
import io.github.assurance.signal.BaselineWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Streaming detector of sudden or progressive drops in a performance signal.
 *
 * <h2>Per sample</h2>
 * <pre>
 *   processSample(s)
 *         │
 *         ├── drop held? ── not recovered ──► sustained Detection
 *         │        └─ recovered: release hold, vote afresh
 *         ▼
 *   ┌──────────────┐   lags 1, 2, 4 ...   ┌─────────────────────┐
 *   │BaselineWindow│ ───────────────────► │ DeviationClassifier │
 *   └──────┬───────┘                      └──────────┬──────────┘
 *          │ update(s)                               ▼
 *          │                              ┌─────────────────────┐
 *          │                              │  CheckpointLedger   │
 *          │                              └──────────┬──────────┘
 *          ▼                                         ▼
 *   pre-update average ── positive vote ──►  QuorumVoter ──► Detection, hold opened
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AssuranceDetector detector = new AssuranceDetector(
 *     Tag.of("qos_controller", "ipc"),
 *     AssuranceConfig.builder().quorum(0.5).build());
 *
 * // once per monitoring tick
 * detector.processSample(ipc).ifPresent(detection -> {
 *     revokeBestEffort(detection.severity());
 *     detector.reset();
 * });
 * }</pre>
 *
 * <p>A detector never resets itself: once a drop is detected it is reported on
 * every sample until the signal comes back within {@code nearFraction} of the
 * pre-drop level, or until the caller invokes {@link #reset()}.</p>
 *
 * <p>Single-threaded: calls on one instance must be serialized by the caller.
 * Separate instances share no state.</p>
 */
public class AssuranceDetector {

    private static final Logger log = LoggerFactory.getLogger(AssuranceDetector.class);

    public static final Tag DEFAULT_TAG = Tag.of("qos_controller", "AssuranceDetector");

    private final Tag tag;
    private final AssuranceConfig config;

    private final BaselineWindow window;
    private final CheckpointSchedule schedule;
    private final DeviationClassifier classifier;
    private final CheckpointLedger ledger;
    private final QuorumVoter voter;

    private DropHold hold;
    private boolean votedSinceReset;
    private long tick;

    public AssuranceDetector(AssuranceConfig config) {
        this(DEFAULT_TAG, config);
    }

    public AssuranceDetector(Tag tag, AssuranceConfig config) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.config = Objects.requireNonNull(config, "config");

        this.window = new BaselineWindow(config.windowSize());
        this.schedule = CheckpointSchedule.geometric(config.windowSize(), config.maxCheckpoints());
        this.classifier = new DeviationClassifier(config);
        this.ledger = new CheckpointLedger(config.maxCheckpoints());
        this.voter = new QuorumVoter(config.quorum());

        log.debug("[{}] created with {} and checkpoints {}", tag, config, schedule);
    }

    // ============ Runtime ============

    /**
     * Feed the next sample of the signal.
     *
     * @param sample the signal value for this tick
     * @return a detection, or empty when the signal looks normal
     */
    public Optional<Detection> processSample(double sample) {
        long current = tick++;

        if (!Double.isFinite(sample)) {
            log.warn("[{}] discarding non-finite sample {} at tick {}", tag, sample, current);
            return Optional.empty();
        }

        if (window.isEmpty()) {
            window.update(sample);
            ledger.clear();
            ledger.append(Checkpoint.seed(sample));
            return Optional.empty();
        }

        if (hold != null) {
            if (!hold.recovered(sample)) {
                window.update(sample);
                return Optional.of(sustainedDetection(current, sample));
            }
            log.info("[{}] recovered at tick {}: {} back within {} of reference {}",
                tag, current, sample, config.nearFraction(), hold.referenceLevel());
            hold = null;
        }

        ledger.clear();
        for (int i = 0; i < schedule.size(); i++) {
            int lag = schedule.lag(i);
            if (lag > window.size()) {
                break;
            }
            ledger.append(classifier.classify(lag, window.lag(lag), sample));
        }
        votedSinceReset = true;

        double expected = window.update(sample);

        Optional<QuorumVote> vote = voter.vote(ledger);
        if (log.isDebugEnabled()) {
            log.debug("[{}] tick {} sample {} baseline {} votes {}/{}",
                tag, current, sample, expected, ledger.trueCount(), ledger.size());
        }
        if (vote.isEmpty()) {
            return Optional.empty();
        }
        if (!(expected > 0) || !Double.isFinite(expected)) {
            // no usable level to hold the drop against
            log.debug("[{}] ignoring vote at tick {}: baseline {} is not a positive level",
                tag, current, expected);
            return Optional.empty();
        }

        QuorumVote positive = vote.get();
        hold = new DropHold(expected, config.nearFraction(), current);
        log.info("[{}] drop detected at tick {}: sample {} vs baseline {}, {}/{} checkpoints, severity {}",
            tag, current, sample, expected, positive.trueCount(), positive.total(), positive.severity());

        Checkpoint strongest = positive.strongest();
        return Optional.of(new Detection(
            tag, current, sample, expected, positive.severity(), positive.fraction(),
            strongest.deviationClass(), false));
    }

    /**
     * Re-arm the detector after a corrective action.
     *
     * <p>Releases a held drop and clears the checkpoint ledger. The baseline
     * window is kept and recalibrates through the following samples, so a
     * signal that settled at a new level stops producing detections once the
     * old level ages out of the checkpoints.</p>
     */
    public void reset() {
        log.info("[{}] reset at tick {}", tag, tick);
        hold = null;
        ledger.clear();
        votedSinceReset = false;
    }

    private Detection sustainedDetection(long current, double sample) {
        double deviation = hold.deviation(sample);
        DeviationClass deviationClass = classifier.classOf(deviation);
        if (deviationClass == DeviationClass.STABLE) {
            // below the threshold but not yet back inside the recovery band
            deviationClass = DeviationClass.NEAR_DROP;
        }
        return new Detection(
            tag, current, sample, hold.referenceLevel(), Math.min(deviation, 1.0), 1.0, deviationClass, true);
    }

    // ============ Inspection ============

    public DetectorState state() {
        if (window.isEmpty()) {
            return DetectorState.UNINITIALIZED;
        }
        if (hold != null) {
            return DetectorState.DETECTING;
        }
        if (!window.isFull() || !votedSinceReset) {
            return DetectorState.CALIBRATING;
        }
        return DetectorState.ARMED;
    }

    public Tag tag() {
        return tag;
    }

    public AssuranceConfig config() {
        return config;
    }

    /**
     * Number of samples processed so far; also the index of the next sample.
     */
    public long tick() {
        return tick;
    }

    /**
     * Current baseline average, or null before the first sample.
     */
    public Double baseline() {
        return window.average();
    }

    public int windowSize() {
        return window.size();
    }

    public int ledgerSize() {
        return ledger.size();
    }

    /**
     * Share of drop checkpoints in the ledger; 0.0 right after a reset.
     */
    public double trueFraction() {
        return ledger.trueFraction();
    }

    /**
     * Level a held drop is judged against, empty when no drop is held.
     */
    public OptionalDouble referenceLevel() {
        return hold == null ? OptionalDouble.empty() : OptionalDouble.of(hold.referenceLevel());
    }

    public CheckpointSchedule schedule() {
        return schedule;
    }

    @Override
    public String toString() {
        return "AssuranceDetector{tag=" + tag + ", state=" + state() + ", tick=" + tick + '}';
    }
}
