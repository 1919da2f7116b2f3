package io.github.assurance.engine;

import io.github.assurance.AssuranceDetector;
import io.github.assurance.Detection;
import io.github.assurance.DetectorState;
import io.github.assurance.Tag;
import io.github.assurance.config.AssuranceConfig;
import io.github.assurance.config.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Routes samples of several signals to one detector per signal and hands
 * detections to listeners.
 *
 * <pre>
 *   record("ipc", 1.8)            record("cpi", 0.9)
 *          │                              │
 *          ▼                              ▼
 * ┌──────────────────────────────────────────────────┐
 * │                AssuranceMonitor                  │
 * │  ┌────────────────────┐  ┌────────────────────┐  │
 * │  │ AssuranceDetector  │  │ AssuranceDetector  │  │
 * │  │ qos_controller/ipc │  │ qos_controller/cpi │  │
 * │  └─────────┬──────────┘  └─────────┬──────────┘  │
 * └────────────┼───────────────────────┼─────────────┘
 *              └──────── Detection ────┘
 *                          ▼
 *                 DetectionListener(s)
 * </pre>
 *
 * <p>Signals without their own configuration get a detector with the default
 * configuration on their first sample.</p>
 *
 * <p>Not thread-safe: intended to be driven by one serialized sampling loop.</p>
 */
public class AssuranceMonitor {

    private static final Logger log = LoggerFactory.getLogger(AssuranceMonitor.class);

    private final String module;
    private final AssuranceConfig defaults;
    private final Map<String, AssuranceConfig> signalConfigs;
    private final Map<String, AssuranceDetector> detectors = new LinkedHashMap<>();
    private final List<DetectionListener> listeners;

    private AssuranceMonitor(Builder builder) {
        this.module = builder.module;
        this.defaults = builder.defaults;
        this.signalConfigs = new LinkedHashMap<>(builder.signalConfigs);
        this.listeners = List.copyOf(builder.listeners);

        // configured signals get their detector up front
        signalConfigs.keySet().forEach(this::getOrCreateDetector);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ============ Recording ============

    /**
     * Feed the next sample of {@code signal}.
     *
     * @return the detection for this sample, if any
     */
    public Optional<Detection> record(String signal, double value) {
        AssuranceDetector detector = getOrCreateDetector(signal);
        Optional<Detection> result = detector.processSample(value);
        result.ifPresent(detection -> notifyListeners(signal, detection, detector));
        return result;
    }

    private void notifyListeners(String signal, Detection detection, AssuranceDetector detector) {
        for (DetectionListener listener : listeners) {
            try {
                listener.onDetection(signal, detection, detector);
            } catch (RuntimeException e) {
                log.warn("Detection listener {} failed for signal '{}' at tick {}",
                    listener, signal, detection.tick(), e);
            }
        }
    }

    // ============ Detectors ============

    /**
     * Get or create the detector of a signal.
     */
    public AssuranceDetector getOrCreateDetector(String signal) {
        if (signal == null || signal.isBlank()) {
            throw new IllegalArgumentException("Signal name cannot be null or blank");
        }
        return detectors.computeIfAbsent(signal, name -> {
            AssuranceConfig config = signalConfigs.getOrDefault(name, defaults);
            if (!signalConfigs.containsKey(name)) {
                log.debug("No configuration for signal '{}', using defaults", name);
            }
            return new AssuranceDetector(Tag.of(module, name), config);
        });
    }

    public Optional<AssuranceDetector> detector(String signal) {
        return Optional.ofNullable(detectors.get(signal));
    }

    /**
     * State of a signal's detector, UNINITIALIZED for unknown signals.
     */
    public DetectorState state(String signal) {
        AssuranceDetector detector = detectors.get(signal);
        return detector != null ? detector.state() : DetectorState.UNINITIALIZED;
    }

    /**
     * Re-arm one signal's detector.
     *
     * @return false if the signal is unknown
     */
    public boolean reset(String signal) {
        AssuranceDetector detector = detectors.get(signal);
        if (detector == null) {
            return false;
        }
        detector.reset();
        return true;
    }

    public void resetAll() {
        detectors.values().forEach(AssuranceDetector::reset);
    }

    public Set<String> signals() {
        return Collections.unmodifiableSet(detectors.keySet());
    }

    public String getModule() {
        return module;
    }

    // ============ Builder ============

    public static class Builder {
        private String module;
        private AssuranceConfig defaults;
        private final Map<String, AssuranceConfig> signalConfigs = new LinkedHashMap<>();
        private final List<DetectionListener> listeners = new ArrayList<>();

        private Builder() {
            MonitorConfig builtIn = MonitorConfig.builtIn();
            this.module = builtIn.module();
            this.defaults = builtIn.defaults();
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder defaults(AssuranceConfig defaults) {
            this.defaults = Objects.requireNonNull(defaults, "defaults");
            return this;
        }

        public Builder signal(String name, AssuranceConfig config) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Signal name cannot be null or blank");
            }
            signalConfigs.put(name, Objects.requireNonNull(config, "config"));
            return this;
        }

        public Builder listener(DetectionListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Take module, defaults and signals from a loaded config.
         */
        public Builder fromConfig(MonitorConfig config) {
            this.module = config.module();
            this.defaults = config.defaults();
            config.signals().forEach(this::signal);
            return this;
        }

        public AssuranceMonitor build() {
            if (module == null || module.isBlank()) {
                throw new IllegalStateException("Module name is required");
            }
            return new AssuranceMonitor(this);
        }
    }
}
