package io.github.assurance.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of a monitor that tracks several signals, one detector each.
 *
 * @param module module name used to tag detectors in logs
 * @param defaults configuration for signals without an entry of their own
 * @param signals per-signal configurations, in declaration order
 */
public record MonitorConfig(
    String module,
    AssuranceConfig defaults,
    Map<String, AssuranceConfig> signals
) {

    public static final String DEFAULT_MODULE = "qos_controller";

    public MonitorConfig {
        if (module == null || module.isBlank()) {
            module = DEFAULT_MODULE;
        }
        if (defaults == null) {
            defaults = AssuranceConfig.defaults();
        }
        signals = signals == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(signals));
    }

    /**
     * Default module, default detector config, no per-signal entries.
     */
    public static MonitorConfig builtIn() {
        return new MonitorConfig(DEFAULT_MODULE, AssuranceConfig.defaults(), Map.of());
    }

    /**
     * Configuration for {@code signal}, falling back to the defaults.
     */
    public AssuranceConfig configFor(String signal) {
        Objects.requireNonNull(signal, "signal");
        return signals.getOrDefault(signal, defaults);
    }
}
