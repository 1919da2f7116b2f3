package io.github.assurance.demo;

import io.github.assurance.Detection;
import io.github.assurance.config.ConfigLoader;
import io.github.assurance.config.MonitorConfig;
import io.github.assurance.engine.AssuranceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Co-location demo: a latency-critical task shares its machine with
 * best-effort jobs, and the assurance detector decides when to evict them.
 *
 * <ul>
 *   <li>Ticks 0-39: task runs alone at its base IPC</li>
 *   <li>Tick 40: a heavy best-effort job lands, IPC collapses, the job is revoked</li>
 *   <li>Tick 80: a light job lands, IPC dips below the threshold and is tolerated</li>
 *   <li>Tick 100: another heavy job lands on top, IPC collapses again, revoked</li>
 * </ul>
 *
 * <h2>Control loop</h2>
 * <pre>{@code
 * AssuranceMonitor monitor = AssuranceMonitor.builder()
 *     .fromConfig(ConfigLoader.fromResource("assurance-demo.json"))
 *     .listener((signal, detection, detector) -> {
 *         simulator.revoke();   // evict best-effort work
 *         detector.reset();     // re-arm for the next incident
 *     })
 *     .build();
 *
 * monitor.record("ipc", simulator.sampleIpc());   // once per tick
 * }</pre>
 */
public class AssuranceDemo {

    private static final Logger log = LoggerFactory.getLogger(AssuranceDemo.class);

    static final String CONFIG_RESOURCE = "assurance-demo.json";
    static final String SIGNAL = "ipc";
    static final int DEFAULT_TICKS = 120;

    /**
     * Outcome of one run.
     *
     * @param ticks samples fed to the monitor
     * @param detections detections raised, first and sustained
     * @param revocations times best-effort work was evicted
     */
    public record Report(int ticks, List<Detection> detections, int revocations) {
    }

    private final MonitorConfig config;
    private final InterferenceSimulator simulator;
    // tick -> best-effort load that starts at that tick
    private final Map<Integer, Double> schedule = new LinkedHashMap<>();

    public AssuranceDemo(MonitorConfig config, InterferenceSimulator simulator) {
        this.config = config;
        this.simulator = simulator;
        schedule.put(40, 0.8);
        schedule.put(80, 0.3);
        schedule.put(100, 0.9);
    }

    public static void main(String[] args) throws IOException {
        int ticks = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_TICKS;
        MonitorConfig config = ConfigLoader.fromResource(CONFIG_RESOURCE);
        log.info("Loaded {}:\n{}", CONFIG_RESOURCE, ConfigLoader.toJsonPretty(config));

        AssuranceDemo demo = new AssuranceDemo(config, new InterferenceSimulator());
        Report report = demo.run(ticks);

        log.info("Demo complete: {} ticks, {} detections, {} revocations",
            report.ticks(), report.detections().size(), report.revocations());
    }

    public Report run(int ticks) {
        List<Detection> detections = new ArrayList<>();
        int[] revocations = {0};

        AssuranceMonitor monitor = AssuranceMonitor.builder()
            .fromConfig(config)
            .listener((signal, detection, detector) -> detections.add(detection))
            .listener((signal, detection, detector) -> {
                if (simulator.isColocated()) {
                    log.info("Revoking best-effort load {} after {} on '{}' (severity {})",
                        simulator.getLoad(), detection.deviationClass(), signal,
                        String.format("%.2f", detection.severity()));
                    simulator.revoke();
                    revocations[0]++;
                }
                detector.reset();
            })
            .build();

        for (int tick = 0; tick < ticks; tick++) {
            Double extra = schedule.get(tick);
            if (extra != null) {
                log.info("Tick {}: co-locating best-effort load {}", tick, extra);
                simulator.colocate(Math.min(1.0, simulator.getLoad() + extra));
            }

            double ipc = simulator.sampleIpc();
            monitor.record(SIGNAL, ipc);

            if (tick % 10 == 9) {
                log.info("Tick {}: ipc={} load={} state={}",
                    tick, String.format("%.3f", ipc), simulator.getLoad(), monitor.state(SIGNAL));
            }
        }
        return new Report(ticks, List.copyOf(detections), revocations[0]);
    }

    InterferenceSimulator simulator() {
        return simulator;
    }

    public static AssuranceDemo fromResource(Random random) throws IOException {
        return new AssuranceDemo(ConfigLoader.fromResource(CONFIG_RESOURCE),
            new InterferenceSimulator(random, 1.8, 0.03));
    }
}
