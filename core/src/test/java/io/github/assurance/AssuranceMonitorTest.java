package io.github.assurance;

import io.github.assurance.config.AssuranceConfig;
import io.github.assurance.config.ConfigLoader;
import io.github.assurance.config.MonitorConfig;
import io.github.assurance.engine.AssuranceMonitor;
import io.github.assurance.engine.DetectionListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssuranceMonitor Tests")
class AssuranceMonitorTest {

    private static final AssuranceConfig HALF_QUORUM = AssuranceConfig.defaults().withQuorum(0.5);

    @Mock
    private DetectionListener listener;

    private static void feed(AssuranceMonitor monitor, String signal, double value, int times) {
        for (int i = 0; i < times; i++) {
            monitor.record(signal, value);
        }
    }

    // ============================================
    // 1. Routing
    // ============================================

    @Test
    @DisplayName("Each signal gets its own detector")
    void routing_DetectorPerSignal() {
        AssuranceMonitor monitor = AssuranceMonitor.builder()
            .defaults(HALF_QUORUM)
            .build();

        feed(monitor, "ipc", 10.0, 10);
        feed(monitor, "cpi", 2.0, 10);

        assertEquals(List.of("ipc", "cpi"), List.copyOf(monitor.signals()));
        assertTrue(monitor.record("ipc", 5.0).isPresent());
        assertTrue(monitor.record("cpi", 2.0).isEmpty());
        assertEquals(DetectorState.DETECTING, monitor.state("ipc"));
        assertEquals(DetectorState.ARMED, monitor.state("cpi"));
        assertEquals(DetectorState.UNINITIALIZED, monitor.state("unknown"));
    }

    @Test
    @DisplayName("Configured signals use their own config and the module tag")
    void routing_ConfiguredSignals() {
        AssuranceConfig wide = HALF_QUORUM.withWindow(16, 5);
        AssuranceMonitor monitor = AssuranceMonitor.builder()
            .module("colo")
            .signal("ipc", wide)
            .build();

        AssuranceDetector ipc = monitor.detector("ipc").orElseThrow();
        assertEquals(wide, ipc.config());
        assertEquals(Tag.of("colo", "ipc"), ipc.tag());
        assertEquals("colo", monitor.getModule());

        AssuranceDetector other = monitor.getOrCreateDetector("cpi");
        assertEquals(AssuranceConfig.defaults(), other.config());
        assertTrue(monitor.detector("missing").isEmpty());
    }

    @Test
    @DisplayName("Monitor built from a loaded config")
    void routing_FromConfig() throws IOException {
        MonitorConfig config = ConfigLoader.fromResource("monitor-config.json");

        AssuranceMonitor monitor = AssuranceMonitor.builder()
            .fromConfig(config)
            .build();

        assertEquals(List.of("ipc", "llc_misses_inverse"), List.copyOf(monitor.signals()));
        assertEquals(0.4, monitor.detector("ipc").orElseThrow().config().fractionThreshold());
        assertEquals(0.5, monitor.getOrCreateDetector("cpi").config().quorum());
    }

    @Test
    @DisplayName("Invalid names are rejected")
    void routing_InvalidNames() {
        AssuranceMonitor monitor = AssuranceMonitor.builder().build();

        assertThrows(IllegalArgumentException.class, () -> monitor.record(" ", 1.0));
        assertThrows(IllegalArgumentException.class, () -> monitor.record(null, 1.0));
        assertThrows(IllegalArgumentException.class,
            () -> AssuranceMonitor.builder().signal("", HALF_QUORUM));
        assertThrows(IllegalStateException.class,
            () -> AssuranceMonitor.builder().module(" ").build());
    }

    // ============================================
    // 2. Listeners
    // ============================================

    @Test
    @DisplayName("Listener sees every detection with its detector")
    void listener_Notified() {
        AssuranceMonitor monitor = AssuranceMonitor.builder()
            .defaults(HALF_QUORUM)
            .listener(listener)
            .build();

        feed(monitor, "ipc", 10.0, 10);
        verifyNoInteractions(listener);

        monitor.record("ipc", 5.0);
        monitor.record("ipc", 5.0);

        ArgumentCaptor<Detection> captor = ArgumentCaptor.forClass(Detection.class);
        verify(listener, times(2)).onDetection(eq("ipc"), captor.capture(), any(AssuranceDetector.class));
        assertFalse(captor.getAllValues().get(0).sustained());
        assertTrue(captor.getAllValues().get(1).sustained());
        assertEquals(10, captor.getAllValues().get(0).tick());
    }

    @Test
    @DisplayName("Listener can re-arm the detector it is handed")
    void listener_ResetsDetector() {
        DetectionListener resetting = (signal, detection, detector) -> detector.reset();
        AssuranceMonitor monitor = AssuranceMonitor.builder()
            .defaults(HALF_QUORUM)
            .listener(resetting)
            .listener(listener)
            .build();

        feed(monitor, "ipc", 10.0, 10);
        for (int i = 0; i < 20; i++) {
            monitor.record("ipc", 5.0);
        }

        // the old level ages out of the checkpoints after four samples
        verify(listener, times(4)).onDetection(eq("ipc"), any(Detection.class), any(AssuranceDetector.class));
        assertEquals(DetectorState.ARMED, monitor.state("ipc"));
    }

    @Test
    @DisplayName("Failing listener does not stop the others")
    void listener_FailureIsolated() {
        DetectionListener failing = mock(DetectionListener.class);
        doThrow(new IllegalStateException("boom"))
            .when(failing).onDetection(any(), any(), any());
        AssuranceMonitor monitor = AssuranceMonitor.builder()
            .defaults(HALF_QUORUM)
            .listener(failing)
            .listener(listener)
            .build();

        feed(monitor, "ipc", 10.0, 10);
        Optional<Detection> detection = monitor.record("ipc", 5.0);

        assertTrue(detection.isPresent());
        verify(failing).onDetection(eq("ipc"), any(Detection.class), any(AssuranceDetector.class));
        verify(listener).onDetection(eq("ipc"), eq(detection.get()), any(AssuranceDetector.class));
    }

    // ============================================
    // 3. Reset
    // ============================================

    @Test
    @DisplayName("Reset re-arms one signal or all of them")
    void reset_OneAndAll() {
        AssuranceMonitor monitor = AssuranceMonitor.builder()
            .defaults(HALF_QUORUM)
            .build();
        feed(monitor, "ipc", 10.0, 10);
        feed(monitor, "cpi", 10.0, 10);
        monitor.record("ipc", 5.0);
        monitor.record("cpi", 5.0);

        assertTrue(monitor.reset("ipc"));
        assertFalse(monitor.reset("unknown"));
        assertEquals(DetectorState.CALIBRATING, monitor.state("ipc"));
        assertEquals(DetectorState.DETECTING, monitor.state("cpi"));

        monitor.resetAll();
        assertEquals(DetectorState.CALIBRATING, monitor.state("cpi"));
        assertEquals(0.0, monitor.detector("cpi").orElseThrow().trueFraction());
    }
}
