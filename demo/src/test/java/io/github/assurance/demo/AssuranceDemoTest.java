package io.github.assurance.demo;

import io.github.assurance.Detection;
import io.github.assurance.policy.DeviationClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Co-location Demo Tests")
class AssuranceDemoTest {

    @Test
    @DisplayName("Heavy co-locations are revoked, the light one is tolerated")
    void demo_RevokesHeavyLoadOnly() throws IOException {
        AssuranceDemo demo = AssuranceDemo.fromResource(new Random(7));

        AssuranceDemo.Report report = demo.run(AssuranceDemo.DEFAULT_TICKS);

        assertEquals(120, report.ticks());
        assertEquals(2, report.revocations());
        assertEquals(2, report.detections().size());
        assertEquals(40, report.detections().get(0).tick());
        assertEquals(100, report.detections().get(1).tick());
        for (Detection detection : report.detections()) {
            assertFalse(detection.sustained());
            assertEquals(DeviationClass.DROP, detection.deviationClass());
        }
        assertFalse(demo.simulator().isColocated());
    }

    @Test
    @DisplayName("Simulated IPC follows the co-located load")
    void simulator_LoadLowersIpc() {
        InterferenceSimulator simulator = new InterferenceSimulator(new Random(1), 2.0, 0.0);

        assertEquals(2.0, simulator.sampleIpc(), 1e-9);
        simulator.colocate(0.5);
        assertEquals(1.3, simulator.sampleIpc(), 1e-9);
        assertTrue(simulator.isColocated());
        simulator.revoke();
        assertEquals(2.0, simulator.sampleIpc(), 1e-9);

        assertThrows(IllegalArgumentException.class, () -> simulator.colocate(1.5));
        assertThrows(IllegalArgumentException.class, () -> new InterferenceSimulator(new Random(), 0.0, 0.1));
    }
}
