package io.github.assurance;

import io.github.assurance.config.AssuranceConfig;
import io.github.assurance.policy.Checkpoint;
import io.github.assurance.policy.DeviationClass;
import io.github.assurance.policy.DeviationClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-checkpoint policy: relative deviation and its four classes.
 */
@DisplayName("DeviationClassifier Tests")
class DeviationClassifierTest {

    // threshold 0.5, severe at 0.9, near band 0.1
    private final DeviationClassifier classifier = new DeviationClassifier(0.5, 0.9, 0.1);

    // ============================================
    // 1. Deviation
    // ============================================

    @Test
    @DisplayName("Deviation is the relative drop from the baseline")
    void deviation_RelativeDrop() {
        assertEquals(0.5, DeviationClassifier.deviation(10.0, 5.0), 1e-9);
        assertEquals(0.25, DeviationClassifier.deviation(4.0, 3.0), 1e-9);
        assertEquals(1.0, DeviationClassifier.deviation(10.0, 0.0), 1e-9);
    }

    @Test
    @DisplayName("Rises and degenerate baselines have no deviation")
    void deviation_NoDrop() {
        assertEquals(0.0, DeviationClassifier.deviation(10.0, 12.0));
        assertEquals(0.0, DeviationClassifier.deviation(0.0, 5.0));
        assertEquals(0.0, DeviationClassifier.deviation(-2.0, -5.0));
        assertEquals(0.0, DeviationClassifier.deviation(Double.NaN, 1.0));
        assertEquals(0.0, DeviationClassifier.deviation(10.0, Double.POSITIVE_INFINITY));
    }

    // ============================================
    // 2. Classes
    // ============================================

    @Test
    @DisplayName("Classes follow threshold, near band and severity cut")
    void classOf_Boundaries() {
        assertEquals(DeviationClass.STABLE, classifier.classOf(0.0));
        assertEquals(DeviationClass.STABLE, classifier.classOf(0.49));
        assertEquals(DeviationClass.NEAR_DROP, classifier.classOf(0.5));
        assertEquals(DeviationClass.NEAR_DROP, classifier.classOf(0.59));
        assertEquals(DeviationClass.DROP, classifier.classOf(0.6));
        assertEquals(DeviationClass.DROP, classifier.classOf(0.89));
        assertEquals(DeviationClass.SEVERE_DROP, classifier.classOf(0.9));
        assertEquals(DeviationClass.SEVERE_DROP, classifier.classOf(1.0));
    }

    @Test
    @DisplayName("Zero threshold still needs a positive drop")
    void classOf_ZeroThreshold() {
        DeviationClassifier eager = new DeviationClassifier(0.0, 1.0, 0.0);

        assertEquals(DeviationClass.STABLE, eager.classOf(0.0));
        assertEquals(DeviationClass.DROP, eager.classOf(0.01));
    }

    @Test
    @DisplayName("Only stable is not a drop")
    void deviationClass_IsDrop() {
        assertFalse(DeviationClass.STABLE.isDrop());
        assertTrue(DeviationClass.NEAR_DROP.isDrop());
        assertTrue(DeviationClass.DROP.isDrop());
        assertTrue(DeviationClass.SEVERE_DROP.isDrop());
    }

    @Test
    @DisplayName("Near drops weigh half as much as full drops")
    void classify_Severity() {
        Checkpoint near = classifier.classify(1, 10.0, 4.5);
        Checkpoint drop = classifier.classify(2, 10.0, 3.0);
        Checkpoint stable = classifier.classify(4, 10.0, 9.0);

        assertEquals(DeviationClass.NEAR_DROP, near.deviationClass());
        assertEquals(0.55 * DeviationClassifier.NEAR_DROP_WEIGHT, near.severity(), 1e-9);
        assertEquals(DeviationClass.DROP, drop.deviationClass());
        assertEquals(0.7, drop.severity(), 1e-9);
        assertEquals(0.0, stable.severity());
        assertFalse(stable.drop());

        assertEquals(2, drop.lag());
        assertEquals(10.0, drop.baseLevel());
    }

    @Test
    @DisplayName("Seed checkpoint is a neutral verdict")
    void checkpoint_Seed() {
        Checkpoint seed = Checkpoint.seed(7.5);

        assertEquals(0, seed.lag());
        assertEquals(7.5, seed.baseLevel());
        assertEquals(DeviationClass.STABLE, seed.deviationClass());
        assertEquals(0.0, seed.severity());
        assertFalse(seed.drop());
    }

    @Test
    @DisplayName("Classifier picks its bounds from the config")
    void classifier_FromConfig() {
        DeviationClassifier fromConfig = new DeviationClassifier(AssuranceConfig.builder()
            .fractionThreshold(0.3)
            .severityFraction(0.8)
            .nearFraction(0.05)
            .build());

        assertEquals(0.3, fromConfig.getFractionThreshold());
        assertEquals(0.8, fromConfig.getSeverityFraction());
        assertEquals(0.05, fromConfig.getNearFraction());
        assertEquals(DeviationClass.DROP, fromConfig.classOf(0.4));
    }
}
