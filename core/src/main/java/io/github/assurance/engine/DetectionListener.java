package io.github.assurance.engine;

import io.github.assurance.AssuranceDetector;
import io.github.assurance.Detection;

/**
 * Consumer of detections, typically a corrective action such as revoking
 * best-effort resources. It decides whether and when to re-arm the detector
 * by calling {@link AssuranceDetector#reset()}.
 */
@FunctionalInterface
public interface DetectionListener {

    /**
     * Called on the sampling thread for every detection.
     *
     * @param signal name of the signal that dropped
     * @param detection the detection
     * @param detector the detector that produced it
     */
    void onDetection(String signal, Detection detection, AssuranceDetector detector);
}
