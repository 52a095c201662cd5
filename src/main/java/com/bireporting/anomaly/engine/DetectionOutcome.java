package com.bireporting.anomaly.engine;

import com.bireporting.anomaly.model.Anomaly;

import java.util.List;

/**
 * Fan-in of one detection run.
 *
 * @param anomalies       everything the detectors returned, in detector-type order
 * @param invoked         detectors that were started
 * @param failedDetectors labels of detectors that threw or missed the deadline
 */
public record DetectionOutcome(List<Anomaly> anomalies,
                               List<DetectorType> invoked,
                               List<String> failedDetectors) {}
