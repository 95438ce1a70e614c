package com.enterprise.sheetrecovery.core.model;

import lombok.Value;

/**
 * A detector's verdict: a label (charset name, delimiter) and a confidence in [0, 1].
 */
@Value
public class DetectionResult {

    public static final double ACCEPTANCE_THRESHOLD = 0.7;

    String label;
    double confidence;

    public boolean isConfident() {
        return confidence > ACCEPTANCE_THRESHOLD;
    }
}
