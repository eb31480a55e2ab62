package com.spendsmart.receiptcrop.processing;

import java.util.Collections;
import java.util.List;

/**
 * Measurements and issues found by {@link ImageQualityAnalyzer}.
 */
public final class QualityReport {

    public final double confidence;
    public final double brightness;
    public final double sharpness;
    public final List<String> issues;

    QualityReport(double confidence, double brightness, double sharpness, List<String> issues) {
        this.confidence = confidence;
        this.brightness = brightness;
        this.sharpness = sharpness;
        this.issues = Collections.unmodifiableList(issues);
    }

    @Override
    public String toString() {
        return String.format("QualityReport[confidence=%.2f brightness=%.2f sharpness=%.2f issues=%s]",
            confidence, brightness, sharpness, issues);
    }
}
