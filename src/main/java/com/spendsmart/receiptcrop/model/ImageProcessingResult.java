package com.spendsmart.receiptcrop.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of automatic processing: how confident we are in the image, what
 * went wrong, and whether a detected rectangle allows manual adjustment.
 */
public final class ImageProcessingResult {

    /** Rough traffic-light grouping of {@link #getOverallConfidence()}. */
    public enum ConfidenceLevel {
        HIGH, MEDIUM, LOW
    }

    private final double overallConfidence;
    private final String processingType;
    private final DetectionResult detectedRectangle;
    private final List<String> qualityIssues;
    private final boolean canAdjustManually;
    private final boolean stitched;

    public ImageProcessingResult(double overallConfidence, String processingType,
                                 DetectionResult detectedRectangle, List<String> qualityIssues,
                                 boolean canAdjustManually, boolean stitched) {
        this.overallConfidence = overallConfidence;
        this.processingType = processingType;
        this.detectedRectangle = detectedRectangle;
        this.qualityIssues = qualityIssues == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(qualityIssues));
        this.canAdjustManually = canAdjustManually;
        this.stitched = stitched;
    }

    public double getOverallConfidence() {
        return overallConfidence;
    }

    public String getProcessingType() {
        return processingType;
    }

    public Optional<DetectionResult> getDetectedRectangle() {
        return Optional.ofNullable(detectedRectangle);
    }

    public List<String> getQualityIssues() {
        return qualityIssues;
    }

    public boolean canAdjustManually() {
        return canAdjustManually;
    }

    public boolean isStitched() {
        return stitched;
    }

    public boolean hasIssues() {
        return !qualityIssues.isEmpty();
    }

    public String qualityText() {
        if (overallConfidence >= 0.9) return "Excellent";
        if (overallConfidence >= 0.75) return "Good";
        if (overallConfidence >= 0.6) return "Fair";
        return "Poor";
    }

    public ConfidenceLevel confidenceLevel() {
        if (overallConfidence >= 0.8) return ConfidenceLevel.HIGH;
        if (overallConfidence >= 0.6) return ConfidenceLevel.MEDIUM;
        return ConfidenceLevel.LOW;
    }

    @Override
    public String toString() {
        return String.format("ImageProcessingResult[%s %.0f%% %s issues=%s adjustable=%b]",
            processingType, overallConfidence * 100, qualityText(), qualityIssues, canAdjustManually);
    }
}
