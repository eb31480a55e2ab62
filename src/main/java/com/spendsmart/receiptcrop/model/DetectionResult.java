package com.spendsmart.receiptcrop.model;

import java.util.Objects;

/**
 * A document rectangle reported by a detector.
 *
 * Corners are normalized to [0,1] with the origin at the bottom-left of the
 * image (y grows upward), the convention used by platform vision detectors.
 * Display space has its origin at the top-left, so consumers must flip y.
 */
public final class DetectionResult {

    private final Point2D topLeft;
    private final Point2D topRight;
    private final Point2D bottomLeft;
    private final Point2D bottomRight;
    private final double confidence;

    public DetectionResult(Point2D topLeft, Point2D topRight, Point2D bottomLeft, Point2D bottomRight,
                           double confidence) {
        this.topLeft = Objects.requireNonNull(topLeft, "topLeft");
        this.topRight = Objects.requireNonNull(topRight, "topRight");
        this.bottomLeft = Objects.requireNonNull(bottomLeft, "bottomLeft");
        this.bottomRight = Objects.requireNonNull(bottomRight, "bottomRight");
        this.confidence = confidence;
    }

    public Point2D getTopLeft() {
        return topLeft;
    }

    public Point2D getTopRight() {
        return topRight;
    }

    public Point2D getBottomLeft() {
        return bottomLeft;
    }

    public Point2D getBottomRight() {
        return bottomRight;
    }

    public double getConfidence() {
        return confidence;
    }

    public double boundingBoxWidth() {
        return maxOf(Point2D::getX) - minOf(Point2D::getX);
    }

    public double boundingBoxHeight() {
        return maxOf(Point2D::getY) - minOf(Point2D::getY);
    }

    /**
     * Detector-space corners in [TL, TR, BR, BL] order.
     */
    public Point2D[] cornersClockwise() {
        return new Point2D[] {topLeft, topRight, bottomRight, bottomLeft};
    }

    private double minOf(java.util.function.ToDoubleFunction<Point2D> axis) {
        double min = Double.MAX_VALUE;
        for (Point2D p : cornersClockwise()) {
            min = Math.min(min, axis.applyAsDouble(p));
        }
        return min;
    }

    private double maxOf(java.util.function.ToDoubleFunction<Point2D> axis) {
        double max = -Double.MAX_VALUE;
        for (Point2D p : cornersClockwise()) {
            max = Math.max(max, axis.applyAsDouble(p));
        }
        return max;
    }

    @Override
    public String toString() {
        return String.format("DetectionResult[tl=%s tr=%s bl=%s br=%s conf=%.2f]",
            topLeft, topRight, bottomLeft, bottomRight, confidence);
    }
}
