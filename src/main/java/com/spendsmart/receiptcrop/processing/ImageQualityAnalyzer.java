package com.spendsmart.receiptcrop.processing;

import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scores how usable a receipt photo is for text extraction.
 *
 * Confidence starts at 1.0 and each detected problem subtracts a fixed
 * penalty; the result is clamped to [0, 1].
 */
public class ImageQualityAnalyzer {

    public static final String ISSUE_DARK = "Low lighting detected - image may be too dark";
    public static final String ISSUE_BRIGHT = "High brightness detected - image may be overexposed";
    public static final String ISSUE_BLURRY = "Image appears blurry - consider retaking";
    public static final String ISSUE_NO_DOCUMENT = "Could not detect document boundaries";
    public static final String ISSUE_WEAK_DETECTION = "Low confidence document detection";
    public static final String ISSUE_ASPECT = "Unusual aspect ratio detected";

    public QualityReport analyze(ImageBuffer image, Optional<DetectionResult> detection) {
        List<String> issues = new ArrayList<>();
        double confidence = 1.0;

        double brightness = measureBrightness(image);
        if (brightness < 0.3) {
            issues.add(ISSUE_DARK);
            confidence -= 0.2;
        } else if (brightness > 0.8) {
            issues.add(ISSUE_BRIGHT);
            confidence -= 0.1;
        }

        double sharpness = measureSharpness(image);
        if (sharpness < 0.4) {
            issues.add(ISSUE_BLURRY);
            confidence -= 0.25;
        }

        if (detection.isEmpty()) {
            issues.add(ISSUE_NO_DOCUMENT);
            confidence -= 0.15;
        } else if (rectangleQuality(detection.get()) < 0.7) {
            issues.add(ISSUE_WEAK_DETECTION);
            confidence -= 0.1;
        }

        double aspectRatio = image.aspectRatio();
        if (aspectRatio > 2.0 || aspectRatio < 0.5) {
            issues.add(ISSUE_ASPECT);
            confidence -= 0.05;
        }

        confidence = Math.max(0.0, Math.min(1.0, confidence));
        QualityReport report = new QualityReport(confidence, brightness, sharpness, issues);
        System.out.println("[ImageQualityAnalyzer] " + report);
        return report;
    }

    /**
     * Mean luminance of the central half of the image, 0..1.
     */
    public double measureBrightness(ImageBuffer image) {
        Mat src = image.toMat();
        Mat gray = new Mat();
        Mat center = null;
        try {
            MatUtils.toGray(src, gray);
            int x = (int) Math.round(image.getWidth() * 0.25);
            int y = (int) Math.round(image.getHeight() * 0.25);
            int w = Math.max(1, (int) Math.round(image.getWidth() * 0.5));
            int h = Math.max(1, (int) Math.round(image.getHeight() * 0.5));
            center = gray.submat(new Rect(x, y, Math.min(w, image.getWidth() - x), Math.min(h, image.getHeight() - y)));
            return Core.mean(center).val[0] / 255.0;
        } finally {
            MatUtils.release(src, gray, center);
        }
    }

    /**
     * Mean absolute Laplacian response, scaled so that crisp printed text
     * lands near 1. Capped at 1.
     */
    public double measureSharpness(ImageBuffer image) {
        Mat src = image.toMat();
        Mat gray = new Mat();
        Mat laplacian = new Mat();
        Mat magnitude = new Mat();
        try {
            MatUtils.toGray(src, gray);
            Imgproc.Laplacian(gray, laplacian, CvType.CV_16S, 1);
            Core.convertScaleAbs(laplacian, magnitude);
            double mean = Core.mean(magnitude).val[0] / 255.0;
            return Math.min(1.0, mean * 10.0);
        } finally {
            MatUtils.release(src, gray, laplacian, magnitude);
        }
    }

    /**
     * Detector confidence discounted for shapes that are unlikely receipts:
     * tiny, extreme aspect, or very uneven sides.
     */
    public double rectangleQuality(DetectionResult detection) {
        double quality = detection.getConfidence();

        double boxWidth = detection.boundingBoxWidth();
        double boxHeight = detection.boundingBoxHeight();
        if (boxWidth * boxHeight < 0.1) {
            quality *= 0.5;
        }

        double aspectRatio = boxHeight > 0 ? boxWidth / boxHeight : Double.POSITIVE_INFINITY;
        if (aspectRatio > 3.0 || aspectRatio < 0.3) {
            quality *= 0.7;
        }

        Point2D[] corners = detection.cornersClockwise();
        double[] sides = new double[corners.length];
        double sum = 0;
        for (int i = 0; i < corners.length; i++) {
            sides[i] = corners[i].distanceTo(corners[(i + 1) % corners.length]);
            sum += sides[i];
        }
        double average = sum / sides.length;
        double deviation = 0;
        for (double side : sides) {
            deviation += Math.abs(side - average);
        }
        deviation /= sides.length;
        if (deviation > average * 0.5) {
            quality *= 0.8;
        }

        return quality;
    }
}
