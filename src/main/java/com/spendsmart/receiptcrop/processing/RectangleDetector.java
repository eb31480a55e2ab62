package com.spendsmart.receiptcrop.processing;

import com.spendsmart.receiptcrop.config.CropSettings;
import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.util.MatUtils;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Contour-based document rectangle detection.
 *
 * Grayscale, blur, Otsu threshold and a morphological close isolate the
 * paper; external contours approximated to four convex vertices become
 * candidates. Among the candidates that pass the size, aspect and
 * confidence filters, the one with the largest bounding box wins.
 */
public class RectangleDetector implements DocumentDetector {

    private static final double APPROX_EPSILON_FRACTION = 0.02;

    private final CropSettings settings;

    public RectangleDetector(CropSettings settings) {
        this.settings = settings;
    }

    public RectangleDetector() {
        this(CropSettings.defaults());
    }

    /**
     * One quadrilateral that passed the filters.
     */
    private static class Candidate {
        final Point[] corners;
        final double boundingArea;
        final double confidence;

        Candidate(Point[] corners, double boundingArea, double confidence) {
            this.corners = corners;
            this.boundingArea = boundingArea;
            this.confidence = confidence;
        }
    }

    @Override
    public Optional<DetectionResult> detect(ImageBuffer image) {
        Mat src = image.toMat();
        Mat gray = new Mat();
        Mat blurred = new Mat();
        Mat binary = new Mat();
        Mat closed = new Mat();
        Mat kernel = null;
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            MatUtils.toGray(src, gray);
            Imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            Imgproc.threshold(blurred, binary, 0, 255, Imgproc.THRESH_BINARY + Imgproc.THRESH_OTSU);

            int k = Math.max(3, (Math.min(image.getWidth(), image.getHeight()) / 100) | 1);
            kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(k, k));
            Imgproc.morphologyEx(binary, closed, Imgproc.MORPH_CLOSE, kernel);

            Imgproc.findContours(closed, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

            List<Candidate> candidates = new ArrayList<>();
            for (MatOfPoint contour : contours) {
                Candidate candidate = evaluate(contour, image.getWidth(), image.getHeight());
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }

            if (candidates.isEmpty()) {
                System.out.println("[RectangleDetector] No document rectangle among " + contours.size() + " contours");
                return Optional.empty();
            }

            candidates.sort(Comparator.comparingDouble((Candidate c) -> c.boundingArea).reversed());
            List<Candidate> kept = candidates.subList(0, Math.min(candidates.size(), settings.getMaxObservations()));
            Candidate best = kept.get(0);
            DetectionResult result = toDetection(best, image.getWidth(), image.getHeight());
            System.out.println("[RectangleDetector] Detected " + result + " (" + candidates.size() + " candidates)");
            return Optional.of(result);
        } finally {
            MatUtils.releaseAll(contours);
            MatUtils.release(src, gray, blurred, binary, closed, kernel, hierarchy);
        }
    }

    private Candidate evaluate(MatOfPoint contour, int imageWidth, int imageHeight) {
        double area = Imgproc.contourArea(contour);
        if (area <= 0) {
            return null;
        }

        MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
        MatOfPoint2f approx = new MatOfPoint2f();
        MatOfPoint approxPoints = null;
        try {
            Imgproc.approxPolyDP(curve, approx, Imgproc.arcLength(curve, true) * APPROX_EPSILON_FRACTION, true);
            if (approx.total() != 4) {
                return null;
            }
            Point[] quad = approx.toArray();
            approxPoints = new MatOfPoint(quad);
            if (!Imgproc.isContourConvex(approxPoints)) {
                return null;
            }

            Rect box = Imgproc.boundingRect(approxPoints);
            if (box.width <= 0 || box.height <= 0) {
                return null;
            }
            // A region touching every border is the frame itself, not a document in it
            if (box.x <= 1 && box.y <= 1
                && box.x + box.width >= imageWidth - 1 && box.y + box.height >= imageHeight - 1) {
                return null;
            }
            double aspect = (double) box.width / box.height;
            if (aspect < settings.getMinAspectRatio() || aspect > settings.getMaxAspectRatio()) {
                return null;
            }
            double minSide = settings.getMinimumSize() * Math.min(imageWidth, imageHeight);
            if (Math.min(box.width, box.height) < minSide) {
                return null;
            }

            double quadArea = polygonArea(quad);
            double confidence = quadArea > 0 ? Math.min(1.0, area / quadArea) : 0;
            if (confidence < settings.getMinimumConfidence()) {
                return null;
            }
            return new Candidate(quad, (double) box.width * box.height, confidence);
        } finally {
            MatUtils.release(curve, approx, approxPoints);
        }
    }

    /**
     * Label pixel corners on screen, then express them the way platform
     * detectors do: normalized with the origin at the bottom-left.
     */
    private static DetectionResult toDetection(Candidate candidate, int imageWidth, int imageHeight) {
        List<Point2D> pixels = new ArrayList<>(4);
        for (Point p : candidate.corners) {
            pixels.add(new Point2D(p.x, p.y));
        }
        Quadrilateral ordered = Quadrilateral.orderedByPosition(pixels);
        return new DetectionResult(
            normalize(ordered.topLeft(), imageWidth, imageHeight),
            normalize(ordered.topRight(), imageWidth, imageHeight),
            normalize(ordered.bottomLeft(), imageWidth, imageHeight),
            normalize(ordered.bottomRight(), imageWidth, imageHeight),
            candidate.confidence
        );
    }

    private static Point2D normalize(Point2D pixel, int imageWidth, int imageHeight) {
        return new Point2D(pixel.getX() / imageWidth, 1.0 - pixel.getY() / imageHeight);
    }

    private static double polygonArea(Point[] points) {
        double sum = 0;
        for (int i = 0; i < points.length; i++) {
            Point a = points[i];
            Point b = points[(i + 1) % points.length];
            sum += a.x * b.y - b.x * a.y;
        }
        return Math.abs(sum) / 2.0;
    }
}
