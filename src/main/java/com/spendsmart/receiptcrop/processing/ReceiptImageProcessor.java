package com.spendsmart.receiptcrop.processing;

import com.spendsmart.receiptcrop.config.CropSettings;
import com.spendsmart.receiptcrop.geometry.CornerSeeder;
import com.spendsmart.receiptcrop.geometry.GeometryException;
import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.ImageProcessingResult;
import com.spendsmart.receiptcrop.model.ProcessedReceipt;
import com.spendsmart.receiptcrop.model.Quadrilateral;

import java.util.Objects;
import java.util.Optional;

/**
 * Automatic receipt pipeline: detect the document, score the photo, crop
 * to the detected outline and enhance the result.
 *
 * Collaborators are passed in so each can be replaced or mocked; there is no
 * shared instance.
 */
public class ReceiptImageProcessor {

    public static final String TYPE_CAMERA = "Camera";
    public static final String TYPE_GALLERY = "Gallery";
    public static final String TYPE_DOCUMENT_SCAN = "Document Scan";

    private final DocumentDetector detector;
    private final ImageQualityAnalyzer analyzer;
    private final ReceiptEnhancer enhancer;
    private final PerspectiveCorrector corrector;
    private final CropSettings settings;

    public ReceiptImageProcessor(DocumentDetector detector, ImageQualityAnalyzer analyzer,
                                 ReceiptEnhancer enhancer, PerspectiveCorrector corrector,
                                 CropSettings settings) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.enhancer = Objects.requireNonNull(enhancer, "enhancer");
        this.corrector = Objects.requireNonNull(corrector, "corrector");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Processor wired with the OpenCV implementations.
     */
    public static ReceiptImageProcessor create(CropSettings settings) {
        return new ReceiptImageProcessor(
            new RectangleDetector(settings),
            new ImageQualityAnalyzer(),
            new ReceiptEnhancer(),
            new PerspectiveCorrector(settings),
            settings);
    }

    /**
     * Analyze and auto-process one image. The processed image is cropped to
     * the detected document when there is one, then enhanced.
     */
    public ProcessedReceipt processWithAnalysis(ImageBuffer image, String processingType) {
        System.out.println("[ReceiptImageProcessor] Processing " + image + " (" + processingType + ")");
        Optional<DetectionResult> detection = detector.detect(image);
        QualityReport report = analyzer.analyze(image, detection);

        ImageBuffer cropped = detection.map(d -> cropToDocument(image, d)).orElse(image);
        ImageBuffer processed = enhancer.enhance(cropped, settings.getReceiptProfile());

        ImageProcessingResult result = new ImageProcessingResult(
            report.confidence,
            processingType,
            detection.orElse(null),
            report.issues,
            detection.isPresent(),
            false
        );
        System.out.println("[ReceiptImageProcessor] " + result);
        return new ProcessedReceipt(processed, result);
    }

    /**
     * Perspective-correct the image to a detector rectangle. A rectangle that
     * cannot be solved leaves the image unchanged.
     */
    public ImageBuffer cropToDocument(ImageBuffer image, DetectionResult detection) {
        Quadrilateral corners = CornerSeeder.fromDetection(detection, image.size());
        try {
            return corrector.correct(image, corners);
        } catch (GeometryException e) {
            System.err.println("[ReceiptImageProcessor] Keeping uncropped image: " + e.getMessage());
            return image;
        }
    }

    /**
     * Gallery import: crop to the document if one is found, then enhance.
     */
    public ImageBuffer processGalleryImage(ImageBuffer image) {
        Optional<DetectionResult> detection = detector.detect(image);
        ImageBuffer processed = image;
        if (detection.isPresent()) {
            System.out.println("[ReceiptImageProcessor] Document rectangle detected - cropping");
            processed = cropToDocument(image, detection.get());
        } else {
            System.out.println("[ReceiptImageProcessor] No document rectangle detected - processing full image");
        }
        return enhancer.enhance(processed, settings.getReceiptProfile());
    }

    /**
     * Final preparation before the image is sent for text extraction.
     */
    public ImageBuffer optimizeForOcr(ImageBuffer image) {
        return enhancer.optimizeForOcr(image, settings.getMaxOcrDimension());
    }
}
