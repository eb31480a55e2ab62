package com.spendsmart.receiptcrop.processing;

import com.spendsmart.receiptcrop.config.CropSettings;
import com.spendsmart.receiptcrop.geometry.GeometryException;
import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.ImageProcessingResult;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.ProcessedReceipt;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReceiptImageProcessorTest {

    private static final ImageBuffer ORIGINAL = TestImages.uniform(1000, 1400, 3, 0);
    private static final ImageBuffer CROPPED = TestImages.uniform(900, 1260, 3, 0);
    private static final ImageBuffer ENHANCED = TestImages.uniform(900, 1260, 3, 1);
    private static final DetectionResult DETECTION = new DetectionResult(
        new Point2D(0.05, 0.95), new Point2D(0.95, 0.95),
        new Point2D(0.05, 0.05), new Point2D(0.95, 0.05), 0.9);

    @Mock
    private DocumentDetector detector;
    @Mock
    private ImageQualityAnalyzer analyzer;
    @Mock
    private ReceiptEnhancer enhancer;
    @Mock
    private PerspectiveCorrector corrector;

    private final CropSettings settings = CropSettings.builder().build();
    private ReceiptImageProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new ReceiptImageProcessor(detector, analyzer, enhancer, corrector, settings);
    }

    @Test
    @DisplayName("A detected document is cropped, enhanced and adjustable")
    void testProcessWithDetection() throws Exception {
        when(detector.detect(ORIGINAL)).thenReturn(Optional.of(DETECTION));
        when(analyzer.analyze(ORIGINAL, Optional.of(DETECTION)))
            .thenReturn(new QualityReport(0.85, 0.5, 0.6, Collections.emptyList()));
        when(corrector.correct(eq(ORIGINAL), any())).thenReturn(CROPPED);
        when(enhancer.enhance(CROPPED, settings.getReceiptProfile())).thenReturn(ENHANCED);

        ProcessedReceipt receipt = processor.processWithAnalysis(ORIGINAL, ReceiptImageProcessor.TYPE_DOCUMENT_SCAN);

        assertSame(ENHANCED, receipt.image);
        ImageProcessingResult result = receipt.result;
        assertEquals(0.85, result.getOverallConfidence(), 1e-9);
        assertEquals(ReceiptImageProcessor.TYPE_DOCUMENT_SCAN, result.getProcessingType());
        assertTrue(result.canAdjustManually());
        assertFalse(result.isStitched());
        assertEquals(Optional.of(DETECTION), result.getDetectedRectangle());
        assertEquals("Good", result.qualityText());
        assertEquals(ImageProcessingResult.ConfidenceLevel.HIGH, result.confidenceLevel());
    }

    @Test
    @DisplayName("Detection corners are mapped into image pixels before cropping")
    void testCropCornersInImageSpace() throws Exception {
        when(corrector.correct(eq(ORIGINAL), any())).thenReturn(CROPPED);

        processor.cropToDocument(ORIGINAL, DETECTION);

        ArgumentCaptor<Quadrilateral> corners = ArgumentCaptor.forClass(Quadrilateral.class);
        verify(corrector).correct(eq(ORIGINAL), corners.capture());
        Quadrilateral quad = corners.getValue();
        assertEquals(50.0, quad.topLeft().getX(), 1e-6);
        assertEquals(70.0, quad.topLeft().getY(), 1e-6);
        assertEquals(950.0, quad.bottomRight().getX(), 1e-6);
        assertEquals(1330.0, quad.bottomRight().getY(), 1e-6);
    }

    @Test
    @DisplayName("Without a detection the full image is enhanced and adjustment is disabled")
    void testProcessWithoutDetection() throws Exception {
        List<String> issues = Collections.singletonList(ImageQualityAnalyzer.ISSUE_NO_DOCUMENT);
        when(detector.detect(ORIGINAL)).thenReturn(Optional.empty());
        when(analyzer.analyze(ORIGINAL, Optional.empty())).thenReturn(new QualityReport(0.55, 0.5, 0.6, issues));
        when(enhancer.enhance(ORIGINAL, settings.getReceiptProfile())).thenReturn(ENHANCED);

        ProcessedReceipt receipt = processor.processWithAnalysis(ORIGINAL, ReceiptImageProcessor.TYPE_CAMERA);

        assertSame(ENHANCED, receipt.image);
        assertFalse(receipt.result.canAdjustManually());
        assertFalse(receipt.result.getDetectedRectangle().isPresent());
        assertEquals(issues, receipt.result.getQualityIssues());
        assertEquals("Poor", receipt.result.qualityText());
        verify(corrector, never()).correct(any(), any());
    }

    @Test
    @DisplayName("A degenerate detection leaves the image uncropped")
    void testCropFallsBack() throws Exception {
        when(corrector.correct(any(), any())).thenThrow(
            new GeometryException(GeometryException.Reason.DEGENERATE_QUADRILATERAL, "flat"));

        assertSame(ORIGINAL, processor.cropToDocument(ORIGINAL, DETECTION));
    }

    @Test
    @DisplayName("Gallery images are cropped only when a document is found")
    void testGalleryImage() throws Exception {
        when(detector.detect(ORIGINAL)).thenReturn(Optional.empty());
        when(enhancer.enhance(ORIGINAL, settings.getReceiptProfile())).thenReturn(ENHANCED);

        assertSame(ENHANCED, processor.processGalleryImage(ORIGINAL));
        verifyNoInteractions(corrector);
    }

    @Test
    @DisplayName("OCR optimization uses the configured size limit")
    void testOptimizeForOcr() {
        when(enhancer.optimizeForOcr(ORIGINAL, settings.getMaxOcrDimension())).thenReturn(ENHANCED);
        assertSame(ENHANCED, processor.optimizeForOcr(ORIGINAL));
    }

    @ParameterizedTest
    @CsvSource({
        "0.95, Excellent, HIGH",
        "0.90, Excellent, HIGH",
        "0.80, Good, HIGH",
        "0.75, Good, MEDIUM",
        "0.60, Fair, MEDIUM",
        "0.59, Poor, LOW"
    })
    @DisplayName("Quality text and confidence level follow the confidence bands")
    void testBands(double confidence, String text, ImageProcessingResult.ConfidenceLevel level) {
        ImageProcessingResult result = new ImageProcessingResult(
            confidence, ReceiptImageProcessor.TYPE_GALLERY, null, null, false, false);
        assertEquals(text, result.qualityText());
        assertEquals(level, result.confidenceLevel());
    }
}
