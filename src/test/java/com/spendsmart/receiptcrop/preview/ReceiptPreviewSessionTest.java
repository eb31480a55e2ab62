package com.spendsmart.receiptcrop.preview;

import com.spendsmart.receiptcrop.config.CropSettings;
import com.spendsmart.receiptcrop.editor.CropSession;
import com.spendsmart.receiptcrop.geometry.GeometryException;
import com.spendsmart.receiptcrop.model.CropOutcome;
import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.ImageProcessingResult;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.PreviewOutcome;
import com.spendsmart.receiptcrop.model.Size2D;
import com.spendsmart.receiptcrop.processing.CorrectionWorker;
import com.spendsmart.receiptcrop.processing.PerspectiveCorrector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReceiptPreviewSessionTest {

    private static final ImageBuffer ORIGINAL = image(100, 140, 10);
    private static final ImageBuffer PROCESSED = image(90, 126, 20);
    private static final ImageBuffer MANUAL = image(80, 110, 30);
    private static final DetectionResult DETECTION = new DetectionResult(
        new Point2D(0.05, 0.95), new Point2D(0.95, 0.95),
        new Point2D(0.05, 0.05), new Point2D(0.95, 0.05), 0.9);
    private static final Size2D CONTAINER = new Size2D(300, 420);

    @Mock
    private PerspectiveCorrector corrector;

    private ReceiptPreviewSession session;

    private static ImageBuffer image(int w, int h, int value) {
        byte[] pixels = new byte[w * h * 3];
        Arrays.fill(pixels, (byte) value);
        return new ImageBuffer(w, h, 3, pixels);
    }

    private static ImageProcessingResult result(boolean adjustable) {
        return new ImageProcessingResult(0.8, "Camera", adjustable ? DETECTION : null,
            Collections.emptyList(), adjustable, false);
    }

    @BeforeEach
    void setUp() {
        session = new ReceiptPreviewSession(ORIGINAL, PROCESSED, result(true), corrector, CropSettings.builder().build());
    }

    @Test
    @DisplayName("A new session starts in INITIAL showing the auto-processed image")
    void testInitialState() {
        assertEquals(PreviewState.INITIAL, session.getState());
        assertEquals(DisplayedImage.AUTO_PROCESSED, session.displayedImage());
        assertSame(PROCESSED, session.currentImage());
        assertFalse(session.outcome().isDone());
    }

    @Test
    @DisplayName("Accepting the preview delivers the auto-processed image")
    void testAcceptProcessed() {
        session.showPreview();
        session.accept();

        assertEquals(PreviewState.ACCEPTED, session.getState());
        PreviewOutcome outcome = session.outcome().join();
        assertTrue(outcome.isAccepted());
        assertSame(PROCESSED, outcome.getImage().orElseThrow());
    }

    @Test
    @DisplayName("Toggling to the original is what gets accepted")
    void testToggleOriginal() {
        session.showPreview();
        session.toggleUseOriginal();

        assertEquals(DisplayedImage.ORIGINAL, session.displayedImage());
        assertFalse(session.canAdjustManually());
        session.accept();
        assertSame(ORIGINAL, session.outcome().join().getImage().orElseThrow());
    }

    @Test
    @DisplayName("Rejecting delivers no image")
    void testReject() {
        session.showPreview();
        session.reject();

        assertEquals(PreviewState.REJECTED, session.getState());
        assertFalse(session.outcome().join().getImage().isPresent());
    }

    @Test
    @DisplayName("Skip Preview accepts the auto-processed image from INITIAL")
    void testSkipFromInitial() {
        session.skipPreview();
        assertSame(PROCESSED, session.outcome().join().getImage().orElseThrow());
    }

    @Test
    @DisplayName("Skip Preview ignores the original toggle")
    void testSkipFromPreviewing() {
        session.showPreview();
        session.toggleUseOriginal();
        session.skipPreview();
        assertSame(PROCESSED, session.outcome().join().getImage().orElseThrow());
    }

    @Test
    @DisplayName("Operations outside their state are rejected")
    void testInvalidTransitions() {
        assertThrows(IllegalStateException.class, session::accept);
        assertThrows(IllegalStateException.class, session::applyManualAdjustment);

        session.showPreview();
        session.reject();
        assertThrows(IllegalStateException.class, session::skipPreview);
        assertThrows(IllegalStateException.class, session::showPreview);
        assertThrows(IllegalStateException.class, session::accept);
    }

    @Test
    @DisplayName("Manual adjustment needs a detected rectangle")
    void testAdjustRequiresDetection() {
        ReceiptPreviewSession noDetection = new ReceiptPreviewSession(
            ORIGINAL, PROCESSED, result(false), corrector, CropSettings.builder().build());
        noDetection.showPreview();

        assertFalse(noDetection.canAdjustManually());
        assertThrows(IllegalStateException.class, () -> noDetection.beginManualAdjustment(CONTAINER));
    }

    @Test
    @DisplayName("Manual adjustment is unavailable while the original is shown")
    void testAdjustBlockedOnOriginal() {
        session.showPreview();
        session.toggleUseOriginal();
        assertThrows(IllegalStateException.class, () -> session.beginManualAdjustment(CONTAINER));
    }

    @Test
    @DisplayName("Applying a manual crop shows and accepts the corrected image")
    void testApplyManual() throws Exception {
        when(corrector.correct(eq(ORIGINAL), any())).thenReturn(MANUAL);
        session.showPreview();
        CropSession crop = session.beginManualAdjustment(CONTAINER);
        assertEquals(PreviewState.ADJUSTING_MANUALLY, session.getState());
        crop.dragCorner(0, new Point2D(-10, -10));

        CropOutcome outcome = session.applyManualAdjustment();

        assertTrue(outcome.isApplied());
        assertEquals(PreviewState.PREVIEWING, session.getState());
        assertEquals(DisplayedImage.MANUALLY_ADJUSTED, session.displayedImage());
        session.accept();
        assertSame(MANUAL, session.outcome().join().getImage().orElseThrow());
    }

    @Test
    @DisplayName("Toggling after a manual crop discards it")
    void testToggleClearsManual() throws Exception {
        when(corrector.correct(eq(ORIGINAL), any())).thenReturn(MANUAL);
        session.showPreview();
        session.beginManualAdjustment(CONTAINER);
        session.applyManualAdjustment();

        session.toggleUseOriginal();
        session.toggleUseOriginal();

        assertEquals(DisplayedImage.AUTO_PROCESSED, session.displayedImage());
    }

    @Test
    @DisplayName("A degenerate crop keeps the adjustment open with a prompt")
    void testApplyDegenerate() throws Exception {
        when(corrector.correct(any(), any())).thenThrow(
            new GeometryException(GeometryException.Reason.DEGENERATE_QUADRILATERAL, "flat"));
        session.showPreview();
        session.beginManualAdjustment(CONTAINER);

        CropOutcome outcome = session.applyManualAdjustment();

        assertFalse(outcome.isApplied());
        assertEquals(PreviewState.ADJUSTING_MANUALLY, session.getState());
        assertEquals(ReceiptPreviewSession.PROMPT_RETRY, session.getPrompt().orElseThrow());
        assertTrue(session.getCropSession().isPresent());
    }

    @Test
    @DisplayName("Cancelling manual adjustment returns to the preview unchanged")
    void testCancelManual() {
        session.showPreview();
        session.beginManualAdjustment(CONTAINER);

        assertFalse(session.cancelManualAdjustment().isApplied());

        assertEquals(PreviewState.PREVIEWING, session.getState());
        assertEquals(DisplayedImage.AUTO_PROCESSED, session.displayedImage());
        assertFalse(session.getCropSession().isPresent());
        verifyNoInteractions(corrector);
    }

    @Test
    @DisplayName("Asynchronous apply locks the crop session until it completes")
    void testApplyAsync() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(corrector.correct(eq(ORIGINAL), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return MANUAL;
        });
        session.showPreview();
        CropSession crop = session.beginManualAdjustment(CONTAINER);

        try (CorrectionWorker worker = new CorrectionWorker(corrector)) {
            CompletableFuture<CropOutcome> future = session.applyManualAdjustmentAsync(worker);
            assertTrue(crop.isLocked());
            assertFalse(crop.dragCorner(1, new Point2D(5, 5)));
            release.countDown();

            assertTrue(future.get(5, TimeUnit.SECONDS).isApplied());
        }
        assertFalse(crop.isLocked());
        assertEquals(PreviewState.PREVIEWING, session.getState());
        assertSame(MANUAL, session.currentImage());
    }

    @Test
    @DisplayName("A correction finishing after cancel is dropped")
    void testCancelDuringAsync() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(corrector.correct(eq(ORIGINAL), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return MANUAL;
        });
        session.showPreview();
        session.beginManualAdjustment(CONTAINER);

        try (CorrectionWorker worker = new CorrectionWorker(corrector)) {
            CompletableFuture<CropOutcome> future = session.applyManualAdjustmentAsync(worker);
            assertTrue(started.await(5, TimeUnit.SECONDS));
            session.cancelManualAdjustment();
            release.countDown();

            assertFalse(future.get(5, TimeUnit.SECONDS).isApplied());
        }
        assertEquals(PreviewState.PREVIEWING, session.getState());
        assertEquals(DisplayedImage.AUTO_PROCESSED, session.displayedImage());
        assertFalse(session.isCorrectionPending());
    }
}
