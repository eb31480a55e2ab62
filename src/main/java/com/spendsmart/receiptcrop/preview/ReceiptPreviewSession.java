package com.spendsmart.receiptcrop.preview;

import com.spendsmart.receiptcrop.config.CropSettings;
import com.spendsmart.receiptcrop.editor.CropSession;
import com.spendsmart.receiptcrop.geometry.CornerSeeder;
import com.spendsmart.receiptcrop.geometry.GeometryException;
import com.spendsmart.receiptcrop.model.CropOutcome;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.ImageProcessingResult;
import com.spendsmart.receiptcrop.model.PreviewOutcome;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;
import com.spendsmart.receiptcrop.processing.CorrectionWorker;
import com.spendsmart.receiptcrop.processing.PerspectiveCorrector;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Decides what happens to one captured receipt: keep the auto-processed
 * image, fall back to the original, adjust the crop by hand, or discard it.
 *
 * The final decision is delivered exactly once through {@link #outcome()}.
 * Methods are synchronized because asynchronous corrections complete on the
 * worker thread.
 */
public class ReceiptPreviewSession {

    public static final String PROMPT_RETRY = "Adjust the corners and try again";

    private final ImageBuffer original;
    private final ImageBuffer processed;
    private final ImageProcessingResult result;
    private final PerspectiveCorrector corrector;
    private final CornerSeeder seeder;
    private final CompletableFuture<PreviewOutcome> outcome = new CompletableFuture<>();

    private PreviewState state = PreviewState.INITIAL;
    private boolean useOriginal;
    private ImageBuffer manuallyAdjusted;
    private CropSession cropSession;
    private CompletableFuture<ImageBuffer> pending;
    // Bumped whenever a pending correction becomes stale
    private long generation;
    private String prompt;

    public ReceiptPreviewSession(ImageBuffer original, ImageBuffer processed, ImageProcessingResult result,
                                 PerspectiveCorrector corrector, CropSettings settings) {
        this.original = Objects.requireNonNull(original, "original");
        this.processed = Objects.requireNonNull(processed, "processed");
        this.result = Objects.requireNonNull(result, "result");
        this.corrector = Objects.requireNonNull(corrector, "corrector");
        this.seeder = new CornerSeeder(settings.getDefaultInset());
    }

    public synchronized void showPreview() {
        requireState(PreviewState.INITIAL, "showPreview");
        state = PreviewState.PREVIEWING;
        System.out.println("[ReceiptPreview] Showing preview: " + result);
    }

    /**
     * Switch between the original and the auto-processed image. Any manual
     * adjustment is discarded.
     */
    public synchronized void toggleUseOriginal() {
        requireState(PreviewState.PREVIEWING, "toggleUseOriginal");
        useOriginal = !useOriginal;
        manuallyAdjusted = null;
        System.out.println("[ReceiptPreview] Using " + (useOriginal ? "original" : "auto-processed") + " image");
    }

    public synchronized DisplayedImage displayedImage() {
        if (manuallyAdjusted != null) {
            return DisplayedImage.MANUALLY_ADJUSTED;
        }
        return useOriginal ? DisplayedImage.ORIGINAL : DisplayedImage.AUTO_PROCESSED;
    }

    public synchronized ImageBuffer currentImage() {
        switch (displayedImage()) {
            case MANUALLY_ADJUSTED:
                return manuallyAdjusted;
            case ORIGINAL:
                return original;
            default:
                return processed;
        }
    }

    /**
     * Manual adjustment needs a detected rectangle and works on the original
     * pixels, so it is unavailable while the original is selected.
     */
    public synchronized boolean canAdjustManually() {
        return result.canAdjustManually() && !useOriginal;
    }

    /**
     * Open a crop session for a surface of the given size, seeded from the
     * detected rectangle or the default inset.
     */
    public synchronized CropSession beginManualAdjustment(Size2D containerSize) {
        requireState(PreviewState.PREVIEWING, "beginManualAdjustment");
        if (!canAdjustManually()) {
            throw new IllegalStateException("Manual adjustment is not available for this image");
        }
        cropSession = new CropSession(original.size(), containerSize,
            result.getDetectedRectangle().orElse(null), seeder);
        prompt = null;
        state = PreviewState.ADJUSTING_MANUALLY;
        System.out.println("[ReceiptPreview] Manual adjustment started, seed " + cropSession.getSeed());
        return cropSession;
    }

    /**
     * Correct the original with the session's corners on the calling thread.
     * A degenerate quadrilateral keeps the session open and sets {@link #getPrompt()}.
     */
    public synchronized CropOutcome applyManualAdjustment() {
        requireState(PreviewState.ADJUSTING_MANUALLY, "applyManualAdjustment");
        Quadrilateral corners = cropSession.toImageSpace();
        try {
            ImageBuffer corrected = corrector.correct(original, corners);
            finishAdjustment(corrected);
            return CropOutcome.applied(corrected);
        } catch (GeometryException e) {
            rejectCorners(e);
            return CropOutcome.cancelled();
        }
    }

    /**
     * Same as {@link #applyManualAdjustment()} but on the worker. The crop
     * session is locked until the correction completes; a result that arrives
     * after cancel is dropped.
     */
    public synchronized CompletableFuture<CropOutcome> applyManualAdjustmentAsync(CorrectionWorker worker) {
        requireState(PreviewState.ADJUSTING_MANUALLY, "applyManualAdjustmentAsync");
        if (pending != null) {
            throw new IllegalStateException("A correction is already pending");
        }
        Quadrilateral corners = cropSession.toImageSpace();
        long ticket = ++generation;
        cropSession.setLocked(true);
        prompt = null;
        pending = worker.submit(original, corners);
        return pending.handle((corrected, error) -> completeAsync(ticket, corrected, error));
    }

    private synchronized CropOutcome completeAsync(long ticket, ImageBuffer corrected, Throwable error) {
        if (ticket != generation || state != PreviewState.ADJUSTING_MANUALLY) {
            System.out.println("[ReceiptPreview] Dropping stale correction result");
            return CropOutcome.cancelled();
        }
        pending = null;
        cropSession.setLocked(false);
        if (error == null) {
            finishAdjustment(corrected);
            return CropOutcome.applied(corrected);
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof GeometryException) {
            rejectCorners((GeometryException) cause);
            return CropOutcome.cancelled();
        }
        System.err.println("[ReceiptPreview] Correction failed: " + cause);
        prompt = PROMPT_RETRY;
        throw new CompletionException(cause);
    }

    /**
     * Leave manual adjustment without changing the displayed image.
     */
    public synchronized CropOutcome cancelManualAdjustment() {
        requireState(PreviewState.ADJUSTING_MANUALLY, "cancelManualAdjustment");
        generation++;
        if (pending != null) {
            pending.cancel(true);
            pending = null;
        }
        cropSession = null;
        prompt = null;
        state = PreviewState.PREVIEWING;
        System.out.println("[ReceiptPreview] Manual adjustment cancelled");
        return CropOutcome.cancelled();
    }

    public synchronized void accept() {
        requireState(PreviewState.PREVIEWING, "accept");
        ImageBuffer image = currentImage();
        state = PreviewState.ACCEPTED;
        System.out.println("[ReceiptPreview] Accepted " + displayedImage() + " image " + image);
        outcome.complete(PreviewOutcome.accepted(image));
    }

    public synchronized void reject() {
        requireState(PreviewState.PREVIEWING, "reject");
        state = PreviewState.REJECTED;
        System.out.println("[ReceiptPreview] Rejected");
        outcome.complete(PreviewOutcome.rejected());
    }

    /**
     * Accept the auto-processed image without reviewing it.
     */
    public synchronized void skipPreview() {
        if (state != PreviewState.INITIAL && state != PreviewState.PREVIEWING) {
            throw new IllegalStateException("skipPreview not allowed in state " + state);
        }
        state = PreviewState.ACCEPTED;
        System.out.println("[ReceiptPreview] Preview skipped");
        outcome.complete(PreviewOutcome.accepted(processed));
    }

    public CompletableFuture<PreviewOutcome> outcome() {
        return outcome;
    }

    public synchronized PreviewState getState() {
        return state;
    }

    public synchronized Optional<String> getPrompt() {
        return Optional.ofNullable(prompt);
    }

    public synchronized Optional<CropSession> getCropSession() {
        return Optional.ofNullable(cropSession);
    }

    public synchronized boolean isCorrectionPending() {
        return pending != null;
    }

    public ImageProcessingResult getResult() {
        return result;
    }

    private void finishAdjustment(ImageBuffer corrected) {
        manuallyAdjusted = corrected;
        cropSession = null;
        prompt = null;
        state = PreviewState.PREVIEWING;
        System.out.println("[ReceiptPreview] Manual adjustment applied: " + corrected);
    }

    private void rejectCorners(GeometryException e) {
        System.err.println("[ReceiptPreview] Cannot apply crop (" + e.getReason() + "): " + e.getMessage());
        prompt = PROMPT_RETRY;
    }

    private void requireState(PreviewState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException(operation + " not allowed in state " + state);
        }
    }
}
