package com.spendsmart.receiptcrop.processing;

import com.spendsmart.receiptcrop.geometry.GeometryException;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.Quadrilateral;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs perspective corrections off the UI thread, one at a time.
 *
 * Cancelling a returned future guarantees its result is never delivered,
 * even if the warp itself has already started.
 */
public class CorrectionWorker implements AutoCloseable {

    private final PerspectiveCorrector corrector;
    private final ExecutorService executor;

    public CorrectionWorker(PerspectiveCorrector corrector) {
        this.corrector = Objects.requireNonNull(corrector, "corrector");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "perspective-correction");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue a correction. The future fails with {@link GeometryException} for
     * degenerate corners.
     */
    public CompletableFuture<ImageBuffer> submit(ImageBuffer image, Quadrilateral corners) {
        CompletableFuture<ImageBuffer> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            if (result.isDone()) {
                return;  // cancelled while queued
            }
            long start = System.currentTimeMillis();
            try {
                ImageBuffer corrected = corrector.correct(image, corners);
                if (result.complete(corrected)) {
                    System.out.println("[CorrectionWorker] Corrected to " + corrected.getWidth() + "x"
                        + corrected.getHeight() + " in " + (System.currentTimeMillis() - start) + "ms");
                }
            } catch (GeometryException | RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                System.err.println("[CorrectionWorker] Worker did not stop within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
