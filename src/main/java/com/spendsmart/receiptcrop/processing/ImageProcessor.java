package com.spendsmart.receiptcrop.processing;

import org.opencv.core.Mat;

/**
 * Interface for pure OpenCV image processing operations.
 * No UI dependencies - just takes a Mat and returns a processed Mat.
 */
@FunctionalInterface
public interface ImageProcessor {
    /**
     * Process an input image and return the result.
     *
     * @param input The input image (caller owns this Mat)
     * @return A new Mat with the processed image (caller must release when done)
     */
    Mat process(Mat input);

    /**
     * Chain another step after this one. The intermediate Mat is released
     * once the next step has produced its output.
     */
    default ImageProcessor andThen(ImageProcessor next) {
        return input -> {
            Mat intermediate = process(input);
            try {
                return next.process(intermediate);
            } finally {
                if (intermediate != input) {
                    intermediate.release();
                }
            }
        };
    }
}
