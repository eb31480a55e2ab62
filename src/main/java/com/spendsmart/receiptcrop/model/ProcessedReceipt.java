package com.spendsmart.receiptcrop.model;

import java.util.Objects;

/**
 * Auto-processed image paired with the analysis that produced it.
 */
public final class ProcessedReceipt {

    public final ImageBuffer image;
    public final ImageProcessingResult result;

    public ProcessedReceipt(ImageBuffer image, ImageProcessingResult result) {
        this.image = Objects.requireNonNull(image, "image");
        this.result = Objects.requireNonNull(result, "result");
    }
}
