package com.spendsmart.receiptcrop.processing;

import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.ImageBuffer;

import java.util.Optional;

/**
 * Finds the receipt's outline in an image.
 */
public interface DocumentDetector {

    /**
     * @return the most likely document rectangle, or empty if nothing qualifies
     */
    Optional<DetectionResult> detect(ImageBuffer image);
}
