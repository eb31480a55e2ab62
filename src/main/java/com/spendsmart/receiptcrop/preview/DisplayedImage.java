package com.spendsmart.receiptcrop.preview;

/**
 * Which variant of the receipt the preview is currently showing.
 */
public enum DisplayedImage {
    ORIGINAL,
    AUTO_PROCESSED,
    MANUALLY_ADJUSTED
}
