package com.spendsmart.receiptcrop.preview;

/**
 * Lifecycle of a {@link ReceiptPreviewSession}. ACCEPTED and REJECTED are terminal.
 */
public enum PreviewState {
    INITIAL,
    PREVIEWING,
    ADJUSTING_MANUALLY,
    ACCEPTED,
    REJECTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == REJECTED;
    }
}
