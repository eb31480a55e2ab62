package com.spendsmart.receiptcrop.model;

import java.util.Optional;

/**
 * Result of a manual adjustment: either a corrected image or a cancellation.
 */
public final class CropOutcome {

    public enum Kind {
        APPLIED, CANCELLED
    }

    private static final CropOutcome CANCELLED = new CropOutcome(Kind.CANCELLED, null);

    private final Kind kind;
    private final ImageBuffer image;

    private CropOutcome(Kind kind, ImageBuffer image) {
        this.kind = kind;
        this.image = image;
    }

    public static CropOutcome applied(ImageBuffer image) {
        if (image == null) {
            throw new IllegalArgumentException("Applied outcome needs an image");
        }
        return new CropOutcome(Kind.APPLIED, image);
    }

    public static CropOutcome cancelled() {
        return CANCELLED;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isApplied() {
        return kind == Kind.APPLIED;
    }

    public Optional<ImageBuffer> getImage() {
        return Optional.ofNullable(image);
    }

    @Override
    public String toString() {
        return "CropOutcome[" + kind + (image != null ? " " + image : "") + "]";
    }
}
