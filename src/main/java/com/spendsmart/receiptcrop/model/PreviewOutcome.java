package com.spendsmart.receiptcrop.model;

import java.util.Optional;

/**
 * Terminal result of a preview session. Accepted outcomes always carry an
 * image; rejected ones never do.
 */
public final class PreviewOutcome {

    public enum Kind {
        ACCEPTED, REJECTED
    }

    private static final PreviewOutcome REJECTED = new PreviewOutcome(Kind.REJECTED, null);

    private final Kind kind;
    private final ImageBuffer image;

    private PreviewOutcome(Kind kind, ImageBuffer image) {
        this.kind = kind;
        this.image = image;
    }

    public static PreviewOutcome accepted(ImageBuffer image) {
        if (image == null) {
            throw new IllegalArgumentException("Accepted outcome needs an image");
        }
        return new PreviewOutcome(Kind.ACCEPTED, image);
    }

    public static PreviewOutcome rejected() {
        return REJECTED;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isAccepted() {
        return kind == Kind.ACCEPTED;
    }

    public Optional<ImageBuffer> getImage() {
        return Optional.ofNullable(image);
    }

    @Override
    public String toString() {
        return "PreviewOutcome[" + kind + (image != null ? " " + image : "") + "]";
    }
}
