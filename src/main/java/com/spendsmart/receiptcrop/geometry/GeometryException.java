package com.spendsmart.receiptcrop.geometry;

/**
 * A set of corners that cannot be turned into a perspective correction.
 */
public class GeometryException extends Exception {

    public enum Reason {
        /** Collinear, zero-area, self-intersecting or too small to solve. */
        DEGENERATE_QUADRILATERAL,
        /** A corner lies outside the image it is supposed to crop. */
        CORNER_OUT_OF_BOUNDS
    }

    private final Reason reason;

    public GeometryException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GeometryException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
