package com.spendsmart.receiptcrop.geometry;

import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;

/**
 * Where an aspect-fitted image sits inside its container.
 *
 * Display coordinates are relative to the fitted image's top-left corner;
 * container coordinates additionally include the centering offset.
 */
public final class FitMapping {

    private final Size2D container;
    private final Size2D fitted;
    private final double offsetX;
    private final double offsetY;

    FitMapping(Size2D container, Size2D fitted, double offsetX, double offsetY) {
        this.container = container;
        this.fitted = fitted;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
    }

    public Size2D getContainer() {
        return container;
    }

    /** Size of the image as drawn, which is also the clamp bounds for corners. */
    public Size2D getFitted() {
        return fitted;
    }

    public double getOffsetX() {
        return offsetX;
    }

    public double getOffsetY() {
        return offsetY;
    }

    public Point2D containerToDisplay(Point2D containerPoint) {
        return containerPoint.translate(-offsetX, -offsetY);
    }

    public Point2D displayToContainer(Point2D displayPoint) {
        return displayPoint.translate(offsetX, offsetY);
    }

    /**
     * Scale a display-space point into the pixel space of an image of the given size.
     */
    public Point2D displayToImage(Point2D displayPoint, Size2D imageSize) {
        if (fitted.isEmpty()) {
            throw new IllegalStateException("Cannot map from an empty display area");
        }
        return displayPoint.scale(imageSize.getWidth() / fitted.getWidth(),
            imageSize.getHeight() / fitted.getHeight());
    }

    public Quadrilateral displayToImage(Quadrilateral display, Size2D imageSize) {
        return display.map(p -> displayToImage(p, imageSize));
    }

    @Override
    public String toString() {
        return String.format("FitMapping[container=%s fitted=%s offset=(%.1f, %.1f)]",
            container, fitted, offsetX, offsetY);
    }
}
