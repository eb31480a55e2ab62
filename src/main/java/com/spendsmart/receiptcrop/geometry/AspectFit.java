package com.spendsmart.receiptcrop.geometry;

import com.spendsmart.receiptcrop.model.Size2D;

/**
 * Letterbox / pillarbox fitting of an image into a container.
 */
public final class AspectFit {

    private AspectFit() {
    }

    /**
     * Scale an image of the given aspect ratio (width / height) to the largest
     * size that fits the container, centered on the free axis.
     */
    public static FitMapping fit(double imageAspectRatio, Size2D container) {
        if (!(imageAspectRatio > 0) || Double.isInfinite(imageAspectRatio)) {
            throw new IllegalArgumentException("Image aspect ratio must be positive, got " + imageAspectRatio);
        }
        if (container.isEmpty()) {
            return new FitMapping(container, new Size2D(0, 0), 0, 0);
        }

        double fittedWidth;
        double fittedHeight;
        if (imageAspectRatio > container.aspectRatio()) {
            // Wider than the container: full width, bars above and below
            fittedWidth = container.getWidth();
            fittedHeight = container.getWidth() / imageAspectRatio;
        } else {
            // Taller: full height, bars left and right
            fittedHeight = container.getHeight();
            fittedWidth = container.getHeight() * imageAspectRatio;
        }

        double offsetX = (container.getWidth() - fittedWidth) / 2.0;
        double offsetY = (container.getHeight() - fittedHeight) / 2.0;
        return new FitMapping(container, new Size2D(fittedWidth, fittedHeight), offsetX, offsetY);
    }
}
