package com.spendsmart.receiptcrop.geometry;

import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces the starting corners for manual adjustment, either from a
 * detector result or as an inset rectangle.
 */
public class CornerSeeder {

    private final double inset;

    public CornerSeeder(double inset) {
        if (inset < 0 || inset >= 0.5) {
            throw new IllegalArgumentException("Inset must be in [0, 0.5), got " + inset);
        }
        this.inset = inset;
    }

    /**
     * Seed corners in display space (relative to the fitted image).
     *
     * @param detection        detector result, or null to use the inset rectangle
     * @param displaySize      container the image is fitted into
     * @param imageAspectRatio original image width / height
     */
    public Quadrilateral seed(DetectionResult detection, Size2D displaySize, double imageAspectRatio) {
        FitMapping mapping = AspectFit.fit(imageAspectRatio, displaySize);
        return seed(detection, mapping);
    }

    /**
     * Seed corners for an already computed fit.
     */
    public Quadrilateral seed(DetectionResult detection, FitMapping mapping) {
        Size2D fitted = mapping.getFitted();
        if (detection != null) {
            return fromDetection(detection, fitted);
        }
        return insetRectangle(fitted);
    }

    public Quadrilateral insetRectangle(Size2D area) {
        double w = area.getWidth();
        double h = area.getHeight();
        return Quadrilateral.of(
            new Point2D(w * inset, h * inset),
            new Point2D(w * (1 - inset), h * inset),
            new Point2D(w * (1 - inset), h * (1 - inset)),
            new Point2D(w * inset, h * (1 - inset))
        );
    }

    /**
     * Map normalized detector corners (origin bottom-left) into a top-left
     * origin pixel area, then label the corners by where they land.
     */
    public static Quadrilateral fromDetection(DetectionResult detection, Size2D area) {
        List<Point2D> mapped = new ArrayList<>(Quadrilateral.CORNER_COUNT);
        for (Point2D p : detection.cornersClockwise()) {
            mapped.add(new Point2D(p.getX() * area.getWidth(), (1 - p.getY()) * area.getHeight()));
        }
        return Quadrilateral.orderedByPosition(mapped);
    }
}
