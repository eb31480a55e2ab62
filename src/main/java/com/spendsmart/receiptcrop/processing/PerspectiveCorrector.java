package com.spendsmart.receiptcrop.processing;

import com.spendsmart.receiptcrop.config.CropSettings;
import com.spendsmart.receiptcrop.geometry.GeometryException;
import com.spendsmart.receiptcrop.geometry.QuadrilateralValidator;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;
import com.spendsmart.receiptcrop.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.Objects;

/**
 * Straightens a photographed document: maps four corners of the original
 * image onto an upright rectangle and resamples into a new buffer.
 *
 * Imgproc.getPerspectiveTransform(src, dst) + Imgproc.warpPerspective(..., INTER_LINEAR)
 */
public class PerspectiveCorrector {

    // Corners this far outside the image are still treated as on the edge
    private static final double BOUNDS_TOLERANCE = 0.5;

    private final QuadrilateralValidator validator;
    private final boolean strictBounds;

    public PerspectiveCorrector(CropSettings settings) {
        this.validator = new QuadrilateralValidator(settings.getMinQuadSide());
        this.strictBounds = settings.isStrictBounds();
    }

    public PerspectiveCorrector() {
        this(CropSettings.defaults());
    }

    /**
     * Warp the quadrilateral into an upright rectangle.
     *
     * @param image   original image (not modified)
     * @param corners corners in the original image's pixel space, [TL, TR, BR, BL]
     * @return a new buffer of size {@link #outputSize(Quadrilateral)}
     * @throws GeometryException if the corners cannot define a perspective transform,
     *                           or lie outside the image in strict mode
     */
    public ImageBuffer correct(ImageBuffer image, Quadrilateral corners) throws GeometryException {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(corners, "corners");

        Quadrilateral quad = checkBounds(corners, image.size());
        validator.validate(quad);

        Size2D output = outputSize(quad);
        int width = (int) output.getWidth();
        int height = (int) output.getHeight();

        Mat src = image.toMat();
        MatOfPoint2f srcPoints = new MatOfPoint2f(toCvPoints(quad));
        MatOfPoint2f dstPoints = new MatOfPoint2f(
            new Point(0, 0),
            new Point(width - 1, 0),
            new Point(width - 1, height - 1),
            new Point(0, height - 1)
        );
        Mat transform = null;
        Mat warped = new Mat();
        try {
            transform = Imgproc.getPerspectiveTransform(srcPoints, dstPoints);
            Imgproc.warpPerspective(src, warped, transform, new Size(width, height),
                Imgproc.INTER_LINEAR, Core.BORDER_REPLICATE);
            return ImageBuffer.fromMat(warped);
        } catch (CvException e) {
            throw new GeometryException(GeometryException.Reason.DEGENERATE_QUADRILATERAL,
                "Perspective transform failed for " + quad + ": " + e.getMessage(), e);
        } finally {
            MatUtils.release(src, srcPoints, dstPoints, transform, warped);
        }
    }

    /**
     * Size of the corrected image: the longer of each pair of opposite sides,
     * rounded to whole pixels and never below 1.
     */
    public static Size2D outputSize(Quadrilateral quad) {
        long width = Math.max(1, Math.round(quad.correctedWidth()));
        long height = Math.max(1, Math.round(quad.correctedHeight()));
        return new Size2D(width, height);
    }

    private Quadrilateral checkBounds(Quadrilateral corners, Size2D bounds) throws GeometryException {
        int outside = QuadrilateralValidator.firstOutOfBounds(corners, bounds, BOUNDS_TOLERANCE);
        if (outside < 0) {
            return corners;
        }
        String message = "Corner " + outside + " " + corners.get(outside) + " is outside image " + bounds;
        if (strictBounds) {
            throw new GeometryException(GeometryException.Reason.CORNER_OUT_OF_BOUNDS, message);
        }
        System.err.println("[PerspectiveCorrector] " + message + ", clamping");
        return corners.map(p -> p.clamp(bounds.getWidth(), bounds.getHeight()));
    }

    private static Point[] toCvPoints(Quadrilateral quad) {
        Point[] points = new Point[Quadrilateral.CORNER_COUNT];
        for (int i = 0; i < Quadrilateral.CORNER_COUNT; i++) {
            Point2D p = quad.get(i);
            points[i] = new Point(p.getX(), p.getY());
        }
        return points;
    }
}
