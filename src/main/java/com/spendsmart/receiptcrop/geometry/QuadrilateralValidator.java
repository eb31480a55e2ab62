package com.spendsmart.receiptcrop.geometry;

import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;

/**
 * Checks that four corners can be solved into a homography.
 *
 * A quadrilateral is accepted only if it is strictly convex: every turn
 * along the outline has the same, non-zero orientation. That rules out
 * collinear and coincident corners, zero area, concave shapes (whose
 * transform folds the image) and bowties.
 */
public class QuadrilateralValidator {

    // Tolerance for a turn to count as non-zero, relative to the squared side scale
    private static final double TURN_EPSILON = 1e-9;

    private final double minSide;

    public QuadrilateralValidator(double minSide) {
        this.minSide = minSide;
    }

    public void validate(Quadrilateral quad) throws GeometryException {
        for (int i = 0; i < Quadrilateral.CORNER_COUNT; i++) {
            double side = quad.sideLength(i);
            if (!(side >= minSide)) {
                throw new GeometryException(GeometryException.Reason.DEGENERATE_QUADRILATERAL,
                    String.format("Side %d is %.2f px, shorter than %.2f px: %s", i, side, minSide, quad));
            }
        }

        double scale = Math.max(quad.correctedWidth(), quad.correctedHeight());
        double epsilon = TURN_EPSILON * scale * scale;

        int sign = 0;
        for (int i = 0; i < Quadrilateral.CORNER_COUNT; i++) {
            double turn = turn(quad.get(i),
                quad.get((i + 1) % Quadrilateral.CORNER_COUNT),
                quad.get((i + 2) % Quadrilateral.CORNER_COUNT));
            if (Math.abs(turn) <= epsilon) {
                throw new GeometryException(GeometryException.Reason.DEGENERATE_QUADRILATERAL,
                    "Collinear corners around index " + ((i + 1) % Quadrilateral.CORNER_COUNT) + ": " + quad);
            }
            int s = turn > 0 ? 1 : -1;
            if (sign == 0) {
                sign = s;
            } else if (s != sign) {
                throw new GeometryException(GeometryException.Reason.DEGENERATE_QUADRILATERAL,
                    "Corners are not convex (crossed or folded): " + quad);
            }
        }
    }

    public boolean isValid(Quadrilateral quad) {
        try {
            validate(quad);
            return true;
        } catch (GeometryException e) {
            return false;
        }
    }

    /**
     * Index of the first corner outside [0,w] x [0,h] by more than the
     * tolerance, or -1 if all corners are inside.
     */
    public static int firstOutOfBounds(Quadrilateral quad, Size2D bounds, double tolerance) {
        for (int i = 0; i < Quadrilateral.CORNER_COUNT; i++) {
            Point2D p = quad.get(i);
            if (p.getX() < -tolerance || p.getY() < -tolerance
                || p.getX() > bounds.getWidth() + tolerance || p.getY() > bounds.getHeight() + tolerance) {
                return i;
            }
        }
        return -1;
    }

    // z component of (b - a) x (c - b)
    private static double turn(Point2D a, Point2D b, Point2D c) {
        double abx = b.getX() - a.getX();
        double aby = b.getY() - a.getY();
        double bcx = c.getX() - b.getX();
        double bcy = c.getY() - b.getY();
        return abx * bcy - aby * bcx;
    }
}
