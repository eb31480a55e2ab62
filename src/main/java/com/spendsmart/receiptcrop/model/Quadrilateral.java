package com.spendsmart.receiptcrop.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Four corner points in closed-polygon order:
 * [topLeft, topRight, bottomRight, bottomLeft].
 *
 * Instances are immutable. Nothing here enforces convexity; a user can drag
 * corners into a bowtie and that shape is still representable. Validity for
 * a perspective transform is checked by the corrector.
 */
public final class Quadrilateral {

    public static final int TOP_LEFT = 0;
    public static final int TOP_RIGHT = 1;
    public static final int BOTTOM_RIGHT = 2;
    public static final int BOTTOM_LEFT = 3;
    public static final int CORNER_COUNT = 4;

    private final Point2D[] corners;

    private Quadrilateral(Point2D[] corners) {
        this.corners = corners;
    }

    public static Quadrilateral of(Point2D topLeft, Point2D topRight, Point2D bottomRight, Point2D bottomLeft) {
        return new Quadrilateral(new Point2D[] {
            Objects.requireNonNull(topLeft, "topLeft"),
            Objects.requireNonNull(topRight, "topRight"),
            Objects.requireNonNull(bottomRight, "bottomRight"),
            Objects.requireNonNull(bottomLeft, "bottomLeft")
        });
    }

    /**
     * Build from a list already in [TL, TR, BR, BL] order.
     *
     * @throws IllegalArgumentException if the list does not hold exactly 4 points
     */
    public static Quadrilateral fromList(List<Point2D> points) {
        if (points == null || points.size() != CORNER_COUNT) {
            throw new IllegalArgumentException("Quadrilateral needs exactly 4 points, got "
                + (points == null ? "null" : points.size()));
        }
        return of(points.get(0), points.get(1), points.get(2), points.get(3));
    }

    /**
     * Axis-aligned rectangle with its top-left corner at (x, y).
     */
    public static Quadrilateral rectangle(double x, double y, double width, double height) {
        return of(
            new Point2D(x, y),
            new Point2D(x + width, y),
            new Point2D(x + width, y + height),
            new Point2D(x, y + height)
        );
    }

    /**
     * Label four unordered points by where they sit on screen (y grows downward).
     * Points are sorted clockwise around their centroid and the list is rotated
     * so it starts at the point nearest the origin.
     */
    public static Quadrilateral orderedByPosition(List<Point2D> points) {
        if (points == null || points.size() != CORNER_COUNT) {
            throw new IllegalArgumentException("Quadrilateral needs exactly 4 points, got "
                + (points == null ? "null" : points.size()));
        }
        double cx = 0;
        double cy = 0;
        for (Point2D p : points) {
            cx += p.getX();
            cy += p.getY();
        }
        final double centerX = cx / CORNER_COUNT;
        final double centerY = cy / CORNER_COUNT;

        List<Point2D> sorted = new ArrayList<>(points);
        // atan2 with y down runs clockwise on screen: TL, TR, BR, BL
        sorted.sort(Comparator.comparingDouble(p -> Math.atan2(p.getY() - centerY, p.getX() - centerX)));

        int start = 0;
        double best = Double.MAX_VALUE;
        for (int i = 0; i < CORNER_COUNT; i++) {
            Point2D p = sorted.get(i);
            double sum = p.getX() + p.getY();
            if (sum < best) {
                best = sum;
                start = i;
            }
        }
        Collections.rotate(sorted, -start);
        return fromList(sorted);
    }

    public Point2D get(int index) {
        checkIndex(index);
        return corners[index];
    }

    public Point2D topLeft() {
        return corners[TOP_LEFT];
    }

    public Point2D topRight() {
        return corners[TOP_RIGHT];
    }

    public Point2D bottomRight() {
        return corners[BOTTOM_RIGHT];
    }

    public Point2D bottomLeft() {
        return corners[BOTTOM_LEFT];
    }

    /**
     * Copy with one corner replaced.
     */
    public Quadrilateral withCorner(int index, Point2D point) {
        checkIndex(index);
        Point2D[] copy = corners.clone();
        copy[index] = Objects.requireNonNull(point, "point");
        return new Quadrilateral(copy);
    }

    public Quadrilateral map(UnaryOperator<Point2D> mapper) {
        Point2D[] mapped = new Point2D[CORNER_COUNT];
        for (int i = 0; i < CORNER_COUNT; i++) {
            mapped[i] = Objects.requireNonNull(mapper.apply(corners[i]));
        }
        return new Quadrilateral(mapped);
    }

    public List<Point2D> toList() {
        return Collections.unmodifiableList(Arrays.asList(corners.clone()));
    }

    /**
     * Width of the upright rectangle this shape straightens into:
     * the longer of the top and bottom edges.
     */
    public double correctedWidth() {
        return Math.max(topLeft().distanceTo(topRight()), bottomLeft().distanceTo(bottomRight()));
    }

    /**
     * Height of the upright rectangle: the longer of the left and right edges.
     */
    public double correctedHeight() {
        return Math.max(topLeft().distanceTo(bottomLeft()), topRight().distanceTo(bottomRight()));
    }

    /**
     * Shoelace area. Positive when the corners run clockwise on screen.
     */
    public double signedArea() {
        double sum = 0;
        for (int i = 0; i < CORNER_COUNT; i++) {
            Point2D a = corners[i];
            Point2D b = corners[(i + 1) % CORNER_COUNT];
            sum += a.getX() * b.getY() - b.getX() * a.getY();
        }
        return sum / 2.0;
    }

    public double sideLength(int index) {
        checkIndex(index);
        return corners[index].distanceTo(corners[(index + 1) % CORNER_COUNT]);
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= CORNER_COUNT) {
            throw new IllegalArgumentException("Corner index must be in [0,3], got " + index);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quadrilateral)) return false;
        return Arrays.equals(corners, ((Quadrilateral) o).corners);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(corners);
    }

    @Override
    public String toString() {
        return "Quadrilateral" + Arrays.toString(corners);
    }
}
