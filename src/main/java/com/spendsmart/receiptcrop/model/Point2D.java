package com.spendsmart.receiptcrop.model;

/**
 * Immutable pixel coordinate. Equality is by value.
 */
public final class Point2D {

    private final double x;
    private final double y;

    public Point2D(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double distanceTo(Point2D other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public Point2D translate(double dx, double dy) {
        return new Point2D(x + dx, y + dy);
    }

    public Point2D scale(double sx, double sy) {
        return new Point2D(x * sx, y * sy);
    }

    /**
     * Clamp into [0, maxX] x [0, maxY].
     */
    public Point2D clamp(double maxX, double maxY) {
        double cx = Math.max(0, Math.min(maxX, x));
        double cy = Math.max(0, Math.min(maxY, y));
        if (cx == x && cy == y) {
            return this;
        }
        return new Point2D(cx, cy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point2D)) return false;
        Point2D other = (Point2D) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
