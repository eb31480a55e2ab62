package com.spendsmart.receiptcrop.model;

/**
 * Width/height pair in pixels. Used for display containers and image bounds.
 */
public final class Size2D {

    private final double width;
    private final double height;

    public Size2D(double width, double height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double aspectRatio() {
        return height == 0 ? 0 : width / height;
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Size2D)) return false;
        Size2D other = (Size2D) o;
        return Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(width) + Double.hashCode(height);
    }

    @Override
    public String toString() {
        return String.format("%.1fx%.1f", width, height);
    }
}
