package com.spendsmart.receiptcrop.editor;

import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Holds the four draggable corners in display coordinates.
 *
 * Single writer: only drag and reset mutate the state, renderers read it
 * through {@link #current()} or the change callback. Corners are clamped to
 * the displayed image but their order and convexity are left to the user.
 */
public class CornerEditor {

    private Quadrilateral corners;
    private Consumer<Quadrilateral> onChanged;

    public CornerEditor(Quadrilateral initial) {
        this.corners = Objects.requireNonNull(initial, "initial");
    }

    public Quadrilateral current() {
        return corners;
    }

    /**
     * Move one corner, clamping the target into [0,w] x [0,h] of the bounds.
     *
     * @return the point actually stored
     * @throws IllegalArgumentException if index is outside [0,3]
     */
    public Point2D dragCorner(int index, Point2D target, Size2D bounds) {
        if (index < 0 || index >= Quadrilateral.CORNER_COUNT) {
            throw new IllegalArgumentException("Corner index must be in [0,3], got " + index);
        }
        Objects.requireNonNull(target, "target");
        Point2D clamped = target.clamp(bounds.getWidth(), bounds.getHeight());
        corners = corners.withCorner(index, clamped);
        fireChanged();
        return clamped;
    }

    /**
     * Discard all edits and restore the given seed.
     */
    public void reset(Quadrilateral seed) {
        corners = Objects.requireNonNull(seed, "seed");
        fireChanged();
    }

    /**
     * Set the callback invoked after every mutation (typically a redraw).
     */
    public void setOnChanged(Consumer<Quadrilateral> callback) {
        this.onChanged = callback;
    }

    private void fireChanged() {
        if (onChanged != null) {
            onChanged.accept(corners);
        }
    }
}
