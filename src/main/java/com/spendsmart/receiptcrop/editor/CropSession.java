package com.spendsmart.receiptcrop.editor;

import com.spendsmart.receiptcrop.geometry.AspectFit;
import com.spendsmart.receiptcrop.geometry.CornerSeeder;
import com.spendsmart.receiptcrop.geometry.FitMapping;
import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Transient state of one manual crop: the seeded corners, the edits made
 * since, and the mapping back to original-image pixels.
 *
 * Created when the adjustment surface appears and thrown away when it is
 * dismissed. While a correction is pending the session is locked and drags
 * are ignored, so the corners cannot change under a warp in flight.
 */
public class CropSession {

    private final Size2D imageSize;
    private final DetectionResult detection;
    private final CornerSeeder seeder;

    private FitMapping mapping;
    private Quadrilateral seed;
    private final CornerEditor editor;
    private boolean dirty;
    private boolean locked;

    public CropSession(Size2D imageSize, Size2D containerSize, DetectionResult detection, CornerSeeder seeder) {
        this.imageSize = Objects.requireNonNull(imageSize, "imageSize");
        this.detection = detection;
        this.seeder = Objects.requireNonNull(seeder, "seeder");
        this.mapping = AspectFit.fit(imageSize.aspectRatio(), containerSize);
        this.seed = seeder.seed(detection, mapping);
        this.editor = new CornerEditor(seed);
    }

    /**
     * Move a corner to a point given in display coordinates (relative to the fitted image).
     *
     * @return false if the session is locked and the drag was ignored
     */
    public boolean dragCorner(int index, Point2D displayPoint) {
        if (locked) {
            System.out.println("[CropSession] Ignoring drag of corner " + index + " while a correction is pending");
            return false;
        }
        editor.dragCorner(index, displayPoint, mapping.getFitted());
        dirty = true;
        return true;
    }

    /**
     * Move a corner to a point given in container coordinates (mouse position),
     * removing the centering offset first.
     */
    public boolean dragFromContainer(int index, Point2D containerPoint) {
        return dragCorner(index, mapping.containerToDisplay(containerPoint));
    }

    /**
     * Restore the seeded corners.
     */
    public void reset() {
        editor.reset(seed);
        dirty = false;
    }

    /**
     * Re-fit after the container changed size. Corners are rescaled
     * proportionally so edits survive a resize or rotation.
     */
    public void resize(Size2D containerSize) {
        FitMapping next = AspectFit.fit(imageSize.aspectRatio(), containerSize);
        Size2D oldFitted = mapping.getFitted();
        Size2D newFitted = next.getFitted();
        Quadrilateral nextSeed = seeder.seed(detection, next);
        Quadrilateral nextCorners;
        if (oldFitted.isEmpty()) {
            nextCorners = nextSeed;
        } else {
            double sx = newFitted.getWidth() / oldFitted.getWidth();
            double sy = newFitted.getHeight() / oldFitted.getHeight();
            nextCorners = editor.current().map(p -> p.scale(sx, sy));
        }
        this.mapping = next;
        this.seed = nextSeed;
        editor.reset(nextCorners);
    }

    /**
     * Corners in original-image pixel space, ready for the corrector.
     */
    public Quadrilateral toImageSpace() {
        return mapping.displayToImage(editor.current(), imageSize);
    }

    public Quadrilateral currentCorners() {
        return editor.current();
    }

    public Quadrilateral getSeed() {
        return seed;
    }

    public FitMapping getMapping() {
        return mapping;
    }

    public Size2D getImageSize() {
        return imageSize;
    }

    public boolean isDirty() {
        return dirty;
    }

    public boolean isLocked() {
        return locked;
    }

    /**
     * Lock while a correction is pending; unlock when it completes or is cancelled.
     */
    public void setLocked(boolean locked) {
        this.locked = locked;
    }

    public void setOnChanged(Consumer<Quadrilateral> callback) {
        editor.setOnChanged(callback);
    }
}
