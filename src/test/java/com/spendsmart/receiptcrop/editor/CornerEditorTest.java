package com.spendsmart.receiptcrop.editor;

import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CornerEditorTest {

    private static final Size2D BOUNDS = new Size2D(300, 420);
    private static final Quadrilateral SEED = Quadrilateral.rectangle(30, 42, 240, 336);

    @ParameterizedTest
    @CsvSource({
        // index, targetX, targetY, expectedX, expectedY
        "0, -10, -10, 0, 0",
        "1, 500, 20, 300, 20",
        "2, 310, 900, 300, 420",
        "3, -0.001, 200, 0, 200",
        "0, 150, -1e9, 150, 0",
        "2, 1e9, 1e9, 300, 420"
    })
    @DisplayName("Dragging outside the image clamps onto the boundary")
    void testDragClamps(int index, double tx, double ty, double ex, double ey) {
        CornerEditor editor = new CornerEditor(SEED);

        Point2D stored = editor.dragCorner(index, new Point2D(tx, ty), BOUNDS);

        assertEquals(new Point2D(ex, ey), stored);
        assertEquals(stored, editor.current().get(index));
        assertTrue(stored.getX() >= 0 && stored.getX() <= BOUNDS.getWidth());
        assertTrue(stored.getY() >= 0 && stored.getY() <= BOUNDS.getHeight());
    }

    @Test
    @DisplayName("A drag inside the image is stored unchanged")
    void testDragInside() {
        CornerEditor editor = new CornerEditor(SEED);
        Point2D target = new Point2D(12.5, 17.25);
        assertEquals(target, editor.dragCorner(Quadrilateral.TOP_LEFT, target, BOUNDS));
        assertEquals(SEED.topRight(), editor.current().topRight());
    }

    @Test
    @DisplayName("Reset restores exactly the seed after any drag history")
    void testResetIdempotent() {
        CornerEditor editor = new CornerEditor(SEED);
        editor.dragCorner(0, new Point2D(-5, 3), BOUNDS);
        editor.dragCorner(2, new Point2D(1000, 1000), BOUNDS);
        editor.dragCorner(1, new Point2D(3, 300), BOUNDS);

        editor.reset(SEED);

        assertEquals(SEED, editor.current());
        editor.reset(SEED);
        assertEquals(SEED, editor.current());
    }

    @Test
    @DisplayName("Drags on different corners commute")
    void testDifferentCornersCommute() {
        CornerEditor first = new CornerEditor(SEED);
        first.dragCorner(0, new Point2D(5, 5), BOUNDS);
        first.dragCorner(2, new Point2D(290, 400), BOUNDS);

        CornerEditor second = new CornerEditor(SEED);
        second.dragCorner(2, new Point2D(290, 400), BOUNDS);
        second.dragCorner(0, new Point2D(5, 5), BOUNDS);

        assertEquals(first.current(), second.current());
    }

    @Test
    @DisplayName("Every mutation notifies the change callback")
    void testChangeCallback() {
        CornerEditor editor = new CornerEditor(SEED);
        List<Quadrilateral> seen = new ArrayList<>();
        editor.setOnChanged(seen::add);

        editor.dragCorner(1, new Point2D(200, 50), BOUNDS);
        editor.reset(SEED);

        assertEquals(2, seen.size());
        assertEquals(new Point2D(200, 50), seen.get(0).topRight());
        assertEquals(SEED, seen.get(1));
    }

    @Test
    @DisplayName("Corner index outside 0..3 is rejected")
    void testInvalidIndex() {
        CornerEditor editor = new CornerEditor(SEED);
        assertThrows(IllegalArgumentException.class, () -> editor.dragCorner(4, new Point2D(1, 1), BOUNDS));
        assertThrows(IllegalArgumentException.class, () -> editor.dragCorner(-1, new Point2D(1, 1), BOUNDS));
        assertEquals(SEED, editor.current());
    }
}
