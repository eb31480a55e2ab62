package com.spendsmart.receiptcrop.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuadrilateralTest {

    @Test
    @DisplayName("orderedByPosition labels shuffled corners TL, TR, BR, BL")
    void testOrderedByPosition() {
        List<Point2D> shuffled = Arrays.asList(
            new Point2D(270, 360), new Point2D(30, 40), new Point2D(30, 360), new Point2D(270, 40));

        Quadrilateral quad = Quadrilateral.orderedByPosition(shuffled);

        assertEquals(new Point2D(30, 40), quad.topLeft());
        assertEquals(new Point2D(270, 40), quad.topRight());
        assertEquals(new Point2D(270, 360), quad.bottomRight());
        assertEquals(new Point2D(30, 360), quad.bottomLeft());
    }

    @Test
    @DisplayName("orderedByPosition handles a rotated receipt")
    void testOrderedByPositionRotated() {
        // Rotated about 10 degrees clockwise
        List<Point2D> points = Arrays.asList(
            new Point2D(100, 50), new Point2D(400, 100), new Point2D(330, 500), new Point2D(30, 450));

        Quadrilateral quad = Quadrilateral.orderedByPosition(points);

        assertEquals(new Point2D(100, 50), quad.topLeft());
        assertEquals(new Point2D(400, 100), quad.topRight());
        assertEquals(new Point2D(330, 500), quad.bottomRight());
        assertEquals(new Point2D(30, 450), quad.bottomLeft());
    }

    @Test
    @DisplayName("Corrected size uses the longer of each pair of opposite sides")
    void testCorrectedSize() {
        Quadrilateral trapezoid = Quadrilateral.of(
            new Point2D(50, 0), new Point2D(250, 0), new Point2D(300, 400), new Point2D(0, 400));

        assertEquals(300.0, trapezoid.correctedWidth(), 1e-9);
        assertEquals(Math.hypot(50, 400), trapezoid.correctedHeight(), 1e-9);
    }

    @Test
    @DisplayName("Signed area is positive for clockwise screen order")
    void testSignedArea() {
        Quadrilateral rect = Quadrilateral.rectangle(10, 20, 100, 50);
        assertEquals(5000.0, rect.signedArea(), 1e-9);

        Quadrilateral reversed = Quadrilateral.of(rect.topLeft(), rect.bottomLeft(), rect.bottomRight(), rect.topRight());
        assertEquals(-5000.0, reversed.signedArea(), 1e-9);
    }

    @Test
    @DisplayName("withCorner returns a copy and leaves the original untouched")
    void testWithCornerIsImmutable() {
        Quadrilateral rect = Quadrilateral.rectangle(0, 0, 10, 10);
        Quadrilateral moved = rect.withCorner(Quadrilateral.TOP_LEFT, new Point2D(1, 1));

        assertEquals(new Point2D(0, 0), rect.topLeft());
        assertEquals(new Point2D(1, 1), moved.topLeft());
        assertEquals(rect.topRight(), moved.topRight());
    }

    @Test
    @DisplayName("Exactly four points are required")
    void testRejectsWrongPointCount() {
        List<Point2D> three = Arrays.asList(new Point2D(0, 0), new Point2D(1, 0), new Point2D(1, 1));
        assertThrows(IllegalArgumentException.class, () -> Quadrilateral.fromList(three));
        assertThrows(IllegalArgumentException.class, () -> Quadrilateral.orderedByPosition(three));
        assertThrows(IllegalArgumentException.class, () -> Quadrilateral.rectangle(0, 0, 1, 1).get(4));
    }

    @Test
    @DisplayName("toList cannot be modified")
    void testToListUnmodifiable() {
        List<Point2D> points = Quadrilateral.rectangle(0, 0, 1, 1).toList();
        assertEquals(4, points.size());
        assertThrows(UnsupportedOperationException.class, () -> points.set(0, new Point2D(5, 5)));
    }
}
