package com.spendsmart.receiptcrop.geometry;

import com.spendsmart.receiptcrop.model.DetectionResult;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class CornerSeederTest {

    private final CornerSeeder seeder = new CornerSeeder(0.1);

    @ParameterizedTest
    @CsvSource({
        "300, 420, 0.7142857",
        "300, 400, 1.5",
        "1024, 768, 0.3",
        "1, 1, 1.0"
    })
    @DisplayName("Inset seeding is deterministic for identical inputs")
    void testSeedingDeterministic(double width, double height, double aspect) {
        Size2D display = new Size2D(width, height);
        assertEquals(seeder.seed(null, display, aspect), seeder.seed(null, display, aspect));
    }

    @Test
    @DisplayName("Without a detection the seed is the fitted image inset by 10%")
    void testInsetSeed() {
        Quadrilateral seed = seeder.seed(null, new Size2D(300, 400), 0.75);

        assertPoint(30, 40, seed.topLeft());
        assertPoint(270, 40, seed.topRight());
        assertPoint(270, 360, seed.bottomRight());
        assertPoint(30, 360, seed.bottomLeft());
    }

    @Test
    @DisplayName("Detection corners are flipped vertically and relabelled by position")
    void testDetectionFlip() {
        // Normalized, origin bottom-left
        DetectionResult detection = new DetectionResult(
            new Point2D(0.1, 0.1), new Point2D(0.9, 0.1),
            new Point2D(0.1, 0.9), new Point2D(0.9, 0.9), 0.9);

        Quadrilateral seed = seeder.seed(detection, new Size2D(300, 400), 0.75);

        assertPoint(30, 40, seed.topLeft());
        assertPoint(270, 40, seed.topRight());
        assertPoint(270, 360, seed.bottomRight());
        assertPoint(30, 360, seed.bottomLeft());
        assertTrue(seed.topLeft().getY() < seed.bottomLeft().getY());
    }

    @Test
    @DisplayName("An upright detection maps top to the small display y")
    void testUprightDetection() {
        DetectionResult detection = new DetectionResult(
            new Point2D(0.2, 0.9), new Point2D(0.8, 0.9),
            new Point2D(0.2, 0.1), new Point2D(0.8, 0.1), 0.95);

        Quadrilateral corners = CornerSeeder.fromDetection(detection, new Size2D(1000, 2000));

        assertEquals(200.0, corners.topLeft().getX(), 1e-9);
        assertEquals(200.0, corners.topLeft().getY(), 1e-9);
        assertEquals(800.0, corners.bottomRight().getX(), 1e-9);
        assertEquals(1800.0, corners.bottomRight().getY(), 1e-9);
    }

    @Test
    @DisplayName("Seeds live in the fitted image, not the container")
    void testSeedUsesFittedArea() {
        // 2:1 image in a square container is fitted to 400x200
        Quadrilateral seed = seeder.seed(null, new Size2D(400, 400), 2.0);
        assertPoint(40, 20, seed.topLeft());
        assertPoint(360, 180, seed.bottomRight());
    }

    @Test
    @DisplayName("Inset must be below one half")
    void testInvalidInset() {
        assertThrows(IllegalArgumentException.class, () -> new CornerSeeder(0.5));
        assertThrows(IllegalArgumentException.class, () -> new CornerSeeder(-0.1));
    }

    private static void assertPoint(double x, double y, Point2D actual) {
        assertEquals(x, actual.getX(), 1e-9, "x of " + actual);
        assertEquals(y, actual.getY(), 1e-9, "y of " + actual);
    }
}
