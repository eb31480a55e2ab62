package com.spendsmart.receiptcrop.fx;

import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.util.MatUtils;
import javafx.scene.image.Image;
import javafx.scene.image.PixelFormat;
import javafx.scene.image.PixelWriter;
import javafx.scene.image.WritableImage;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Converts image buffers into JavaFX images using a PixelWriter directly
 * (no AWT/Swing dependency).
 */
public final class FXImageUtils {

    private FXImageUtils() {
    }

    /**
     * @return a JavaFX image, or null if the buffer has an unsupported channel count
     */
    public static Image toFxImage(ImageBuffer buffer) {
        if (buffer == null) {
            return null;
        }
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        WritableImage image = new WritableImage(width, height);
        PixelWriter pw = image.getPixelWriter();

        if (buffer.getChannels() == 4) {
            // BGRA matches JavaFX's byte layout as-is
            pw.setPixels(0, 0, width, height, PixelFormat.getByteBgraInstance(),
                buffer.getPixels(), 0, width * 4);
            return image;
        }

        Mat src = buffer.toMat();
        Mat rgb = new Mat();
        try {
            if (buffer.getChannels() == 3) {
                Imgproc.cvtColor(src, rgb, Imgproc.COLOR_BGR2RGB);
            } else if (buffer.getChannels() == 1) {
                Imgproc.cvtColor(src, rgb, Imgproc.COLOR_GRAY2RGB);
            } else {
                System.err.println("[FXImageUtils] Unsupported channel count: " + buffer.getChannels());
                return null;
            }
            byte[] pixels = new byte[width * height * 3];
            rgb.get(0, 0, pixels);
            pw.setPixels(0, 0, width, height, PixelFormat.getByteRgbInstance(), pixels, 0, width * 3);
            return image;
        } finally {
            MatUtils.release(src, rgb);
        }
    }
}
