package com.spendsmart.receiptcrop.model;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.Arrays;

/**
 * Immutable 8-bit pixel raster in OpenCV channel order (BGR / BGRA / gray).
 *
 * The pixel array is copied on construction and on every read, so a buffer
 * can be shared by reference between the preview and the corrector without
 * either side mutating it. Conversions to and from {@link Mat} also copy.
 */
public final class ImageBuffer {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] pixels;

    public ImageBuffer(int width, int height, int channels, byte[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must have positive size, got " + width + "x" + height);
        }
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (pixels == null || pixels.length != width * height * channels) {
            throw new IllegalArgumentException("Pixel data length does not match " + width + "x" + height
                + "x" + channels);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.pixels = pixels.clone();
    }

    /**
     * Copy an 8-bit Mat into a new buffer. The Mat is not modified or released.
     */
    public static ImageBuffer fromMat(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Mat is null or empty");
        }
        if (mat.depth() != CvType.CV_8U) {
            throw new IllegalArgumentException("Only 8-bit images are supported, got depth " + mat.depth());
        }
        Mat source = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] data = new byte[(int) (source.total() * source.channels())];
            source.get(0, 0, data);
            return new ImageBuffer(source.cols(), source.rows(), source.channels(), data);
        } finally {
            if (source != mat) {
                source.release();
            }
        }
    }

    /**
     * New Mat holding a copy of the pixels. Caller must release it.
     */
    public Mat toMat() {
        Mat mat = new Mat(height, width, CvType.CV_8UC(channels));
        mat.put(0, 0, pixels);
        return mat;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    public Size2D size() {
        return new Size2D(width, height);
    }

    public double aspectRatio() {
        return (double) width / height;
    }

    /**
     * Copy of the raw pixel data, row-major, interleaved channels.
     */
    public byte[] getPixels() {
        return pixels.clone();
    }

    /**
     * Unsigned value of one channel at (x, y).
     */
    public int sample(int x, int y, int channel) {
        if (x < 0 || x >= width || y < 0 || y >= height || channel < 0 || channel >= channels) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + "," + channel + ") outside " + this);
        }
        return pixels[(y * width + x) * channels + channel] & 0xFF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageBuffer)) return false;
        ImageBuffer other = (ImageBuffer) o;
        return width == other.width && height == other.height && channels == other.channels
            && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        result = 31 * result + channels;
        return 31 * result + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "ImageBuffer[" + width + "x" + height + "x" + channels + "]";
    }
}
