package com.spendsmart.receiptcrop.processing;

import com.spendsmart.receiptcrop.config.EnhancementProfile;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Tone, contrast and sharpness adjustments that make printed text easier
 * to read. Every step is an {@link ImageProcessor}; the chain releases its
 * intermediates.
 */
public class ReceiptEnhancer {

    // Contrast for the final OCR pass, pivoting around mid-grey
    private static final double OCR_CONTRAST = 1.3;
    private static final double OCR_SHARPNESS = 0.6;

    /**
     * Apply exposure, brightness, contrast, sharpening and light denoising.
     * Size and channel count are preserved.
     */
    public ImageBuffer enhance(ImageBuffer image, EnhancementProfile profile) {
        ImageProcessor chain = exposure(profile.getExposure())
            .andThen(brightness(profile.getBrightness()))
            .andThen(contrast(profile.getContrast()))
            .andThen(sharpen(profile.getSharpness()))
            .andThen(denoise(profile.getNoiseReduction()));
        return run(image, chain);
    }

    /**
     * Prepare an image for text recognition: shrink to the size limit,
     * sharpen, raise contrast and drop color. Color inputs stay 3-channel.
     */
    public ImageBuffer optimizeForOcr(ImageBuffer image, int maxDimension) {
        ImageBuffer resized = resizeToFit(image, maxDimension);
        ImageProcessor chain = sharpen(OCR_SHARPNESS)
            .andThen(contrast(OCR_CONTRAST))
            .andThen(desaturate());
        return run(resized, chain);
    }

    /**
     * Downscale so the longest side is at most maxDimension. Never upscales;
     * returns the same instance when no resize is needed.
     */
    public ImageBuffer resizeToFit(ImageBuffer image, int maxDimension) {
        double scale = Math.min((double) maxDimension / image.getWidth(), (double) maxDimension / image.getHeight());
        if (scale >= 1.0) {
            return image;
        }
        int width = Math.max(1, (int) Math.round(image.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(image.getHeight() * scale));

        Mat src = image.toMat();
        Mat scaled = new Mat();
        try {
            // INTER_AREA for better quality when shrinking
            Imgproc.resize(src, scaled, new Size(width, height), 0, 0, Imgproc.INTER_AREA);
            System.out.println("[ReceiptEnhancer] Resized " + image.getWidth() + "x" + image.getHeight()
                + " -> " + width + "x" + height);
            return ImageBuffer.fromMat(scaled);
        } finally {
            MatUtils.release(src, scaled);
        }
    }

    private static ImageBuffer run(ImageBuffer image, ImageProcessor chain) {
        Mat src = image.toMat();
        Mat result = null;
        try {
            result = chain.process(src);
            return ImageBuffer.fromMat(result);
        } finally {
            MatUtils.release(src, result);
        }
    }

    static ImageProcessor exposure(double ev) {
        double gain = Math.pow(2.0, ev);
        return input -> {
            Mat output = new Mat();
            input.convertTo(output, -1, gain, 0);
            return output;
        };
    }

    static ImageProcessor brightness(double offset) {
        return input -> {
            Mat output = new Mat();
            input.convertTo(output, -1, 1.0, offset * 255.0);
            return output;
        };
    }

    static ImageProcessor contrast(double factor) {
        return input -> {
            Mat output = new Mat();
            // (v - 127.5) * factor + 127.5
            input.convertTo(output, -1, factor, 127.5 * (1.0 - factor));
            return output;
        };
    }

    /**
     * Unsharp mask: original + amount * (original - blurred).
     */
    static ImageProcessor sharpen(double amount) {
        return input -> {
            Mat output = new Mat();
            if (amount <= 0) {
                input.copyTo(output);
                return output;
            }
            Mat blurred = new Mat();
            try {
                Imgproc.GaussianBlur(input, blurred, new Size(0, 0), 1.5);
                Core.addWeighted(input, 1.0 + amount, blurred, -amount, 0, output);
                return output;
            } finally {
                blurred.release();
            }
        };
    }

    /**
     * Edge-preserving smoothing. Strength is a fraction of full scale used as
     * the bilateral color sigma. BGRA input is passed through unchanged.
     */
    static ImageProcessor denoise(double strength) {
        return input -> {
            Mat output = new Mat();
            if (strength <= 0 || input.channels() == 4) {
                input.copyTo(output);
                return output;
            }
            Imgproc.bilateralFilter(input, output, 5, strength * 255.0, 3.0);
            return output;
        };
    }

    static ImageProcessor desaturate() {
        return input -> {
            Mat output = new Mat();
            if (input.channels() == 1) {
                input.copyTo(output);
                return output;
            }
            Mat gray = new Mat();
            try {
                MatUtils.toGray(input, gray);
                Imgproc.cvtColor(gray, output, Imgproc.COLOR_GRAY2BGR);
                return output;
            } finally {
                gray.release();
            }
        };
    }
}
