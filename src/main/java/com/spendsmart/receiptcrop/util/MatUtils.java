package com.spendsmart.receiptcrop.util;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Small helpers for native Mat lifetimes.
 */
public final class MatUtils {

    private MatUtils() {
    }

    /**
     * Release every non-null Mat.
     */
    public static void release(Mat... mats) {
        if (mats == null) return;
        for (Mat m : mats) {
            if (m != null) {
                m.release();
            }
        }
    }

    public static void releaseAll(List<? extends Mat> mats) {
        if (mats == null) return;
        for (Mat m : mats) {
            if (m != null) {
                m.release();
            }
        }
    }

    /**
     * Convert BGR, BGRA or single-channel input to an 8-bit gray Mat.
     */
    public static void toGray(Mat src, Mat gray) {
        switch (src.channels()) {
            case 3:
                Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);
                break;
            case 4:
                Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGRA2GRAY);
                break;
            default:
                src.copyTo(gray);
                break;
        }
    }
}
