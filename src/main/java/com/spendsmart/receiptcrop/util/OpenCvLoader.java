package com.spendsmart.receiptcrop.util;

import org.opencv.core.Core;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact.
 * Safe to call repeatedly; only the first call does any work.
 */
public final class OpenCvLoader {

    private static boolean loaded = false;

    private OpenCvLoader() {
    }

    public static synchronized void load() {
        if (loaded) {
            return;
        }
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        System.out.println("[OpenCvLoader] OpenCV " + Core.VERSION + " loaded");
    }
}
