package com.spendsmart.receiptcrop.config;

import com.google.gson.JsonObject;

/**
 * Tone and sharpness adjustments applied to a receipt before text recognition.
 */
public final class EnhancementProfile {

    /** Default look for captured receipts. */
    public static final EnhancementProfile RECEIPT = new EnhancementProfile(0.5, 0.1, 1.2, 0.6, 0.02);

    /** Stronger settings for the final OCR pass. */
    public static final EnhancementProfile OCR_OPTIMIZED = new EnhancementProfile(0.3, 0.15, 1.4, 0.8, 0.03);

    private final double exposure;
    private final double brightness;
    private final double contrast;
    private final double sharpness;
    private final double noiseReduction;

    public EnhancementProfile(double exposure, double brightness, double contrast, double sharpness,
                              double noiseReduction) {
        this.exposure = exposure;
        this.brightness = brightness;
        this.contrast = contrast;
        this.sharpness = sharpness;
        this.noiseReduction = noiseReduction;
    }

    /** Exposure adjustment in EV stops. */
    public double getExposure() {
        return exposure;
    }

    /** Brightness offset as a fraction of full scale. */
    public double getBrightness() {
        return brightness;
    }

    public double getContrast() {
        return contrast;
    }

    public double getSharpness() {
        return sharpness;
    }

    public double getNoiseReduction() {
        return noiseReduction;
    }

    static EnhancementProfile fromJson(JsonObject json, EnhancementProfile defaults) {
        if (json == null) {
            return defaults;
        }
        return new EnhancementProfile(
            CropSettings.getJsonDouble(json, "exposure", defaults.exposure),
            CropSettings.getJsonDouble(json, "brightness", defaults.brightness),
            CropSettings.getJsonDouble(json, "contrast", defaults.contrast),
            CropSettings.getJsonDouble(json, "sharpness", defaults.sharpness),
            CropSettings.getJsonDouble(json, "noiseReduction", defaults.noiseReduction)
        );
    }

    JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("exposure", exposure);
        json.addProperty("brightness", brightness);
        json.addProperty("contrast", contrast);
        json.addProperty("sharpness", sharpness);
        json.addProperty("noiseReduction", noiseReduction);
        return json;
    }

    @Override
    public String toString() {
        return String.format("EnhancementProfile[ev=%.2f brightness=%.2f contrast=%.2f sharpness=%.2f noise=%.3f]",
            exposure, brightness, contrast, sharpness, noiseReduction);
    }
}
