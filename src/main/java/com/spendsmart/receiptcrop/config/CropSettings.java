package com.spendsmart.receiptcrop.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables for seeding, detection, correction and enhancement.
 *
 * Defaults come from the classpath resource {@value #DEFAULTS_RESOURCE}. A user
 * file loaded with {@link #load(Path)} only needs the keys it changes.
 */
public final class CropSettings {

    public static final String DEFAULTS_RESOURCE = "/receipt-crop.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private static volatile CropSettings defaults;

    // Seeding / editing
    private final double defaultInset;
    private final double minQuadSide;
    private final boolean strictBounds;

    // Rectangle detection
    private final int maxObservations;
    private final double minAspectRatio;
    private final double maxAspectRatio;
    private final double minimumSize;
    private final double minimumConfidence;

    // Enhancement
    private final int maxOcrDimension;
    private final EnhancementProfile receiptProfile;
    private final EnhancementProfile ocrProfile;

    private CropSettings(Builder b) {
        this.defaultInset = b.defaultInset;
        this.minQuadSide = b.minQuadSide;
        this.strictBounds = b.strictBounds;
        this.maxObservations = b.maxObservations;
        this.minAspectRatio = b.minAspectRatio;
        this.maxAspectRatio = b.maxAspectRatio;
        this.minimumSize = b.minimumSize;
        this.minimumConfidence = b.minimumConfidence;
        this.maxOcrDimension = b.maxOcrDimension;
        this.receiptProfile = b.receiptProfile;
        this.ocrProfile = b.ocrProfile;
    }

    /**
     * Settings from the bundled defaults resource. Falls back to the compiled-in
     * values if the resource is missing or unreadable.
     */
    public static CropSettings defaults() {
        CropSettings result = defaults;
        if (result == null) {
            synchronized (CropSettings.class) {
                result = defaults;
                if (result == null) {
                    result = loadDefaultsResource();
                    defaults = result;
                }
            }
        }
        return result;
    }

    private static CropSettings loadDefaultsResource() {
        try (InputStream in = CropSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                System.err.println("[CropSettings] " + DEFAULTS_RESOURCE + " not found, using built-in defaults");
                return new Builder().build();
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return fromJson(JsonParser.parseReader(reader).getAsJsonObject(), new Builder().build());
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            System.err.println("[CropSettings] Could not read " + DEFAULTS_RESOURCE + ": " + e.getMessage());
            return new Builder().build();
        }
    }

    /**
     * Load a user settings file on top of {@link #defaults()}.
     *
     * @throws IOException if the file cannot be read, is not a JSON object, or holds
     *                     a value of the wrong type or out of range
     */
    public static CropSettings load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
            CropSettings settings = fromJson(root, defaults());
            System.out.println("[CropSettings] Loaded settings from " + path);
            return settings;
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                 | IllegalArgumentException e) {
            throw new IOException("Invalid settings file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Write the effective settings as pretty-printed JSON.
     */
    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(), writer);
        }
    }

    static CropSettings fromJson(JsonObject root, CropSettings base) {
        Builder b = base.toBuilder();

        if (root.has("crop") && root.get("crop").isJsonObject()) {
            JsonObject crop = root.getAsJsonObject("crop");
            b.defaultInset(getJsonDouble(crop, "defaultInset", b.defaultInset));
            b.minQuadSide(getJsonDouble(crop, "minQuadSide", b.minQuadSide));
            b.strictBounds(getJsonBoolean(crop, "strictBounds", b.strictBounds));
        }

        if (root.has("detection") && root.get("detection").isJsonObject()) {
            JsonObject detection = root.getAsJsonObject("detection");
            b.maxObservations(getJsonInt(detection, "maxObservations", b.maxObservations));
            b.minAspectRatio(getJsonDouble(detection, "minAspectRatio", b.minAspectRatio));
            b.maxAspectRatio(getJsonDouble(detection, "maxAspectRatio", b.maxAspectRatio));
            b.minimumSize(getJsonDouble(detection, "minimumSize", b.minimumSize));
            b.minimumConfidence(getJsonDouble(detection, "minimumConfidence", b.minimumConfidence));
        }

        if (root.has("enhancement") && root.get("enhancement").isJsonObject()) {
            JsonObject enhancement = root.getAsJsonObject("enhancement");
            b.maxOcrDimension(getJsonInt(enhancement, "maxOcrDimension", b.maxOcrDimension));
            if (enhancement.has("receipt") && enhancement.get("receipt").isJsonObject()) {
                b.receiptProfile(EnhancementProfile.fromJson(enhancement.getAsJsonObject("receipt"), b.receiptProfile));
            }
            if (enhancement.has("ocrOptimized") && enhancement.get("ocrOptimized").isJsonObject()) {
                b.ocrProfile(EnhancementProfile.fromJson(enhancement.getAsJsonObject("ocrOptimized"), b.ocrProfile));
            }
        }

        return b.build();
    }

    public JsonObject toJson() {
        JsonObject root = new JsonObject();

        JsonObject crop = new JsonObject();
        crop.addProperty("defaultInset", defaultInset);
        crop.addProperty("minQuadSide", minQuadSide);
        crop.addProperty("strictBounds", strictBounds);
        root.add("crop", crop);

        JsonObject detection = new JsonObject();
        detection.addProperty("maxObservations", maxObservations);
        detection.addProperty("minAspectRatio", minAspectRatio);
        detection.addProperty("maxAspectRatio", maxAspectRatio);
        detection.addProperty("minimumSize", minimumSize);
        detection.addProperty("minimumConfidence", minimumConfidence);
        root.add("detection", detection);

        JsonObject enhancement = new JsonObject();
        enhancement.addProperty("maxOcrDimension", maxOcrDimension);
        enhancement.add("receipt", receiptProfile.toJson());
        enhancement.add("ocrOptimized", ocrProfile.toJson());
        root.add("enhancement", enhancement);

        return root;
    }

    /**
     * Helper to safely get an int from JSON.
     */
    static int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsInt();
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a double from JSON.
     */
    static double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsDouble();
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a boolean from JSON.
     */
    static boolean getJsonBoolean(JsonObject json, String key, boolean defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsBoolean();
        }
        return defaultValue;
    }

    /** Fraction of the fitted image left as margin around the default crop. */
    public double getDefaultInset() {
        return defaultInset;
    }

    /** Shortest quadrilateral side, in image pixels, that still counts as a valid crop. */
    public double getMinQuadSide() {
        return minQuadSide;
    }

    /** When true, out-of-bounds corners fail the correction instead of being clamped. */
    public boolean isStrictBounds() {
        return strictBounds;
    }

    public int getMaxObservations() {
        return maxObservations;
    }

    public double getMinAspectRatio() {
        return minAspectRatio;
    }

    public double getMaxAspectRatio() {
        return maxAspectRatio;
    }

    /** Minimum detected size as a fraction of the image's smaller side. */
    public double getMinimumSize() {
        return minimumSize;
    }

    public double getMinimumConfidence() {
        return minimumConfidence;
    }

    public int getMaxOcrDimension() {
        return maxOcrDimension;
    }

    public EnhancementProfile getReceiptProfile() {
        return receiptProfile;
    }

    public EnhancementProfile getOcrProfile() {
        return ocrProfile;
    }

    public Builder toBuilder() {
        return new Builder()
            .defaultInset(defaultInset)
            .minQuadSide(minQuadSide)
            .strictBounds(strictBounds)
            .maxObservations(maxObservations)
            .minAspectRatio(minAspectRatio)
            .maxAspectRatio(maxAspectRatio)
            .minimumSize(minimumSize)
            .minimumConfidence(minimumConfidence)
            .maxOcrDimension(maxOcrDimension)
            .receiptProfile(receiptProfile)
            .ocrProfile(ocrProfile);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder seeded with the compiled-in defaults.
     */
    public static final class Builder {
        private double defaultInset = 0.1;
        private double minQuadSide = 2.0;
        private boolean strictBounds = false;
        private int maxObservations = 5;
        private double minAspectRatio = 0.2;
        private double maxAspectRatio = 5.0;
        private double minimumSize = 0.3;
        private double minimumConfidence = 0.7;
        private int maxOcrDimension = 2048;
        private EnhancementProfile receiptProfile = EnhancementProfile.RECEIPT;
        private EnhancementProfile ocrProfile = EnhancementProfile.OCR_OPTIMIZED;

        private Builder() {
        }

        public Builder defaultInset(double value) {
            if (value < 0 || value >= 0.5) {
                throw new IllegalArgumentException("defaultInset must be in [0, 0.5), got " + value);
            }
            this.defaultInset = value;
            return this;
        }

        public Builder minQuadSide(double value) {
            this.minQuadSide = value;
            return this;
        }

        public Builder strictBounds(boolean value) {
            this.strictBounds = value;
            return this;
        }

        public Builder maxObservations(int value) {
            this.maxObservations = Math.max(1, value);
            return this;
        }

        public Builder minAspectRatio(double value) {
            this.minAspectRatio = value;
            return this;
        }

        public Builder maxAspectRatio(double value) {
            this.maxAspectRatio = value;
            return this;
        }

        public Builder minimumSize(double value) {
            this.minimumSize = value;
            return this;
        }

        public Builder minimumConfidence(double value) {
            this.minimumConfidence = value;
            return this;
        }

        public Builder maxOcrDimension(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("maxOcrDimension must be positive, got " + value);
            }
            this.maxOcrDimension = value;
            return this;
        }

        public Builder receiptProfile(EnhancementProfile value) {
            this.receiptProfile = value;
            return this;
        }

        public Builder ocrProfile(EnhancementProfile value) {
            this.ocrProfile = value;
            return this;
        }

        public CropSettings build() {
            return new CropSettings(this);
        }
    }
}
