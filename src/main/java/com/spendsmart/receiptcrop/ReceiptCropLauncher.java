package com.spendsmart.receiptcrop;

import com.spendsmart.receiptcrop.fx.ReceiptCropApp;
import com.spendsmart.receiptcrop.util.OpenCvLoader;

import java.util.logging.Filter;
import java.util.logging.Logger;

/**
 * Launcher class for the JavaFX application.
 * JavaFX Application classes cannot be launched directly from a shaded JAR,
 * so the manifest points here instead.
 */
public class ReceiptCropLauncher {

    private static final String APP_NAME = "Receipt Crop";

    public static void main(String[] args) {
        suppressJavaFXModuleWarning();

        // Must be set before any AWT/JavaFX initialization
        System.setProperty("apple.awt.application.name", APP_NAME);

        OpenCvLoader.load();

        ReceiptCropApp.main(args);
    }

    /**
     * Filter the "Unsupported JavaFX configuration" warning logged when JavaFX
     * is loaded from the classpath rather than as a module.
     */
    private static void suppressJavaFXModuleWarning() {
        Logger javafxLogger = Logger.getLogger("javafx");
        Filter existingFilter = javafxLogger.getFilter();
        javafxLogger.setFilter(record -> {
            String msg = record.getMessage();
            if (msg != null && msg.contains("Unsupported JavaFX configuration")) {
                return false;
            }
            return existingFilter == null || existingFilter.isLoggable(record);
        });
    }
}
