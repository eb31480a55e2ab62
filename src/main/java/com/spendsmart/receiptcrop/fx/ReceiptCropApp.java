package com.spendsmart.receiptcrop.fx;

import com.spendsmart.receiptcrop.config.CropSettings;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.PreviewOutcome;
import com.spendsmart.receiptcrop.model.ProcessedReceipt;
import com.spendsmart.receiptcrop.preview.ReceiptPreviewSession;
import com.spendsmart.receiptcrop.processing.CorrectionWorker;
import com.spendsmart.receiptcrop.processing.PerspectiveCorrector;
import com.spendsmart.receiptcrop.processing.ReceiptImageProcessor;
import com.spendsmart.receiptcrop.util.OpenCvLoader;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Alert;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.layout.VBox;
import javafx.stage.FileChooser;
import javafx.stage.Stage;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.prefs.Preferences;

/**
 * Desktop front end: open a receipt photo, review the automatic crop, adjust
 * it if needed and save the result next to the source as
 * {@code <name>-cropped.png}.
 *
 * Usage: {@code receipt-crop [--settings <file.json>] [image]}
 */
public class ReceiptCropApp extends Application {

    private static final String LAST_DIR_KEY = "lastDirectory";

    private Stage primaryStage;
    private Preferences prefs;
    private CropSettings settings;
    private ReceiptImageProcessor processor;
    private CorrectionWorker worker;
    private Label statusLabel;
    private Button openButton;

    @Override
    public void start(Stage primaryStage) {
        this.primaryStage = primaryStage;
        OpenCvLoader.load();

        String commandLineImage = null;
        String settingsFile = null;
        List<String> params = getParameters().getRaw();
        for (int i = 0; i < params.size(); i++) {
            String param = params.get(i);
            if ("--settings".equals(param)) {
                if (i + 1 < params.size()) {
                    settingsFile = params.get(++i);
                } else {
                    System.err.println("Error: --settings requires a file path");
                    Platform.exit();
                    return;
                }
            } else if ("-h".equals(param) || "--help".equals(param)) {
                printHelp();
                Platform.exit();
                return;
            } else if (!param.startsWith("-")) {
                commandLineImage = param;
            } else {
                System.err.println("Unknown option: " + param);
                printHelp();
                Platform.exit();
                return;
            }
        }

        settings = CropSettings.defaults();
        if (settingsFile != null) {
            try {
                settings = CropSettings.load(Paths.get(settingsFile));
                System.out.println("[ReceiptCropApp] Loaded settings from " + settingsFile);
            } catch (IOException e) {
                System.err.println("[ReceiptCropApp] Could not read settings " + settingsFile + ": " + e.getMessage());
                Platform.exit();
                return;
            }
        }

        prefs = Preferences.userNodeForPackage(ReceiptCropApp.class);
        processor = ReceiptImageProcessor.create(settings);
        worker = new CorrectionWorker(new PerspectiveCorrector(settings));

        openButton = new Button("Open Receipt...");
        openButton.setOnAction(e -> chooseImage());
        statusLabel = new Label("Open a receipt photo to begin");

        VBox root = new VBox(12, openButton, statusLabel);
        root.setAlignment(Pos.CENTER);
        root.setPadding(new Insets(20));

        primaryStage.setTitle("Receipt Crop");
        primaryStage.setScene(new Scene(root, 420, 160));
        primaryStage.centerOnScreen();
        primaryStage.show();

        if (commandLineImage != null) {
            File file = new File(commandLineImage);
            Platform.runLater(() -> processFile(file));
        }
    }

    @Override
    public void stop() {
        if (worker != null) {
            worker.close();
        }
    }

    private void chooseImage() {
        FileChooser fileChooser = new FileChooser();
        fileChooser.setTitle("Open Receipt");
        fileChooser.getExtensionFilters().add(
            new FileChooser.ExtensionFilter("Images", "*.png", "*.jpg", "*.jpeg", "*.bmp", "*.tif", "*.tiff"));
        String lastDir = prefs.get(LAST_DIR_KEY, null);
        if (lastDir != null && new File(lastDir).isDirectory()) {
            fileChooser.setInitialDirectory(new File(lastDir));
        }
        File file = fileChooser.showOpenDialog(primaryStage);
        if (file != null) {
            prefs.put(LAST_DIR_KEY, file.getParentFile().getAbsolutePath());
            processFile(file);
        }
    }

    private void processFile(File file) {
        openButton.setDisable(true);
        statusLabel.setText("Processing " + file.getName() + "...");

        // Detection and enhancement are too slow for the FX thread
        Thread thread = new Thread(() -> {
            try {
                ImageBuffer original = readImage(file);
                ProcessedReceipt receipt = processor.processWithAnalysis(original, ReceiptImageProcessor.TYPE_GALLERY);
                Platform.runLater(() -> showPreview(file, original, receipt));
            } catch (IOException | RuntimeException e) {
                Platform.runLater(() -> {
                    openButton.setDisable(false);
                    statusLabel.setText("Failed to process " + file.getName());
                    e.printStackTrace();
                    showError("Open Error", "Failed to process image: " + e.getMessage());
                });
            }
        }, "ReceiptProcessThread");
        thread.setDaemon(true);
        thread.start();
    }

    private void showPreview(File source, ImageBuffer original, ProcessedReceipt receipt) {
        ReceiptPreviewSession session = new ReceiptPreviewSession(
            original, receipt.image, receipt.result, new PerspectiveCorrector(settings), settings);
        session.outcome().thenAccept(outcome -> Platform.runLater(() -> finish(source, outcome)));
        new PreviewWindow(primaryStage, session, original, worker).show();
        statusLabel.setText("Reviewing " + source.getName());
    }

    private void finish(File source, PreviewOutcome outcome) {
        openButton.setDisable(false);
        if (!outcome.isAccepted()) {
            statusLabel.setText("Discarded " + source.getName());
            return;
        }
        Path target = croppedPath(source.toPath());
        try {
            writeImage(outcome.getImage().orElseThrow(), target);
            statusLabel.setText("Saved " + target.getFileName());
            System.out.println("[ReceiptCropApp] Saved " + target);
        } catch (IOException e) {
            statusLabel.setText("Save failed");
            e.printStackTrace();
            showError("Save Error", "Failed to save image: " + e.getMessage());
        }
    }

    /**
     * {@code dir/receipt.jpg} becomes {@code dir/receipt-cropped.png}.
     */
    static Path croppedPath(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return source.resolveSibling(base + "-cropped.png");
    }

    static ImageBuffer readImage(File file) throws IOException {
        Mat mat = Imgcodecs.imread(file.getAbsolutePath(), Imgcodecs.IMREAD_COLOR);
        try {
            if (mat.empty()) {
                throw new IOException("Unreadable image: " + file);
            }
            return ImageBuffer.fromMat(mat);
        } finally {
            mat.release();
        }
    }

    static void writeImage(ImageBuffer image, Path target) throws IOException {
        Mat mat = image.toMat();
        try {
            if (!Imgcodecs.imwrite(target.toString(), mat)) {
                throw new IOException("Could not write " + target);
            }
        } finally {
            mat.release();
        }
    }

    private void printHelp() {
        System.out.println("Usage: receipt-crop [--settings <file.json>] [image]");
        System.out.println("  --settings <file>  Override crop, detection and enhancement settings");
        System.out.println("  -h, --help         Show this help");
    }

    private void showError(String title, String message) {
        Alert alert = new Alert(Alert.AlertType.ERROR);
        alert.setTitle(title);
        alert.setHeaderText(null);
        alert.setContentText(message);
        alert.showAndWait();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
