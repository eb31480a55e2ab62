package com.spendsmart.receiptcrop.fx;

import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.ImageProcessingResult;
import com.spendsmart.receiptcrop.preview.DisplayedImage;
import com.spendsmart.receiptcrop.preview.ReceiptPreviewSession;
import com.spendsmart.receiptcrop.processing.CorrectionWorker;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.image.ImageView;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;
import javafx.stage.Stage;
import javafx.stage.Window;

/**
 * Shows the processed receipt with its quality assessment and lets the user
 * keep it, switch to the original, adjust the crop, or discard it.
 */
public class PreviewWindow {

    private final ReceiptPreviewSession session;
    private final ImageBuffer original;
    private final CorrectionWorker worker;
    private final Stage stage;
    private final ImageView imageView;
    private final Label sourceLabel;
    private final Button toggleButton;
    private final Button adjustButton;

    public PreviewWindow(Window owner, ReceiptPreviewSession session, ImageBuffer original, CorrectionWorker worker) {
        this.session = session;
        this.original = original;
        this.worker = worker;

        stage = new Stage();
        stage.initOwner(owner);
        stage.setTitle("Receipt Preview");

        ImageProcessingResult result = session.getResult();

        imageView = new ImageView();
        imageView.setPreserveRatio(true);
        imageView.setFitWidth(560);
        imageView.setFitHeight(640);

        Label badge = new Label(result.qualityText() + " quality ("
            + Math.round(result.getOverallConfidence() * 100) + "%)");
        badge.setStyle("-fx-font-weight: bold; -fx-text-fill: " + badgeColor(result) + ";");

        VBox issues = new VBox(2);
        for (String issue : result.getQualityIssues()) {
            issues.getChildren().add(new Label("• " + issue));
        }

        sourceLabel = new Label();

        toggleButton = new Button();
        toggleButton.setOnAction(e -> {
            session.toggleUseOriginal();
            refresh();
        });
        adjustButton = new Button("Adjust");
        adjustButton.setOnAction(e -> openAdjustment());
        Button cancelButton = new Button("Cancel");
        cancelButton.setOnAction(e -> {
            session.reject();
            stage.close();
        });
        Button acceptButton = new Button("Use This Image");
        acceptButton.setDefaultButton(true);
        acceptButton.setOnAction(e -> {
            session.accept();
            stage.close();
        });
        Button skipButton = new Button("Skip Preview");
        skipButton.setOnAction(e -> {
            session.skipPreview();
            stage.close();
        });

        HBox buttons = new HBox(10, toggleButton, adjustButton, skipButton, cancelButton, acceptButton);
        buttons.setAlignment(Pos.CENTER_RIGHT);

        VBox info = new VBox(6, badge, issues, sourceLabel, buttons);
        info.setPadding(new Insets(10));

        BorderPane root = new BorderPane();
        root.setCenter(imageView);
        root.setBottom(info);

        stage.setScene(new Scene(root));
        stage.setOnCloseRequest(e -> {
            if (!session.getState().isTerminal()) {
                session.reject();
            }
        });
    }

    public void show() {
        session.showPreview();
        refresh();
        stage.show();
    }

    private void openAdjustment() {
        CropAdjustmentWindow window = new CropAdjustmentWindow(stage, session, original, worker);
        window.setOnApplied(corrected -> refresh());
        window.show();
    }

    private void refresh() {
        imageView.setImage(FXImageUtils.toFxImage(session.currentImage()));
        DisplayedImage displayed = session.displayedImage();
        switch (displayed) {
            case ORIGINAL:
                sourceLabel.setText("Showing original image");
                toggleButton.setText("Use Processed");
                break;
            case MANUALLY_ADJUSTED:
                sourceLabel.setText("Showing manually adjusted crop");
                toggleButton.setText("Use Original");
                break;
            default:
                sourceLabel.setText("Showing auto-processed image");
                toggleButton.setText("Use Original");
                break;
        }
        adjustButton.setDisable(!session.canAdjustManually());
    }

    private static String badgeColor(ImageProcessingResult result) {
        switch (result.confidenceLevel()) {
            case HIGH:
                return "#27ae60";
            case MEDIUM:
                return "#e67e22";
            default:
                return "#c0392b";
        }
    }
}
