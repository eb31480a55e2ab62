package com.spendsmart.receiptcrop.fx;

import com.spendsmart.receiptcrop.editor.CropSession;
import com.spendsmart.receiptcrop.geometry.FitMapping;
import com.spendsmart.receiptcrop.model.CropOutcome;
import com.spendsmart.receiptcrop.model.ImageBuffer;
import com.spendsmart.receiptcrop.model.Point2D;
import com.spendsmart.receiptcrop.model.Quadrilateral;
import com.spendsmart.receiptcrop.model.Size2D;
import com.spendsmart.receiptcrop.preview.ReceiptPreviewSession;
import com.spendsmart.receiptcrop.processing.CorrectionWorker;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.image.Image;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Pane;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.stage.Modality;
import javafx.stage.Stage;
import javafx.stage.Window;

import java.util.function.Consumer;

/**
 * Modal window for dragging the four crop corners over the original image.
 * Apply runs the correction on the worker; dragging is disabled until it
 * finishes.
 */
public class CropAdjustmentWindow {

    private static final double INITIAL_WIDTH = 600;
    private static final double INITIAL_HEIGHT = 700;
    private static final double HANDLE_RADIUS = 10;
    // Generous grab distance for touchpads
    private static final double GRAB_DISTANCE = 24;

    private final ReceiptPreviewSession preview;
    private final CorrectionWorker worker;
    private final Image image;
    private final Stage stage;
    private final Canvas canvas;
    private final Label promptLabel;
    private final Button applyButton;
    private final Button resetButton;
    private final CropSession session;
    private Consumer<ImageBuffer> onApplied;
    private int activeCorner = -1;

    public CropAdjustmentWindow(Window owner, ReceiptPreviewSession preview, ImageBuffer original,
                                CorrectionWorker worker) {
        this.preview = preview;
        this.worker = worker;
        this.image = FXImageUtils.toFxImage(original);

        stage = new Stage();
        stage.setTitle("Adjust Crop");
        stage.initOwner(owner);
        stage.initModality(Modality.APPLICATION_MODAL);

        canvas = new Canvas(INITIAL_WIDTH, INITIAL_HEIGHT);
        Pane canvasPane = new Pane(canvas);
        canvasPane.setPrefSize(INITIAL_WIDTH, INITIAL_HEIGHT);
        canvasPane.setStyle("-fx-background-color: black;");

        session = preview.beginManualAdjustment(new Size2D(INITIAL_WIDTH, INITIAL_HEIGHT));
        session.setOnChanged(corners -> paintCanvas());

        canvas.widthProperty().bind(canvasPane.widthProperty());
        canvas.heightProperty().bind(canvasPane.heightProperty());
        canvas.widthProperty().addListener((obs, oldV, newV) -> onResize());
        canvas.heightProperty().addListener((obs, oldV, newV) -> onResize());

        canvas.setOnMousePressed(e -> activeCorner = nearestCorner(new Point2D(e.getX(), e.getY())));
        canvas.setOnMouseDragged(e -> {
            if (activeCorner >= 0) {
                session.dragFromContainer(activeCorner, new Point2D(e.getX(), e.getY()));
            }
        });
        canvas.setOnMouseReleased(e -> activeCorner = -1);

        promptLabel = new Label();
        promptLabel.setStyle("-fx-text-fill: #c0392b;");

        Button cancelButton = new Button("Cancel");
        cancelButton.setOnAction(e -> cancel());
        resetButton = new Button("Reset");
        resetButton.setOnAction(e -> session.reset());
        applyButton = new Button("Apply Crop");
        applyButton.setDefaultButton(true);
        applyButton.setOnAction(e -> apply());

        HBox buttons = new HBox(10, cancelButton, resetButton, applyButton);
        buttons.setAlignment(Pos.CENTER_RIGHT);
        VBox bottom = new VBox(6, promptLabel, buttons);

        BorderPane root = new BorderPane();
        root.setCenter(canvasPane);
        root.setBottom(bottom);
        BorderPane.setMargin(bottom, new Insets(10));

        stage.setScene(new Scene(root));
        stage.setOnCloseRequest(e -> cancel());
    }

    public void setOnApplied(Consumer<ImageBuffer> onApplied) {
        this.onApplied = onApplied;
    }

    public void show() {
        stage.show();
        Platform.runLater(this::paintCanvas);
    }

    private void onResize() {
        if (canvas.getWidth() > 0 && canvas.getHeight() > 0) {
            session.resize(new Size2D(canvas.getWidth(), canvas.getHeight()));
            paintCanvas();
        }
    }

    private void apply() {
        setPending(true);
        preview.applyManualAdjustmentAsync(worker).whenComplete((outcome, error) ->
            Platform.runLater(() -> onCorrectionDone(outcome, error)));
    }

    private void onCorrectionDone(CropOutcome outcome, Throwable error) {
        setPending(false);
        if (error != null) {
            promptLabel.setText("Crop failed: " + error.getMessage());
            return;
        }
        if (outcome.isApplied()) {
            stage.close();
            if (onApplied != null) {
                outcome.getImage().ifPresent(onApplied);
            }
        } else {
            promptLabel.setText(preview.getPrompt().orElse(""));
        }
    }

    private void cancel() {
        if (preview.getCropSession().isPresent()) {
            preview.cancelManualAdjustment();
        }
        stage.close();
    }

    private void setPending(boolean pending) {
        applyButton.setDisable(pending);
        resetButton.setDisable(pending);
        if (pending) {
            promptLabel.setText("Correcting perspective...");
        } else {
            promptLabel.setText("");
        }
    }

    private int nearestCorner(Point2D containerPoint) {
        FitMapping mapping = session.getMapping();
        Quadrilateral corners = session.currentCorners();
        int best = -1;
        double bestDistance = GRAB_DISTANCE;
        for (int i = 0; i < Quadrilateral.CORNER_COUNT; i++) {
            double d = mapping.displayToContainer(corners.get(i)).distanceTo(containerPoint);
            if (d <= bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return best;
    }

    private void paintCanvas() {
        GraphicsContext gc = canvas.getGraphicsContext2D();
        gc.setFill(Color.BLACK);
        gc.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

        FitMapping mapping = session.getMapping();
        Size2D fitted = mapping.getFitted();
        if (image != null) {
            gc.drawImage(image, mapping.getOffsetX(), mapping.getOffsetY(), fitted.getWidth(), fitted.getHeight());
        }

        Quadrilateral corners = session.currentCorners();
        double[] xs = new double[Quadrilateral.CORNER_COUNT];
        double[] ys = new double[Quadrilateral.CORNER_COUNT];
        for (int i = 0; i < Quadrilateral.CORNER_COUNT; i++) {
            Point2D p = mapping.displayToContainer(corners.get(i));
            xs[i] = p.getX();
            ys[i] = p.getY();
        }

        gc.setFill(Color.rgb(52, 152, 219, 0.15));
        gc.fillPolygon(xs, ys, Quadrilateral.CORNER_COUNT);
        gc.setStroke(Color.rgb(52, 152, 219));
        gc.setLineWidth(2);
        gc.strokePolygon(xs, ys, Quadrilateral.CORNER_COUNT);

        for (int i = 0; i < Quadrilateral.CORNER_COUNT; i++) {
            gc.setFill(i == activeCorner ? Color.ORANGE : Color.WHITE);
            gc.fillOval(xs[i] - HANDLE_RADIUS, ys[i] - HANDLE_RADIUS, HANDLE_RADIUS * 2, HANDLE_RADIUS * 2);
            gc.strokeOval(xs[i] - HANDLE_RADIUS, ys[i] - HANDLE_RADIUS, HANDLE_RADIUS * 2, HANDLE_RADIUS * 2);
        }
    }
}
