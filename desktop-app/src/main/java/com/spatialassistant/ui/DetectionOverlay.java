package com.spatialassistant.ui;

import com.spatialassistant.detection.TrackedObject;
import com.spatialassistant.video.VideoFrame;
import javafx.application.Platform;
import javafx.embed.swing.SwingFXUtils;
import javafx.scene.image.Image;
import javafx.scene.image.ImageView;
import javafx.scene.control.Label;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.shape.Rectangle;

import java.util.ArrayList;
import java.util.List;

/**
 * Shows the latest video frame with tracked objects drawn over it as labelled boxes.
 * Coordinates are normalized to 0..1000 and scaled to the current size of the pane,
 * which the frame is stretched to fill.
 */
public class DetectionOverlay {
    private static final double NORMALIZED_EXTENT = 1000.0;
    private static final Color BOX_COLOR = Color.web("#00E676");

    private final Pane pane;
    private final ImageView frameView = new ImageView();
    private List<TrackedObject> objects = new ArrayList<>();

    public DetectionOverlay() {
        pane = new Pane();
        pane.setStyle("-fx-background-color: #202124;");
        pane.setMinSize(320, 180);
        frameView.setPreserveRatio(false);
        frameView.setSmooth(true);
        pane.widthProperty().addListener((obs, oldVal, newVal) -> redraw());
        pane.heightProperty().addListener((obs, oldVal, newVal) -> redraw());
    }

    public Pane getView() {
        return pane;
    }

    /**
     * Replaces the drawn set. Safe to call from any thread.
     */
    public void showObjects(List<TrackedObject> tracked) {
        List<TrackedObject> copy = new ArrayList<>(tracked);
        Platform.runLater(() -> {
            objects = copy;
            redraw();
        });
    }

    /**
     * Replaces the background picture. Safe to call from any thread; frames without a
     * decoded image are ignored.
     */
    public void showFrame(VideoFrame frame) {
        if (frame.getImage() == null) {
            return;
        }
        Image image = SwingFXUtils.toFXImage(frame.getImage(), null);
        Platform.runLater(() -> frameView.setImage(image));
    }

    /**
     * Drops the background picture, e.g. when the session ends.
     */
    public void clearFrame() {
        Platform.runLater(() -> frameView.setImage(null));
    }

    private void redraw() {
        pane.getChildren().clear();
        frameView.setFitWidth(pane.getWidth());
        frameView.setFitHeight(pane.getHeight());
        pane.getChildren().add(frameView);
        double scaleX = pane.getWidth() / NORMALIZED_EXTENT;
        double scaleY = pane.getHeight() / NORMALIZED_EXTENT;
        for (TrackedObject object : objects) {
            double x = object.getXmin() * scaleX;
            double y = object.getYmin() * scaleY;
            double width = Math.max(1, (object.getXmax() - object.getXmin()) * scaleX);
            double height = Math.max(1, (object.getYmax() - object.getYmin()) * scaleY);

            Rectangle box = new Rectangle(x, y, width, height);
            box.setFill(Color.TRANSPARENT);
            box.setStroke(BOX_COLOR);
            box.setStrokeWidth(2);

            Label label = new Label(object.getLabel() + " (" + object.getId() + ")");
            label.setStyle("-fx-background-color: #00E676; -fx-text-fill: black; " +
                          "-fx-font-size: 11px; -fx-padding: 1px 4px;");
            label.setLayoutX(x);
            label.setLayoutY(Math.max(0, y - 18));

            pane.getChildren().addAll(box, label);
        }
    }
}
