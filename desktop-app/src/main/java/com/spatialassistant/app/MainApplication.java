package com.spatialassistant.app;

import com.spatialassistant.audio.CaptureService;
import com.spatialassistant.audio.LinePlaybackEngine;
import com.spatialassistant.config.AppConfig;
import com.spatialassistant.detection.TrackedObject;
import com.spatialassistant.session.ConnectionState;
import com.spatialassistant.session.SessionCoordinator;
import com.spatialassistant.session.SessionException;
import com.spatialassistant.session.SessionListener;
import com.spatialassistant.session.TranscriptEntry;
import com.spatialassistant.transport.GeminiLiveChannel;
import com.spatialassistant.ui.ChatTimeline;
import com.spatialassistant.ui.DetectionOverlay;
import com.spatialassistant.video.CameraFrameSource;
import com.spatialassistant.video.ScreenFrameSource;
import com.spatialassistant.video.VideoFrame;
import com.spatialassistant.video.VideoFrameSource;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.SplitPane;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Main JavaFX application.
 * Wires camera or screen capture, microphone and speaker to a live model session and shows
 * what the model sees and says.
 */
public class MainApplication extends Application {
    private static final Logger LOG = LoggerFactory.getLogger(MainApplication.class);

    private SessionCoordinator coordinator;
    private ChatTimeline chatTimeline;
    private DetectionOverlay detectionOverlay;

    private Button startStopButton;
    private Label statusLabel;
    private Label objectCountLabel;

    @Override
    public void start(Stage primaryStage) {
        AppConfig config = AppConfig.getInstance();
        config.logConfiguration();

        GeminiLiveChannel channel = new GeminiLiveChannel(config.getLiveEndpoint(), config.getApiKey(),
            Duration.ofMillis(config.getConnectionTimeout()));
        coordinator = new SessionCoordinator(config,
            channel,
            new CaptureService(config.getCaptureFrameMillis()),
            createVideoSource(config),
            new LinePlaybackEngine(config.getPlaybackSampleRate()));

        chatTimeline = new ChatTimeline();
        detectionOverlay = new DetectionOverlay();

        BorderPane root = new BorderPane();

        // Top: controls
        HBox controlsBox = new HBox(10);
        controlsBox.setPadding(new Insets(10));
        controlsBox.setAlignment(Pos.CENTER_LEFT);
        controlsBox.setStyle("-fx-background-color: #e0e0e0;");

        startStopButton = new Button("Start session");
        startStopButton.setStyle("-fx-font-size: 14px; -fx-padding: 8px 16px;");
        startStopButton.setOnAction(e -> toggleSession());

        statusLabel = new Label();
        objectCountLabel = new Label("Objects: 0");
        objectCountLabel.setStyle("-fx-font-size: 12px; -fx-padding: 8px;");
        showState(ConnectionState.DISCONNECTED);

        controlsBox.getChildren().addAll(startStopButton, statusLabel, objectCountLabel);
        root.setTop(controlsBox);

        // Center: what the model sees next to what was said
        SplitPane split = new SplitPane(detectionOverlay.getView(), chatTimeline.getView());
        split.setDividerPositions(0.6);
        root.setCenter(split);

        coordinator.addListener(new SessionListener() {
            @Override
            public void onStateChanged(ConnectionState state) {
                if (state != ConnectionState.CONNECTED) {
                    detectionOverlay.clearFrame();
                }
                Platform.runLater(() -> showState(state));
            }

            @Override
            public void onVideoFrame(VideoFrame frame) {
                detectionOverlay.showFrame(frame);
            }

            @Override
            public void onTrackedObjectsChanged(List<TrackedObject> objects) {
                detectionOverlay.showObjects(objects);
                Platform.runLater(() -> objectCountLabel.setText("Objects: " + objects.size()));
            }

            @Override
            public void onHistoryChanged(List<TranscriptEntry> history) {
                chatTimeline.showHistory(history);
            }
        });

        Scene scene = new Scene(root, config.getWindowWidth(), config.getWindowHeight());
        primaryStage.setTitle("Spatial Assistant");
        primaryStage.setScene(scene);
        primaryStage.show();

        if (config.getApiKey() == null) {
            statusLabel.setText("No API key configured");
            statusLabel.setStyle("-fx-font-size: 12px; -fx-padding: 8px; -fx-text-fill: red;");
        }
    }

    private static VideoFrameSource createVideoSource(AppConfig config) {
        if ("screen".equals(config.getVideoSource())) {
            return new ScreenFrameSource(config.getVideoMaxWidth());
        }
        return new CameraFrameSource(config.getCameraIndex(), config.getVideoMaxWidth());
    }

    private void toggleSession() {
        ConnectionState state = coordinator.getState();
        if (state == ConnectionState.DISCONNECTED || state == ConnectionState.ERROR) {
            startSession();
        } else {
            stopSession();
        }
    }

    private void startSession() {
        startStopButton.setDisable(true);
        CompletableFuture.runAsync(() -> {
            try {
                coordinator.start();
            } catch (SessionException e) {
                LOG.error("Could not start session: {}", e.getMessage());
                Platform.runLater(() -> {
                    statusLabel.setText("Error: " + e.getMessage());
                    statusLabel.setStyle("-fx-font-size: 12px; -fx-padding: 8px; -fx-text-fill: red;");
                });
            }
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                LOG.error("Unexpected error while starting session", error);
            }
            Platform.runLater(() -> startStopButton.setDisable(false));
        });
    }

    private void stopSession() {
        CompletableFuture.runAsync(coordinator::stop)
            .exceptionally(e -> {
                LOG.error("Error while stopping session", e);
                return null;
            });
    }

    private void showState(ConnectionState state) {
        switch (state) {
            case CONNECTING:
                statusLabel.setText("Connecting...");
                statusLabel.setStyle("-fx-font-size: 12px; -fx-padding: 8px; -fx-text-fill: blue;");
                startStopButton.setText("Stop session");
                break;
            case CONNECTED:
                statusLabel.setText("Live");
                statusLabel.setStyle("-fx-font-size: 12px; -fx-padding: 8px; -fx-text-fill: green;");
                startStopButton.setText("Stop session");
                break;
            case ERROR:
                statusLabel.setText("Connection error");
                statusLabel.setStyle("-fx-font-size: 12px; -fx-padding: 8px; -fx-text-fill: red;");
                startStopButton.setText("Start session");
                break;
            default:
                statusLabel.setText("Ready");
                statusLabel.setStyle("-fx-font-size: 12px; -fx-padding: 8px;");
                startStopButton.setText("Start session");
        }
    }

    @Override
    public void stop() {
        if (coordinator != null) {
            coordinator.close();
        }
        LOG.info("Application stopped");
    }

    public static void main(String[] args) {
        launch(args);
    }
}
