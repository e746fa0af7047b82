package com.spatialassistant.ui;

import com.spatialassistant.session.TranscriptEntry;
import javafx.application.Platform;
import javafx.geometry.Pos;
import javafx.scene.control.Label;
import javafx.scene.control.ScrollPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.scene.text.Font;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat-style view of the conversation history.
 * User turns are right-aligned, model turns left-aligned.
 */
public class ChatTimeline {
    private static final Color USER_COLOR = Color.web("#4A90E2");
    private static final Color MODEL_COLOR = Color.web("#50C878");

    private final VBox messageContainer;
    private final ScrollPane scrollPane;
    private int renderedCount;

    public ChatTimeline() {
        messageContainer = new VBox(10);
        messageContainer.setStyle("-fx-padding: 15px; -fx-background-color: #f5f5f5;");

        scrollPane = new ScrollPane(messageContainer);
        scrollPane.setFitToWidth(true);
        scrollPane.setStyle("-fx-background: #f5f5f5;");
        scrollPane.setVvalue(1.0);

        // Keep the newest turn in view
        messageContainer.heightProperty().addListener((obs, oldVal, newVal) ->
            Platform.runLater(() -> scrollPane.setVvalue(1.0)));
    }

    public ScrollPane getView() {
        return scrollPane;
    }

    /**
     * Shows a history snapshot. History is append-only, so only entries not yet rendered are added.
     * Safe to call from any thread.
     */
    public void showHistory(List<TranscriptEntry> history) {
        List<TranscriptEntry> entries = new ArrayList<>(history);
        Platform.runLater(() -> {
            if (entries.size() < renderedCount) {
                messageContainer.getChildren().clear();
                renderedCount = 0;
            }
            for (int i = renderedCount; i < entries.size(); i++) {
                messageContainer.getChildren().add(createMessageBox(entries.get(i)));
            }
            renderedCount = entries.size();
        });
    }

    private HBox createMessageBox(TranscriptEntry entry) {
        boolean user = entry.getRole() == TranscriptEntry.Role.USER;

        HBox messageBox = new HBox(10);
        messageBox.setAlignment(user ? Pos.TOP_RIGHT : Pos.TOP_LEFT);
        messageBox.setStyle("-fx-padding: 8px;");

        Label roleLabel = new Label(user ? "You:" : "Assistant:");
        roleLabel.setFont(Font.font("System", 14));
        roleLabel.setTextFill(user ? USER_COLOR : MODEL_COLOR);
        roleLabel.setStyle("-fx-font-weight: bold; -fx-padding: 0 8px 0 0;");

        Label textLabel = new Label(entry.getText());
        textLabel.setFont(Font.font("System", 13));
        textLabel.setWrapText(true);
        textLabel.setMaxWidth(520);
        textLabel.setStyle("-fx-background-color: white; -fx-background-radius: 8px; " +
                          "-fx-padding: 10px; -fx-border-radius: 8px; " +
                          "-fx-effect: dropshadow(three-pass-box, rgba(0,0,0,0.1), 5, 0, 0, 2);");

        if (user) {
            messageBox.getChildren().addAll(textLabel, roleLabel);
        } else {
            messageBox.getChildren().addAll(roleLabel, textLabel);
        }
        return messageBox;
    }

    public void clear() {
        Platform.runLater(() -> {
            messageContainer.getChildren().clear();
            renderedCount = 0;
        });
    }
}
