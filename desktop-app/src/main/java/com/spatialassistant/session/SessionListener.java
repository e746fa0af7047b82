package com.spatialassistant.session;

import com.spatialassistant.detection.TrackedObject;
import com.spatialassistant.video.VideoFrame;

import java.util.List;

/**
 * Presentation-side subscriber. Every argument is an immutable snapshot.
 * Callbacks arrive on session threads; UI code must hop to its own thread.
 */
public interface SessionListener {

    default void onStateChanged(ConnectionState state) {
    }

    default void onTrackedObjectsChanged(List<TrackedObject> objects) {
    }

    default void onHistoryChanged(List<TranscriptEntry> history) {
    }

    /**
     * A frame was sent to the model. Called on the frame timer thread.
     */
    default void onVideoFrame(VideoFrame frame) {
    }
}
