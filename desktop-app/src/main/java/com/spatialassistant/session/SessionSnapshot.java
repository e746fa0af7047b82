package com.spatialassistant.session;

import com.spatialassistant.detection.TrackedObject;

import java.util.List;

/**
 * Read-only view of a coordinator at one point in time.
 */
public final class SessionSnapshot {
    private final ConnectionState state;
    private final List<TrackedObject> trackedObjects;
    private final List<TranscriptEntry> history;

    SessionSnapshot(ConnectionState state, List<TrackedObject> trackedObjects, List<TranscriptEntry> history) {
        this.state = state;
        this.trackedObjects = trackedObjects;
        this.history = history;
    }

    public ConnectionState getState() {
        return state;
    }

    public List<TrackedObject> getTrackedObjects() {
        return trackedObjects;
    }

    public List<TranscriptEntry> getHistory() {
        return history;
    }
}
