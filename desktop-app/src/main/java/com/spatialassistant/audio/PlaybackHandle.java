package com.spatialassistant.audio;

/**
 * Opaque ticket for a segment registered with a {@link PlaybackScheduler}.
 */
public final class PlaybackHandle {
    private final long id;
    private final double startTime;
    private final double durationSeconds;

    PlaybackHandle(long id, double startTime, double durationSeconds) {
        this.id = id;
        this.startTime = startTime;
        this.durationSeconds = durationSeconds;
    }

    long getId() {
        return id;
    }

    public double getStartTime() {
        return startTime;
    }

    public double getEndTime() {
        return startTime + durationSeconds;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    @Override
    public String toString() {
        return "PlaybackHandle#" + id + "[" + startTime + "s +" + durationSeconds + "s]";
    }
}
