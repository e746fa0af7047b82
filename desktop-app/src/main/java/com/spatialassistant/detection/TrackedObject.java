package com.spatialassistant.detection;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A detection reconciled into a persistent identity.
 * Instances are immutable; the tracker replaces them on update and carries the id forward.
 */
public final class TrackedObject {
    private final String id;
    private final String label;
    private final int ymin;
    private final int xmin;
    private final int ymax;
    private final int xmax;
    private final Instant lastUpdated;

    public TrackedObject(String id, String label, int ymin, int xmin, int ymax, int xmax, Instant lastUpdated) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = Objects.requireNonNull(label, "label");
        this.ymin = ymin;
        this.xmin = xmin;
        this.ymax = ymax;
        this.xmax = xmax;
        this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    static TrackedObject fromDetection(String id, Detection detection) {
        return new TrackedObject(id, detection.getLabel(),
            detection.getYmin(), detection.getXmin(), detection.getYmax(), detection.getXmax(),
            detection.getObservedAt());
    }

    /**
     * Same identity, box and label taken from the newer detection.
     */
    TrackedObject updatedWith(Detection detection) {
        return fromDetection(id, detection);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public int getYmin() {
        return ymin;
    }

    public int getXmin() {
        return xmin;
    }

    public int getYmax() {
        return ymax;
    }

    public int getXmax() {
        return xmax;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public double centerX() {
        return (xmin + xmax) / 2.0;
    }

    public double centerY() {
        return (ymin + ymax) / 2.0;
    }

    public Duration ageAt(Instant now) {
        return Duration.between(lastUpdated, now);
    }

    @Override
    public String toString() {
        return id + ":" + label + " [" + ymin + ", " + xmin + ", " + ymax + ", " + xmax + "]";
    }
}
