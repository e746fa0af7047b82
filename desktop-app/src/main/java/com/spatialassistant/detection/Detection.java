package com.spatialassistant.detection;

import java.time.Instant;
import java.util.Objects;

/**
 * One bounding box read from the model's transcript.
 * Coordinates are normalized to the 0-1000 range as [ymin, xmin, ymax, xmax].
 */
public final class Detection {
    private final String label;
    private final int ymin;
    private final int xmin;
    private final int ymax;
    private final int xmax;
    private final Instant observedAt;

    public Detection(String label, int ymin, int xmin, int ymax, int xmax, Instant observedAt) {
        this.label = Objects.requireNonNull(label, "label");
        this.ymin = ymin;
        this.xmin = xmin;
        this.ymax = ymax;
        this.xmax = xmax;
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt");
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

    public Instant getObservedAt() {
        return observedAt;
    }

    public double centerX() {
        return (xmin + xmax) / 2.0;
    }

    public double centerY() {
        return (ymin + ymax) / 2.0;
    }

    @Override
    public String toString() {
        return label + " [" + ymin + ", " + xmin + ", " + ymax + ", " + xmax + "]";
    }
}
