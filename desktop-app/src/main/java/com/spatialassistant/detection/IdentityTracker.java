package com.spatialassistant.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Keeps stable identities for detections arriving over time.
 *
 * <p>Each detection is matched greedily, in arrival order, against the nearest tracked object
 * with the same label (case-insensitive). An object already updated earlier in a batch stays
 * a valid target for later detections of that batch. Batch updates and expiry sweeps are
 * serialized on this tracker's monitor.
 */
public class IdentityTracker {
    private static final Logger LOG = LoggerFactory.getLogger(IdentityTracker.class);

    public static final double DEFAULT_MATCH_DISTANCE = 200.0;
    public static final Duration DEFAULT_TTL = Duration.ofMillis(3000);

    private final List<TrackedObject> objects = new ArrayList<>();
    private final double matchDistance;
    private final Duration ttl;
    private long nextId = 1;

    public IdentityTracker() {
        this(DEFAULT_MATCH_DISTANCE, DEFAULT_TTL);
    }

    public IdentityTracker(double matchDistance, Duration ttl) {
        this.matchDistance = matchDistance;
        this.ttl = ttl;
    }

    /**
     * Reconciles a batch of detections and returns the tracked set afterwards.
     */
    public synchronized List<TrackedObject> update(List<Detection> detections) {
        for (Detection detection : detections) {
            int bestIndex = findNearest(detection);
            if (bestIndex >= 0) {
                objects.set(bestIndex, objects.get(bestIndex).updatedWith(detection));
            } else {
                TrackedObject created = TrackedObject.fromDetection(generateId(), detection);
                objects.add(created);
                LOG.debug("Tracking new object {}", created);
            }
        }
        return snapshotLocked();
    }

    private int findNearest(Detection detection) {
        String label = detection.getLabel().toLowerCase(Locale.ROOT);
        int bestIndex = -1;
        double bestDistance = matchDistance;
        for (int i = 0; i < objects.size(); i++) {
            TrackedObject candidate = objects.get(i);
            if (!candidate.getLabel().toLowerCase(Locale.ROOT).equals(label)) {
                continue;
            }
            double distance = centerDistance(candidate, detection);
            if (distance < bestDistance) {
                bestDistance = distance;
                bestIndex = i;
            }
        }
        return bestIndex;
    }

    static double centerDistance(TrackedObject object, Detection detection) {
        double dx = object.centerX() - detection.centerX();
        double dy = object.centerY() - detection.centerY();
        return Math.sqrt(dx * dx + dy * dy);
    }

    private String generateId() {
        return "obj-" + (nextId++);
    }

    /**
     * Removes objects not updated for longer than the TTL.
     *
     * @return true if anything was removed
     */
    public synchronized boolean pruneExpired(Instant now) {
        boolean removed = false;
        Iterator<TrackedObject> it = objects.iterator();
        while (it.hasNext()) {
            TrackedObject object = it.next();
            if (object.ageAt(now).compareTo(ttl) > 0) {
                it.remove();
                removed = true;
                LOG.debug("Expired tracked object {}", object);
            }
        }
        return removed;
    }

    /**
     * Immutable copy of the tracked set.
     */
    public synchronized List<TrackedObject> snapshot() {
        return snapshotLocked();
    }

    private List<TrackedObject> snapshotLocked() {
        return Collections.unmodifiableList(new ArrayList<>(objects));
    }

    /**
     * Drops every tracked object. Ids handed out earlier are never issued again.
     */
    public synchronized void clear() {
        objects.clear();
    }

    public synchronized int size() {
        return objects.size();
    }
}
