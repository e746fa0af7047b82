package com.spatialassistant.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gapless scheduler for streamed model speech with barge-in support.
 *
 * <p>Segments are queued back to back on the engine clock: each one starts where the previous
 * one ends, or immediately if the queue has drained. Active segments live in a registry owned
 * by this scheduler; natural completion and cancellation both remove entries through it.
 *
 * <p>All methods are synchronized. The engine reports completion without holding its own lock,
 * so callbacks can re-enter the scheduler safely.
 */
public class PlaybackScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(PlaybackScheduler.class);

    private final PlaybackEngine engine;
    private final Map<Long, PlaybackEngine.Source> active = new LinkedHashMap<>();
    private double nextStartTime;
    private long nextHandleId = 1;

    public PlaybackScheduler(PlaybackEngine engine) {
        this.engine = engine;
    }

    /**
     * Queues a segment right after everything already scheduled.
     */
    public synchronized PlaybackHandle schedule(AudioSegment segment) {
        double startTime = Math.max(nextStartTime, engine.currentTime());
        PlaybackHandle handle = new PlaybackHandle(nextHandleId++, startTime, segment.getDurationSeconds());
        PlaybackEngine.Source source = engine.play(segment, startTime, () -> onEnded(handle));
        active.put(handle.getId(), source);
        nextStartTime = handle.getEndTime();
        LOG.trace("Scheduled {}", handle);
        return handle;
    }

    private synchronized void onEnded(PlaybackHandle handle) {
        active.remove(handle.getId());
    }

    /**
     * Barge-in: silences everything and makes the next segment start as soon as it arrives.
     *
     * @return number of segments that were stopped
     */
    public synchronized int interrupt() {
        List<PlaybackEngine.Source> sources = new ArrayList<>(active.values());
        active.clear();
        for (PlaybackEngine.Source source : sources) {
            source.stop();
        }
        nextStartTime = engine.currentTime();
        if (!sources.isEmpty()) {
            LOG.debug("Interrupted {} active segment(s)", sources.size());
        }
        return sources.size();
    }

    /**
     * Stops all playback during session teardown.
     */
    public synchronized void stopAll() {
        interrupt();
    }

    /**
     * Stops one segment. No-op if it already finished or was stopped.
     */
    public synchronized void cancel(PlaybackHandle handle) {
        PlaybackEngine.Source source = active.remove(handle.getId());
        if (source != null) {
            source.stop();
        }
    }

    public synchronized boolean isActive(PlaybackHandle handle) {
        return active.containsKey(handle.getId());
    }

    public synchronized int getActiveCount() {
        return active.size();
    }

    public synchronized double getNextStartTime() {
        return nextStartTime;
    }
}
