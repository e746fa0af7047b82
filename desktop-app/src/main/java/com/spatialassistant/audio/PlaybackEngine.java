package com.spatialassistant.audio;

import com.spatialassistant.session.DeviceAcquisitionException;

/**
 * An output device that can start audio at a precise time on its own monotonic clock.
 */
public interface PlaybackEngine {

    /**
     * A segment handed to the engine.
     */
    interface Source {
        /**
         * Silences the source immediately. No-op once it has finished or been stopped.
         */
        void stop();

        boolean isFinished();
    }

    void open() throws DeviceAcquisitionException;

    /**
     * Current engine time in seconds. Never decreases while the engine is open.
     */
    double currentTime();

    /**
     * Schedules a segment.
     *
     * @param onEnded run once when the segment plays to the end; not run if it is stopped.
     *                Called without any engine lock held.
     */
    Source play(AudioSegment segment, double startTime, Runnable onEnded);

    void close();
}
