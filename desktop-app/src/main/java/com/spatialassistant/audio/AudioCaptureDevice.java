package com.spatialassistant.audio;

import com.spatialassistant.session.DeviceAcquisitionException;

/**
 * A microphone that delivers mono PCM16 LE frames at its native rate.
 */
public interface AudioCaptureDevice {

    interface FrameListener {
        /**
         * Called on the capture thread. Must return quickly and never block.
         */
        void onFrame(byte[] pcm, int length, int sampleRate);
    }

    /**
     * Opens the device without starting delivery.
     *
     * @return the native sample rate frames will arrive at
     */
    int acquire() throws DeviceAcquisitionException;

    /**
     * Starts delivering frames to the listener.
     */
    void start(FrameListener listener);

    /**
     * Stops delivery and closes the device. Safe to call when not acquired.
     */
    void release();
}
