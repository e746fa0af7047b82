package com.spatialassistant.video;

import com.spatialassistant.session.DeviceAcquisitionException;

import java.io.IOException;

/**
 * Supplies encoded frames on demand.
 */
public interface VideoFrameSource {

    void open() throws DeviceAcquisitionException;

    /**
     * Grabs and encodes the current picture.
     *
     * @return the frame, or null if nothing is available yet
     */
    VideoFrame captureFrame() throws IOException;

    void close();
}
