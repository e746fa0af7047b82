package com.spatialassistant.video;

import com.spatialassistant.session.DeviceAcquisitionException;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.bytedeco.javacv.OpenCVFrameGrabber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Clock;

/**
 * Grabs frames from a local camera through JavaCV and encodes them as JPEG.
 */
public class CameraFrameSource implements VideoFrameSource {
    private static final Logger LOG = LoggerFactory.getLogger(CameraFrameSource.class);

    private final FrameGrabber grabber;
    private final int maxWidth;
    private final Clock clock;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private boolean started;

    public CameraFrameSource(int deviceIndex, int maxWidth) {
        this(new OpenCVFrameGrabber(deviceIndex), maxWidth, Clock.systemUTC());
    }

    public CameraFrameSource(FrameGrabber grabber, int maxWidth, Clock clock) {
        this.grabber = grabber;
        this.maxWidth = maxWidth;
        this.clock = clock;
    }

    @Override
    public synchronized void open() throws DeviceAcquisitionException {
        if (started) {
            return;
        }
        try {
            grabber.start();
        } catch (FrameGrabber.Exception | RuntimeException e) {
            release();
            throw new DeviceAcquisitionException("Camera unavailable: " + e.getMessage(), e);
        }
        started = true;
        LOG.info("Camera opened: {}x{}", grabber.getImageWidth(), grabber.getImageHeight());
    }

    @Override
    public synchronized VideoFrame captureFrame() throws IOException {
        if (!started) {
            return null;
        }
        Frame frame = grabber.grab();
        if (frame == null || frame.image == null) {
            return null;
        }
        // the converted image reuses the grabber's buffer until the next grab
        BufferedImage picture = converter.convert(frame);
        if (picture == null) {
            return null;
        }
        return FrameEncoding.toFrame(picture, maxWidth, clock.instant());
    }

    @Override
    public synchronized void close() {
        if (!started) {
            return;
        }
        started = false;
        try {
            grabber.stop();
        } catch (FrameGrabber.Exception e) {
            LOG.warn("Failed to stop camera: {}", e.getMessage());
        }
        release();
        LOG.info("Camera closed");
    }

    private void release() {
        try {
            grabber.release();
        } catch (FrameGrabber.Exception e) {
            LOG.warn("Failed to release camera: {}", e.getMessage());
        }
    }
}
