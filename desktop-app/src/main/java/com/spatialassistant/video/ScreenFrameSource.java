package com.spatialassistant.video;

import com.spatialassistant.session.DeviceAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTException;
import java.awt.Dimension;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.io.IOException;
import java.time.Clock;

/**
 * Captures the primary screen with {@link Robot} and encodes it as JPEG.
 * Frames wider than the configured maximum are scaled down, keeping the aspect ratio.
 */
public class ScreenFrameSource implements VideoFrameSource {
    private static final Logger LOG = LoggerFactory.getLogger(ScreenFrameSource.class);

    private final int maxWidth;
    private final Clock clock;
    private Robot robot;
    private Rectangle area;

    public ScreenFrameSource(int maxWidth) {
        this(maxWidth, Clock.systemUTC());
    }

    public ScreenFrameSource(int maxWidth, Clock clock) {
        this.maxWidth = maxWidth;
        this.clock = clock;
    }

    @Override
    public synchronized void open() throws DeviceAcquisitionException {
        if (GraphicsEnvironment.isHeadless()) {
            throw new DeviceAcquisitionException("Screen capture is not available in a headless environment");
        }
        try {
            robot = new Robot();
        } catch (AWTException | SecurityException e) {
            throw new DeviceAcquisitionException("Screen capture not permitted: " + e.getMessage(), e);
        }
        Dimension size = Toolkit.getDefaultToolkit().getScreenSize();
        area = new Rectangle(size);
        LOG.info("Screen capture opened: {}x{}", size.width, size.height);
    }

    @Override
    public synchronized VideoFrame captureFrame() throws IOException {
        if (robot == null) {
            return null;
        }
        return FrameEncoding.toFrame(robot.createScreenCapture(area), maxWidth, clock.instant());
    }

    @Override
    public synchronized void close() {
        robot = null;
        area = null;
    }
}
