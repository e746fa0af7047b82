package com.spatialassistant.video;

import com.spatialassistant.session.DeviceAcquisitionException;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.Assert.*;

public class CameraFrameSourceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T10:00:00Z"), ZoneOffset.UTC);

    /**
     * Grabber with no device behind it; records the lifecycle calls it receives.
     */
    private static class RecordingGrabber extends FrameGrabber {
        boolean failStart;
        int starts;
        int stops;
        int releases;
        int grabs;

        @Override
        public void start() throws Exception {
            starts++;
            if (failStart) {
                throw new Exception("no camera at index 0");
            }
        }

        @Override
        public void stop() {
            stops++;
        }

        @Override
        public void trigger() {
        }

        @Override
        public Frame grab() {
            grabs++;
            return null;
        }

        @Override
        public void release() {
            releases++;
        }
    }

    @Test
    public void testOpenFailureIsDeviceAcquisitionFailure() {
        RecordingGrabber grabber = new RecordingGrabber();
        grabber.failStart = true;
        CameraFrameSource source = new CameraFrameSource(grabber, 1280, CLOCK);

        try {
            source.open();
            fail("expected DeviceAcquisitionException");
        } catch (DeviceAcquisitionException e) {
            assertTrue(e.getMessage().contains("Camera unavailable"));
        }
        assertEquals(1, grabber.releases);
    }

    @Test
    public void testCaptureBeforeOpenReturnsNothing() throws Exception {
        RecordingGrabber grabber = new RecordingGrabber();
        CameraFrameSource source = new CameraFrameSource(grabber, 1280, CLOCK);

        assertNull(source.captureFrame());
        assertEquals(0, grabber.grabs);
    }

    @Test
    public void testEmptyGrabYieldsNoFrame() throws Exception {
        RecordingGrabber grabber = new RecordingGrabber();
        CameraFrameSource source = new CameraFrameSource(grabber, 1280, CLOCK);
        source.open();

        assertNull(source.captureFrame());
        assertEquals(1, grabber.grabs);
    }

    @Test
    public void testCloseStopsAndReleasesOnce() throws Exception {
        RecordingGrabber grabber = new RecordingGrabber();
        CameraFrameSource source = new CameraFrameSource(grabber, 1280, CLOCK);
        source.open();
        source.open();

        source.close();
        source.close();

        assertEquals(1, grabber.starts);
        assertEquals(1, grabber.stops);
        assertEquals(1, grabber.releases);
        assertNull(source.captureFrame());
    }
}
