package com.spatialassistant.config;

import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.*;

public class AppConfigTest {

    @Test
    public void testDefaultsWhenNothingConfigured() {
        AppConfig config = new AppConfig(new Properties());

        assertNull(config.getApiKey());
        assertEquals("Kore", config.getVoice());
        assertEquals(16000, config.getCaptureTargetRate());
        assertEquals(24000, config.getPlaybackSampleRate());
        assertEquals(500, config.getDetectionBufferChars());
        assertEquals(200, config.getTrackerMatchDistance());
        assertEquals(3000L, config.getTrackerTtlMillis());
        assertEquals(500L, config.getTrackerSweepIntervalMillis());
        assertEquals(500L, config.getVideoFrameIntervalMillis());
        assertEquals(1024, config.getInboxCapacity());
        assertEquals(AppConfig.DEFAULT_SYSTEM_INSTRUCTION, config.getSystemInstruction());
        assertTrue(config.getLiveEndpoint().startsWith("wss://"));
    }

    @Test
    public void testOverridesFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("api.key", "secret");
        properties.setProperty("live.model", "other-model");
        properties.setProperty("tracker.ttl.ms", "1500");

        AppConfig config = new AppConfig(properties);

        assertEquals("secret", config.getApiKey());
        assertEquals("other-model", config.getModel());
        assertEquals(1500L, config.getTrackerTtlMillis());
    }

    @Test
    public void testVideoSourceSelection() {
        Properties properties = new Properties();
        AppConfig config = new AppConfig(properties);
        assertEquals("camera", config.getVideoSource());
        assertEquals(0, config.getCameraIndex());
        assertEquals(1280, config.getVideoMaxWidth());

        config.setProperty("video.source", " Screen ");
        assertEquals("screen", config.getVideoSource());

        config.setProperty("video.source", "webcam2");
        assertEquals("camera", config.getVideoSource());
    }

    @Test
    public void testInvalidNumberFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty("capture.target.rate", "sixteen");
        properties.setProperty("tracker.ttl.ms", "");

        AppConfig config = new AppConfig(properties);

        assertEquals(16000, config.getCaptureTargetRate());
        assertEquals(3000L, config.getTrackerTtlMillis());
    }

    @Test
    public void testSetPropertyIsVisibleToGetters() {
        AppConfig config = new AppConfig(new Properties());

        config.setProperty("detection.buffer.chars", "250");

        assertEquals(250, config.getDetectionBufferChars());
        assertEquals("250", config.getProperty("detection.buffer.chars", null));
    }
}
