package com.spatialassistant.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Application configuration manager.
 * Loads configuration from config.properties with overrides from environment variables and system properties.
 */
public class AppConfig {
    private static final Logger LOG = LoggerFactory.getLogger(AppConfig.class);

    private static AppConfig instance;
    private final Properties properties;

    // Default values
    private static final String DEFAULT_ENDPOINT =
        "wss://generativelanguage.googleapis.com/ws/google.ai.generativelanguage.v1beta.GenerativeService.BidiGenerateContent";
    private static final String DEFAULT_MODEL = "gemini-2.5-flash-native-audio-preview-09-2025";
    private static final String DEFAULT_VOICE = "Kore";
    private static final int DEFAULT_CONNECTION_TIMEOUT = 10000;
    private static final int DEFAULT_TARGET_RATE = 16000;
    private static final int DEFAULT_CAPTURE_FRAME_MS = 100;
    private static final int DEFAULT_PLAYBACK_RATE = 24000;
    private static final long DEFAULT_VIDEO_INTERVAL_MS = 500;
    private static final String DEFAULT_VIDEO_SOURCE = "camera";
    private static final int DEFAULT_CAMERA_INDEX = 0;
    private static final int DEFAULT_VIDEO_MAX_WIDTH = 1280;
    private static final int DEFAULT_BUFFER_CHARS = 500;
    private static final int DEFAULT_MATCH_DISTANCE = 200;
    private static final long DEFAULT_TTL_MS = 3000;
    private static final long DEFAULT_SWEEP_INTERVAL_MS = 500;
    private static final int DEFAULT_INBOX_CAPACITY = 1024;
    private static final int DEFAULT_WINDOW_WIDTH = 1280;
    private static final int DEFAULT_WINDOW_HEIGHT = 760;

    public static final String DEFAULT_SYSTEM_INSTRUCTION =
        "You are a spatial reasoning expert.\n"
            + "Your task is to detect objects in the video stream and provide their locations using normalized bounding boxes.\n"
            + "A bounding box is a list of four numbers: [ymin, xmin, ymax, xmax] where each number is between 0 and 1000.\n"
            + "Always mention the labels of the objects you find and follow it with their box coordinates.\n"
            + "Example: \"I see a coffee cup at [200, 300, 450, 500] and a laptop at [600, 100, 950, 800].\"\n"
            + "Focus on responding naturally to the user while performing this visual detection.\n"
            + "Keep your verbal responses concise and always prioritize accuracy in coordinates.";

    private AppConfig() {
        properties = new Properties();
        loadConfiguration();
    }

    /**
     * Creates a configuration backed by the given properties only. No files or environment are consulted.
     */
    public AppConfig(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    /**
     * Get the singleton instance of AppConfig.
     */
    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = new AppConfig();
        }
        return instance;
    }

    /**
     * Load configuration from file, environment variables, or use defaults.
     * Priority: system properties > environment variables > config file > defaults
     */
    private void loadConfiguration() {
        try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.properties")) {
            if (resourceStream != null) {
                properties.load(resourceStream);
                LOG.info("Loaded configuration from classpath config.properties");
            }
        } catch (IOException e) {
            LOG.warn("Could not load config.properties from classpath: {}", e.getMessage());
        }

        Path[] configPaths = {
            Paths.get("config.properties"),
            Paths.get(System.getProperty("user.home"), ".spatialassistant", "config.properties"),
            Paths.get(System.getProperty("user.dir"), "config.properties")
        };

        for (Path configPath : configPaths) {
            if (Files.exists(configPath)) {
                try (InputStream fileStream = Files.newInputStream(configPath)) {
                    properties.load(fileStream);
                    LOG.info("Loaded configuration from: {}", configPath.toAbsolutePath());
                    break;
                } catch (IOException e) {
                    LOG.warn("Could not load config from {}: {}", configPath, e.getMessage());
                }
            }
        }

        String envApiKey = System.getenv("SPATIAL_ASSISTANT_API_KEY");
        if (envApiKey == null || envApiKey.isEmpty()) {
            envApiKey = System.getenv("GEMINI_API_KEY");
        }
        if (envApiKey != null && !envApiKey.isEmpty()) {
            properties.setProperty("api.key", envApiKey);
        }

        String envModel = System.getenv("SPATIAL_ASSISTANT_MODEL");
        if (envModel != null && !envModel.isEmpty()) {
            properties.setProperty("live.model", envModel);
            LOG.info("Overriding live.model with environment variable: {}", envModel);
        }

        String sysApiKey = System.getProperty("spatial.assistant.api.key");
        if (sysApiKey != null && !sysApiKey.isEmpty()) {
            properties.setProperty("api.key", sysApiKey);
        }

        String sysModel = System.getProperty("spatial.assistant.model");
        if (sysModel != null && !sysModel.isEmpty()) {
            properties.setProperty("live.model", sysModel);
            LOG.info("Overriding live.model with system property: {}", sysModel);
        }
    }

    /**
     * Get the streaming endpoint URL, without query string.
     */
    public String getLiveEndpoint() {
        return properties.getProperty("live.endpoint", DEFAULT_ENDPOINT);
    }

    /**
     * Get the API key (null if not configured).
     */
    public String getApiKey() {
        String key = properties.getProperty("api.key", "");
        return key.isEmpty() ? null : key;
    }

    public String getModel() {
        return properties.getProperty("live.model", DEFAULT_MODEL);
    }

    public String getVoice() {
        return properties.getProperty("live.voice", DEFAULT_VOICE);
    }

    public String getSystemInstruction() {
        return properties.getProperty("live.system.instruction", DEFAULT_SYSTEM_INSTRUCTION);
    }

    /**
     * Get the connection timeout in milliseconds.
     */
    public int getConnectionTimeout() {
        return getIntProperty("connection.timeout", DEFAULT_CONNECTION_TIMEOUT);
    }

    /**
     * Sample rate of outbound microphone audio.
     */
    public int getCaptureTargetRate() {
        return getIntProperty("capture.target.rate", DEFAULT_TARGET_RATE);
    }

    /**
     * Length of one microphone capture frame in milliseconds.
     */
    public int getCaptureFrameMillis() {
        return getIntProperty("capture.frame.ms", DEFAULT_CAPTURE_FRAME_MS);
    }

    /**
     * Sample rate the speaker line is opened at.
     */
    public int getPlaybackSampleRate() {
        return getIntProperty("playback.sample.rate", DEFAULT_PLAYBACK_RATE);
    }

    public long getVideoFrameIntervalMillis() {
        return getLongProperty("video.frame.interval.ms", DEFAULT_VIDEO_INTERVAL_MS);
    }

    /**
     * Where frames come from: {@code camera} or {@code screen}. Anything else falls back to the camera.
     */
    public String getVideoSource() {
        String value = properties.getProperty("video.source", DEFAULT_VIDEO_SOURCE).trim().toLowerCase(Locale.ROOT);
        if (!"camera".equals(value) && !"screen".equals(value)) {
            LOG.warn("Unknown video.source: {}, using {}", value, DEFAULT_VIDEO_SOURCE);
            return DEFAULT_VIDEO_SOURCE;
        }
        return value;
    }

    public int getCameraIndex() {
        return getIntProperty("video.camera.index", DEFAULT_CAMERA_INDEX);
    }

    /**
     * Frames wider than this are scaled down before encoding.
     */
    public int getVideoMaxWidth() {
        return getIntProperty("video.max.width", DEFAULT_VIDEO_MAX_WIDTH);
    }

    /**
     * Maximum number of characters kept in the detection parser's trailing buffer.
     */
    public int getDetectionBufferChars() {
        return getIntProperty("detection.buffer.chars", DEFAULT_BUFFER_CHARS);
    }

    /**
     * Center distance, in the 0-1000 box space, below which a detection updates an existing object.
     */
    public int getTrackerMatchDistance() {
        return getIntProperty("tracker.match.distance", DEFAULT_MATCH_DISTANCE);
    }

    public long getTrackerTtlMillis() {
        return getLongProperty("tracker.ttl.ms", DEFAULT_TTL_MS);
    }

    public long getTrackerSweepIntervalMillis() {
        return getLongProperty("tracker.sweep.interval.ms", DEFAULT_SWEEP_INTERVAL_MS);
    }

    public int getInboxCapacity() {
        return getIntProperty("session.inbox.capacity", DEFAULT_INBOX_CAPACITY);
    }

    /**
     * Get the window width.
     */
    public int getWindowWidth() {
        return getIntProperty("window.width", DEFAULT_WINDOW_WIDTH);
    }

    /**
     * Get the window height.
     */
    public int getWindowHeight() {
        return getIntProperty("window.height", DEFAULT_WINDOW_HEIGHT);
    }

    /**
     * Get an integer property with a default value.
     */
    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Get a property value.
     */
    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    /**
     * Set a property value (runtime override).
     */
    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    /**
     * Log current configuration (for debugging).
     */
    public void logConfiguration() {
        LOG.info("Current configuration:");
        LOG.info("  live.endpoint: {}", getLiveEndpoint());
        LOG.info("  live.model: {}", getModel());
        LOG.info("  api.key: {}", getApiKey() != null ? "***" : "not set");
        LOG.info("  capture.target.rate: {}", getCaptureTargetRate());
        LOG.info("  playback.sample.rate: {}", getPlaybackSampleRate());
        LOG.info("  video: source={}, interval={}ms, maxWidth={}",
            getVideoSource(), getVideoFrameIntervalMillis(), getVideoMaxWidth());
        LOG.info("  tracker: distance={}, ttl={}ms, sweep={}ms",
            getTrackerMatchDistance(), getTrackerTtlMillis(), getTrackerSweepIntervalMillis());
    }
}
