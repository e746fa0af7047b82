package com.spatialassistant.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Incremental parser for bounding boxes embedded in streamed model text.
 *
 * <p>Deltas are appended to a bounded trailing buffer and the whole buffer is rescanned on
 * every call, so a box whose characters arrive across several deltas is found as soon as the
 * last piece lands. The same box is reported again on later scans while it stays inside the
 * buffer; reconciling repeats is the tracker's job.
 *
 * <p>Not thread-safe. The session dispatcher is the only caller.
 */
public class DetectionParser {
    private static final Logger LOG = LoggerFactory.getLogger(DetectionParser.class);

    public static final int DEFAULT_BUFFER_CHARS = 500;
    public static final String DEFAULT_LABEL = "Object";
    public static final int MAX_COORDINATE = 1000;

    // label run, then [ymin, xmin, ymax, xmax]; separators are a comma or plain whitespace
    private static final String SEPARATOR = "(?:\\s*,\\s*|\\s+)";
    private static final Pattern BOX_PATTERN = Pattern.compile(
        "([\\p{L}\\s]+)?\\[\\s*(\\d+)" + SEPARATOR + "(\\d+)" + SEPARATOR + "(\\d+)" + SEPARATOR + "(\\d+)\\s*\\]");

    private final StringBuilder buffer = new StringBuilder();
    private final int maxBufferChars;
    private final Clock clock;

    public DetectionParser() {
        this(DEFAULT_BUFFER_CHARS, Clock.systemUTC());
    }

    public DetectionParser(int maxBufferChars, Clock clock) {
        if (maxBufferChars <= 0) {
            throw new IllegalArgumentException("maxBufferChars must be positive: " + maxBufferChars);
        }
        this.maxBufferChars = maxBufferChars;
        this.clock = clock;
    }

    /**
     * Appends a transcript delta and returns every box currently visible in the trailing buffer.
     */
    public List<Detection> parse(String delta) {
        if (delta != null && !delta.isEmpty()) {
            buffer.append(delta);
            int overflow = buffer.length() - maxBufferChars;
            if (overflow > 0) {
                buffer.delete(0, overflow);
            }
        }
        return scan(clock.instant());
    }

    private List<Detection> scan(Instant observedAt) {
        List<Detection> found = new ArrayList<>();
        Matcher matcher = BOX_PATTERN.matcher(buffer);
        while (matcher.find()) {
            try {
                int ymin = parseCoordinate(matcher.group(2));
                int xmin = parseCoordinate(matcher.group(3));
                int ymax = parseCoordinate(matcher.group(4));
                int xmax = parseCoordinate(matcher.group(5));
                found.add(new Detection(extractLabel(matcher.group(1)), ymin, xmin, ymax, xmax, observedAt));
            } catch (NumberFormatException e) {
                LOG.debug("Discarding malformed box '{}': {}", matcher.group(), e.getMessage());
            }
        }
        return found;
    }

    private static int parseCoordinate(String text) {
        int value = Integer.parseInt(text);
        if (value < 0 || value > MAX_COORDINATE) {
            throw new NumberFormatException("coordinate out of range: " + value);
        }
        return value;
    }

    /**
     * Last whitespace-delimited token before the bracket, or the default label.
     */
    static String extractLabel(String rawLabel) {
        if (rawLabel == null) {
            return DEFAULT_LABEL;
        }
        String trimmed = rawLabel.trim();
        if (trimmed.isEmpty()) {
            return DEFAULT_LABEL;
        }
        String[] tokens = trimmed.split("\\s+");
        return tokens[tokens.length - 1];
    }

    /**
     * Drops all buffered text.
     */
    public void reset() {
        buffer.setLength(0);
    }

    int bufferedLength() {
        return buffer.length();
    }

    String bufferedText() {
        return buffer.toString();
    }
}
