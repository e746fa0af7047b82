package com.spatialassistant.video;

import java.awt.image.BufferedImage;
import java.time.Instant;

/**
 * One encoded still image sent to the model. Sources may also attach the decoded picture
 * for local preview; it is never sent.
 */
public final class VideoFrame {
    private final byte[] data;
    private final String mimeType;
    private final int width;
    private final int height;
    private final Instant capturedAt;
    private final BufferedImage image;

    public VideoFrame(byte[] data, String mimeType, int width, int height, Instant capturedAt) {
        this(data, mimeType, width, height, capturedAt, null);
    }

    public VideoFrame(byte[] data, String mimeType, int width, int height, Instant capturedAt, BufferedImage image) {
        this.data = data;
        this.mimeType = mimeType;
        this.width = width;
        this.height = height;
        this.capturedAt = capturedAt;
        this.image = image;
    }

    public byte[] getData() {
        return data;
    }

    public String getMimeType() {
        return mimeType;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    /**
     * The picture the data was encoded from, or null if the source does not keep it.
     */
    public BufferedImage getImage() {
        return image;
    }
}
