package com.spatialassistant.video;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Iterator;

/**
 * Scaling and JPEG encoding shared by the frame sources.
 */
final class FrameEncoding {
    static final String MIME_TYPE = "image/jpeg";
    static final float JPEG_QUALITY = 0.85f;

    private FrameEncoding() {
    }

    /**
     * Copies the picture into a new RGB image no wider than {@code maxWidth}, keeping the aspect ratio.
     * The result never shares pixels with the source.
     */
    static BufferedImage toRgb(BufferedImage source, int maxWidth) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (width > maxWidth) {
            height = Math.max(1, (int) Math.round(height * (maxWidth / (double) width)));
            width = maxWidth;
        }
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    static byte[] encodeJpeg(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }

    /**
     * Scales, encodes and wraps a captured picture, keeping the scaled image for preview.
     */
    static VideoFrame toFrame(BufferedImage captured, int maxWidth, Instant capturedAt) throws IOException {
        BufferedImage image = toRgb(captured, maxWidth);
        return new VideoFrame(encodeJpeg(image), MIME_TYPE, image.getWidth(), image.getHeight(), capturedAt, image);
    }
}
