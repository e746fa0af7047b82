package com.spatialassistant.audio;

import org.junit.Test;

import static org.junit.Assert.*;

public class AudioSegmentTest {

    @Test
    public void testDecodesMonoPcm() throws AudioDecodeException {
        // 0, 16384, -32768 little-endian
        byte[] pcm = {0, 0, 0, 0x40, 0, (byte) 0x80};

        AudioSegment segment = AudioSegment.decode(pcm, 24000, 1);

        assertEquals(3, segment.getFrameCount());
        assertEquals(24000, segment.getSampleRate());
        assertEquals(0f, segment.getSamples()[0], 1e-6f);
        assertEquals(0.5f, segment.getSamples()[1], 1e-6f);
        assertEquals(-1f, segment.getSamples()[2], 1e-6f);
        assertEquals(3.0 / 24000, segment.getDurationSeconds(), 1e-12);
    }

    @Test
    public void testAveragesStereoToMono() throws AudioDecodeException {
        // left 16384, right 0
        byte[] pcm = {0, 0x40, 0, 0};

        AudioSegment segment = AudioSegment.decode(pcm, 24000, 2);

        assertEquals(1, segment.getFrameCount());
        assertEquals(0.25f, segment.getSamples()[0], 1e-6f);
    }

    @Test(expected = AudioDecodeException.class)
    public void testRejectsEmptyPayload() throws AudioDecodeException {
        AudioSegment.decode(new byte[0], 24000, 1);
    }

    @Test(expected = AudioDecodeException.class)
    public void testRejectsPartialFrame() throws AudioDecodeException {
        AudioSegment.decode(new byte[3], 24000, 1);
    }

    @Test(expected = AudioDecodeException.class)
    public void testRejectsPartialStereoFrame() throws AudioDecodeException {
        AudioSegment.decode(new byte[6], 24000, 2);
    }

    @Test(expected = AudioDecodeException.class)
    public void testRejectsZeroRate() throws AudioDecodeException {
        AudioSegment.decode(new byte[4], 0, 1);
    }

    @Test(expected = AudioDecodeException.class)
    public void testRejectsZeroChannels() throws AudioDecodeException {
        AudioSegment.decode(new byte[4], 24000, 0);
    }
}
