package com.spatialassistant.audio;

/**
 * A decoded block of model speech, mono float PCM.
 */
public final class AudioSegment {
    private final float[] samples;
    private final int sampleRate;

    public AudioSegment(float[] samples, int sampleRate) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        this.samples = samples;
        this.sampleRate = sampleRate;
    }

    /**
     * Decodes raw PCM16 little-endian bytes as delivered by the channel.
     */
    public static AudioSegment decode(byte[] pcm, int sampleRate, int channels) throws AudioDecodeException {
        if (pcm == null || pcm.length == 0) {
            throw new AudioDecodeException("empty audio payload");
        }
        if (sampleRate <= 0) {
            throw new AudioDecodeException("invalid sample rate: " + sampleRate);
        }
        if (channels <= 0) {
            throw new AudioDecodeException("invalid channel count: " + channels);
        }
        int frameBytes = channels * PcmCodec.BYTES_PER_SAMPLE;
        if (pcm.length % frameBytes != 0) {
            throw new AudioDecodeException("payload of " + pcm.length
                + " bytes is not a whole number of " + frameBytes + "-byte frames");
        }
        return new AudioSegment(PcmCodec.toMonoFloat(pcm, channels), sampleRate);
    }

    public float[] getSamples() {
        return samples;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public int getFrameCount() {
        return samples.length;
    }

    public double getDurationSeconds() {
        return (double) samples.length / sampleRate;
    }
}
