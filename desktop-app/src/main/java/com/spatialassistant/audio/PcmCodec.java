package com.spatialassistant.audio;

/**
 * Conversions between 16-bit little-endian PCM bytes and normalized float samples.
 */
public final class PcmCodec {
    public static final int BYTES_PER_SAMPLE = 2;

    private PcmCodec() {
    }

    /**
     * Reads one signed 16-bit little-endian sample starting at the given byte offset.
     */
    public static int readSample(byte[] pcm, int offset) {
        // high byte keeps its sign
        return (pcm[offset] & 0xFF) | (pcm[offset + 1] << 8);
    }

    /**
     * Writes one sample in [-1, 1] as signed 16-bit little-endian, clamping out-of-range input.
     */
    public static void writeSample(byte[] pcm, int offset, float sample) {
        float s = Math.max(-1f, Math.min(1f, sample));
        int value = s < 0 ? (int) (s * 32768f) : (int) (s * 32767f);
        pcm[offset] = (byte) value;
        pcm[offset + 1] = (byte) (value >> 8);
    }

    /**
     * Decodes interleaved PCM16 LE frames into mono floats, averaging channels.
     */
    public static float[] toMonoFloat(byte[] pcm, int channels) {
        int frameBytes = channels * BYTES_PER_SAMPLE;
        int frames = pcm.length / frameBytes;
        float[] out = new float[frames];
        for (int f = 0; f < frames; f++) {
            int base = f * frameBytes;
            float sum = 0f;
            for (int c = 0; c < channels; c++) {
                sum += readSample(pcm, base + c * BYTES_PER_SAMPLE) / 32768f;
            }
            out[f] = sum / channels;
        }
        return out;
    }

    /**
     * Encodes floats as PCM16 LE.
     */
    public static byte[] toPcm16(float[] samples, int length) {
        byte[] out = new byte[length * BYTES_PER_SAMPLE];
        for (int i = 0; i < length; i++) {
            writeSample(out, i * BYTES_PER_SAMPLE, samples[i]);
        }
        return out;
    }

    /**
     * One-shot linear interpolation of a whole buffer to another rate.
     */
    public static float[] resampleLinear(float[] input, int inputRate, int outputRate) {
        if (inputRate == outputRate || input.length == 0) {
            return input;
        }
        double ratio = (double) inputRate / outputRate;
        int outLength = (int) Math.floor(input.length / ratio);
        float[] out = new float[outLength];
        for (int i = 0; i < outLength; i++) {
            double pos = i * ratio;
            int index = (int) pos;
            double frac = pos - index;
            float a = input[index];
            float b = index + 1 < input.length ? input[index + 1] : a;
            out[i] = (float) (a + (b - a) * frac);
        }
        return out;
    }
}
