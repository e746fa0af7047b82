package com.spatialassistant.audio;

/**
 * Streaming linear-interpolation resampler for microphone frames.
 *
 * <p>Takes mono PCM16 LE at the device's native rate and returns mono PCM16 LE at the
 * target rate. Runs on the capture thread, so it does no I/O, takes no locks and only
 * allocates the returned array; the scratch buffer grows when a larger frame first shows up.
 * The interpolation phase and the last input sample carry over between frames, so
 * consecutive frames resample as one continuous signal.
 *
 * <p>One instance per capture stream; not thread-safe.
 */
public final class CaptureResampler {
    private static final byte[] EMPTY = new byte[0];

    private final int inputRate;
    private final int outputRate;
    private final double step;

    // next output position, in input samples relative to the current frame; -1 is the previous frame's last sample
    private double position;
    private int previous;
    private byte[] scratch;

    public CaptureResampler(int inputRate, int outputRate, int expectedFrameSamples) {
        if (inputRate <= 0 || outputRate <= 0) {
            throw new IllegalArgumentException("rates must be positive: " + inputRate + " -> " + outputRate);
        }
        this.inputRate = inputRate;
        this.outputRate = outputRate;
        this.step = (double) inputRate / outputRate;
        this.scratch = new byte[maxOutputSamples(Math.max(expectedFrameSamples, 1)) * PcmCodec.BYTES_PER_SAMPLE];
    }

    /**
     * Resamples one frame.
     *
     * @param pcm    native-rate mono PCM16 LE
     * @param length number of valid bytes in {@code pcm}
     * @return target-rate mono PCM16 LE, possibly empty
     */
    public byte[] process(byte[] pcm, int length) {
        int samples = length / PcmCodec.BYTES_PER_SAMPLE;
        if (samples == 0) {
            return EMPTY;
        }
        int capacity = maxOutputSamples(samples) * PcmCodec.BYTES_PER_SAMPLE;
        if (scratch.length < capacity) {
            scratch = new byte[capacity];
        }

        int written = 0;
        int last = samples - 1;
        while (position <= last) {
            int index = (int) Math.floor(position);
            double frac = position - index;
            int a = index < 0 ? previous : PcmCodec.readSample(pcm, index * PcmCodec.BYTES_PER_SAMPLE);
            int value = a;
            if (frac > 0) {
                int b = PcmCodec.readSample(pcm, (index + 1) * PcmCodec.BYTES_PER_SAMPLE);
                value = (int) Math.round(a + (b - a) * frac);
            }
            int offset = written * PcmCodec.BYTES_PER_SAMPLE;
            scratch[offset] = (byte) value;
            scratch[offset + 1] = (byte) (value >> 8);
            written++;
            position += step;
        }
        position -= samples;
        previous = PcmCodec.readSample(pcm, last * PcmCodec.BYTES_PER_SAMPLE);

        byte[] out = new byte[written * PcmCodec.BYTES_PER_SAMPLE];
        System.arraycopy(scratch, 0, out, 0, out.length);
        return out;
    }

    private int maxOutputSamples(int inputSamples) {
        return (int) Math.ceil((inputSamples + 1) / step) + 1;
    }

    /**
     * Forgets carried phase, for reuse on a new capture stream.
     */
    public void reset() {
        position = 0;
        previous = 0;
    }

    public int getInputRate() {
        return inputRate;
    }

    public int getOutputRate() {
        return outputRate;
    }
}
