package com.spatialassistant.audio;

/**
 * Outbound microphone audio, already in the wire encoding.
 */
public final class AudioChunk {
    private final byte[] data;
    private final int sampleRate;

    public AudioChunk(byte[] data, int sampleRate) {
        this.data = data;
        this.sampleRate = sampleRate;
    }

    public byte[] getData() {
        return data;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public String getMimeType() {
        return "audio/pcm;rate=" + sampleRate;
    }
}
