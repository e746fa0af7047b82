package com.spatialassistant.transport;

/**
 * Something the remote side reported.
 */
public final class ChannelEvent {

    public enum Type {
        OPENED,
        OUTPUT_TRANSCRIPTION,
        INPUT_TRANSCRIPTION,
        TURN_COMPLETE,
        AUDIO_SEGMENT,
        INTERRUPTED,
        ERROR,
        CLOSED
    }

    private static final ChannelEvent OPENED = new ChannelEvent(Type.OPENED, null, null, 0, 0);
    private static final ChannelEvent TURN_COMPLETE = new ChannelEvent(Type.TURN_COMPLETE, null, null, 0, 0);
    private static final ChannelEvent INTERRUPTED = new ChannelEvent(Type.INTERRUPTED, null, null, 0, 0);
    private static final ChannelEvent CLOSED = new ChannelEvent(Type.CLOSED, null, null, 0, 0);

    private final Type type;
    private final String text;
    private final byte[] audio;
    private final int sampleRate;
    private final int channels;

    private ChannelEvent(Type type, String text, byte[] audio, int sampleRate, int channels) {
        this.type = type;
        this.text = text;
        this.audio = audio;
        this.sampleRate = sampleRate;
        this.channels = channels;
    }

    public static ChannelEvent opened() {
        return OPENED;
    }

    public static ChannelEvent outputTranscription(String text) {
        return new ChannelEvent(Type.OUTPUT_TRANSCRIPTION, text, null, 0, 0);
    }

    public static ChannelEvent inputTranscription(String text) {
        return new ChannelEvent(Type.INPUT_TRANSCRIPTION, text, null, 0, 0);
    }

    public static ChannelEvent turnComplete() {
        return TURN_COMPLETE;
    }

    /**
     * Raw PCM16 LE model speech.
     */
    public static ChannelEvent audioSegment(byte[] audio, int sampleRate, int channels) {
        return new ChannelEvent(Type.AUDIO_SEGMENT, null, audio, sampleRate, channels);
    }

    public static ChannelEvent interrupted() {
        return INTERRUPTED;
    }

    public static ChannelEvent error(String detail) {
        return new ChannelEvent(Type.ERROR, detail, null, 0, 0);
    }

    public static ChannelEvent closed() {
        return CLOSED;
    }

    public Type getType() {
        return type;
    }

    /**
     * Transcript delta for transcription events, detail for errors, otherwise null.
     */
    public String getText() {
        return text;
    }

    public byte[] getAudio() {
        return audio;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public int getChannels() {
        return channels;
    }

    @Override
    public String toString() {
        switch (type) {
            case OUTPUT_TRANSCRIPTION:
            case INPUT_TRANSCRIPTION:
            case ERROR:
                return type + "(" + text + ")";
            case AUDIO_SEGMENT:
                return type + "(" + audio.length + " bytes @" + sampleRate + "Hz x" + channels + ")";
            default:
                return type.toString();
        }
    }
}
