package com.spatialassistant.transport;

import com.spatialassistant.audio.AudioChunk;
import com.spatialassistant.video.VideoFrame;

/**
 * An open channel. Sends are fire-and-continue: they queue the payload and return at once.
 */
public interface ChannelHandle {

    void sendAudio(AudioChunk chunk);

    void sendVideo(VideoFrame frame);

    /**
     * Closes the connection. Idempotent.
     */
    void close();
}
