package com.spatialassistant.audio;

/**
 * Raised when an inbound audio payload cannot be turned into a playable segment.
 */
public class AudioDecodeException extends Exception {
    public AudioDecodeException(String message) {
        super(message);
    }
}
