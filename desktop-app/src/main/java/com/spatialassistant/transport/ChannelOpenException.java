package com.spatialassistant.transport;

import com.spatialassistant.session.SessionException;

/**
 * The channel could not be opened.
 */
public class ChannelOpenException extends SessionException {
    public ChannelOpenException(String message) {
        super(message);
    }

    public ChannelOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
