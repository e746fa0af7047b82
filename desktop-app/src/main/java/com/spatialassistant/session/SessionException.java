package com.spatialassistant.session;

/**
 * Base type for failures that abort starting a session.
 */
public class SessionException extends Exception {
    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
