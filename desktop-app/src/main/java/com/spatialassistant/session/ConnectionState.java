package com.spatialassistant.session;

/**
 * Lifecycle of a session as seen by subscribers.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
}
