package com.spatialassistant.transport;

/**
 * Receives channel events on the transport's own thread. Implementations must not block.
 */
public interface ChannelEventListener {
    void onEvent(ChannelEvent event);
}
