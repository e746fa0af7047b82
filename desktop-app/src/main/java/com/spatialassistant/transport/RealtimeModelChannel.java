package com.spatialassistant.transport;

/**
 * Duplex streaming connection to a conversational model.
 */
public interface RealtimeModelChannel {

    /**
     * Connects and starts session negotiation. Completion of the negotiation is reported later as
     * {@link ChannelEvent.Type#OPENED}; every later event goes to the same listener.
     *
     * @throws ChannelOpenException if the connection cannot be established
     */
    ChannelHandle open(SessionConfig config, ChannelEventListener listener) throws ChannelOpenException;
}
