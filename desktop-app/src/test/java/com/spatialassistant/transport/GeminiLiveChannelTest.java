package com.spatialassistant.transport;

import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.Assert.*;

public class GeminiLiveChannelTest {

    @Test
    public void testOpenWithoutApiKeyFails() {
        GeminiLiveChannel channel = new GeminiLiveChannel("wss://example.invalid/live", null, Duration.ofSeconds(1));

        try {
            channel.open(new SessionConfig("model", null, null), event -> { });
            fail("Expected ChannelOpenException");
        } catch (ChannelOpenException e) {
            assertTrue(e.getMessage().contains("API key"));
        }
    }

    @Test
    public void testKeepsReadingAfterBadlyTypedMessage() {
        List<ChannelEvent> events = new CopyOnWriteArrayList<>();
        GeminiLiveChannel.LiveSession session = new GeminiLiveChannel.LiveSession(events::add);
        RecordingSocket socket = new RecordingSocket();

        session.onText(socket, "{\"serverContent\":{\"outputTranscription\":{\"text\":{}}}}", true);
        session.onText(socket, "{\"setupComplete\":", false);
        session.onText(socket, "{}}", true);

        assertEquals(3, socket.requested);
        assertEquals(1, events.size());
        assertEquals(ChannelEvent.Type.OPENED, events.get(0).getType());
    }

    @Test
    public void testBinaryFramesAreTranslatedAsText() {
        List<ChannelEvent> events = new CopyOnWriteArrayList<>();
        GeminiLiveChannel.LiveSession session = new GeminiLiveChannel.LiveSession(events::add);
        RecordingSocket socket = new RecordingSocket();

        byte[] json = "{\"serverContent\":{\"interrupted\":true}}".getBytes(StandardCharsets.UTF_8);
        session.onBinary(socket, ByteBuffer.wrap(json), true);

        assertEquals(1, socket.requested);
        assertEquals(1, events.size());
        assertEquals(ChannelEvent.Type.INTERRUPTED, events.get(0).getType());
    }

    private static final class RecordingSocket implements WebSocket {
        int requested;

        @Override
        public CompletableFuture<WebSocket> sendText(CharSequence data, boolean last) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendBinary(ByteBuffer data, boolean last) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPing(ByteBuffer message) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPong(ByteBuffer message) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendClose(int statusCode, String reason) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public void request(long n) {
            requested += n;
        }

        @Override
        public String getSubprotocol() {
            return "";
        }

        @Override
        public boolean isOutputClosed() {
            return false;
        }

        @Override
        public boolean isInputClosed() {
            return false;
        }

        @Override
        public void abort() {
        }
    }
}
