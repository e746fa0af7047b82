package com.spatialassistant.transport;

import com.spatialassistant.audio.AudioChunk;
import com.spatialassistant.video.VideoFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket client for the Gemini Live API.
 * Outbound messages go through a bounded queue drained by one sender thread per session.
 */
public class GeminiLiveChannel implements RealtimeModelChannel {
    private static final Logger LOG = LoggerFactory.getLogger(GeminiLiveChannel.class);

    private static final int OUTBOUND_CAPACITY = 256;

    private final String endpoint;
    private final String apiKey;
    private final Duration connectTimeout;
    private final HttpClient httpClient;

    public GeminiLiveChannel(String endpoint, String apiKey, Duration connectTimeout) {
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.apiKey = apiKey;
        this.connectTimeout = connectTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public ChannelHandle open(SessionConfig config, ChannelEventListener listener) throws ChannelOpenException {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new ChannelOpenException("No API key configured");
        }
        URI uri = URI.create(endpoint + "?key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        LiveSession session = new LiveSession(listener);
        LOG.info("Connecting to {} (model {})", endpoint, config.getModel());

        WebSocket webSocket;
        try {
            webSocket = httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, session)
                .get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ChannelOpenException("Connection failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new ChannelOpenException("Connection timed out after " + connectTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelOpenException("Interrupted while connecting", e);
        }

        session.attach(webSocket);
        session.enqueue(LiveProtocol.setupMessage(config));
        return session;
    }

    /**
     * One connected socket: receives and translates server messages, sends queued client messages.
     */
    static final class LiveSession implements WebSocket.Listener, ChannelHandle {
        private final ChannelEventListener listener;
        private final BlockingQueue<String> outbound = new ArrayBlockingQueue<>(OUTBOUND_CAPACITY);
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final StringBuilder textPart = new StringBuilder();
        private final ByteArrayOutputStream binaryPart = new ByteArrayOutputStream();
        private volatile WebSocket webSocket;
        private Thread sender;

        LiveSession(ChannelEventListener listener) {
            this.listener = listener;
        }

        void attach(WebSocket socket) {
            this.webSocket = socket;
            sender = new Thread(this::sendLoop, "LiveSender");
            sender.setDaemon(true);
            sender.start();
        }

        void enqueue(String message) {
            if (closed.get()) {
                return;
            }
            if (!outbound.offer(message)) {
                LOG.warn("Outbound queue full, dropping message");
            }
        }

        private void sendLoop() {
            try {
                while (!closed.get()) {
                    String message = outbound.poll(200, TimeUnit.MILLISECONDS);
                    if (message == null) {
                        continue;
                    }
                    webSocket.sendText(message, true).get();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                if (!closed.get()) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    LOG.error("Send failed", cause);
                    listener.onEvent(ChannelEvent.error("Send failed: " + cause.getMessage()));
                }
            }
        }

        @Override
        public void sendAudio(AudioChunk chunk) {
            if (chunk.getData().length > 0) {
                enqueue(LiveProtocol.audioMessage(chunk));
            }
        }

        @Override
        public void sendVideo(VideoFrame frame) {
            enqueue(LiveProtocol.videoMessage(frame));
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            outbound.clear();
            if (sender != null) {
                sender.interrupt();
            }
            WebSocket socket = webSocket;
            if (socket != null && !socket.isOutputClosed()) {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "client closed")
                    .exceptionally(e -> {
                        LOG.debug("Close handshake failed: {}", e.getMessage());
                        socket.abort();
                        return socket;
                    });
            }
            LOG.info("Live session closed by client");
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            LOG.debug("WebSocket opened");
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            try {
                textPart.append(data);
                if (last) {
                    String message = textPart.toString();
                    textPart.setLength(0);
                    dispatch(message);
                }
            } finally {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            try {
                byte[] bytes = new byte[data.remaining()];
                data.get(bytes);
                binaryPart.write(bytes, 0, bytes.length);
                if (last) {
                    String message = new String(binaryPart.toByteArray(), StandardCharsets.UTF_8);
                    binaryPart.reset();
                    dispatch(message);
                }
            } finally {
                webSocket.request(1);
            }
            return null;
        }

        private void dispatch(String message) {
            List<ChannelEvent> events;
            try {
                events = LiveProtocol.translate(message);
            } catch (RuntimeException e) {
                LOG.warn("Dropping server message that could not be translated", e);
                return;
            }
            for (ChannelEvent event : events) {
                listener.onEvent(event);
            }
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            LOG.info("WebSocket closed: {} {}", statusCode, reason);
            closed.set(true);
            listener.onEvent(ChannelEvent.closed());
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            LOG.error("WebSocket error", error);
            closed.set(true);
            listener.onEvent(ChannelEvent.error(error.getMessage() != null ? error.getMessage() : error.toString()));
        }
    }
}
