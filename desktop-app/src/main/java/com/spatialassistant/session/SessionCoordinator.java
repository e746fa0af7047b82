package com.spatialassistant.session;

import com.spatialassistant.audio.AudioCaptureDevice;
import com.spatialassistant.audio.AudioChunk;
import com.spatialassistant.audio.AudioDecodeException;
import com.spatialassistant.audio.AudioSegment;
import com.spatialassistant.audio.CaptureResampler;
import com.spatialassistant.audio.PlaybackEngine;
import com.spatialassistant.audio.PlaybackScheduler;
import com.spatialassistant.config.AppConfig;
import com.spatialassistant.detection.Detection;
import com.spatialassistant.detection.DetectionParser;
import com.spatialassistant.detection.IdentityTracker;
import com.spatialassistant.detection.TrackedObject;
import com.spatialassistant.transport.ChannelEvent;
import com.spatialassistant.transport.ChannelHandle;
import com.spatialassistant.transport.ChannelOpenException;
import com.spatialassistant.transport.RealtimeModelChannel;
import com.spatialassistant.transport.SessionConfig;
import com.spatialassistant.video.VideoFrame;
import com.spatialassistant.video.VideoFrameSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one live session at a time: acquires the devices, opens the model channel and
 * routes everything the model sends back to the detection, tracking and playback components.
 *
 * <p>Channel callbacks only enqueue into a bounded inbox. A single dispatcher thread drains it
 * and handles each event under the coordinator lock, so events are processed in arrival order.
 * Every session carries a generation number; {@link #stop()} bumps it first, so inbox entries,
 * capture frames and timer ticks from a finished session are discarded.
 */
public class SessionCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(SessionCoordinator.class);

    private static final long INBOX_POLL_MILLIS = 200;

    private final RealtimeModelChannel channel;
    private final AudioCaptureDevice microphone;
    private final VideoFrameSource video;
    private final PlaybackEngine engine;
    private final SessionConfig sessionConfig;
    private final Clock clock;
    private final ScheduledExecutorService frameTimer;
    private final ScheduledExecutorService sweepTimer;

    private final int captureTargetRate;
    private final int captureFrameMillis;
    private final long videoIntervalMillis;
    private final long sweepIntervalMillis;

    private final PlaybackScheduler scheduler;
    private final DetectionParser parser;
    private final IdentityTracker tracker;

    private final BlockingQueue<Envelope> inbox;
    private final AtomicLong generation = new AtomicLong();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<TranscriptEntry> history = new ArrayList<>();
    private final StringBuilder inputText = new StringBuilder();
    private final StringBuilder outputText = new StringBuilder();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private ChannelHandle handle;
    private int microphoneRate;
    private boolean openedBeforeHandle;
    private ScheduledFuture<?> videoTask;
    private ScheduledFuture<?> sweepTask;
    private Thread dispatcher;
    private volatile boolean dispatching;
    private boolean closed;

    public SessionCoordinator(AppConfig config,
                              RealtimeModelChannel channel,
                              AudioCaptureDevice microphone,
                              VideoFrameSource video,
                              PlaybackEngine engine) {
        this(config, channel, microphone, video, engine, Clock.systemUTC(),
            newTimerExecutor("VideoFrameTimer"), newTimerExecutor("TrackerSweepTimer"));
    }

    public SessionCoordinator(AppConfig config,
                              RealtimeModelChannel channel,
                              AudioCaptureDevice microphone,
                              VideoFrameSource video,
                              PlaybackEngine engine,
                              Clock clock,
                              ScheduledExecutorService frameTimer,
                              ScheduledExecutorService sweepTimer) {
        this.channel = channel;
        this.microphone = microphone;
        this.video = video;
        this.engine = engine;
        this.clock = clock;
        this.frameTimer = frameTimer;
        this.sweepTimer = sweepTimer;
        this.sessionConfig = new SessionConfig(config.getModel(), config.getSystemInstruction(), config.getVoice());
        this.captureTargetRate = config.getCaptureTargetRate();
        this.captureFrameMillis = config.getCaptureFrameMillis();
        this.videoIntervalMillis = config.getVideoFrameIntervalMillis();
        this.sweepIntervalMillis = config.getTrackerSweepIntervalMillis();
        this.scheduler = new PlaybackScheduler(engine);
        this.parser = new DetectionParser(config.getDetectionBufferChars(), clock);
        this.tracker = new IdentityTracker(config.getTrackerMatchDistance(),
            Duration.ofMillis(config.getTrackerTtlMillis()));
        this.inbox = new ArrayBlockingQueue<>(config.getInboxCapacity());
    }

    private static ScheduledExecutorService newTimerExecutor(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Acquires the devices and opens the channel. The session becomes CONNECTED once the
     * channel reports it is open. Ignored unless the session is DISCONNECTED or in ERROR.
     *
     * <p>The connect itself runs without holding the coordinator lock, so {@link #stop()} and
     * {@link #close()} return at once while it is in progress. A connection that completes after
     * the session was stopped is closed again immediately.
     *
     * @throws DeviceAcquisitionException if the speaker, microphone or screen cannot be opened
     * @throws ChannelOpenException if the connection cannot be established
     */
    public void start() throws DeviceAcquisitionException, ChannelOpenException {
        long session;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Coordinator is closed");
            }
            if (state != ConnectionState.DISCONNECTED && state != ConnectionState.ERROR) {
                LOG.warn("Ignoring start while {}", state);
                return;
            }
            ensureDispatcher();
            session = generation.incrementAndGet();
            openedBeforeHandle = false;
            setState(ConnectionState.CONNECTING);

            try {
                engine.open();
                microphoneRate = microphone.acquire();
                video.open();
            } catch (DeviceAcquisitionException e) {
                LOG.error("Device acquisition failed: {}", e.getMessage());
                releaseDevices();
                setState(ConnectionState.ERROR);
                throw e;
            }
        }

        ChannelHandle opened;
        try {
            opened = channel.open(sessionConfig, event -> enqueue(session, event));
        } catch (ChannelOpenException e) {
            synchronized (this) {
                if (session != generation.get()) {
                    LOG.info("Connect for stopped session {} failed: {}", session, e.getMessage());
                    return;
                }
                LOG.error("Could not open channel: {}", e.getMessage());
                releaseDevices();
                setState(ConnectionState.ERROR);
            }
            throw e;
        }

        synchronized (this) {
            if (session != generation.get()) {
                LOG.info("Session {} was stopped while connecting, closing late connection", session);
                opened.close();
                return;
            }
            handle = opened;
            LOG.info("Session {} started, microphone at {} Hz", session, microphoneRate);
            if (openedBeforeHandle) {
                onOpened(session);
            }
        }
    }

    /**
     * Ends the session and returns to DISCONNECTED. Idempotent.
     */
    public synchronized void stop() {
        if (state == ConnectionState.DISCONNECTED) {
            return;
        }
        teardown(ConnectionState.DISCONNECTED);
    }

    /**
     * Stops the session and shuts down the dispatcher and timer threads. The coordinator
     * cannot be started again.
     */
    public void close() {
        Thread thread;
        synchronized (this) {
            stop();
            closed = true;
            dispatching = false;
            thread = dispatcher;
            dispatcher = null;
        }
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        frameTimer.shutdownNow();
        sweepTimer.shutdownNow();
    }

    public ConnectionState getState() {
        return state;
    }

    public synchronized List<TranscriptEntry> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public List<TrackedObject> getTrackedObjects() {
        return tracker.snapshot();
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(state, tracker.snapshot(), getHistory());
    }

    PlaybackScheduler getScheduler() {
        return scheduler;
    }

    private void enqueue(long session, ChannelEvent event) {
        if (session != generation.get()) {
            LOG.debug("Dropping {} from finished session {}", event.getType(), session);
            return;
        }
        if (!inbox.offer(new Envelope(session, event))) {
            LOG.warn("Event inbox full, dropping {}", event.getType());
        }
    }

    private void ensureDispatcher() {
        if (dispatcher != null) {
            return;
        }
        dispatching = true;
        dispatcher = new Thread(this::dispatchLoop, "SessionDispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    private void dispatchLoop() {
        while (dispatching) {
            Envelope envelope;
            try {
                envelope = inbox.poll(INBOX_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (envelope == null) {
                continue;
            }
            try {
                dispatch(envelope);
            } catch (RuntimeException e) {
                LOG.error("Error handling {}", envelope.event.getType(), e);
            }
        }
        LOG.debug("Dispatcher finished");
    }

    private synchronized void dispatch(Envelope envelope) {
        ChannelEvent event = envelope.event;
        if (envelope.generation != generation.get() || state == ConnectionState.DISCONNECTED) {
            LOG.debug("Discarding stale {}", event.getType());
            return;
        }
        switch (event.getType()) {
            case OPENED:
                onOpened(envelope.generation);
                break;
            case OUTPUT_TRANSCRIPTION:
                onOutputTranscription(event.getText());
                break;
            case INPUT_TRANSCRIPTION:
                inputText.append(event.getText());
                break;
            case TURN_COMPLETE:
                onTurnComplete();
                break;
            case AUDIO_SEGMENT:
                onAudioSegment(event);
                break;
            case INTERRUPTED:
                int stopped = scheduler.interrupt();
                LOG.debug("Model interrupted, {} segment(s) silenced", stopped);
                break;
            case ERROR:
                LOG.error("Channel error: {}", event.getText());
                teardown(ConnectionState.ERROR);
                break;
            case CLOSED:
                LOG.info("Channel closed by remote");
                stop();
                break;
            default:
                LOG.warn("Unhandled event {}", event.getType());
        }
    }

    private void onOpened(long session) {
        if (state != ConnectionState.CONNECTING) {
            LOG.debug("Ignoring open while {}", state);
            return;
        }
        if (handle == null) {
            // channel.open has not returned yet; start() finishes the transition
            openedBeforeHandle = true;
            return;
        }
        setState(ConnectionState.CONNECTED);
        ChannelHandle target = handle;

        videoTask = frameTimer.scheduleAtFixedRate(() -> sendVideoFrame(session, target),
            0, videoIntervalMillis, TimeUnit.MILLISECONDS);
        sweepTask = sweepTimer.scheduleAtFixedRate(() -> sweep(session),
            sweepIntervalMillis, sweepIntervalMillis, TimeUnit.MILLISECONDS);

        CaptureResampler resampler = new CaptureResampler(microphoneRate, captureTargetRate,
            microphoneRate * captureFrameMillis / 1000);
        microphone.start((pcm, length, sampleRate) -> {
            if (session != generation.get()) {
                return;
            }
            byte[] resampled = resampler.process(pcm, length);
            if (resampled.length > 0) {
                target.sendAudio(new AudioChunk(resampled, captureTargetRate));
            }
        });
    }

    private void sendVideoFrame(long session, ChannelHandle target) {
        if (session != generation.get()) {
            return;
        }
        try {
            VideoFrame frame = video.captureFrame();
            if (frame != null) {
                target.sendVideo(frame);
                notifyVideoFrame(frame);
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Video frame capture failed: {}", e.getMessage());
        }
    }

    private void sweep(long session) {
        if (session != generation.get()) {
            return;
        }
        try {
            if (tracker.pruneExpired(clock.instant())) {
                notifyTrackedObjects(tracker.snapshot());
            }
        } catch (RuntimeException e) {
            LOG.warn("Tracker sweep failed", e);
        }
    }

    private void onOutputTranscription(String text) {
        outputText.append(text);
        List<Detection> detections = parser.parse(text);
        if (!detections.isEmpty()) {
            notifyTrackedObjects(tracker.update(detections));
        }
    }

    private void onTurnComplete() {
        boolean changed = false;
        if (inputText.length() > 0) {
            history.add(new TranscriptEntry(TranscriptEntry.Role.USER, inputText.toString()));
            changed = true;
        }
        if (outputText.length() > 0) {
            history.add(new TranscriptEntry(TranscriptEntry.Role.MODEL, outputText.toString()));
            changed = true;
        }
        inputText.setLength(0);
        outputText.setLength(0);
        if (changed) {
            notifyHistory(getHistory());
        }
    }

    private void onAudioSegment(ChannelEvent event) {
        try {
            AudioSegment segment = AudioSegment.decode(event.getAudio(), event.getSampleRate(), event.getChannels());
            scheduler.schedule(segment);
        } catch (AudioDecodeException e) {
            LOG.warn("Dropping model audio: {}", e.getMessage());
        }
    }

    private void teardown(ConnectionState finalState) {
        long finished = generation.getAndIncrement();
        if (videoTask != null) {
            videoTask.cancel(false);
            videoTask = null;
        }
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        microphone.release();
        video.close();
        if (handle != null) {
            handle.close();
            handle = null;
        }
        scheduler.stopAll();
        engine.close();

        tracker.clear();
        parser.reset();
        inputText.setLength(0);
        outputText.setLength(0);
        inbox.clear();

        LOG.info("Session {} torn down", finished);
        setState(finalState);
        notifyTrackedObjects(Collections.<TrackedObject>emptyList());
    }

    private void releaseDevices() {
        microphone.release();
        video.close();
        engine.close();
    }

    private void setState(ConnectionState newState) {
        if (state == newState) {
            return;
        }
        LOG.info("Session state {} -> {}", state, newState);
        state = newState;
        for (SessionListener listener : listeners) {
            try {
                listener.onStateChanged(newState);
            } catch (RuntimeException e) {
                LOG.error("Session listener failed on state change", e);
            }
        }
    }

    private void notifyTrackedObjects(List<TrackedObject> objects) {
        for (SessionListener listener : listeners) {
            try {
                listener.onTrackedObjectsChanged(objects);
            } catch (RuntimeException e) {
                LOG.error("Session listener failed on tracked objects", e);
            }
        }
    }

    private void notifyVideoFrame(VideoFrame frame) {
        for (SessionListener listener : listeners) {
            try {
                listener.onVideoFrame(frame);
            } catch (RuntimeException e) {
                LOG.error("Session listener failed on video frame", e);
            }
        }
    }

    private void notifyHistory(List<TranscriptEntry> entries) {
        for (SessionListener listener : listeners) {
            try {
                listener.onHistoryChanged(entries);
            } catch (RuntimeException e) {
                LOG.error("Session listener failed on history", e);
            }
        }
    }

    private static final class Envelope {
        private final long generation;
        private final ChannelEvent event;

        Envelope(long generation, ChannelEvent event) {
            this.generation = generation;
            this.event = event;
        }
    }
}
