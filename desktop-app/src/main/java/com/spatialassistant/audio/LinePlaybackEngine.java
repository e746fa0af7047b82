package com.spatialassistant.audio;

import com.spatialassistant.session.DeviceAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Speaker output on a Java Sound {@link SourceDataLine}.
 *
 * <p>A render thread mixes every scheduled source into 10 ms blocks and writes them to the
 * line; the blocking write paces the loop. The engine clock is the render cursor, so a source
 * scheduled at {@link #currentTime()} goes into the very next block. Segments at another
 * sample rate are resampled when they are scheduled.
 */
public class LinePlaybackEngine implements PlaybackEngine {
    private static final Logger LOG = LoggerFactory.getLogger(LinePlaybackEngine.class);

    private static final int BLOCK_MILLIS = 10;
    private static final int LINE_BUFFER_BLOCKS = 8;

    private final int sampleRate;
    private final int blockFrames;
    private final Object mixLock = new Object();
    private final List<LineSource> sources = new ArrayList<>();
    private long framesRendered;

    private SourceDataLine line;
    private Thread renderThread;
    private volatile boolean running;

    public LinePlaybackEngine(int sampleRate) {
        this.sampleRate = sampleRate;
        this.blockFrames = sampleRate * BLOCK_MILLIS / 1000;
    }

    @Override
    public synchronized void open() throws DeviceAcquisitionException {
        if (running) {
            return;
        }
        AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
        try {
            SourceDataLine newLine = AudioSystem.getSourceDataLine(format);
            newLine.open(format, blockFrames * PcmCodec.BYTES_PER_SAMPLE * LINE_BUFFER_BLOCKS);
            newLine.start();
            line = newLine;
        } catch (LineUnavailableException | IllegalArgumentException e) {
            throw new DeviceAcquisitionException("Audio output not available: " + e.getMessage(), e);
        }
        // framesRendered is kept across reopen so the clock never runs backwards
        running = true;
        SourceDataLine target = line;
        renderThread = new Thread(() -> renderLoop(target), "AudioPlayback");
        renderThread.setDaemon(true);
        renderThread.start();
        LOG.info("Speaker opened: {}", format);
    }

    @Override
    public double currentTime() {
        synchronized (mixLock) {
            return (double) framesRendered / sampleRate;
        }
    }

    @Override
    public Source play(AudioSegment segment, double startTime, Runnable onEnded) {
        float[] samples = PcmCodec.resampleLinear(segment.getSamples(), segment.getSampleRate(), sampleRate);
        synchronized (mixLock) {
            long startFrame = Math.max(Math.round(startTime * sampleRate), framesRendered);
            LineSource source = new LineSource(samples, startFrame, onEnded);
            sources.add(source);
            return source;
        }
    }

    private void renderLoop(SourceDataLine target) {
        float[] mix = new float[blockFrames];
        byte[] out = new byte[blockFrames * PcmCodec.BYTES_PER_SAMPLE];
        List<LineSource> ended = new ArrayList<>();

        while (running) {
            ended.clear();
            synchronized (mixLock) {
                Arrays.fill(mix, 0f);
                long blockStart = framesRendered;
                long blockEnd = blockStart + blockFrames;
                Iterator<LineSource> it = sources.iterator();
                while (it.hasNext()) {
                    LineSource source = it.next();
                    source.mixInto(mix, blockStart, blockEnd);
                    if (source.endFrame() <= blockEnd) {
                        it.remove();
                        source.finished = true;
                        ended.add(source);
                    }
                }
                framesRendered = blockEnd;
            }

            for (int i = 0; i < blockFrames; i++) {
                PcmCodec.writeSample(out, i * PcmCodec.BYTES_PER_SAMPLE, mix[i]);
            }
            target.write(out, 0, out.length);

            for (LineSource source : ended) {
                try {
                    source.onEnded.run();
                } catch (RuntimeException e) {
                    LOG.error("Error in playback completion callback", e);
                }
            }
        }
        LOG.debug("Render loop finished");
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        line.stop();
        line.flush();
        if (renderThread != null && renderThread != Thread.currentThread()) {
            try {
                renderThread.join(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        line.close();
        line = null;
        renderThread = null;
        synchronized (mixLock) {
            for (LineSource source : sources) {
                source.finished = true;
            }
            sources.clear();
        }
        LOG.info("Speaker closed");
    }

    public int getSampleRate() {
        return sampleRate;
    }

    private final class LineSource implements Source {
        private final float[] samples;
        private final long startFrame;
        private final Runnable onEnded;
        private volatile boolean finished;

        LineSource(float[] samples, long startFrame, Runnable onEnded) {
            this.samples = samples;
            this.startFrame = startFrame;
            this.onEnded = onEnded;
        }

        long endFrame() {
            return startFrame + samples.length;
        }

        void mixInto(float[] mix, long blockStart, long blockEnd) {
            long from = Math.max(startFrame, blockStart);
            long to = Math.min(endFrame(), blockEnd);
            for (long frame = from; frame < to; frame++) {
                mix[(int) (frame - blockStart)] += samples[(int) (frame - startFrame)];
            }
        }

        @Override
        public void stop() {
            synchronized (mixLock) {
                if (!finished) {
                    sources.remove(this);
                    finished = true;
                }
            }
        }

        @Override
        public boolean isFinished() {
            return finished;
        }
    }
}
