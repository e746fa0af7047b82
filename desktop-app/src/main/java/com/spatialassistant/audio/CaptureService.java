package com.spatialassistant.audio;

import com.spatialassistant.session.DeviceAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Microphone capture using the Java Sound API.
 * Opens the line at a rate the hardware supports natively and hands fixed-size frames to a listener.
 */
public class CaptureService implements AudioCaptureDevice {
    private static final Logger LOG = LoggerFactory.getLogger(CaptureService.class);

    // Tried in order; the first one the line accepts becomes the native rate
    private static final float[] CANDIDATE_RATES = {48000f, 44100f, 16000f};

    private final Mixer.Info mixerInfo;
    private final int frameMillis;
    private final AtomicBoolean isCapturing = new AtomicBoolean(false);
    private volatile TargetDataLine audioLine;
    private Thread captureThread;

    public CaptureService(int frameMillis) {
        this(null, frameMillis);
    }

    /**
     * @param mixerInfo   mixer to capture from, or null for the system default
     * @param frameMillis length of each delivered frame
     */
    public CaptureService(Mixer.Info mixerInfo, int frameMillis) {
        this.mixerInfo = mixerInfo;
        this.frameMillis = frameMillis;
    }

    /**
     * Lists available audio input devices.
     */
    public static List<Mixer.Info> listInputDevices() {
        List<Mixer.Info> devices = new ArrayList<>();
        for (Mixer.Info info : AudioSystem.getMixerInfo()) {
            Mixer mixer = AudioSystem.getMixer(info);
            Line.Info[] lineInfos = mixer.getTargetLineInfo();
            if (lineInfos.length > 0) {
                devices.add(info);
            }
        }
        return devices;
    }

    @Override
    public synchronized int acquire() throws DeviceAcquisitionException {
        if (audioLine != null) {
            return (int) audioLine.getFormat().getSampleRate();
        }
        LineUnavailableException lastError = null;
        for (float rate : CANDIDATE_RATES) {
            AudioFormat format = new AudioFormat(rate, 16, 1, true, false);
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
            try {
                TargetDataLine line = openLine(info);
                if (line == null) {
                    LOG.debug("Capture format not supported: {}", format);
                    continue;
                }
                line.open(format, bytesPerFrame(format) * 2);
                audioLine = line;
                LOG.info("Microphone opened: {}", line.getFormat());
                return (int) rate;
            } catch (LineUnavailableException e) {
                LOG.warn("Could not open capture line at {} Hz: {}", rate, e.getMessage());
                lastError = e;
            }
        }
        throw new DeviceAcquisitionException("No supported audio input line found. Please check your microphone.", lastError);
    }

    private TargetDataLine openLine(DataLine.Info info) throws LineUnavailableException {
        if (mixerInfo != null) {
            Mixer mixer = AudioSystem.getMixer(mixerInfo);
            return mixer.isLineSupported(info) ? (TargetDataLine) mixer.getLine(info) : null;
        }
        return AudioSystem.isLineSupported(info) ? (TargetDataLine) AudioSystem.getLine(info) : null;
    }

    private int bytesPerFrame(AudioFormat format) {
        int samples = Math.max(1, (int) (format.getSampleRate() * frameMillis / 1000));
        return samples * PcmCodec.BYTES_PER_SAMPLE;
    }

    @Override
    public synchronized void start(FrameListener listener) {
        TargetDataLine line = audioLine;
        if (line == null) {
            throw new IllegalStateException("capture line not acquired");
        }
        if (!isCapturing.compareAndSet(false, true)) {
            LOG.warn("Capture already running");
            return;
        }
        line.start();
        captureThread = new Thread(() -> captureLoop(line, listener), "AudioCapture");
        captureThread.setDaemon(true);
        captureThread.start();
    }

    @Override
    public void release() {
        Thread thread;
        synchronized (this) {
            isCapturing.set(false);
            if (audioLine != null) {
                audioLine.stop();
                audioLine.close();
                audioLine = null;
            }
            thread = captureThread;
            captureThread = null;
        }
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Reads frames until the line is stopped.
     */
    private void captureLoop(TargetDataLine line, FrameListener listener) {
        AudioFormat format = line.getFormat();
        int sampleRate = (int) format.getSampleRate();
        byte[] buffer = new byte[bytesPerFrame(format)];
        LOG.debug("Capture loop started: {} Hz, {} byte frames", sampleRate, buffer.length);

        while (isCapturing.get()) {
            int bytesRead = line.read(buffer, 0, buffer.length);
            if (bytesRead <= 0) {
                if (!line.isOpen()) {
                    break;
                }
                continue;
            }
            try {
                listener.onFrame(buffer, bytesRead, sampleRate);
            } catch (RuntimeException e) {
                LOG.error("Error in capture frame listener", e);
            }
        }
        LOG.debug("Capture loop finished");
    }

    public boolean isCapturing() {
        return isCapturing.get();
    }
}
