package org.example.voicemesh.media;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the most recent time-domain window of a source (mono, normalised to [-1,1]) and reports its RMS.
 * Frames arrive on media threads while reads happen on the event loop.
 */
@Slf4j
public class LevelAnalyser implements PcmFrameSink {
    private final AudioProcessingContext context;
    @Getter
    private final String ownerId;
    private final AudioSource source;

    private final float[] window;
    private int writeIndex = 0;
    private int filled = 0;
    private volatile boolean connected = true;
    private boolean warnedFormat = false;

    LevelAnalyser(AudioProcessingContext context, String ownerId, AudioSource source, int windowSamples) {
        this.context = context;
        this.ownerId = ownerId;
        this.source = source;
        this.window = new float[windowSamples];
    }

    @Override
    public void onFrame(byte[] data, int bitsPerSample, int sampleRate, int channels, int frames) {
        if (!connected || data == null) return;
        if (bitsPerSample != 16 || channels < 1) {
            if (!warnedFormat) {
                log.warn("Unsupported PCM format for {}: {} bits, {} channels", ownerId, bitsPerSample, channels);
                warnedFormat = true;
            }
            return;
        }

        int available = Math.min(frames, data.length / (2 * channels));
        synchronized (window) {
            for (int frame = 0; frame < available; frame++) {
                // Downmix to mono, 16-bit little endian
                float sum = 0f;
                for (int ch = 0; ch < channels; ch++) {
                    int offset = (frame * channels + ch) * 2;
                    short sample = (short) ((data[offset] & 0xFF) | (data[offset + 1] << 8));
                    sum += sample / 32768f;
                }
                window[writeIndex] = sum / channels;
                writeIndex = (writeIndex + 1) % window.length;
                if (filled < window.length) filled++;
            }
        }
    }

    /**
     * Root-mean-square of the current window, 0 when nothing has been received.
     */
    public double readRms() {
        synchronized (window) {
            if (filled == 0) return 0.0;
            double sumSquares = 0.0;
            for (int i = 0; i < filled; i++) {
                sumSquares += window[i] * window[i];
            }
            return Math.sqrt(sumSquares / filled);
        }
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Detaches from the source and from the context. Safe to call more than once.
     */
    public void disconnect() {
        if (!connected) return;
        connected = false;
        try {
            source.removeFrameSink(this);
        } catch (Exception e) {
            log.warn("Error detaching analyser for {}", ownerId, e);
        }
        context.release(this);
        synchronized (window) {
            filled = 0;
            writeIndex = 0;
        }
        log.debug("Analyser disconnected for {}", ownerId);
    }
}
