package org.example.voicemesh.media;

import common.constant.VoiceConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide owner of every {@link LevelAnalyser}.
 * <p>
 * Created lazily by {@link #getInstance()} and torn down by {@link #shutdown()}, which disconnects every analyser
 * still attached. A later {@link #getInstance()} starts a fresh context for the next session.
 */
@Slf4j
public class AudioProcessingContext {
    private static AudioProcessingContext instance;

    private final Set<LevelAnalyser> analysers = ConcurrentHashMap.newKeySet();
    private final int windowSamples;
    private volatile boolean closed = false;

    private AudioProcessingContext(int windowSamples) {
        this.windowSamples = windowSamples;
        log.info("Audio processing context created (window={} samples)", windowSamples);
    }

    public static synchronized AudioProcessingContext getInstance() {
        if (instance == null) {
            instance = new AudioProcessingContext(VoiceConfig.ANALYSER_WINDOW_SAMPLES);
        }
        return instance;
    }

    public static synchronized boolean isInitialized() {
        return instance != null;
    }

    /**
     * Disconnects every analyser and discards the context. No-op if none was created.
     */
    public static synchronized void shutdown() {
        if (instance == null) {
            return;
        }
        instance.close();
        instance = null;
    }

    /**
     * Creates an analyser tapping the given source. The caller owns it and must {@link LevelAnalyser#disconnect()} it.
     */
    public LevelAnalyser createAnalyser(String ownerId, AudioSource source) {
        if (closed) {
            throw new IllegalStateException("Audio processing context is closed");
        }
        LevelAnalyser analyser = new LevelAnalyser(this, ownerId, source, windowSamples);
        analysers.add(analyser);
        source.addFrameSink(analyser);
        log.debug("Analyser created for {}", ownerId);
        return analyser;
    }

    public int getActiveAnalyserCount() {
        return analysers.size();
    }

    public boolean isClosed() {
        return closed;
    }

    void release(LevelAnalyser analyser) {
        analysers.remove(analyser);
    }

    private void close() {
        closed = true;
        List<LevelAnalyser> remaining = new ArrayList<>(analysers);
        if (!remaining.isEmpty()) {
            log.warn("Closing audio context with {} analyser(s) still connected", remaining.size());
        }
        for (LevelAnalyser analyser : remaining) {
            analyser.disconnect();
        }
        analysers.clear();
        log.info("Audio processing context closed");
    }
}
