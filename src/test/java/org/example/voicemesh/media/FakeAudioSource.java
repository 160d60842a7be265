package org.example.voicemesh.media;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Audio source driven by the test: pushes 16-bit mono frames straight into the attached sinks.
 */
public class FakeAudioSource implements AudioSource {
    private final Set<PcmFrameSink> sinks = new CopyOnWriteArraySet<>();

    @Override
    public void addFrameSink(PcmFrameSink sink) {
        sinks.add(sink);
    }

    @Override
    public void removeFrameSink(PcmFrameSink sink) {
        sinks.remove(sink);
    }

    public int sinkCount() {
        return sinks.size();
    }

    /**
     * Fills a whole analyser window with a constant sample of the given amplitude (0..1), whose RMS is the amplitude.
     */
    public void pushConstant(double amplitude) {
        pushConstant(amplitude, 2048);
    }

    public void pushConstant(double amplitude, int frames) {
        short sample = (short) Math.round(amplitude * Short.MAX_VALUE);
        byte[] data = new byte[frames * 2];
        for (int i = 0; i < frames; i++) {
            data[i * 2] = (byte) (sample & 0xFF);
            data[i * 2 + 1] = (byte) ((sample >> 8) & 0xFF);
        }
        for (PcmFrameSink sink : sinks) {
            sink.onFrame(data, 16, 48000, 1, frames);
        }
    }
}
