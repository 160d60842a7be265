package org.example.voicemesh.media;

/**
 * Receives raw PCM frames from an {@link AudioSource}.
 */
@FunctionalInterface
public interface PcmFrameSink {

    void onFrame(byte[] data, int bitsPerSample, int sampleRate, int channels, int frames);
}
