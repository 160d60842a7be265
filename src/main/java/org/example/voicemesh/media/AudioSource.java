package org.example.voicemesh.media;

/**
 * A stream of PCM audio that analysers can tap into (the local microphone track or a remote track).
 */
public interface AudioSource {

    void addFrameSink(PcmFrameSink sink);

    void removeFrameSink(PcmFrameSink sink);
}
