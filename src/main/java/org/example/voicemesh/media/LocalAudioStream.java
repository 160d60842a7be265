package org.example.voicemesh.media;

/**
 * Handle to the already acquired local microphone stream. Acquisition and release happen outside the voice session.
 */
public interface LocalAudioStream extends AudioSource {

    String getId();

    /**
     * @return true if the stream has an audio track and that track is enabled (not muted)
     */
    boolean isAudioTrackEnabled();
}
