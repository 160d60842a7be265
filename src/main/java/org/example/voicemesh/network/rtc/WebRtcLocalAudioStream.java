package org.example.voicemesh.network.rtc;

import dev.onvoid.webrtc.media.audio.AudioTrack;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.media.LocalAudioStream;

/**
 * Microphone track created by {@link WebRtcConnectionFactory}. Muting is done by disabling the track.
 */
@Slf4j
public class WebRtcLocalAudioStream extends WebRtcAudioTrackSource implements LocalAudioStream {

    WebRtcLocalAudioStream(AudioTrack track) {
        super(track);
    }

    @Override
    public String getId() {
        return getTrack().getId();
    }

    @Override
    public boolean isAudioTrackEnabled() {
        return getTrack().isEnabled();
    }

    public void setMuted(boolean muted) {
        getTrack().setEnabled(!muted);
    }

    public void release() {
        try {
            getTrack().setEnabled(false);
            getTrack().dispose();
        } catch (Exception e) {
            log.warn("Error disposing local audio track", e);
        }
    }
}
