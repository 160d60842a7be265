package org.example.voicemesh.network.rtc;

import dev.onvoid.webrtc.media.audio.AudioTrack;
import dev.onvoid.webrtc.media.audio.AudioTrackSink;
import org.example.voicemesh.media.AudioSource;
import org.example.voicemesh.media.PcmFrameSink;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exposes a native audio track as an {@link AudioSource}.
 */
public class WebRtcAudioTrackSource implements AudioSource {
    private final AudioTrack track;
    private final Map<PcmFrameSink, AudioTrackSink> sinks = new ConcurrentHashMap<>();

    public WebRtcAudioTrackSource(AudioTrack track) {
        this.track = track;
    }

    public AudioTrack getTrack() {
        return track;
    }

    @Override
    public void addFrameSink(PcmFrameSink sink) {
        AudioTrackSink nativeSink = sink::onFrame;
        if (sinks.putIfAbsent(sink, nativeSink) == null) {
            track.addSink(nativeSink);
        }
    }

    @Override
    public void removeFrameSink(PcmFrameSink sink) {
        AudioTrackSink nativeSink = sinks.remove(sink);
        if (nativeSink != null) {
            track.removeSink(nativeSink);
        }
    }
}
