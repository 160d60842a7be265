package org.example.voicemesh.network.rtc;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import common.model.IceCandidate;
import org.example.voicemesh.media.AudioSource;

public interface RtcConnectionObserver {

    void onIceCandidate(IceCandidate candidate);

    void onConnectionStateChange(ConnectionState state);

    void onIceConnectionStateChange(IceConnectionState state);

    void onRemoteAudio(AudioSource remoteAudio);
}
