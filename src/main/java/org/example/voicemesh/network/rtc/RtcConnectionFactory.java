package org.example.voicemesh.network.rtc;

/**
 * Builds {@link RtcConnection}s for the mesh.
 */
public interface RtcConnectionFactory {

    RtcConnection create(String peerId, RtcConnectionObserver observer);
}
