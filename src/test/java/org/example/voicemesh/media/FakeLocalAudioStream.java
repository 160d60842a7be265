package org.example.voicemesh.media;

public class FakeLocalAudioStream extends FakeAudioSource implements LocalAudioStream {
    private final String id;
    private volatile boolean enabled = true;

    public FakeLocalAudioStream(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isAudioTrackEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
