package org.example.voicemesh.network.signaling;

import common.model.SignalingMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Relay stand-in: records delivered messages and lets the test drive transport events and incoming traffic.
 */
public class RecordingSignalingAdapter implements SignalingAdapter {
    private final List<SignalingMessage> sent = new ArrayList<>();
    private final List<SignalingMessage> attempted = new ArrayList<>();
    private SignalingListener listener;
    private boolean connected;
    private int connectCalls = 0;

    public RecordingSignalingAdapter(boolean connected) {
        this.connected = connected;
    }

    @Override
    public void setListener(SignalingListener listener) {
        this.listener = listener;
    }

    @Override
    public void connect() {
        connectCalls++;
    }

    @Override
    public boolean send(SignalingMessage message) {
        attempted.add(message);
        if (!connected) return false;
        sent.add(message);
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void disconnect() {
        if (!connected) return;
        connected = false;
        if (listener != null) listener.onTransportDown(true);
    }

    // ===== Test controls =====

    public void transportUp() {
        connected = true;
        listener.onTransportUp();
    }

    public void transportLost() {
        connected = false;
        listener.onTransportDown(false);
    }

    public void deliver(SignalingMessage message) {
        listener.onMessage(message);
    }

    public List<SignalingMessage> getSent() {
        return sent;
    }

    public List<SignalingMessage> sent(String event) {
        return sent.stream().filter(m -> event.equals(m.getEvent())).collect(Collectors.toList());
    }

    /**
     * Every send call for the event, delivered or not.
     */
    public List<SignalingMessage> attempted(String event) {
        return attempted.stream().filter(m -> event.equals(m.getEvent())).collect(Collectors.toList());
    }

    public List<String> sentEvents() {
        return sent.stream().map(SignalingMessage::getEvent).collect(Collectors.toList());
    }

    public void clear() {
        sent.clear();
        attempted.clear();
    }

    public int getConnectCalls() {
        return connectCalls;
    }
}
