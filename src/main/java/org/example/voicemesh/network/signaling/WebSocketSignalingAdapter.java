package org.example.voicemesh.network.signaling;

import common.model.SignalingMessage;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link SignalingAdapter} over an OkHttp WebSocket to the voice relay.
 * <p>
 * Unexpected closes and failures are reported as accidental transport-down events and followed by reconnection
 * attempts every {@code reconnectDelayMs} until {@link #disconnect()} is called.
 */
@Slf4j
public class WebSocketSignalingAdapter implements SignalingAdapter {
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient httpClient;
    private final String relayUrl;
    private final long reconnectDelayMs;
    private final SignalingCodec codec;
    private final ScheduledExecutorService reconnectExecutor;

    private volatile SignalingListener listener;
    private volatile WebSocket webSocket;
    private volatile boolean connected = false;
    private volatile boolean leaving = false;
    private ScheduledFuture<?> pendingReconnect;

    public WebSocketSignalingAdapter(String relayUrl, long reconnectDelayMs) {
        this(new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .pingInterval(20, TimeUnit.SECONDS)
                .build(), relayUrl, reconnectDelayMs, new SignalingCodec());
    }

    public WebSocketSignalingAdapter(OkHttpClient httpClient, String relayUrl, long reconnectDelayMs, SignalingCodec codec) {
        this.httpClient = httpClient;
        this.relayUrl = relayUrl;
        this.reconnectDelayMs = reconnectDelayMs;
        this.codec = codec;
        this.reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voice-relay-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void setListener(SignalingListener listener) {
        this.listener = listener;
    }

    @Override
    public synchronized void connect() {
        leaving = false;
        if (webSocket != null) {
            log.debug("Relay socket already open or opening");
            return;
        }
        openSocket();
    }

    private synchronized void openSocket() {
        if (leaving) return;
        log.info("Connecting to voice relay {}", relayUrl);
        Request request = new Request.Builder()
                .url(relayUrl)
                .build();
        webSocket = httpClient.newWebSocket(request, new RelayWebSocketListener());
    }

    @Override
    public boolean send(SignalingMessage message) {
        WebSocket socket = webSocket;
        if (!connected || socket == null) {
            log.warn("Relay unavailable, dropping {}", message.getEvent());
            return false;
        }
        boolean queued = socket.send(codec.encode(message));
        if (!queued) {
            log.warn("Relay refused {}", message.getEvent());
        }
        return queued;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void disconnect() {
        WebSocket socket;
        boolean wasConnected;
        synchronized (this) {
            leaving = true;
            if (pendingReconnect != null) {
                pendingReconnect.cancel(false);
                pendingReconnect = null;
            }
            socket = webSocket;
            wasConnected = connected;
            webSocket = null;
            connected = false;
        }
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "leaving");
        }
        log.info("Disconnected from voice relay");
        if (wasConnected) {
            notifyDown(true);
        }
    }

    /**
     * Disconnects and stops the reconnect thread.
     */
    public void shutdown() {
        disconnect();
        reconnectExecutor.shutdown();
        try {
            if (!reconnectExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                reconnectExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            reconnectExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void handleTransportLost(WebSocket socket, String reason) {
        boolean wasConnected;
        synchronized (this) {
            if (socket != webSocket) {
                // Stale socket from a previous connection
                return;
            }
            wasConnected = connected;
            connected = false;
            webSocket = null;
            if (!leaving) {
                scheduleReconnect();
            }
        }
        log.warn("Voice relay connection lost: {}", reason);
        if (wasConnected && !leaving) {
            notifyDown(false);
        }
    }

    private void scheduleReconnect() {
        if (pendingReconnect != null && !pendingReconnect.isDone()) return;
        if (reconnectExecutor.isShutdown()) return;
        pendingReconnect = reconnectExecutor.schedule(() -> {
            synchronized (WebSocketSignalingAdapter.this) {
                pendingReconnect = null;
                if (webSocket == null) {
                    openSocket();
                }
            }
        }, reconnectDelayMs, TimeUnit.MILLISECONDS);
        log.info("Reconnecting to voice relay in {}ms", reconnectDelayMs);
    }

    private void notifyDown(boolean intentional) {
        SignalingListener current = listener;
        if (current != null) {
            current.onTransportDown(intentional);
        }
    }

    private class RelayWebSocketListener extends WebSocketListener {
        @Override
        public void onOpen(WebSocket socket, Response response) {
            synchronized (WebSocketSignalingAdapter.this) {
                if (socket != webSocket) {
                    socket.close(NORMAL_CLOSURE, "superseded");
                    return;
                }
                connected = true;
            }
            log.info("✅ Voice relay connected");
            SignalingListener current = listener;
            if (current != null) {
                current.onTransportUp();
            }
        }

        @Override
        public void onMessage(WebSocket socket, String text) {
            SignalingMessage message = codec.decode(text);
            SignalingListener current = listener;
            if (message != null && current != null) {
                current.onMessage(message);
            }
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            socket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket socket, int code, String reason) {
            handleTransportLost(socket, "closed (" + code + " " + reason + ")");
        }

        @Override
        public void onFailure(WebSocket socket, Throwable t, Response response) {
            handleTransportLost(socket, t.getMessage());
        }
    }
}
