package org.example.voicemesh.network.p2p;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Authoritative map of peer id to {@link PeerConnectionRecord}. Owned by the voice event loop.
 * <p>
 * At most one live record exists per peer. Replacing or removing a record always disposes it first.
 * Reconnect attempts outlive individual records so consecutive failures are counted per peer.
 */
@Slf4j
public class PeerConnectionRegistry {
    private final Map<String, PeerConnectionRecord> records = new LinkedHashMap<>();
    private final Map<String, Integer> carriedAttempts = new HashMap<>();
    private final Set<String> abandoned = new HashSet<>();
    private long generationCounter = 0;

    public long nextGeneration() {
        return ++generationCounter;
    }

    public void upsert(String peerId, PeerConnectionRecord record) {
        PeerConnectionRecord existing = records.get(peerId);
        if (existing == record) return;
        if (existing != null) {
            log.info("Replacing connection record for {} (generation {} -> {})",
                    peerId, existing.getGeneration(), record.getGeneration());
            existing.dispose();
            records.remove(peerId);
        }
        Integer carried = carriedAttempts.get(peerId);
        if (carried != null && record.getReconnectAttempts() < carried) {
            record.setReconnectAttempts(carried);
        }
        abandoned.remove(peerId);
        records.put(peerId, record);
    }

    public PeerConnectionRecord get(String peerId) {
        return records.get(peerId);
    }

    public boolean contains(String peerId) {
        return records.containsKey(peerId);
    }

    /**
     * @return true if the record is still the registered one for its peer
     */
    public boolean isCurrent(PeerConnectionRecord record) {
        return record != null && records.get(record.getPeerId()) == record && !record.isDisposed();
    }

    /**
     * Disposes the peer's record (connection and analyser) and then drops it from the map.
     */
    public boolean removeAndDispose(String peerId) {
        PeerConnectionRecord record = records.get(peerId);
        if (record == null) return false;
        if (record.getReconnectAttempts() > 0) {
            carriedAttempts.put(peerId, record.getReconnectAttempts());
        }
        record.dispose();
        records.remove(peerId);
        log.info("Disposed connection to {}", peerId);
        return true;
    }

    /**
     * Iterates over a copy, so the callback may remove records.
     */
    public void forEach(Consumer<PeerConnectionRecord> fn) {
        for (PeerConnectionRecord record : new ArrayList<>(records.values())) {
            fn.accept(record);
        }
    }

    public List<String> peerIds() {
        return new ArrayList<>(records.keySet());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int getReconnectAttempts(String peerId) {
        PeerConnectionRecord record = records.get(peerId);
        if (record != null) return record.getReconnectAttempts();
        return carriedAttempts.getOrDefault(peerId, 0);
    }

    public void resetReconnectAttempts(String peerId) {
        carriedAttempts.remove(peerId);
        abandoned.remove(peerId);
        PeerConnectionRecord record = records.get(peerId);
        if (record != null) record.setReconnectAttempts(0);
    }

    public void disposeAll() {
        for (String peerId : peerIds()) {
            removeAndDispose(peerId);
        }
        carriedAttempts.clear();
        abandoned.clear();
    }

    /**
     * Marks a peer the watchdog gave up on. Cleared when a new record is registered for it or its attempts
     * are reset.
     */
    public void markAbandoned(String peerId) {
        abandoned.add(peerId);
    }

    public boolean isAbandoned(String peerId) {
        return abandoned.contains(peerId);
    }
}
