package io.meshward.health;

import io.meshward.model.PeerState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Active peers with their last beacon time, plus the peers this node has
 * locally declared dead. A peer is in at most one of the two.
 */
public final class PeerRegistry {
    private final Map<String, PeerRecord> active = new HashMap<>();
    private final Set<String> locallyDead = new HashSet<>();

    /**
     * Records a beacon from {@code nodeId}. A locally-dead peer is brought back.
     *
     * @return {@code true} when the peer was locally dead before this call
     */
    public synchronized boolean touch(String nodeId, long seenAtMs, List<String> neighbors) {
        boolean recovered = locallyDead.remove(nodeId);
        active.put(nodeId, new PeerRecord(nodeId, seenAtMs, neighbors));
        return recovered;
    }

    /** Moves {@code nodeId} out of the active set; returns false if it was already dead. */
    public synchronized boolean markDead(String nodeId) {
        active.remove(nodeId);
        return locallyDead.add(nodeId);
    }

    public synchronized boolean isLocallyDead(String nodeId) {
        return locallyDead.contains(nodeId);
    }

    public synchronized Optional<PeerRecord> find(String nodeId) {
        return Optional.ofNullable(active.get(nodeId));
    }

    public synchronized List<PeerRecord> activePeers() {
        List<PeerRecord> out = new ArrayList<>(active.values());
        out.sort((a, b) -> a.nodeId().compareTo(b.nodeId()));
        return out;
    }

    public synchronized Set<String> locallyDead() {
        return new TreeSet<>(locallyDead);
    }

    public synchronized int activeCount() {
        return active.size();
    }

    public synchronized PeerState state(String nodeId, Set<String> validatedFailures) {
        if (validatedFailures.contains(nodeId)) {
            return PeerState.VALIDATED_FAILED;
        }
        return locallyDead.contains(nodeId) ? PeerState.LOCALLY_DEAD : PeerState.ALIVE;
    }
}
