package io.meshward.health;

import java.util.List;

public record PeerRecord(String nodeId, long lastSeenMs, List<String> neighbors) {
    public PeerRecord {
        neighbors = neighbors == null ? List.of() : List.copyOf(neighbors);
    }
}
