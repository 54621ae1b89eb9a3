package io.meshward.runtime;

import io.meshward.model.PeerState;

import java.util.List;

public record PeerView(
        String nodeId,
        PeerState state,
        long lastSeenMs,
        double elapsedSeconds,
        boolean alive,
        List<String> neighbors,
        double reputation,
        boolean quarantined,
        boolean validatedFailure
) {
}
