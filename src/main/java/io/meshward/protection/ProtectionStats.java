package io.meshward.protection;

import java.util.List;
import java.util.Map;

public record ProtectionStats(
        String nodeId,
        String signatureAlgorithm,
        long currentEpoch,
        int totalNodes,
        double quorumThreshold,
        int quorumSize,
        List<String> quarantinedNodes,
        List<String> validatedFailures,
        int pendingEvents,
        int validatedEvents,
        int trackedNonces,
        Map<String, Double> reputations
) {
}
