package io.meshward.runtime;

import io.meshward.protection.ProtectionStats;

import java.util.List;

public record MeshStatus(
        String nodeId,
        boolean running,
        int activePeers,
        List<String> locallyDeadPeers,
        List<String> validatedFailures,
        long beaconsReceived,
        long beaconsRejected,
        long votesReceived,
        int trackedRoutes,
        String aclProfile,
        int aclPolicies,
        long malformedDatagrams,
        long loopErrors,
        ProtectionStats protection
) {
}
