package io.meshward.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.meshward.routing.AclPolicy;

import java.util.List;
import java.util.Map;

/** On-disk shape of {@code meshward-settings.json}; every field is optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MeshSettingsFile(
        String nodeId,
        Integer totalNodes,
        Double quorumThreshold,
        Long peerTimeoutMs,
        Long healthCheckIntervalMs,
        Double pheromoneDecayRate,
        Double pheromoneBoost,
        Double pheromoneMin,
        Long decayIntervalMs,
        Integer rateLimitPerSecond,
        Long quarantineMs,
        Long keyRotationIntervalMs,
        Long pendingEventTtlMs,
        Boolean requireSignedBeacons,
        Integer bindPort,
        List<String> seeds,
        Long gossipIntervalMs,
        Long receiveWindowMs,
        List<String> localTags,
        String aclProfile,
        List<AclPolicy> aclPolicies,
        Map<String, List<String>> peerTags
) {
}
