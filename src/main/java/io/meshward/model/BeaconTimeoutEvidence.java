package io.meshward.model;

import java.util.Map;

/** Last beacon time and silence duration, both in seconds. */
public record BeaconTimeoutEvidence(double lastSeen, double elapsed) implements Evidence {
    @Override
    public String kind() {
        return "beacon_timeout";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("last_seen", lastSeen, "elapsed", elapsed);
    }
}
