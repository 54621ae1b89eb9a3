package io.meshward.model;

import java.util.Map;

/** Observed round-trip latency; {@code Double.POSITIVE_INFINITY} means no answer at all. */
public record LatencyEvidence(double latencyMs) implements Evidence {
    @Override
    public String kind() {
        return "latency";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("latency", Double.isInfinite(latencyMs) ? "inf" : latencyMs);
    }
}
