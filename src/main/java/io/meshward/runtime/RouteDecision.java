package io.meshward.runtime;

import java.util.List;

/**
 * Where to send traffic for {@code destination}. {@code nextHop} is null unless
 * {@code status} is {@code routed}; {@code delivered} means the destination is
 * this node.
 */
public record RouteDecision(String destination, String status, String nextHop, List<String> alternatives, String reason) {
    public static final String DELIVERED = "delivered";
    public static final String ROUTED = "routed";
    public static final String UNREACHABLE = "unreachable";

    public RouteDecision {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public boolean reachable() {
        return !UNREACHABLE.equals(status);
    }
}
