package io.meshward.routing;

/** Snapshot of one (destination, next hop) trail. */
public record RoutePheromone(String nextHop, double score, long lastUpdatedMs) {
}
