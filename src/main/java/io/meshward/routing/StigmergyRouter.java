package io.meshward.routing;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pheromone routing table keyed by (destination, next hop).
 *
 * <p>Successful transmissions add a fixed boost to a trail, failures halve it,
 * and {@link #evaporate()} decays every trail so stale paths fade out. Trails
 * under {@value #PRUNE_BELOW} are dropped; only trails at or above the
 * configured minimum are offered for path selection.
 *
 * <p>Reinforcement is gated by the tag ACL: a destination the local node may
 * not reach is ignored silently. All table access is serialized on this
 * instance, so updates to one pair apply in call order.
 */
public final class StigmergyRouter {
    public static final double DEFAULT_DECAY_RATE = 0.9d;
    public static final double DEFAULT_BOOST = 10.0d;
    public static final double DEFAULT_MIN = 1.0d;
    public static final double PRUNE_BELOW = 0.1d;
    public static final double FAILURE_FACTOR = 0.5d;
    public static final int DEFAULT_PATH_LIMIT = 3;

    private final double decayRate;
    private final double boost;
    private final double pheromoneMin;
    private final Clock clock;
    private final Set<String> localTags;
    private final Map<String, Map<String, Trail>> table;
    private volatile AclState acl;

    public StigmergyRouter(Clock clock) {
        this(clock, Set.of(), DEFAULT_DECAY_RATE, DEFAULT_BOOST, DEFAULT_MIN);
    }

    public StigmergyRouter(Clock clock, Set<String> localTags, double decayRate, double boost, double pheromoneMin) {
        if (decayRate <= 0d || decayRate >= 1d) {
            throw new IllegalArgumentException("decayRate must be in (0,1), got " + decayRate);
        }
        if (boost <= 0d) {
            throw new IllegalArgumentException("boost must be > 0, got " + boost);
        }
        if (pheromoneMin < PRUNE_BELOW) {
            throw new IllegalArgumentException("pheromoneMin must be >= " + PRUNE_BELOW + ", got " + pheromoneMin);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.localTags = localTags == null ? Set.of() : Set.copyOf(localTags);
        this.decayRate = decayRate;
        this.boost = boost;
        this.pheromoneMin = pheromoneMin;
        this.table = new HashMap<>();
        this.acl = new AclState(List.of(), Map.of(), AclProfile.DEFAULT);
    }

    /**
     * @return {@code true} when the trail was updated, {@code false} when the ACL denied the destination
     */
    public boolean reinforce(String destination, String nextHop, boolean success) {
        requireId(destination, "destination");
        requireId(nextHop, "nextHop");
        if (!isAllowed(destination)) {
            return false;
        }
        synchronized (this) {
            Trail trail = table.computeIfAbsent(destination, k -> new LinkedHashMap<>())
                    .computeIfAbsent(nextHop, k -> new Trail(pheromoneMin));
            if (success) {
                trail.score += boost;
            } else {
                trail.score *= FAILURE_FACTOR;
            }
            trail.lastUpdatedMs = clock.millis();
            return true;
        }
    }

    public Optional<String> getBestRoute(String destination) {
        List<String> paths = getRedundantPaths(destination, 1);
        return paths.isEmpty() ? Optional.empty() : Optional.of(paths.get(0));
    }

    public List<String> getRedundantPaths(String destination) {
        return getRedundantPaths(destination, DEFAULT_PATH_LIMIT);
    }

    /** Eligible next hops for {@code destination}, best first, at most {@code limit}. */
    public synchronized List<String> getRedundantPaths(String destination, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        Map<String, Trail> hops = table.get(destination);
        if (hops == null) {
            return List.of();
        }
        List<Map.Entry<String, Trail>> eligible = new ArrayList<>();
        for (Map.Entry<String, Trail> entry : hops.entrySet()) {
            if (entry.getValue().score >= pheromoneMin) {
                eligible.add(entry);
            }
        }
        eligible.sort(Comparator
                .comparingDouble((Map.Entry<String, Trail> e) -> e.getValue().score).reversed()
                .thenComparing(Map.Entry::getKey));
        List<String> out = new ArrayList<>(Math.min(limit, eligible.size()));
        for (int i = 0; i < eligible.size() && i < limit; i++) {
            out.add(eligible.get(i).getKey());
        }
        return out;
    }

    /** Decays every trail once and drops the ones that fell under the prune floor. */
    public synchronized EvaporationOutcome evaporate() {
        int decayed = 0;
        int pruned = 0;
        int destinationsRemoved = 0;
        Iterator<Map.Entry<String, Map<String, Trail>>> destinations = table.entrySet().iterator();
        while (destinations.hasNext()) {
            Map<String, Trail> hops = destinations.next().getValue();
            Iterator<Trail> trails = hops.values().iterator();
            while (trails.hasNext()) {
                Trail trail = trails.next();
                trail.score *= decayRate;
                decayed++;
                if (trail.score < PRUNE_BELOW) {
                    trails.remove();
                    pruned++;
                }
            }
            if (hops.isEmpty()) {
                destinations.remove();
                destinationsRemoved++;
            }
        }
        return new EvaporationOutcome(decayed, pruned, destinationsRemoved);
    }

    /** Drops every trail that leads to or through {@code nodeId}; returns how many were removed. */
    public synchronized int forget(String nodeId) {
        int removed = 0;
        Map<String, Trail> own = table.remove(nodeId);
        if (own != null) {
            removed += own.size();
        }
        Iterator<Map<String, Trail>> destinations = table.values().iterator();
        while (destinations.hasNext()) {
            Map<String, Trail> hops = destinations.next();
            if (hops.remove(nodeId) != null) {
                removed++;
            }
            if (hops.isEmpty()) {
                destinations.remove();
            }
        }
        return removed;
    }

    public void updatePolicies(List<AclPolicy> policies, Map<String, ? extends Iterable<String>> peerTags) {
        AclState current = acl;
        acl = new AclState(copyPolicies(policies), copyTags(peerTags), current.profile());
    }

    public void updateProfile(AclProfile profile) {
        AclState current = acl;
        acl = new AclState(current.policies(), current.peerTags(), profile == null ? AclProfile.DEFAULT : profile);
    }

    public boolean isAllowed(String destination) {
        return evaluate(destination).allowed();
    }

    /**
     * Deny-priority evaluation: an isolated profile denies outright, any matching
     * deny rule wins, then any matching allow rule. Without a match the request
     * is allowed only when no policies exist and the profile is {@code DEFAULT}.
     */
    public AclDecision evaluate(String destination) {
        AclState state = acl;
        if (state.profile() == AclProfile.ISOLATED) {
            return new AclDecision(AclAction.DENY, AclDecision.ISOLATED, List.of());
        }
        Set<String> targetTags = state.peerTags().getOrDefault(destination, Set.of());
        List<AclPolicy> matched = new ArrayList<>();
        for (AclPolicy policy : state.policies()) {
            if (policy.matches(localTags, targetTags)) {
                matched.add(policy);
            }
        }
        if (matched.stream().anyMatch(p -> p.action() == AclAction.DENY)) {
            return new AclDecision(AclAction.DENY, AclDecision.EXPLICIT_DENY, matched);
        }
        if (!matched.isEmpty()) {
            return new AclDecision(AclAction.ALLOW, AclDecision.EXPLICIT_ALLOW, matched);
        }
        if (state.policies().isEmpty() && state.profile() == AclProfile.DEFAULT) {
            return new AclDecision(AclAction.ALLOW, AclDecision.OPEN_MESH, List.of());
        }
        return new AclDecision(AclAction.DENY, AclDecision.DEFAULT_DENY, List.of());
    }

    public synchronized Optional<RoutePheromone> pheromone(String destination, String nextHop) {
        Map<String, Trail> hops = table.get(destination);
        Trail trail = hops == null ? null : hops.get(nextHop);
        return trail == null ? Optional.empty() : Optional.of(new RoutePheromone(nextHop, trail.score, trail.lastUpdatedMs));
    }

    /** Copy of the whole table, destinations and next hops sorted by name. */
    public synchronized Map<String, List<RoutePheromone>> snapshot() {
        Map<String, List<RoutePheromone>> out = new TreeMap<>();
        for (Map.Entry<String, Map<String, Trail>> dest : table.entrySet()) {
            List<RoutePheromone> trails = new ArrayList<>();
            for (Map.Entry<String, Trail> hop : new TreeMap<>(dest.getValue()).entrySet()) {
                trails.add(new RoutePheromone(hop.getKey(), hop.getValue().score, hop.getValue().lastUpdatedMs));
            }
            out.put(dest.getKey(), trails);
        }
        return out;
    }

    public synchronized int trackedPairs() {
        int total = 0;
        for (Map<String, Trail> hops : table.values()) {
            total += hops.size();
        }
        return total;
    }

    public List<AclPolicy> policies() {
        return acl.policies();
    }

    public AclProfile profile() {
        return acl.profile();
    }

    public double pheromoneMin() {
        return pheromoneMin;
    }

    private static List<AclPolicy> copyPolicies(List<AclPolicy> policies) {
        return policies == null ? List.of() : List.copyOf(policies);
    }

    private static Map<String, Set<String>> copyTags(Map<String, ? extends Iterable<String>> peerTags) {
        if (peerTags == null || peerTags.isEmpty()) {
            return Map.of();
        }
        Map<String, Set<String>> out = new HashMap<>();
        for (Map.Entry<String, ? extends Iterable<String>> entry : peerTags.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            List<String> tags = new ArrayList<>();
            for (String tag : entry.getValue()) {
                if (tag != null && !tag.isBlank()) {
                    tags.add(tag.trim());
                }
            }
            out.put(entry.getKey(), Set.copyOf(tags));
        }
        return Map.copyOf(out);
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    public record EvaporationOutcome(int decayed, int pruned, int destinationsRemoved) {
    }

    private record AclState(List<AclPolicy> policies, Map<String, Set<String>> peerTags, AclProfile profile) {
    }

    private static final class Trail {
        private double score;
        private long lastUpdatedMs;

        private Trail(double score) {
            this.score = score;
        }
    }
}
