package io.meshward.gossip;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.HashMap;
import java.util.TreeMap;

/**
 * Per-node reputation in [0,1] plus temporary quarantine.
 *
 * <p>Each violation multiplies reputation by {@value #PENALTY_FACTOR}; each
 * accepted message multiplies it by {@value #REWARD_FACTOR}, capped at 1.0.
 * Falling below {@value #QUARANTINE_THRESHOLD} quarantines the node until
 * {@code now + quarantineDuration}. Expired quarantines are dropped lazily on
 * lookup.
 */
public final class ReputationLedger {
    public static final double INITIAL_REPUTATION = 1.0d;
    public static final double PENALTY_FACTOR = 0.9d;
    public static final double REWARD_FACTOR = 1.05d;
    public static final double QUARANTINE_THRESHOLD = 0.3d;
    public static final Duration DEFAULT_QUARANTINE = Duration.ofSeconds(300L);

    private final Clock clock;
    private final Duration quarantineDuration;
    private final Map<String, Double> reputations = new HashMap<>();
    private final Map<String, Instant> quarantinedUntil = new HashMap<>();

    public ReputationLedger(Clock clock, Duration quarantineDuration) {
        this.clock = clock;
        this.quarantineDuration = quarantineDuration == null || quarantineDuration.isNegative()
                ? DEFAULT_QUARANTINE
                : quarantineDuration;
    }

    public synchronized double reputation(String nodeId) {
        return reputations.getOrDefault(nodeId, INITIAL_REPUTATION);
    }

    /**
     * @return {@code true} when this violation put the node into quarantine
     */
    public synchronized boolean penalize(String nodeId) {
        double next = reputation(nodeId) * PENALTY_FACTOR;
        reputations.put(nodeId, next);
        if (next < QUARANTINE_THRESHOLD) {
            boolean wasQuarantined = isQuarantined(nodeId);
            quarantinedUntil.put(nodeId, clock.instant().plus(quarantineDuration));
            return !wasQuarantined;
        }
        return false;
    }

    /** Fully restored nodes are dropped from the table; lookups default to {@value #INITIAL_REPUTATION}. */
    public synchronized void reward(String nodeId) {
        double next = Math.min(1.0d, reputation(nodeId) * REWARD_FACTOR);
        if (next >= INITIAL_REPUTATION) {
            reputations.remove(nodeId);
        } else {
            reputations.put(nodeId, next);
        }
    }

    public synchronized boolean isQuarantined(String nodeId) {
        Instant until = quarantinedUntil.get(nodeId);
        if (until == null) {
            return false;
        }
        if (!clock.instant().isBefore(until)) {
            quarantinedUntil.remove(nodeId);
            return false;
        }
        return true;
    }

    public synchronized Instant quarantinedUntil(String nodeId) {
        return isQuarantined(nodeId) ? quarantinedUntil.get(nodeId) : null;
    }

    /** Active quarantines, node id -> release time, sorted by node id. */
    public synchronized Map<String, Instant> quarantined() {
        Instant now = clock.instant();
        quarantinedUntil.values().removeIf(until -> !now.isBefore(until));
        return new TreeMap<>(quarantinedUntil);
    }

    public synchronized Map<String, Double> snapshot() {
        return new TreeMap<>(reputations);
    }

    public Duration quarantineDuration() {
        return quarantineDuration;
    }
}
