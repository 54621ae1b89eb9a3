package io.meshward.quorum;

import io.meshward.model.CriticalEventType;
import io.meshward.model.Evidence;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Collects validator signatures over critical events and flips an event to
 * validated once {@code ceil(totalNodes * quorumThreshold)} distinct
 * validators have signed it.
 *
 * <p>Events are keyed by {@code (type, target)}; reporting the same pair again
 * returns the existing event. Unvalidated events can be evicted after a TTL
 * via {@link #evictExpired()}; a zero TTL keeps them indefinitely.
 */
public final class QuorumValidator {
    public static final double DEFAULT_QUORUM_THRESHOLD = 0.67d;

    private final int totalNodes;
    private final double quorumThreshold;
    private final int quorumSize;
    private final Clock clock;
    private final Duration pendingTtl;
    private final ConcurrentMap<String, CriticalEvent> events;

    public QuorumValidator(int totalNodes, double quorumThreshold, Clock clock) {
        this(totalNodes, quorumThreshold, clock, Duration.ZERO);
    }

    public QuorumValidator(int totalNodes, double quorumThreshold, Clock clock, Duration pendingTtl) {
        if (totalNodes < 1) {
            throw new IllegalArgumentException("totalNodes must be >= 1, got " + totalNodes);
        }
        if (Double.isNaN(quorumThreshold) || quorumThreshold <= 0d || quorumThreshold > 1d) {
            throw new IllegalArgumentException("quorumThreshold must be in (0,1], got " + quorumThreshold);
        }
        this.totalNodes = totalNodes;
        this.quorumThreshold = quorumThreshold;
        this.quorumSize = Math.max(1, (int) Math.ceil(totalNodes * quorumThreshold));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pendingTtl = pendingTtl == null || pendingTtl.isNegative() ? Duration.ZERO : pendingTtl;
        this.events = new ConcurrentHashMap<>();
    }

    public CriticalEvent report(CriticalEventType eventType, String target, List<Evidence> evidence) {
        Objects.requireNonNull(eventType, "eventType");
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        return events.computeIfAbsent(
                key(eventType, target),
                k -> new CriticalEvent(eventType, target, evidence, clock.millis() / 1000d)
        );
    }

    /**
     * Adds {@code validatorId}'s signature. Re-adding a validator does not
     * change the count.
     *
     * @return whether the event is validated after this call
     */
    public boolean validate(CriticalEvent event, String validatorId, byte[] signature) {
        Objects.requireNonNull(event, "event");
        if (validatorId == null || validatorId.isBlank()) {
            throw new IllegalArgumentException("validatorId is required");
        }
        return event.addSignature(validatorId, signature, quorumSize);
    }

    public CriticalEvent find(CriticalEventType eventType, String target) {
        return events.get(key(eventType, target));
    }

    public List<CriticalEvent> pending() {
        List<CriticalEvent> out = new ArrayList<>();
        for (CriticalEvent event : events.values()) {
            if (!event.validated()) {
                out.add(event);
            }
        }
        return out;
    }

    public List<CriticalEvent> validatedEvents() {
        List<CriticalEvent> out = new ArrayList<>();
        for (CriticalEvent event : events.values()) {
            if (event.validated()) {
                out.add(event);
            }
        }
        return out;
    }

    /** Removes unvalidated events older than the pending TTL; returns the evicted ones. */
    public List<CriticalEvent> evictExpired() {
        if (pendingTtl.isZero()) {
            return List.of();
        }
        double cutoff = (clock.millis() - pendingTtl.toMillis()) / 1000d;
        List<CriticalEvent> evicted = new ArrayList<>();
        for (Map.Entry<String, CriticalEvent> entry : events.entrySet()) {
            CriticalEvent event = entry.getValue();
            if (!event.validated() && event.timestamp() <= cutoff && events.remove(entry.getKey(), event)) {
                evicted.add(event);
            }
        }
        return evicted;
    }

    public int quorumSize() {
        return quorumSize;
    }

    public int totalNodes() {
        return totalNodes;
    }

    public double quorumThreshold() {
        return quorumThreshold;
    }

    public Duration pendingTtl() {
        return pendingTtl;
    }

    private static String key(CriticalEventType eventType, String target) {
        return eventType.name() + ":" + target;
    }
}
