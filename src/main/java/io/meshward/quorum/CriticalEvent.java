package io.meshward.quorum;

import io.meshward.model.CriticalEventType;
import io.meshward.model.Evidence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A proposed fact that becomes network truth once enough distinct validators
 * have signed it. All mutation goes through {@link #addSignature}, which is
 * synchronized on the event; once validated the event stays validated.
 */
public final class CriticalEvent {
    private final CriticalEventType eventType;
    private final String target;
    private final List<Evidence> evidence;
    private final double timestamp;
    private final Map<String, byte[]> signatures;
    private boolean validated;

    CriticalEvent(CriticalEventType eventType, String target, List<Evidence> evidence, double timestamp) {
        this.eventType = eventType;
        this.target = target;
        this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
        this.timestamp = timestamp;
        this.signatures = new LinkedHashMap<>();
        this.validated = false;
    }

    synchronized boolean addSignature(String validatorId, byte[] signature, int quorumSize) {
        signatures.putIfAbsent(validatorId, signature == null ? new byte[0] : signature.clone());
        if (!validated && signatures.size() >= quorumSize) {
            validated = true;
        }
        return validated;
    }

    public CriticalEventType eventType() {
        return eventType;
    }

    public String target() {
        return target;
    }

    public List<Evidence> evidence() {
        return evidence;
    }

    public double timestamp() {
        return timestamp;
    }

    /** {@code EVENT_TYPE:target:epoch-seconds}. */
    public String eventId() {
        return eventType.name() + ":" + target + ":" + (long) timestamp;
    }

    public synchronized boolean validated() {
        return validated;
    }

    public synchronized Set<String> signers() {
        return new TreeSet<>(signatures.keySet());
    }

    public synchronized int signatureCount() {
        return signatures.size();
    }

    @Override
    public synchronized String toString() {
        return "CriticalEvent{" + eventId() + ", signatures=" + signatures.size() + ", validated=" + validated + "}";
    }
}
