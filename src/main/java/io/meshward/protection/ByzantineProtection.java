package io.meshward.protection;

import io.meshward.gossip.ReputationLedger;
import io.meshward.gossip.SignedGossip;
import io.meshward.gossip.VerificationResult;
import io.meshward.gossip.Violation;
import io.meshward.model.CriticalEventType;
import io.meshward.model.Evidence;
import io.meshward.model.MessageType;
import io.meshward.model.SignedEnvelope;
import io.meshward.observability.AuditLogger;
import io.meshward.quorum.CriticalEvent;
import io.meshward.quorum.QuorumValidator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mesh-facing entry point for signed gossip and quorum validation.
 *
 * <p>Owns the node-local set of validated failures: once a node-failure event
 * reaches quorum its target is added and never removed.
 */
public final class ByzantineProtection {
    private final String nodeId;
    private final SignedGossip gossip;
    private final QuorumValidator quorum;
    private final AuditLogger auditLogger;
    private final Set<String> validatedFailures;

    public ByzantineProtection(SignedGossip gossip, QuorumValidator quorum, AuditLogger auditLogger) {
        this.gossip = Objects.requireNonNull(gossip, "gossip");
        this.quorum = Objects.requireNonNull(quorum, "quorum");
        this.nodeId = gossip.nodeId();
        this.auditLogger = auditLogger;
        this.validatedFailures = ConcurrentHashMap.newKeySet();
    }

    public SignedEnvelope signBeacon(List<String> neighbors) {
        return gossip.sign(MessageType.BEACON, Map.of("neighbors", neighbors == null ? List.of() : List.copyOf(neighbors)));
    }

    public VerificationResult verifyBeacon(SignedEnvelope envelope) {
        if (envelope != null && envelope.msgType() != MessageType.BEACON) {
            return VerificationResult.rejected(Violation.MALFORMED, "Expected BEACON, got " + envelope.msgType());
        }
        return verify(envelope);
    }

    public CriticalEvent reportNodeFailure(String failedNode, List<Evidence> evidence) {
        CriticalEvent event = quorum.report(CriticalEventType.NODE_FAILURE, failedNode, evidence);
        audit("quorum.report", "quorum/" + event.eventId(), "pending", reportDetails(event));
        return event;
    }

    /** Adds the local node's signature to a node-failure event. */
    public boolean validateNodeFailure(CriticalEvent event, byte[] validatorSignature) {
        return applyValidation(event, nodeId, validatorSignature);
    }

    public CriticalEvent reportLinkDown(String fromNode, String toNode, List<Evidence> evidence) {
        CriticalEvent event = quorum.report(CriticalEventType.LINK_DOWN, linkTarget(fromNode, toNode), evidence);
        audit("quorum.report", "quorum/" + event.eventId(), "pending", reportDetails(event));
        return event;
    }

    public boolean validateLinkDown(CriticalEvent event, byte[] validatorSignature) {
        return applyValidation(event, nodeId, validatorSignature);
    }

    /**
     * Signs a vote for {@code event}, counts it as the local validation and
     * returns the envelope to broadcast to peers.
     */
    public SignedEnvelope castFailureVote(CriticalEvent event) {
        Objects.requireNonNull(event, "event");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", event.eventType().name());
        payload.put("target", event.target());
        SignedEnvelope vote = gossip.sign(MessageType.FAILURE_VOTE, payload);
        applyValidation(event, nodeId, vote.signature());
        return vote;
    }

    /** Verifies a peer's vote and counts its sender as a validator of the named event. */
    public VoteOutcome recordFailureVote(SignedEnvelope vote) {
        if (vote != null && vote.msgType() != MessageType.FAILURE_VOTE) {
            return VoteOutcome.rejected("Expected FAILURE_VOTE, got " + vote.msgType(), quorum.quorumSize());
        }
        VerificationResult verified = verify(vote);
        if (!verified.ok()) {
            return VoteOutcome.rejected(verified.error(), quorum.quorumSize());
        }
        CriticalEventType type = parseEventType(vote.payload().get("event_type"));
        Object target = vote.payload().get("target");
        if (type == null || target == null || target.toString().isBlank()) {
            return VoteOutcome.rejected("Vote does not name an event", quorum.quorumSize());
        }
        CriticalEvent event = quorum.find(type, target.toString());
        if (event == null) {
            event = type == CriticalEventType.NODE_FAILURE
                    ? reportNodeFailure(target.toString(), List.of())
                    : quorum.report(type, target.toString(), List.of());
        }
        boolean validated = applyValidation(event, vote.sender(), vote.signature());
        return new VoteOutcome(true, null, event.eventId(), validated, event.signatureCount(), quorum.quorumSize());
    }

    public boolean isNodeQuarantined(String node) {
        return gossip.reputation().isQuarantined(node);
    }

    public double getNodeReputation(String node) {
        return gossip.reputation().reputation(node);
    }

    public boolean shouldAcceptMessage(String sender) {
        return !isNodeQuarantined(sender)
                && getNodeReputation(sender) >= ReputationLedger.QUARANTINE_THRESHOLD;
    }

    public boolean isValidatedFailure(String node) {
        return validatedFailures.contains(node);
    }

    public Set<String> validatedFailures() {
        return new TreeSet<>(validatedFailures);
    }

    public List<CriticalEvent> evictExpiredEvents() {
        List<CriticalEvent> evicted = quorum.evictExpired();
        for (CriticalEvent event : evicted) {
            audit("quorum.evicted", "quorum/" + event.eventId(), "expired", Map.of(
                    "signatures", event.signatureCount(),
                    "quorum_size", quorum.quorumSize()
            ));
        }
        return evicted;
    }

    public long rotateKeys() {
        long epoch = gossip.rotateKeys();
        audit("gossip.key_rotation", "gossip/keys", "ok", Map.of("epoch", epoch, "algorithm", gossip.algorithm()));
        return epoch;
    }

    public ProtectionStats getProtectionStats() {
        return new ProtectionStats(
                nodeId,
                gossip.algorithm(),
                gossip.currentEpoch(),
                quorum.totalNodes(),
                quorum.quorumThreshold(),
                quorum.quorumSize(),
                new ArrayList<>(gossip.reputation().quarantined().keySet()),
                new ArrayList<>(validatedFailures()),
                quorum.pending().size(),
                quorum.validatedEvents().size(),
                gossip.trackedNonces(),
                gossip.reputation().snapshot()
        );
    }

    public String nodeId() {
        return nodeId;
    }

    public int quorumSize() {
        return quorum.quorumSize();
    }

    public SignedGossip gossip() {
        return gossip;
    }

    private VerificationResult verify(SignedEnvelope envelope) {
        String sender = envelope == null ? null : envelope.sender();
        boolean wasQuarantined = sender != null && isNodeQuarantined(sender);
        VerificationResult result = gossip.verify(envelope);
        if (!result.ok() && sender != null && !wasQuarantined && isNodeQuarantined(sender)) {
            audit("gossip.quarantine", "peer/" + sender, "quarantined", Map.of(
                    "violation", result.violation().code(),
                    "reputation", getNodeReputation(sender),
                    "until", String.valueOf(gossip.reputation().quarantinedUntil(sender))
            ));
        }
        return result;
    }

    private boolean applyValidation(CriticalEvent event, String validatorId, byte[] signature) {
        boolean wasValidated = event.validated();
        boolean validated = quorum.validate(event, validatorId, signature);
        if (validated && event.eventType() == CriticalEventType.NODE_FAILURE) {
            validatedFailures.add(event.target());
        }
        if (validated && !wasValidated) {
            audit("quorum.validated", "quorum/" + event.eventId(), "validated", Map.of(
                    "target", event.target(),
                    "signers", new ArrayList<>(event.signers()),
                    "quorum_size", quorum.quorumSize()
            ));
        }
        return validated;
    }

    private Map<String, Object> reportDetails(CriticalEvent event) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        for (Evidence item : event.evidence()) {
            evidence.putAll(item.attributes());
        }
        return Map.of(
                "target", event.target(),
                "event_type", event.eventType().name(),
                "evidence", evidence,
                "quorum_size", quorum.quorumSize()
        );
    }

    private static String linkTarget(String fromNode, String toNode) {
        if (fromNode == null || fromNode.isBlank() || toNode == null || toNode.isBlank()) {
            throw new IllegalArgumentException("Both link endpoints are required");
        }
        return fromNode.trim() + "->" + toNode.trim();
    }

    private static CriticalEventType parseEventType(Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            return CriticalEventType.valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.tryLog(AuditLogger.AuditEvent.of(action, resource, result, details));
        }
    }
}
