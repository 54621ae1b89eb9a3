package io.meshward.health;

import io.meshward.model.BeaconTimeoutEvidence;
import io.meshward.model.Evidence;
import io.meshward.model.LatencyEvidence;
import io.meshward.model.PacketLossEvidence;
import io.meshward.model.SignedEnvelope;
import io.meshward.observability.AuditLogger;
import io.meshward.protection.ByzantineProtection;
import io.meshward.quorum.CriticalEvent;
import io.meshward.routing.StigmergyRouter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One health-check pass over the peer registry.
 *
 * <p>A peer silent for longer than the timeout is marked locally dead, dropped
 * from routing and reported as a node failure. The local node's vote on that
 * failure is handed to the vote sink for broadcast. Peers already dead or
 * validated-failed are not reported again, and quarantined peers are skipped.
 */
public final class HealthMonitor {
    public static final Duration DEFAULT_PEER_TIMEOUT = Duration.ofSeconds(30);

    private final Clock clock;
    private final PeerRegistry registry;
    private final ByzantineProtection protection;
    private final StigmergyRouter router;
    private final Duration peerTimeout;
    private final AuditLogger auditLogger;
    private final Consumer<SignedEnvelope> voteSink;

    public HealthMonitor(
            Clock clock,
            PeerRegistry registry,
            ByzantineProtection protection,
            StigmergyRouter router,
            Duration peerTimeout,
            AuditLogger auditLogger,
            Consumer<SignedEnvelope> voteSink
    ) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.protection = Objects.requireNonNull(protection, "protection");
        this.router = Objects.requireNonNull(router, "router");
        this.peerTimeout = peerTimeout == null ? DEFAULT_PEER_TIMEOUT : peerTimeout;
        this.auditLogger = auditLogger;
        this.voteSink = voteSink == null ? vote -> { } : voteSink;
    }

    public HealthTickOutcome tick() {
        long nowMs = clock.millis();
        int checked = 0;
        int skipped = 0;
        List<String> markedDead = new ArrayList<>();
        List<String> reported = new ArrayList<>();
        for (PeerRecord peer : registry.activePeers()) {
            String nodeId = peer.nodeId();
            if (protection.isNodeQuarantined(nodeId)) {
                skipped++;
                continue;
            }
            checked++;
            long elapsedMs = nowMs - peer.lastSeenMs();
            if (elapsedMs <= peerTimeout.toMillis()) {
                continue;
            }
            if (registry.isLocallyDead(nodeId) || protection.isValidatedFailure(nodeId)) {
                continue;
            }
            List<Evidence> evidence = List.of(
                    new LatencyEvidence(Double.POSITIVE_INFINITY),
                    new PacketLossEvidence(1.0d),
                    new BeaconTimeoutEvidence(peer.lastSeenMs() / 1000d, elapsedMs / 1000d)
            );
            // Report and vote before the dead mark: a peer still active is retried on the next tick.
            CriticalEvent event = protection.reportNodeFailure(nodeId, evidence);
            SignedEnvelope vote = protection.castFailureVote(event);
            if (!registry.markDead(nodeId)) {
                continue;
            }
            router.forget(nodeId);
            markedDead.add(nodeId);
            reported.add(event.eventId());
            voteSink.accept(vote);
            if (auditLogger != null) {
                auditLogger.tryLog(AuditLogger.AuditEvent.of("peer.dead", "peer/" + nodeId, "locally_dead", Map.of(
                        "elapsed_ms", elapsedMs,
                        "timeout_ms", peerTimeout.toMillis(),
                        "event_id", event.eventId()
                )));
            }
        }
        return new HealthTickOutcome(checked, skipped, List.copyOf(markedDead), List.copyOf(reported));
    }

    public Duration peerTimeout() {
        return peerTimeout;
    }
}
