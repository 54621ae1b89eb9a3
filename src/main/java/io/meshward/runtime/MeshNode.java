package io.meshward.runtime;

import io.meshward.config.MeshSettings;
import io.meshward.gossip.SignedGossip;
import io.meshward.gossip.VerificationResult;
import io.meshward.health.HealthMonitor;
import io.meshward.health.PeerRecord;
import io.meshward.health.PeerRegistry;
import io.meshward.model.BeaconRequest;
import io.meshward.model.Evidence;
import io.meshward.model.FailureReport;
import io.meshward.model.MessageType;
import io.meshward.model.SignedEnvelope;
import io.meshward.net.BeaconChannel;
import io.meshward.net.ExchangeOutcome;
import io.meshward.observability.AuditLogger;
import io.meshward.observability.PrometheusFormatter;
import io.meshward.protection.ByzantineProtection;
import io.meshward.protection.VoteOutcome;
import io.meshward.quorum.CriticalEvent;
import io.meshward.quorum.QuorumValidator;
import io.meshward.routing.StigmergyRouter;
import io.meshward.security.SignatureScheme;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One mesh node: owns the peer registry, routing table, gossip state and
 * pending quorum events, and the loops that drive them.
 *
 * <p>Everything outside this class mutates that state through the methods
 * below. Each table serializes its own updates, so the loops run on separate
 * threads without a node-wide lock.
 */
public final class MeshNode {
    private final MeshSettings settings;
    private final Clock clock;
    private final AuditLogger auditLogger;
    private final SignedGossip gossip;
    private final QuorumValidator quorum;
    private final ByzantineProtection protection;
    private final StigmergyRouter router;
    private final PeerRegistry registry;
    private final HealthMonitor healthMonitor;
    private final ConcurrentLinkedQueue<SignedEnvelope> outboundVotes;
    private final List<PeriodicLoop> loops;
    private final AtomicLong beaconsReceived;
    private final AtomicLong beaconsRejected;
    private final AtomicLong votesReceived;
    private volatile BeaconChannel channel;
    private volatile boolean running;

    public MeshNode(MeshSettings settings, Clock clock, SignatureScheme scheme, AuditLogger auditLogger) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.auditLogger = auditLogger;
        this.gossip = new SignedGossip(
                settings.nodeId(),
                scheme,
                clock,
                settings.rateLimitPerSecond(),
                settings.quarantine()
        );
        this.quorum = new QuorumValidator(settings.totalNodes(), settings.quorumThreshold(), clock, settings.pendingEventTtl());
        this.protection = new ByzantineProtection(gossip, quorum, auditLogger);
        this.router = new StigmergyRouter(
                clock,
                new HashSet<>(settings.localTags()),
                settings.pheromoneDecayRate(),
                settings.pheromoneBoost(),
                settings.pheromoneMin()
        );
        router.updatePolicies(settings.aclPolicies(), settings.peerTags());
        router.updateProfile(settings.aclProfile());
        this.registry = new PeerRegistry();
        this.outboundVotes = new ConcurrentLinkedQueue<>();
        this.healthMonitor = new HealthMonitor(
                clock,
                registry,
                protection,
                router,
                settings.peerTimeout(),
                auditLogger,
                outboundVotes::add
        );
        this.loops = new ArrayList<>();
        this.beaconsReceived = new AtomicLong(0L);
        this.beaconsRejected = new AtomicLong(0L);
        this.votesReceived = new AtomicLong(0L);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        if (settings.bindPort() > 0) {
            channel = new BeaconChannel(settings.bindPort(), settings.seeds(), settings.receiveWindowMs(), this::receiveEnvelope);
        }
        loops.add(new PeriodicLoop("health", settings.healthCheckIntervalMs(), this::runHealthCheck, auditLogger));
        loops.add(new PeriodicLoop("evaporation", settings.decayIntervalMs(), this::runEvaporation, auditLogger));
        if (channel != null) {
            loops.add(new PeriodicLoop("gossip", settings.gossipIntervalMs(), this::runGossipExchange, auditLogger));
        }
        if (settings.keyRotationIntervalMs() > 0L) {
            loops.add(new PeriodicLoop("key-rotation", settings.keyRotationIntervalMs(), protection::rotateKeys, auditLogger));
        }
        if (settings.pendingEventTtlMs() > 0L) {
            loops.add(new PeriodicLoop("pending-eviction", settings.healthCheckIntervalMs(), protection::evictExpiredEvents, auditLogger));
        }
        running = true;
        for (PeriodicLoop loop : loops) {
            loop.start();
        }
        audit("node.start", "node/" + settings.nodeId(), "ok", Map.of(
                "loops", loops.stream().map(PeriodicLoop::name).toList(),
                "bind_port", channel == null ? 0 : channel.localPort(),
                "quorum_size", quorum.quorumSize()
        ));
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        for (PeriodicLoop loop : loops) {
            loop.stop();
        }
        long loopErrors = loopErrors();
        loops.clear();
        if (channel != null) {
            channel.close();
        }
        audit("node.stop", "node/" + settings.nodeId(), "ok", Map.of(
                "beacons_received", beaconsReceived.get(),
                "loop_errors", loopErrors
        ));
    }

    public BeaconOutcome receiveBeacon(BeaconRequest request) {
        if (request == null || request.nodeId() == null || request.nodeId().isBlank()) {
            return reject(null, BeaconOutcome.MALFORMED, "Beacon without node id");
        }
        String peer = request.nodeId().trim();
        if (peer.equals(settings.nodeId())) {
            return reject(peer, BeaconOutcome.SELF, "Beacon from local node");
        }
        if (protection.isNodeQuarantined(peer)) {
            return reject(peer, BeaconOutcome.QUARANTINED, "Node " + peer + " is quarantined");
        }
        if (!protection.shouldAcceptMessage(peer)) {
            return reject(peer, BeaconOutcome.LOW_REPUTATION, "Node " + peer + " has low reputation");
        }
        if (request.isSigned()) {
            VerificationResult verified = protection.verifyBeacon(request.toEnvelope());
            if (!verified.ok()) {
                return reject(peer, verified.violation().code(), verified.error());
            }
        } else if (settings.requireSignedBeacons()) {
            return reject(peer, BeaconOutcome.UNSIGNED, "Unsigned beacon from " + peer);
        }

        boolean recovered = registry.touch(peer, clock.millis(), request.neighbors());
        beaconsReceived.incrementAndGet();
        if (recovered) {
            audit("peer.recovered", "peer/" + peer, "alive", Map.of("validated_failure", protection.isValidatedFailure(peer)));
        }
        if (!protection.isValidatedFailure(peer)) {
            router.reinforce(peer, peer, true);
            for (String neighbor : request.neighbors()) {
                if (!neighbor.equals(settings.nodeId()) && !neighbor.equals(peer)) {
                    router.reinforce(neighbor, peer, true);
                }
            }
        }
        return new BeaconOutcome(true, peer, BeaconOutcome.ACCEPTED, null, recovered, registry.activeCount());
    }

    /** Entry point for envelopes arriving over the beacon channel. */
    public void receiveEnvelope(SignedEnvelope envelope) {
        if (envelope == null || envelope.msgType() == null || settings.nodeId().equals(envelope.sender())) {
            return;
        }
        if (envelope.msgType() == MessageType.BEACON) {
            receiveBeacon(BeaconRequest.fromEnvelope(envelope));
        } else if (envelope.msgType() == MessageType.FAILURE_VOTE) {
            receiveFailureVote(envelope);
        }
    }

    public VoteOutcome receiveFailureVote(SignedEnvelope vote) {
        VoteOutcome outcome = protection.recordFailureVote(vote);
        if (outcome.accepted()) {
            votesReceived.incrementAndGet();
            if (outcome.validated()) {
                dropValidatedRoutes();
            }
        }
        return outcome;
    }

    /**
     * Reports a failure and adds this node's validation. Without a signature in
     * the report, the node signs a vote itself and queues it for broadcast.
     */
    public FailureReportOutcome reportFailure(FailureReport report) {
        Objects.requireNonNull(report, "report");
        CriticalEvent event = protection.reportNodeFailure(report.failedNode(), report.evidence());
        boolean validated;
        if (report.signature() != null && report.signature().length > 0) {
            validated = protection.validateNodeFailure(event, report.signature());
        } else {
            outboundVotes.add(protection.castFailureVote(event));
            validated = event.validated();
        }
        if (validated) {
            dropValidatedRoutes();
        }
        return new FailureReportOutcome(event.eventId(), validated, event.signatureCount(), quorum.quorumSize());
    }

    public CriticalEvent reportLinkDown(String fromNode, String toNode, List<Evidence> evidence) {
        CriticalEvent event = protection.reportLinkDown(fromNode, toNode, evidence);
        outboundVotes.add(protection.castFailureVote(event));
        return event;
    }

    public RouteDecision resolveRoute(String destination) {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination is required");
        }
        String dest = destination.trim();
        if (dest.equals(settings.nodeId())) {
            return new RouteDecision(dest, RouteDecision.DELIVERED, null, List.of(), "local_node");
        }
        if (protection.isValidatedFailure(dest)) {
            return new RouteDecision(dest, RouteDecision.UNREACHABLE, null, List.of(), "validated_failure");
        }
        if (registry.isLocallyDead(dest)) {
            return new RouteDecision(dest, RouteDecision.UNREACHABLE, null, List.of(), "locally_dead");
        }
        List<String> usable = new ArrayList<>();
        for (String hop : router.getRedundantPaths(dest, Integer.MAX_VALUE)) {
            if (!protection.isValidatedFailure(hop) && !registry.isLocallyDead(hop)) {
                usable.add(hop);
            }
            if (usable.size() == StigmergyRouter.DEFAULT_PATH_LIMIT) {
                break;
            }
        }
        if (usable.isEmpty()) {
            return new RouteDecision(dest, RouteDecision.UNREACHABLE, null, List.of(), "no_route");
        }
        return new RouteDecision(dest, RouteDecision.ROUTED, usable.get(0), usable.subList(1, usable.size()), "pheromone");
    }

    public List<PeerView> peers() {
        long nowMs = clock.millis();
        Set<String> validated = protection.validatedFailures();
        List<PeerView> out = new ArrayList<>();
        for (PeerRecord peer : registry.activePeers()) {
            long elapsedMs = nowMs - peer.lastSeenMs();
            out.add(new PeerView(
                    peer.nodeId(),
                    registry.state(peer.nodeId(), validated),
                    peer.lastSeenMs(),
                    elapsedMs / 1000d,
                    elapsedMs < settings.peerTimeoutMs(),
                    peer.neighbors(),
                    protection.getNodeReputation(peer.nodeId()),
                    protection.isNodeQuarantined(peer.nodeId()),
                    validated.contains(peer.nodeId())
            ));
        }
        return out;
    }

    public MeshStatus status() {
        return new MeshStatus(
                settings.nodeId(),
                running,
                registry.activeCount(),
                new ArrayList<>(registry.locallyDead()),
                new ArrayList<>(protection.validatedFailures()),
                beaconsReceived.get(),
                beaconsRejected.get(),
                votesReceived.get(),
                router.trackedPairs(),
                router.profile().wireName(),
                router.policies().size(),
                channel == null ? 0L : channel.malformedTotal(),
                loopErrors(),
                protection.getProtectionStats()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(status());
    }

    public void runHealthCheck() {
        healthMonitor.tick();
    }

    public StigmergyRouter.EvaporationOutcome runEvaporation() {
        gossip.pruneIdleSenders();
        StigmergyRouter.EvaporationOutcome outcome = router.evaporate();
        if (outcome.pruned() > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("decayed", outcome.decayed());
            details.put("pruned", outcome.pruned());
            details.put("destinations_removed", outcome.destinationsRemoved());
            audit("router.evaporate", "router/pheromones", "pruned", details);
        }
        return outcome;
    }

    public ExchangeOutcome runGossipExchange() {
        BeaconChannel current = channel;
        if (current == null) {
            return new ExchangeOutcome(0, 0, 0, 0, 0);
        }
        List<SignedEnvelope> outbound = new ArrayList<>();
        outbound.add(protection.signBeacon(registry.activePeers().stream().map(PeerRecord::nodeId).toList()));
        SignedEnvelope vote;
        while ((vote = outboundVotes.poll()) != null) {
            outbound.add(vote);
        }
        return current.exchange(outbound);
    }

    /** Votes signed locally and not yet sent; draining them hands them to the caller. */
    public List<SignedEnvelope> drainOutboundVotes() {
        List<SignedEnvelope> out = new ArrayList<>();
        SignedEnvelope vote;
        while ((vote = outboundVotes.poll()) != null) {
            out.add(vote);
        }
        return out;
    }

    public SignedEnvelope signBeacon() {
        return protection.signBeacon(registry.activePeers().stream().map(PeerRecord::nodeId).toList());
    }

    public String nodeId() {
        return settings.nodeId();
    }

    public MeshSettings settings() {
        return settings;
    }

    public boolean isRunning() {
        return running;
    }

    public ByzantineProtection protection() {
        return protection;
    }

    public StigmergyRouter router() {
        return router;
    }

    public PeerRegistry registry() {
        return registry;
    }

    public QuorumValidator quorum() {
        return quorum;
    }

    public BeaconChannel channel() {
        return channel;
    }

    private void dropValidatedRoutes() {
        for (String failed : protection.validatedFailures()) {
            router.forget(failed);
        }
    }

    private long loopErrors() {
        long total = 0L;
        synchronized (this) {
            for (PeriodicLoop loop : loops) {
                total += loop.errors();
            }
        }
        return total;
    }

    private BeaconOutcome reject(String peer, String reason, String error) {
        beaconsRejected.incrementAndGet();
        audit("beacon.rejected", "peer/" + (peer == null ? "unknown" : peer), reason, Map.of("error", error));
        return new BeaconOutcome(false, peer, reason, error, false, registry.activeCount());
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.tryLog(AuditLogger.AuditEvent.of(action, resource, result, details));
        }
    }
}
