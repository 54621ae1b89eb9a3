package io.meshward.gossip;

import io.meshward.model.MessageType;
import io.meshward.model.SignedEnvelope;
import io.meshward.security.SignatureScheme;

import java.security.KeyPair;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Signs outbound control messages and screens inbound ones.
 *
 * <p>Inbound checks run in a fixed order: quarantine, rate limit, replay,
 * stale epoch, signature. A quarantined sender is turned away without any
 * state change; every other rejection costs the sender reputation. Acceptance
 * records the nonce and the rate-limit timestamp and rewards the sender.
 *
 * <p>Table checks and updates happen under one lock. The signature check runs
 * outside it so a slow verification does not stall other senders; the replay
 * check is repeated when the result is committed.
 */
public final class SignedGossip {
    public static final int DEFAULT_RATE_LIMIT_PER_SECOND = 100;

    private final String nodeId;
    private final SignatureScheme scheme;
    private final Clock clock;
    private final ReputationLedger reputation;
    private final ReplayGuard replayGuard;
    private final SenderRateLimiter rateLimiter;
    private final AtomicLong lastNonce;
    private final Object lock;
    private volatile KeyPair keyPair;
    private volatile byte[] encodedPublicKey;
    private volatile long currentEpoch;

    public SignedGossip(String nodeId, SignatureScheme scheme, Clock clock) {
        this(nodeId, scheme, clock, DEFAULT_RATE_LIMIT_PER_SECOND, ReputationLedger.DEFAULT_QUARANTINE);
    }

    public SignedGossip(
            String nodeId,
            SignatureScheme scheme,
            Clock clock,
            int rateLimitPerSecond,
            Duration quarantineDuration
    ) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        this.nodeId = nodeId.trim();
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reputation = new ReputationLedger(clock, quarantineDuration);
        this.replayGuard = new ReplayGuard();
        this.rateLimiter = new SenderRateLimiter(rateLimitPerSecond);
        this.lastNonce = new AtomicLong(0L);
        this.lock = new Object();
        this.currentEpoch = 0L;
        installKeyPair(scheme.generateKeyPair());
    }

    public SignedEnvelope sign(MessageType msgType, Map<String, Object> payload) {
        return sign(msgType, payload, null);
    }

    public SignedEnvelope sign(MessageType msgType, Map<String, Object> payload, Long nonce) {
        Objects.requireNonNull(msgType, "msgType");
        Instant now = clock.instant();
        long resolvedNonce = nonce != null ? nonce : nextNonce(now);
        KeyPair keys = keyPair;
        SignedEnvelope unsigned = new SignedEnvelope(
                msgType,
                nodeId,
                now.toEpochMilli() / 1000d,
                resolvedNonce,
                currentEpoch,
                payload,
                null,
                encodedPublicKey
        );
        return unsigned.withSignature(scheme.sign(keys.getPrivate(), unsigned.serialize()));
    }

    public VerificationResult verify(SignedEnvelope envelope) {
        if (envelope == null || envelope.msgType() == null || envelope.sender() == null || envelope.sender().isBlank()) {
            return VerificationResult.rejected(Violation.MALFORMED, "Malformed envelope");
        }
        String sender = envelope.sender();
        if (reputation.isQuarantined(sender)) {
            return VerificationResult.rejected(Violation.QUARANTINED, "Sender " + sender + " is quarantined");
        }
        synchronized (lock) {
            VerificationResult precheck = checkTables(envelope, clock.millis());
            if (precheck != null) {
                return precheck;
            }
        }
        boolean signatureValid = envelope.isSigned()
                && scheme.verify(envelope.publicKey(), envelope.serialize(), envelope.signature());
        synchronized (lock) {
            if (!signatureValid) {
                return reject(sender, Violation.INVALID_SIGNATURE, "Invalid signature from " + sender);
            }
            if (!replayGuard.record(sender, envelope.epoch(), envelope.nonce())) {
                return reject(sender, Violation.REPLAY_ATTACK, replayMessage(envelope));
            }
            rateLimiter.record(sender, clock.millis());
            reputation.reward(sender);
            return VerificationResult.accepted();
        }
    }

    /**
     * Advances the epoch and installs a fresh keypair. Nonces of the previous
     * epoch are kept as long as that epoch is still accepted; older ones are
     * forgotten.
     */
    public long rotateKeys() {
        KeyPair fresh = scheme.generateKeyPair();
        synchronized (lock) {
            currentEpoch++;
            installKeyPair(fresh);
            replayGuard.retainFrom(currentEpoch - 1L);
            return currentEpoch;
        }
    }

    public String nodeId() {
        return nodeId;
    }

    public long currentEpoch() {
        return currentEpoch;
    }

    public byte[] publicKey() {
        return encodedPublicKey.clone();
    }

    public ReputationLedger reputation() {
        return reputation;
    }

    public String algorithm() {
        return scheme.algorithm();
    }

    public int trackedNonces() {
        synchronized (lock) {
            return replayGuard.size();
        }
    }

    /**
     * Forgets rate windows of senders idle for a full window and expired
     * quarantines.
     *
     * @return number of rate windows removed
     */
    public int pruneIdleSenders() {
        reputation.quarantined();
        synchronized (lock) {
            return rateLimiter.prune(clock.millis());
        }
    }

    public int trackedSenders() {
        synchronized (lock) {
            return rateLimiter.trackedSenders();
        }
    }

    public int rateLimitPerSecond() {
        return rateLimiter.maxPerWindow();
    }

    private VerificationResult checkTables(SignedEnvelope envelope, long nowMs) {
        String sender = envelope.sender();
        if (rateLimiter.exceeded(sender, nowMs)) {
            return reject(sender, Violation.RATE_LIMIT_EXCEEDED,
                    "Rate limit exceeded for " + sender + " (max " + rateLimiter.maxPerWindow() + "/s)");
        }
        if (replayGuard.contains(sender, envelope.epoch(), envelope.nonce())) {
            return reject(sender, Violation.REPLAY_ATTACK, replayMessage(envelope));
        }
        if (envelope.epoch() < currentEpoch - 1L) {
            return reject(sender, Violation.STALE_EPOCH,
                    "Stale epoch " + envelope.epoch() + " from " + sender + " (current " + currentEpoch + ")");
        }
        return null;
    }

    private VerificationResult reject(String sender, Violation violation, String error) {
        if (violation.penalized()) {
            reputation.penalize(sender);
        }
        return VerificationResult.rejected(violation, error);
    }

    private static String replayMessage(SignedEnvelope envelope) {
        return "Replay attack detected: nonce " + envelope.nonce()
                + " already used by " + envelope.sender() + " in epoch " + envelope.epoch();
    }

    private long nextNonce(Instant now) {
        long micros = now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000L;
        return lastNonce.updateAndGet(prev -> Math.max(prev + 1L, micros));
    }

    private void installKeyPair(KeyPair fresh) {
        this.keyPair = fresh;
        this.encodedPublicKey = fresh.getPublic().getEncoded();
    }
}
