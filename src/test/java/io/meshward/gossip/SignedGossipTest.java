package io.meshward.gossip;

import io.meshward.MutableClock;
import io.meshward.model.MessageType;
import io.meshward.model.SignedEnvelope;
import io.meshward.security.Ed25519SignatureScheme;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class SignedGossipTest {
    private static final Ed25519SignatureScheme SCHEME = new Ed25519SignatureScheme();

    @Test
    void sameNonceIsAcceptedOnlyOnce() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);

        SignedEnvelope envelope = sender.sign(MessageType.BEACON, Map.of("neighbors", List.of("node-x")), 42L);

        VerificationResult first = receiver.verify(envelope);
        VerificationResult second = receiver.verify(envelope);

        Assertions.assertTrue(first.ok());
        Assertions.assertFalse(second.ok());
        Assertions.assertEquals(Violation.REPLAY_ATTACK, second.violation());
        Assertions.assertTrue(second.error().startsWith("Replay attack detected"), second.error());
        Assertions.assertEquals(0.9d, receiver.reputation().reputation("node-s"), 1e-9);
    }

    @Test
    void sameNonceInDifferentEpochIsNotAReplay() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);

        Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of(), 7L)).ok());
        sender.rotateKeys();
        Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of(), 7L)).ok());
    }

    @Test
    void envelopeTwoEpochsBehindIsRejectedEvenWhenSignatureIsValid() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);
        receiver.rotateKeys();
        receiver.rotateKeys();

        VerificationResult stale = receiver.verify(sender.sign(MessageType.BEACON, Map.of()));
        Assertions.assertEquals(Violation.STALE_EPOCH, stale.violation());

        sender.rotateKeys();
        Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of())).ok(),
                "one epoch of skew is tolerated");
    }

    @Test
    void invalidSignaturesCutReputationWithoutQuarantineUntilBelowThreshold() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);

        for (int i = 0; i < 3; i++) {
            VerificationResult result = receiver.verify(tampered(sender));
            Assertions.assertEquals(Violation.INVALID_SIGNATURE, result.violation());
        }
        Assertions.assertEquals(0.729d, receiver.reputation().reputation("node-s"), 1e-9);
        Assertions.assertFalse(receiver.reputation().isQuarantined("node-s"));

        receiver.verify(tampered(sender));
        Assertions.assertEquals(0.6561d, receiver.reputation().reputation("node-s"), 1e-9);
        Assertions.assertFalse(receiver.reputation().isQuarantined("node-s"));
    }

    @Test
    void quarantineBlocksWithoutSideEffectsAndLapsesAfterExactlyThreeHundredSeconds() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);

        // 0.9^11 is still above 0.3, 0.9^12 is not.
        for (int i = 0; i < 11; i++) {
            receiver.verify(tampered(sender));
        }
        Assertions.assertFalse(receiver.reputation().isQuarantined("node-s"));
        receiver.verify(tampered(sender));
        Assertions.assertTrue(receiver.reputation().isQuarantined("node-s"));

        double before = receiver.reputation().reputation("node-s");
        int noncesBefore = receiver.trackedNonces();
        VerificationResult blocked = receiver.verify(sender.sign(MessageType.BEACON, Map.of()));
        Assertions.assertEquals(Violation.QUARANTINED, blocked.violation());
        Assertions.assertEquals(before, receiver.reputation().reputation("node-s"), 0d);
        Assertions.assertEquals(noncesBefore, receiver.trackedNonces());

        clock.advance(Duration.ofSeconds(300).minusMillis(1));
        Assertions.assertTrue(receiver.reputation().isQuarantined("node-s"));
        clock.advanceMillis(1L);
        Assertions.assertFalse(receiver.reputation().isQuarantined("node-s"));
        Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of())).ok());
    }

    @Test
    void rateLimitAppliesWithinOneSecondWindow() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock, 3, Duration.ofSeconds(300));

        for (int i = 0; i < 3; i++) {
            Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of())).ok());
        }
        VerificationResult limited = receiver.verify(sender.sign(MessageType.BEACON, Map.of()));
        Assertions.assertEquals(Violation.RATE_LIMIT_EXCEEDED, limited.violation());

        clock.advance(Duration.ofSeconds(1));
        Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of())).ok());
    }

    @Test
    void acceptedMessagesRestoreReputationUpToOne() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);

        receiver.verify(tampered(sender));
        Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of())).ok());
        Assertions.assertEquals(0.945d, receiver.reputation().reputation("node-s"), 1e-9);
        Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of())).ok());
        Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of())).ok());
        Assertions.assertEquals(1.0d, receiver.reputation().reputation("node-s"), 0d);
    }

    @Test
    void rotateKeysAdvancesEpochAndDropsNoncesOutsideAcceptedEpochs() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);
        byte[] originalKey = receiver.publicKey();

        receiver.verify(sender.sign(MessageType.BEACON, Map.of()));
        Assertions.assertEquals(1, receiver.trackedNonces());

        Assertions.assertEquals(1L, receiver.rotateKeys());
        Assertions.assertEquals(1L, receiver.currentEpoch());
        Assertions.assertEquals(1, receiver.trackedNonces(), "epoch 0 is still accepted");
        Assertions.assertFalse(Arrays.equals(originalKey, receiver.publicKey()));

        Assertions.assertEquals(2L, receiver.rotateKeys());
        Assertions.assertEquals(0, receiver.trackedNonces());

        SignedEnvelope signed = receiver.sign(MessageType.FAILURE_VOTE, Map.of("target", "node-x"));
        Assertions.assertEquals(2L, signed.epoch());
    }

    @Test
    void previousEpochMessageCannotBeReplayedAfterRotation() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);

        SignedEnvelope envelope = sender.sign(MessageType.BEACON, Map.of(), 42L);
        Assertions.assertTrue(receiver.verify(envelope).ok());

        receiver.rotateKeys();
        VerificationResult replayed = receiver.verify(envelope);

        Assertions.assertFalse(replayed.ok());
        Assertions.assertEquals(Violation.REPLAY_ATTACK, replayed.violation());

        receiver.rotateKeys();
        Assertions.assertEquals(Violation.STALE_EPOCH, receiver.verify(envelope).violation());
    }

    @Test
    void changingPayloadMapAfterSigningDoesNotBreakSignature() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-s", SCHEME, clock);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);
        Map<String, Object> payload = new HashMap<>();
        payload.put("neighbors", List.of("node-a"));

        SignedEnvelope envelope = sender.sign(MessageType.BEACON, payload);
        payload.put("neighbors", List.of("node-evil"));

        Assertions.assertTrue(receiver.verify(envelope).ok());
        Assertions.assertEquals(List.of("node-a"), envelope.payload().get("neighbors"));
    }

    @Test
    void idleSendersAndRestoredReputationsAreNotKept() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);
        for (int i = 0; i < 5; i++) {
            SignedGossip sender = new SignedGossip("node-" + i, SCHEME, clock);
            Assertions.assertTrue(receiver.verify(sender.sign(MessageType.BEACON, Map.of())).ok());
        }
        Assertions.assertEquals(5, receiver.trackedSenders());
        Assertions.assertTrue(receiver.reputation().snapshot().isEmpty(), "full reputation is the default");

        Assertions.assertEquals(0, receiver.pruneIdleSenders());
        clock.advance(Duration.ofSeconds(1));
        Assertions.assertEquals(5, receiver.pruneIdleSenders());
        Assertions.assertEquals(0, receiver.trackedSenders());

        SignedGossip penalized = new SignedGossip("node-p", SCHEME, clock);
        receiver.verify(tampered(penalized));
        Assertions.assertEquals(0.9d, receiver.reputation().snapshot().get("node-p"), 1e-9);
        Assertions.assertTrue(receiver.verify(penalized.sign(MessageType.BEACON, Map.of())).ok());
        Assertions.assertTrue(receiver.verify(penalized.sign(MessageType.BEACON, Map.of())).ok());
        Assertions.assertTrue(receiver.verify(penalized.sign(MessageType.BEACON, Map.of())).ok());
        Assertions.assertFalse(receiver.reputation().snapshot().containsKey("node-p"));
    }

    @Test
    void malformedEnvelopesAreRejectedWithoutPenalty() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip receiver = new SignedGossip("node-r", SCHEME, clock);

        Assertions.assertEquals(Violation.MALFORMED, receiver.verify(null).violation());
        SignedEnvelope blankSender = new SignedEnvelope(MessageType.BEACON, " ", 1d, 1L, 0L, Map.of(), null, null);
        Assertions.assertEquals(Violation.MALFORMED, receiver.verify(blankSender).violation());
        Assertions.assertTrue(receiver.reputation().snapshot().isEmpty());
    }

    private static SignedEnvelope tampered(SignedGossip sender) {
        SignedEnvelope good = sender.sign(MessageType.BEACON, Map.of("neighbors", List.of("node-a")));
        return new SignedEnvelope(
                good.msgType(),
                good.sender(),
                good.timestamp(),
                good.nonce(),
                good.epoch(),
                Map.of("neighbors", List.of("node-evil")),
                good.signature(),
                good.publicKey()
        );
    }
}
