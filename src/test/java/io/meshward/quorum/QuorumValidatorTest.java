package io.meshward.quorum;

import io.meshward.MutableClock;
import io.meshward.model.CriticalEventType;
import io.meshward.model.PacketLossEvidence;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class QuorumValidatorTest {

    @Test
    void sevenOfTenValidatorsAreNeededAtDefaultThreshold() {
        QuorumValidator quorum = new QuorumValidator(10, QuorumValidator.DEFAULT_QUORUM_THRESHOLD, new MutableClock(0L));
        Assertions.assertEquals(7, quorum.quorumSize());

        CriticalEvent event = quorum.report(CriticalEventType.NODE_FAILURE, "peer-p", List.of(new PacketLossEvidence(1.0d)));
        for (int i = 1; i <= 6; i++) {
            Assertions.assertFalse(quorum.validate(event, "validator-" + i, new byte[]{(byte) i}));
        }
        Assertions.assertFalse(event.validated());
        Assertions.assertTrue(quorum.validate(event, "validator-7", new byte[]{7}));
        Assertions.assertTrue(event.validated());
        Assertions.assertEquals(7, event.signatureCount());
    }

    @Test
    void repeatedValidatorDoesNotInflateCount() {
        QuorumValidator quorum = new QuorumValidator(3, 0.67d, new MutableClock(0L));
        CriticalEvent event = quorum.report(CriticalEventType.NODE_FAILURE, "peer-p", List.of());

        quorum.validate(event, "validator-1", new byte[]{1});
        quorum.validate(event, "validator-1", new byte[]{2});
        Assertions.assertEquals(1, event.signatureCount());
        Assertions.assertFalse(event.validated());

        Assertions.assertFalse(quorum.validate(event, "validator-2", new byte[]{3}));
        Assertions.assertTrue(quorum.validate(event, "validator-3", new byte[]{4}));
    }

    @Test
    void reportingSamePairReturnsExistingEventEvenWhenValidated() {
        QuorumValidator quorum = new QuorumValidator(1, 1.0d, new MutableClock(5_000L));
        CriticalEvent first = quorum.report(CriticalEventType.NODE_FAILURE, "peer-p", List.of());
        Assertions.assertTrue(quorum.validate(first, "validator-1", new byte[]{1}));

        CriticalEvent again = quorum.report(CriticalEventType.NODE_FAILURE, "peer-p", List.of(new PacketLossEvidence(0.5d)));
        Assertions.assertSame(first, again);
        Assertions.assertTrue(again.validated());
        Assertions.assertTrue(again.evidence().isEmpty());
        Assertions.assertEquals("NODE_FAILURE:peer-p:5", again.eventId());

        CriticalEvent link = quorum.report(CriticalEventType.LINK_DOWN, "peer-p", List.of());
        Assertions.assertNotSame(first, link);
    }

    @Test
    void validatedEventNeverReverts() {
        QuorumValidator quorum = new QuorumValidator(2, 0.5d, new MutableClock(0L));
        CriticalEvent event = quorum.report(CriticalEventType.LINK_DOWN, "a->b", List.of());
        Assertions.assertTrue(quorum.validate(event, "validator-1", new byte[]{1}));
        Assertions.assertTrue(quorum.validate(event, "validator-1", new byte[]{1}));
        Assertions.assertTrue(event.validated());
        Assertions.assertEquals(1, quorum.validatedEvents().size());
        Assertions.assertTrue(quorum.pending().isEmpty());
    }

    @Test
    void pendingEventsAreKeptForeverWithoutTtl() {
        MutableClock clock = new MutableClock(0L);
        QuorumValidator quorum = new QuorumValidator(10, 0.67d, clock);
        quorum.report(CriticalEventType.NODE_FAILURE, "peer-p", List.of());
        clock.advance(Duration.ofDays(30));
        Assertions.assertTrue(quorum.evictExpired().isEmpty());
        Assertions.assertEquals(1, quorum.pending().size());
    }

    @Test
    void ttlEvictsOnlyUnvalidatedEvents() {
        MutableClock clock = new MutableClock(0L);
        QuorumValidator quorum = new QuorumValidator(2, 0.5d, clock, Duration.ofSeconds(10));
        quorum.report(CriticalEventType.NODE_FAILURE, "peer-stuck", List.of());
        CriticalEvent done = quorum.report(CriticalEventType.NODE_FAILURE, "peer-done", List.of());
        quorum.validate(done, "validator-1", new byte[]{1});

        clock.advance(Duration.ofSeconds(9));
        Assertions.assertTrue(quorum.evictExpired().isEmpty());

        clock.advance(Duration.ofSeconds(2));
        List<CriticalEvent> evicted = quorum.evictExpired();
        Assertions.assertEquals(1, evicted.size());
        Assertions.assertEquals("peer-stuck", evicted.get(0).target());
        Assertions.assertNull(quorum.find(CriticalEventType.NODE_FAILURE, "peer-stuck"));
        Assertions.assertSame(done, quorum.find(CriticalEventType.NODE_FAILURE, "peer-done"));
    }

    @Test
    void invalidConfigurationIsRejected() {
        MutableClock clock = new MutableClock(0L);
        Assertions.assertThrows(IllegalArgumentException.class, () -> new QuorumValidator(0, 0.67d, clock));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new QuorumValidator(10, 0d, clock));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new QuorumValidator(10, 1.5d, clock));
        QuorumValidator quorum = new QuorumValidator(10, 0.67d, clock);
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> quorum.report(CriticalEventType.NODE_FAILURE, " ", List.of()));
    }
}
