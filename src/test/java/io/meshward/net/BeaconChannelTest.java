package io.meshward.net;

import io.meshward.MutableClock;
import io.meshward.gossip.SignedGossip;
import io.meshward.model.MessageType;
import io.meshward.model.SignedEnvelope;
import io.meshward.security.Ed25519SignatureScheme;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

final class BeaconChannelTest {

    @Test
    void signedEnvelopeSurvivesTheWireAndStillVerifies() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SignedGossip sender = new SignedGossip("node-a", new Ed25519SignatureScheme(), clock);
        SignedGossip receiver = new SignedGossip("node-b", new Ed25519SignatureScheme(), clock);
        List<SignedEnvelope> delivered = new CopyOnWriteArrayList<>();

        try (BeaconChannel b = new BeaconChannel(0, List.of(), 300L, delivered::add);
             BeaconChannel a = new BeaconChannel(0, List.of("127.0.0.1:" + b.localPort()), 100L, env -> { })) {
            SignedEnvelope beacon = sender.sign(MessageType.BEACON, Map.of("neighbors", List.of("node-c")));

            ExchangeOutcome sent = a.exchange(List.of(beacon));
            Assertions.assertEquals(1, sent.sent());

            ExchangeOutcome received = b.exchange(List.of());
            Assertions.assertEquals(1, received.dispatched());
            Assertions.assertEquals(1, delivered.size());
            SignedEnvelope decoded = delivered.get(0);
            Assertions.assertEquals("node-a", decoded.sender());
            Assertions.assertEquals(List.of("node-c"), decoded.payload().get("neighbors"));
            Assertions.assertTrue(receiver.verify(decoded).ok());
        }
    }

    @Test
    void garbageDatagramsAreCountedNotThrown() throws Exception {
        try (BeaconChannel channel = new BeaconChannel(0, List.of(), 300L, env -> Assertions.fail("nothing should decode"));
             DatagramSocket raw = new DatagramSocket()) {
            byte[] junk = "{\"msg_type\":\"NOT_A_TYPE\"}".getBytes(StandardCharsets.UTF_8);
            byte[] notJson = "hello".getBytes(StandardCharsets.UTF_8);
            InetAddress local = InetAddress.getByName("127.0.0.1");
            raw.send(new DatagramPacket(junk, junk.length, local, channel.localPort()));
            raw.send(new DatagramPacket(notJson, notJson.length, local, channel.localPort()));

            ExchangeOutcome outcome = channel.exchange(List.of());
            Assertions.assertEquals(2, outcome.received());
            Assertions.assertEquals(2, outcome.malformed());
            Assertions.assertEquals(2L, channel.malformedTotal());
        }
    }

    @Test
    void seedListSkipsInvalidAndDuplicateEntries() {
        List<SeedEndpoint> seeds = SeedEndpoint.parseAll(List.of(
                "10.0.0.1:7000", "10.0.0.1:7000", "bad", ":7000", "host:0", "host:70000", "host:x", " node-b:7001 "
        ));
        Assertions.assertEquals(List.of(new SeedEndpoint("10.0.0.1", 7000), new SeedEndpoint("node-b", 7001)), seeds);
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BeaconChannel(70000, List.of(), 100L, env -> { }));
    }
}
