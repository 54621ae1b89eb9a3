package io.meshward.net;

import io.meshward.model.SignedEnvelope;
import io.meshward.util.Jsons;

import java.io.Closeable;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * UDP transport for signed envelopes. Each envelope is one datagram holding
 * its compact JSON form.
 *
 * <p>{@link #exchange(List)} sends every outbound envelope to every seed, then
 * reads datagrams for the receive window and hands each decoded envelope to
 * the handler. Datagrams that do not decode are counted and dropped.
 */
public final class BeaconChannel implements Closeable {
    public static final int MAX_DATAGRAM_BYTES = 8192;

    private final List<SeedEndpoint> seeds;
    private final long receiveWindowMs;
    private final Consumer<SignedEnvelope> handler;
    private final DatagramSocket socket;
    private final AtomicLong malformedTotal;
    private final AtomicLong sentTotal;
    private final AtomicLong receivedTotal;

    public BeaconChannel(int bindPort, List<String> seeds, long receiveWindowMs, Consumer<SignedEnvelope> handler) {
        if (bindPort < 0 || bindPort > 65535) {
            throw new IllegalArgumentException("bindPort must be in [0,65535], got " + bindPort);
        }
        this.seeds = SeedEndpoint.parseAll(seeds);
        this.receiveWindowMs = Math.max(100L, receiveWindowMs);
        this.handler = Objects.requireNonNull(handler, "handler");
        this.malformedTotal = new AtomicLong(0L);
        this.sentTotal = new AtomicLong(0L);
        this.receivedTotal = new AtomicLong(0L);
        try {
            DatagramSocket bound = new DatagramSocket(null);
            bound.setReuseAddress(true);
            bound.bind(new InetSocketAddress(bindPort));
            bound.setSoTimeout((int) Math.min(Integer.MAX_VALUE, this.receiveWindowMs));
            this.socket = bound;
        } catch (IOException e) {
            throw new RuntimeException("Failed to bind beacon channel on port " + bindPort, e);
        }
    }

    public synchronized ExchangeOutcome exchange(List<SignedEnvelope> outbound) {
        int sent = 0;
        int sendFailures = 0;
        for (SignedEnvelope envelope : outbound == null ? List.<SignedEnvelope>of() : outbound) {
            byte[] payload = Jsons.toCompactJson(envelope).getBytes(StandardCharsets.UTF_8);
            for (SeedEndpoint seed : seeds) {
                try {
                    socket.send(new DatagramPacket(payload, payload.length, InetAddress.getByName(seed.host()), seed.port()));
                    sent++;
                } catch (IOException e) {
                    sendFailures++;
                }
            }
        }
        sentTotal.addAndGet(sent);

        int received = 0;
        int dispatched = 0;
        int malformed = 0;
        long deadline = System.currentTimeMillis() + receiveWindowMs;
        while (System.currentTimeMillis() < deadline) {
            byte[] buf = new byte[MAX_DATAGRAM_BYTES];
            DatagramPacket incoming = new DatagramPacket(buf, buf.length);
            try {
                socket.setSoTimeout((int) Math.max(1L, deadline - System.currentTimeMillis()));
                socket.receive(incoming);
            } catch (SocketTimeoutException timeout) {
                break;
            } catch (IOException e) {
                if (socket.isClosed()) {
                    break;
                }
                malformed++;
                continue;
            }
            received++;
            SignedEnvelope envelope = decode(incoming);
            if (envelope == null) {
                malformed++;
                continue;
            }
            handler.accept(envelope);
            dispatched++;
        }
        receivedTotal.addAndGet(received);
        malformedTotal.addAndGet(malformed);
        return new ExchangeOutcome(sent, sendFailures, received, dispatched, malformed);
    }

    public int localPort() {
        return socket.getLocalPort();
    }

    public List<SeedEndpoint> seeds() {
        return seeds;
    }

    public long malformedTotal() {
        return malformedTotal.get();
    }

    public long sentTotal() {
        return sentTotal.get();
    }

    public long receivedTotal() {
        return receivedTotal.get();
    }

    @Override
    public void close() {
        socket.close();
    }

    private static SignedEnvelope decode(DatagramPacket packet) {
        String body = new String(packet.getData(), packet.getOffset(), packet.getLength(), StandardCharsets.UTF_8);
        try {
            SignedEnvelope envelope = Jsons.mapper().readValue(body, SignedEnvelope.class);
            if (envelope == null || envelope.msgType() == null || envelope.sender() == null || envelope.sender().isBlank()) {
                return null;
            }
            return envelope;
        } catch (IOException e) {
            return null;
        }
    }
}
