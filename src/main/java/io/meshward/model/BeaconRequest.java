package io.meshward.model;

import java.util.List;
import java.util.Map;

/**
 * Inbound beacon as delivered by the beacon entry point.
 *
 * <p>{@code nonce} and {@code epoch} are optional; legacy senders omit them and
 * the receiver derives the nonce from the beacon timestamp at microsecond
 * precision and assumes epoch 0.
 */
public record BeaconRequest(
        String nodeId,
        double timestamp,
        List<String> neighbors,
        Long nonce,
        Long epoch,
        byte[] signature,
        byte[] publicKey
) {
    public BeaconRequest {
        neighbors = neighbors == null ? List.of() : List.copyOf(neighbors);
    }

    public static BeaconRequest unsigned(String nodeId, double timestamp, List<String> neighbors) {
        return new BeaconRequest(nodeId, timestamp, neighbors, null, null, null, null);
    }

    public static BeaconRequest fromEnvelope(SignedEnvelope envelope) {
        return new BeaconRequest(
                envelope.sender(),
                envelope.timestamp(),
                neighborsOf(envelope.payload()),
                envelope.nonce(),
                envelope.epoch(),
                envelope.signature(),
                envelope.publicKey()
        );
    }

    public boolean isSigned() {
        return signature != null && signature.length > 0 && publicKey != null && publicKey.length > 0;
    }

    public SignedEnvelope toEnvelope() {
        long resolvedNonce = nonce != null ? nonce : (long) (timestamp * 1_000_000d);
        long resolvedEpoch = epoch != null ? epoch : 0L;
        return new SignedEnvelope(
                MessageType.BEACON,
                nodeId,
                timestamp,
                resolvedNonce,
                resolvedEpoch,
                Map.of("neighbors", neighbors),
                signature,
                publicKey
        );
    }

    private static List<String> neighborsOf(Map<String, Object> payload) {
        Object raw = payload == null ? null : payload.get("neighbors");
        if (!(raw instanceof List<?>)) {
            return List.of();
        }
        return ((List<?>) raw).stream()
                .filter(v -> v != null && !v.toString().isBlank())
                .map(Object::toString)
                .toList();
    }
}
