package io.meshward.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.meshward.util.Jsons;

import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Signed control message exchanged between mesh nodes.
 *
 * <p>The signing input is {@link #serialize()}: a key-sorted JSON encoding of
 * every field except {@code signature}. Binary fields travel as base64 on the
 * wire and as lowercase hex inside the signing input.
 */
public record SignedEnvelope(
        @JsonProperty("msg_type") MessageType msgType,
        @JsonProperty("sender") String sender,
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("nonce") long nonce,
        @JsonProperty("epoch") long epoch,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("signature") byte[] signature,
        @JsonProperty("public_key") byte[] publicKey
) {
    public SignedEnvelope {
        // Copied so later changes to the caller's map cannot alter the signed bytes; values may be null.
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public byte[] serialize() {
        Map<String, Object> body = new TreeMap<>();
        body.put("epoch", epoch);
        body.put("msg_type", msgType == null ? "" : msgType.name());
        body.put("nonce", nonce);
        body.put("payload", payload);
        body.put("public_key", publicKey == null ? "" : HexFormat.of().formatHex(publicKey));
        body.put("sender", sender == null ? "" : sender);
        body.put("timestamp", timestamp);
        return Jsons.canonicalBytes(body);
    }

    public SignedEnvelope withSignature(byte[] value) {
        return new SignedEnvelope(msgType, sender, timestamp, nonce, epoch, payload, value, publicKey);
    }

    @JsonIgnore
    public boolean isSigned() {
        return signature != null && signature.length > 0 && publicKey != null && publicKey.length > 0;
    }
}
