package io.meshward.security;

import java.security.KeyPair;
import java.security.PrivateKey;

/**
 * Signing capability used by the gossip layer.
 *
 * <p>Implementations must be thread-safe. {@link #verify} never throws for
 * malformed keys or signatures; it answers {@code false}.
 */
public interface SignatureScheme {

    String algorithm();

    KeyPair generateKeyPair();

    byte[] sign(PrivateKey privateKey, byte[] payload);

    /**
     * @param encodedPublicKey public key as produced by {@link java.security.PublicKey#getEncoded()}
     */
    boolean verify(byte[] encodedPublicKey, byte[] payload, byte[] signature);
}
