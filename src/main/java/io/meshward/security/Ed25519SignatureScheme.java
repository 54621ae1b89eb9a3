package io.meshward.security;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;

public final class Ed25519SignatureScheme implements SignatureScheme {
    private static final String ALGORITHM = "Ed25519";

    private final KeyFactory keyFactory;

    public Ed25519SignatureScheme() {
        try {
            this.keyFactory = KeyFactory.getInstance(ALGORITHM);
            // Probe the remaining primitives so a missing provider fails here, not on first use.
            KeyPairGenerator.getInstance(ALGORITHM);
            Signature.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new SignatureSchemeException("Signature backend unavailable: " + ALGORITHM, e);
        }
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new SignatureSchemeException("Failed to generate " + ALGORITHM + " keypair", e);
        }
    }

    @Override
    public byte[] sign(PrivateKey privateKey, byte[] payload) {
        try {
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.initSign(privateKey);
            signer.update(payload);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new SignatureSchemeException("Failed to sign payload", e);
        }
    }

    @Override
    public boolean verify(byte[] encodedPublicKey, byte[] payload, byte[] signature) {
        if (encodedPublicKey == null || encodedPublicKey.length == 0 || signature == null || signature.length == 0) {
            return false;
        }
        try {
            PublicKey key;
            synchronized (keyFactory) {
                key = keyFactory.generatePublic(new X509EncodedKeySpec(encodedPublicKey));
            }
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(key);
            verifier.update(payload);
            return verifier.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }
}
