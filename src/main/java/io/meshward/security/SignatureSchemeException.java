package io.meshward.security;

public final class SignatureSchemeException extends RuntimeException {
    public SignatureSchemeException(String message, Throwable cause) {
        super(message, cause);
    }
}
