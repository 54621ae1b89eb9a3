package io.meshward.gossip;

public enum Violation {
    MALFORMED("malformed_envelope", false),
    QUARANTINED("sender_quarantined", false),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", true),
    REPLAY_ATTACK("replay_attack", true),
    STALE_EPOCH("stale_epoch", true),
    INVALID_SIGNATURE("invalid_signature", true);

    private final String code;
    private final boolean penalized;

    Violation(String code, boolean penalized) {
        this.code = code;
        this.penalized = penalized;
    }

    public String code() {
        return code;
    }

    /** Whether the sender's reputation is cut when this violation is detected. */
    public boolean penalized() {
        return penalized;
    }
}
