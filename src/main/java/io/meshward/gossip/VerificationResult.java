package io.meshward.gossip;

public record VerificationResult(boolean ok, Violation violation, String error) {
    private static final VerificationResult ACCEPTED = new VerificationResult(true, null, null);

    public static VerificationResult accepted() {
        return ACCEPTED;
    }

    public static VerificationResult rejected(Violation violation, String error) {
        return new VerificationResult(false, violation, error);
    }
}
