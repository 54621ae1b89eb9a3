package io.meshward.protection;

public record VoteOutcome(
        boolean accepted,
        String error,
        String eventId,
        boolean validated,
        int signatures,
        int quorumNeeded
) {
    static VoteOutcome rejected(String error, int quorumNeeded) {
        return new VoteOutcome(false, error, null, false, 0, quorumNeeded);
    }
}
