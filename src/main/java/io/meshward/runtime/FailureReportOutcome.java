package io.meshward.runtime;

public record FailureReportOutcome(String eventId, boolean quorumReached, int signaturesCount, int quorumNeeded) {
}
