package io.meshward.runtime;

public record BeaconOutcome(
        boolean accepted,
        String nodeId,
        String reason,
        String error,
        boolean recovered,
        int peersCount
) {
    public static final String ACCEPTED = "accepted";
    public static final String MALFORMED = "malformed";
    public static final String SELF = "self";
    public static final String QUARANTINED = "quarantined";
    public static final String LOW_REPUTATION = "low_reputation";
    public static final String UNSIGNED = "unsigned";
}
