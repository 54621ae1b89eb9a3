package io.meshward.model;

import java.util.List;

public record FailureReport(String failedNode, List<Evidence> evidence, byte[] signature) {
    public FailureReport {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
