package io.meshward.health;

import java.util.List;

public record HealthTickOutcome(int checked, int skippedQuarantined, List<String> markedDead, List<String> reportedEvents) {
}
