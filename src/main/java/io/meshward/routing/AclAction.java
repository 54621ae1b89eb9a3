package io.meshward.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AclAction {
    ALLOW,
    DENY;

    @JsonCreator
    public static AclAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("ACL action is required");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "allow" -> ALLOW;
            case "deny" -> DENY;
            default -> throw new IllegalArgumentException("Unknown ACL action: " + raw);
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
