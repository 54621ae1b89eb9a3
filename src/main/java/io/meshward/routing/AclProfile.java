package io.meshward.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Node-level ACL posture. {@code DEFAULT} treats an empty policy list as an
 * open mesh, {@code STRICT} denies unless a rule allows, {@code ISOLATED}
 * denies everything.
 */
public enum AclProfile {
    DEFAULT,
    STRICT,
    ISOLATED;

    @JsonCreator
    public static AclProfile fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "default" -> DEFAULT;
            case "strict" -> STRICT;
            case "isolated" -> ISOLATED;
            default -> throw new IllegalArgumentException("Unknown ACL profile: " + raw);
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
