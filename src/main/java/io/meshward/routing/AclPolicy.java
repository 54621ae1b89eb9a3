package io.meshward.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/** One tag rule; {@code *} on either side matches any tag. */
public record AclPolicy(
        @JsonProperty("source_tag") String sourceTag,
        @JsonProperty("target_tag") String targetTag,
        @JsonProperty("action") AclAction action
) {
    public static final String WILDCARD = "*";

    public AclPolicy {
        sourceTag = sourceTag == null ? "" : sourceTag.trim();
        targetTag = targetTag == null ? "" : targetTag.trim();
        if (action == null) {
            throw new IllegalArgumentException("ACL action is required");
        }
    }

    public static AclPolicy allow(String sourceTag, String targetTag) {
        return new AclPolicy(sourceTag, targetTag, AclAction.ALLOW);
    }

    public static AclPolicy deny(String sourceTag, String targetTag) {
        return new AclPolicy(sourceTag, targetTag, AclAction.DENY);
    }

    public boolean matches(Collection<String> sourceTags, Collection<String> targetTags) {
        return side(sourceTag, sourceTags) && side(targetTag, targetTags);
    }

    private static boolean side(String ruleTag, Collection<String> tags) {
        if (WILDCARD.equals(ruleTag)) {
            return true;
        }
        return !ruleTag.isEmpty() && tags.contains(ruleTag);
    }
}
