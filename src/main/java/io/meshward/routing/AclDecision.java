package io.meshward.routing;

import java.util.List;

public record AclDecision(AclAction action, String reason, List<AclPolicy> matchedRules) {
    public static final String ISOLATED = "acl_profile_isolated";
    public static final String EXPLICIT_DENY = "explicit_deny";
    public static final String EXPLICIT_ALLOW = "explicit_allow";
    public static final String OPEN_MESH = "open_mesh";
    public static final String DEFAULT_DENY = "default_deny";

    public AclDecision {
        matchedRules = matchedRules == null ? List.of() : List.copyOf(matchedRules);
    }

    public boolean allowed() {
        return action == AclAction.ALLOW;
    }
}
