package com.e2eq.amper.iam;

import java.util.Objects;

/**
 * Permissions policy and trust policy of one service role.
 */
public record ServiceRolePolicy(IAMPolicyDoc policy, IAMPolicyDoc assumeRolePolicy) {
    public ServiceRolePolicy {
        Objects.requireNonNull(policy, "service role policy cannot be null");
        Objects.requireNonNull(assumeRolePolicy, "assume role policy cannot be null");
    }
}
