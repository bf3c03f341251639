package com.e2eq.amper.iam;

import com.e2eq.amper.exceptions.PolicyCompressionException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The composed policy bundle of a container, keyed by account name.
 *
 * <ul>
 *   <li>{@link #getAccountPolicies()} rendered documents, the synthesized deny and, for scoped accounts, allow-all</li>
 *   <li>{@link #getAccountRolePolicies()} the same list without the trailing allow-all</li>
 *   <li>{@link #getServiceRolePolicies()} account name to role name to role policies</li>
 * </ul>
 *
 * The maps and lists are immutable; the documents are normalized in place by {@link #compress(PolicyLimits)}.
 */
public class Policy {

    private final ImmutableMap<String, ImmutableList<IAMPolicyDoc>> accountPolicies;
    private final ImmutableMap<String, ImmutableList<IAMPolicyDoc>> accountRolePolicies;
    private final ImmutableMap<String, ImmutableMap<String, ServiceRolePolicy>> serviceRolePolicies;

    public Policy(Map<String, List<IAMPolicyDoc>> accountPolicies,
                  Map<String, List<IAMPolicyDoc>> accountRolePolicies,
                  Map<String, Map<String, ServiceRolePolicy>> serviceRolePolicies) {
        this.accountPolicies = copyDocuments(accountPolicies);
        this.accountRolePolicies = copyDocuments(accountRolePolicies);

        ImmutableMap.Builder<String, ImmutableMap<String, ServiceRolePolicy>> roles = ImmutableMap.builder();
        serviceRolePolicies.forEach((account, byRole) -> roles.put(account, ImmutableMap.copyOf(byRole)));
        this.serviceRolePolicies = roles.build();
    }

    public Map<String, ImmutableList<IAMPolicyDoc>> getAccountPolicies() {
        return accountPolicies;
    }

    public Map<String, ImmutableList<IAMPolicyDoc>> getAccountRolePolicies() {
        return accountRolePolicies;
    }

    public Map<String, ImmutableMap<String, ServiceRolePolicy>> getServiceRolePolicies() {
        return serviceRolePolicies;
    }

    public List<IAMPolicyDoc> accountPolicies(String account) {
        return accountPolicies.getOrDefault(account, ImmutableList.of());
    }

    public List<IAMPolicyDoc> accountRolePolicies(String account) {
        return accountRolePolicies.getOrDefault(account, ImmutableList.of());
    }

    public Map<String, ServiceRolePolicy> serviceRolePolicies(String account) {
        return serviceRolePolicies.getOrDefault(account, ImmutableMap.of());
    }

    public Set<String> accounts() {
        return accountPolicies.keySet();
    }

    /**
     * Normalize every document and validate the bundle against {@code limits}.
     */
    public void compress(PolicyLimits limits) throws PolicyCompressionException {
        PolicyCompressor.compress(this, limits);
    }

    private static ImmutableMap<String, ImmutableList<IAMPolicyDoc>> copyDocuments(Map<String, List<IAMPolicyDoc>> source) {
        ImmutableMap.Builder<String, ImmutableList<IAMPolicyDoc>> builder = ImmutableMap.builder();
        source.forEach((account, docs) -> builder.put(account, ImmutableList.copyOf(docs)));
        return builder.build();
    }
}
