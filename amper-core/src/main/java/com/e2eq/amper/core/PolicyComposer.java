package com.e2eq.amper.core;

import com.e2eq.amper.exceptions.PolicyCompressionException;
import com.e2eq.amper.exceptions.TemplateRenderException;
import com.e2eq.amper.exceptions.UnsupportedPolicyVersionException;
import com.e2eq.amper.iam.IAMPolicyDoc;
import com.e2eq.amper.iam.IAMPolicyStatement;
import com.e2eq.amper.iam.Policy;
import com.e2eq.amper.iam.PolicyLimits;
import com.e2eq.amper.iam.ServiceRolePolicy;
import com.e2eq.amper.util.CommonUtils;
import com.e2eq.amper.util.ExceptionLoggingUtils;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the default-deny policy bundle of one container.
 *
 * <p>Every attachment is rendered in insertion order. Per account the rendered documents are
 * followed by a synthesized deny statement: deny everything when no attached template declared
 * a scope, otherwise deny every action outside the union of declared scopes. Scoped accounts
 * additionally get a trailing allow-all document in their account policies, never in their
 * role policies.</p>
 *
 * <p>The first failure aborts the whole composition. A template that renders nothing is not a
 * failure: it yields an empty placeholder document and is reported in
 * {@link PolicyResult#missing()}.</p>
 */
final class PolicyComposer {

    private static final Logger LOG = Logger.getLogger(PolicyComposer.class);

    private final Container container;
    private final PolicyLimits limits;

    private final Map<String, List<IAMPolicyDoc>> accountPolicies = new LinkedHashMap<>();
    private final Map<String, List<IAMPolicyDoc>> accountRolePolicies = new LinkedHashMap<>();
    private final Map<String, Map<String, ServiceRolePolicy>> serviceRolePolicies = new LinkedHashMap<>();
    private final Map<String, Set<String>> scopes = new LinkedHashMap<>();
    private final List<Attachment> missing = new ArrayList<>();

    PolicyComposer(Container container, PolicyLimits limits) {
        this.container = container;
        this.limits = limits;
    }

    // caller holds the registry and container read locks
    PolicyResult compose(List<Attachment> attachments)
            throws TemplateRenderException, UnsupportedPolicyVersionException, PolicyCompressionException {
        try {
            for (Attachment a : attachments) {
                render(a);
            }
            synthesizeDefaults();

            Policy policy = new Policy(accountPolicies, accountRolePolicies, serviceRolePolicies);
            policy.compress(limits);

            LOG.debugf("Composed policy for %d account(s) in container '%s', %d missing template(s)",
                    Integer.valueOf(accountPolicies.size()), container.getId(), Integer.valueOf(missing.size()));
            return new PolicyResult(policy, missing);
        } catch (TemplateRenderException | UnsupportedPolicyVersionException | PolicyCompressionException e) {
            ExceptionLoggingUtils.logDebug(LOG, e, "Policy composition aborted in container '%s'", container.getId());
            throw e;
        }
    }

    private void render(Attachment a) throws TemplateRenderException, UnsupportedPolicyVersionException {
        PolicyTemplate pt = a.getPolicyTemplate();
        String accountName = a.getAccount().name();

        Map<String, ServiceRolePolicy> roles = serviceRolePolicies.computeIfAbsent(accountName, k -> new LinkedHashMap<>());

        Optional<IAMPolicyDoc> rendered = pt.render(container, a.getAccount(), a.getVars());

        Set<String> scope = scopes.computeIfAbsent(accountName, k -> new LinkedHashSet<>());

        if (rendered.isEmpty()) {
            LOG.warnf("Policy template '%s' not found for account '%s' in container '%s'",
                    pt.getKey(), accountName, container.getId());
            documents(accountPolicies, accountName).add(IAMPolicyDoc.empty());
            missing.add(a);
            return;
        }

        IAMPolicyDoc pd = rendered.get();
        if (StringUtils.isNotEmpty(pd.getVersion()) && !IAMPolicyDoc.VERSION.equals(pd.getVersion())) {
            throw new UnsupportedPolicyVersionException(pd.getVersion());
        }

        documents(accountPolicies, accountName).add(pd);
        scope.addAll(pt.getScope());

        Optional<ServiceRole> serviceRole = pt.getServiceRole();
        if (serviceRole.isPresent()) {
            IAMPolicyDoc rolePolicy = pt.renderServiceRole(container, a.getAccount(), a.getVars());
            IAMPolicyDoc assumeRolePolicy = pt.renderServiceAssumeRole(container, a.getAccount(), a.getVars());

            String roleName = serviceRole.get().name();
            if (roles.containsKey(roleName)) {
                LOG.debugf("Service role '%s' of account '%s' redefined by policy template '%s'",
                        roleName, accountName, pt.getKey());
            }
            roles.put(roleName, new ServiceRolePolicy(rolePolicy, assumeRolePolicy));
        }
    }

    private void synthesizeDefaults() {
        for (Map.Entry<String, Set<String>> entry : scopes.entrySet()) {
            String account = entry.getKey();
            Set<String> scope = entry.getValue();

            IAMPolicyStatement denyUnknown = scope.isEmpty()
                    ? IAMPolicyStatement.denyAll()
                    : IAMPolicyStatement.denyUnknownServices(CommonUtils.sortedDistinct(scope));

            List<IAMPolicyDoc> docs = documents(accountPolicies, account);
            docs.add(IAMPolicyDoc.of(denyUnknown));

            accountRolePolicies.put(account, new ArrayList<>(docs));

            if (!scope.isEmpty()) {
                docs.add(IAMPolicyDoc.of(IAMPolicyStatement.allowAll()));
            }
        }
    }

    private static List<IAMPolicyDoc> documents(Map<String, List<IAMPolicyDoc>> byAccount, String account) {
        return byAccount.computeIfAbsent(account, k -> new ArrayList<>());
    }
}
