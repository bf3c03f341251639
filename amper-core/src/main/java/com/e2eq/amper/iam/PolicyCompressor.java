package com.e2eq.amper.iam;

import com.e2eq.amper.exceptions.PolicyCompressionException;
import com.e2eq.amper.util.CommonUtils;
import com.e2eq.amper.util.JSONUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Normalizes the documents of a composed {@link Policy} and checks them against {@link PolicyLimits}.
 *
 * <p>Normalization never reorders documents: it fills a missing version, drops duplicate
 * statements and drops duplicate entries of action, not-action and resource lists keeping
 * first occurrences. Empty placeholder documents are left untouched. Sizes are measured in
 * UTF-8 bytes of the compact JSON form.</p>
 */
public final class PolicyCompressor {

    private static final Logger LOG = Logger.getLogger(PolicyCompressor.class);

    private PolicyCompressor() {}

    public static void compress(Policy policy, PolicyLimits limits) throws PolicyCompressionException {
        for (Map.Entry<String, ? extends List<IAMPolicyDoc>> entry : policy.getAccountPolicies().entrySet()) {
            compressManaged(entry.getKey(), "account policy", entry.getValue(), limits);
        }
        for (Map.Entry<String, ? extends List<IAMPolicyDoc>> entry : policy.getAccountRolePolicies().entrySet()) {
            compressManaged(entry.getKey(), "account role policy", entry.getValue(), limits);
        }

        for (Map.Entry<String, ? extends Map<String, ServiceRolePolicy>> entry : policy.getServiceRolePolicies().entrySet()) {
            String account = entry.getKey();
            for (Map.Entry<String, ServiceRolePolicy> role : entry.getValue().entrySet()) {
                String label = "service role '" + role.getKey() + "'";
                ServiceRolePolicy srp = role.getValue();

                normalize(srp.policy());
                validateStatements(account, label + " policy", srp.policy());
                checkSize(account, label + " policy", srp.policy(), limits.getMaxRolePolicySize());

                normalize(srp.assumeRolePolicy());
                validateStatements(account, label + " assume role policy", srp.assumeRolePolicy());
                checkSize(account, label + " assume role policy", srp.assumeRolePolicy(), limits.getMaxAssumeRolePolicySize());
            }
        }
    }

    private static void compressManaged(String account, String label, List<IAMPolicyDoc> docs, PolicyLimits limits)
            throws PolicyCompressionException {
        for (int i = 0; i < docs.size(); i++) {
            IAMPolicyDoc doc = docs.get(i);
            if (doc.isEmpty()) {
                continue;
            }
            String docLabel = label + " #" + (i + 1);
            normalize(doc);
            validateStatements(account, docLabel, doc);
            checkSize(account, docLabel, doc, limits.getMaxManagedPolicySize());
        }
    }

    static void normalize(IAMPolicyDoc doc) {
        if (doc.isEmpty()) {
            return;
        }
        if (StringUtils.isEmpty(doc.getVersion())) {
            doc.setVersion(IAMPolicyDoc.VERSION);
        }

        for (IAMPolicyStatement s : doc.getStatements()) {
            s.setActions(CommonUtils.distinct(s.getActions()));
            s.setNotActions(CommonUtils.distinct(s.getNotActions()));
            s.setResources(CommonUtils.distinct(s.getResources()));
        }

        int before = doc.getStatements().size();
        List<IAMPolicyStatement> unique = new ArrayList<>(new LinkedHashSet<>(doc.getStatements()));
        if (unique.size() != before) {
            LOG.debugf("Dropped %d duplicate statement(s)", before - unique.size());
        }
        doc.setStatements(unique);
    }

    private static void validateStatements(String account, String label, IAMPolicyDoc doc)
            throws PolicyCompressionException {
        for (IAMPolicyStatement s : doc.getStatements()) {
            String name = s.getSid() != null ? "'" + s.getSid() + "'" : "without Sid";
            if (s.getEffect() == null) {
                throw new PolicyCompressionException(account, String.format("statement %s in %s has no Effect", name, label));
            }

            boolean hasActions = !CommonUtils.nullSafe(s.getActions()).isEmpty();
            boolean hasNotActions = !CommonUtils.nullSafe(s.getNotActions()).isEmpty();
            if (hasActions == hasNotActions) {
                throw new PolicyCompressionException(account,
                        String.format("statement %s in %s must set exactly one of Action or NotAction", name, label));
            }

            boolean trust = s.getPrincipal() != null && !s.getPrincipal().isEmpty();
            if (!trust && CommonUtils.nullSafe(s.getResources()).isEmpty()) {
                throw new PolicyCompressionException(account,
                        String.format("statement %s in %s has no Resource", name, label));
            }
        }
    }

    private static void checkSize(String account, String label, IAMPolicyDoc doc, int limit)
            throws PolicyCompressionException {
        int size;
        try {
            size = JSONUtils.instance().compactSize(doc);
        } catch (JsonProcessingException e) {
            throw new PolicyCompressionException(account, "cannot serialize " + label, e);
        }
        if (size > limit) {
            throw new PolicyCompressionException(account,
                    String.format("%s is %d bytes, the limit is %d", label, size, limit));
        }
    }
}
