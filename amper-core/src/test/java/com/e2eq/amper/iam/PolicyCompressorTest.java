package com.e2eq.amper.iam;

import com.e2eq.amper.exceptions.PolicyCompressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PolicyCompressor normalization and limits")
class PolicyCompressorTest {

    @Test
    @DisplayName("duplicate statements and duplicate list entries are dropped, order is kept")
    void normalize_dropsDuplicates() throws Exception {
        IAMPolicyStatement read = statement("Read", List.of("s3:GetObject", "s3:ListBucket", "s3:GetObject"), List.of("*", "*"));
        IAMPolicyStatement same = statement("Read", List.of("s3:GetObject", "s3:ListBucket"), List.of("*"));
        IAMPolicyStatement write = statement("Write", List.of("s3:PutObject"), List.of("arn:aws:s3:::b/*"));
        IAMPolicyDoc doc = IAMPolicyDoc.of(read, same, write);

        Policy policy = single("A", doc);
        policy.compress(PolicyLimits.defaults());

        IAMPolicyDoc compressed = policy.accountPolicies("A").get(0);
        assertEquals(IAMPolicyDoc.VERSION, compressed.getVersion());
        assertEquals(2, compressed.getStatements().size());
        assertEquals("Read", compressed.getStatements().get(0).getSid());
        assertEquals(List.of("s3:GetObject", "s3:ListBucket"), compressed.getStatements().get(0).getActions());
        assertEquals(List.of("*"), compressed.getStatements().get(0).getResources());
        assertEquals("Write", compressed.getStatements().get(1).getSid());
    }

    @Test
    @DisplayName("empty placeholder documents are kept as they are")
    void placeholders_untouched() throws Exception {
        Map<String, List<IAMPolicyDoc>> docs = new LinkedHashMap<>();
        docs.put("A", List.of(IAMPolicyDoc.empty(), IAMPolicyDoc.empty(), IAMPolicyDoc.of(IAMPolicyStatement.denyAll())));
        Policy policy = new Policy(docs, Map.of(), Map.of());

        policy.compress(PolicyLimits.defaults());

        assertEquals(3, policy.accountPolicies("A").size());
        assertNull(policy.accountPolicies("A").get(0).getVersion());
        assertTrue(policy.accountPolicies("A").get(1).isEmpty());
    }

    @Test
    @DisplayName("a document larger than the managed policy limit fails")
    void managedPolicy_tooLarge() {
        List<String> actions = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            actions.add("s3:SomeRatherLongActionName" + i);
        }
        Policy policy = single("A", IAMPolicyDoc.of(statement("Big", actions, List.of("*"))));

        PolicyCompressionException ex = assertThrows(PolicyCompressionException.class,
                () -> policy.compress(PolicyLimits.builder().maxManagedPolicySize(512).build()));

        assertEquals("A", ex.getAccount());
        assertTrue(ex.getMessage().contains("account policy #1"));
        assertTrue(ex.getMessage().contains("bytes, the limit is 512"));
    }

    @Test
    @DisplayName("a statement with both Action and NotAction is rejected")
    void statement_actionAndNotAction() {
        IAMPolicyStatement bad = IAMPolicyStatement.denyUnknownServices(List.of("s3:*"));
        bad.setActions(new ArrayList<>(List.of("ec2:*")));
        Policy policy = single("A", IAMPolicyDoc.of(bad));

        PolicyCompressionException ex = assertThrows(PolicyCompressionException.class,
                () -> policy.compress(PolicyLimits.defaults()));
        assertTrue(ex.getMessage().contains("exactly one of Action or NotAction"));
    }

    @Test
    @DisplayName("statements need an effect and, outside trust policies, a resource")
    void statement_missingEffectOrResource() {
        IAMPolicyStatement noEffect = statement("NoEffect", List.of("s3:*"), List.of("*"));
        noEffect.setEffect(null);
        assertThrows(PolicyCompressionException.class,
                () -> single("A", IAMPolicyDoc.of(noEffect)).compress(PolicyLimits.defaults()));

        IAMPolicyStatement noResource = statement("NoResource", List.of("s3:*"), List.of());
        PolicyCompressionException ex = assertThrows(PolicyCompressionException.class,
                () -> single("A", IAMPolicyDoc.of(noResource)).compress(PolicyLimits.defaults()));
        assertTrue(ex.getMessage().contains("'NoResource'"));
    }

    @Test
    @DisplayName("service role trust policies are checked against their own limit")
    void serviceRole_assumeRoleLimit() throws Exception {
        Map<String, List<String>> principal = new LinkedHashMap<>();
        principal.put("Service", new ArrayList<>(List.of("ec2.amazonaws.com")));
        IAMPolicyStatement trust = IAMPolicyStatement.builder()
                .effect(Effect.ALLOW)
                .principal(principal)
                .actions(new ArrayList<>(List.of("sts:AssumeRole")))
                .build();
        ServiceRolePolicy srp = new ServiceRolePolicy(
                IAMPolicyDoc.of(statement("Role", List.of("s3:GetObject"), List.of("*"))),
                IAMPolicyDoc.of(trust));
        Policy policy = new Policy(Map.of(), Map.of(), Map.of("A", Map.of("reader", srp)));

        policy.compress(PolicyLimits.defaults());
        assertEquals(IAMPolicyDoc.VERSION, srp.assumeRolePolicy().getVersion());

        PolicyCompressionException ex = assertThrows(PolicyCompressionException.class,
                () -> policy.compress(PolicyLimits.builder().maxAssumeRolePolicySize(20).build()));
        assertTrue(ex.getMessage().contains("service role 'reader' assume role policy"));
    }

    @Test
    @DisplayName("compression is idempotent")
    void compress_idempotent() throws Exception {
        Policy policy = single("A", IAMPolicyDoc.of(statement("Read", List.of("s3:GetObject", "s3:GetObject"), List.of("*"))));

        policy.compress(PolicyLimits.defaults());
        IAMPolicyDoc once = policy.accountPolicies("A").get(0);
        String first = once.toString();
        policy.compress(PolicyLimits.defaults());

        assertEquals(first, policy.accountPolicies("A").get(0).toString());
    }

    private static Policy single(String account, IAMPolicyDoc doc) {
        return new Policy(Map.of(account, List.of(doc)), Map.of(account, List.of(doc)), Map.of());
    }

    private static IAMPolicyStatement statement(String sid, List<String> actions, List<String> resources) {
        return IAMPolicyStatement.builder()
                .sid(sid)
                .effect(Effect.ALLOW)
                .actions(new ArrayList<>(actions))
                .resources(new ArrayList<>(resources))
                .build();
    }
}
