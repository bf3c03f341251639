package com.e2eq.amper.core;

import com.e2eq.amper.exceptions.TemplateRenderException;
import com.e2eq.amper.iam.Effect;
import com.e2eq.amper.iam.IAMPolicyDoc;
import com.e2eq.amper.iam.IAMPolicyStatement;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Policy template double. Renders a fresh single-statement document allowing the template's
 * scope unless told to render nothing, fail, or declare a foreign version.
 */
class PolicyTemplateTestDouble extends PolicyTemplate {

    enum Mode { DOCUMENT, ABSENT, FAIL, FAIL_SERVICE_ROLE }

    private final Mode mode;
    private final String version;
    final AtomicInteger renders = new AtomicInteger();

    private PolicyTemplateTestDouble(String key, List<String> vars, List<String> scope, ServiceRole role,
                                     Mode mode, String version) {
        super(key, vars, new LinkedHashSet<>(scope), role);
        this.mode = mode;
        this.version = version;
    }

    static PolicyTemplateTestDouble of(String key, List<String> vars, List<String> scope) {
        return new PolicyTemplateTestDouble(key, vars, scope, null, Mode.DOCUMENT, IAMPolicyDoc.VERSION);
    }

    static PolicyTemplateTestDouble withServiceRole(String key, List<String> scope, ServiceRole role) {
        return new PolicyTemplateTestDouble(key, List.of(), scope, role, Mode.DOCUMENT, IAMPolicyDoc.VERSION);
    }

    static PolicyTemplateTestDouble failingServiceRole(String key, ServiceRole role) {
        return new PolicyTemplateTestDouble(key, List.of(), List.of("s3:*"), role, Mode.FAIL_SERVICE_ROLE, IAMPolicyDoc.VERSION);
    }

    static PolicyTemplateTestDouble absent(String key, List<String> scope) {
        return new PolicyTemplateTestDouble(key, List.of(), scope, null, Mode.ABSENT, null);
    }

    static PolicyTemplateTestDouble failing(String key) {
        return new PolicyTemplateTestDouble(key, List.of(), List.of("s3:*"), null, Mode.FAIL, null);
    }

    static PolicyTemplateTestDouble versioned(String key, String version) {
        return new PolicyTemplateTestDouble(key, List.of(), List.of("s3:*"), null, Mode.DOCUMENT, version);
    }

    /**
     * The document this double renders, for comparison in assertions.
     */
    static IAMPolicyDoc expectedDocument(String key, List<String> scope) {
        IAMPolicyDoc doc = IAMPolicyDoc.of(IAMPolicyStatement.builder()
                .sid(sid(key))
                .effect(Effect.ALLOW)
                .actions(new ArrayList<>(scope.isEmpty() ? List.of("sts:GetCallerIdentity") : scope))
                .resources(new ArrayList<>(List.of("*")))
                .build());
        doc.setVersion(IAMPolicyDoc.VERSION);
        return doc;
    }

    @Override
    public Optional<IAMPolicyDoc> render(Container container, Account account, Map<String, String> vars)
            throws TemplateRenderException {
        renders.incrementAndGet();
        switch (mode) {
            case ABSENT:
                return Optional.empty();
            case FAIL:
                throw new TemplateRenderException(getKey(), "render failed for " + getKey());
            default:
                IAMPolicyDoc doc = expectedDocument(getKey(), new ArrayList<>(getScope()));
                doc.setVersion(version);
                return Optional.of(doc);
        }
    }

    @Override
    public IAMPolicyDoc renderServiceRole(Container container, Account account, Map<String, String> vars)
            throws TemplateRenderException {
        if (mode == Mode.FAIL_SERVICE_ROLE) {
            throw new TemplateRenderException(getKey(), "service role render failed for " + getKey());
        }
        return IAMPolicyDoc.of(IAMPolicyStatement.builder()
                .sid(sid(getKey()) + "Role")
                .effect(Effect.ALLOW)
                .actions(new ArrayList<>(List.of("s3:GetObject")))
                .resources(new ArrayList<>(List.of("arn:aws:s3:::" + vars.getOrDefault("Bucket", "default") + "/*")))
                .build());
    }

    private static String sid(String key) {
        return "Template" + key.replaceAll("[^A-Za-z0-9]", "");
    }
}
