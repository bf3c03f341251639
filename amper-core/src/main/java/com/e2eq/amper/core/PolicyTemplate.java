package com.e2eq.amper.core;

import com.e2eq.amper.exceptions.TemplateRenderException;
import com.e2eq.amper.iam.Effect;
import com.e2eq.amper.iam.IAMPolicyDoc;
import com.e2eq.amper.iam.IAMPolicyStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named, parameterized unit that renders a policy document for an account.
 *
 * <p>A template declares the variables an attachment must bind, the scope of service
 * identifiers it may grant, and optionally a {@link ServiceRole}. Registration through
 * {@link Container#addPolicyTemplate(PolicyTemplate)} binds it to one registry and one
 * container; a bound template can never be registered again.</p>
 */
public abstract class PolicyTemplate {

    public static final String ASSUME_ROLE_ACTION = "sts:AssumeRole";

    /**
     * Ownership tag set once by registration.
     */
    public record Binding(PolicyRegistry registry, Container container) {}

    private final String key;
    private final List<String> vars;
    private final Set<String> scope;
    private final ServiceRole serviceRole;

    private final AtomicReference<Binding> binding = new AtomicReference<>();

    protected PolicyTemplate(String key, List<String> vars, Set<String> scope, ServiceRole serviceRole) {
        this.key = Objects.requireNonNull(key, "policy template key cannot be null");
        this.vars = vars == null ? List.of() : List.copyOf(vars);
        this.scope = scope == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(scope));
        this.serviceRole = serviceRole;
    }

    public String getKey() {
        return key;
    }

    /**
     * Names every attachment of this template must bind, in declaration order.
     */
    public List<String> getVars() {
        return vars;
    }

    public Set<String> getScope() {
        return scope;
    }

    public Optional<ServiceRole> getServiceRole() {
        return Optional.ofNullable(serviceRole);
    }

    public Optional<Binding> binding() {
        return Optional.ofNullable(binding.get());
    }

    public boolean isBound() {
        return binding.get() != null;
    }

    // first binding wins; callers may hold the locks of different registries
    boolean bind(Binding binding) {
        return this.binding.compareAndSet(null, binding);
    }

    /**
     * Render the template for one attachment.
     *
     * @return the document, or empty when the template intentionally produces nothing for this context
     * @throws TemplateRenderException when rendering fails
     */
    public abstract Optional<IAMPolicyDoc> render(Container container, Account account, Map<String, String> vars)
            throws TemplateRenderException;

    /**
     * Render the permissions policy of the declared service role. Only called when
     * {@link #getServiceRole()} is present.
     */
    public abstract IAMPolicyDoc renderServiceRole(Container container, Account account, Map<String, String> vars)
            throws TemplateRenderException;

    /**
     * Render the trust policy of the declared service role. The default lets the role's services
     * assume it.
     */
    public IAMPolicyDoc renderServiceAssumeRole(Container container, Account account, Map<String, String> vars)
            throws TemplateRenderException {
        ServiceRole role = getServiceRole().orElseThrow(() ->
                new TemplateRenderException(key, "policy template '" + key + "' declares no service role"));
        if (role.services().isEmpty()) {
            throw new TemplateRenderException(key,
                    "service role '" + role.name() + "' of policy template '" + key + "' trusts no service");
        }

        Map<String, List<String>> principal = new LinkedHashMap<>();
        principal.put("Service", new ArrayList<>(role.services()));

        IAMPolicyStatement trust = IAMPolicyStatement.builder()
                .effect(Effect.ALLOW)
                .principal(principal)
                .actions(new ArrayList<>(List.of(ASSUME_ROLE_ACTION)))
                .build();
        IAMPolicyDoc doc = IAMPolicyDoc.of(trust);
        doc.setVersion(IAMPolicyDoc.VERSION);
        return doc;
    }

    @Override
    public String toString() {
        return key;
    }
}
