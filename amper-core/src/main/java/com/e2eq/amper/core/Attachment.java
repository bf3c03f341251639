package com.e2eq.amper.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binding of one policy template to one account with concrete variable values.
 * Created only by {@link Container#addAttachment(String, String, Map)} and never changed afterwards.
 */
public final class Attachment {

    private final PolicyTemplate policyTemplate;
    private final Account account;
    private final Map<String, String> vars;
    private final String containerId;

    Attachment(PolicyTemplate policyTemplate, Account account, Map<String, String> vars, String containerId) {
        this.policyTemplate = policyTemplate;
        this.account = account;
        this.vars = Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        this.containerId = containerId;
    }

    public PolicyTemplate getPolicyTemplate() {
        return policyTemplate;
    }

    public Account getAccount() {
        return account;
    }

    public Map<String, String> getVars() {
        return vars;
    }

    public String getContainerId() {
        return containerId;
    }

    @Override
    public String toString() {
        return policyTemplate.getKey();
    }
}
