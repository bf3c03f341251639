package com.e2eq.amper.template;

import com.e2eq.amper.core.Account;
import com.e2eq.amper.core.Container;
import com.e2eq.amper.core.PolicyTemplate;
import com.e2eq.amper.core.ServiceRole;
import com.e2eq.amper.exceptions.TemplateRenderException;
import com.e2eq.amper.iam.IAMPolicyDoc;
import com.e2eq.amper.util.JSONUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.text.StringEscapeUtils;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Policy template whose documents are JSON text with {@code ${name}} placeholders.
 *
 * <p>Placeholders resolve against the attachment variables plus {@code account.name},
 * {@code account.id}, {@code container.id} and {@code template.key}. Values are JSON escaped
 * before insertion. Placeholders whose name contains a colon, such as {@code ${aws:username}},
 * are provider policy variables and are kept as written. Any other unresolved placeholder fails
 * the render. When the source holds no text for the policy path the template renders nothing.</p>
 */
public class TextPolicyTemplate extends PolicyTemplate {

    private final TemplateSource source;
    private final String policyPath;
    private final String serviceRolePolicyPath;

    public TextPolicyTemplate(String key, List<String> vars, Set<String> scope, ServiceRole serviceRole,
                              TemplateSource source, String policyPath, String serviceRolePolicyPath) {
        super(key, vars, scope, serviceRole);
        this.source = source;
        this.policyPath = policyPath != null ? policyPath : key + ".json";
        this.serviceRolePolicyPath = serviceRolePolicyPath;
    }

    public String getPolicyPath() {
        return policyPath;
    }

    public String getServiceRolePolicyPath() {
        return serviceRolePolicyPath;
    }

    @Override
    public Optional<IAMPolicyDoc> render(Container container, Account account, Map<String, String> vars)
            throws TemplateRenderException {
        Optional<String> text = read(policyPath);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parse(substitute(text.get(), container, account, vars)));
    }

    @Override
    public IAMPolicyDoc renderServiceRole(Container container, Account account, Map<String, String> vars)
            throws TemplateRenderException {
        if (serviceRolePolicyPath == null) {
            throw new TemplateRenderException(getKey(), "policy template '" + getKey() + "' has no service role policy");
        }
        String text = read(serviceRolePolicyPath).orElseThrow(() -> new TemplateRenderException(getKey(),
                "service role policy '" + serviceRolePolicyPath + "' of policy template '" + getKey()
                        + "' not found in " + source));
        return parse(substitute(text, container, account, vars));
    }

    private Optional<String> read(String path) throws TemplateRenderException {
        try {
            return source.load(path);
        } catch (IOException e) {
            throw new TemplateRenderException(getKey(), "cannot read '" + path + "' of policy template '" + getKey() + "'", e);
        }
    }

    private String substitute(String text, Container container, Account account, Map<String, String> vars)
            throws TemplateRenderException {
        Map<String, String> values = new HashMap<>();
        vars.forEach((k, v) -> values.put(k, escape(v)));
        values.put("account.name", escape(account.name()));
        values.put("account.id", escape(account.id()));
        values.put("container.id", escape(container.getId()));
        values.put("template.key", escape(getKey()));

        StringSubstitutor sub = new StringSubstitutor((StringLookup) name -> {
            String value = values.get(name);
            if (value == null && name.indexOf(':') >= 0) {
                // provider policy variable such as aws:username, resolved at request time
                return "${" + name + "}";
            }
            return value;
        });
        sub.setEnableUndefinedVariableException(true);
        sub.setDisableSubstitutionInValues(true);
        try {
            return sub.replace(text);
        } catch (IllegalArgumentException e) {
            throw new TemplateRenderException(getKey(),
                    "cannot render policy template '" + getKey() + "': " + e.getMessage(), e);
        }
    }

    private IAMPolicyDoc parse(String json) throws TemplateRenderException {
        try {
            return JSONUtils.instance().fromJson(json, IAMPolicyDoc.class);
        } catch (JsonProcessingException e) {
            throw new TemplateRenderException(getKey(),
                    "policy template '" + getKey() + "' did not render a valid policy document: " + e.getOriginalMessage(), e);
        }
    }

    private static String escape(String value) {
        return value == null ? "" : StringEscapeUtils.escapeJson(value);
    }
}
