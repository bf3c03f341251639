package com.e2eq.amper.exceptions;

/**
 * Thrown when a policy template that is already bound to a registry and container is registered again.
 */
public class InvalidTemplateStateException extends AmperException {
    private static final long serialVersionUID = 1L;

    private final String templateKey;

    public InvalidTemplateStateException(String templateKey) {
        super(String.format("policy '%s' is in unknown state", templateKey));
        this.templateKey = templateKey;
    }

    public String getTemplateKey() {
        return templateKey;
    }
}
