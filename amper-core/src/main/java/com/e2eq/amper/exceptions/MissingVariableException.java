package com.e2eq.amper.exceptions;

/**
 * Thrown when an attachment does not bind a variable its policy template requires.
 */
public class MissingVariableException extends AmperException {
    private static final long serialVersionUID = 1L;

    private final String variable;
    private final String templateKey;
    private final String containerId;

    public MissingVariableException(String variable, String templateKey, String containerId) {
        super(String.format("cannot add attachment of '%s', variable '%s' is not set in container '%s'",
                templateKey, variable, containerId));
        this.variable = variable;
        this.templateKey = templateKey;
        this.containerId = containerId;
    }

    /**
     * The first required variable found missing.
     */
    public String getVariable() {
        return variable;
    }

    public String getTemplateKey() {
        return templateKey;
    }

    public String getContainerId() {
        return containerId;
    }
}
