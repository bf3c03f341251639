package com.e2eq.amper.exceptions;

/**
 * Thrown by a policy template that fails to produce a document. Propagated unchanged by composition.
 */
public class TemplateRenderException extends AmperException {
    private static final long serialVersionUID = 1L;

    private final String templateKey;

    public TemplateRenderException(String templateKey, String message) {
        super(message);
        this.templateKey = templateKey;
    }

    public TemplateRenderException(String templateKey, String message, Throwable cause) {
        super(message, cause);
        this.templateKey = templateKey;
    }

    public String getTemplateKey() {
        return templateKey;
    }
}
