package com.e2eq.amper.exceptions;

/**
 * Thrown when an attachment names a policy template or account the registry does not know.
 */
public class UnknownReferenceException extends AmperException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        TEMPLATE("policy template"),
        ACCOUNT("account");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;
    private final String name;
    private final String containerId;

    public UnknownReferenceException(Kind kind, String name, String containerId) {
        super(String.format("cannot add attachment, unknown %s '%s' in container '%s'", kind.label(), name, containerId));
        this.kind = kind;
        this.name = name;
        this.containerId = containerId;
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getContainerId() {
        return containerId;
    }
}
