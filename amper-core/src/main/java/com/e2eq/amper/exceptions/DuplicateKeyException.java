package com.e2eq.amper.exceptions;

/**
 * Thrown when a template key, account name or container id is registered twice.
 */
public class DuplicateKeyException extends AmperException {
    private static final long serialVersionUID = 1L;

    private final String entityType;
    private final String key;

    public DuplicateKeyException(String entityType, String key) {
        super(String.format("%s '%s' already exists", entityType, key));
        this.entityType = entityType;
        this.key = key;
    }

    /**
     * The kind of entity that was registered twice, e.g. "policy template".
     */
    public String getEntityType() {
        return entityType;
    }

    public String getKey() {
        return key;
    }
}
