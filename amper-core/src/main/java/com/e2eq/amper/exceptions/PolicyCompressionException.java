package com.e2eq.amper.exceptions;

/**
 * Thrown when a composed policy bundle is structurally invalid or exceeds a configured size limit.
 */
public class PolicyCompressionException extends AmperException {
    private static final long serialVersionUID = 1L;

    private final String account;

    public PolicyCompressionException(String account, String message) {
        super(String.format("account '%s': %s", account, message));
        this.account = account;
    }

    public PolicyCompressionException(String account, String message, Throwable cause) {
        super(String.format("account '%s': %s", account, message), cause);
        this.account = account;
    }

    public String getAccount() {
        return account;
    }
}
