package com.e2eq.amper.exceptions;

public class UnsupportedPolicyVersionException extends AmperException {
    private static final long serialVersionUID = 1L;

    private final String version;

    public UnsupportedPolicyVersionException(String version) {
        super(String.format("Unsupported policy version '%s'", version));
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
