package com.e2eq.amper.core;

import java.util.Objects;

/**
 * A cloud account policies are composed for. Accounts are registered by name before any
 * attachment may reference them.
 *
 * @param name registry key of the account
 * @param id   the provider's account identifier, may be null when not known
 */
public record Account(String name, String id) {
    public Account {
        Objects.requireNonNull(name, "account name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("account name cannot be blank");
        }
    }

    public static Account named(String name) {
        return new Account(name, null);
    }
}
