package com.e2eq.amper.core;

import java.util.List;
import java.util.Objects;

/**
 * Secondary role a policy template may declare. Its trust policy lets the listed service
 * principals assume it.
 *
 * @param name     role name, unique per account
 * @param services service principals trusted to assume the role, e.g. {@code ec2.amazonaws.com}
 */
public record ServiceRole(String name, List<String> services) {
    public ServiceRole {
        Objects.requireNonNull(name, "service role name cannot be null");
        services = services == null ? List.of() : List.copyOf(services);
    }
}
