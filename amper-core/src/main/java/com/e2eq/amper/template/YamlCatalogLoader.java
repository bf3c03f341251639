package com.e2eq.amper.template;

import com.e2eq.amper.core.Account;
import com.e2eq.amper.core.Container;
import com.e2eq.amper.core.PolicyRegistry;
import com.e2eq.amper.core.ServiceRole;
import com.e2eq.amper.exceptions.DuplicateKeyException;
import com.e2eq.amper.exceptions.InvalidTemplateStateException;
import com.e2eq.amper.iam.PolicyLimits;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Loads accounts, policy templates and limits from a YAML catalog and registers them.
 *
 * <pre>{@code
 * limits:
 *   maxManagedPolicySize: 6144
 * accounts:
 *   - name: prod
 *     id: "123456789012"
 * templates:
 *   - key: s3-bucket
 *     policy: s3-bucket.json        # defaults to <key>.json
 *     vars: [Bucket]
 *     scope: ["s3:*"]
 *     serviceRole:
 *       name: s3-reader
 *       services: [ec2.amazonaws.com]
 *       policy: s3-bucket-role.json
 * }</pre>
 */
public final class YamlCatalogLoader {

    private static final Logger LOG = Logger.getLogger(YamlCatalogLoader.class);

    // DTOs mirroring YAML
    public record YCatalog(PolicyLimits limits, List<YAccount> accounts, List<YTemplate> templates) {}
    public record YAccount(String name, String id) {}
    public record YTemplate(String key, String policy, List<String> vars, List<String> scope, YServiceRole serviceRole) {}
    public record YServiceRole(String name, List<String> services, String policy) {}

    /**
     * A registry built from a catalog together with the container owning its templates.
     */
    public record Catalog(PolicyRegistry registry, Container container) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final TemplateSource templateSource;

    public YamlCatalogLoader(TemplateSource templateSource) {
        this.templateSource = templateSource;
    }

    public Catalog loadFromClasspath(String resourcePath, String containerId)
            throws IOException, DuplicateKeyException, InvalidTemplateStateException {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in, containerId);
        }
    }

    public Catalog loadFromPath(Path path, String containerId)
            throws IOException, DuplicateKeyException, InvalidTemplateStateException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, containerId);
        }
    }

    /**
     * Build a new registry with the catalog's limits and register its content through a new container.
     */
    public Catalog load(InputStream in, String containerId)
            throws IOException, DuplicateKeyException, InvalidTemplateStateException {
        YCatalog catalog = read(in);
        PolicyRegistry registry = new PolicyRegistry(Optional.ofNullable(catalog.limits()).orElseGet(PolicyLimits::defaults));
        Container container = registry.addContainer(containerId);
        register(catalog, container);
        return new Catalog(registry, container);
    }

    /**
     * Register the catalog's accounts and templates into the registry of an existing container.
     * The catalog's limits are ignored.
     */
    public void loadInto(InputStream in, Container container)
            throws IOException, DuplicateKeyException, InvalidTemplateStateException {
        register(read(in), container);
    }

    private YCatalog read(InputStream in) throws IOException {
        YCatalog catalog = mapper.readValue(in, YCatalog.class);
        if (catalog == null) {
            throw new IOException("Empty policy catalog");
        }
        return catalog;
    }

    private void register(YCatalog catalog, Container container)
            throws DuplicateKeyException, InvalidTemplateStateException {
        for (YAccount a : Optional.ofNullable(catalog.accounts()).orElse(List.of())) {
            container.getRegistry().addAccount(new Account(a.name(), a.id()));
        }

        for (YTemplate t : Optional.ofNullable(catalog.templates()).orElse(List.of())) {
            if (t.key() == null || t.key().isBlank()) {
                throw new IllegalArgumentException("Policy template without key in catalog");
            }
            ServiceRole serviceRole = null;
            String serviceRolePolicy = null;
            if (t.serviceRole() != null) {
                serviceRole = new ServiceRole(t.serviceRole().name(), t.serviceRole().services());
                serviceRolePolicy = t.serviceRole().policy();
            }

            container.addPolicyTemplate(new TextPolicyTemplate(
                    t.key(),
                    Optional.ofNullable(t.vars()).orElse(List.of()),
                    new LinkedHashSet<>(Optional.ofNullable(t.scope()).orElse(List.of())),
                    serviceRole,
                    templateSource,
                    t.policy(),
                    serviceRolePolicy));
        }

        LOG.infof("Loaded %d account(s) and %d policy template(s) into container '%s'",
                Optional.ofNullable(catalog.accounts()).map(List::size).orElse(0),
                Optional.ofNullable(catalog.templates()).map(List::size).orElse(0),
                container.getId());
    }
}
