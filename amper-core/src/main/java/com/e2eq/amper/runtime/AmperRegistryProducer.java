package com.e2eq.amper.runtime;

import com.e2eq.amper.core.Container;
import com.e2eq.amper.core.PolicyRegistry;
import com.e2eq.amper.exceptions.AmperException;
import com.e2eq.amper.template.ClasspathTemplateSource;
import com.e2eq.amper.template.YamlCatalogLoader;
import com.e2eq.amper.util.ExceptionLoggingUtils;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Loads the policy catalog from the classpath and exposes the resulting {@link PolicyRegistry}
 * and the {@link Container} owning the catalog templates for injection. Applications only gain
 * these beans when they depend on this module.
 */
@ApplicationScoped
public class AmperRegistryProducer {

    private static final Logger LOG = Logger.getLogger(AmperRegistryProducer.class);

    private final String catalogLocation;
    private final String containerId;
    private final String templatesPrefix;

    private PolicyRegistry registry;
    private Container container;

    @Inject
    public AmperRegistryProducer(@ConfigProperty(name = "amper.catalog", defaultValue = "amper/catalog.yaml")
                                 String catalogLocation,
                                 @ConfigProperty(name = "amper.container", defaultValue = "catalog")
                                 String containerId,
                                 @ConfigProperty(name = "amper.templates.prefix", defaultValue = "amper/templates")
                                 String templatesPrefix) {
        this.catalogLocation = catalogLocation;
        this.containerId = containerId;
        this.templatesPrefix = templatesPrefix;
    }

    @PostConstruct
    void init() {
        YamlCatalogLoader loader = new YamlCatalogLoader(new ClasspathTemplateSource(templatesPrefix));
        try {
            YamlCatalogLoader.Catalog catalog = loader.loadFromClasspath(catalogLocation, containerId);
            this.registry = catalog.registry();
            this.container = catalog.container();
        } catch (IOException | AmperException e) {
            ExceptionLoggingUtils.logError(LOG, e, "Failed to load policy catalog from %s", catalogLocation);
            throw new IllegalStateException("Failed to load policy catalog from " + catalogLocation, e);
        }
    }

    @Produces
    public PolicyRegistry registry() {
        return registry;
    }

    @Produces
    public Container catalogContainer() {
        return container;
    }
}
