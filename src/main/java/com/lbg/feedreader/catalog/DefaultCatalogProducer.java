package com.lbg.feedreader.catalog;

import com.lbg.feedreader.domain.DefaultCatalog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Supplies the default catalog to the feed list store.
 * Deployments that register every feed themselves can switch the seed data off.
 */
@ApplicationScoped
public class DefaultCatalogProducer {

    private static final Logger LOG = Logger.getLogger(DefaultCatalogProducer.class);

    @ConfigProperty(name = "feeds.default-catalog.enabled", defaultValue = "true")
    boolean enabled;

    @Produces
    @Singleton
    public DefaultCatalog defaultCatalog() {
        if (!enabled) {
            LOG.info("Default catalog disabled");
            return DefaultCatalog.empty();
        }
        return DefaultCatalog.reference();
    }
}
