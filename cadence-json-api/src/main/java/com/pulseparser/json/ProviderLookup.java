package com.pulseparser.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * ServiceLoader discovery behind the static methods of {@link AstJsonProvider}.
 */
final class ProviderLookup {
    private static final Logger log = LoggerFactory.getLogger(ProviderLookup.class);

    private ProviderLookup() {
    }

    static List<AstJsonProvider> discover() {
        List<AstJsonProvider> providers = new ArrayList<>();
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            providers.add(provider);
            log.debug("Discovered AstJsonProvider: {} ({})", provider.getName(), provider.getClass().getName());
        }
        return providers;
    }

    static AstJsonProvider first() {
        List<AstJsonProvider> providers = discover();
        if (providers.isEmpty()) {
            log.warn("No AstJsonProvider implementations found via SPI");
            throw new IllegalStateException(
                "No AstJsonProvider found on the classpath. " +
                "Add cadence-jackson (or another provider) to your dependencies."
            );
        }
        AstJsonProvider selected = providers.get(0);
        log.debug("Selected AstJsonProvider: {}", selected.getName());
        return selected;
    }

    static AstJsonProvider named(String name) {
        for (AstJsonProvider provider : discover()) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        log.warn("No AstJsonProvider named '{}' found via SPI", name);
        throw new IllegalStateException(
            "No AstJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }
}
