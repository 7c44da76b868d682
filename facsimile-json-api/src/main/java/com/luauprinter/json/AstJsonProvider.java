package com.luauprinter.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * A JSON binding for syntax trees. Implementations are found with
 * {@link ServiceLoader}; putting facsimile-jackson on the classpath registers
 * one.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(root);
 * Block copy = provider.getDeserializer().deserializeBlock(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * A short name such as "Jackson", used by {@link #getProvider(String)}.
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is on the classpath
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> providers = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (providers.hasNext()) {
            return providers.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider on the classpath; add facsimile-jackson or another provider");
    }

    /**
     * @throws IllegalStateException if no provider has that name (ignoring case)
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
