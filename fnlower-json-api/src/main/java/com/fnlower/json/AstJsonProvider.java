package com.fnlower.json;

import java.util.ServiceLoader;

/**
 * Entry point for core IR JSON support. Implementations register themselves in
 * {@code META-INF/services/com.fnlower.json.AstJsonProvider} and are found with
 * {@link ServiceLoader}.
 *
 * <pre>{@code
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * String text = json.getSerializer().serializePretty(coreModule);
 * CoreModule back = json.getDeserializer().deserializeModule(text);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. {@code "Jackson"}.
     */
    String getName();

    /**
     * Returns the first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider on the classpath; add fnlower-jackson to the dependencies");
    }

    /**
     * Returns the provider whose {@link #getName()} matches, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
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
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
