package org.Aayush.tracksync.collection;

import org.Aayush.tracksync.core.ValidationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of collection providers keyed by url scheme.
 *
 * <p>Built once at startup through {@link #register(CollectionProvider...)}. The
 * built-in {@code memory} provider is always present; custom providers override
 * built-ins when schemes collide.</p>
 */
public final class CollectionRegistry {
    public static final String SCHEME_MEMORY = "memory";

    private static final CollectionProvider MEMORY_PROVIDER = new CollectionProvider() {
        @Override
        public String scheme() {
            return SCHEME_MEMORY;
        }

        @Override
        public RecordCollection create(CollectionConfig config) {
            return new InMemoryCollection(config);
        }
    };

    private final Map<String, CollectionProvider> providersByScheme;

    private CollectionRegistry(Collection<? extends CollectionProvider> customProviders) {
        this.providersByScheme = Map.copyOf(mergeWithBuiltIns(customProviders));
    }

    /**
     * Returns a registry with built-ins plus {@code providers}.
     */
    public static CollectionRegistry register(CollectionProvider... providers) {
        return new CollectionRegistry(List.of(providers));
    }

    /**
     * Returns a registry with built-in providers only.
     */
    public static CollectionRegistry defaultRegistry() {
        return new CollectionRegistry(List.of());
    }

    /**
     * Returns the provider for {@code scheme}, or {@code null} when not registered.
     */
    public CollectionProvider provider(String scheme) {
        if (scheme == null) {
            return null;
        }
        return providersByScheme.get(scheme);
    }

    /**
     * Returns immutable set of registered schemes.
     */
    public Set<String> schemes() {
        return providersByScheme.keySet();
    }

    /**
     * Opens a collection through the provider registered for the config scheme.
     *
     * @throws ValidationException if no provider handles the scheme.
     */
    public RecordCollection open(CollectionConfig config) {
        Objects.requireNonNull(config, "config");
        CollectionProvider provider = provider(config.scheme());
        if (provider == null) {
            throw new ValidationException(
                    ValidationException.REASON_INVALID_CONFIG,
                    "no collection provider for scheme " + config.scheme() + ", known: " + schemes());
        }
        return provider.create(config);
    }

    public RecordCollection open(String url) {
        return open(CollectionConfig.of(url));
    }

    private static LinkedHashMap<String, CollectionProvider> mergeWithBuiltIns(
            Collection<? extends CollectionProvider> customProviders
    ) {
        LinkedHashMap<String, CollectionProvider> merged = new LinkedHashMap<>();
        merged.put(SCHEME_MEMORY, MEMORY_PROVIDER);
        for (CollectionProvider provider : customProviders) {
            CollectionProvider nonNullProvider = Objects.requireNonNull(provider, "provider");
            merged.put(normalizeRequiredScheme(nonNullProvider.scheme()), nonNullProvider);
        }
        return merged;
    }

    private static String normalizeRequiredScheme(String scheme) {
        String normalized = Objects.requireNonNull(scheme, "provider.scheme").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("provider.scheme must be non-blank");
        }
        return normalized;
    }
}
