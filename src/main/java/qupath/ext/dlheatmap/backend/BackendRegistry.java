package qupath.ext.dlheatmap.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe table mapping backend type identifiers to
 * {@link InferenceBackendProvider} implementations.
 * <p>
 * A registry is an ordinary object passed to the heatmap builder; there is no
 * global instance.
 *
 * <h3>Lookup</h3>
 * <ul>
 *   <li><strong>Registration:</strong> providers register under their type identifier</li>
 *   <li><strong>Exact Matching:</strong> lookup is exact and case-insensitive</li>
 *   <li><strong>Replacement:</strong> registering a type twice replaces the earlier provider</li>
 * </ul>
 *
 * <pre>{@code
 * BackendRegistry registry = BackendRegistry.withDefaults();
 * registry.register(new MyBackendProvider());
 * Optional<InferenceBackendProvider> provider = registry.getProvider("http");
 * }</pre>
 *
 * @author UW-LOCI
 * @since 0.1.0
 * @see InferenceBackendProvider
 */
public final class BackendRegistry {

    private static final Logger logger = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<String, InferenceBackendProvider> providers = new ConcurrentHashMap<>();

    /**
     * Creates an empty registry.
     */
    public BackendRegistry() {
    }

    /**
     * Creates a registry holding the built-in providers (currently the HTTP backend).
     */
    public static BackendRegistry withDefaults() {
        BackendRegistry registry = new BackendRegistry();
        registry.register(new HttpBackendProvider());
        return registry;
    }

    /**
     * Registers a provider under its type identifier.
     *
     * @param provider the provider, must not be null and must have a non-blank type
     * @throws IllegalArgumentException if the provider or its type is missing
     */
    public void register(InferenceBackendProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("Provider cannot be null");
        }
        String type = provider.getType();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException(
                    "Provider " + provider.getClass().getSimpleName() + " has no type identifier");
        }

        String normalizedType = normalize(type);
        InferenceBackendProvider existing = providers.put(normalizedType, provider);
        if (existing != null) {
            logger.warn("Replaced backend provider for type '{}'. Old: {}, New: {}",
                    normalizedType,
                    existing.getClass().getSimpleName(),
                    provider.getClass().getSimpleName());
        } else {
            logger.debug("Registered backend provider for type '{}': {}",
                    normalizedType, provider.getClass().getSimpleName());
        }
    }

    /**
     * Returns the provider for a backend type.
     *
     * @param type backend type (case-insensitive)
     * @return the provider, or empty if none is registered
     */
    public Optional<InferenceBackendProvider> getProvider(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        InferenceBackendProvider provider = providers.get(normalize(type));
        if (provider == null) {
            logger.debug("No backend provider for type '{}'. Registered types: {}", type, providers.keySet());
        }
        return Optional.ofNullable(provider);
    }

    public boolean hasProvider(String type) {
        return getProvider(type).isPresent();
    }

    /**
     * Removes the provider for a type.
     *
     * @return true if a provider was removed
     */
    public boolean unregister(String type) {
        if (type == null || type.isBlank()) {
            return false;
        }
        InferenceBackendProvider removed = providers.remove(normalize(type));
        if (removed != null) {
            logger.debug("Unregistered backend provider for type '{}'", type);
        }
        return removed != null;
    }

    public Collection<String> getAllTypes() {
        return Collections.unmodifiableCollection(providers.keySet());
    }

    private static String normalize(String type) {
        return type.toLowerCase().trim();
    }
}
