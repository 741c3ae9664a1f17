package qupath.ext.dlheatmap.backend;

import qupath.ext.dlheatmap.service.InferenceInterface;

import java.io.IOException;
import java.util.Map;

/**
 * Creates {@link InferenceInterface} instances of one backend type.
 * <p>
 * Providers are looked up by type in a {@link BackendRegistry}. Providers used
 * with process pools are instantiated inside each worker JVM by class name,
 * so they need a public no-argument constructor.
 *
 * @author UW-LOCI
 * @since 0.1.0
 * @see BackendRegistry
 */
public interface InferenceBackendProvider {

    /**
     * Returns the unique type identifier (for example "http").
     */
    String getType();

    /**
     * Returns a human-readable name.
     */
    String getDisplayName();

    default String getDescription() {
        return getDisplayName();
    }

    /**
     * Creates a backend instance.
     *
     * @param options backend-specific options, never null
     * @return a new inference instance
     * @throws IOException if the backend cannot be reached or initialized
     */
    InferenceInterface create(Map<String, String> options) throws IOException;
}
