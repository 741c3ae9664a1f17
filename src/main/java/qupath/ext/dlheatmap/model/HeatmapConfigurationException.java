package qupath.ext.dlheatmap.model;

/**
 * Thrown when a heatmap cannot be configured: conflicting worker counts,
 * an invalid stride divisor, or a grid that disagrees with the tile source.
 * <p>
 * Configuration errors are raised at construction time and are never retried.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class HeatmapConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public HeatmapConfigurationException(String message) {
        super(message);
    }

    public HeatmapConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
