package qupath.ext.dlheatmap.model;

/**
 * Lifecycle of a heatmap generation run.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public enum GenerationState {
    /** No run has been started */
    IDLE,
    /** A run is filling the result buffer */
    RUNNING,
    /** The last run filled every included cell */
    COMPLETED,
    /** The last run stopped on a backend failure */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
