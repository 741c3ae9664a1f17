package qupath.ext.dlheatmap.controller;

/**
 * Thrown when an operation is not allowed in the current generation state,
 * such as starting a run while another is in progress.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class GenerationStateException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public GenerationStateException(String message) {
        super(message);
    }
}
