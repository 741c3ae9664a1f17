package qupath.ext.dlheatmap.service;

import java.io.IOException;

/**
 * Thrown when the inference backend fails on a batch. A backend failure ends
 * the current generation run and is never retried by the engine.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class InferenceException extends IOException {

    private static final long serialVersionUID = 1L;

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
