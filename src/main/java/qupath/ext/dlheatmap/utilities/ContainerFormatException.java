package qupath.ext.dlheatmap.utilities;

import java.io.IOException;

/**
 * Thrown when a saved heatmap container is malformed or lacks a required array.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class ContainerFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public ContainerFormatException(String message) {
        super(message);
    }

    public ContainerFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
