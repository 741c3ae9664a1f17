package qupath.ext.dlheatmap.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.model.DenseHeatmapArray;
import qupath.ext.dlheatmap.model.HeatmapArray;
import qupath.ext.dlheatmap.utilities.ContainerFormatException;
import qupath.ext.dlheatmap.utilities.NpzContainer;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Saves and loads heatmap results as {@code .npz} containers.
 *
 * <h3>Container keys</h3>
 * <ul>
 *   <li>{@code predictions} - features and class scores, shape (rows, cols, F+K)</li>
 *   <li>{@code uncertainty} - optional, shape (rows, cols, U)</li>
 *   <li>{@code logits} - read in place of {@code predictions} in older containers</li>
 * </ul>
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class HeatmapPersistence {

    private static final Logger logger = LoggerFactory.getLogger(HeatmapPersistence.class);

    public static final String PREDICTIONS_KEY = "predictions";
    public static final String UNCERTAINTY_KEY = "uncertainty";
    public static final String LEGACY_PREDICTIONS_KEY = "logits";
    public static final String FILE_EXTENSION = ".npz";

    private HeatmapPersistence() {
        // Utility class - no instantiation
    }

    /**
     * Returns the default container path for a slide: {@code <name>.npz} in
     * the working directory.
     */
    public static Path defaultPath(String slideName) {
        return Paths.get(slideName + FILE_EXTENSION);
    }

    /**
     * Writes predictions and, when present, uncertainty.
     *
     * @param path        destination file
     * @param predictions prediction array
     * @param uncertainty uncertainty array, or null
     * @throws IOException if writing fails
     */
    public static void save(Path path, HeatmapArray predictions, HeatmapArray uncertainty) throws IOException {
        Objects.requireNonNull(predictions, "Predictions are required");
        Map<String, DenseHeatmapArray> arrays = new LinkedHashMap<>();
        arrays.put(PREDICTIONS_KEY, DenseHeatmapArray.copyOf(predictions));
        if (uncertainty != null) {
            arrays.put(UNCERTAINTY_KEY, DenseHeatmapArray.copyOf(uncertainty));
        }
        NpzContainer.write(path, arrays);
        logger.info("Saved heatmap to {} ({})", path, arrays.keySet());
    }

    /**
     * Reads a container written by {@link #save} or by older versions that
     * stored predictions under {@code logits}.
     *
     * @param path container file
     * @return the loaded arrays
     * @throws ContainerFormatException if the file is malformed or has no predictions
     * @throws IOException              if reading fails
     */
    public static LoadedHeatmap load(Path path) throws IOException {
        Map<String, DenseHeatmapArray> arrays = NpzContainer.read(path);

        DenseHeatmapArray predictions = arrays.get(PREDICTIONS_KEY);
        if (predictions == null) {
            predictions = arrays.get(LEGACY_PREDICTIONS_KEY);
            if (predictions == null) {
                throw new ContainerFormatException(String.format(
                        "%s has neither '%s' nor '%s' (found %s)",
                        path, PREDICTIONS_KEY, LEGACY_PREDICTIONS_KEY, arrays.keySet()));
            }
            logger.warn("Loading predictions from '{}' key.", LEGACY_PREDICTIONS_KEY);
        }

        DenseHeatmapArray uncertainty = arrays.get(UNCERTAINTY_KEY);
        if (uncertainty != null
                && (uncertainty.rows() != predictions.rows() || uncertainty.cols() != predictions.cols())) {
            throw new ContainerFormatException(String.format(
                    "%s: uncertainty grid %dx%d does not match predictions grid %dx%d",
                    path, uncertainty.rows(), uncertainty.cols(), predictions.rows(), predictions.cols()));
        }
        logger.info("Loaded heatmap from {}: predictions {}{}", path, predictions,
                uncertainty != null ? ", uncertainty " + uncertainty : "");
        return new LoadedHeatmap(predictions, uncertainty);
    }

    /**
     * Arrays read from a container.
     *
     * @param predictions prediction array
     * @param uncertainty uncertainty array, or null if the container has none
     */
    public record LoadedHeatmap(DenseHeatmapArray predictions, DenseHeatmapArray uncertainty) {}
}
