package qupath.ext.dlheatmap.service;

import qupath.ext.dlheatmap.model.ChannelLayout;
import qupath.ext.dlheatmap.model.PixelTile;

import java.io.IOException;
import java.util.List;

/**
 * Backend interface turning a batch of tiles into per-tile vectors.
 * <p>
 * Each returned vector has {@code numFeatures + numClasses + numUncertainty}
 * entries ordered features, class scores, uncertainty. The channel counts are
 * fixed and can be queried before any call to {@link #predict(List)}.
 * <p>
 * When used with a thread pool a single instance is shared by all worker
 * threads, so implementations must be thread-safe. Retry policy, if any,
 * belongs to the implementation; the heatmap engine never retries a batch.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public interface InferenceInterface extends AutoCloseable {

    int getNumFeatures();

    int getNumClasses();

    /**
     * Returns the number of trailing uncertainty channels, or 0 if the
     * backend does not estimate uncertainty.
     */
    int getNumUncertainty();

    /**
     * Returns the channel layout built from the three counts.
     */
    default ChannelLayout getChannelLayout() {
        return new ChannelLayout(getNumFeatures(), getNumClasses(), getNumUncertainty());
    }

    /**
     * Returns the tile size in pixels the model was trained on, or 0 if the
     * backend accepts any size.
     */
    default int getTilePx() {
        return 0;
    }

    /**
     * Returns the tile width in microns the model was trained on, or 0 if
     * the backend does not say.
     */
    default double getTileUm() {
        return 0;
    }

    /**
     * Runs inference on a batch of tiles.
     *
     * @param tiles tiles in batch order, never empty
     * @return one vector per tile, in the same order
     * @throws IOException if the backend fails on this batch
     */
    float[][] predict(List<PixelTile> tiles) throws IOException;

    /**
     * Releases backend resources. The default does nothing.
     */
    @Override
    default void close() {
    }
}
