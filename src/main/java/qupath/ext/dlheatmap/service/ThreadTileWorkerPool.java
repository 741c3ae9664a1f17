package qupath.ext.dlheatmap.service;

import qupath.ext.dlheatmap.model.PixelTile;

import java.io.IOException;
import java.util.List;

/**
 * Worker pool running batches on threads that share one inference instance.
 * The instance must be thread-safe and is not closed by the pool.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class ThreadTileWorkerPool extends TileWorkerPool {

    private final InferenceInterface inference;

    public ThreadTileWorkerPool(InferenceInterface inference, int threads, int shutdownTimeoutSeconds) {
        super("heatmap-threads", threads, shutdownTimeoutSeconds);
        this.inference = inference;
    }

    @Override
    protected float[][] infer(List<PixelTile> tiles) throws IOException {
        return inference.predict(tiles);
    }
}
