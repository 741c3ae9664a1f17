package qupath.ext.dlheatmap.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.backend.InferenceBackendProvider;
import qupath.ext.dlheatmap.model.GenerationProgress;
import qupath.ext.dlheatmap.model.HeatmapConfig;
import qupath.ext.dlheatmap.model.SlideTile;
import qupath.ext.dlheatmap.service.InferenceException;
import qupath.ext.dlheatmap.service.InferenceInterface;
import qupath.ext.dlheatmap.service.ResultBuffer;
import qupath.ext.dlheatmap.service.TileBatch;
import qupath.ext.dlheatmap.service.TileSource;
import qupath.ext.dlheatmap.service.TileWorkerPool;
import qupath.ext.dlheatmap.service.WorkerPoolFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs one inference pass over a tile source and commits the vectors into a
 * {@link ResultBuffer}.
 * <p>
 * Tiles are pulled in the source's order and grouped into batches of the
 * configured size. At most two batches per worker are in flight at once, so
 * memory stays bounded on gigapixel slides. Results are committed by the
 * calling thread as batches finish, in any order. The first failure ends the
 * pass; the worker pool is shut down either way.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class HeatmapGenerator {

    private static final Logger logger = LoggerFactory.getLogger(HeatmapGenerator.class);

    private final TileSource source;
    private final InferenceInterface inference;
    private final InferenceBackendProvider provider;
    private final HeatmapConfig config;
    private final int stride;

    /**
     * @param source    tile source
     * @param inference inference instance (shared by threads, layout reference for processes)
     * @param provider  provider for worker processes, or null
     * @param config    heatmap configuration
     * @param stride    grid stride in full-resolution pixels
     */
    public HeatmapGenerator(TileSource source, InferenceInterface inference, InferenceBackendProvider provider,
                            HeatmapConfig config, int stride) {
        this.source = source;
        this.inference = inference;
        this.provider = provider;
        this.config = config;
        this.stride = stride;
    }

    /**
     * Runs the pass on the calling thread.
     *
     * @param buffer   buffer to fill, allocated by the caller
     * @param listener progress callback invoked after each committed batch, or null
     * @throws InferenceException if the backend fails on any batch
     * @throws IOException        if a tile cannot be read
     */
    public void run(ResultBuffer buffer, Consumer<GenerationProgress> listener) throws IOException {
        long startTime = System.currentTimeMillis();
        int batchSize = config.getBatchSize();
        int channels = buffer.getLayout().totalChannels();
        int totalCells = buffer.getShape().cellCount();

        logger.info("Generating heatmap for {}: grid {}, {} channels, {} x{}, batch size {}",
                source.getName(), buffer.getShape(), channels,
                config.getPoolKind(), config.getWorkerCount(), batchSize);

        try (TileWorkerPool pool = WorkerPoolFactory.create(config, inference, provider)) {
            int maxInFlight = 2 * pool.getWorkerCount();
            Iterator<SlideTile> tiles = source.tiles(stride);
            int inFlight = 0;
            int dispatched = 0;
            int completed = 0;

            while (true) {
                while (inFlight < maxInFlight && tiles.hasNext()) {
                    List<SlideTile> batch = new ArrayList<>(batchSize);
                    while (batch.size() < batchSize && tiles.hasNext()) {
                        batch.add(tiles.next());
                    }
                    pool.submit(new TileBatch(dispatched++, batch));
                    inFlight++;
                }
                if (inFlight == 0) {
                    break;
                }

                TileWorkerPool.BatchResult result = pool.take();
                inFlight--;
                commit(buffer, result, channels);
                completed++;

                if (listener != null) {
                    listener.accept(new GenerationProgress(buffer.getCommittedCount(), completed,
                            totalCells, System.currentTimeMillis() - startTime));
                }
            }

            logger.info("Heatmap for {} complete: {} tiles in {} batches ({} ms)",
                    source.getName(), buffer.getCommittedCount(), completed,
                    System.currentTimeMillis() - startTime);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Interrupted while waiting for inference results", e);
        }
    }

    private static void commit(ResultBuffer buffer, TileWorkerPool.BatchResult result, int channels)
            throws InferenceException {
        TileBatch batch = result.batch();
        float[][] vectors = result.vectors();
        if (vectors == null || vectors.length != batch.size()) {
            throw new InferenceException(String.format(
                    "Backend returned %s results for batch %d of %d tiles",
                    vectors == null ? "no" : String.valueOf(vectors.length), batch.index(), batch.size()));
        }
        for (int i = 0; i < vectors.length; i++) {
            if (vectors[i] == null || vectors[i].length != channels) {
                throw new InferenceException(String.format(
                        "Backend returned a vector of length %s for tile %d of batch %d, expected %d",
                        vectors[i] == null ? "null" : String.valueOf(vectors[i].length), i, batch.index(), channels));
            }
        }
        for (int i = 0; i < vectors.length; i++) {
            SlideTile tile = batch.tiles().get(i);
            buffer.commit(tile.row(), tile.col(), vectors[i]);
        }
    }
}
