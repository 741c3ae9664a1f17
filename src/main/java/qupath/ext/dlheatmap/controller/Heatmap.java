package qupath.ext.dlheatmap.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.backend.BackendRegistry;
import qupath.ext.dlheatmap.backend.InferenceBackendProvider;
import qupath.ext.dlheatmap.model.ChannelLayout;
import qupath.ext.dlheatmap.model.GenerationProgress;
import qupath.ext.dlheatmap.model.GenerationState;
import qupath.ext.dlheatmap.model.GridShape;
import qupath.ext.dlheatmap.model.HeatmapArray;
import qupath.ext.dlheatmap.model.HeatmapConfig;
import qupath.ext.dlheatmap.model.HeatmapConfigurationException;
import qupath.ext.dlheatmap.service.HeatmapPersistence;
import qupath.ext.dlheatmap.service.InferenceInterface;
import qupath.ext.dlheatmap.service.ResultBuffer;
import qupath.ext.dlheatmap.service.TileSource;
import qupath.ext.dlheatmap.utilities.GridGeometryResolver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Heatmap of per-tile model outputs for one slide.
 * <p>
 * A heatmap ties together a {@link TileSource}, an {@link InferenceInterface}
 * and a {@link HeatmapConfig}. The grid is resolved and checked against the
 * tile source when the heatmap is built, so geometry and configuration errors
 * surface before any inference runs.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * Heatmap heatmap = Heatmap.builder()
 *         .tileSource(source)
 *         .inference(model)
 *         .config(HeatmapConfig.builder().tileUm(302).numThreads(4).build())
 *         .build();
 * heatmap.generate();
 * HeatmapArray predictions = heatmap.getPredictions();
 * heatmap.save();
 * }</pre>
 *
 * <h3>Generation state</h3>
 * <ul>
 *   <li>{@code IDLE} until the first run starts</li>
 *   <li>{@code RUNNING} while a run is in progress; starting another run throws {@link GenerationStateException}</li>
 *   <li>{@code COMPLETED} or {@code FAILED} afterwards; a new run may be started from either</li>
 * </ul>
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class Heatmap implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Heatmap.class);

    private final TileSource source;
    private final InferenceInterface inference;
    private final boolean ownsInference;
    private final HeatmapConfig config;
    private final GridGeometryResolver grid;
    private final ChannelLayout layout;
    private final Consumer<GenerationProgress> progressListener;
    private final HeatmapGenerator generator;

    private final AtomicReference<GenerationState> state = new AtomicReference<>(GenerationState.IDLE);
    private volatile ResultBuffer lastBuffer;
    private volatile HeatmapArray predictions;
    private volatile HeatmapArray uncertainty;
    private volatile ThreadFactory threadFactory;

    private Heatmap(Builder builder, InferenceInterface inference, InferenceBackendProvider provider,
                    GridGeometryResolver grid) {
        this.source = builder.tileSource;
        this.inference = inference;
        this.ownsInference = builder.inference == null;
        this.config = builder.config;
        this.grid = grid;
        this.layout = inference.getChannelLayout();
        this.progressListener = builder.progressListener;
        this.generator = new HeatmapGenerator(source, inference, provider, config, grid.getStride());
        this.threadFactory = task -> new Thread(task, "heatmap-generation-" + source.getName());
    }

    // Replaces the factory for background generation threads; used by tests
    void setThreadFactory(ThreadFactory threadFactory) {
        this.threadFactory = Objects.requireNonNull(threadFactory);
    }

    // ==================== Generation ====================

    /**
     * Runs inference over the whole slide on the calling thread.
     *
     * @throws GenerationStateException if a run is already in progress
     * @throws IOException              if the backend fails or a tile cannot be read
     */
    public void generate() throws IOException {
        ResultBuffer buffer = begin();
        try {
            generator.run(buffer, progressListener);
        } catch (IOException | RuntimeException | Error e) {
            fail(e);
            throw e;
        }
        complete(buffer);
    }

    /**
     * Starts inference on a background thread.
     * <p>
     * The returned handle's buffer is allocated (all sentinel) before this
     * method returns and fills in as batches finish.
     *
     * @return handle on the running generation
     * @throws GenerationStateException if a run is already in progress
     */
    public GenerationHandle generateAsync() {
        ResultBuffer buffer = begin();
        CompletableFuture<Void> completion = new CompletableFuture<>();
        Thread thread = threadFactory.newThread(() -> {
            try {
                generator.run(buffer, progressListener);
                complete(buffer);
                completion.complete(null);
            } catch (Throwable t) {
                fail(t);
                completion.completeExceptionally(t);
            }
        });
        try {
            thread.start();
        } catch (RuntimeException | Error e) {
            fail(e);
            throw e;
        }
        return new GenerationHandle(buffer, completion);
    }

    /**
     * Runs inference either on the calling thread or in the background.
     *
     * @param asynchronous true to run in the background
     * @return the handle when asynchronous, empty otherwise
     * @throws IOException if a synchronous run fails
     */
    public Optional<GenerationHandle> generate(boolean asynchronous) throws IOException {
        if (asynchronous) {
            return Optional.of(generateAsync());
        }
        generate();
        return Optional.empty();
    }

    private ResultBuffer begin() {
        while (true) {
            GenerationState current = state.get();
            if (current == GenerationState.RUNNING) {
                throw new GenerationStateException("Heatmap generation is already running for " + source.getName());
            }
            if (state.compareAndSet(current, GenerationState.RUNNING)) {
                break;
            }
        }
        try {
            ResultBuffer buffer = new ResultBuffer(grid.getGridShape(), layout);
            lastBuffer = buffer;
            return buffer;
        } catch (RuntimeException | Error e) {
            state.set(GenerationState.FAILED);
            throw e;
        }
    }

    private synchronized void complete(ResultBuffer buffer) {
        predictions = buffer.predictions();
        uncertainty = buffer.uncertainty();
        state.set(GenerationState.COMPLETED);
    }

    private void fail(Throwable cause) {
        logger.error("Heatmap generation failed for {}: {}", source.getName(), cause.getMessage());
        state.set(GenerationState.FAILED);
    }

    // ==================== Persistence ====================

    /**
     * Saves the predictions to {@code <slide name>.npz} in the working directory.
     *
     * @return the path written
     * @throws IOException if writing fails
     */
    public Path save() throws IOException {
        Path path = HeatmapPersistence.defaultPath(source.getName());
        save(path);
        return path;
    }

    /**
     * Saves predictions and, when present, uncertainty.
     *
     * @param path destination file
     * @throws GenerationStateException if there are no predictions yet
     * @throws IOException              if writing fails
     */
    public synchronized void save(Path path) throws IOException {
        if (predictions == null) {
            throw new GenerationStateException("No predictions to save for " + source.getName()
                    + "; run generate() or load() first");
        }
        HeatmapPersistence.save(path, predictions, uncertainty);
    }

    /**
     * Replaces the in-memory results with those stored in a container.
     * A failed load leaves the current results untouched.
     *
     * @param path container file
     * @throws GenerationStateException if a run is in progress
     * @throws IOException              if the container cannot be read
     */
    public synchronized void load(Path path) throws IOException {
        if (state.get() == GenerationState.RUNNING) {
            throw new GenerationStateException("Cannot load results while generation is running");
        }
        HeatmapPersistence.LoadedHeatmap loaded = HeatmapPersistence.load(path);
        predictions = loaded.predictions();
        uncertainty = loaded.uncertainty();
    }

    // ==================== Accessors ====================

    public GenerationState getState() {
        return state.get();
    }

    /**
     * Returns the predictions of the last successful run or load, or null.
     */
    public HeatmapArray getPredictions() {
        return predictions;
    }

    /**
     * Returns the uncertainty of the last successful run or load, or null if
     * there is none.
     */
    public HeatmapArray getUncertainty() {
        return uncertainty;
    }

    /**
     * Returns the buffer of the most recent run, including a failed or
     * running one, or null if no run has started.
     */
    public ResultBuffer getLastBuffer() {
        return lastBuffer;
    }

    public GridShape getGridShape() {
        return grid.getGridShape();
    }

    public GridGeometryResolver getGrid() {
        return grid;
    }

    public ChannelLayout getChannelLayout() {
        return layout;
    }

    public HeatmapConfig getConfig() {
        return config;
    }

    public String getSlideName() {
        return source.getName();
    }

    /**
     * Closes the inference instance if this heatmap created it from a registry.
     *
     * @throws GenerationStateException if a run is in progress
     */
    @Override
    public void close() {
        if (state.get() == GenerationState.RUNNING) {
            throw new GenerationStateException("Cannot close while generation is running");
        }
        if (ownsInference) {
            inference.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Heatmap.
     * <p>
     * Either an inference instance or a configured backend type is required.
     * A process pool always needs the backend type, because each worker
     * process creates its own instance through the registered provider.
     */
    public static class Builder {
        private TileSource tileSource;
        private InferenceInterface inference;
        private BackendRegistry registry;
        private HeatmapConfig config;
        private Consumer<GenerationProgress> progressListener;

        public Builder tileSource(TileSource tileSource) {
            this.tileSource = tileSource;
            return this;
        }

        /**
         * Uses an existing inference instance. The heatmap does not close it.
         */
        public Builder inference(InferenceInterface inference) {
            this.inference = inference;
            return this;
        }

        /**
         * Sets the registry used to look up {@link HeatmapConfig#getBackendType()}.
         * Defaults to {@link BackendRegistry#withDefaults()}.
         */
        public Builder registry(BackendRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder config(HeatmapConfig config) {
            this.config = config;
            return this;
        }

        public Builder progressListener(Consumer<GenerationProgress> progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        /**
         * Builds the heatmap, creating the backend if needed and resolving the grid.
         *
         * @return the heatmap
         * @throws HeatmapConfigurationException if the configuration, backend and tile source disagree
         * @throws IOException                   if a registered backend cannot be created
         */
        public Heatmap build() throws IOException {
            Objects.requireNonNull(tileSource, "Tile source is required");
            Objects.requireNonNull(config, "Heatmap configuration is required");

            InferenceBackendProvider provider = null;
            if (config.getBackendType() != null) {
                BackendRegistry lookup = registry != null ? registry : BackendRegistry.withDefaults();
                provider = lookup.getProvider(config.getBackendType())
                        .orElseThrow(() -> new HeatmapConfigurationException(String.format(
                                "Unknown backend type '%s'. Registered types: %s",
                                config.getBackendType(), lookup.getAllTypes())));
            }
            if (config.getPoolKind() == HeatmapConfig.WorkerPoolKind.PROCESSES && provider == null) {
                throw new HeatmapConfigurationException(
                        "A process pool needs a registered backend type; an inference instance cannot be sent to another process");
            }
            if (inference == null && provider == null) {
                throw new HeatmapConfigurationException("Either an inference instance or a backend type is required");
            }

            InferenceInterface resolved = inference != null ? inference : provider.create(config.getBackendOptions());
            try {
                int modelTilePx = resolved.getTilePx();
                if (modelTilePx > 0 && modelTilePx != config.getTilePx()) {
                    throw new HeatmapConfigurationException(String.format(
                            "Slide tile size %dpx does not match the model's tile size %dpx",
                            config.getTilePx(), modelTilePx));
                }
                double modelTileUm = resolved.getTileUm();
                if (modelTileUm > 0 && Double.compare(modelTileUm, config.getTileUm()) != 0) {
                    throw new HeatmapConfigurationException(String.format(
                            "Slide tile size %sum does not match the model's tile size %sum",
                            config.getTileUm(), modelTileUm));
                }
                GridGeometryResolver grid = new GridGeometryResolver(tileSource.getWidth(), tileSource.getHeight(),
                        tileSource.getMicronsPerPixel(), config.getTileUm(), config.getStrideDiv());
                grid.verifyAgainst(tileSource.getGridShape());

                Heatmap heatmap = new Heatmap(this, resolved, provider, grid);
                logger.debug("Built heatmap for {}: grid {}, {}, {}", tileSource.getName(),
                        grid.getGridShape(), heatmap.layout, config);
                return heatmap;
            } catch (RuntimeException e) {
                if (inference == null) {
                    resolved.close();
                }
                throw e;
            }
        }
    }
}
