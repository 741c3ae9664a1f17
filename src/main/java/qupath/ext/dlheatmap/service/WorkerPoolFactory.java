package qupath.ext.dlheatmap.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.backend.InferenceBackendProvider;
import qupath.ext.dlheatmap.model.HeatmapConfig;
import qupath.ext.dlheatmap.model.HeatmapConfigurationException;

/**
 * Creates the {@link TileWorkerPool} selected by a {@link HeatmapConfig}.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class WorkerPoolFactory {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPoolFactory.class);

    private WorkerPoolFactory() {
        // Utility class
    }

    /**
     * Creates a worker pool.
     * <p>
     * A thread pool shares {@code inference} across its threads. A process pool
     * starts one child per worker, each creating its own instance through
     * {@code provider}; {@code inference} then only supplies the layout the
     * children must agree with.
     *
     * @param config    heatmap configuration
     * @param inference the parent's inference instance
     * @param provider  provider the inference came from, or null if it was supplied directly
     * @return a started pool
     * @throws HeatmapConfigurationException if a process pool is requested without a provider
     * @throws InferenceException            if worker processes fail to start
     */
    public static TileWorkerPool create(HeatmapConfig config,
                                        InferenceInterface inference,
                                        InferenceBackendProvider provider) throws InferenceException {
        int workers = config.getWorkerCount();
        int timeout = config.getWorkerShutdownTimeoutSeconds();
        if (config.getPoolKind() == HeatmapConfig.WorkerPoolKind.PROCESSES) {
            if (provider == null) {
                throw new HeatmapConfigurationException(
                        "A process pool needs a registered backend type; an inference instance cannot be sent to another process");
            }
            logger.debug("Creating process pool with {} workers for backend '{}'", workers, provider.getType());
            return new ProcessTileWorkerPool(provider.getClass().getName(), config.getBackendOptions(),
                    inference.getChannelLayout(), workers, timeout);
        }
        logger.debug("Creating thread pool with {} workers", workers);
        return new ThreadTileWorkerPool(inference, workers, timeout);
    }
}
