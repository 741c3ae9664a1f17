package qupath.ext.dlheatmap.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.model.PixelTile;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs inference batches concurrently and hands back results as they finish.
 * <p>
 * Results come back in completion order, not submission order; each
 * {@link BatchResult} carries its batch so the caller can place the vectors.
 * The pool never writes results anywhere itself.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 *   <li>{@link #submit(TileBatch)} queues a batch on one of the worker threads</li>
 *   <li>{@link #take()} blocks for the next finished batch and rethrows its failure</li>
 *   <li>{@link #close()} stops the worker threads and releases workers; always call it</li>
 * </ol>
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public abstract class TileWorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TileWorkerPool.class);

    private final String name;
    private final int workerCount;
    private final int shutdownTimeoutSeconds;
    private final ExecutorService executor;
    private final CompletionService<BatchResult> completion;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param name                   pool name used for thread names and logging
     * @param workerCount            number of concurrent workers
     * @param shutdownTimeoutSeconds how long {@link #close()} waits for workers to stop
     */
    protected TileWorkerPool(String name, int workerCount, int shutdownTimeoutSeconds) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, got " + workerCount);
        }
        this.name = name;
        this.workerCount = workerCount;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, name + "-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.completion = new ExecutorCompletionService<>(executor);
    }

    /**
     * Queues a batch for inference.
     *
     * @param batch the batch
     * @throws IllegalStateException if the pool is closed
     */
    public void submit(TileBatch batch) {
        if (closed.get()) {
            throw new IllegalStateException("Worker pool " + name + " is closed");
        }
        completion.submit(() -> {
            try {
                return new BatchResult(batch, infer(batch.pixels()));
            } catch (InferenceException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                throw new InferenceException(String.format(
                        "Inference failed on batch %d: %s", batch.index(), e.getMessage()), e);
            }
        });
    }

    /**
     * Waits for the next finished batch.
     *
     * @return the batch with its vectors
     * @throws InferenceException   if that batch failed
     * @throws InterruptedException if interrupted while waiting
     */
    public BatchResult take() throws InferenceException, InterruptedException {
        Future<BatchResult> future = completion.take();
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InferenceException inferenceException) {
                throw inferenceException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new InferenceException("Inference failed: " + cause, cause);
        }
    }

    /**
     * Runs inference on one batch. Called concurrently from up to
     * {@link #getWorkerCount()} threads.
     *
     * @param tiles tiles of the batch
     * @return one vector per tile
     * @throws IOException if inference fails
     */
    protected abstract float[][] infer(List<PixelTile> tiles) throws IOException;

    /**
     * Releases pool-specific workers after the threads have stopped.
     */
    protected void closeWorkers() {
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public String getName() {
        return name;
    }

    protected int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    /**
     * Stops the worker threads, interrupting in-flight batches, and releases
     * the workers. Safe to call more than once.
     */
    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                logger.warn("Worker threads of {} did not stop within {}s", name, shutdownTimeoutSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while stopping worker threads of {}", name);
        }
        closeWorkers();
        logger.debug("Closed worker pool {}", name);
    }

    /**
     * Vectors produced for one batch.
     *
     * @param batch   the batch that was processed
     * @param vectors one vector per tile, in batch order
     */
    public record BatchResult(TileBatch batch, float[][] vectors) {}
}
