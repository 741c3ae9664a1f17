package qupath.ext.dlheatmap.controller;

import qupath.ext.dlheatmap.model.HeatmapArray;
import qupath.ext.dlheatmap.service.ResultBuffer;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on a background generation run.
 * <p>
 * The buffer is readable while the run progresses; cells not yet computed
 * hold the sentinel value. Dropping the handle does not stop the run.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class GenerationHandle {

    private final ResultBuffer buffer;
    private final CompletableFuture<Void> completion;

    GenerationHandle(ResultBuffer buffer, CompletableFuture<Void> completion) {
        this.buffer = buffer;
        this.completion = completion;
    }

    /**
     * Returns the live result buffer of this run.
     */
    public ResultBuffer getBuffer() {
        return buffer;
    }

    /**
     * Returns a live view of the prediction channels.
     */
    public HeatmapArray getPredictions() {
        return buffer.predictions();
    }

    /**
     * Returns a live view of the uncertainty channels, or null if the backend has none.
     */
    public HeatmapArray getUncertainty() {
        return buffer.uncertainty();
    }

    /**
     * Returns a future completing when the run ends, exceptionally with the
     * run's failure.
     */
    public CompletableFuture<Void> getCompletion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Waits for the run to finish.
     *
     * @throws IOException          the run's backend or tile-reading failure
     * @throws InterruptedException if interrupted while waiting
     */
    public void await() throws IOException, InterruptedException {
        try {
            completion.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Waits for the run to finish, up to a timeout.
     *
     * @return true if the run finished successfully, false on timeout
     * @throws IOException          the run's backend or tile-reading failure
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean await(long timeout, TimeUnit unit) throws IOException, InterruptedException {
        try {
            completion.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static IOException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException ioException) {
            return ioException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException("Heatmap generation failed", cause);
    }
}
