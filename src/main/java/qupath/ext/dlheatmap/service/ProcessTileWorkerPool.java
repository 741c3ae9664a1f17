package qupath.ext.dlheatmap.service;

import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.model.ChannelLayout;
import qupath.ext.dlheatmap.model.PixelTile;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Worker pool running each batch in one of N child JVMs.
 * <p>
 * Every child runs {@link TileWorkerProcess} on the parent's classpath and
 * builds its own inference instance from the given provider class and
 * options. Tiles travel to the child and vectors back over its standard
 * streams; the child's stderr is inherited so its log output appears in the
 * parent's console.
 *
 * <h3>Failure handling</h3>
 * <ul>
 *   <li>A child that reports a different channel layout fails pool startup</li>
 *   <li>A child that exits or breaks the protocol mid-batch fails that batch</li>
 *   <li>On close, children get a shutdown frame and are destroyed if they
 *       have not exited within the shutdown timeout</li>
 * </ul>
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class ProcessTileWorkerPool extends TileWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(ProcessTileWorkerPool.class);

    private final List<WorkerProcess> workers = new ArrayList<>();
    private final BlockingQueue<WorkerProcess> idle = new LinkedBlockingQueue<>();

    /**
     * Starts the child processes and waits for each handshake.
     *
     * @param providerClass          fully-qualified provider class name, instantiated in each child
     * @param backendOptions         options passed to the provider in each child
     * @param expectedLayout         channel layout every child must report
     * @param processes              number of child processes
     * @param shutdownTimeoutSeconds how long to wait for children to exit on close
     * @throws InferenceException if a child fails to start or reports a different layout
     */
    public ProcessTileWorkerPool(String providerClass,
                                 Map<String, String> backendOptions,
                                 ChannelLayout expectedLayout,
                                 int processes,
                                 int shutdownTimeoutSeconds) throws InferenceException {
        super("heatmap-processes", processes, shutdownTimeoutSeconds);
        String optionsJson = new Gson().toJson(backendOptions);
        try {
            for (int i = 0; i < processes; i++) {
                WorkerProcess worker = WorkerProcess.start(i, providerClass, optionsJson);
                workers.add(worker);
                ChannelLayout reported = worker.handshake();
                if (!reported.equals(expectedLayout)) {
                    throw new InferenceException(String.format(
                            "Worker %d reports %s but the backend declared %s", i, reported, expectedLayout));
                }
                idle.add(worker);
            }
        } catch (InferenceException e) {
            close();
            throw e;
        } catch (IOException e) {
            close();
            throw new InferenceException("Failed to start worker processes: " + e.getMessage(), e);
        }
        logger.info("Started {} worker processes for backend {}", processes, providerClass);
    }

    @Override
    protected float[][] infer(List<PixelTile> tiles) throws IOException {
        WorkerProcess worker;
        try {
            worker = idle.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Interrupted while waiting for a worker process", e);
        }
        try {
            return worker.predict(tiles);
        } finally {
            idle.add(worker);
        }
    }

    @Override
    protected void closeWorkers() {
        for (WorkerProcess worker : workers) {
            worker.shutdown(getShutdownTimeoutSeconds());
        }
        workers.clear();
        idle.clear();
    }

    /**
     * One child JVM and its protocol streams.
     */
    private static final class WorkerProcess {

        private final int id;
        private final Process process;
        private final DataOutputStream out;
        private final DataInputStream in;

        private WorkerProcess(int id, Process process) {
            this.id = id;
            this.process = process;
            this.out = new DataOutputStream(new BufferedOutputStream(process.getOutputStream()));
            this.in = new DataInputStream(new BufferedInputStream(process.getInputStream()));
        }

        static WorkerProcess start(int id, String providerClass, String optionsJson) throws IOException {
            String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
            ProcessBuilder builder = new ProcessBuilder(
                    java, "-cp", System.getProperty("java.class.path"), TileWorkerProcess.class.getName());
            builder.redirectError(ProcessBuilder.Redirect.INHERIT);
            WorkerProcess worker = new WorkerProcess(id, builder.start());
            logger.debug("Started worker process {} (pid {})", id, worker.process.pid());

            worker.out.writeInt(WorkerProtocol.MAGIC);
            WorkerProtocol.writeString(worker.out, providerClass);
            WorkerProtocol.writeString(worker.out, optionsJson);
            worker.out.flush();
            return worker;
        }

        ChannelLayout handshake() throws IOException {
            try {
                if (in.readInt() != WorkerProtocol.MAGIC) {
                    throw new InferenceException("Worker " + id + " sent an invalid handshake");
                }
                if (in.readInt() != WorkerProtocol.STATUS_OK) {
                    throw new InferenceException("Worker " + id + " failed to start: " + WorkerProtocol.readString(in));
                }
                int features = in.readInt();
                int classes = in.readInt();
                int uncertainty = in.readInt();
                in.readInt(); // tile size, checked against the parent's backend already
                return new ChannelLayout(features, classes, uncertainty);
            } catch (InferenceException e) {
                throw e;
            } catch (IOException e) {
                throw new InferenceException("Worker " + id + " exited during startup" + exitSuffix(), e);
            }
        }

        float[][] predict(List<PixelTile> tiles) throws InferenceException {
            try {
                WorkerProtocol.writeBatch(out, tiles);
                out.flush();
                int status = in.readInt();
                if (status == WorkerProtocol.STATUS_OK) {
                    return WorkerProtocol.readVectors(in);
                }
                throw new InferenceException("Worker " + id + " failed: " + WorkerProtocol.readString(in));
            } catch (InferenceException e) {
                throw e;
            } catch (IOException e) {
                throw new InferenceException("Worker " + id + " exited unexpectedly" + exitSuffix(), e);
            }
        }

        void shutdown(int timeoutSeconds) {
            if (process.isAlive()) {
                try {
                    out.writeInt(WorkerProtocol.SHUTDOWN);
                    out.flush();
                    out.close();
                } catch (IOException e) {
                    logger.debug("Could not send shutdown to worker {}: {}", id, e.getMessage());
                }
            }
            try {
                if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                    logger.warn("Worker process {} did not exit within {}s, destroying it", id, timeoutSeconds);
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for worker process {}, destroying it", id);
                process.destroyForcibly();
            }
        }

        private String exitSuffix() {
            try {
                if (process.waitFor(1, TimeUnit.SECONDS)) {
                    return " (exit code " + process.exitValue() + ")";
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "";
        }
    }
}
