package qupath.ext.dlheatmap.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.backend.InferenceBackendProvider;
import qupath.ext.dlheatmap.model.PixelTile;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;

/**
 * Entry point of a child worker JVM started by {@link ProcessTileWorkerPool}.
 * <p>
 * The child builds its own inference instance from the provider class named
 * in the init frame, reports the channel layout, then answers batch frames on
 * stdout until it receives a shutdown frame or stdin closes. Stdout carries
 * protocol frames only; {@code System.out} is redirected to stderr before
 * anything is logged.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class TileWorkerProcess {

    private static final Logger logger = LoggerFactory.getLogger(TileWorkerProcess.class);

    private static final Type OPTIONS_TYPE = new TypeToken<Map<String, String>>() {}.getType();

    private TileWorkerProcess() {
    }

    public static void main(String[] args) {
        DataOutputStream out = new DataOutputStream(
                new BufferedOutputStream(new FileOutputStream(FileDescriptor.out)));
        System.setOut(System.err);
        DataInputStream in = new DataInputStream(new BufferedInputStream(System.in));
        int exitCode;
        try {
            exitCode = serve(in, out);
        } catch (IOException e) {
            logger.error("Worker protocol failure: {}", e.getMessage(), e);
            exitCode = 2;
        }
        System.exit(exitCode);
    }

    /**
     * Runs the worker protocol on the given streams.
     *
     * @param in  frames from the parent
     * @param out frames to the parent
     * @return process exit code, 0 after a clean shutdown
     * @throws IOException if the streams fail or a frame is malformed
     */
    static int serve(DataInputStream in, DataOutputStream out) throws IOException {
        if (in.readInt() != WorkerProtocol.MAGIC) {
            throw new IOException("Parent did not send the worker init frame");
        }
        String providerClass = WorkerProtocol.readString(in);
        String optionsJson = WorkerProtocol.readString(in);

        InferenceInterface created;
        try {
            created = createInference(providerClass, optionsJson);
        } catch (Exception e) {
            logger.error("Could not create inference backend {}: {}", providerClass, e.getMessage(), e);
            out.writeInt(WorkerProtocol.MAGIC);
            WorkerProtocol.writeError(out, "Could not create backend " + providerClass + ": " + e);
            out.flush();
            return 1;
        }

        try (InferenceInterface inference = created) {
            out.writeInt(WorkerProtocol.MAGIC);
            out.writeInt(WorkerProtocol.STATUS_OK);
            out.writeInt(inference.getNumFeatures());
            out.writeInt(inference.getNumClasses());
            out.writeInt(inference.getNumUncertainty());
            out.writeInt(inference.getTilePx());
            out.flush();
            logger.debug("Worker ready with backend {}", providerClass);

            int batches = 0;
            while (true) {
                int count;
                try {
                    count = in.readInt();
                } catch (EOFException e) {
                    logger.warn("Parent closed the worker input without a shutdown frame");
                    return 0;
                }
                if (count == WorkerProtocol.SHUTDOWN) {
                    logger.debug("Worker shutting down after {} batches", batches);
                    return 0;
                }
                if (count < 0) {
                    throw new IOException("Invalid tile count in batch frame: " + count);
                }
                List<PixelTile> tiles = WorkerProtocol.readBatch(in, count);
                try {
                    WorkerProtocol.writeVectors(out, inference.predict(tiles));
                } catch (Exception e) {
                    logger.error("Inference failed in worker: {}", e.getMessage(), e);
                    WorkerProtocol.writeError(out, e.toString());
                }
                out.flush();
                batches++;
            }
        }
    }

    private static InferenceInterface createInference(String providerClass, String optionsJson)
            throws ReflectiveOperationException, IOException {
        Class<?> type = Class.forName(providerClass);
        if (!InferenceBackendProvider.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(providerClass + " is not an InferenceBackendProvider");
        }
        InferenceBackendProvider provider =
                (InferenceBackendProvider) type.getDeclaredConstructor().newInstance();
        Map<String, String> options;
        try {
            options = new Gson().fromJson(optionsJson, OPTIONS_TYPE);
        } catch (JsonParseException e) {
            throw new IOException("Invalid backend options: " + optionsJson, e);
        }
        return provider.create(options == null ? Map.of() : options);
    }
}
