package qupath.ext.dlheatmap.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.model.PixelTile;

import java.io.IOException;
import java.util.List;

/**
 * Inference backend that delegates to a model server through {@link InferenceClient}.
 * <p>
 * The channel layout is fetched once on construction so it can be queried
 * before any batch is sent. The underlying HTTP client is thread-safe, so one
 * instance can be shared by a thread pool.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class HttpInferenceInterface implements InferenceInterface {

    private static final Logger logger = LoggerFactory.getLogger(HttpInferenceInterface.class);

    private final InferenceClient client;
    private final String modelPath;
    private final InferenceClient.ModelInfo modelInfo;

    /**
     * Connects to a model server and reads the model layout.
     *
     * @param host      server hostname
     * @param port      server port
     * @param modelPath model path passed to the server, or null for its default
     * @throws IOException if the server cannot be reached or returns a malformed layout
     */
    public HttpInferenceInterface(String host, int port, String modelPath) throws IOException {
        this(new InferenceClient(host, port), modelPath);
    }

    HttpInferenceInterface(InferenceClient client, String modelPath) throws IOException {
        this.client = client;
        this.modelPath = modelPath;
        try {
            this.modelInfo = client.getModelInfo(modelPath);
        } catch (IOException e) {
            client.close();
            throw e;
        }
        logger.info("Connected to model server {}: features={}, classes={}, uncertainty={}, tilePx={}, tileUm={}",
                client.getBaseUrl(), modelInfo.numFeatures(), modelInfo.numClasses(),
                modelInfo.numUncertainty(), modelInfo.tilePx(), modelInfo.tileUm());
    }

    @Override
    public int getNumFeatures() {
        return modelInfo.numFeatures();
    }

    @Override
    public int getNumClasses() {
        return modelInfo.numClasses();
    }

    @Override
    public int getNumUncertainty() {
        return modelInfo.numUncertainty();
    }

    @Override
    public int getTilePx() {
        return modelInfo.tilePx();
    }

    @Override
    public double getTileUm() {
        return modelInfo.tileUm();
    }

    @Override
    public float[][] predict(List<PixelTile> tiles) throws IOException {
        return client.predictBinary(modelPath, tiles);
    }

    @Override
    public void close() {
        client.close();
    }
}
