package qupath.ext.dlheatmap.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.model.PixelTile;
import qupath.ext.dlheatmap.utilities.TileCodec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for a tile-level model server.
 *
 * <h3>Server Endpoints</h3>
 * <ul>
 *   <li>GET /api/v1/health - Server health check</li>
 *   <li>GET /api/v1/model - Channel layout and input tile size of the loaded model</li>
 *   <li>POST /api/v1/predict/binary - Per-tile vectors for a batch sent as multipart form data</li>
 * </ul>
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class InferenceClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(InferenceClient.class);
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final String API_VERSION = "v1";

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final Gson gson;

    /**
     * Creates a new client.
     *
     * @param host server hostname
     * @param port server port
     */
    public InferenceClient(String host, int port) {
        this.baseUrl = String.format("http://%s:%d/api/%s", host, port, API_VERSION);

        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(300, TimeUnit.SECONDS) // large batches on CPU can be slow
                .writeTimeout(60, TimeUnit.SECONDS)
                .build();

        this.gson = new Gson();

        logger.debug("InferenceClient initialized with base URL: {}", baseUrl);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    // ==================== Health & Model ====================

    /**
     * Checks if the server is healthy and responding.
     *
     * @return true if the server reports status "healthy"
     */
    public boolean checkHealth() {
        Request request = new Request.Builder()
                .url(baseUrl + "/health")
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (response.isSuccessful() && body != null) {
                JsonObject json = JsonParser.parseString(body.string()).getAsJsonObject();
                return json.has("status") && "healthy".equals(json.get("status").getAsString());
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            logger.debug("Health check failed: {}", e.getMessage());
        }
        return false;
    }

    /**
     * Fetches the layout of the model the server will use.
     *
     * @param modelPath model path passed to the server, or null for its default model
     * @return model information
     * @throws IOException if the request fails or the response is malformed
     */
    public ModelInfo getModelInfo(String modelPath) throws IOException {
        HttpUrl.Builder url = HttpUrl.get(baseUrl + "/model").newBuilder();
        if (modelPath != null) {
            url.addQueryParameter("model_path", modelPath);
        }
        Request request = new Request.Builder()
                .url(url.build())
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("Model info request failed (HTTP " + response.code() + "): " + body);
            }
            try {
                JsonObject json = JsonParser.parseString(body).getAsJsonObject();
                return new ModelInfo(
                        requireInt(json, "num_features"),
                        requireInt(json, "num_classes"),
                        json.has("num_uncertainty") ? json.get("num_uncertainty").getAsInt() : 0,
                        json.has("tile_px") ? json.get("tile_px").getAsInt() : 0,
                        json.has("tile_um") ? json.get("tile_um").getAsDouble() : 0);
            } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
                throw new IOException("Malformed model info response: " + body, e);
            }
        }
    }

    // ==================== Inference ====================

    /**
     * Runs inference on a batch using binary tile transfer.
     * <p>
     * Tiles are sent as one little-endian float32 blob in HWC order together
     * with a JSON metadata part naming each tile. The server replies with a
     * {@code predictions} object keyed by tile id.
     *
     * @param modelPath model path passed to the server, or null
     * @param tiles     equally-sized tiles
     * @return one vector per tile, in input order
     * @throws InferenceException if the server rejects the batch or omits a tile
     * @throws IOException        if communication fails
     */
    public float[][] predictBinary(String modelPath, List<PixelTile> tiles) throws IOException {
        PixelTile first = tiles.get(0);
        List<String> tileIds = new ArrayList<>(tiles.size());
        for (int i = 0; i < tiles.size(); i++) {
            tileIds.add(Integer.toString(i));
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        if (modelPath != null) {
            meta.put("model_path", modelPath);
        }
        meta.put("tile_ids", tileIds);
        meta.put("tile_height", first.height());
        meta.put("tile_width", first.width());
        meta.put("num_channels", first.channels());
        meta.put("dtype", "float32");
        String metadataJson = gson.toJson(meta);

        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("metadata", metadataJson)
                .addFormDataPart("tiles", "tiles.bin",
                        RequestBody.create(TileCodec.encodeBatch(tiles), OCTET_STREAM))
                .build();

        Request request = new Request.Builder()
                .url(baseUrl + "/predict/binary")
                .post(body)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new InferenceException("Binary inference request failed (HTTP "
                        + response.code() + "): " + responseBody);
            }

            JsonObject predObj;
            try {
                predObj = JsonParser.parseString(responseBody).getAsJsonObject().getAsJsonObject("predictions");
            } catch (JsonParseException | IllegalStateException | ClassCastException e) {
                throw new InferenceException("Malformed inference response", e);
            }
            if (predObj == null) {
                throw new InferenceException("Inference response has no 'predictions'");
            }

            float[][] vectors = new float[tiles.size()][];
            for (int i = 0; i < tileIds.size(); i++) {
                JsonElement element = predObj.get(tileIds.get(i));
                if (element == null || !element.isJsonArray()) {
                    throw new InferenceException("Inference response is missing tile " + tileIds.get(i));
                }
                JsonArray arr = element.getAsJsonArray();
                float[] vector = new float[arr.size()];
                for (int j = 0; j < arr.size(); j++) {
                    vector[j] = arr.get(j).getAsFloat();
                }
                vectors[i] = vector;
            }
            return vectors;
        }
    }

    private static int requireInt(JsonObject json, String field) throws IOException {
        if (!json.has(field)) {
            throw new IOException("Model info response has no '" + field + "'");
        }
        return json.get(field).getAsInt();
    }

    /**
     * Releases the client's connection pool and dispatcher threads.
     */
    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    /**
     * Layout of the model served by the backend.
     *
     * @param numFeatures    feature channels per tile
     * @param numClasses     class-score channels per tile
     * @param numUncertainty uncertainty channels per tile
     * @param tilePx         expected input tile size, or 0 if unspecified
     * @param tileUm         tile width in microns used for training, or 0 if unspecified
     */
    public record ModelInfo(int numFeatures, int numClasses, int numUncertainty, int tilePx, double tileUm) {}
}
