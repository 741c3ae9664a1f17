package qupath.ext.dlheatmap.backend;

import qupath.ext.dlheatmap.model.HeatmapConfigurationException;
import qupath.ext.dlheatmap.preferences.HeatmapPreferences;
import qupath.ext.dlheatmap.service.HttpInferenceInterface;
import qupath.ext.dlheatmap.service.InferenceInterface;

import java.io.IOException;
import java.util.Map;

/**
 * Provider for {@link HttpInferenceInterface}, registered as type {@code "http"}.
 * <p>
 * Recognized options: {@code host}, {@code port} (defaults from
 * {@link HeatmapPreferences}) and {@code model_path} (passed to the server).
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class HttpBackendProvider implements InferenceBackendProvider {

    public static final String TYPE = "http";

    public static final String OPTION_HOST = "host";
    public static final String OPTION_PORT = "port";
    public static final String OPTION_MODEL_PATH = "model_path";

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String getDisplayName() {
        return "HTTP model server";
    }

    @Override
    public String getDescription() {
        return "Runs inference on a remote model server over HTTP";
    }

    @Override
    public InferenceInterface create(Map<String, String> options) throws IOException {
        String host = options.getOrDefault(OPTION_HOST, HeatmapPreferences.getServerHost());
        int port;
        try {
            port = options.containsKey(OPTION_PORT)
                    ? Integer.parseInt(options.get(OPTION_PORT).trim())
                    : HeatmapPreferences.getServerPort();
        } catch (NumberFormatException e) {
            throw new HeatmapConfigurationException("Invalid port option: " + options.get(OPTION_PORT), e);
        }
        return new HttpInferenceInterface(host, port, options.get(OPTION_MODEL_PATH));
    }
}
