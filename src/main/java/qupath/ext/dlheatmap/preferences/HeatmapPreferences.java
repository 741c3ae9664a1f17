package qupath.ext.dlheatmap.preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Default settings for heatmap generation.
 * <p>
 * Defaults are bundled in {@code heatmap-defaults.properties} next to this
 * class's package on the classpath. Any key can be overridden with a JVM
 * system property of the same name, e.g. {@code -Ddlheatmap.batchSize=64}.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class HeatmapPreferences {

    private static final Logger logger = LoggerFactory.getLogger(HeatmapPreferences.class);

    private static final String DEFAULTS_RESOURCE = "/qupath/ext/dlheatmap/heatmap-defaults.properties";

    // Tile settings
    static final String TILE_PX = "dlheatmap.tilePx";
    static final String TILE_UM = "dlheatmap.tileUm";
    static final String STRIDE_DIV = "dlheatmap.strideDiv";

    // Execution settings
    static final String BATCH_SIZE = "dlheatmap.batchSize";
    static final String NUM_THREADS = "dlheatmap.numThreads";
    static final String WORKER_SHUTDOWN_TIMEOUT = "dlheatmap.workerShutdownTimeoutSeconds";

    // Server settings (HTTP backend)
    static final String SERVER_HOST = "dlheatmap.serverHost";
    static final String SERVER_PORT = "dlheatmap.serverPort";

    private static final Properties DEFAULTS = loadDefaults();

    private HeatmapPreferences() {
        // Utility class - no instantiation
    }

    private static Properties loadDefaults() {
        Properties props = new Properties();
        try (InputStream in = HeatmapPreferences.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("Heatmap defaults resource {} not found, using built-in values", DEFAULTS_RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read heatmap defaults from {}: {}", DEFAULTS_RESOURCE, e.getMessage());
        }
        return props;
    }

    private static String getString(String key, String fallback) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            value = DEFAULTS.getProperty(key, fallback);
        }
        return value.trim();
    }

    private static int getInt(String key, int fallback) {
        String value = getString(key, Integer.toString(fallback));
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-integer value '{}' for {}, using {}", value, key, fallback);
            return fallback;
        }
    }

    private static double getDouble(String key, double fallback) {
        String value = getString(key, Double.toString(fallback));
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}, using {}", value, key, fallback);
            return fallback;
        }
    }

    // ==================== Getters ====================

    public static int getTilePx() {
        return getInt(TILE_PX, 299);
    }

    public static double getTileUm() {
        return getDouble(TILE_UM, 302.0);
    }

    public static int getStrideDiv() {
        return getInt(STRIDE_DIV, 2);
    }

    public static int getBatchSize() {
        return getInt(BATCH_SIZE, 32);
    }

    /**
     * Returns the thread count used when neither threads nor processes were
     * configured. A value of 0 or less means one thread per available processor.
     */
    public static int getDefaultNumThreads() {
        int threads = getInt(NUM_THREADS, 0);
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    public static int getWorkerShutdownTimeoutSeconds() {
        return getInt(WORKER_SHUTDOWN_TIMEOUT, 10);
    }

    public static String getServerHost() {
        return getString(SERVER_HOST, "localhost");
    }

    public static int getServerPort() {
        return getInt(SERVER_PORT, 8765);
    }
}
