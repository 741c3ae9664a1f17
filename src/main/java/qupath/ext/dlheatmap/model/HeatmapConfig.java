package qupath.ext.dlheatmap.model;

import qupath.ext.dlheatmap.preferences.HeatmapPreferences;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration parameters for generating a heatmap over a whole slide.
 * <p>
 * Instances are immutable and created through {@link #builder()}. Validation
 * happens in {@link Builder#build()}, so an invalid combination (for example
 * both a thread count and a process count) fails before any inference work.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class HeatmapConfig {

    /**
     * Kind of worker pool used to run inference batches.
     */
    public enum WorkerPoolKind {
        /** Fixed thread pool sharing one inference instance */
        THREADS,
        /** Child JVM processes, each with its own inference instance */
        PROCESSES
    }

    // Tile geometry
    private final int tilePx;
    private final double tileUm;
    private final int strideDiv;

    // Execution
    private final int batchSize;
    private final Integer numThreads;
    private final Integer numProcesses;
    private final int workerShutdownTimeoutSeconds;

    // Backend lookup (required for process pools)
    private final String backendType;
    private final Map<String, String> backendOptions;

    private HeatmapConfig(Builder builder) {
        this.tilePx = builder.tilePx;
        this.tileUm = builder.tileUm;
        this.strideDiv = builder.strideDiv;
        this.batchSize = builder.batchSize;
        this.numThreads = builder.numThreads;
        this.numProcesses = builder.numProcesses;
        this.workerShutdownTimeoutSeconds = builder.workerShutdownTimeoutSeconds;
        this.backendType = builder.backendType;
        this.backendOptions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.backendOptions));
    }

    // Getters

    public int getTilePx() {
        return tilePx;
    }

    public double getTileUm() {
        return tileUm;
    }

    public int getStrideDiv() {
        return strideDiv;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Integer getNumThreads() {
        return numThreads;
    }

    public Integer getNumProcesses() {
        return numProcesses;
    }

    public int getWorkerShutdownTimeoutSeconds() {
        return workerShutdownTimeoutSeconds;
    }

    public String getBackendType() {
        return backendType;
    }

    public Map<String, String> getBackendOptions() {
        return backendOptions;
    }

    /**
     * Returns which pool kind this configuration selects. A process count
     * selects processes; anything else runs on threads.
     */
    public WorkerPoolKind getPoolKind() {
        return numProcesses != null ? WorkerPoolKind.PROCESSES : WorkerPoolKind.THREADS;
    }

    /**
     * Returns the number of workers for the selected pool kind.
     * <p>
     * When neither count was supplied the preference default is used.
     */
    public int getWorkerCount() {
        if (numProcesses != null) {
            return numProcesses;
        }
        if (numThreads != null) {
            return numThreads;
        }
        return HeatmapPreferences.getDefaultNumThreads();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HeatmapConfig that = (HeatmapConfig) o;
        return tilePx == that.tilePx &&
                Double.compare(that.tileUm, tileUm) == 0 &&
                strideDiv == that.strideDiv &&
                batchSize == that.batchSize &&
                workerShutdownTimeoutSeconds == that.workerShutdownTimeoutSeconds &&
                Objects.equals(numThreads, that.numThreads) &&
                Objects.equals(numProcesses, that.numProcesses) &&
                Objects.equals(backendType, that.backendType) &&
                backendOptions.equals(that.backendOptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tilePx, tileUm, strideDiv, batchSize, numThreads, numProcesses,
                workerShutdownTimeoutSeconds, backendType, backendOptions);
    }

    @Override
    public String toString() {
        return String.format("HeatmapConfig{tile=%dpx/%.1fum, strideDiv=%d, batch=%d, pool=%s x%s, backend=%s}",
                tilePx, tileUm, strideDiv, batchSize, getPoolKind(),
                numProcesses != null ? numProcesses : numThreads, backendType);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for HeatmapConfig.
     */
    public static class Builder {
        private int tilePx = HeatmapPreferences.getTilePx();
        private double tileUm = HeatmapPreferences.getTileUm();
        private int strideDiv = HeatmapPreferences.getStrideDiv();
        private int batchSize = HeatmapPreferences.getBatchSize();
        private Integer numThreads;
        private Integer numProcesses;
        private int workerShutdownTimeoutSeconds = HeatmapPreferences.getWorkerShutdownTimeoutSeconds();
        private String backendType;
        private final Map<String, String> backendOptions = new LinkedHashMap<>();

        public Builder tilePx(int tilePx) {
            this.tilePx = tilePx;
            return this;
        }

        /**
         * Sets the physical tile width in microns. Together with the slide
         * resolution this determines how many level-0 pixels each tile covers.
         *
         * @param tileUm tile size in microns
         * @return this builder
         */
        public Builder tileUm(double tileUm) {
            this.tileUm = tileUm;
            return this;
        }

        /**
         * Sets the stride divisor. A divisor of 2 moves the tile window by half
         * a tile, so neighbouring tiles overlap by 50%.
         *
         * @param strideDiv stride divisor, must be positive
         * @return this builder
         */
        public Builder strideDiv(int strideDiv) {
            this.strideDiv = strideDiv;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Runs inference on a thread pool of the given size.
         * Cannot be combined with {@link #numProcesses(Integer)}.
         */
        public Builder numThreads(Integer numThreads) {
            this.numThreads = numThreads;
            return this;
        }

        /**
         * Runs inference on the given number of child processes.
         * Cannot be combined with {@link #numThreads(Integer)}.
         */
        public Builder numProcesses(Integer numProcesses) {
            this.numProcesses = numProcesses;
            return this;
        }

        public Builder workerShutdownTimeoutSeconds(int seconds) {
            this.workerShutdownTimeoutSeconds = seconds;
            return this;
        }

        /**
         * Sets the registered backend type used to create inference instances.
         *
         * @param backendType backend type identifier (case-insensitive)
         * @return this builder
         */
        public Builder backendType(String backendType) {
            this.backendType = backendType;
            return this;
        }

        public Builder backendOption(String key, String value) {
            this.backendOptions.put(key, value);
            return this;
        }

        public Builder backendOptions(Map<String, String> options) {
            this.backendOptions.putAll(options);
            return this;
        }

        public HeatmapConfig build() {
            if (numThreads != null && numProcesses != null) {
                throw new HeatmapConfigurationException(
                        "Invalid argument: cannot supply both numProcesses and numThreads");
            }
            if (strideDiv <= 0) {
                throw new HeatmapConfigurationException("Stride divisor must be positive, got " + strideDiv);
            }
            if (tilePx < 1) {
                throw new HeatmapConfigurationException("Tile size must be at least 1 pixel, got " + tilePx);
            }
            if (!(tileUm > 0)) {
                throw new HeatmapConfigurationException("Tile size in microns must be positive, got " + tileUm);
            }
            if (batchSize < 1) {
                throw new HeatmapConfigurationException("Batch size must be at least 1, got " + batchSize);
            }
            if (numThreads != null && numThreads < 1) {
                throw new HeatmapConfigurationException("Thread count must be at least 1, got " + numThreads);
            }
            if (numProcesses != null && numProcesses < 1) {
                throw new HeatmapConfigurationException("Process count must be at least 1, got " + numProcesses);
            }
            if (workerShutdownTimeoutSeconds < 0) {
                throw new HeatmapConfigurationException("Worker shutdown timeout cannot be negative");
            }
            return new HeatmapConfig(this);
        }
    }
}
