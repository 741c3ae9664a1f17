package qupath.ext.dlheatmap.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Heatmap array backed by its own row-major float array, used for loaded
 * and saved results.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class DenseHeatmapArray implements HeatmapArray {

    private final int rows;
    private final int cols;
    private final int channels;
    private final float[] data;

    /**
     * Wraps existing data without copying.
     *
     * @param rows     number of rows
     * @param cols     number of columns
     * @param channels number of channels
     * @param data     values in row-major order, length {@code rows * cols * channels}
     */
    public DenseHeatmapArray(int rows, int cols, int channels, float[] data) {
        Objects.requireNonNull(data, "Array data is required");
        if (rows < 0 || cols < 0 || channels < 0) {
            throw new IllegalArgumentException(String.format(
                    "Invalid array shape (%d, %d, %d)", rows, cols, channels));
        }
        if ((long) rows * cols * channels != data.length) {
            throw new IllegalArgumentException(String.format(
                    "Shape (%d, %d, %d) needs %d values but got %d",
                    rows, cols, channels, (long) rows * cols * channels, data.length));
        }
        this.rows = rows;
        this.cols = cols;
        this.channels = channels;
        this.data = data;
    }

    /**
     * Copies any heatmap array into a dense array.
     */
    public static DenseHeatmapArray copyOf(HeatmapArray array) {
        if (array instanceof DenseHeatmapArray dense) {
            return new DenseHeatmapArray(dense.rows, dense.cols, dense.channels, dense.data.clone());
        }
        return new DenseHeatmapArray(array.rows(), array.cols(), array.channels(), array.toArray());
    }

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int cols() {
        return cols;
    }

    @Override
    public int channels() {
        return channels;
    }

    @Override
    public float get(int row, int col, int channel) {
        return data[(row * cols + col) * channels + channel];
    }

    @Override
    public float[] toArray() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DenseHeatmapArray that = (DenseHeatmapArray) o;
        return rows == that.rows &&
                cols == that.cols &&
                channels == that.channels &&
                Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, cols, channels, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return String.format("DenseHeatmapArray{shape=(%d, %d, %d)}", rows, cols, channels);
    }
}
