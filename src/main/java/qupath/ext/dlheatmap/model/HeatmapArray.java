package qupath.ext.dlheatmap.model;

/**
 * Read-only three-dimensional array of shape {@code (rows, cols, channels)}
 * aligned to the tile grid.
 * <p>
 * Cells that were never computed (or were excluded from inference) hold
 * {@link #SENTINEL} in every channel.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public interface HeatmapArray {

    /** Value stored in cells that hold no result */
    float SENTINEL = -1f;

    int rows();

    int cols();

    int channels();

    /**
     * Returns one value.
     *
     * @param row     grid row
     * @param col     grid column
     * @param channel channel index
     * @return value at that position
     */
    float get(int row, int col, int channel);

    /**
     * Returns a copy of one cell's channel vector.
     */
    default float[] getCell(int row, int col) {
        float[] cell = new float[channels()];
        for (int c = 0; c < cell.length; c++) {
            cell[c] = get(row, col, c);
        }
        return cell;
    }

    /**
     * Returns true if every channel of the cell holds the sentinel value.
     */
    default boolean isSentinel(int row, int col) {
        for (int c = 0; c < channels(); c++) {
            if (get(row, col, c) != SENTINEL) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copies the array into a new row-major ({@code C}-order) float array.
     */
    default float[] toArray() {
        int channels = channels();
        float[] out = new float[rows() * cols() * channels];
        int i = 0;
        for (int r = 0; r < rows(); r++) {
            for (int c = 0; c < cols(); c++) {
                for (int ch = 0; ch < channels; ch++) {
                    out[i++] = get(r, c, ch);
                }
            }
        }
        return out;
    }

    default int[] shape() {
        return new int[]{rows(), cols(), channels()};
    }
}
