package qupath.ext.dlheatmap.model;

/**
 * Shape of the tile grid covering a slide.
 *
 * @param rows number of tile rows (y direction)
 * @param cols number of tile columns (x direction)
 * @author UW-LOCI
 * @since 0.1.0
 */
public record GridShape(int rows, int cols) {

    public GridShape {
        if (rows < 0 || cols < 0) {
            throw new HeatmapConfigurationException("Grid dimensions cannot be negative: " + rows + "x" + cols);
        }
        if (Math.multiplyExact((long) rows, cols) > Integer.MAX_VALUE) {
            throw new HeatmapConfigurationException(String.format(
                    "Grid %dx%d has more than %d cells", rows, cols, Integer.MAX_VALUE));
        }
    }

    /**
     * Returns {@code rows * cols}, which always fits in an int.
     */
    public int cellCount() {
        return rows * cols;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    @Override
    public String toString() {
        return rows + "x" + cols;
    }
}
