package qupath.ext.dlheatmap.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.model.GridShape;
import qupath.ext.dlheatmap.model.HeatmapConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the tile grid covering a slide.
 * <p>
 * The tile extent at full resolution is {@code floor(tileUm / mpp)} pixels and
 * the grid advances by {@code floor(extent / strideDiv)} pixels. A tile is
 * placed at every stride step whose window still fits inside the slide, so the
 * last row and column never extend past the slide edge.
 *
 * <h3>Grid layout</h3>
 * <ul>
 *   <li>Rows run along y, columns along x</li>
 *   <li>Cell {@code (row, col)} has its top-left corner at {@code (col * stride, row * stride)}</li>
 *   <li>Tiles are enumerated row-major, which is the order used for batching</li>
 * </ul>
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class GridGeometryResolver {

    private static final Logger logger = LoggerFactory.getLogger(GridGeometryResolver.class);

    private final int slideWidth;
    private final int slideHeight;
    private final int extractPx;
    private final int stride;
    private final GridShape gridShape;

    /**
     * Creates a resolver for the given slide geometry.
     *
     * @param slideWidth  slide width in pixels at full resolution
     * @param slideHeight slide height in pixels at full resolution
     * @param mpp         slide resolution in microns per pixel
     * @param tileUm      tile size in microns
     * @param strideDiv   stride divisor, must be positive
     * @throws HeatmapConfigurationException if any parameter is invalid
     */
    public GridGeometryResolver(int slideWidth, int slideHeight, double mpp, double tileUm, int strideDiv) {
        if (strideDiv <= 0) {
            throw new HeatmapConfigurationException("Stride divisor must be positive, got " + strideDiv);
        }
        if (slideWidth < 0 || slideHeight < 0) {
            throw new HeatmapConfigurationException(String.format(
                    "Slide dimensions cannot be negative: %dx%d", slideWidth, slideHeight));
        }
        if (!(mpp > 0)) {
            throw new HeatmapConfigurationException("Slide microns-per-pixel must be positive, got " + mpp);
        }
        if (!(tileUm > 0)) {
            throw new HeatmapConfigurationException("Tile size in microns must be positive, got " + tileUm);
        }

        this.slideWidth = slideWidth;
        this.slideHeight = slideHeight;
        this.extractPx = (int) Math.floor(tileUm / mpp);
        if (extractPx < 1) {
            throw new HeatmapConfigurationException(String.format(
                    "Tile of %.3f um is smaller than one pixel at %.4f um/px", tileUm, mpp));
        }
        this.stride = extractPx / strideDiv;
        if (stride < 1) {
            throw new HeatmapConfigurationException(String.format(
                    "Stride divisor %d is too large for a tile of %d px", strideDiv, extractPx));
        }

        int cols = countSteps(slideWidth);
        int rows = countSteps(slideHeight);
        this.gridShape = new GridShape(rows, cols);

        logger.debug("Resolved grid {} for slide {}x{}: extract={}px, stride={}px",
                gridShape, slideWidth, slideHeight, extractPx, stride);
    }

    // Number of window positions 0, stride, 2*stride, ... below (extent + 1 - extractPx)
    private int countSteps(int extent) {
        int span = extent + 1 - extractPx;
        if (span <= 0) {
            return 0;
        }
        return (span + stride - 1) / stride;
    }

    /**
     * Checks this grid against the shape a tile source reports on its own.
     *
     * @param reported grid shape reported by the tile source
     * @throws HeatmapConfigurationException if the shapes differ
     */
    public void verifyAgainst(GridShape reported) {
        if (!gridShape.equals(reported)) {
            throw new HeatmapConfigurationException(String.format(
                    "Grid shape mismatch: resolved %s (extract=%dpx, stride=%dpx) but tile source reports %s",
                    gridShape, extractPx, stride, reported));
        }
    }

    /**
     * Returns the tile specification for a grid cell.
     *
     * @param row grid row
     * @param col grid column
     * @return tile specification
     * @throws IndexOutOfBoundsException if the cell is outside the grid
     */
    public TileSpec getTile(int row, int col) {
        if (!gridShape.contains(row, col)) {
            throw new IndexOutOfBoundsException(String.format(
                    "Cell (%d, %d) outside grid %s", row, col, gridShape));
        }
        return new TileSpec(row * gridShape.cols() + col, row, col, col * stride, row * stride, extractPx);
    }

    /**
     * Generates tile specifications for every grid cell in row-major order.
     *
     * @return list of tile specifications
     */
    public List<TileSpec> generateTiles() {
        List<TileSpec> tiles = new ArrayList<>(gridShape.cellCount());
        for (int row = 0; row < gridShape.rows(); row++) {
            for (int col = 0; col < gridShape.cols(); col++) {
                tiles.add(getTile(row, col));
            }
        }
        return tiles;
    }

    // ==================== Getters ====================

    public GridShape getGridShape() {
        return gridShape;
    }

    public int getExtractPx() {
        return extractPx;
    }

    public int getStride() {
        return stride;
    }

    public int getSlideWidth() {
        return slideWidth;
    }

    public int getSlideHeight() {
        return slideHeight;
    }

    /**
     * Tile specification for one grid cell.
     *
     * @param index row-major index of the cell
     * @param row   grid row
     * @param col   grid column
     * @param x     left edge in slide pixel coordinates
     * @param y     top edge in slide pixel coordinates
     * @param size  tile extent in slide pixels (square)
     */
    public record TileSpec(int index, int row, int col, int x, int y, int size) {

        /**
         * Returns the centre X coordinate.
         */
        public double centerX() {
            return x + size / 2.0;
        }

        /**
         * Returns the centre Y coordinate.
         */
        public double centerY() {
            return y + size / 2.0;
        }
    }
}
