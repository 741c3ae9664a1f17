package qupath.ext.dlheatmap.service;

import qupath.ext.dlheatmap.model.GridShape;
import qupath.ext.dlheatmap.model.SlideTile;

import java.util.Iterator;

/**
 * Source of tiles for a whole slide image.
 * <p>
 * A tile source reports the slide geometry and its own grid shape, and
 * enumerates extracted tiles in a stable order (row-major for the built-in
 * sources). Cells excluded from inference, such as background or tiles
 * outside a region of interest, are omitted from the enumeration.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public interface TileSource {

    /**
     * Returns a short name for the slide, used for logging and default file names.
     */
    String getName();

    /**
     * Returns the slide width in pixels at full resolution.
     */
    int getWidth();

    /**
     * Returns the slide height in pixels at full resolution.
     */
    int getHeight();

    /**
     * Returns the slide resolution in microns per pixel.
     */
    double getMicronsPerPixel();

    /**
     * Returns the grid shape as computed by the source itself.
     */
    GridShape getGridShape();

    /**
     * Enumerates the included tiles.
     * <p>
     * Tiles are extracted lazily as the iterator advances. A failure to read a
     * tile surfaces as an {@link java.io.UncheckedIOException} from
     * {@link Iterator#next()}.
     *
     * @param stride grid stride in full-resolution pixels
     * @return iterator over included tiles in a stable order
     */
    Iterator<SlideTile> tiles(int stride);
}
