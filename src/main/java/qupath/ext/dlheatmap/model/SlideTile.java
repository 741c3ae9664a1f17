package qupath.ext.dlheatmap.model;

import java.util.Objects;

/**
 * A tile produced by a tile source, addressed by its grid cell.
 *
 * @param row    grid row
 * @param col    grid column
 * @param pixels extracted pixel data
 * @author UW-LOCI
 * @since 0.1.0
 */
public record SlideTile(int row, int col, PixelTile pixels) {

    public SlideTile {
        Objects.requireNonNull(pixels, "Tile pixels are required");
    }
}
