package qupath.ext.dlheatmap.service;

import qupath.ext.dlheatmap.model.PixelTile;
import qupath.ext.dlheatmap.model.SlideTile;

import java.util.ArrayList;
import java.util.List;

/**
 * A group of tiles dispatched to the inference backend in one call.
 *
 * @param index position of the batch in dispatch order
 * @param tiles tiles with their grid positions, never empty
 * @author UW-LOCI
 * @since 0.1.0
 */
public record TileBatch(int index, List<SlideTile> tiles) {

    public TileBatch {
        if (tiles == null || tiles.isEmpty()) {
            throw new IllegalArgumentException("A batch must contain at least one tile");
        }
        tiles = List.copyOf(tiles);
    }

    public int size() {
        return tiles.size();
    }

    /**
     * Returns the pixel data of each tile, in batch order.
     */
    public List<PixelTile> pixels() {
        List<PixelTile> pixels = new ArrayList<>(tiles.size());
        for (SlideTile tile : tiles) {
            pixels.add(tile.pixels());
        }
        return pixels;
    }
}
