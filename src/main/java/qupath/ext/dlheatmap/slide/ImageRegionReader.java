package qupath.ext.dlheatmap.slide;

import qupath.ext.dlheatmap.model.PixelTile;

import java.io.IOException;

/**
 * Reads square regions of a slide and resamples them to the model's tile size.
 * Decoding the slide file is left to implementations.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public interface ImageRegionReader {

    String getName();

    /**
     * Returns the slide width in pixels at full resolution.
     */
    int getWidth();

    /**
     * Returns the slide height in pixels at full resolution.
     */
    int getHeight();

    double getMicronsPerPixel();

    /**
     * Reads a square region and resamples it.
     *
     * @param x          left edge in full-resolution pixels
     * @param y          top edge in full-resolution pixels
     * @param size       region extent in full-resolution pixels
     * @param outputSize width and height of the returned tile
     * @return the resampled region
     * @throws IOException if the region cannot be read
     */
    PixelTile readRegion(int x, int y, int size, int outputSize) throws IOException;
}
