package qupath.ext.dlheatmap.slide;

import qupath.ext.dlheatmap.model.PixelTile;
import qupath.ext.dlheatmap.utilities.TileCodec;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Region reader over an image held in memory, for thumbnails, small slides
 * and tests. Regions are resampled with nearest-neighbour interpolation.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class BufferedImageRegionReader implements ImageRegionReader {

    private final String name;
    private final PixelTile image;
    private final double micronsPerPixel;

    /**
     * @param name            slide name
     * @param image           full-resolution image
     * @param micronsPerPixel image resolution
     */
    public BufferedImageRegionReader(String name, BufferedImage image, double micronsPerPixel) {
        this(name, TileCodec.fromImage(image), micronsPerPixel);
    }

    /**
     * @param name            slide name
     * @param image           full-resolution pixels
     * @param micronsPerPixel image resolution
     */
    public BufferedImageRegionReader(String name, PixelTile image, double micronsPerPixel) {
        this.name = Objects.requireNonNull(name, "Slide name is required");
        this.image = Objects.requireNonNull(image, "Image is required");
        this.micronsPerPixel = micronsPerPixel;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getWidth() {
        return image.width();
    }

    @Override
    public int getHeight() {
        return image.height();
    }

    @Override
    public double getMicronsPerPixel() {
        return micronsPerPixel;
    }

    @Override
    public PixelTile readRegion(int x, int y, int size, int outputSize) {
        if (x < 0 || y < 0 || x + size > image.width() || y + size > image.height()) {
            throw new IndexOutOfBoundsException(String.format(
                    "Region (%d, %d, %d) outside image %dx%d", x, y, size, image.width(), image.height()));
        }
        int channels = image.channels();
        float[] src = image.pixels();
        float[] out = new float[outputSize * outputSize * channels];
        double scale = (double) size / outputSize;
        for (int oy = 0; oy < outputSize; oy++) {
            int sy = y + Math.min(size - 1, (int) (oy * scale));
            for (int ox = 0; ox < outputSize; ox++) {
                int sx = x + Math.min(size - 1, (int) (ox * scale));
                System.arraycopy(src, (sy * image.width() + sx) * channels,
                        out, (oy * outputSize + ox) * channels, channels);
            }
        }
        return new PixelTile(outputSize, outputSize, channels, out);
    }
}
