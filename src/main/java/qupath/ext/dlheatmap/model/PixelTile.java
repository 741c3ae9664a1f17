package qupath.ext.dlheatmap.model;

/**
 * Pixel data for one extracted tile, stored as interleaved float values in
 * HWC order ({@code pixels[(y * width + x) * channels + c]}).
 *
 * @param width    tile width in pixels
 * @param height   tile height in pixels
 * @param channels number of channels per pixel
 * @param pixels   pixel values, length {@code width * height * channels}
 * @author UW-LOCI
 * @since 0.1.0
 */
public record PixelTile(int width, int height, int channels, float[] pixels) {

    public PixelTile {
        if (width < 1 || height < 1 || channels < 1) {
            throw new IllegalArgumentException(String.format(
                    "Invalid tile dimensions %dx%dx%d", width, height, channels));
        }
        if (pixels == null || pixels.length != width * height * channels) {
            throw new IllegalArgumentException(String.format(
                    "Tile %dx%dx%d expects %d values but got %s",
                    width, height, channels, width * height * channels,
                    pixels == null ? "null" : String.valueOf(pixels.length)));
        }
    }

    public float get(int x, int y, int c) {
        return pixels[(y * width + x) * channels + c];
    }

    /**
     * Returns the mean over all pixels and channels.
     */
    public double mean() {
        double sum = 0;
        for (float v : pixels) {
            sum += v;
        }
        return sum / pixels.length;
    }
}
