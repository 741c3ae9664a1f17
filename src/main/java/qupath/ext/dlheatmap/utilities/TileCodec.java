package qupath.ext.dlheatmap.utilities;

import qupath.ext.dlheatmap.model.PixelTile;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts tiles to and from raw little-endian float32 bytes for binary
 * transfer to inference backends and worker processes.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class TileCodec {

    private TileCodec() {
        // Utility class - no instantiation
    }

    /**
     * Encodes one tile as little-endian float32 in HWC order.
     *
     * @param tile the tile
     * @return raw bytes ({@code H * W * C * 4})
     */
    public static byte[] encode(PixelTile tile) {
        ByteBuffer buf = ByteBuffer.allocate(tile.pixels().length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buf.asFloatBuffer().put(tile.pixels());
        return buf.array();
    }

    /**
     * Encodes a batch of equally-sized tiles as one concatenated blob.
     *
     * @param tiles tiles sharing width, height and channel count
     * @return concatenated raw bytes
     * @throws IllegalArgumentException if the tiles differ in size
     */
    public static byte[] encodeBatch(List<PixelTile> tiles) {
        if (tiles.isEmpty()) {
            return new byte[0];
        }
        PixelTile first = tiles.get(0);
        int tileFloats = first.pixels().length;
        ByteBuffer buf = ByteBuffer.allocate(tiles.size() * tileFloats * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (PixelTile tile : tiles) {
            if (tile.width() != first.width() || tile.height() != first.height()
                    || tile.channels() != first.channels()) {
                throw new IllegalArgumentException(String.format(
                        "Batch mixes tile sizes %dx%dx%d and %dx%dx%d",
                        first.width(), first.height(), first.channels(),
                        tile.width(), tile.height(), tile.channels()));
            }
            for (float v : tile.pixels()) {
                buf.putFloat(v);
            }
        }
        return buf.array();
    }

    /**
     * Decodes a concatenated blob back into tiles.
     *
     * @param bytes    raw bytes produced by {@link #encodeBatch(List)}
     * @param count    number of tiles
     * @param width    tile width
     * @param height   tile height
     * @param channels channel count
     * @return decoded tiles
     */
    public static List<PixelTile> decodeBatch(byte[] bytes, int count, int width, int height, int channels) {
        int tileFloats = width * height * channels;
        long expected = (long) count * tileFloats * Float.BYTES;
        if (bytes.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Tile blob size mismatch: expected %d bytes (%d tiles of %dx%dx%d) but got %d",
                    expected, count, width, height, channels, bytes.length));
        }
        var floats = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
        List<PixelTile> tiles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            float[] pixels = new float[tileFloats];
            floats.get(pixels);
            tiles.add(new PixelTile(width, height, channels, pixels));
        }
        return tiles;
    }

    /**
     * Converts an image into a float tile, one channel per raster band.
     *
     * @param image the image (any bit depth and band count)
     * @return tile with the raw sample values as floats
     */
    public static PixelTile fromImage(BufferedImage image) {
        Raster raster = image.getRaster();
        int w = raster.getWidth();
        int h = raster.getHeight();
        int c = raster.getNumBands();
        float[] pixels = new float[w * h * c];
        float[] row = new float[w * c];
        for (int y = 0; y < h; y++) {
            raster.getPixels(0, y, w, 1, row);
            System.arraycopy(row, 0, pixels, y * w * c, w * c);
        }
        return new PixelTile(w, h, c, pixels);
    }
}
