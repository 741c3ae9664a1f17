package qupath.ext.dlheatmap.utilities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import qupath.ext.dlheatmap.model.PixelTile;

import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TileCodec}.
 */
class TileCodecTest {

    @Test
    @DisplayName("tiles are encoded as little-endian float32 in HWC order")
    void encode_littleEndian() {
        PixelTile tile = new PixelTile(2, 1, 1, new float[]{1.5f, -2f});

        byte[] bytes = TileCodec.encode(tile);

        assertEquals(8, bytes.length);
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(1.5f, buf.getFloat());
        assertEquals(-2f, buf.getFloat());
    }

    @Test
    @DisplayName("a decoded batch restores tile order and pixels")
    void decodeBatch_restoresTiles() {
        PixelTile a = new PixelTile(1, 1, 2, new float[]{1f, 2f});
        PixelTile b = new PixelTile(1, 1, 2, new float[]{3f, 4f});

        List<PixelTile> decoded = TileCodec.decodeBatch(TileCodec.encodeBatch(List.of(a, b)), 2, 1, 1, 2);

        assertEquals(2, decoded.size());
        assertArrayEquals(a.pixels(), decoded.get(0).pixels());
        assertArrayEquals(b.pixels(), decoded.get(1).pixels());
    }

    @Test
    @DisplayName("mixed tile sizes and short blobs are rejected")
    void invalidBatches_throw() {
        PixelTile small = new PixelTile(1, 1, 1, new float[]{1f});
        PixelTile large = new PixelTile(2, 1, 1, new float[]{1f, 2f});

        assertThrows(IllegalArgumentException.class, () -> TileCodec.encodeBatch(List.of(small, large)));
        assertThrows(IllegalArgumentException.class, () -> TileCodec.decodeBatch(new byte[7], 2, 1, 1, 1));
        assertEquals(0, TileCodec.encodeBatch(List.of()).length);
    }

    @Test
    @DisplayName("image bands become tile channels")
    void fromImage_rgb() {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        image.setRGB(1, 0, 0x102030);

        PixelTile tile = TileCodec.fromImage(image);

        assertEquals(2, tile.width());
        assertEquals(2, tile.height());
        assertEquals(3, tile.channels());
        assertEquals(0x10, tile.get(1, 0, 0));
        assertEquals(0x20, tile.get(1, 0, 1));
        assertEquals(0x30, tile.get(1, 0, 2));
        assertEquals(0f, tile.get(0, 1, 0));
    }
}
