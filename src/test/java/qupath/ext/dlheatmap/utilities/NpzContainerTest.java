package qupath.ext.dlheatmap.utilities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import qupath.ext.dlheatmap.model.DenseHeatmapArray;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link NpzContainer}.
 */
class NpzContainerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("written arrays carry a NumPy float32 header")
    void write_npyHeader() throws IOException {
        Path file = tempDir.resolve("slide.npz");
        DenseHeatmapArray array = new DenseHeatmapArray(2, 3, 1, new float[]{0f, 1f, 2f, 3f, 4f, -1f});

        NpzContainer.write(file, Map.of("predictions", array));

        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(file))) {
            ZipEntry entry = zip.getNextEntry();
            assertEquals("predictions.npy", entry.getName());
            byte[] bytes = zip.readAllBytes();
            assertEquals((byte) 0x93, bytes[0]);
            assertEquals("NUMPY", new String(bytes, 1, 5, StandardCharsets.US_ASCII));
            int headerLength = (bytes[8] & 0xFF) | ((bytes[9] & 0xFF) << 8);
            String header = new String(bytes, 10, headerLength, StandardCharsets.US_ASCII);
            assertTrue(header.contains("'descr': '<f4'"), header);
            assertTrue(header.contains("'shape': (2, 3, 1)"), header);
            assertEquals(0, (10 + headerLength) % 64);
            assertEquals(10 + headerLength + 6 * 4, bytes.length);
        }
    }

    @Test
    @DisplayName("arrays read back with their shapes and values")
    void read_afterWrite() throws IOException {
        Path file = tempDir.resolve("nested/dir/slide.npz");
        Map<String, DenseHeatmapArray> arrays = new LinkedHashMap<>();
        arrays.put("predictions", new DenseHeatmapArray(1, 2, 2, new float[]{1f, 2f, 3f, 4f}));
        arrays.put("uncertainty", new DenseHeatmapArray(1, 2, 1, new float[]{0.5f, -1f}));

        NpzContainer.write(file, arrays);
        Map<String, DenseHeatmapArray> read = NpzContainer.read(file);

        assertEquals(arrays.keySet(), read.keySet());
        assertArrayEquals(new float[]{1f, 2f, 3f, 4f}, read.get("predictions").toArray());
        assertArrayEquals(new int[]{1, 2, 1}, read.get("uncertainty").shape());
    }

    @Test
    @DisplayName("big-endian float64 arrays are narrowed to float32")
    void read_bigEndianDouble() throws IOException {
        ByteBuffer data = ByteBuffer.allocate(3 * 8).order(ByteOrder.BIG_ENDIAN);
        data.putDouble(0.25).putDouble(-1.0).putDouble(7.5);
        Path file = writeRaw("logits", "{'descr': '>f8', 'fortran_order': False, 'shape': (1, 3, 1), }",
                data.array());

        DenseHeatmapArray array = NpzContainer.read(file).get("logits");

        assertArrayEquals(new float[]{0.25f, -1f, 7.5f}, array.toArray());
    }

    @Test
    @DisplayName("Fortran-ordered arrays are rejected")
    void read_fortranOrder_throws() throws IOException {
        Path file = writeRaw("predictions", "{'descr': '<f4', 'fortran_order': True, 'shape': (1, 1, 1), }",
                new byte[4]);

        ContainerFormatException e = assertThrows(ContainerFormatException.class, () -> NpzContainer.read(file));
        assertTrue(e.getMessage().contains("Fortran"));
    }

    @Test
    @DisplayName("arrays that are not three-dimensional are rejected")
    void read_twoDimensional_throws() throws IOException {
        Path file = writeRaw("predictions", "{'descr': '<f4', 'fortran_order': False, 'shape': (2, 2), }",
                new byte[16]);

        assertThrows(ContainerFormatException.class, () -> NpzContainer.read(file));
    }

    @Test
    @DisplayName("integer dtypes are rejected")
    void read_integerDtype_throws() throws IOException {
        Path file = writeRaw("predictions", "{'descr': '<i4', 'fortran_order': False, 'shape': (1, 1, 1), }",
                new byte[4]);

        assertThrows(ContainerFormatException.class, () -> NpzContainer.read(file));
    }

    @Test
    @DisplayName("truncated array data is a format error")
    void read_truncated_throws() throws IOException {
        Path file = writeRaw("predictions", "{'descr': '<f4', 'fortran_order': False, 'shape': (2, 2, 2), }",
                new byte[12]);

        assertThrows(ContainerFormatException.class, () -> NpzContainer.read(file));
    }

    @ParameterizedTest(name = "shape {0}")
    @ValueSource(strings = {"(-1, -1, 2)", "(2, 3, -4)"})
    @DisplayName("negative dimensions are a format error")
    void read_negativeDimension_throws(String shape) throws IOException {
        Path file = writeRaw("predictions", "{'descr': '<f4', 'fortran_order': False, 'shape': " + shape + ", }",
                new byte[0]);

        ContainerFormatException e = assertThrows(ContainerFormatException.class, () -> NpzContainer.read(file));
        assertTrue(e.getMessage().contains("negative dimension"), e.getMessage());
    }

    @Test
    @DisplayName("an oversized header length is a format error")
    void read_hugeHeaderLength_throws() throws IOException {
        ByteArrayOutputStream npy = new ByteArrayOutputStream();
        npy.write(new byte[]{(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 2, 0});
        // 0x7FFFFFF0 as a little-endian uint32, followed by no header at all
        npy.write(new byte[]{(byte) 0xF0, (byte) 0xFF, (byte) 0xFF, 0x7F});

        Path file = tempDir.resolve("huge-header.npz");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(file))) {
            zip.putNextEntry(new ZipEntry("predictions.npy"));
            zip.write(npy.toByteArray());
            zip.closeEntry();
        }

        ContainerFormatException e = assertThrows(ContainerFormatException.class, () -> NpzContainer.read(file));
        assertTrue(e.getMessage().contains("header"), e.getMessage());
    }

    @Test
    @DisplayName("files that are not zip archives are rejected")
    void read_garbage_throws() throws IOException {
        Path file = tempDir.resolve("garbage.npz");
        Files.writeString(file, "this is not a zip archive");

        assertThrows(ContainerFormatException.class, () -> NpzContainer.read(file));
    }

    private Path writeRaw(String key, String dict, byte[] data) throws IOException {
        ByteArrayOutputStream npy = new ByteArrayOutputStream();
        byte[] header = (dict + "\n").getBytes(StandardCharsets.US_ASCII);
        npy.write(new byte[]{(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 1, 0});
        npy.write(header.length & 0xFF);
        npy.write((header.length >>> 8) & 0xFF);
        npy.write(header);
        npy.write(data);

        Path file = tempDir.resolve(key + "-raw.npz");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(file))) {
            zip.putNextEntry(new ZipEntry(key + ".npy"));
            zip.write(npy.toByteArray());
            zip.closeEntry();
        }
        return file;
    }
}
