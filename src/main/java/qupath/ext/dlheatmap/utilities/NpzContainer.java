package qupath.ext.dlheatmap.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.model.DenseHeatmapArray;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Reads and writes named three-dimensional float arrays in NumPy's
 * {@code .npz} format (a zip archive of {@code .npy} files).
 * <p>
 * Arrays are written as little-endian float32 in C order with a version 1.0
 * header. Reading accepts version 1.0 to 3.0 headers, either byte order, and
 * float64 data (narrowed to float32).
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class NpzContainer {

    private static final Logger logger = LoggerFactory.getLogger(NpzContainer.class);

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final String NPY_SUFFIX = ".npy";
    private static final int HEADER_ALIGNMENT = 64;
    private static final int CHUNK_VALUES = 16384;
    private static final int MAX_HEADER_LENGTH = 64 * 1024;

    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']*)'");
    private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

    private NpzContainer() {
        // Utility class - no instantiation
    }

    // ==================== Writing ====================

    /**
     * Writes arrays to an {@code .npz} file, replacing any existing file.
     *
     * @param path   destination file
     * @param arrays arrays keyed by name, written in iteration order
     * @throws IOException if writing fails
     */
    public static void write(Path path, Map<String, DenseHeatmapArray> arrays) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
            for (Map.Entry<String, DenseHeatmapArray> entry : arrays.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey() + NPY_SUFFIX));
                writeNpy(zip, entry.getValue());
                zip.closeEntry();
            }
        }
        logger.debug("Wrote {} array(s) {} to {}", arrays.size(), arrays.keySet(), path);
    }

    private static void writeNpy(OutputStream out, DenseHeatmapArray array) throws IOException {
        String dict = String.format("{'descr': '<f4', 'fortran_order': False, 'shape': (%d, %d, %d), }",
                array.rows(), array.cols(), array.channels());
        // magic + version + uint16 length, then the dict padded so data starts aligned
        int preamble = MAGIC.length + 2 + 2;
        int unpadded = preamble + dict.length() + 1;
        int padding = (HEADER_ALIGNMENT - unpadded % HEADER_ALIGNMENT) % HEADER_ALIGNMENT;
        byte[] header = (dict + " ".repeat(padding) + "\n").getBytes(StandardCharsets.US_ASCII);

        out.write(MAGIC);
        out.write(1);
        out.write(0);
        out.write(header.length & 0xFF);
        out.write((header.length >>> 8) & 0xFF);
        out.write(header);

        float[] data = array.toArray();
        ByteBuffer buf = ByteBuffer.allocate(CHUNK_VALUES * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int start = 0; start < data.length; start += CHUNK_VALUES) {
            int end = Math.min(start + CHUNK_VALUES, data.length);
            buf.clear();
            for (int i = start; i < end; i++) {
                buf.putFloat(data[i]);
            }
            out.write(buf.array(), 0, buf.position());
        }
    }

    // ==================== Reading ====================

    /**
     * Reads every array from an {@code .npz} file.
     *
     * @param path source file
     * @return arrays keyed by name (without the {@code .npy} suffix), in archive order
     * @throws ContainerFormatException if the file is not a valid container
     * @throws IOException              if reading fails
     */
    public static Map<String, DenseHeatmapArray> read(Path path) throws IOException {
        Map<String, DenseHeatmapArray> arrays = new LinkedHashMap<>();
        int entries = 0;
        try (ZipInputStream zip = new ZipInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries++;
                String name = entry.getName();
                if (entry.isDirectory() || !name.endsWith(NPY_SUFFIX)) {
                    logger.debug("Skipping non-array entry {} in {}", name, path);
                    continue;
                }
                String key = name.substring(0, name.length() - NPY_SUFFIX.length());
                arrays.put(key, readNpy(new DataInputStream(zip), key));
            }
        } catch (ZipException e) {
            throw new ContainerFormatException("Not a valid .npz container: " + path, e);
        } catch (EOFException e) {
            throw new ContainerFormatException("Truncated .npz container: " + path, e);
        }
        if (entries == 0) {
            throw new ContainerFormatException("Not a valid .npz container (no entries): " + path);
        }
        logger.debug("Read {} array(s) {} from {}", arrays.size(), arrays.keySet(), path);
        return arrays;
    }

    private static DenseHeatmapArray readNpy(DataInputStream in, String key) throws IOException {
        byte[] magic = new byte[MAGIC.length];
        in.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new ContainerFormatException("Array '" + key + "' is missing the NPY magic string");
        }
        int major = in.readUnsignedByte();
        in.readUnsignedByte(); // minor version
        int headerLength;
        if (major == 1) {
            headerLength = readLittleEndian(in, 2);
        } else if (major == 2 || major == 3) {
            headerLength = readLittleEndian(in, 4);
        } else {
            throw new ContainerFormatException("Unsupported NPY version " + major + " for array '" + key + "'");
        }
        if (headerLength > MAX_HEADER_LENGTH) {
            throw new ContainerFormatException(String.format(
                    "Array '%s' header is %d bytes, more than the %d allowed", key, headerLength, MAX_HEADER_LENGTH));
        }
        byte[] headerBytes = new byte[headerLength];
        in.readFully(headerBytes);
        String header = new String(headerBytes, major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

        String descr = match(DESCR, header, "descr", key);
        if ("True".equals(match(FORTRAN, header, "fortran_order", key))) {
            throw new ContainerFormatException("Fortran-ordered array '" + key + "' is not supported");
        }
        int[] shape = parseShape(match(SHAPE, header, "shape", key), key);
        if (shape.length != 3) {
            throw new ContainerFormatException(String.format(
                    "Array '%s' must have 3 dimensions (rows, cols, channels) but has %d", key, shape.length));
        }

        ByteOrder order = switch (descr.charAt(0)) {
            case '>' -> ByteOrder.BIG_ENDIAN;
            case '<', '|', '=' -> ByteOrder.LITTLE_ENDIAN;
            default -> throw new ContainerFormatException("Unrecognized dtype '" + descr + "' for array '" + key + "'");
        };
        String kind = descr.substring(1);
        int itemSize;
        if ("f4".equals(kind)) {
            itemSize = 4;
        } else if ("f8".equals(kind)) {
            itemSize = 8;
        } else {
            throw new ContainerFormatException("Unsupported dtype '" + descr + "' for array '" + key + "'");
        }

        long count;
        try {
            count = Math.multiplyExact(Math.multiplyExact((long) shape[0], shape[1]), shape[2]);
        } catch (ArithmeticException e) {
            count = Long.MAX_VALUE;
        }
        if (count > Integer.MAX_VALUE - 8) {
            throw new ContainerFormatException("Array '" + key + "' is too large: " + count + " values");
        }
        float[] data = new float[(int) count];
        byte[] chunk = new byte[CHUNK_VALUES * itemSize];
        int read = 0;
        while (read < data.length) {
            int n = Math.min(CHUNK_VALUES, data.length - read);
            in.readFully(chunk, 0, n * itemSize);
            ByteBuffer buf = ByteBuffer.wrap(chunk, 0, n * itemSize).order(order);
            for (int i = 0; i < n; i++) {
                data[read + i] = itemSize == 4 ? buf.getFloat() : (float) buf.getDouble();
            }
            read += n;
        }
        return new DenseHeatmapArray(shape[0], shape[1], shape[2], data);
    }

    private static int readLittleEndian(InputStream in, int bytes) throws IOException {
        int value = 0;
        for (int i = 0; i < bytes; i++) {
            int b = in.read();
            if (b < 0) {
                throw new EOFException("Unexpected end of NPY header");
            }
            value |= b << (8 * i);
        }
        if (value < 0) {
            throw new ContainerFormatException("NPY header length out of range");
        }
        return value;
    }

    private static String match(Pattern pattern, String header, String field, String key)
            throws ContainerFormatException {
        Matcher m = pattern.matcher(header);
        if (!m.find()) {
            throw new ContainerFormatException("Array '" + key + "' header has no '" + field + "': " + header.trim());
        }
        return m.group(1);
    }

    private static int[] parseShape(String shape, String key) throws ContainerFormatException {
        int[] dims;
        try {
            dims = Arrays.stream(shape.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .mapToInt(s -> Integer.parseInt(s.endsWith("L") ? s.substring(0, s.length() - 1) : s))
                    .toArray();
        } catch (NumberFormatException e) {
            throw new ContainerFormatException("Array '" + key + "' has invalid shape (" + shape + ")", e);
        }
        for (int dim : dims) {
            if (dim < 0) {
                throw new ContainerFormatException(
                        "Array '" + key + "' has a negative dimension in shape (" + shape + ")");
            }
        }
        return dims;
    }
}
