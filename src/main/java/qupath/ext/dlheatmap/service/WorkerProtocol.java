package qupath.ext.dlheatmap.service;

import qupath.ext.dlheatmap.model.PixelTile;
import qupath.ext.dlheatmap.utilities.TileCodec;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Binary frames exchanged between {@link ProcessTileWorkerPool} and
 * {@link TileWorkerProcess} over the child's stdin and stdout.
 *
 * <h3>Frames</h3>
 * <ul>
 *   <li>Init (parent to child): magic, provider class, options JSON</li>
 *   <li>Handshake (child to parent): magic, status, then features, classes,
 *       uncertainty and tile size, or an error message</li>
 *   <li>Batch (parent to child): tile count (0 means shut down), width, height,
 *       channels, byte length, little-endian float32 tile blob</li>
 *   <li>Reply (child to parent): status, then vector count and each vector
 *       as length plus floats, or an error message</li>
 * </ul>
 * Integers and floats outside the tile blob use {@link DataOutputStream}
 * (big-endian) encoding. Strings are a byte length followed by UTF-8.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
final class WorkerProtocol {

    static final int MAGIC = 0x484D5750;
    static final int STATUS_OK = 0;
    static final int STATUS_ERROR = 1;
    static final int SHUTDOWN = 0;

    private static final int MAX_STRING_BYTES = 1 << 20;

    private WorkerProtocol() {
        // Utility class - no instantiation
    }

    static void writeString(DataOutputStream out, String value) throws IOException {
        byte[] bytes = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    static String readString(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > MAX_STRING_BYTES) {
            throw new IOException("Invalid string length in worker frame: " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static void writeBatch(DataOutputStream out, List<PixelTile> tiles) throws IOException {
        PixelTile first = tiles.get(0);
        byte[] blob = TileCodec.encodeBatch(tiles);
        out.writeInt(tiles.size());
        out.writeInt(first.width());
        out.writeInt(first.height());
        out.writeInt(first.channels());
        out.writeInt(blob.length);
        out.write(blob);
    }

    /**
     * Reads the rest of a batch frame once its tile count has been read.
     */
    static List<PixelTile> readBatch(DataInputStream in, int count) throws IOException {
        int width = in.readInt();
        int height = in.readInt();
        int channels = in.readInt();
        int length = in.readInt();
        if (length < 0) {
            throw new IOException("Invalid tile blob length: " + length);
        }
        byte[] blob = new byte[length];
        in.readFully(blob);
        try {
            return TileCodec.decodeBatch(blob, count, width, height, channels);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed batch frame: " + e.getMessage(), e);
        }
    }

    static void writeVectors(DataOutputStream out, float[][] vectors) throws IOException {
        out.writeInt(STATUS_OK);
        out.writeInt(vectors.length);
        for (float[] vector : vectors) {
            out.writeInt(vector.length);
            for (float v : vector) {
                out.writeFloat(v);
            }
        }
    }

    /**
     * Reads a vector reply once its status has been read as OK.
     */
    static float[][] readVectors(DataInputStream in) throws IOException {
        int count = in.readInt();
        if (count < 0) {
            throw new IOException("Invalid vector count: " + count);
        }
        float[][] vectors = new float[count][];
        for (int i = 0; i < count; i++) {
            int length = in.readInt();
            if (length < 0) {
                throw new IOException("Invalid vector length: " + length);
            }
            float[] vector = new float[length];
            for (int j = 0; j < length; j++) {
                vector[j] = in.readFloat();
            }
            vectors[i] = vector;
        }
        return vectors;
    }

    static void writeError(DataOutputStream out, String message) throws IOException {
        out.writeInt(STATUS_ERROR);
        writeString(out, message);
    }
}
