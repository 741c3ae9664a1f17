package qupath.ext.dlheatmap.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import qupath.ext.dlheatmap.model.PixelTile;
import qupath.ext.dlheatmap.testing.CellEchoInference;
import qupath.ext.dlheatmap.testing.CellEchoProvider;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the worker side of the process protocol, driven in-process over
 * byte streams.
 */
class TileWorkerProcessTest {

    private static final String PROVIDER = CellEchoProvider.class.getName();

    @Test
    @DisplayName("worker reports its layout and answers batches until shutdown")
    void serve_batchesThenShutdown() throws IOException {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        DataOutputStream parent = new DataOutputStream(input);
        writeInit(parent, PROVIDER, "{\"features\":\"1\",\"classes\":\"2\",\"uncertainty\":\"1\"}");
        WorkerProtocol.writeBatch(parent, List.of(tile(3, 4), tile(5, 6)));
        parent.writeInt(WorkerProtocol.SHUTDOWN);

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        int exit = TileWorkerProcess.serve(streamOf(input), new DataOutputStream(output));

        assertEquals(0, exit);
        DataInputStream reply = streamOf(output);
        assertEquals(WorkerProtocol.MAGIC, reply.readInt());
        assertEquals(WorkerProtocol.STATUS_OK, reply.readInt());
        assertEquals(1, reply.readInt());
        assertEquals(2, reply.readInt());
        assertEquals(1, reply.readInt());
        assertEquals(0, reply.readInt());

        assertEquals(WorkerProtocol.STATUS_OK, reply.readInt());
        float[][] vectors = WorkerProtocol.readVectors(reply);
        assertEquals(2, vectors.length);
        assertArrayEquals(CellEchoInference.expected(3, 4, 4), vectors[0]);
        assertArrayEquals(CellEchoInference.expected(5, 6, 4), vectors[1]);
        assertEquals(0, reply.available());
    }

    @Test
    @DisplayName("backend failures become error replies and the worker keeps serving")
    void serve_backendFailure_errorReply() throws IOException {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        DataOutputStream parent = new DataOutputStream(input);
        writeInit(parent, PROVIDER, "{\"fail\":\"true\"}");
        WorkerProtocol.writeBatch(parent, List.of(tile(0, 0)));
        WorkerProtocol.writeBatch(parent, List.of(tile(0, 1)));
        parent.writeInt(WorkerProtocol.SHUTDOWN);

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        int exit = TileWorkerProcess.serve(streamOf(input), new DataOutputStream(output));

        assertEquals(0, exit);
        DataInputStream reply = streamOf(output);
        skipHandshake(reply);
        for (int i = 0; i < 2; i++) {
            assertEquals(WorkerProtocol.STATUS_ERROR, reply.readInt());
            assertTrue(WorkerProtocol.readString(reply).contains("Simulated backend failure"));
        }
    }

    @Test
    @DisplayName("an unknown provider class gives an error handshake")
    void serve_unknownProvider_errorHandshake() throws IOException {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        writeInit(new DataOutputStream(input), "com.example.NoSuchProvider", "{}");

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        int exit = TileWorkerProcess.serve(streamOf(input), new DataOutputStream(output));

        assertEquals(1, exit);
        DataInputStream reply = streamOf(output);
        assertEquals(WorkerProtocol.MAGIC, reply.readInt());
        assertEquals(WorkerProtocol.STATUS_ERROR, reply.readInt());
        assertTrue(WorkerProtocol.readString(reply).contains("com.example.NoSuchProvider"));
    }

    @Test
    @DisplayName("a closed input without shutdown ends the worker cleanly")
    void serve_inputClosed_exitsCleanly() throws IOException {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        writeInit(new DataOutputStream(input), PROVIDER, "{}");

        int exit = TileWorkerProcess.serve(streamOf(input), new DataOutputStream(new ByteArrayOutputStream()));

        assertEquals(0, exit);
    }

    @Test
    @DisplayName("a missing init frame is a protocol error")
    void serve_badMagic_throws() throws IOException {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        new DataOutputStream(input).writeInt(42);

        assertThrows(IOException.class, () ->
                TileWorkerProcess.serve(streamOf(input), new DataOutputStream(new ByteArrayOutputStream())));
    }

    private static void writeInit(DataOutputStream out, String providerClass, String options) throws IOException {
        out.writeInt(WorkerProtocol.MAGIC);
        WorkerProtocol.writeString(out, providerClass);
        WorkerProtocol.writeString(out, options);
    }

    private static void skipHandshake(DataInputStream in) throws IOException {
        assertEquals(WorkerProtocol.MAGIC, in.readInt());
        assertEquals(WorkerProtocol.STATUS_OK, in.readInt());
        for (int i = 0; i < 4; i++) {
            in.readInt();
        }
    }

    private static PixelTile tile(int row, int col) {
        return new PixelTile(1, 1, 2, new float[]{row, col});
    }

    private static DataInputStream streamOf(ByteArrayOutputStream bytes) {
        return new DataInputStream(new ByteArrayInputStream(bytes.toByteArray()));
    }
}
