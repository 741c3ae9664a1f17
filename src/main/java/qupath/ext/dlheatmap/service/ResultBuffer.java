package qupath.ext.dlheatmap.service;

import qupath.ext.dlheatmap.model.ChannelLayout;
import qupath.ext.dlheatmap.model.GridShape;
import qupath.ext.dlheatmap.model.HeatmapArray;
import qupath.ext.dlheatmap.model.HeatmapConfigurationException;
import qupath.ext.dlheatmap.utilities.ChannelSplitter;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Grid-aligned store for per-tile inference vectors.
 * <p>
 * The buffer is allocated at full size before inference starts with every
 * value set to {@link HeatmapArray#SENTINEL}. Each cell is written at most
 * once. A cell becomes visible to readers only after its whole vector has
 * been copied in, so concurrent readers see either the sentinel vector or the
 * complete result for a cell, never a mix.
 *
 * <h3>Threading</h3>
 * <ul>
 *   <li>One writer thread commits cells (the generation controller)</li>
 *   <li>Any number of threads may read at any time, including during a run</li>
 *   <li>{@link #predictions()} and {@link #uncertainty()} are live views, not copies</li>
 * </ul>
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class ResultBuffer {

    private static final int EMPTY = 0;
    private static final int COMMITTED = 1;

    private final GridShape shape;
    private final ChannelLayout layout;
    private final ChannelSplitter splitter;
    private final int channels;
    private final float[] arena;
    private final AtomicIntegerArray cellState;
    private final AtomicInteger committedCount = new AtomicInteger();

    /**
     * Allocates a buffer filled with the sentinel value.
     *
     * @param shape  grid shape
     * @param layout channel layout of the backend vectors
     * @throws HeatmapConfigurationException if the buffer would be too large
     */
    public ResultBuffer(GridShape shape, ChannelLayout layout) {
        this.shape = shape;
        this.layout = layout;
        this.splitter = new ChannelSplitter(layout);
        this.channels = layout.totalChannels();
        long size = (long) shape.cellCount() * channels;
        if (size > Integer.MAX_VALUE - 8) {
            throw new HeatmapConfigurationException(String.format(
                    "Result buffer for grid %s with %d channels is too large (%d values)",
                    shape, channels, size));
        }
        this.arena = new float[(int) size];
        Arrays.fill(arena, HeatmapArray.SENTINEL);
        this.cellState = new AtomicIntegerArray(shape.cellCount());
    }

    /**
     * Writes the vector for one cell.
     *
     * @param row    grid row
     * @param col    grid column
     * @param vector full channel vector of length {@code C}
     * @throws IndexOutOfBoundsException if the cell is outside the grid
     * @throws IllegalArgumentException  if the vector length is not {@code C}
     * @throws IllegalStateException     if the cell was already written
     */
    public void commit(int row, int col, float[] vector) {
        int cell = cellIndex(row, col);
        if (vector.length != channels) {
            throw new IllegalArgumentException(String.format(
                    "Cell (%d, %d) expects %d channels but got %d", row, col, channels, vector.length));
        }
        if (cellState.get(cell) != EMPTY) {
            throw new IllegalStateException(String.format("Cell (%d, %d) was already written", row, col));
        }
        System.arraycopy(vector, 0, arena, cell * channels, channels);
        // volatile write publishes the copied values
        cellState.set(cell, COMMITTED);
        committedCount.incrementAndGet();
    }

    public boolean isCommitted(int row, int col) {
        return cellState.get(cellIndex(row, col)) == COMMITTED;
    }

    public int getCommittedCount() {
        return committedCount.get();
    }

    public GridShape getShape() {
        return shape;
    }

    public ChannelLayout getLayout() {
        return layout;
    }

    // ==================== Views ====================

    /**
     * Returns the full-vector view of shape {@code (rows, cols, C)}.
     */
    public HeatmapArray all() {
        return new SliceView(0, channels);
    }

    /**
     * Returns the predictions view: features and class scores, or the whole
     * vector when the backend has no uncertainty channels.
     */
    public HeatmapArray predictions() {
        return new SliceView(splitter.getPredictionOffset(), splitter.getPredictionCount());
    }

    /**
     * Returns the uncertainty view of the last {@code U} channels, or
     * {@code null} when the backend has no uncertainty channels.
     */
    public HeatmapArray uncertainty() {
        if (!layout.hasUncertainty()) {
            return null;
        }
        return new SliceView(splitter.getUncertaintyOffset(), splitter.getUncertaintyCount());
    }

    private int cellIndex(int row, int col) {
        if (!shape.contains(row, col)) {
            throw new IndexOutOfBoundsException(String.format("Cell (%d, %d) outside grid %s", row, col, shape));
        }
        return row * shape.cols() + col;
    }

    @Override
    public String toString() {
        return String.format("ResultBuffer{grid=%s, channels=%d, committed=%d}",
                shape, channels, committedCount.get());
    }

    /**
     * Channel range over the shared arena.
     */
    private final class SliceView implements HeatmapArray {

        private final int offset;
        private final int count;

        private SliceView(int offset, int count) {
            this.offset = offset;
            this.count = count;
        }

        @Override
        public int rows() {
            return shape.rows();
        }

        @Override
        public int cols() {
            return shape.cols();
        }

        @Override
        public int channels() {
            return count;
        }

        @Override
        public float get(int row, int col, int channel) {
            if (channel < 0 || channel >= count) {
                throw new IndexOutOfBoundsException("Channel " + channel + " outside 0.." + (count - 1));
            }
            int cell = cellIndex(row, col);
            if (cellState.get(cell) != COMMITTED) {
                return SENTINEL;
            }
            return arena[cell * channels + offset + channel];
        }

        @Override
        public float[] getCell(int row, int col) {
            int cell = cellIndex(row, col);
            float[] out = new float[count];
            if (cellState.get(cell) != COMMITTED) {
                Arrays.fill(out, SENTINEL);
            } else {
                System.arraycopy(arena, cell * channels + offset, out, 0, count);
            }
            return out;
        }

        @Override
        public float[] toArray() {
            float[] out = new float[shape.cellCount() * count];
            for (int r = 0; r < shape.rows(); r++) {
                for (int c = 0; c < shape.cols(); c++) {
                    // per-cell copy so a cell committed mid-read is never torn
                    System.arraycopy(getCell(r, c), 0, out, (r * shape.cols() + c) * count, count);
                }
            }
            return out;
        }

        @Override
        public String toString() {
            return String.format("HeatmapView{shape=(%d, %d, %d), offset=%d}", rows(), cols(), count, offset);
        }
    }
}
