package qupath.ext.dlheatmap.testing;

import qupath.ext.dlheatmap.model.PixelTile;
import qupath.ext.dlheatmap.service.InferenceInterface;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic backend: the vector for a tile holding {@code (row, col)} is
 * {@link #expected(int, int, int)}. Can be told to fail, block or misbehave.
 */
public class CellEchoInference implements InferenceInterface {

    private final int features;
    private final int classes;
    private final int uncertainty;
    private int tilePx;
    private double tileUm;

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger concurrent = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private final List<Integer> batchSizes = Collections.synchronizedList(new ArrayList<>());
    private volatile int failOnCall = -1;
    private volatile CountDownLatch gate;
    private volatile boolean dropLastResult;
    private volatile boolean truncateVectors;

    public CellEchoInference(int features, int classes, int uncertainty) {
        this.features = features;
        this.classes = classes;
        this.uncertainty = uncertainty;
    }

    /**
     * Vector produced for a cell: entry {@code i} is {@code row * 100 + col + i / 8}.
     */
    public static float[] expected(int row, int col, int channels) {
        float[] vector = new float[channels];
        for (int i = 0; i < channels; i++) {
            vector[i] = row * 100 + col + i / 8f;
        }
        return vector;
    }

    public CellEchoInference withTilePx(int tilePx) {
        this.tilePx = tilePx;
        return this;
    }

    public CellEchoInference withTileUm(double tileUm) {
        this.tileUm = tileUm;
        return this;
    }

    /**
     * Fails the given call (0-based) and every later one.
     */
    public CellEchoInference failFromCall(int call) {
        this.failOnCall = call;
        return this;
    }

    /**
     * Blocks every call until the latch opens.
     */
    public CellEchoInference blockOn(CountDownLatch latch) {
        this.gate = latch;
        return this;
    }

    public CellEchoInference dropLastResult() {
        this.dropLastResult = true;
        return this;
    }

    public CellEchoInference truncateVectors() {
        this.truncateVectors = true;
        return this;
    }

    public int getCallCount() {
        return calls.get();
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrent.get();
    }

    public List<Integer> getBatchSizes() {
        synchronized (batchSizes) {
            return new ArrayList<>(batchSizes);
        }
    }

    @Override
    public int getNumFeatures() {
        return features;
    }

    @Override
    public int getNumClasses() {
        return classes;
    }

    @Override
    public int getNumUncertainty() {
        return uncertainty;
    }

    @Override
    public int getTilePx() {
        return tilePx;
    }

    @Override
    public double getTileUm() {
        return tileUm;
    }

    @Override
    public float[][] predict(List<PixelTile> tiles) throws IOException {
        int call = calls.getAndIncrement();
        batchSizes.add(tiles.size());
        int now = concurrent.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        try {
            CountDownLatch latch = gate;
            if (latch != null) {
                latch.await();
            }
            if (failOnCall >= 0 && call >= failOnCall) {
                throw new IOException("Simulated backend failure on call " + call);
            }
            int channels = features + classes + uncertainty - (truncateVectors ? 1 : 0);
            int count = dropLastResult ? tiles.size() - 1 : tiles.size();
            float[][] out = new float[count][];
            for (int i = 0; i < count; i++) {
                PixelTile tile = tiles.get(i);
                out[i] = expected((int) tile.get(0, 0, 0), (int) tile.get(0, 0, 1), channels);
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted", e);
        } finally {
            concurrent.decrementAndGet();
        }
    }
}
