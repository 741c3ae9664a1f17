package qupath.ext.dlheatmap.slide;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import qupath.ext.dlheatmap.controller.Heatmap;
import qupath.ext.dlheatmap.model.GridShape;
import qupath.ext.dlheatmap.model.HeatmapArray;
import qupath.ext.dlheatmap.model.HeatmapConfig;
import qupath.ext.dlheatmap.model.HeatmapConfigurationException;
import qupath.ext.dlheatmap.model.PixelTile;
import qupath.ext.dlheatmap.model.SlideTile;
import qupath.ext.dlheatmap.service.InferenceInterface;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RegionTileSource} and {@link BufferedImageRegionReader}.
 * <p>
 * The test slide is 400x200 px at 1 um/px with pixel value {@code x + 1000 * y}.
 * With 100 um tiles and a stride divisor of 2 the grid is 3x7 and cell
 * centres sit at {@code (50 + 50 * col, 50 + 50 * row)}.
 */
class RegionTileSourceTest {

    private static final GeometryFactory GEOMETRY = new GeometryFactory();

    private BufferedImageRegionReader reader;
    private List<Geometry> leftHalf;

    @BeforeEach
    void setUp() {
        float[] pixels = new float[400 * 200];
        for (int y = 0; y < 200; y++) {
            for (int x = 0; x < 400; x++) {
                pixels[y * 400 + x] = x + 1000f * y;
            }
        }
        reader = new BufferedImageRegionReader("synthetic", new PixelTile(400, 200, 1, pixels), 1.0);
        leftHalf = List.of(GEOMETRY.toGeometry(new Envelope(0, 200, 0, 200)));
    }

    private static List<SlideTile> drain(Iterator<SlideTile> it) {
        List<SlideTile> tiles = new ArrayList<>();
        it.forEachRemaining(tiles::add);
        return tiles;
    }

    @Test
    @DisplayName("every cell is tiled without ROIs")
    void ignore_tilesEveryCell() {
        RegionTileSource source = new RegionTileSource(reader, 10, 100, 2);

        List<SlideTile> tiles = drain(source.tiles(50));

        assertEquals(new GridShape(3, 7), source.getGridShape());
        assertEquals(21, tiles.size());
        assertEquals(0, tiles.get(0).row());
        assertEquals(1, tiles.get(1).col());
        assertEquals(RoiMethod.IGNORE, source.getEffectiveRoiMethod());
    }

    @Test
    @DisplayName("regions are resampled to the model tile size")
    void tiles_resampled() {
        RegionTileSource source = new RegionTileSource(reader, 10, 100, 2);

        SlideTile cell = drain(source.tiles(50)).get(7 + 2);

        assertEquals(1, cell.row());
        assertEquals(2, cell.col());
        PixelTile pixels = cell.pixels();
        assertEquals(10, pixels.width());
        assertEquals(10, pixels.height());
        // top-left of the region is (100, 50); each output pixel spans 10 source pixels
        assertEquals(100 + 1000f * 50, pixels.get(0, 0, 0));
        assertEquals(130 + 1000f * 70, pixels.get(3, 2, 0));
    }

    @ParameterizedTest(name = "{0} tiles {1} cells")
    @CsvSource({"INSIDE, 12", "OUTSIDE, 9", "AUTO, 12", "IGNORE, 21"})
    @DisplayName("ROI methods select cells by their centre")
    void roiMethods_selectCells(RoiMethod method, int expected) {
        RegionTileSource source = new RegionTileSource(reader, 10, 100, 2, leftHalf, method);

        List<SlideTile> tiles = drain(source.tiles(50));

        assertEquals(expected, tiles.size());
        for (SlideTile tile : tiles) {
            // centre x of column 3 lies on the ROI edge and counts as inside
            boolean inside = tile.col() <= 3;
            if (method == RoiMethod.INSIDE || method == RoiMethod.AUTO) {
                assertTrue(inside, "cell " + tile.row() + "," + tile.col());
            } else if (method == RoiMethod.OUTSIDE) {
                assertFalse(inside, "cell " + tile.row() + "," + tile.col());
            }
        }
    }

    @Test
    @DisplayName("overlapping ROIs are merged")
    void overlappingRois_union() {
        List<Geometry> rois = List.of(
                GEOMETRY.toGeometry(new Envelope(0, 120, 0, 200)),
                GEOMETRY.toGeometry(new Envelope(80, 200, 0, 200)));

        RegionTileSource source = new RegionTileSource(reader, 10, 100, 2, rois, RoiMethod.INSIDE);

        assertEquals(12, drain(source.tiles(50)).size());
    }

    @Test
    @DisplayName("AUTO without ROIs covers the whole slide")
    void auto_withoutRois_ignores() {
        RegionTileSource source = new RegionTileSource(reader, 10, 100, 2, List.of(), RoiMethod.AUTO);

        assertEquals(RoiMethod.IGNORE, source.getEffectiveRoiMethod());
        assertEquals(21, drain(source.tiles(50)).size());
    }

    @Test
    @DisplayName("INSIDE and OUTSIDE need at least one ROI")
    void insideWithoutRois_throws() {
        assertThrows(HeatmapConfigurationException.class,
                () -> new RegionTileSource(reader, 10, 100, 2, List.of(), RoiMethod.INSIDE));
        assertThrows(HeatmapConfigurationException.class,
                () -> new RegionTileSource(reader, 10, 100, 2, null, RoiMethod.OUTSIDE));
    }

    @Test
    @DisplayName("a stride other than the grid's is rejected")
    void tiles_wrongStride_throws() {
        RegionTileSource source = new RegionTileSource(reader, 10, 100, 2);

        assertThrows(IllegalArgumentException.class, () -> source.tiles(100));
    }

    @Test
    @DisplayName("read failures surface while iterating")
    void readFailure_unchecked() {
        ImageRegionReader failing = new ImageRegionReader() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public int getWidth() {
                return 200;
            }

            @Override
            public int getHeight() {
                return 200;
            }

            @Override
            public double getMicronsPerPixel() {
                return 1.0;
            }

            @Override
            public PixelTile readRegion(int x, int y, int size, int outputSize) throws IOException {
                throw new IOException("disk gone");
            }
        };
        Iterator<SlideTile> tiles = new RegionTileSource(failing, 10, 100, 2).tiles(50);

        UncheckedIOException e = assertThrows(UncheckedIOException.class, tiles::next);
        assertEquals("disk gone", e.getCause().getMessage());
    }

    @Test
    @DisplayName("method names parse case-insensitively")
    void roiMethod_fromString() {
        assertEquals(RoiMethod.OUTSIDE, RoiMethod.fromString(" outside "));
        assertThrows(IllegalArgumentException.class, () -> RoiMethod.fromString("around"));
    }

    @Test
    @DisplayName("a heatmap over ROI-restricted tiles leaves excluded cells at the sentinel")
    void heatmap_overRoiSource() throws IOException {
        RegionTileSource source = new RegionTileSource(reader, 10, 100, 2, leftHalf, RoiMethod.INSIDE);
        HeatmapConfig config = HeatmapConfig.builder()
                .tilePx(10)
                .tileUm(100)
                .strideDiv(2)
                .batchSize(5)
                .numThreads(2)
                .build();

        try (Heatmap heatmap = Heatmap.builder()
                .tileSource(source)
                .inference(new MeanInference())
                .config(config)
                .build()) {
            heatmap.generate();
            HeatmapArray predictions = heatmap.getPredictions();

            for (int row = 0; row < 3; row++) {
                for (int col = 0; col < 7; col++) {
                    if (col <= 3) {
                        // 10x10 samples at x0 + 10i, y0 + 10j
                        float expected = (col * 50 + 45) + 1000f * (row * 50 + 45);
                        assertEquals(expected, predictions.get(row, col, 0), 1e-2f);
                    } else {
                        assertTrue(predictions.isSentinel(row, col));
                    }
                }
            }
        }
    }

    /**
     * One-class backend that reports the mean pixel value of each tile.
     */
    private static final class MeanInference implements InferenceInterface {

        @Override
        public int getNumFeatures() {
            return 0;
        }

        @Override
        public int getNumClasses() {
            return 1;
        }

        @Override
        public int getNumUncertainty() {
            return 0;
        }

        @Override
        public int getTilePx() {
            return 10;
        }

        @Override
        public float[][] predict(List<PixelTile> tiles) {
            float[][] out = new float[tiles.size()][];
            for (int i = 0; i < tiles.size(); i++) {
                out[i] = new float[]{(float) tiles.get(i).mean()};
            }
            return out;
        }
    }
}
