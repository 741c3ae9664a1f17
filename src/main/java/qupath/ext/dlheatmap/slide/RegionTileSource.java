package qupath.ext.dlheatmap.slide;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qupath.ext.dlheatmap.model.GridShape;
import qupath.ext.dlheatmap.model.HeatmapConfigurationException;
import qupath.ext.dlheatmap.model.PixelTile;
import qupath.ext.dlheatmap.model.SlideTile;
import qupath.ext.dlheatmap.service.TileSource;
import qupath.ext.dlheatmap.utilities.GridGeometryResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Tile source that reads grid cells from an {@link ImageRegionReader},
 * optionally restricted by region-of-interest polygons.
 * <p>
 * A cell counts as inside an ROI when its centre point is covered by the
 * union of all ROIs. Coordinates are full-resolution slide pixels.
 *
 * <h3>ROI methods</h3>
 * <ul>
 *   <li>{@link RoiMethod#INSIDE} and {@link RoiMethod#OUTSIDE} require at least one ROI</li>
 *   <li>{@link RoiMethod#AUTO} behaves like INSIDE when ROIs exist, otherwise tiles the whole slide</li>
 *   <li>{@link RoiMethod#IGNORE} tiles the whole slide</li>
 * </ul>
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public class RegionTileSource implements TileSource {

    private static final Logger logger = LoggerFactory.getLogger(RegionTileSource.class);

    private final ImageRegionReader reader;
    private final int tilePx;
    private final GridGeometryResolver grid;
    private final RoiMethod effectiveMethod;
    private final PreparedGeometry roiMask;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    /**
     * Creates a tile source covering the whole slide.
     */
    public RegionTileSource(ImageRegionReader reader, int tilePx, double tileUm, int strideDiv) {
        this(reader, tilePx, tileUm, strideDiv, List.of(), RoiMethod.IGNORE);
    }

    /**
     * Creates a tile source restricted by ROIs.
     *
     * @param reader    slide reader
     * @param tilePx    output tile size in pixels
     * @param tileUm    tile size in microns
     * @param strideDiv stride divisor
     * @param rois      ROI polygons in slide pixel coordinates, may be empty
     * @param roiMethod how the ROIs restrict tiling
     * @throws HeatmapConfigurationException if the method needs ROIs and none are given
     */
    public RegionTileSource(ImageRegionReader reader, int tilePx, double tileUm, int strideDiv,
                            List<Geometry> rois, RoiMethod roiMethod) {
        this.reader = reader;
        this.tilePx = tilePx;
        this.grid = new GridGeometryResolver(reader.getWidth(), reader.getHeight(),
                reader.getMicronsPerPixel(), tileUm, strideDiv);

        boolean hasRois = rois != null && !rois.isEmpty();
        if ((roiMethod == RoiMethod.INSIDE || roiMethod == RoiMethod.OUTSIDE) && !hasRois) {
            throw new HeatmapConfigurationException(String.format(
                    "ROI method %s requires at least one ROI for slide %s", roiMethod, reader.getName()));
        }
        if (roiMethod == RoiMethod.AUTO) {
            this.effectiveMethod = hasRois ? RoiMethod.INSIDE : RoiMethod.IGNORE;
        } else {
            this.effectiveMethod = roiMethod;
        }
        if (effectiveMethod == RoiMethod.IGNORE) {
            this.roiMask = null;
        } else {
            Geometry union = UnaryUnionOp.union(rois);
            this.roiMask = PreparedGeometryFactory.prepare(union);
        }
        logger.debug("Tile source for {}: grid {}, ROI method {} (effective {})",
                reader.getName(), grid.getGridShape(), roiMethod, effectiveMethod);
    }

    /**
     * Returns true if the cell is tiled under the configured ROI method.
     */
    public boolean isIncluded(GridGeometryResolver.TileSpec spec) {
        if (roiMask == null) {
            return true;
        }
        boolean inside = roiMask.covers(geometryFactory.createPoint(new Coordinate(spec.centerX(), spec.centerY())));
        return effectiveMethod == RoiMethod.INSIDE ? inside : !inside;
    }

    public RoiMethod getEffectiveRoiMethod() {
        return effectiveMethod;
    }

    @Override
    public String getName() {
        return reader.getName();
    }

    @Override
    public int getWidth() {
        return reader.getWidth();
    }

    @Override
    public int getHeight() {
        return reader.getHeight();
    }

    @Override
    public double getMicronsPerPixel() {
        return reader.getMicronsPerPixel();
    }

    @Override
    public GridShape getGridShape() {
        return grid.getGridShape();
    }

    @Override
    public Iterator<SlideTile> tiles(int stride) {
        if (stride != grid.getStride()) {
            throw new IllegalArgumentException(String.format(
                    "Requested stride %d but this source was built for stride %d", stride, grid.getStride()));
        }
        return new CellIterator();
    }

    /**
     * Row-major walk over included cells, reading each region on demand.
     */
    private final class CellIterator implements Iterator<SlideTile> {

        private final GridShape shape = grid.getGridShape();
        private int next = -1;

        private CellIterator() {
            advance();
        }

        private void advance() {
            next++;
            while (next < shape.cellCount()
                    && !isIncluded(grid.getTile(next / shape.cols(), next % shape.cols()))) {
                next++;
            }
        }

        @Override
        public boolean hasNext() {
            return next < shape.cellCount();
        }

        @Override
        public SlideTile next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            GridGeometryResolver.TileSpec spec = grid.getTile(next / shape.cols(), next % shape.cols());
            advance();
            try {
                PixelTile pixels = reader.readRegion(spec.x(), spec.y(), spec.size(), tilePx);
                return new SlideTile(spec.row(), spec.col(), pixels);
            } catch (IOException e) {
                throw new UncheckedIOException(String.format(
                        "Failed to read tile (%d, %d) of %s", spec.row(), spec.col(), reader.getName()), e);
            }
        }
    }
}
