package qupath.ext.dlheatmap.model;

/**
 * Progress snapshot reported after each committed batch.
 *
 * @param committedTiles   number of cells written so far
 * @param completedBatches number of batches whose results were committed
 * @param totalCells       number of cells in the grid (upper bound on tiles)
 * @param elapsedMillis    time since the run started
 * @author UW-LOCI
 * @since 0.1.0
 */
public record GenerationProgress(int committedTiles, int completedBatches, int totalCells, long elapsedMillis) {

    /**
     * Returns the fraction of grid cells written. Excluded cells are never
     * written, so this may stay below 1.0 for a finished run.
     */
    public double getFractionOfGrid() {
        return totalCells == 0 ? 1.0 : (double) committedTiles / totalCells;
    }
}
