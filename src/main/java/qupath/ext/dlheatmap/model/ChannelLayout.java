package qupath.ext.dlheatmap.model;

/**
 * Channel layout of the vectors produced by an inference backend.
 * <p>
 * Each per-tile vector is ordered features first, then class scores, then
 * uncertainty channels. The layout is fixed for the lifetime of a backend.
 *
 * @param numFeatures    number of feature channels
 * @param numClasses     number of class-score channels
 * @param numUncertainty number of trailing uncertainty channels (0 if unsupported)
 * @author UW-LOCI
 * @since 0.1.0
 */
public record ChannelLayout(int numFeatures, int numClasses, int numUncertainty) {

    public ChannelLayout {
        if (numFeatures < 0 || numClasses < 0 || numUncertainty < 0) {
            throw new HeatmapConfigurationException(String.format(
                    "Channel counts cannot be negative (features=%d, classes=%d, uncertainty=%d)",
                    numFeatures, numClasses, numUncertainty));
        }
        if (numFeatures + numClasses + numUncertainty == 0) {
            throw new HeatmapConfigurationException("Backend declares no output channels");
        }
    }

    /**
     * Returns the full vector length {@code C}.
     */
    public int totalChannels() {
        return numFeatures + numClasses + numUncertainty;
    }

    /**
     * Returns the number of leading prediction channels (features and classes).
     */
    public int predictionChannels() {
        return numFeatures + numClasses;
    }

    public boolean hasUncertainty() {
        return numUncertainty > 0;
    }

    @Override
    public String toString() {
        return String.format("ChannelLayout{features=%d, classes=%d, uncertainty=%d}",
                numFeatures, numClasses, numUncertainty);
    }
}
