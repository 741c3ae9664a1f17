package qupath.ext.dlheatmap.utilities;

import qupath.ext.dlheatmap.model.ChannelLayout;

import java.util.Arrays;
import java.util.Objects;

/**
 * Separates prediction channels from uncertainty channels.
 * <p>
 * The split is positional: the trailing {@code numUncertainty} entries of a
 * vector are uncertainty, everything before them is prediction (features
 * followed by class scores). Backends are responsible for that ordering.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public final class ChannelSplitter {

    private static final float[] EMPTY = new float[0];

    private final ChannelLayout layout;

    public ChannelSplitter(ChannelLayout layout) {
        this.layout = Objects.requireNonNull(layout, "Channel layout is required");
    }

    /**
     * Splits a full backend vector, checking it against the layout.
     *
     * @param vector vector of length {@link ChannelLayout#totalChannels()}
     * @return prediction and uncertainty parts
     * @throws IllegalArgumentException if the vector has the wrong length
     */
    public Split split(float[] vector) {
        Objects.requireNonNull(vector, "Vector is required");
        if (vector.length != layout.totalChannels()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d channels for %s but got %d",
                    layout.totalChannels(), layout, vector.length));
        }
        return split(vector, layout.numUncertainty());
    }

    /**
     * Splits a vector by position alone.
     *
     * @param vector         raw vector
     * @param numUncertainty number of trailing uncertainty channels
     * @return prediction and uncertainty parts; uncertainty is empty when {@code numUncertainty == 0}
     */
    public static Split split(float[] vector, int numUncertainty) {
        if (numUncertainty < 0 || numUncertainty > vector.length) {
            throw new IllegalArgumentException(String.format(
                    "Cannot take %d uncertainty channels from a vector of length %d",
                    numUncertainty, vector.length));
        }
        int boundary = vector.length - numUncertainty;
        float[] predictions = Arrays.copyOfRange(vector, 0, boundary);
        float[] uncertainty = numUncertainty == 0 ? EMPTY : Arrays.copyOfRange(vector, boundary, vector.length);
        return new Split(predictions, uncertainty);
    }

    // Channel ranges used by result views

    public int getPredictionOffset() {
        return 0;
    }

    public int getPredictionCount() {
        return layout.predictionChannels();
    }

    public int getUncertaintyOffset() {
        return layout.predictionChannels();
    }

    public int getUncertaintyCount() {
        return layout.numUncertainty();
    }

    public ChannelLayout getLayout() {
        return layout;
    }

    /**
     * Result of splitting one vector.
     *
     * @param predictions feature and class channels
     * @param uncertainty uncertainty channels, empty when the backend has none
     */
    public record Split(float[] predictions, float[] uncertainty) {

        public boolean hasUncertainty() {
            return uncertainty.length > 0;
        }
    }
}
