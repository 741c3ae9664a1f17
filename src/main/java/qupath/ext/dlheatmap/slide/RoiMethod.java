package qupath.ext.dlheatmap.slide;

/**
 * How regions of interest restrict which grid cells are tiled.
 *
 * @author UW-LOCI
 * @since 0.1.0
 */
public enum RoiMethod {
    /** Only cells whose centre lies inside an ROI; ROIs are required */
    INSIDE,
    /** Only cells whose centre lies outside every ROI; ROIs are required */
    OUTSIDE,
    /** {@link #INSIDE} when ROIs are present, otherwise the whole slide */
    AUTO,
    /** Every cell, regardless of ROIs */
    IGNORE;

    /**
     * Parses a method name case-insensitively.
     *
     * @param value method name such as "inside" or "auto"
     * @return the method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RoiMethod fromString(String value) {
        for (RoiMethod method : values()) {
            if (method.name().equalsIgnoreCase(value.trim())) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown ROI method: " + value);
    }
}
