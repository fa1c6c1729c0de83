package gov.nih.ncats.dugr.segmentation;

/**
 * How the partial area search ended.
 */
public enum SegmentationStatus {
    /**
     * The whole luminous area is uniform.
     */
    CONVERGED_SINGLE_AREA,
    /**
     * Every partial area is uniform or can not be split any further.
     */
    CONVERGED,
    /**
     * The partial area cap or the depth limit stopped the search while
     * a non-uniform area could still have been split.
     */
    ITERATION_LIMIT_REACHED,
    /**
     * The luminous area is not uniform but no admissible split exists.
     */
    SPLIT_NOT_POSSIBLE
}
