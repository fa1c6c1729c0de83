package gov.nih.ncats.dugr;

/**
 * Overall status of a glare evaluation.
 */
public enum GlareStatus {
    /**
     * Several partial areas, all of them uniform or not further divisible.
     */
    CONVERGED,
    /**
     * The partial area cap or the depth limit stopped the refinement;
     * the index is computed from the best partition found.
     */
    ITERATION_LIMIT_REACHED,
    /**
     * One partial area; the index is the classical single source rating.
     * Takes precedence over {@link #ITERATION_LIMIT_REACHED}: a non-uniform area
     * held back by a cap of one partial area or a depth limit of 0 is reported
     * here too. {@link GlareResult#getSegmentationStatus()} tells the cases apart
     * ({@code CONVERGED_SINGLE_AREA}, {@code SPLIT_NOT_POSSIBLE} or
     * {@code ITERATION_LIMIT_REACHED}).
     */
    SINGLE_AREA
}
