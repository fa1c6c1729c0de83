package gov.nih.ncats.dugr.segmentation;

import java.util.List;

/**
 * Decomposition of a luminous area into partial areas.
 */
public interface Segmentation {
    /**
     * The partial areas ordered by descending mean luminance,
     * ties by descending solid angle, then by raster position.
     */
    List<PartialArea> getPartialAreas ();

    PartitionTree getTree ();

    SegmentationStatus getStatus ();

    /**
     * Number of split threshold searches that were run.
     */
    int getSearchCount ();
}
