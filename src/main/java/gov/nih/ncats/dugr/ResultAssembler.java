package gov.nih.ncats.dugr;

import gov.nih.ncats.dugr.segmentation.Segmentation;
import gov.nih.ncats.dugr.segmentation.SegmentationStatus;

/**
 * Packages the outcome of the pipeline stages into a {@link GlareResult}.
 */
public class ResultAssembler {

    public GlareResult assemble(double glareIndex, Segmentation segmentation,
                                GlareDiagnostics diagnostics, GlareContext context){
        return new GlareResult(glareIndex, segmentation.getPartialAreas(),
                statusOf(segmentation), segmentation.getStatus(),
                segmentation.getTree(), diagnostics, context);
    }

    static GlareStatus statusOf(Segmentation segmentation){
        if(segmentation.getPartialAreas().size() == 1){
            return GlareStatus.SINGLE_AREA;
        }
        if(segmentation.getStatus() == SegmentationStatus.ITERATION_LIMIT_REACHED){
            return GlareStatus.ITERATION_LIMIT_REACHED;
        }
        return GlareStatus.CONVERGED;
    }
}
