package gov.nih.ncats.dugr;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceField;
import gov.nih.ncats.dugr.segmentation.PartialArea;
import gov.nih.ncats.dugr.segmentation.PartitionTree;
import gov.nih.ncats.dugr.segmentation.Segmentation;
import gov.nih.ncats.dugr.segmentation.SegmentationStatus;

public class ResultAssemblerTest {

    private static Segmentation segmentation(int areaCount, SegmentationStatus status){
        LuminanceField field = new LuminanceField(areaCount, 1, new double[areaCount], 1E-3);
        List<PartialArea> areas = new ArrayList<>();
        for(int i=0;i<areaCount;i++){
            Bitmap bm = new Bitmap(areaCount, 1);
            bm.set(i, 0, true);
            areas.add(new PartialArea("A" + (i+1), bm, field.stats(bm), 1E-6));
        }
        return new Segmentation() {
            @Override
            public List<PartialArea> getPartialAreas() {
                return areas;
            }

            @Override
            public PartitionTree getTree() {
                return null;
            }

            @Override
            public SegmentationStatus getStatus() {
                return status;
            }

            @Override
            public int getSearchCount() {
                return 0;
            }
        };
    }

    @Test
    public void singleAreaWinsOverLimit(){
        assertEquals(GlareStatus.SINGLE_AREA,
                ResultAssembler.statusOf(segmentation(1, SegmentationStatus.ITERATION_LIMIT_REACHED)));
        assertEquals(GlareStatus.SINGLE_AREA,
                ResultAssembler.statusOf(segmentation(1, SegmentationStatus.SPLIT_NOT_POSSIBLE)));
    }

    @Test
    public void limitIsReported(){
        assertEquals(GlareStatus.ITERATION_LIMIT_REACHED,
                ResultAssembler.statusOf(segmentation(3, SegmentationStatus.ITERATION_LIMIT_REACHED)));
    }

    @Test
    public void converged(){
        assertEquals(GlareStatus.CONVERGED,
                ResultAssembler.statusOf(segmentation(2, SegmentationStatus.CONVERGED)));
    }
}
