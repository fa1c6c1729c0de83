package gov.nih.ncats.dugr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import gov.nih.ncats.dugr.segmentation.PartialArea;
import gov.nih.ncats.dugr.segmentation.PartitionTree;
import gov.nih.ncats.dugr.segmentation.SegmentationStatus;

/**
 * Outcome of one glare evaluation.  Immutable.
 */
public final class GlareResult {

    private final double glareIndex;
    private final List<PartialArea> partialAreas;
    private final GlareStatus status;
    private final SegmentationStatus segmentationStatus;
    private final PartitionTree tree;
    private final GlareDiagnostics diagnostics;
    private final GlareContext context;

    GlareResult(double glareIndex, List<PartialArea> partialAreas, GlareStatus status,
                SegmentationStatus segmentationStatus, PartitionTree tree,
                GlareDiagnostics diagnostics, GlareContext context){
        this.glareIndex = glareIndex;
        this.partialAreas = Collections.unmodifiableList(new ArrayList<>(partialAreas));
        this.status = status;
        this.segmentationStatus = segmentationStatus;
        this.tree = tree;
        this.diagnostics = diagnostics;
        this.context = context;
    }

    /**
     * The DUGR value.
     */
    public double getGlareIndex() {
        return glareIndex;
    }

    /**
     * The partial areas ordered by descending mean luminance.
     */
    public List<PartialArea> getPartialAreas() {
        return partialAreas;
    }

    public GlareStatus getStatus() {
        return status;
    }

    public SegmentationStatus getSegmentationStatus() {
        return segmentationStatus;
    }

    public PartitionTree getPartitionTree() {
        return tree;
    }

    public GlareDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public GlareContext getContext() {
        return context;
    }

    /**
     * Plain text report of this result.
     */
    public String getReport(){
        return getReport(null);
    }

    /**
     * Plain text report of this result with the given properties listed first.
     * @param properties a mapping of properties to include in the report. If null, then no properties are included.
     */
    public String getReport(Map<String,String> properties){
        StringBuilder sb = new StringBuilder();
        if(properties != null){
            for(Map.Entry<String,String> e : properties.entrySet()){
                sb.append(e.getKey()).append(": ").append(e.getValue()).append('\n');
            }
        }
        sb.append(fmt("DUGR: %.2f%n", glareIndex));
        sb.append("status: ").append(status)
          .append(" (segmentation ").append(segmentationStatus).append(")\n");
        sb.append(fmt("viewing distance: %.3f m%n", context.getViewingDistance()));
        sb.append(fmt("background luminance: %.3f cd/m2%n", context.getBackgroundLuminance()));
        sb.append(fmt("position index: %.4f%n", context.getPositionIndex()));
        sb.append(fmt("threshold: %.3f cd/m2%n", diagnostics.getThreshold()));
        sb.append(fmt("blur sigma: %.4f px%n", diagnostics.getBlurSigma()));
        sb.append(fmt("luminous area: %d px, %.6e sr, %d component(s)%n",
                diagnostics.getLuminousPixelCount(), diagnostics.getLuminousSolidAngle(),
                diagnostics.getComponentCount()));
        sb.append(fmt("effective luminance: %.3f cd/m2 (max %.3f cd/m2)%n",
                diagnostics.getEffectiveLuminance(), diagnostics.getMaxLuminance()));
        sb.append(fmt("UGR of whole area: %.2f%n", diagnostics.getWholeAreaRating()));
        diagnostics.getLuminaireRating().ifPresent(r -> sb.append(fmt("UGR of luminaire: %.2f%n", r)));
        diagnostics.getCorrectionFactor().ifPresent(k -> sb.append(fmt("k^2: %.4f%n", k)));
        sb.append("partial areas: ").append(partialAreas.size()).append('\n');
        sb.append(fmt("%-4s %10s %14s %14s %14s %14s%n",
                "name", "pixels", "mean cd/m2", "max cd/m2", "stdev cd/m2", "solid angle sr"));
        for(PartialArea a : partialAreas){
            sb.append(fmt("%-4s %10d %14.3f %14.3f %14.3f %14.6e%n",
                    a.getName(), a.getPixelCount(), a.getMeanLuminance(), a.getMaxLuminance(),
                    a.getStdev(), a.getSolidAngle()));
        }
        return sb.toString();
    }

    private static String fmt(String format, Object... args){
        return String.format(Locale.ROOT, format, args);
    }

    @Override
    public String toString() {
        return "GlareResult{" +
                "glareIndex=" + glareIndex +
                ", areas=" + partialAreas.size() +
                ", status=" + status +
                ", segmentationStatus=" + segmentationStatus +
                '}';
    }
}
