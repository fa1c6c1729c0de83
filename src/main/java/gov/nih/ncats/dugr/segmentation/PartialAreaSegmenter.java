package gov.nih.ncats.dugr.segmentation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.dugr.DugrOptions;
import gov.nih.ncats.dugr.algo.UnionFind;
import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceField;
import gov.nih.ncats.dugr.image.LuminanceStats;
import gov.nih.ncats.dugr.image.LuminousAreaMask;
import gov.nih.ncats.dugr.util.RunningStats;

/**
 * Decomposes a luminous area into approximately uniform partial areas.
 * <p>
 * Disjoint components start as separate areas. Non-uniform areas are then
 * split best-first at the luminance threshold that minimizes the within-class
 * variance, until every area is uniform or the area cap or the depth limit
 * is reached. Each connected piece of a split becomes its own area, so an area
 * only spans several regions when components had to be merged to stay within
 * the area cap.
 */
public class PartialAreaSegmenter {
    private static final Logger logger =
        Logger.getLogger (PartialAreaSegmenter.class.getName ());

    static final boolean DEBUG;
    static {
        boolean debug = false;
        try {
            debug = Boolean.getBoolean("dugr.debug");
        } catch (SecurityException e) {
            logger.log(Level.FINE, "can't read debug property", e);
        }
        DEBUG = debug;
    }

    private static final Comparator<PartialArea> AREA_ORDER =
            Comparator.comparingDouble(PartialArea::getMeanLuminance).reversed()
                .thenComparing(Comparator.comparingDouble(PartialArea::getSolidAngle).reversed())
                .thenComparingInt(PartialArea::getFirstPixelIndex);

    private final double uniformityTolerance;
    private final int maxPartialAreas;
    private final int minPixels;
    private final int maxDepth;
    private final int maxSearchIterations;

    public PartialAreaSegmenter(){
        this(DugrOptions.defaults());
    }

    public PartialAreaSegmenter(DugrOptions options){
        this.uniformityTolerance = options.getUniformityTolerance();
        this.maxPartialAreas = options.getMaxPartialAreas();
        this.minPixels = options.getMinPixelsPerArea();
        this.maxDepth = options.getMaxRecursionDepth();
        this.maxSearchIterations = options.getMaxSearchIterations();
    }

    /**
     * @param field the blurred luminance field the mask was detected on.
     * @param mask the luminous area.
     * @param viewingDistance viewing distance in meters used for the solid angles.
     */
    public Segmentation segment(LuminanceField field, LuminousAreaMask mask, double viewingDistance){
        double omegaPx = field.solidAnglePerPixel(viewingDistance);

        PartitionTree tree = new PartitionTree();
        Bitmap all = mask.getMask();
        int root = tree.addRoot(all, field.stats(all));

        List<Integer> leaves = new ArrayList<>();
        List<Bitmap> groups = groupComponents(field, all);
        if(groups.size() > 1){
            for(Bitmap g : groups){
                leaves.add(tree.addChild(root, g, field.stats(g)));
            }
        }else{
            leaves.add(root);
        }

        Set<Integer> unsplittable = new HashSet<>();
        int searches = 0;
        boolean limited = false;
        while(true){
            int best = -1;
            boolean blockedByDepth = false;
            for(int leaf : leaves){
                PartitionTree.Node n = tree.getNode(leaf);
                if(isUniform(n.getStats()) || unsplittable.contains(leaf)
                        || n.getStats().count < 2*minPixels){
                    continue;
                }
                if(n.getDepth() >= maxDepth){
                    blockedByDepth = true;
                    continue;
                }
                if(best < 0 || splitsBefore(n, tree.getNode(best))){
                    best = leaf;
                }
            }
            if(best < 0){
                limited |= blockedByDepth;
                break;
            }
            if(leaves.size() >= maxPartialAreas){
                limited = true;
                break;
            }

            searches++;
            Split split = findSplit(field, tree.pixels(best), tree.getNode(best).getStats());
            if(split == null){
                logger.fine("node " + best + " can't be split");
                unsplittable.add(best);
                continue;
            }
            List<Bitmap> pieces = split.pieces();
            if(leaves.size() - 1 + pieces.size() > maxPartialAreas){
                logger.fine("split of node " + best + " into " + pieces.size()
                        + " pieces would exceed " + maxPartialAreas + " partial areas");
                limited = true;
                unsplittable.add(best);
                continue;
            }
            tree.setSplitThreshold(best, split.threshold);
            leaves.remove(Integer.valueOf(best));
            for(Bitmap piece : pieces){
                leaves.add(tree.addChild(best, piece, field.stats(piece)));
            }
            logger.fine("split node " + best + " at " + split.threshold + " cd/m2 into "
                    + pieces.size() + " pieces of " + split.brightStats.count + " + "
                    + split.dimStats.count + " pixels");
        }

        SegmentationStatus status;
        if(limited){
            status = SegmentationStatus.ITERATION_LIMIT_REACHED;
            logger.warning("partial area limit reached with non-uniform areas left ("
                    + leaves.size() + " areas, max " + maxPartialAreas + ", depth limit " + maxDepth + ")");
        }else if(leaves.size() == 1){
            status = isUniform(tree.getNode(leaves.get(0)).getStats())
                    ? SegmentationStatus.CONVERGED_SINGLE_AREA
                    : SegmentationStatus.SPLIT_NOT_POSSIBLE;
        }else{
            status = SegmentationStatus.CONVERGED;
        }

        List<PartialArea> areas = new ArrayList<>();
        for(int leaf : leaves){
            PartitionTree.Node n = tree.getNode(leaf);
            areas.add(new PartialArea("", tree.pixels(leaf), n.getStats(), omegaPx));
        }
        areas.sort(AREA_ORDER);
        for(int i=0;i<areas.size();i++){
            areas.set(i, areas.get(i).rename("A" + (i+1)));
        }

        if(DEBUG){
            tree.dump(System.err);
        }
        logger.fine(areas.size() + " partial areas, " + tree.size() + " nodes, "
                + searches + " split searches, status " + status);
        return new SegmentationResult(Collections.unmodifiableList(areas), tree, status, searches);
    }

    boolean isUniform(LuminanceStats stats){
        return stats.getUniformityRatio() <= uniformityTolerance;
    }

    private static boolean splitsBefore(PartitionTree.Node a, PartitionTree.Node b){
        int c = Double.compare(a.getStats().getUniformityRatio(), b.getStats().getUniformityRatio());
        if(c != 0){
            return c > 0;
        }
        if(a.getStats().count != b.getStats().count){
            return a.getStats().count > b.getStats().count;
        }
        return a.getIndex() < b.getIndex();
    }

    /**
     * Group the connected components of the area so that there are at most
     * {@code maxPartialAreas} groups, merging groups of closest mean luminance first.
     * @return the groups in raster order of their first pixel.
     */
    List<Bitmap> groupComponents(LuminanceField field, Bitmap area){
        Bitmap.ComponentLabels labels = area.connectedComponentLabels();
        int count = labels.count();
        if(count <= 1){
            return Collections.singletonList(area);
        }
        RunningStats[] perLabel = new RunningStats[count+1];
        for(int i=1;i<=count;i++){
            perLabel[i] = new RunningStats();
        }
        for(int y=0;y<area.height();y++){
            for(int x=0;x<area.width();x++){
                int l = labels.label(x, y);
                if(l != 0){
                    perLabel[l].add(field.get(x, y));
                }
            }
        }

        UnionFind uf = new UnionFind(count+1);
        List<Group> sorted = new ArrayList<>();
        for(int i=1;i<=count;i++){
            sorted.add(new Group(i, perLabel[i]));
        }
        sorted.sort(Comparator.comparingDouble(Group::mean).thenComparingInt(g -> g.label));

        // closest means are neighbours in this order and a merged group stays between them
        while(sorted.size() > maxPartialAreas){
            int bestPair = -1;
            double bestDiff = Double.POSITIVE_INFINITY;
            int bestSize = Integer.MAX_VALUE;
            int bestLabel = Integer.MAX_VALUE;
            for(int i=0;i+1<sorted.size();i++){
                Group a = sorted.get(i);
                Group b = sorted.get(i+1);
                double diff = b.mean() - a.mean();
                int size = a.stats.count() + b.stats.count();
                int lowLabel = Math.min(a.label, b.label);
                if(diff < bestDiff
                        || (diff == bestDiff && size < bestSize)
                        || (diff == bestDiff && size == bestSize && lowLabel < bestLabel)){
                    bestPair = i;
                    bestDiff = diff;
                    bestSize = size;
                    bestLabel = lowLabel;
                }
            }
            Group a = sorted.get(bestPair);
            Group b = sorted.remove(bestPair+1);
            RunningStats merged = new RunningStats();
            merged.addAll(a.stats);
            merged.addAll(b.stats);
            uf.union(a.label, b.label);
            sorted.set(bestPair, new Group(Math.min(a.label, b.label), merged));
        }
        logger.fine(count + " components merged into " + sorted.size() + " groups");

        List<Bitmap> groups = new ArrayList<>();
        int[] groupOfRoot = new int[count+1];
        Arrays.fill(groupOfRoot, -1);
        for(int y=0;y<area.height();y++){
            for(int x=0;x<area.width();x++){
                int l = labels.label(x, y);
                if(l == 0){
                    continue;
                }
                int r = uf.getComponent(l);
                if(groupOfRoot[r] < 0){
                    groupOfRoot[r] = groups.size();
                    groups.add(new Bitmap(area.width(), area.height()));
                }
                groups.get(groupOfRoot[r]).set(x, y, true);
            }
        }
        return groups;
    }

    /**
     * Search the threshold that splits the given pixels into a bright and a dim
     * class with the lowest within-class variance.
     * @return the best admissible split or null if there is none.
     */
    Split findSplit(LuminanceField field, Bitmap pixels, LuminanceStats stats){
        if(stats.count < 2*minPixels || !(stats.max > stats.min)){
            return null;
        }
        double tieTolerance = 1e-9 * stats.stdev * stats.stdev;
        double lo = stats.min;
        double hi = stats.max;
        Split best = null;
        for(int i=0;i<maxSearchIterations;i++){
            double width = hi - lo;
            if(!(width > 0)){
                break;
            }
            double mid = lo + width/2;
            Split low = evaluate(field, pixels, lo + width/4);
            Split high = evaluate(field, pixels, lo + 3*width/4);
            best = better(better(best, low, stats.median, tieTolerance), high, stats.median, tieTolerance);

            if(low == null && high == null){
                // admissible thresholds, if any, lie between the quarter points
                lo = lo + width/4;
                hi = hi - width/4;
            }else if(better(low, high, stats.median, tieTolerance) == low){
                hi = mid;
            }else{
                lo = mid;
            }
        }
        return best;
    }

    static Split better(Split a, Split b, double median, double tieTolerance){
        if(a == null){
            return b;
        }
        if(b == null){
            return a;
        }
        if(Math.abs(a.score - b.score) > tieTolerance){
            return a.score < b.score ? a : b;
        }
        double da = Math.abs(a.threshold - median);
        double db = Math.abs(b.threshold - median);
        if(da != db){
            return da < db ? a : b;
        }
        return a.threshold <= b.threshold ? a : b;
    }

    /**
     * Split the pixels at threshold t; fragments too small to stand on
     * their own are given to the other class.
     */
    Split evaluate(LuminanceField field, Bitmap pixels, double t){
        Bitmap bright = new Bitmap(pixels.width(), pixels.height());
        pixels.getXYOnPoints()
              .filter(xy -> field.get(xy[0], xy[1]) >= t)
              .forEach(xy -> bright.set(xy[0], xy[1], true));

        Bitmap small = smallFragments(bright);
        Bitmap b = bright.andNot(small);
        Bitmap d = pixels.andNot(b);
        small = smallFragments(d);
        b = b.or(small);
        d = d.andNot(small);

        LuminanceStats bs = field.stats(b);
        LuminanceStats ds = field.stats(d);
        if(bs.count < minPixels || ds.count < minPixels){
            return null;
        }
        double score = (bs.count*bs.stdev*bs.stdev + ds.count*ds.stdev*ds.stdev)
                        / (bs.count + ds.count);
        return new Split(t, score, b, bs, d, ds);
    }

    private Bitmap smallFragments(Bitmap bm){
        Bitmap.ComponentLabels labels = bm.connectedComponentLabels();
        Bitmap small = new Bitmap(bm.width(), bm.height());
        for(int y=0;y<bm.height();y++){
            for(int x=0;x<bm.width();x++){
                int l = labels.label(x, y);
                if(l != 0 && labels.size(l) < minPixels){
                    small.set(x, y, true);
                }
            }
        }
        return small;
    }

    static final class Split {
        final double threshold;
        final double score;
        final Bitmap bright;
        final LuminanceStats brightStats;
        final Bitmap dim;
        final LuminanceStats dimStats;

        Split(double threshold, double score, Bitmap bright, LuminanceStats brightStats,
              Bitmap dim, LuminanceStats dimStats){
            this.threshold = threshold;
            this.score = score;
            this.bright = bright;
            this.brightStats = brightStats;
            this.dim = dim;
            this.dimStats = dimStats;
        }

        /**
         * The connected pieces of the bright class followed by those of the dim class.
         */
        List<Bitmap> pieces(){
            List<Bitmap> pieces = new ArrayList<>(bright.connectedComponents());
            pieces.addAll(dim.connectedComponents());
            return pieces;
        }
    }

    private static final class Group {
        final int label;
        final RunningStats stats;

        Group(int label, RunningStats stats){
            this.label = label;
            this.stats = stats;
        }

        double mean(){
            return stats.computeAvg();
        }
    }

    private static final class SegmentationResult implements Segmentation {
        private final List<PartialArea> areas;
        private final PartitionTree tree;
        private final SegmentationStatus status;
        private final int searches;

        SegmentationResult(List<PartialArea> areas, PartitionTree tree,
                           SegmentationStatus status, int searches){
            this.areas = areas;
            this.tree = tree;
            this.status = status;
            this.searches = searches;
        }

        @Override
        public List<PartialArea> getPartialAreas() {
            return areas;
        }

        @Override
        public PartitionTree getTree() {
            return tree;
        }

        @Override
        public SegmentationStatus getStatus() {
            return status;
        }

        @Override
        public int getSearchCount() {
            return searches;
        }
    }
}
