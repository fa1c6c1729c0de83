package gov.nih.ncats.dugr.segmentation;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceStats;

/**
 * Arena of the candidate areas visited by the segmentation. Node 0 is the
 * whole luminous area; every split adds the children of a node.
 * The leaves are the final partial areas.
 */
public final class PartitionTree {

    public static final class Node {
        private final int index;
        private final int parent;
        private final int depth;
        private final Bitmap pixels;
        private final LuminanceStats stats;
        private final List<Integer> children = new ArrayList<>();
        private double splitThreshold = Double.NaN;

        Node(int index, int parent, int depth, Bitmap pixels, LuminanceStats stats){
            this.index = index;
            this.parent = parent;
            this.depth = depth;
            this.pixels = pixels;
            this.stats = stats;
        }

        public int getIndex() {
            return index;
        }

        /**
         * @return the index of the parent or -1 for the root.
         */
        public int getParent() {
            return parent;
        }

        public int getDepth() {
            return depth;
        }

        public Bitmap getPixels() {
            return new Bitmap(pixels);
        }

        public LuminanceStats getStats() {
            return stats;
        }

        public List<Integer> getChildren() {
            return Collections.unmodifiableList(children);
        }

        public boolean isLeaf(){
            return children.isEmpty();
        }

        /**
         * The luminance threshold that produced the children of this node,
         * NaN for leaves and for a root split by connectivity.
         */
        public double getSplitThreshold() {
            return splitThreshold;
        }
    }

    private final List<Node> nodes = new ArrayList<>();

    PartitionTree(){
    }

    int addRoot(Bitmap pixels, LuminanceStats stats){
        if(!nodes.isEmpty()){
            throw new IllegalStateException("root already set");
        }
        nodes.add(new Node(0, -1, 0, pixels, stats));
        return 0;
    }

    int addChild(int parent, Bitmap pixels, LuminanceStats stats){
        Node p = nodes.get(parent);
        Node n = new Node(nodes.size(), parent, p.depth+1, pixels, stats);
        nodes.add(n);
        p.children.add(n.index);
        return n.index;
    }

    void setSplitThreshold(int node, double threshold){
        nodes.get(node).splitThreshold = threshold;
    }

    Bitmap pixels(int node){
        return nodes.get(node).pixels;
    }

    public Node getRoot(){
        return nodes.get(0);
    }

    public Node getNode(int index){
        return nodes.get(index);
    }

    public int size(){
        return nodes.size();
    }

    public List<Node> getLeaves(){
        return nodes.stream()
                .filter(Node::isLeaf)
                .collect(Collectors.toList());
    }

    public void dump(PrintStream ps){
        dump(ps, getRoot());
    }

    private void dump(PrintStream ps, Node n){
        StringBuilder sb = new StringBuilder();
        for(int i=0;i<n.depth;i++){
            sb.append("  ");
        }
        sb.append('#').append(n.index)
          .append(" n=").append(n.stats.count)
          .append(" mean=").append(n.stats.mean)
          .append(" cv=").append(n.stats.getUniformityRatio());
        if(!Double.isNaN(n.splitThreshold)){
            sb.append(" split@").append(n.splitThreshold);
        }
        ps.println(sb);
        for(int c : n.children){
            dump(ps, nodes.get(c));
        }
    }
}
