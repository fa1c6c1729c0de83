package gov.nih.ncats.dugr.image;

import java.io.OutputStream;
import java.io.PrintStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import gov.nih.ncats.dugr.algo.UnionFind;

/**
 * A bitmap image. Used for validity masks, luminous area masks
 * and the pixel sets of partial areas.
 */
public class Bitmap implements Serializable {
    private static final long serialVersionUID = 0x3a0c61d2be1f49e7L;
    private static final Logger logger =
        Logger.getLogger (Bitmap.class.getName ());

    static final int[] MASK = new int[]{
        0x80,
        0x40,
        0x20,
        0x10,
        0x08,
        0x04,
        0x02,
        0x01
    };

    private final int width;
    private final int height;
    private final int scanline;
    private final byte[] data; // pixel values

    /**
     * Result of 8-connected component labelling. Label 0 is background,
     * components are numbered 1..count in raster order of their first pixel.
     */
    public static final class ComponentLabels {
        private final int width;
        private final int height;
        private final int[] labels;
        private final int[] sizes;

        ComponentLabels(int width, int height, int[] labels, int[] sizes){
            this.width=width;
            this.height=height;
            this.labels=labels;
            this.sizes=sizes;
        }

        public int count(){
            return sizes.length-1;
        }

        public int label(int x, int y){
            return labels[y*width+x];
        }

        /**
         * @param label a label in 1..count
         */
        public int size(int label){
            return sizes[label];
        }

        public Bitmap component(int label){
            Bitmap bm = new Bitmap(width, height);
            for(int i=0;i<labels.length;i++){
                if(labels[i]==label){
                    bm.set(i%width, i/width, true);
                }
            }
            return bm;
        }

        public List<Bitmap> components(){
            List<Bitmap> comps = new ArrayList<>(count());
            for(int l=1;l<=count();l++){
                comps.add(component(l));
            }
            return comps;
        }
    }

    public Bitmap (Bitmap copy) {
        this (copy.width, copy.height);
        System.arraycopy (copy.data, 0, this.data, 0, this.data.length);
    }

    public Bitmap (int width, int height) {
        if(width <=0 || height <=0){
            throw new IllegalArgumentException("invalid bitmap size " + width + "x" + height);
        }
        this.width = width;
        this.height = height;

        scanline = (width + 7) >> 3;
        data = new byte[scanline * height];
    }

    /**
     * Create a bitmap with every pixel on.
     */
    public static Bitmap filled(int width, int height){
        Bitmap bm = new Bitmap(width, height);
        for(int y=0;y<height;y++){
            for(int x=0;x<width;x++){
                bm.set(x, y, true);
            }
        }
        return bm;
    }

    public int width () {
        return width;
    }

    public int height () {
        return height;
    }

    public boolean get (int x, int y) {
        if (x >= 0 && x < width && y >= 0 && y < height) {
            return isOn(x,y);
        }
        return false;
    }

    // same as get() but without the bound checking
    public boolean isOn (int x, int y) {
        return (data[y * scanline + x / 8] & MASK[x % 8]) != 0;
    }

    public void set (int x, int y, boolean on) {
        int loc = y * scanline + x / 8;
        if (on) {
            data[loc] |= MASK[x % 8];
        } else {
            data[loc] &= ~MASK[x % 8];
        }
    }

    public int countOn(){
        int on=0;
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                if(isOn(x,y)){
                    on++;
                }
            }
        }
        return on;
    }

    public boolean isEmpty(){
        for (int i = 0; i < data.length; ++i) {
            if(data[i]!=0){
                return false;
            }
        }
        return true;
    }

    /**
     * Raster index (y*width+x) of the first on pixel, or -1 if the bitmap is empty.
     */
    public int firstOnIndex(){
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                if(isOn(x,y)){
                    return y*width+x;
                }
            }
        }
        return -1;
    }

    /**
     * All on pixels as {x,y} pairs in raster order.
     */
    public Stream<int[]> getXYOnPoints(){
        return IntStream.range(0, width*height)
                .filter(i->isOn(i%width, i/width))
                .mapToObj(i->new int[]{i%width, i/width});
    }

    public Bitmap invert(){
        Bitmap clone = new Bitmap(width, height);
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                clone.set(x, y, !isOn(x,y));
            }
        }
        return clone;
    }

    public Bitmap and(Bitmap other){
        checkSameSize(other);
        Bitmap bm = new Bitmap(this);
        for (int i = 0; i < data.length; ++i) {
            bm.data[i] = (byte) (data[i] & other.data[i]);
        }
        return bm;
    }

    public Bitmap or(Bitmap other){
        checkSameSize(other);
        Bitmap bm = new Bitmap(this);
        for (int i = 0; i < data.length; ++i) {
            bm.data[i] = (byte) (data[i] | other.data[i]);
        }
        return bm;
    }

    public Bitmap andNot(Bitmap other){
        checkSameSize(other);
        Bitmap bm = new Bitmap(this);
        for (int i = 0; i < data.length; ++i) {
            bm.data[i] = (byte) (data[i] & ~other.data[i]);
        }
        return bm;
    }

    public boolean intersects(Bitmap other){
        checkSameSize(other);
        for (int i = 0; i < data.length; ++i) {
            if((data[i] & other.data[i]) !=0){
                return true;
            }
        }
        return false;
    }

    private void checkSameSize(Bitmap other){
        if(other.width!=width || other.height!=height){
            throw new IllegalArgumentException("bitmap sizes differ: " + width + "x" + height
                    + " vs " + other.width + "x" + other.height);
        }
    }

    /**
     * Dilation with a (2r+1)x(2r+1) square structuring element.
     */
    public Bitmap dilate(int rad){
        if(rad<=0){
            return new Bitmap(this);
        }
        Bitmap bm = new Bitmap(width, height);
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                bm.set(x, y, anyInWindow(x, y, rad));
            }
        }
        return bm;
    }

    /**
     * Erosion with a (2r+1)x(2r+1) square structuring element. Neighbors
     * outside of the image are ignored so pixels on the image border
     * are not eroded just for being on the border.
     */
    public Bitmap erode(int rad){
        if(rad<=0){
            return new Bitmap(this);
        }
        Bitmap bm = new Bitmap(width, height);
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                bm.set(x, y, isOn(x,y) && allInWindow(x, y, rad));
            }
        }
        return bm;
    }

    /**
     * Morphological closing (dilate then erode). The result always
     * contains every pixel of this bitmap.
     */
    public Bitmap close(int rad){
        return dilate(rad).erode(rad).or(this);
    }

    private boolean anyInWindow(int x, int y, int rad){
        int y0 = Math.max(0, y-rad), y1 = Math.min(height-1, y+rad);
        int x0 = Math.max(0, x-rad), x1 = Math.min(width-1, x+rad);
        for(int j=y0;j<=y1;j++){
            for(int i=x0;i<=x1;i++){
                if(isOn(i,j)){
                    return true;
                }
            }
        }
        return false;
    }

    private boolean allInWindow(int x, int y, int rad){
        int y0 = Math.max(0, y-rad), y1 = Math.min(height-1, y+rad);
        int x0 = Math.max(0, x-rad), x1 = Math.min(width-1, x+rad);
        for(int j=y0;j<=y1;j++){
            for(int i=x0;i<=x1;i++){
                if(!isOn(i,j)){
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Two pass 8-connected component labelling.
     */
    public ComponentLabels connectedComponentLabels(){
        int[] labels = new int[width*height];
        int next = 0;
        // provisional labels start at 1; the table grows as labels are created
        UnionFind eqv = new UnionFind(1);
        int[] L = new int[4];

        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                if(!isOn(x,y)){
                    continue;
                }
                L[0] = x > 0 ? labels[y*width + x-1] : 0;
                L[1] = x > 0 && y > 0 ? labels[(y-1)*width + x-1] : 0;
                L[2] = y > 0 ? labels[(y-1)*width + x] : 0;
                L[3] = y > 0 && x+1 < width ? labels[(y-1)*width + x+1] : 0;

                int min = 0;
                for(int l : L){
                    if(l!=0 && (min==0 || l<min)){
                        min=l;
                    }
                }
                if(min==0){
                    next = eqv.add();
                    labels[y*width+x] = next;
                    continue;
                }
                labels[y*width+x] = min;
                for(int l : L){
                    if(l!=0 && l!=min){
                        eqv.union(min, l);
                    }
                }
            }
        }

        // relabel so components are numbered in raster order of their first pixel
        int[] compact = new int[next+1];
        int count=0;
        for (int i = 0; i < labels.length; ++i) {
            if(labels[i]==0){
                continue;
            }
            int root = eqv.getComponent(labels[i]);
            if(compact[root]==0){
                compact[root]= ++count;
            }
        }
        int[] sizes = new int[count+1];
        for (int i = 0; i < labels.length; ++i) {
            if(labels[i]!=0){
                int l = compact[eqv.getComponent(labels[i])];
                labels[i]=l;
                sizes[l]++;
            }
        }
        logger.finest("found " + count + " connected components");
        return new ComponentLabels(width, height, labels, sizes);
    }

    public List<Bitmap> connectedComponents(){
        if(isEmpty()){
            return Collections.emptyList();
        }
        return connectedComponentLabels().components();
    }

    public void dump (OutputStream os) {
        PrintStream ps = new PrintStream (os, true);
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x)
                ps.print (isOn (x, y) ? '*' : '.');
            ps.println ();
        }
    }

    @Override
    public boolean equals(Object o){
        if(this==o){
            return true;
        }
        if(!(o instanceof Bitmap)){
            return false;
        }
        Bitmap other = (Bitmap)o;
        return width==other.width && height==other.height
                && java.util.Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode(){
        return 31*(31*width+height) + java.util.Arrays.hashCode(data);
    }
}
