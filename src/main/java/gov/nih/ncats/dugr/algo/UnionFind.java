package gov.nih.ncats.dugr.algo;

import java.util.Arrays;

/**
 * Weighted quick-union with path compression.
 * Elements are numbered from 0; {@link #add()} appends a new singleton.
 */
public class UnionFind {
    private int[] nodes;
    private int[] sizes;
    private int count;

    public UnionFind (int N) {
        nodes = new int[Math.max(N, 16)];
        sizes = new int[nodes.length];
        for (int i = 0; i < N; ++i) {
            nodes[i] = i;
            sizes[i] = 1;
        }
        count = N;
    }

    /**
     * Append a new element in its own set.
     * @return the index of the new element.
     */
    public int add () {
        if (count == nodes.length) {
            nodes = Arrays.copyOf(nodes, nodes.length * 2);
            sizes = Arrays.copyOf(sizes, sizes.length * 2);
        }
        nodes[count] = count;
        sizes[count] = 1;
        return count++;
    }

    public int size () {
        return count;
    }

    protected int getRoot (int n) {
        while (n != nodes[n]) {
            nodes[n] = nodes[nodes[n]]; // path compression
            n = nodes[n];
        }
        return n;
    }

    public void union (int p, int q) {
        int i = getRoot (p);
        int j = getRoot (q);
        if (i == j) {
            return;
        }
        if (sizes[i] < sizes[j]) {
            nodes[i] = j;
            sizes[j] += sizes[i];
        }
        else {
            nodes[j] = i;
            sizes[i] += sizes[j];
        }
    }

    public int getComponent (int p) { return getRoot (p); }
}
