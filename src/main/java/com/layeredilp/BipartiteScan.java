package com.layeredilp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks for dense complete bipartite patterns between adjacent layers, the
 * starting point for stronger non-verticality bounds. The bounds themselves
 * are not derived yet: candidates are only reported in the log and no
 * constraints are produced.
 */
public final class BipartiteScan {
    private static final Logger log = LoggerFactory.getLogger(BipartiteScan.class);

    /** Smallest number of edges in a pattern worth reporting. */
    static final int MIN_EDGES = 6;

    /** A set of nodes on one layer together with the up-neighbors they all share. */
    public static final class Candidate {
        public final List<Node> lower;
        public final Set<Node> upper;
        Candidate(List<Node> lower, Set<Node> upper) {
            this.lower = Collections.unmodifiableList(new ArrayList<>(lower));
            this.upper = Collections.unmodifiableSet(upper);
        }
        public int edges() { return lower.size() * upper.size(); }
        @Override public String toString() { return lower + " x " + upper; }
    }

    private BipartiteScan() {}

    /**
     * Subsets of 2..limit nodes on every layer but the last whose common
     * up-neighbors give at least {@link #MIN_EDGES} edges. A limit below 2
     * means no limit. Larger subsets are only tried while some subset of
     * the current size was a hit.
     */
    public static List<Candidate> scan(LayeredGraph g, int limit) {
        if (limit < 2) limit = g.maxLayerSize();
        List<Candidate> found = new ArrayList<>();
        for (int layer = 0; layer < g.getLayerCount() - 1; layer++) {
            List<Node> nodes = g.getLayer(layer);
            int largest = Math.min(nodes.size(), limit);
            for (int size = 2; size <= largest; size++) {
                boolean hit = false;
                for (List<Node> subset : subsets(nodes, size)) {
                    Set<Node> common = new LinkedHashSet<>(subset.get(0).upNeighbors());
                    for (Node n : subset) common.retainAll(n.upNeighbors());
                    if (common.size() * subset.size() >= MIN_EDGES) {
                        Candidate c = new Candidate(subset, common);
                        log.debug("layer {}: bipartite candidate {} ({} edges)", layer, c, c.edges());
                        found.add(c);
                        hit = true;
                    }
                }
                // pairs are always examined, larger subsets only after a hit
                if (!hit && size > 2) break;
            }
        }
        log.debug("bipartite scan: {} candidates, no constraints derived", found.size());
        return found;
    }

    /** All subsets of the given size, in lexicographic order of positions. */
    static List<List<Node>> subsets(List<Node> nodes, int size) {
        List<List<Node>> out = new ArrayList<>();
        int[] idx = new int[size];
        for (int i = 0; i < size; i++) idx[i] = i;
        int n = nodes.size();
        if (size > n) return out;
        while (true) {
            List<Node> s = new ArrayList<>(size);
            for (int i : idx) s.add(nodes.get(i));
            out.add(s);
            int i = size - 1;
            while (i >= 0 && idx[i] == n - size + i) i--;
            if (i < 0) return out;
            idx[i]++;
            for (int j = i + 1; j < size; j++) idx[j] = idx[j - 1] + 1;
        }
    }
}
