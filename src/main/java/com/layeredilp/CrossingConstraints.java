package com.layeredilp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.layeredilp.Constraint.Relation.GE;

/**
 * Crossing indicators c_i_j_k_l for edges ij and kl in the same channel
 * (i, k on one layer, j, l on the next) with no common endpoint, and the
 * total and bottleneck crossing measures built on them.
 */
public final class CrossingConstraints {

    private CrossingConstraints() {}

    /**
     * Every pair of edges that may cross, first edge leaving the node with
     * the smaller id, in channel order.
     */
    static List<Edge[]> candidatePairs(LayeredGraph g) {
        List<Edge[]> pairs = new ArrayList<>();
        // nodes on the last layer have no upward edges
        for (int layer = 0; layer < g.getLayerCount() - 1; layer++) {
            List<Node> nodes = g.getLayer(layer);
            for (Node i : nodes) {
                for (Node k : nodes) {
                    if (i.id() >= k.id()) continue;
                    for (Edge ij : i.upEdges()) {
                        for (Edge kl : k.upEdges()) {
                            if (ij.target() != kl.target()) pairs.add(new Edge[]{ij, kl});
                        }
                    }
                }
            }
        }
        return pairs;
    }

    /**
     * Two constraints per candidate pair; the indicator is forced to 1 when
     * the order of the lower endpoints disagrees with that of the upper ones:
     * <pre>
     *   c_i_j_k_l - x_k_i - x_j_l &gt;= -1   (wrong order below, right order above)
     *   c_i_j_k_l - x_l_j - x_i_k &gt;= -1   (wrong order above, right order below)
     * </pre>
     */
    public static List<Constraint> crossings(LayeredGraph g, Program program) {
        List<Constraint> out = new ArrayList<>();
        for (Edge[] pair : candidatePairs(g)) {
            Node i = pair[0].source(), j = pair[0].target();
            Node k = pair[1].source(), l = pair[1].target();
            VariableKey c = VariableKey.crossing(pair[0], pair[1]);
            program.declare(c, VarType.BINARY);
            out.add(Constraint.of(GE, -1, Term.plus(c),
                    Term.minus(VariableKey.precedes(k, i)),
                    Term.minus(VariableKey.precedes(j, l))));
            out.add(Constraint.of(GE, -1, Term.plus(c),
                    Term.minus(VariableKey.precedes(l, j)),
                    Term.minus(VariableKey.precedes(i, k))));
        }
        return out;
    }

    /** total - (sum of all crossing indicators) &gt;= 0 */
    public static Constraint total(LayeredGraph g, Program program) {
        program.declare(VariableKey.TOTAL, VarType.GENERAL);
        List<Term> left = new ArrayList<>();
        left.add(Term.plus(VariableKey.TOTAL));
        for (Edge[] pair : candidatePairs(g)) {
            left.add(Term.minus(VariableKey.crossing(pair[0], pair[1])));
        }
        return new Constraint(left, GE, Fraction.ZERO);
    }

    /**
     * bottleneck - (sum of the crossing indicators of one edge) &gt;= 0 for
     * every edge with at least one potential crossing in its channel.
     */
    public static List<Constraint> bottleneck(LayeredGraph g, Program program) {
        program.declare(VariableKey.BOTTLENECK, VarType.GENERAL);
        Map<Edge, List<Term>> byEdge = new LinkedHashMap<>();
        for (int layer = 0; layer < g.getLayerCount() - 1; layer++) {
            for (Node i : g.getLayer(layer)) {
                for (Edge e : i.upEdges()) byEdge.put(e, new ArrayList<>());
            }
        }
        for (Edge[] pair : candidatePairs(g)) {
            Term t = Term.minus(VariableKey.crossing(pair[0], pair[1]));
            byEdge.get(pair[0]).add(t);
            byEdge.get(pair[1]).add(t);
        }
        List<Constraint> out = new ArrayList<>();
        for (List<Term> crossings : byEdge.values()) {
            if (crossings.isEmpty()) continue;
            List<Term> left = new ArrayList<>(crossings.size() + 1);
            left.add(Term.plus(VariableKey.BOTTLENECK));
            left.addAll(crossings);
            out.add(new Constraint(left, GE, Fraction.ZERO));
        }
        return out;
    }
}
