package com.layeredilp;

import java.util.ArrayList;
import java.util.List;

import static com.layeredilp.Constraint.Relation.EQ;
import static com.layeredilp.Constraint.Relation.GE;
import static com.layeredilp.Constraint.Relation.LE;

/**
 * Constraints that make the program describe a valid layered drawing: a
 * total order of the nodes on each layer (x variables) and the integer
 * positions that realize it (p variables).
 */
public final class OrderingConstraints {

    private OrderingConstraints() {}

    /**
     * Anti-symmetry for every same-layer pair and two transitivity
     * constraints for every same-layer triple i &lt; j &lt; k (by id):
     * <pre>
     *   x_i_k - x_i_j - x_j_k &gt;= -1
     *   x_i_j - x_i_k - x_k_j &gt;= -1
     * </pre>
     * The other four variants follow from these by x_p_q = 1 - x_q_p:
     * x_i_k - x_i_j - x_j_k = x_k_j - x_k_i - x_i_j = x_j_i - x_j_k - x_k_i.
     */
    public static List<Constraint> triangle(LayeredGraph g, Program program) {
        List<Constraint> out = new ArrayList<>();
        for (int layer = 0; layer < g.getLayerCount(); layer++) {
            List<Node> nodes = g.getLayer(layer);
            for (Node i : nodes) {
                for (Node j : nodes) {
                    if (i.id() < j.id()) {
                        VariableKey xij = VariableKey.precedes(i, j);
                        VariableKey xji = VariableKey.precedes(j, i);
                        program.declare(xij, VarType.BINARY);
                        program.declare(xji, VarType.BINARY);
                        out.add(Constraint.of(EQ, 1, Term.plus(xij), Term.plus(xji)));
                    }
                }
            }
        }
        for (int layer = 0; layer < g.getLayerCount(); layer++) {
            List<Node> nodes = g.getLayer(layer);
            for (Node i : nodes) {
                for (Node j : nodes) {
                    if (i.id() >= j.id()) continue;
                    for (Node k : nodes) {
                        if (j.id() >= k.id()) continue;
                        out.add(Constraint.of(GE, -1,
                                Term.plus(VariableKey.precedes(i, k)),
                                Term.minus(VariableKey.precedes(i, j)),
                                Term.minus(VariableKey.precedes(j, k))));
                        out.add(Constraint.of(GE, -1,
                                Term.plus(VariableKey.precedes(i, j)),
                                Term.minus(VariableKey.precedes(i, k)),
                                Term.minus(VariableKey.precedes(k, j))));
                    }
                }
            }
        }
        return out;
    }

    /**
     * Integer position p_i_L for every node. If i precedes j then
     * p_j - p_i &gt;= 1, otherwise unconstrained:
     * <pre>
     *   p_j - p_i + (M+1) x_j_i &gt;= 1,   p_i &lt;= M
     * </pre>
     * M is the layer size - 1 when positions are contiguous, the largest
     * layer size - 1 when gaps are allowed.
     */
    public static List<Constraint> positions(LayeredGraph g, Program program, boolean contiguous) {
        List<Constraint> out = new ArrayList<>();
        for (int layer = 0; layer < g.getLayerCount(); layer++) {
            List<Node> nodes = g.getLayer(layer);
            int maxDifference = maxPosition(g, layer, contiguous);
            for (Node node : nodes) {
                VariableKey p = VariableKey.position(node);
                program.declare(p, VarType.GENERAL);
                out.add(Constraint.of(LE, maxDifference, Term.plus(p)));
                for (Node other : nodes) {
                    if (other == node) continue;
                    out.add(Constraint.of(GE, 1,
                            Term.plus(VariableKey.position(other)),
                            Term.minus(p),
                            Term.of(maxDifference + 1L, VariableKey.precedes(other, node))));
                }
            }
        }
        return out;
    }

    /** Largest position on a layer, which is also the largest position difference there. */
    static int maxPosition(LayeredGraph g, int layer, boolean contiguous) {
        return (contiguous ? g.layerSize(layer) : g.maxLayerSize()) - 1;
    }

    /**
     * One self-crossing marker c_u_v_u_v = 0 per edge, so that the edge is
     * recovered from any solution listing.
     */
    public static List<Constraint> edgeMarkers(LayeredGraph g, Program program) {
        List<Constraint> out = new ArrayList<>();
        for (Edge e : g.getEdges()) {
            VariableKey marker = VariableKey.edgeMarker(e);
            program.declare(marker, VarType.BINARY);
            out.add(Constraint.of(EQ, 0, Term.plus(marker)));
        }
        return out;
    }
}
