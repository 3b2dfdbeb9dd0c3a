package com.layeredilp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.layeredilp.Constraint.Relation.EQ;
import static com.layeredilp.Constraint.Relation.GE;
import static com.layeredilp.Constraint.Relation.LE;

/**
 * Non-verticality of an edge: the integer difference between the positions
 * of its endpoints. Positions may have gaps here, only their order matters.
 * Total non-verticality is the sum of squared offsets, linearized following
 * Chimani and Hungerländer (INFORMS Journal on Computing, 2013).
 */
public final class VerticalityConstraints {

    private VerticalityConstraints() {}

    /** d_u_v_0 &gt;= |p_u - p_v| as the pair d + p_u - p_v &gt;= 0, d - p_u + p_v &gt;= 0. */
    public static List<Constraint> distances(LayeredGraph g, Program program) {
        List<Constraint> out = new ArrayList<>();
        for (Edge e : g.getEdges()) {
            VariableKey d = VariableKey.distance(e, 0);
            VariableKey pu = VariableKey.position(e.source());
            VariableKey pv = VariableKey.position(e.target());
            program.declare(d, VarType.GENERAL);
            out.add(Constraint.of(GE, 0, Term.plus(d), Term.plus(pu), Term.minus(pv)));
            out.add(Constraint.of(GE, 0, Term.plus(d), Term.minus(pu), Term.plus(pv)));
        }
        return out;
    }

    /**
     * d_u_v_0 - d_u_v_i &lt;= i for i = 1 .. (largest layer size - 1), so
     * that d_u_v_i &gt;= max(d_u_v_0 - i, 0).
     */
    public static List<Constraint> linearized(LayeredGraph g, Program program) {
        List<Constraint> out = new ArrayList<>();
        int max = g.maxLayerSize();
        for (Edge e : g.getEdges()) {
            VariableKey d0 = VariableKey.distance(e, 0);
            for (int i = 1; i < max; i++) {
                VariableKey di = VariableKey.distance(e, i);
                program.declare(di, VarType.GENERAL);
                out.add(Constraint.of(LE, i, Term.plus(d0), Term.minus(di)));
            }
        }
        return out;
    }

    /**
     * q_u_v = d_u_v_0 + 2 d_u_v_1 + ... + 2 d_u_v_max. With d_u_v_i at
     * d_u_v_0 - i this is (1 + ... + n) + (1 + ... + n-1) = n^2 for n = d_u_v_0.
     */
    public static List<Constraint> nonverticality(LayeredGraph g, Program program) {
        List<Constraint> out = new ArrayList<>();
        int max = g.maxLayerSize();
        for (Edge e : g.getEdges()) {
            VariableKey q = VariableKey.nonverticality(e);
            program.declare(q, VarType.GENERAL);
            List<Term> left = new ArrayList<>(max + 1);
            left.add(Term.plus(VariableKey.distance(e, 0)));
            for (int i = 1; i < max; i++) left.add(Term.of(2, VariableKey.distance(e, i)));
            left.add(Term.minus(q));
            out.add(new Constraint(left, EQ, Fraction.ZERO));
        }
        return out;
    }

    /** vertical = sum of all q_u_v */
    public static Constraint total(LayeredGraph g, Program program) {
        program.declare(VariableKey.TOTAL_VERTICAL, VarType.GENERAL);
        List<Term> left = new ArrayList<>();
        for (Edge e : g.getEdges()) left.add(Term.plus(VariableKey.nonverticality(e)));
        left.add(Term.minus(VariableKey.TOTAL_VERTICAL));
        return new Constraint(left, EQ, Fraction.ZERO);
    }

    /**
     * Lower bounds on the offsets around each node, from its number of
     * distinct neighbors above and below: the neighbors occupy distinct
     * positions, so for i = 0 .. floor(deg/2) - 1
     * <pre>
     *   sum over neighbors of d_i &gt;= (floor(deg/2) - i) * (ceil(deg/2) - i)
     * </pre>
     */
    public static List<Constraint> lowerBounds(LayeredGraph g, Program program) {
        List<Constraint> out = new ArrayList<>();
        int max = g.maxLayerSize();
        for (Node node : g.getNodes()) {
            out.addAll(bounds(distinctNeighborEdges(node.upEdges(), true), max));
            out.addAll(bounds(distinctNeighborEdges(node.downEdges(), false), max));
        }
        return out;
    }

    private static List<Constraint> bounds(List<Edge> edges, int maxLayerSize) {
        List<Constraint> out = new ArrayList<>();
        int degree = edges.size();
        if (degree < 2) return out;
        for (int i = 0; i < degree / 2 && i < maxLayerSize; i++) {
            List<Term> left = new ArrayList<>(degree);
            for (Edge e : edges) left.add(Term.plus(VariableKey.distance(e, i)));
            out.add(new Constraint(left, GE, Fraction.of(minimumOffsetSum(degree, i))));
        }
        return out;
    }

    /** Smallest possible sum of max(offset - i, 0) over {@code degree} neighbors in distinct positions. */
    static long minimumOffsetSum(int degree, int i) {
        long half = degree / 2;
        long upperHalf = (degree + 1) / 2;
        return (half - i) * (upperHalf - i);
    }

    /** First edge to each distinct neighbor; parallel edges may all be vertical. */
    private static List<Edge> distinctNeighborEdges(List<Edge> edges, boolean up) {
        Map<Node, Edge> first = new LinkedHashMap<>();
        for (Edge e : edges) first.putIfAbsent(up ? e.target() : e.source(), e);
        return new ArrayList<>(first.values());
    }

    /** bn_vertical - d_u_v_0 &gt;= 0 for every edge */
    public static List<Constraint> bottleneck(LayeredGraph g, Program program) {
        program.declare(VariableKey.BOTTLENECK_VERTICAL, VarType.GENERAL);
        List<Constraint> out = new ArrayList<>();
        for (Edge e : g.getEdges()) {
            out.add(Constraint.of(GE, 0, Term.plus(VariableKey.BOTTLENECK_VERTICAL),
                    Term.minus(VariableKey.distance(e, 0))));
        }
        return out;
    }

    /** Sum of the squared offsets d_u_v_0. */
    public static Objective quadraticObjective(LayeredGraph g) {
        if (g.getEdgeCount() == 0) throw new IllegalArgumentException("quad_vertical needs at least one edge");
        List<VariableKey> vs = new ArrayList<>();
        for (Edge e : g.getEdges()) vs.add(VariableKey.distance(e, 0));
        return Objective.sumOfSquares(vs);
    }
}
