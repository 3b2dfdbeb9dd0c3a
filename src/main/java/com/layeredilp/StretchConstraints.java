package com.layeredilp;

import java.util.ArrayList;
import java.util.List;

import static com.layeredilp.Constraint.Relation.EQ;
import static com.layeredilp.Constraint.Relation.GE;

/**
 * Stretch of an edge: the horizontal displacement between its endpoints
 * when the nodes of every layer are spread evenly over [0, 1]. Needs
 * contiguous positions.
 */
public final class StretchConstraints {

    /** Slack allowed in the absolute-value constraints. */
    static final Fraction TOLERANCE = Fraction.ZERO;

    private StretchConstraints() {}

    /**
     * Multiplier of a position on each layer: 1/(L-1) for a layer of L
     * nodes, 1/2 for a single node so that it sits in the middle.
     */
    public static Fraction[] layerFactors(LayeredGraph g) {
        Fraction[] factors = new Fraction[g.getLayerCount()];
        for (int layer = 0; layer < factors.length; layer++) {
            int size = g.layerSize(layer);
            if (size < 1) throw new IllegalArgumentException("Layer " + layer + " has no nodes");
            int denominator = size == 1 ? 2 : size - 1;
            factors[layer] = Fraction.of(1, denominator);
        }
        return factors;
    }

    /**
     * z_u_v = f(u) p_u - f(v) p_v for every edge uv; z ranges over [-1, 1].
     */
    public static List<Constraint> raw(LayeredGraph g, Program program) {
        Fraction[] factor = layerFactors(g);
        List<Constraint> out = new ArrayList<>();
        for (Edge e : g.getEdges()) {
            VariableKey z = VariableKey.rawStretch(e);
            program.declare(z, VarType.CONTINUOUS);
            program.bound(z, Fraction.ONE.negate(), Fraction.ONE);
            List<Term> left = new ArrayList<>(3);
            left.add(Term.plus(z));
            left.add(new Term(factor[e.source().layer()].negate(), VariableKey.position(e.source())));
            left.add(new Term(factor[e.target().layer()], VariableKey.position(e.target())));
            out.add(new Constraint(left, EQ, Fraction.ZERO));
        }
        return out;
    }

    /**
     * s_u_v = |z_u_v| through a sign indicator b_u_v (0 when z is
     * positive, 1 when negative):
     * <pre>
     *   s - z &gt;= 0,  s + z &gt;= 0,  s &lt;= z + 2b,  s &lt;= -z + 2 - 2b
     * </pre>
     */
    public static List<Constraint> absolute(LayeredGraph g, Program program) {
        Fraction slack = TOLERANCE.negate();
        List<Constraint> out = new ArrayList<>();
        for (Edge e : g.getEdges()) {
            VariableKey s = VariableKey.stretch(e);
            VariableKey z = VariableKey.rawStretch(e);
            VariableKey b = VariableKey.sign(e);
            program.declare(s, VarType.SEMI);
            program.declare(b, VarType.BINARY);
            out.add(new Constraint(List.of(Term.plus(s), Term.minus(z)), GE, slack));
            out.add(new Constraint(List.of(Term.plus(s), Term.plus(z)), GE, slack));
            out.add(new Constraint(List.of(Term.plus(z), Term.of(2, b), Term.minus(s)), GE, slack));
            out.add(new Constraint(List.of(Term.minus(z), Term.of(-2, b), Term.minus(s)), GE,
                    Fraction.of(-2).subtract(TOLERANCE)));
        }
        return out;
    }

    /** stretch - (sum of all s_u_v) &gt;= 0 */
    public static Constraint total(LayeredGraph g, Program program) {
        program.declare(VariableKey.TOTAL_STRETCH, VarType.SEMI);
        List<Term> left = new ArrayList<>();
        left.add(Term.plus(VariableKey.TOTAL_STRETCH));
        for (Edge e : g.getEdges()) left.add(Term.minus(VariableKey.stretch(e)));
        return new Constraint(left, GE, Fraction.ZERO);
    }

    /** bn_stretch - s_u_v &gt;= 0 for every edge */
    public static List<Constraint> bottleneck(LayeredGraph g, Program program) {
        program.declare(VariableKey.BOTTLENECK_STRETCH, VarType.SEMI);
        List<Constraint> out = new ArrayList<>();
        for (Edge e : g.getEdges()) {
            out.add(Constraint.of(GE, 0, Term.plus(VariableKey.BOTTLENECK_STRETCH),
                    Term.minus(VariableKey.stretch(e))));
        }
        return out;
    }

    /**
     * Sum of z_u_v squared. The raw displacements may be fractional, so the
     * optimum need not match the one for linear stretch.
     */
    public static Objective quadraticObjective(LayeredGraph g) {
        if (g.getEdgeCount() == 0) throw new IllegalArgumentException("quad_stretch needs at least one edge");
        List<VariableKey> vs = new ArrayList<>();
        for (Edge e : g.getEdges()) vs.add(VariableKey.rawStretch(e));
        return Objective.sumOfSquares(vs);
    }
}
