package com.layeredilp;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class CrossingConstraintsTest {

    /** a=0, b=1 on layer 0; c=2, d=3 on layer 1; edges ad and bc. */
    static LayeredGraph twoEdges() throws IOException {
        return LayeredGraphIOTest.read("t pair", "n 0 0", "n 1 0", "n 2 1", "n 3 1", "e 0 3", "e 1 2");
    }

    static LayeredGraph completeTwoByTwo() throws IOException {
        return LayeredGraphIOTest.read("t k22", "n 0 0", "n 1 0", "n 2 1", "n 3 1", "e 0 2", "e 0 3", "e 1 2", "e 1 3");
    }

    @Test
    public void singleCrossingVariableForTwoEdges() throws IOException {
        LayeredGraph g = twoEdges();
        Program p = new Program();
        List<Constraint> cs = CrossingConstraints.crossings(g, p);

        List<VariableKey> crossings = new ArrayList<>();
        for (VariableKey v : p.variables(VarType.BINARY)) {
            if (v.kind() == VariableKey.Kind.CROSSING && !v.isEdgeMarker()) crossings.add(v);
        }
        assertEquals(1, crossings.size());
        assertEquals("c_0_3_1_2", crossings.get(0).name());

        assertEquals(2, cs.size());
        assertEquals("+ c_0_3_1_2 - x_1_0 - x_3_2 >= -1", cs.get(0).toString());
        assertEquals("+ c_0_3_1_2 - x_2_3 - x_0_1 >= -1", cs.get(1).toString());
    }

    /** With c = 0 some constraint fails exactly when the two orders disagree. */
    @Test
    public void indicatorForcedForEveryInversion() throws IOException {
        LayeredGraph g = twoEdges();
        List<Constraint> cs = CrossingConstraints.crossings(g, new Program());
        for (int below = 0; below <= 1; below++) {
            for (int above = 0; above <= 1; above++) {
                Map<String, Integer> x = new HashMap<>();
                x.put("x_0_1", below);
                x.put("x_1_0", 1 - below);
                x.put("x_3_2", above);
                x.put("x_2_3", 1 - above);
                boolean forced = false;
                for (Constraint c : cs) {
                    long lhs = 0;
                    for (Term t : c.terms()) {
                        Integer v = x.get(t.variable().name());
                        if (v != null) lhs += t.coefficient().toBigDecimal().longValueExact() * v;
                    }
                    if (lhs < c.rhs().toBigDecimal().longValueExact()) forced = true;
                }
                // 0-3 and 1-2 are uncrossed when 0 precedes 1 and 3 precedes 2, or neither
                boolean crossed = below != above;
                assertEquals(crossed, forced, "x_0_1=" + below + " x_3_2=" + above);
            }
        }
    }

    @Test
    public void edgesSharingAnEndpointNeverCross() throws IOException {
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 0", "n 2 1", "e 0 2", "e 1 2");
        assertTrue(CrossingConstraints.candidatePairs(g).isEmpty());
        assertEquals(2, CrossingConstraints.candidatePairs(completeTwoByTwo()).size());
    }

    @Test
    public void totalSumsAllIndicators() throws IOException {
        LayeredGraph g = completeTwoByTwo();
        Program p = new Program();
        Constraint total = CrossingConstraints.total(g, p);
        assertEquals("+ total - c_0_2_1_3 - c_0_3_1_2 >= 0", total.toString());
        assertEquals(VarType.GENERAL, p.typeOf(VariableKey.TOTAL));
    }

    @Test
    public void bottleneckSumsEveryCrossingOfAnEdge() throws IOException {
        // 0-3 has no partner: 0-4 is its sibling and 2-3 shares its target
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 0", "n 2 0", "n 3 1", "n 4 1",
                "e 0 3", "e 0 4", "e 2 3");
        Program p = new Program();
        List<Constraint> cs = CrossingConstraints.bottleneck(g, p);
        assertEquals(2, cs.size());
        assertEquals("+ bottleneck - c_0_4_2_3 >= 0", cs.get(0).toString());
        assertEquals("+ bottleneck - c_0_4_2_3 >= 0", cs.get(1).toString());

        Program k = new Program();
        List<Constraint> all = CrossingConstraints.bottleneck(completeTwoByTwo(), k);
        assertEquals(4, all.size());
        for (Constraint c : all) assertEquals(2, c.terms().size());
    }

    @Test
    public void bottleneckCountsBothMembers() throws IOException {
        // 1-3 is the second member of its pair with 0-4 and the first of its pair with 2-5
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 0", "n 2 0", "n 3 1", "n 4 1", "n 5 1",
                "e 0 4", "e 1 3", "e 2 3", "e 2 5");
        Program p = new Program();
        List<Constraint> cs = CrossingConstraints.bottleneck(g, p);
        Constraint middle = null;
        for (Constraint c : cs) {
            if (c.toString().contains("c_0_4_1_3") && c.toString().contains("c_1_3_2_5")) middle = c;
        }
        assertNotNull(middle);
        assertEquals(3, middle.terms().size());
        CrossingConstraints.crossings(g, p);
        p.setObjective(Objective.linear(VariableKey.BOTTLENECK));
        p.addAll(cs);
        p.checkDeclarations();
    }
}
