package com.layeredilp;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class VerticalityConstraintsTest {

    /** Node 0 below three nodes, with a parallel copy of edge 0-1. */
    private static LayeredGraph star() throws IOException {
        return LayeredGraphIOTest.read("n 0 0", "n 1 1", "n 2 1", "n 3 1", "e 0 1", "e 0 2", "e 0 3", "e 0 1");
    }

    @Test
    public void distancesBoundTheOffset() throws IOException {
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 1", "e 0 1");
        Program p = new Program();
        List<Constraint> cs = VerticalityConstraints.distances(g, p);
        assertEquals("+ d_0_1_0 + p_0_0 - p_1_1 >= 0", cs.get(0).toString());
        assertEquals("+ d_0_1_0 - p_0_0 + p_1_1 >= 0", cs.get(1).toString());
        assertEquals(VarType.GENERAL, p.typeOf(VariableKey.parse("d_0_1_0")));
    }

    @Test
    public void linearizationUpToLargestLayer() throws IOException {
        LayeredGraph g = star();
        Program p = new Program();
        List<Constraint> cs = VerticalityConstraints.linearized(g, p);
        assertEquals(4 * 2, cs.size());
        assertEquals("+ d_0_1_0 - d_0_1_1 <= 1", cs.get(0).toString());
        assertEquals("+ d_0_1_0 - d_0_1_2 <= 2", cs.get(1).toString());
        assertTrue(p.isDeclared(VariableKey.parse("d_0_1.1_2")));
    }

    /** q = d_0 + 2 (d_1 + ... ) equals n^2 when every d_i sits at max(n - i, 0). */
    @Test
    public void linearizedSquareIdentity() throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i <= 11; i++) lines.add("n " + i + " " + (i == 0 ? 0 : 1));
        lines.add("e 0 1");
        LayeredGraph g = LayeredGraphIOTest.read(lines.toArray(new String[0]));
        assertEquals(11, g.maxLayerSize());
        Constraint q = VerticalityConstraints.nonverticality(g, new Program()).get(0);

        for (int n : new int[]{0, 1, 2, 5, 10}) {
            long sum = 0;
            long qCoefficient = 0;
            for (Term t : q.terms()) {
                long c = t.coefficient().toBigDecimal().longValueExact();
                VariableKey v = t.variable();
                if (v.kind() == VariableKey.Kind.NONVERTICALITY) qCoefficient = c;
                else sum += c * Math.max(n - v.index(), 0);
            }
            assertEquals(-1, qCoefficient);
            assertEquals((long) n * n, sum, "offset " + n);
        }
    }

    @Test
    public void totalVertical() throws IOException {
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 1", "n 2 1", "e 0 1", "e 0 2");
        Program p = new Program();
        assertEquals("+ q_0_1 + q_0_2 - vertical = 0", VerticalityConstraints.total(g, p).toString());
        assertEquals(VarType.GENERAL, p.typeOf(VariableKey.TOTAL_VERTICAL));
    }

    @Test
    public void minimumOffsetSums() {
        assertEquals(2, VerticalityConstraints.minimumOffsetSum(3, 0));
        assertEquals(4, VerticalityConstraints.minimumOffsetSum(4, 0));
        assertEquals(1, VerticalityConstraints.minimumOffsetSum(4, 1));
        assertEquals(6, VerticalityConstraints.minimumOffsetSum(5, 0));
        assertEquals(2, VerticalityConstraints.minimumOffsetSum(5, 1));
    }

    @Test
    public void lowerBoundsCountDistinctNeighbors() throws IOException {
        LayeredGraph g = star();
        Program p = new Program();
        List<Constraint> cs = VerticalityConstraints.lowerBounds(g, p);
        assertEquals(1, cs.size());
        assertEquals("+ d_0_1_0 + d_0_2_0 + d_0_3_0 >= 2", cs.get(0).toString());
    }

    @Test
    public void lowerBoundsFromBelow() throws IOException {
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 0", "n 2 0", "n 3 0", "n 4 1",
                "e 0 4", "e 1 4", "e 2 4", "e 3 4");
        List<Constraint> cs = VerticalityConstraints.lowerBounds(g, new Program());
        assertEquals(2, cs.size());
        assertEquals("+ d_0_4_0 + d_1_4_0 + d_2_4_0 + d_3_4_0 >= 4", cs.get(0).toString());
        assertEquals("+ d_0_4_1 + d_1_4_1 + d_2_4_1 + d_3_4_1 >= 1", cs.get(1).toString());
    }

    @Test
    public void bottleneckAndQuadratic() throws IOException {
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 1", "e 0 1");
        Program p = new Program();
        List<Constraint> bn = VerticalityConstraints.bottleneck(g, p);
        assertEquals("+ bn_vertical - d_0_1_0 >= 0", bn.get(0).toString());
        assertEquals(List.of("+ 2 d_0_1_0^2"), VerticalityConstraints.quadraticObjective(g).formatTerms());
    }
}
