package com.layeredilp;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Generated programs solved with ojAlgo; the optimal values are checked
 * against hand-computed optima and fed back through the decoder.
 */
public class SolveEndToEndTest {

    private static Map<VariableKey, Double> solve(IlpConfig.Builder b, LayeredGraph g) {
        Map<VariableKey, Double> values = OjAlgoSolver.solve(new ProgramAssembler(b.build()).assemble(g));
        assertNotNull(values, "no optimum");
        return values;
    }

    /** Every layer's positions are exactly 0 .. size-1. */
    private static void assertContiguous(LayeredGraph placed) {
        for (int layer = 0; layer < placed.getLayerCount(); layer++) {
            Set<Integer> seen = new HashSet<>();
            for (Node n : placed.getLayer(layer)) {
                assertTrue(n.position() >= 0 && n.position() < placed.layerSize(layer), n.toString());
                assertTrue(seen.add(n.position()), "two nodes at " + n.position() + " on layer " + layer);
            }
        }
    }

    @Test
    public void uncrossesTwoEdgesAndDecodes() throws IOException {
        LayeredGraph g = CrossingConstraintsTest.twoEdges();
        Map<VariableKey, Double> values = solve(new IlpConfig.Builder().objective(ObjectiveKind.TOTAL), g);
        assertEquals(0, OjAlgoSolver.rounded(values, VariableKey.TOTAL));

        LayeredGraph placed = OjAlgoSolver.decode("/work/pair.lp", values);
        assertEquals("pair", placed.getName());
        assertEquals(4, placed.getNodeCount());
        assertEquals(2, placed.getEdgeCount());
        assertContiguous(placed);
        boolean aBeforeB = placed.getNode(0).position() < placed.getNode(1).position();
        boolean dBeforeC = placed.getNode(3).position() < placed.getNode(2).position();
        assertEquals(aBeforeB, dBeforeC);
    }

    @Test
    public void completeTwoByTwoCrossesOnce() throws IOException {
        LayeredGraph g = CrossingConstraintsTest.completeTwoByTwo();
        assertEquals(1, OjAlgoSolver.rounded(
                solve(new IlpConfig.Builder().objective(ObjectiveKind.TOTAL), g), VariableKey.TOTAL));
        assertEquals(1, OjAlgoSolver.rounded(
                solve(new IlpConfig.Builder().objective(ObjectiveKind.BOTTLENECK), g), VariableKey.BOTTLENECK));
    }

    @Test
    public void infeasibleCeiling() throws IOException {
        LayeredGraph g = CrossingConstraintsTest.completeTwoByTwo();
        Program p = new ProgramAssembler(new IlpConfig.Builder()
                .objective(ObjectiveKind.BOTTLENECK).total(0).build()).assemble(g);
        assertNull(OjAlgoSolver.solve(p));
    }

    @Test
    public void orderIsTransitiveAndMatchesPositions() throws IOException {
        LayeredGraph g = LayeredGraphIOTest.read("t reversed",
                "n 0 0", "n 1 0", "n 2 0", "n 3 0", "n 4 1", "n 5 1", "n 6 1", "n 7 1",
                "e 0 7", "e 1 6", "e 2 5", "e 3 4");
        Map<VariableKey, Double> values = solve(new IlpConfig.Builder().objective(ObjectiveKind.TOTAL), g);
        assertEquals(0, OjAlgoSolver.rounded(values, VariableKey.TOTAL));

        LayeredGraph placed = OjAlgoSolver.decode("reversed.lp", values);
        assertContiguous(placed);
        for (int layer = 0; layer < 2; layer++) {
            List<Node> nodes = g.getLayer(layer);
            for (Node i : nodes) {
                for (Node j : nodes) {
                    if (i == j) continue;
                    boolean precedes = OjAlgoSolver.rounded(values, VariableKey.precedes(i, j)) == 1;
                    boolean before = placed.getNode(i.id()).position() < placed.getNode(j.id()).position();
                    assertEquals(before, precedes, i + " " + j);
                }
            }
        }
    }

    @Test
    public void straightEdgesHaveNoStretch() throws IOException {
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 0", "n 2 1", "n 3 1", "n 4 1", "e 0 2", "e 1 4");
        Map<VariableKey, Double> values = solve(new IlpConfig.Builder().objective(ObjectiveKind.STRETCH), g);
        assertEquals(0.0, values.get(VariableKey.TOTAL_STRETCH), 1e-6);

        LayeredGraph placed = OjAlgoSolver.decode("stretch.lp", values);
        assertContiguous(placed);
        // the outer nodes are taken by the edges
        assertEquals(1, placed.getNode(3).position());

        Map<VariableKey, Double> bn = solve(new IlpConfig.Builder().objective(ObjectiveKind.BN_STRETCH), g);
        assertEquals(0.0, bn.get(VariableKey.BOTTLENECK_STRETCH), 1e-6);
    }

    @Test
    public void crossedEdgesStretch() throws IOException {
        // node 0 cannot sit straight below both of its neighbors
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 0", "n 2 1", "n 3 1", "e 0 2", "e 0 3");
        Map<VariableKey, Double> values = solve(new IlpConfig.Builder().objective(ObjectiveKind.STRETCH), g);
        assertEquals(1.0, values.get(VariableKey.TOTAL_STRETCH), 1e-6);
    }

    @Test
    public void starVerticality() throws IOException {
        LayeredGraph g = LayeredGraphIOTest.read("n 0 0", "n 1 1", "n 2 1", "n 3 1", "e 0 1", "e 0 2", "e 0 3");
        Map<VariableKey, Double> values = solve(new IlpConfig.Builder().objective(ObjectiveKind.VERTICAL), g);
        assertEquals(2, OjAlgoSolver.rounded(values, VariableKey.TOTAL_VERTICAL));

        LayeredGraph placed = OjAlgoSolver.decode("star.lp", values);
        assertEquals(1, placed.getNode(0).position());

        Map<VariableKey, Double> bn = solve(new IlpConfig.Builder().objective(ObjectiveKind.BN_VERTICAL), g);
        assertEquals(1, OjAlgoSolver.rounded(bn, VariableKey.BOTTLENECK_VERTICAL));
    }
}
