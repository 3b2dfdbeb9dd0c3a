package com.layeredilp;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a solver solution listing back into a placed layered graph. Nodes
 * come from the position variables p_i_L, edges from the crossing
 * indicators c_i_j_k_l (every edge has at least its own marker), whatever
 * their value.
 */
public final class SolutionDecoder {
    private static final Logger log = LoggerFactory.getLogger(SolutionDecoder.class);

    static final String INPUT_FILE = "InputFile";
    static final String BEGIN = "BeginSolution";
    static final String END = "EndSolution";
    private static final String[] RUN_INFO = {"Runtime", "TimedOut", "ProvedOptimal", "Objective"};

    private SolutionDecoder() {}

    public static LayeredGraph readFromFile(String filename) throws IOException {
        try (BufferedReader br = new BufferedReader(new FileReader(filename))) {
            return decode(br, LayeredGraph.baseName(filename));
        }
    }

    /**
     * @param defaultName graph name used when the listing has no InputFile line
     * @throws IOException if either sentinel is missing or a position value is not a number
     */
    public static LayeredGraph decode(BufferedReader br, String defaultName) throws IOException {
        List<String> comments = new ArrayList<>();
        String name = defaultName;
        boolean seenInputFile = false;

        String line;
        int lineNumber = 0;
        boolean begun = false;
        while (!begun && (line = br.readLine()) != null) {
            lineNumber++;
            String t = line.trim();
            if (t.isEmpty()) continue;
            String first = t.split("\\s+")[0];
            if (first.equals(BEGIN)) {
                begun = true;
            } else if (!seenInputFile) {
                if (first.equals(INPUT_FILE)) {
                    String[] tok = t.split("\\s+");
                    if (tok.length > 1) name = LayeredGraph.baseName(tok[1]);
                    seenInputFile = true;
                } else {
                    comments.add(t);
                }
            } else if (isRunInfo(first)) {
                comments.add(t);
            }
        }
        if (!begun) throw new IOException("No " + BEGIN + " line in solution");

        List<int[]> nodes = new ArrayList<>();        // id, layer, position
        Set<List<Integer>> edges = new LinkedHashSet<>();
        boolean ended = false;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            String t = line.trim();
            if (t.equals(END)) { ended = true; break; }
            if (t.isEmpty()) continue;
            String[] tok = t.split("\\s+");
            VariableKey v = VariableKey.parse(tok[0]);
            if (v == null || tok.length < 2) {
                log.debug("line {}: ignored '{}'", lineNumber, t);
                continue;
            }
            switch (v.kind()) {
                case POSITION:
                    nodes.add(new int[]{v.nodeId(0), v.layer(), position(tok[1], lineNumber)});
                    break;
                case CROSSING:
                    edges.add(List.of(v.nodeId(0), v.nodeId(1)));
                    edges.add(List.of(v.nodeId(2), v.nodeId(3)));
                    break;
                default:
                    break;
            }
        }
        if (!ended) throw new IOException("No " + END + " line in solution");

        LayeredGraph g = new LayeredGraph(name);
        for (String c : comments) g.addComment(c);
        for (int[] n : nodes) g.addNode(n[0], n[1], n[2]);
        for (List<Integer> e : edges) g.addEdge(e.get(0), e.get(1));
        g.checkLayers();
        log.debug("decoded {} nodes and {} edges", g.getNodeCount(), g.getEdgeCount());
        return g;
    }

    /** Nearest integer to a solver value such as 2.9999999. */
    static int position(String value, int lineNumber) throws IOException {
        double v;
        try {
            v = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IOException("Line " + lineNumber + ": position is not a number: " + value, e);
        }
        double rounded = Math.floor(v + 0.5);
        if (Double.isNaN(rounded) || rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
            throw new IOException("Line " + lineNumber + ": position is not a number: " + value);
        }
        return (int) rounded;
    }

    private static boolean isRunInfo(String word) {
        for (String s : RUN_INFO) {
            if (s.equals(word)) return true;
        }
        return false;
    }
}
