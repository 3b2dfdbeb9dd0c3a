package com.layeredilp;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A layered graph: nodes on contiguous 0-based layers and edges between
 * adjacent layers. Parses (and writes) the line-oriented sgf format:
 * <pre>
 *   c comment
 *   t name [nodes edges layers]
 *   n id layer [position]
 *   e source target
 * </pre>
 * The graph is read-only once {@link #checkLayers()} has passed.
 */
public class LayeredGraph {
    private String name;
    private final List<String> comments = new ArrayList<>();
    private final Map<Integer, Node> nodes = new LinkedHashMap<>();
    private final List<List<Node>> layers = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    public LayeredGraph(String name) { this.name = name; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<String> getComments() { return Collections.unmodifiableList(comments); }
    public void addComment(String comment) { comments.add(comment); }

    public Node addNode(int id, int layer) { return addNode(id, layer, Node.UNPLACED); }

    /** Registers a node, extending the layer list as needed. */
    public Node addNode(int id, int layer, int position) {
        if (id < 0 || layer < 0) throw new IllegalArgumentException("Node " + id + " on layer " + layer + ": negative value");
        if (nodes.containsKey(id)) {
            throw new IllegalArgumentException("Duplicate node " + id
                    + " (already on layer " + nodes.get(id).layer() + ")");
        }
        Node node = new Node(id, layer, position);
        while (layers.size() <= layer) layers.add(new ArrayList<>());
        layers.get(layer).add(node);
        nodes.put(id, node);
        return node;
    }

    /**
     * Adds an edge between two registered nodes on adjacent layers. An edge
     * given top-down is turned around so that its source is the lower node.
     */
    public Edge addEdge(int sourceId, int targetId) {
        Node a = nodes.get(sourceId);
        Node b = nodes.get(targetId);
        if (a == null) throw new IllegalArgumentException("Edge " + sourceId + " " + targetId + ": missing node " + sourceId);
        if (b == null) throw new IllegalArgumentException("Edge " + sourceId + " " + targetId + ": missing node " + targetId);
        if (a.layer() == b.layer()) {
            throw new IllegalArgumentException("Edge " + sourceId + " " + targetId
                    + ": nodes are on the same layer " + a.layer());
        }
        Node lower = a.layer() < b.layer() ? a : b;
        Node upper = a.layer() < b.layer() ? b : a;
        if (upper.layer() - lower.layer() != 1) {
            throw new IllegalArgumentException("Edge " + sourceId + " " + targetId
                    + ": nodes not on adjacent layers (" + a.layer() + " and " + b.layer() + ")");
        }
        Edge edge = new Edge(lower, upper, lower.edgesTo(upper));
        lower.addUpEdge(edge);
        upper.addDownEdge(edge);
        edges.add(edge);
        return edge;
    }

    /** Fails if some layer below the highest one has no nodes. */
    public void checkLayers() {
        if (layers.isEmpty()) throw new IllegalArgumentException("Graph has no nodes");
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i).isEmpty()) {
                throw new IllegalArgumentException("Layer " + i + " has no nodes");
            }
        }
    }

    public Node getNode(int id) { return nodes.get(id); }
    public Collection<Node> getNodes() { return Collections.unmodifiableCollection(nodes.values()); }
    public List<Edge> getEdges() { return Collections.unmodifiableList(edges); }
    public int getLayerCount() { return layers.size(); }
    public int getNodeCount() { return nodes.size(); }
    public int getEdgeCount() { return edges.size(); }

    /** Nodes of one layer in input order. */
    public List<Node> getLayer(int layer) { return Collections.unmodifiableList(layers.get(layer)); }

    public int layerSize(int layer) { return layers.get(layer).size(); }

    /** Largest node count over all layers; bounds positions and linearizations. */
    public int maxLayerSize() {
        int max = 0;
        for (List<Node> l : layers) max = Math.max(max, l.size());
        return max;
    }

    public static LayeredGraph readFromFile(String filename) throws IOException {
        try (BufferedReader br = new BufferedReader(new FileReader(filename))) {
            return read(br, baseName(filename));
        }
    }

    /**
     * Reads an sgf description. Format problems surface as IOException,
     * structural ones (duplicate node, bad edge, empty layer) as
     * IllegalArgumentException; both carry the line number.
     */
    public static LayeredGraph read(BufferedReader br, String defaultName) throws IOException {
        LayeredGraph g = new LayeredGraph(defaultName);
        String line;
        int lineNumber = 0;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            String t = line.trim();
            if (t.isEmpty()) continue;
            String[] tok = t.split("\\s+");
            try {
                switch (tok[0]) {
                    case "c":
                        g.addComment(t.substring(1).trim());
                        break;
                    case "t":
                        if (tok.length > 1) g.setName(tok[1]);
                        break;
                    case "n":
                        if (tok.length < 3) throw new IOException("Line " + lineNumber + ": expected 'n id layer [position]', got: " + t);
                        g.addNode(Integer.parseInt(tok[1]), Integer.parseInt(tok[2]),
                                tok.length > 3 ? Integer.parseInt(tok[3]) : Node.UNPLACED);
                        break;
                    case "e":
                        if (tok.length < 3) throw new IOException("Line " + lineNumber + ": expected 'e source target', got: " + t);
                        g.addEdge(Integer.parseInt(tok[1]), Integer.parseInt(tok[2]));
                        break;
                    default:
                        throw new IOException("Line " + lineNumber + ": unknown record '" + tok[0] + "'");
                }
            } catch (NumberFormatException e) {
                throw new IOException("Line " + lineNumber + ": not a number in: " + t, e);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Line " + lineNumber + ": " + e.getMessage(), e);
            }
        }
        g.checkLayers();
        return g;
    }

    /** Writes comments, the tag line, nodes by layer and position, then edges. */
    public void write(PrintWriter out) {
        for (String c : comments) out.println("c " + c);
        out.printf("t %s %d %d %d%n", name, nodes.size(), edges.size(), layers.size());
        List<Node> sorted = new ArrayList<>(nodes.values());
        sorted.sort(Comparator.comparingInt(Node::layer)
                .thenComparingInt(Node::position)
                .thenComparingInt(Node::id));
        for (Node n : sorted) {
            if (n.isPlaced()) out.printf("n %d %d %d%n", n.id(), n.layer(), n.position());
            else out.printf("n %d %d%n", n.id(), n.layer());
        }
        for (Edge e : edges) out.printf("e %d %d%n", e.source().id(), e.target().id());
        out.flush();
    }

    /** File name without directory and extension. */
    static String baseName(String path) {
        String base = Paths.get(path).getFileName().toString();
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
