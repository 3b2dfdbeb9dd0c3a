package com.layeredilp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** A node of a layered graph; identity and ordering come from its numeric id. */
public final class Node implements Comparable<Node> {
    /** Position of a node whose place on its layer is not known. */
    public static final int UNPLACED = -1;

    private final int id;
    private final int layer;
    private final int position;
    private final List<Edge> upEdges = new ArrayList<>();
    private final List<Edge> downEdges = new ArrayList<>();

    Node(int id, int layer, int position) {
        if (layer < 0) throw new IllegalArgumentException("Node " + id + " has negative layer " + layer);
        this.id = id;
        this.layer = layer;
        this.position = position;
    }

    public int id() { return id; }
    public int layer() { return layer; }
    public int position() { return position; }
    public boolean isPlaced() { return position != UNPLACED; }

    /** Edges to the next higher layer, in input order. */
    public List<Edge> upEdges() { return Collections.unmodifiableList(upEdges); }

    /** Edges to the next lower layer, in input order. */
    public List<Edge> downEdges() { return Collections.unmodifiableList(downEdges); }

    public Set<Node> upNeighbors() {
        Set<Node> s = new LinkedHashSet<>();
        for (Edge e : upEdges) s.add(e.target());
        return s;
    }

    void addUpEdge(Edge e) { upEdges.add(e); }
    void addDownEdge(Edge e) { downEdges.add(e); }

    /** Number of edges from this node to {@code target} already recorded. */
    int edgesTo(Node target) {
        int count = 0;
        for (Edge e : upEdges) if (e.target() == target) count++;
        return count;
    }

    @Override public int compareTo(Node o) { return Integer.compare(id, o.id); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Node)) return false;
        return id == ((Node) obj).id;
    }

    @Override public int hashCode() { return Integer.hashCode(id); }

    @Override public String toString() { return id + "@" + layer; }
}
