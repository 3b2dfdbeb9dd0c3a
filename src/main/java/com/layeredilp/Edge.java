package com.layeredilp;

/**
 * An edge between adjacent layers, always directed from the lower layer
 * (source) to the higher one (target). Repeated (source, target) pairs are
 * distinct edges told apart by their copy ordinal.
 */
public final class Edge {
    private final Node source;
    private final Node target;
    private final int copy;     // 0 for the first occurrence of the pair

    Edge(Node source, Node target, int copy) {
        this.source = source;
        this.target = target;
        this.copy = copy;
    }

    public Node source() { return source; }
    public Node target() { return target; }
    public int copy() { return copy; }

    @Override public String toString() {
        return source.id() + "->" + target.id() + (copy > 0 ? "." + copy : "");
    }
}
