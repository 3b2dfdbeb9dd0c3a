package com.layeredilp;

import java.util.Arrays;
import java.util.Objects;

/**
 * Structured name of a program variable. The textual form is produced only
 * by {@link #name()} when the program is written, and read back by
 * {@link #parse(String)} when a solution is decoded.
 *
 * <pre>
 *   x_i_j        1 if node i precedes node j on their common layer
 *   c_i_j_k_l    1 if edge ij crosses edge kl; c_u_v_u_v marks edge uv
 *   p_i_L        position of node i on layer L
 *   d_u_v_i      offset of edge uv (i = 0) and its linearization terms
 *   q_u_v        linearized square of the offset of edge uv
 *   z_u_v        signed, layer-normalized displacement of edge uv
 *   s_u_v        stretch of edge uv, |z_u_v|
 *   b_u_v        sign indicator of z_u_v
 * </pre>
 * A repeated edge carries its copy ordinal on the target token, as in
 * {@code z_1_2.1}.
 */
public final class VariableKey {

    public enum Kind {
        PRECEDES("x"),
        CROSSING("c"),
        POSITION("p"),
        DISTANCE("d"),
        NONVERTICALITY("q"),
        RAW_STRETCH("z"),
        STRETCH("s"),
        SIGN("b"),
        SCALAR("");

        private final String prefix;
        Kind(String prefix) { this.prefix = prefix; }
        public String prefix() { return prefix; }
    }

    private static final int[] NONE = new int[0];

    public static final VariableKey TOTAL = scalar("total");
    public static final VariableKey BOTTLENECK = scalar("bottleneck");
    public static final VariableKey TOTAL_STRETCH = scalar("stretch");
    public static final VariableKey BOTTLENECK_STRETCH = scalar("bn_stretch");
    public static final VariableKey TOTAL_VERTICAL = scalar("vertical");
    public static final VariableKey BOTTLENECK_VERTICAL = scalar("bn_vertical");

    private static final VariableKey[] SCALARS = {
            TOTAL, BOTTLENECK, TOTAL_STRETCH, BOTTLENECK_STRETCH, TOTAL_VERTICAL, BOTTLENECK_VERTICAL
    };

    private final Kind kind;
    private final int[] ids;        // node ids, in name order
    private final int[] copies;     // copy ordinal of each edge in the name
    private final int index;        // layer (POSITION) or linearization index (DISTANCE)
    private final String scalar;

    private VariableKey(Kind kind, int[] ids, int[] copies, int index, String scalar) {
        this.kind = kind;
        this.ids = ids;
        this.copies = copies;
        this.index = index;
        this.scalar = scalar;
    }

    public static VariableKey precedes(Node a, Node b) {
        return new VariableKey(Kind.PRECEDES, new int[]{a.id(), b.id()}, NONE, 0, null);
    }

    public static VariableKey crossing(Edge e, Edge f) {
        return new VariableKey(Kind.CROSSING,
                new int[]{e.source().id(), e.target().id(), f.source().id(), f.target().id()},
                new int[]{e.copy(), f.copy()}, 0, null);
    }

    /** The self-crossing of an edge; pinned to 0 so the edge shows up in a solution. */
    public static VariableKey edgeMarker(Edge e) { return crossing(e, e); }

    public static VariableKey position(Node n) {
        return new VariableKey(Kind.POSITION, new int[]{n.id()}, NONE, n.layer(), null);
    }

    public static VariableKey distance(Edge e, int i) { return edgeKey(Kind.DISTANCE, e, i); }
    public static VariableKey nonverticality(Edge e) { return edgeKey(Kind.NONVERTICALITY, e, 0); }
    public static VariableKey rawStretch(Edge e) { return edgeKey(Kind.RAW_STRETCH, e, 0); }
    public static VariableKey stretch(Edge e) { return edgeKey(Kind.STRETCH, e, 0); }
    public static VariableKey sign(Edge e) { return edgeKey(Kind.SIGN, e, 0); }

    public static VariableKey scalar(String name) {
        return new VariableKey(Kind.SCALAR, NONE, NONE, 0, name);
    }

    private static VariableKey edgeKey(Kind kind, Edge e, int index) {
        return new VariableKey(kind, new int[]{e.source().id(), e.target().id()}, new int[]{e.copy()}, index, null);
    }

    public Kind kind() { return kind; }

    /** The i-th node id appearing in the name. */
    public int nodeId(int i) { return ids[i]; }

    /** Copy ordinal of the i-th edge in the name (0 unless the edge is repeated). */
    public int edgeCopy(int i) { return copies[i]; }

    /** Layer of a position variable. */
    public int layer() {
        if (kind != Kind.POSITION) throw new IllegalStateException(name() + " is not a position variable");
        return index;
    }

    /** Linearization index of a distance variable (0 for the offset itself). */
    public int index() { return index; }

    public boolean isEdgeMarker() {
        return kind == Kind.CROSSING && ids[0] == ids[2] && ids[1] == ids[3] && copies[0] == copies[1];
    }

    public String name() {
        switch (kind) {
            case SCALAR:
                return scalar;
            case PRECEDES:
                return "x_" + ids[0] + "_" + ids[1];
            case CROSSING:
                return "c_" + ids[0] + "_" + edgeTarget(ids[1], copies[0])
                        + "_" + ids[2] + "_" + edgeTarget(ids[3], copies[1]);
            case POSITION:
                return "p_" + ids[0] + "_" + index;
            case DISTANCE:
                return "d_" + ids[0] + "_" + edgeTarget(ids[1], copies[0]) + "_" + index;
            default:
                return kind.prefix() + "_" + ids[0] + "_" + edgeTarget(ids[1], copies[0]);
        }
    }

    private static String edgeTarget(int target, int copy) {
        return copy > 0 ? target + "." + copy : Integer.toString(target);
    }

    /**
     * Reads a variable name back.
     *
     * @return the key, or null if the name is not one this program produces
     */
    public static VariableKey parse(String name) {
        for (VariableKey s : SCALARS) {
            if (s.scalar.equals(name)) return s;
        }
        String[] tok = name.split("_", -1);
        if (tok.length < 2 || tok[0].length() != 1) return null;
        try {
            switch (tok[0]) {
                case "x":
                    if (tok.length != 3) return null;
                    return new VariableKey(Kind.PRECEDES, new int[]{id(tok[1]), id(tok[2])}, NONE, 0, null);
                case "c":
                    if (tok.length != 5) return null;
                    return new VariableKey(Kind.CROSSING,
                            new int[]{id(tok[1]), targetId(tok[2]), id(tok[3]), targetId(tok[4])},
                            new int[]{copy(tok[2]), copy(tok[4])}, 0, null);
                case "p":
                    if (tok.length != 3) return null;
                    return new VariableKey(Kind.POSITION, new int[]{id(tok[1])}, NONE, id(tok[2]), null);
                case "d":
                    if (tok.length != 4) return null;
                    return new VariableKey(Kind.DISTANCE, new int[]{id(tok[1]), targetId(tok[2])},
                            new int[]{copy(tok[2])}, id(tok[3]), null);
                default:
                    Kind kind = edgeKind(tok[0]);
                    if (kind == null || tok.length != 3) return null;
                    return new VariableKey(kind, new int[]{id(tok[1]), targetId(tok[2])},
                            new int[]{copy(tok[2])}, 0, null);
            }
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Kind edgeKind(String prefix) {
        switch (prefix) {
            case "q": return Kind.NONVERTICALITY;
            case "z": return Kind.RAW_STRETCH;
            case "s": return Kind.STRETCH;
            case "b": return Kind.SIGN;
            default: return null;
        }
    }

    private static int id(String token) {
        int v = Integer.parseInt(token);
        if (v < 0 || token.startsWith("+")) throw new NumberFormatException(token);
        return v;
    }

    private static int targetId(String token) {
        int dot = token.indexOf('.');
        return id(dot < 0 ? token : token.substring(0, dot));
    }

    private static int copy(String token) {
        int dot = token.indexOf('.');
        return dot < 0 ? 0 : id(token.substring(dot + 1));
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VariableKey)) return false;
        VariableKey o = (VariableKey) obj;
        return kind == o.kind && index == o.index
                && Arrays.equals(ids, o.ids)
                && Arrays.equals(copies, o.copies)
                && Objects.equals(scalar, o.scalar);
    }

    @Override public int hashCode() {
        int h = kind.hashCode();
        h = 31 * h + Arrays.hashCode(ids);
        h = 31 * h + Arrays.hashCode(copies);
        h = 31 * h + index;
        return 31 * h + Objects.hashCode(scalar);
    }

    @Override public String toString() { return name(); }
}
