package com.layeredilp;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for one run. Conflicting combinations are rejected by
 * {@link Builder#build()}, before any constraint is generated.
 */
public final class IlpConfig {
    public enum Mode { COMPILE, DECODE }     // sgf -> lp / solution -> sgf
    public final Mode mode;

    public final ObjectiveKind objective;   // what to minimize (COMPILE only)

    // ceilings; null when absent
    public final Long total;                // total crossings
    public final Long bottleneck;           // crossings of any one edge
    public final BigDecimal stretch;        // total stretch
    public final BigDecimal bnStretch;      // stretch of any one edge
    public final Long vertical;             // total non-verticality
    public final Long bnVertical;           // non-verticality of any one edge

    public final Long seed;                 // permute constraints if set
    public final Integer bipartite;         // subset limit for the bipartite scan (0 = none)

    private IlpConfig(Builder b) {
        this.mode = b.mode;
        this.objective = b.objective;
        this.total = b.total;
        this.bottleneck = b.bottleneck;
        this.stretch = b.stretch;
        this.bnStretch = b.bnStretch;
        this.vertical = b.vertical;
        this.bnVertical = b.bnVertical;
        this.seed = b.seed;
        this.bipartite = b.bipartite;
    }

    public boolean needsCrossings() {
        return objective == ObjectiveKind.TOTAL || objective == ObjectiveKind.BOTTLENECK
                || total != null || bottleneck != null;
    }

    /** Raw displacements z_u_v, also used by the quadratic stretch objective. */
    public boolean needsRawStretch() {
        return needsStretch() || objective == ObjectiveKind.QUAD_STRETCH;
    }

    /** Absolute stretch s_u_v. */
    public boolean needsStretch() {
        return objective == ObjectiveKind.STRETCH || objective == ObjectiveKind.BN_STRETCH
                || stretch != null || bnStretch != null;
    }

    public boolean needsTotalVertical() {
        return objective == ObjectiveKind.VERTICAL || vertical != null;
    }

    public boolean needsBottleneckVertical() {
        return objective == ObjectiveKind.BN_VERTICAL || bnVertical != null;
    }

    /** Any member of the verticality family, objective or ceiling. */
    public boolean needsVerticality() {
        return needsTotalVertical() || needsBottleneckVertical() || objective == ObjectiveKind.QUAD_VERTICAL;
    }

    /** Positions must be 0..L-1 unless only relative order matters. */
    public boolean contiguousPositions() { return !needsVerticality(); }

    public static final class Builder {
        private Mode mode = Mode.COMPILE;
        private ObjectiveKind objective;
        private Long total, bottleneck, vertical, bnVertical, seed;
        private BigDecimal stretch, bnStretch;
        private Integer bipartite;

        public Builder mode(Mode m){ this.mode=m; return this; }
        public Builder objective(ObjectiveKind o){ this.objective=o; return this; }
        public Builder total(long v){ this.total=v; return this; }
        public Builder bottleneck(long v){ this.bottleneck=v; return this; }
        public Builder stretch(BigDecimal v){ this.stretch=v; return this; }
        public Builder bnStretch(BigDecimal v){ this.bnStretch=v; return this; }
        public Builder vertical(long v){ this.vertical=v; return this; }
        public Builder bnVertical(long v){ this.bnVertical=v; return this; }
        public Builder seed(long v){ this.seed=v; return this; }
        public Builder bipartite(int v){ this.bipartite=v; return this; }

        public IlpConfig build(){
            List<String> problems = validate();
            if (!problems.isEmpty()) throw new IllegalArgumentException(String.join("; ", problems));
            return new IlpConfig(this);
        }

        private List<String> validate() {
            List<String> problems = new ArrayList<>();
            boolean anyCompileOption = objective != null || total != null || bottleneck != null
                    || stretch != null || bnStretch != null || vertical != null || bnVertical != null
                    || seed != null || bipartite != null;
            if (mode == Mode.DECODE) {
                if (anyCompileOption) problems.add("decoding a solution takes no objective options");
                return problems;
            }
            if (objective == null) problems.add("an objective is required");
            nonNegative(problems, "total", total);
            nonNegative(problems, "bottleneck", bottleneck);
            nonNegative(problems, "vertical", vertical);
            nonNegative(problems, "bn_vertical", bnVertical);
            if (stretch != null && stretch.signum() < 0) problems.add("stretch ceiling must not be negative");
            if (bnStretch != null && bnStretch.signum() < 0) problems.add("bn_stretch ceiling must not be negative");

            boolean stretchFamily = (objective != null && objective.family() == ObjectiveKind.Family.STRETCH)
                    || stretch != null || bnStretch != null;
            boolean verticalFamily = (objective != null && objective.family() == ObjectiveKind.Family.VERTICAL)
                    || vertical != null || bnVertical != null;
            if (stretchFamily && verticalFamily) {
                problems.add("stretch needs contiguous positions and verticality needs gaps; they cannot be combined");
            }
            if (bipartite != null) {
                if (bipartite < 0) problems.add("bipartite limit must not be negative");
                if (objective != ObjectiveKind.VERTICAL && vertical == null) {
                    problems.add("bipartite scan only applies to total verticality");
                }
            }
            return problems;
        }

        private static void nonNegative(List<String> problems, String name, Long v) {
            if (v != null && v < 0) problems.add(name + " ceiling must not be negative");
        }
    }
}
