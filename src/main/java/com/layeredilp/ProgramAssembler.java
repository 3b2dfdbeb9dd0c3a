package com.layeredilp;

import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.layeredilp.Constraint.Relation.LE;

/**
 * Builds the complete program for one graph and one configuration. The
 * ordering constraints always come first since later families refer to
 * their position variables; then the families the objective and the
 * ceilings call for; then the ceilings themselves.
 */
public final class ProgramAssembler {
    private static final Logger log = LoggerFactory.getLogger(ProgramAssembler.class);

    private final IlpConfig config;
    private final Random random;    // null: keep generation order

    public ProgramAssembler(IlpConfig config) {
        this(config, config.seed == null ? null : new Random(config.seed));
    }

    public ProgramAssembler(IlpConfig config, Random random) {
        if (config.mode != IlpConfig.Mode.COMPILE) throw new IllegalArgumentException("Not a compile configuration");
        this.config = config;
        this.random = random;
    }

    public Program assemble(LayeredGraph g) {
        g.checkLayers();
        Program p = new Program();
        boolean contiguous = config.contiguousPositions();

        add(p, "triangle", OrderingConstraints.triangle(g, p));
        add(p, contiguous ? "contiguous position" : "position", OrderingConstraints.positions(g, p, contiguous));
        add(p, "edge marker", OrderingConstraints.edgeMarkers(g, p));

        if (config.needsCrossings()) add(p, "crossing", CrossingConstraints.crossings(g, p));
        if (config.needsRawStretch()) add(p, "raw stretch", StretchConstraints.raw(g, p));
        if (config.needsStretch()) add(p, "stretch", StretchConstraints.absolute(g, p));

        if (config.objective == ObjectiveKind.TOTAL || config.total != null) {
            p.add(CrossingConstraints.total(g, p));
        }
        if (config.objective == ObjectiveKind.BOTTLENECK || config.bottleneck != null) {
            add(p, "bottleneck", CrossingConstraints.bottleneck(g, p));
        }
        if (config.objective == ObjectiveKind.STRETCH || config.stretch != null) {
            p.add(StretchConstraints.total(g, p));
        }
        if (config.objective == ObjectiveKind.BN_STRETCH || config.bnStretch != null) {
            add(p, "bottleneck stretch", StretchConstraints.bottleneck(g, p));
        }

        if (config.needsVerticality()) add(p, "distance", VerticalityConstraints.distances(g, p));
        if (config.needsTotalVertical()) {
            add(p, "linearized distance", VerticalityConstraints.linearized(g, p));
            add(p, "nonverticality", VerticalityConstraints.nonverticality(g, p));
            add(p, "verticality lower bound", VerticalityConstraints.lowerBounds(g, p));
            p.add(VerticalityConstraints.total(g, p));
            if (config.bipartite != null) BipartiteScan.scan(g, config.bipartite);
        }
        if (config.needsBottleneckVertical()) {
            add(p, "bottleneck vertical", VerticalityConstraints.bottleneck(g, p));
        }

        ceiling(p, VariableKey.TOTAL, config.total == null ? null : Fraction.of(config.total));
        ceiling(p, VariableKey.BOTTLENECK, config.bottleneck == null ? null : Fraction.of(config.bottleneck));
        ceiling(p, VariableKey.TOTAL_STRETCH, config.stretch == null ? null : Fraction.of(config.stretch));
        ceiling(p, VariableKey.BOTTLENECK_STRETCH, config.bnStretch == null ? null : Fraction.of(config.bnStretch));
        ceiling(p, VariableKey.TOTAL_VERTICAL, config.vertical == null ? null : Fraction.of(config.vertical));
        ceiling(p, VariableKey.BOTTLENECK_VERTICAL, config.bnVertical == null ? null : Fraction.of(config.bnVertical));

        p.setObjective(objective(g));

        if (random != null) p.permute(random);
        p.checkDeclarations();
        return p;
    }

    private Objective objective(LayeredGraph g) {
        switch (config.objective) {
            case QUAD_STRETCH: return StretchConstraints.quadraticObjective(g);
            case QUAD_VERTICAL: return VerticalityConstraints.quadraticObjective(g);
            default: return Objective.linear(VariableKey.scalar(config.objective.label()));
        }
    }

    private static void ceiling(Program p, VariableKey measure, Fraction cap) {
        if (cap == null) return;
        p.add(new Constraint(List.of(Term.plus(measure)), LE, cap));
    }

    private static void add(Program p, String family, List<Constraint> cs) {
        log.debug("{} constraints: {}", family, cs.size());
        p.addAll(cs);
    }
}
