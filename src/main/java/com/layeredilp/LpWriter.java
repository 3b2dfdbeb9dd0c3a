package com.layeredilp;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a program in the CPLEX LP text format. Constraints are written one
 * at a time as they are formatted; long term lists are wrapped so that no
 * line exceeds the solver's limit.
 */
public final class LpWriter {
    public static final int MAX_TERMS_IN_LINE = 20;
    static final String INDENT = "  ";
    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public LpWriter() { this(Clock.systemUTC()); }

    public LpWriter(Clock clock) { this.clock = clock; }

    /**
     * @param invocation echoed in the header, typically the command line
     * @param comments   input comments, passed through as LP comments
     */
    public void write(Program program, String invocation, List<String> comments, Writer out) throws IOException {
        program.checkDeclarations();

        out.write("\\ " + invocation + "\n");
        out.write("\\ " + TIMESTAMP.format(clock.instant()) + "\n");
        for (String c : comments) out.write("\\ " + c + "\n");

        out.write("Min\n");
        Objective objective = program.getObjective();
        if (objective.isQuadratic()) {
            out.write(INDENT + "[ " + wrap(objective.formatTerms()) + " ]/2\n");
        } else {
            out.write(INDENT + objective.variables().get(0).name() + "\n");
        }

        out.write("st\n");
        for (Constraint c : program.constraints()) {
            List<String> terms = new ArrayList<>(c.terms().size());
            for (Term t : c.terms()) terms.add(t.format());
            out.write(INDENT + wrap(terms) + " " + c.relation().symbol() + " " + c.rhs().toDecimalString() + "\n");
        }

        Map<VariableKey, Fraction[]> bounds = program.bounds();
        if (!bounds.isEmpty()) {
            out.write("Bounds\n");
            for (Map.Entry<VariableKey, Fraction[]> b : bounds.entrySet()) {
                out.write(INDENT + b.getValue()[0].toDecimalString() + " <= " + b.getKey().name()
                        + " <= " + b.getValue()[1].toDecimalString() + "\n");
            }
        }

        for (VarType type : VarType.values()) {
            if (type.section() == null || program.variables(type).isEmpty()) continue;
            List<String> names = new ArrayList<>();
            for (VariableKey v : program.variables(type)) names.add(v.name());
            out.write(type.section() + "\n");
            out.write(INDENT + wrap(names) + "\n");
        }
        out.write("End\n");
        out.flush();
    }

    /** Items separated by blanks, with a line break after every {@link #MAX_TERMS_IN_LINE}. */
    static String wrap(List<String> items) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(i % MAX_TERMS_IN_LINE == 0 ? "\n" + INDENT + INDENT : " ");
            sb.append(items.get(i));
        }
        return sb.toString();
    }
}
