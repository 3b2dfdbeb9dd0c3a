package com.layeredilp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the program minimizes: a single scalar variable, or a sum of squares
 * written with doubled coefficients inside {@code [ ... ]/2}, since the
 * solver halves quadratic objective coefficients.
 */
public final class Objective {
    /** Coefficient printed in front of each square. */
    public static final int SQUARE_COEFFICIENT = 2;

    private final boolean quadratic;
    private final List<VariableKey> variables;

    private Objective(boolean quadratic, List<VariableKey> variables) {
        this.quadratic = quadratic;
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
    }

    public static Objective linear(VariableKey v) {
        return new Objective(false, Collections.singletonList(v));
    }

    public static Objective sumOfSquares(List<VariableKey> vs) {
        if (vs.isEmpty()) throw new IllegalArgumentException("Quadratic objective without terms");
        return new Objective(true, vs);
    }

    public boolean isQuadratic() { return quadratic; }

    /** The scalar for a linear objective, the squared variables otherwise. */
    public List<VariableKey> variables() { return variables; }

    /** The terms as they appear between the brackets, or the bare name. */
    public List<String> formatTerms() {
        List<String> out = new ArrayList<>(variables.size());
        for (VariableKey v : variables) {
            out.add(quadratic ? "+ " + SQUARE_COEFFICIENT + " " + v.name() + "^2" : v.name());
        }
        return out;
    }
}
