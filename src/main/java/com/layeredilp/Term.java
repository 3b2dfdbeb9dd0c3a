package com.layeredilp;

import java.util.Objects;

/** One signed, optionally weighted variable reference on the left-hand side of a constraint. */
public final class Term {
    private final Fraction coefficient;
    private final VariableKey variable;

    public Term(Fraction coefficient, VariableKey variable) {
        this.coefficient = Objects.requireNonNull(coefficient, "coefficient");
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public static Term plus(VariableKey v) { return new Term(Fraction.ONE, v); }
    public static Term minus(VariableKey v) { return new Term(Fraction.ONE.negate(), v); }
    public static Term of(long coefficient, VariableKey v) { return new Term(Fraction.of(coefficient), v); }

    public Fraction coefficient() { return coefficient; }
    public VariableKey variable() { return variable; }

    /** Text as the solver reads it: "+ x_1_2", "- 2 b_1_2", "+ 0.5 p_3_1". */
    public String format() {
        String sign = coefficient.signum() < 0 ? "- " : "+ ";
        Fraction magnitude = coefficient.abs();
        if (magnitude.isOne()) return sign + variable.name();
        return sign + magnitude.toDecimalString() + " " + variable.name();
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Term)) return false;
        Term o = (Term) obj;
        return coefficient.equals(o.coefficient) && variable.equals(o.variable);
    }

    @Override public int hashCode() { return 31 * coefficient.hashCode() + variable.hashCode(); }

    @Override public String toString() { return format(); }
}
