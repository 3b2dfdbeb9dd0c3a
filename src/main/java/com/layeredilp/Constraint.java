package com.layeredilp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/** A linear constraint: terms, relational operator, numeric right-hand side. */
public final class Constraint {

    public enum Relation {
        LE("<="), GE(">="), EQ("=");

        private final String symbol;
        Relation(String symbol) { this.symbol = symbol; }
        public String symbol() { return symbol; }
    }

    private final List<Term> terms;
    private final Relation relation;
    private final Fraction rhs;

    public Constraint(List<Term> terms, Relation relation, Fraction rhs) {
        if (terms.isEmpty()) throw new IllegalArgumentException("Constraint without terms");
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.relation = Objects.requireNonNull(relation, "relation");
        this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    public static Constraint of(Relation relation, long rhs, Term... terms) {
        return new Constraint(Arrays.asList(terms), relation, Fraction.of(rhs));
    }

    public List<Term> terms() { return terms; }
    public Relation relation() { return relation; }
    public Fraction rhs() { return rhs; }

    /** Same constraint with its left-hand terms shuffled. */
    public Constraint permuted(Random random) {
        List<Term> shuffled = new ArrayList<>(terms);
        Collections.shuffle(shuffled, random);
        return new Constraint(shuffled, relation, rhs);
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Term t : terms) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(t.format());
        }
        return sb.append(' ').append(relation.symbol()).append(' ').append(rhs.toDecimalString()).toString();
    }
}
