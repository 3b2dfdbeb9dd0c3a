package com.layeredilp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Mutable accumulator for one generated program: typed variable
 * declarations, explicit bounds, constraints in generation order and the
 * objective. Builders declare what they use and hand back their
 * constraints; the assembler appends them here.
 */
public final class Program {
    private final Map<VarType, Set<VariableKey>> declared = new EnumMap<>(VarType.class);
    private final Map<VariableKey, VarType> typeOf = new HashMap<>();
    private final Map<VariableKey, Fraction[]> bounds = new LinkedHashMap<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private Objective objective;

    public Program() {
        for (VarType t : VarType.values()) declared.put(t, new LinkedHashSet<>());
    }

    /**
     * Declares a variable. Declaring it again with the same type is a no-op;
     * with a different type it is an error.
     */
    public void declare(VariableKey v, VarType type) {
        VarType previous = typeOf.putIfAbsent(v, type);
        if (previous == null) {
            declared.get(type).add(v);
        } else if (previous != type) {
            throw new IllegalStateException("Variable " + v + " declared " + previous + " and " + type);
        }
    }

    public boolean isDeclared(VariableKey v) { return typeOf.containsKey(v); }
    public VarType typeOf(VariableKey v) { return typeOf.get(v); }

    /** Variables of one type in declaration order. */
    public Set<VariableKey> variables(VarType type) { return Collections.unmodifiableSet(declared.get(type)); }

    /** Explicit range for a variable whose default [0, inf) does not fit. */
    public void bound(VariableKey v, Fraction lower, Fraction upper) {
        if (lower.compareTo(upper) > 0) throw new IllegalArgumentException("Empty range for " + v);
        bounds.put(v, new Fraction[]{lower, upper});
    }

    /** Bounded variables in order; each value is {lower, upper}. */
    public Map<VariableKey, Fraction[]> bounds() { return Collections.unmodifiableMap(bounds); }

    public void add(Constraint c) { constraints.add(Objects.requireNonNull(c)); }
    public void addAll(List<Constraint> cs) { for (Constraint c : cs) add(c); }
    public List<Constraint> constraints() { return Collections.unmodifiableList(constraints); }

    public Objective getObjective() { return objective; }
    public void setObjective(Objective objective) { this.objective = objective; }

    /**
     * Shuffles the constraint order and the terms within each constraint.
     * The program's meaning is unchanged.
     */
    public void permute(Random random) {
        Collections.shuffle(constraints, random);
        for (int i = 0; i < constraints.size(); i++) {
            constraints.set(i, constraints.get(i).permuted(random));
        }
    }

    /** Fails if the objective or any constraint refers to an undeclared variable. */
    public void checkDeclarations() {
        if (objective == null) throw new IllegalStateException("Program has no objective");
        Set<VariableKey> missing = new LinkedHashSet<>();
        for (VariableKey v : objective.variables()) if (!isDeclared(v)) missing.add(v);
        for (Constraint c : constraints) {
            for (Term t : c.terms()) if (!isDeclared(t.variable())) missing.add(t.variable());
        }
        for (VariableKey v : bounds.keySet()) if (!isDeclared(v)) missing.add(v);
        if (!missing.isEmpty()) throw new IllegalStateException("Undeclared variables: " + missing);
    }
}
