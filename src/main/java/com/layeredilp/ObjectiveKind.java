package com.layeredilp;

import java.util.Locale;

/** The aesthetic criteria a program can minimize. */
public enum ObjectiveKind {
    TOTAL(Family.CROSSING),
    BOTTLENECK(Family.CROSSING),
    STRETCH(Family.STRETCH),
    BN_STRETCH(Family.STRETCH),
    QUAD_STRETCH(Family.STRETCH),
    VERTICAL(Family.VERTICAL),
    BN_VERTICAL(Family.VERTICAL),
    QUAD_VERTICAL(Family.VERTICAL);

    /** Objectives sharing a family share their position model. */
    public enum Family { CROSSING, STRETCH, VERTICAL }

    private final Family family;

    ObjectiveKind(Family family) { this.family = family; }

    public Family family() { return family; }

    public boolean isQuadratic() { return this == QUAD_STRETCH || this == QUAD_VERTICAL; }

    /** Name as used on the command line and for the objective variable. */
    public String label() { return name().toLowerCase(Locale.ROOT); }

    public static ObjectiveKind fromLabel(String label) {
        for (ObjectiveKind k : values()) if (k.label().equals(label)) return k;
        throw new IllegalArgumentException("Unknown objective: " + label);
    }
}
