package com.layeredilp;

/** Declaration type of a program variable and the section that declares it. */
public enum VarType {
    BINARY("Binary"),
    GENERAL("General"),
    SEMI("Semi"),
    /** Plain continuous; has no section of its own and is declared through its bounds. */
    CONTINUOUS(null);

    private final String section;

    VarType(String section) { this.section = section; }

    /** Section header, or null if the type has none. */
    public String section() { return section; }
}
