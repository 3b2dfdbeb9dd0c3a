package com.layeredilp;

/** Size of a generated program. */
public final class ProgramStats {
    public int binaries;
    public int generals;
    public int semis;
    public int continuous;
    public int constraints;

    public static ProgramStats of(Program p) {
        ProgramStats st = new ProgramStats();
        st.binaries = p.variables(VarType.BINARY).size();
        st.generals = p.variables(VarType.GENERAL).size();
        st.semis = p.variables(VarType.SEMI).size();
        st.continuous = p.variables(VarType.CONTINUOUS).size();
        st.constraints = p.constraints().size();
        return st;
    }

    public int variables() { return binaries + generals + semis + continuous; }

    @Override
    public String toString() {
        return "*Totals: constraints=" + constraints +
                " variables=" + variables() +
                " binary=" + binaries +
                " general=" + generals +
                " semi=" + semis +
                " continuous=" + continuous;
    }
}
