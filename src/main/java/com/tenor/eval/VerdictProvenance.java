package com.tenor.eval;

import java.util.List;

/** Which rule produced a verdict, at which stratum, and what it read. */
public final class VerdictProvenance {

    public final String ruleId;
    public final int stratum;
    public final List<String> factsUsed;
    public final List<String> verdictsUsed;

    public VerdictProvenance(String ruleId, int stratum, List<String> factsUsed, List<String> verdictsUsed) {
        this.ruleId = ruleId;
        this.stratum = stratum;
        this.factsUsed = List.copyOf(factsUsed);
        this.verdictsUsed = List.copyOf(verdictsUsed);
    }
}
