package com.tenor.eval;

public final class VerdictInstance {

    public final String verdictType;
    public final Value payload;
    public final VerdictProvenance provenance;

    public VerdictInstance(String verdictType, Value payload, VerdictProvenance provenance) {
        this.verdictType = verdictType;
        this.payload = payload;
        this.provenance = provenance;
    }
}
