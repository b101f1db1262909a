package com.tenor.eval;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.tenor.interchange.Contract;

/** Chooses which instance of each entity an operation's effects target. */
public final class InstanceBindings {

    /** Reserved instance id used when no binding names an instance. */
    public static final String DEFAULT_INSTANCE_ID = "_default";

    private InstanceBindings() {}

    /**
     * One entry per entity the operation affects: the ambient binding when
     * there is one, else {@link #DEFAULT_INSTANCE_ID}. Entities the operation
     * does not touch are left out.
     */
    public static Map<String, String> resolve(Contract.Operation op, Map<String, String> ambient) {
        Map<String, String> out = new TreeMap<>();
        for (Contract.Effect e : op.effects) {
            String bound = ambient == null ? null : ambient.get(e.entityId);
            out.put(e.entityId, bound == null ? DEFAULT_INSTANCE_ID : bound);
        }
        return Collections.unmodifiableMap(out);
    }

    static String instanceFor(Map<String, String> resolved, String entityId) {
        String id = resolved.get(entityId);
        return id == null ? DEFAULT_INSTANCE_ID : id;
    }
}
