package com.tenor.eval;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** Assembled facts, keyed by fact id in sorted order. Immutable once built. */
public final class FactSet {

    private final Map<String, Value> values;

    FactSet(Map<String, Value> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public Value get(String id) {
        return values.get(id);
    }

    public boolean has(String id) {
        return values.containsKey(id);
    }

    public Set<String> ids() {
        return values.keySet();
    }

    public Map<String, Value> asMap() {
        return values;
    }
}
