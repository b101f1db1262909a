package com.tenor.elaborate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawType;

/**
 * Pass 3: rejects cyclic TypeDecls and resolves each one to a concrete Record.
 * References to names that are not TypeDecls are left for Pass 4 to report.
 */
final class Pass3Types {

    private Pass3Types() {}

    static Map<String, RawType> resolve(ConstructIndex index) {
        CycleDetector graph = new CycleDetector();
        for (RawConstruct.TypeDecl decl : index.types.values()) {
            graph.node(decl.id);
            for (RawType t : decl.fields.values()) addRefs(graph, decl.id, t, index);
        }
        CycleDetector.Cycle cycle = graph.findCycle();
        if (cycle != null) {
            RawConstruct.TypeDecl closing = index.types.get(cycle.closing);
            String target = cycle.path.get(0);
            String field = null;
            for (Map.Entry<String, RawType> e : closing.fields.entrySet()) {
                if (references(e.getValue(), target)) {
                    field = "type.fields." + e.getKey();
                    break;
                }
            }
            throw new ElaborationException(new ElabError(3, "TypeDecl", closing.id, field, closing.file,
                    closing.line, "TypeDecl cycle detected: " + cycle.render()));
        }

        Map<String, RawType> env = new LinkedHashMap<>();
        for (RawConstruct.TypeDecl decl : index.types.values()) {
            env.put(decl.id, resolveDecl(decl.id, index, env));
        }
        return Collections.unmodifiableMap(env);
    }

    private static void addRefs(CycleDetector graph, String from, RawType t, ConstructIndex index) {
        if (t.is(RawType.Base.REF)) {
            if (index.types.containsKey(t.refName)) graph.edge(from, t.refName);
            return;
        }
        if (t.is(RawType.Base.LIST)) addRefs(graph, from, t.elementType, index);
        for (RawType f : t.fields.values()) addRefs(graph, from, f, index);
    }

    private static boolean references(RawType t, String name) {
        if (t.is(RawType.Base.REF)) return t.refName.equals(name);
        if (t.is(RawType.Base.LIST)) return references(t.elementType, name);
        for (RawType f : t.fields.values()) {
            if (references(f, name)) return true;
        }
        return false;
    }

    private static RawType resolveDecl(String id, ConstructIndex index, Map<String, RawType> env) {
        RawType done = env.get(id);
        if (done != null) return done;
        RawConstruct.TypeDecl decl = index.types.get(id);
        Map<String, RawType> fields = new LinkedHashMap<>();
        for (Map.Entry<String, RawType> e : decl.fields.entrySet()) {
            fields.put(e.getKey(), inline(e.getValue(), index, env));
        }
        RawType resolved = RawType.record(fields);
        env.put(id, resolved);
        return resolved;
    }

    private static RawType inline(RawType t, ConstructIndex index, Map<String, RawType> env) {
        if (t.is(RawType.Base.REF)) {
            return index.types.containsKey(t.refName) ? resolveDecl(t.refName, index, env) : t;
        }
        return t.mapChildren(child -> inline(child, index, env));
    }
}
