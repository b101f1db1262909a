package com.tenor.elaborate;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.tenor.elaborate.parser.RawConstruct;

/** State closure of each entity, and acyclicity of the parent hierarchy. */
final class EntityValidator {

    private EntityValidator() {}

    static void validate(ConstructIndex index, List<ElabError> errors) {
        CycleDetector hierarchy = new CycleDetector();
        for (RawConstruct.Entity e : index.entities.values()) {
            Set<String> states = new HashSet<>(e.states);
            String declared = String.join(", ", e.states);
            if (!states.contains(e.initial)) {
                errors.add(new ElabError(5, "Entity", e.id, "initial", e.file, e.initialLine,
                        "initial state '" + e.initial + "' is not declared in states: [" + declared + "]"));
            }
            for (RawConstruct.Transition t : e.transitions) {
                for (String endpoint : new String[] { t.from, t.to }) {
                    if (!states.contains(endpoint)) {
                        errors.add(new ElabError(5, "Entity", e.id, "transitions", e.file, t.line,
                                "transition endpoint '" + endpoint + "' is not declared in states: [" + declared + "]"));
                    }
                }
            }
            hierarchy.node(e.id);
            if (e.parent != null) {
                if (index.entities.containsKey(e.parent)) {
                    hierarchy.edge(e.id, e.parent);
                } else {
                    errors.add(new ElabError(5, "Entity", e.id, "parent", e.file, e.parentLine,
                            "parent entity '" + e.parent + "' is not declared"));
                }
            }
        }

        CycleDetector.Cycle cycle = hierarchy.findCycle();
        if (cycle != null) {
            RawConstruct.Entity closing = index.entities.get(cycle.closing);
            errors.add(new ElabError(5, "Entity", closing.id, "parent", closing.file, closing.parentLine,
                    "entity hierarchy cycle detected: " + cycle.render()));
        }
    }
}
