package com.tenor.elaborate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.tenor.elaborate.parser.RawConstruct;

final class OperationValidator {

    private OperationValidator() {}

    static void validate(ConstructIndex index, List<ElabError> errors) {
        for (RawConstruct.Operation op : index.operations.values()) {
            Set<String> seen = new HashSet<>();
            for (String outcome : op.outcomes) {
                if (!seen.add(outcome)) {
                    errors.add(error(op, "outcomes", op.line, "duplicate outcome '" + outcome
                            + "'; outcome labels must be unique within an Operation"));
                }
            }

            if (op.allowedPersonas.isEmpty()) {
                errors.add(error(op, "allowed_personas", op.allowedPersonasLine,
                        "allowed_personas must be non-empty; an Operation with no allowed personas can never be invoked"));
            } else if (!index.personas.isEmpty()) {
                for (String p : op.allowedPersonas) {
                    if (!index.personas.containsKey(p)) {
                        errors.add(error(op, "allowed_personas", op.allowedPersonasLine,
                                "undeclared persona '" + p + "' in allowed_personas"));
                    }
                }
            }

            for (RawConstruct.Effect effect : op.effects) {
                RawConstruct.Entity entity = index.entities.get(effect.entityId);
                if (entity == null) {
                    errors.add(error(op, "effects", effect.line, "effect references undeclared entity '" + effect.entityId + "'"));
                    continue;
                }
                if (!entity.hasTransition(effect.from, effect.to)) {
                    List<String> declared = new ArrayList<>();
                    for (RawConstruct.Transition t : entity.transitions) declared.add("(" + t.from + ", " + t.to + ")");
                    errors.add(error(op, "effects", effect.line, "effect " + effect.display()
                            + " is not a declared transition in entity " + entity.id
                            + "; declared transitions are: [" + String.join(", ", declared) + "]"));
                }
                if (op.outcomes.size() >= 2) {
                    if (effect.outcome == null) {
                        errors.add(error(op, "effects", effect.line, "effect " + effect.display()
                                + " is missing an outcome label; multi-outcome operations require every effect "
                                + "to specify which outcome it belongs to"));
                    } else if (!op.outcomes.contains(effect.outcome)) {
                        errors.add(error(op, "effects", effect.line, "effect " + effect.display()
                                + " references undeclared outcome '" + effect.outcome + "'; declared outcomes are: ["
                                + String.join(", ", op.outcomes) + "]"));
                    }
                }
            }

            for (String ec : op.errorContract) {
                if (op.outcomes.contains(ec)) {
                    errors.add(error(op, "outcomes", op.line, "outcome '" + ec
                            + "' conflicts with error_contract; outcomes and error_contract must be disjoint"));
                }
            }
        }
    }

    private static ElabError error(RawConstruct.Operation op, String field, int line, String message) {
        return new ElabError(5, "Operation", op.id, field, op.file, line, message);
    }
}
