package com.tenor.elaborate;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawStep;

/** Membership, sharing and trigger checks for System constructs. */
final class SystemValidator {

    private static final Set<String> TRIGGER_OUTCOMES = Set.of("success", "failure", "escalation");

    private SystemValidator() {}

    static void validate(ConstructIndex index, List<ElabError> errors) {
        Set<String> systemFiles = new HashSet<>();
        for (RawConstruct.SystemDecl s : index.systems.values()) systemFiles.add(s.file);

        for (RawConstruct.SystemDecl sys : index.systems.values()) {
            if (sys.members.isEmpty()) {
                errors.add(error(sys, "members", "System must declare at least one member contract"));
            }
            Set<String> members = new HashSet<>();
            for (RawConstruct.Member m : sys.members) {
                if (!members.add(m.id)) {
                    errors.add(error(sys, "members", "duplicate member id '" + m.id + "' in System '" + sys.id + "'"));
                }
                if (systemFiles.contains(fileName(m.path))) {
                    errors.add(error(sys, "members", "member '" + m.id + "' is a System file; nested Systems are not permitted"));
                }
            }

            checkShared(sys, sys.sharedPersonas, "shared_personas", "shared_persona", members, errors);

            CycleDetector graph = new CycleDetector();
            for (RawConstruct.Trigger t : sys.triggers) {
                if (!members.contains(t.sourceContract)) {
                    errors.add(error(sys, "triggers", "trigger source contract '" + t.sourceContract + "' is not a System member"));
                }
                if (!members.contains(t.targetContract)) {
                    errors.add(error(sys, "triggers", "trigger target contract '" + t.targetContract + "' is not a System member"));
                }
                if (!TRIGGER_OUTCOMES.contains(t.on)) {
                    errors.add(error(sys, "triggers", "invalid trigger outcome '" + t.on
                            + "'; must be 'success', 'failure', or 'escalation'"));
                }
                if (t.sourceContract.equals(t.targetContract) && t.sourceFlow.equals(t.targetFlow)) {
                    errors.add(error(sys, "triggers", "self-referential trigger: " + t.sourceContract + "."
                            + t.sourceFlow + " triggers itself"));
                } else {
                    graph.edge(t.sourceContract + "." + t.sourceFlow, t.targetContract + "." + t.targetFlow);
                }
                checkTriggerPersona(index, sys, t, errors);
            }

            checkShared(sys, sys.sharedEntities, "shared_entities", "shared_entity", members, errors);

            CycleDetector.Cycle cycle = graph.findCycle();
            if (cycle != null) {
                errors.add(error(sys, "triggers", "trigger cycle detected: " + cycle.render()));
            }
        }
    }

    private static void checkShared(RawConstruct.SystemDecl sys, List<RawConstruct.Shared> shared, String field,
                                    String label, Set<String> members, List<ElabError> errors) {
        for (RawConstruct.Shared s : shared) {
            for (String c : s.contracts) {
                if (!members.contains(c)) {
                    errors.add(error(sys, field, "contract '" + c + "' in " + label + " '" + s.name + "' is not a System member"));
                }
            }
            if (s.contracts.size() < 2) {
                errors.add(error(sys, field, label + " '" + s.name + "' must reference at least 2 member contracts; got "
                        + s.contracts.size()));
            }
        }
    }

    /** Only checkable when the target flow is part of the same bundle. */
    private static void checkTriggerPersona(ConstructIndex index, RawConstruct.SystemDecl sys, RawConstruct.Trigger t,
                                            List<ElabError> errors) {
        RawConstruct.Flow target = index.flows.get(t.targetFlow);
        if (target == null) return;
        if (!index.personas.containsKey(t.persona)) {
            errors.add(error(sys, "triggers", "persona '" + t.persona + "' not declared in target contract '"
                    + t.targetContract + "'"));
            return;
        }
        RawStep.Step entry = target.steps.get(target.entry);
        if (entry == null || entry.kind() != RawStep.Kind.OPERATION) return;
        String opId = ((RawStep.OperationStep) entry).op;
        RawConstruct.Operation op = index.operations.get(opId);
        if (op != null && !op.allowedPersonas.contains(t.persona)) {
            errors.add(error(sys, "triggers", "trigger persona '" + t.persona + "' not in allowed_personas of entry operation '"
                    + opId + "' in target flow '" + t.targetFlow + "'"));
        }
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static ElabError error(RawConstruct.SystemDecl sys, String field, String message) {
        return new ElabError(5, "System", sys.id, field, sys.file, sys.line, message);
    }
}
