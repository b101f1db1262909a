package com.tenor.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.debug.Debug;
import com.tenor.interchange.Contract;
import com.tenor.interchange.FlowStep;
import com.tenor.interchange.Predicate;

/**
 * What a persona can do right now: one entry per flow whose entry step is an
 * operation, either available (with the instances it could act on) or
 * blocked (with the reason).
 */
public final class ActionSpace {

    private static final String TAG = "tenor.action";

    public static final class VerdictSummary {
        public final String verdictType;
        public final Value payload;
        public final String producingRule;
        public final int stratum;

        VerdictSummary(VerdictInstance v) {
            this.verdictType = v.verdictType;
            this.payload = v.payload;
            this.producingRule = v.provenance.ruleId;
            this.stratum = v.provenance.stratum;
        }

        ObjectNode toJson() {
            ObjectNode o = JsonNodeFactory.instance.objectNode();
            o.put("verdict_type", verdictType);
            o.set("payload", payload.toJson());
            o.put("producing_rule", producingRule);
            o.put("stratum", stratum);
            return o;
        }
    }

    public static final class EntitySummary {
        public final String entityId;
        public final String currentState;
        public final List<String> possibleTransitions;

        EntitySummary(String entityId, String currentState, List<String> possibleTransitions) {
            this.entityId = entityId;
            this.currentState = currentState;
            this.possibleTransitions = List.copyOf(possibleTransitions);
        }

        ObjectNode toJson() {
            ObjectNode o = JsonNodeFactory.instance.objectNode();
            o.put("entity_id", entityId);
            o.put("current_state", currentState);
            ArrayNode arr = o.putArray("possible_transitions");
            for (String t : possibleTransitions) arr.add(t);
            return o;
        }
    }

    public static final class Action {
        public final String flowId;
        public final String personaId;
        public final String entryOperationId;
        public final List<VerdictSummary> enablingVerdicts;
        public final List<EntitySummary> affectedEntities;
        public final String description;
        /** entity id to the instances currently in the required source state. */
        public final Map<String, SortedSet<String>> instanceBindings;

        Action(String flowId, String personaId, String entryOperationId, List<VerdictSummary> enablingVerdicts,
               List<EntitySummary> affectedEntities, String description, Map<String, SortedSet<String>> instanceBindings) {
            this.flowId = flowId;
            this.personaId = personaId;
            this.entryOperationId = entryOperationId;
            this.enablingVerdicts = List.copyOf(enablingVerdicts);
            this.affectedEntities = List.copyOf(affectedEntities);
            this.description = description;
            this.instanceBindings = Collections.unmodifiableMap(instanceBindings);
        }

        ObjectNode toJson() {
            ObjectNode o = JsonNodeFactory.instance.objectNode();
            o.put("flow_id", flowId);
            o.put("persona_id", personaId);
            o.put("entry_operation_id", entryOperationId);
            ArrayNode ev = o.putArray("enabling_verdicts");
            for (VerdictSummary v : enablingVerdicts) ev.add(v.toJson());
            ArrayNode ae = o.putArray("affected_entities");
            for (EntitySummary e : affectedEntities) ae.add(e.toJson());
            o.put("description", description);
            o.set("instance_bindings", bindingsJson(instanceBindings));
            return o;
        }
    }

    public static final class BlockedAction {
        public final String flowId;
        public final BlockedReason reason;
        /** Instances responsible for an entity-state block; empty for other reasons. */
        public final Map<String, SortedSet<String>> instanceBindings;

        BlockedAction(String flowId, BlockedReason reason, Map<String, SortedSet<String>> instanceBindings) {
            this.flowId = flowId;
            this.reason = reason;
            this.instanceBindings = Collections.unmodifiableMap(instanceBindings);
        }

        ObjectNode toJson() {
            ObjectNode o = JsonNodeFactory.instance.objectNode();
            o.put("flow_id", flowId);
            o.set("reason", reason.toJson());
            o.set("instance_bindings", bindingsJson(instanceBindings));
            return o;
        }
    }

    public final String personaId;
    public final List<Action> actions;
    public final List<VerdictSummary> currentVerdicts;
    public final List<BlockedAction> blockedActions;

    private ActionSpace(String personaId, List<Action> actions, List<VerdictSummary> currentVerdicts, List<BlockedAction> blocked) {
        this.personaId = personaId;
        this.actions = List.copyOf(actions);
        this.currentVerdicts = List.copyOf(currentVerdicts);
        this.blockedActions = List.copyOf(blocked);
    }

    public Action action(String flowId) {
        for (Action a : actions) {
            if (a.flowId.equals(flowId)) return a;
        }
        return null;
    }

    public BlockedAction blocked(String flowId) {
        for (BlockedAction b : blockedActions) {
            if (b.flowId.equals(flowId)) return b;
        }
        return null;
    }

    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("persona_id", personaId);
        ArrayNode a = o.putArray("actions");
        for (Action x : actions) a.add(x.toJson());
        ArrayNode v = o.putArray("current_verdicts");
        for (VerdictSummary x : currentVerdicts) v.add(x.toJson());
        ArrayNode b = o.putArray("blocked_actions");
        for (BlockedAction x : blockedActions) b.add(x.toJson());
        return o;
    }

    // -------------------------
    // Computation
    // -------------------------

    static ActionSpace compute(Contract contract, JsonNode factsJson, EntityStateMap states, String persona) {
        List<Action> actions = new ArrayList<>();
        List<BlockedAction> blocked = new ArrayList<>();

        List<String> missing = FactAssembler.missing(contract, factsJson);
        if (!missing.isEmpty()) {
            // rules cannot run; every action the persona could take is blocked on the same facts
            for (Contract.Flow flow : contract.flows().values()) {
                Contract.Operation op = entryOperation(contract, flow);
                if (op == null) continue;
                BlockedReason reason = op.allowedPersonas.contains(persona)
                        ? new BlockedReason.MissingFacts(missing)
                        : new BlockedReason.PersonaNotAuthorized();
                blocked.add(new BlockedAction(flow.id, reason, Map.of()));
            }
            Debug.get().d(TAG, "persona '" + persona + "': missing facts " + missing);
            return new ActionSpace(persona, actions, List.of(), blocked);
        }

        FactSet facts = FactAssembler.assemble(contract, factsJson);
        VerdictSet verdicts = RuleEngine.evaluate(contract, facts);
        List<VerdictSummary> current = new ArrayList<>();
        for (VerdictInstance v : verdicts.all()) current.add(new VerdictSummary(v));

        for (Contract.Flow flow : contract.flows().values()) {
            Contract.Operation op = entryOperation(contract, flow);
            if (op == null) continue;

            if (!op.allowedPersonas.contains(persona)) {
                blocked.add(new BlockedAction(flow.id, new BlockedReason.PersonaNotAuthorized(), Map.of()));
                continue;
            }

            List<String> required = verdictRefs(op.precondition);
            List<String> absent = new ArrayList<>();
            for (String v : required) {
                if (!verdicts.has(v)) absent.add(v);
            }
            if (!absent.isEmpty()
                    || !new PredicateEvaluator(facts, verdicts, new ProvenanceCollector()).test(op.precondition)) {
                blocked.add(new BlockedAction(flow.id, new BlockedReason.PreconditionNotMet(absent), Map.of()));
                continue;
            }

            Map<String, SortedSet<String>> valid = new TreeMap<>();
            BlockedAction entityBlock = null;
            for (Contract.Effect e : op.effects) {
                Map<String, String> instances = states.instances(e.entityId);
                SortedSet<String> ok = new TreeSet<>();
                for (Map.Entry<String, String> i : instances.entrySet()) {
                    if (i.getValue().equals(e.from)) ok.add(i.getKey());
                }
                if (instances.isEmpty()) {
                    entityBlock = new BlockedAction(flow.id,
                            new BlockedReason.EntityNotInSourceState(e.entityId, "(unknown)", e.from),
                            Map.of(e.entityId, new TreeSet<>(List.of(InstanceBindings.DEFAULT_INSTANCE_ID))));
                    break;
                }
                if (ok.isEmpty()) {
                    Map.Entry<String, String> firstInstance = instances.entrySet().iterator().next();
                    entityBlock = new BlockedAction(flow.id,
                            new BlockedReason.EntityNotInSourceState(e.entityId, firstInstance.getValue(), e.from),
                            Map.of(e.entityId, new TreeSet<>(instances.keySet())));
                    break;
                }
                valid.put(e.entityId, ok);
            }
            if (entityBlock != null) {
                blocked.add(entityBlock);
                continue;
            }

            List<VerdictSummary> enabling = new ArrayList<>();
            for (String v : required) enabling.add(new VerdictSummary(verdicts.get(v)));

            List<EntitySummary> affected = new ArrayList<>();
            for (Contract.Effect e : op.effects) {
                String instance = valid.get(e.entityId).first();
                String state = states.get(e.entityId, instance);
                List<String> next = new ArrayList<>();
                Contract.Entity entity = contract.entity(e.entityId);
                if (entity != null) {
                    for (Contract.Transition t : entity.transitions) {
                        if (t.from.equals(state)) next.add(t.to);
                    }
                }
                affected.add(new EntitySummary(e.entityId, state, next));
            }

            actions.add(new Action(flow.id, persona, op.id, enabling, affected, describe(flow.id, op), valid));
        }

        Debug.get().d(TAG, "persona '" + persona + "': " + actions.size() + " available, " + blocked.size() + " blocked");
        return new ActionSpace(persona, actions, current, blocked);
    }

    /** The operation of the flow's entry step, or null when the entry is not an operation step. */
    private static Contract.Operation entryOperation(Contract contract, Contract.Flow flow) {
        FlowStep entry = flow.steps.get(flow.entry);
        if (entry == null || entry.kind() != FlowStep.Kind.OPERATION) return null;
        return contract.operation(((FlowStep.OperationStep) entry).op);
    }

    private static String describe(String flowId, Contract.Operation op) {
        if (op.effects.isEmpty()) return "Execute " + flowId + ": " + op.id;
        List<String> parts = new ArrayList<>();
        for (Contract.Effect e : op.effects) parts.add(e.entityId + " from " + e.from + " to " + e.to);
        return "Execute " + flowId + ": " + op.id + " transitions " + String.join(", ", parts);
    }

    static List<String> verdictRefs(Predicate p) {
        List<String> out = new ArrayList<>();
        collectVerdicts(p, out);
        return out;
    }

    private static void collectVerdicts(Predicate p, List<String> out) {
        if (p instanceof Predicate.VerdictPresent) {
            String id = ((Predicate.VerdictPresent) p).verdictType;
            if (!out.contains(id)) out.add(id);
        } else if (p instanceof Predicate.And) {
            collectVerdicts(((Predicate.And) p).left, out);
            collectVerdicts(((Predicate.And) p).right, out);
        } else if (p instanceof Predicate.Or) {
            collectVerdicts(((Predicate.Or) p).left, out);
            collectVerdicts(((Predicate.Or) p).right, out);
        } else if (p instanceof Predicate.Compare) {
            collectVerdicts(((Predicate.Compare) p).left, out);
            collectVerdicts(((Predicate.Compare) p).right, out);
        } else if (p instanceof Predicate.Not) {
            collectVerdicts(((Predicate.Not) p).operand, out);
        } else if (p instanceof Predicate.Quantifier) {
            collectVerdicts(((Predicate.Quantifier) p).domain, out);
            collectVerdicts(((Predicate.Quantifier) p).body, out);
        } else if (p instanceof Predicate.Mul) {
            collectVerdicts(((Predicate.Mul) p).left, out);
        }
    }

    private static ObjectNode bindingsJson(Map<String, SortedSet<String>> bindings) {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, SortedSet<String>> e : new TreeMap<>(bindings).entrySet()) {
            ArrayNode arr = o.putArray(e.getKey());
            for (String id : e.getValue()) arr.add(id);
        }
        return o;
    }
}
