package com.tenor.interchange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable view of an Interchange Bundle: the constructs the evaluator needs,
 * indexed by id in bundle order. Sources and Systems are not evaluated.
 */
public final class Contract {

    public static final class FactDecl {
        public final String id;
        public final TypeSpec type;
        /** Raw default as written in the bundle, or null. */
        public final JsonNode defaultValue;

        public FactDecl(String id, TypeSpec type, JsonNode defaultValue) {
            this.id = id;
            this.type = type;
            this.defaultValue = defaultValue;
        }
    }

    public static final class Transition {
        public final String from;
        public final String to;

        public Transition(String from, String to) {
            this.from = from;
            this.to = to;
        }
    }

    public static final class Entity {
        public final String id;
        public final List<String> states;
        public final String initial;
        public final List<Transition> transitions;
        public final String parent;

        public Entity(String id, List<String> states, String initial, List<Transition> transitions, String parent) {
            this.id = id;
            this.states = List.copyOf(states);
            this.initial = initial;
            this.transitions = List.copyOf(transitions);
            this.parent = parent;
        }
    }

    /** Verdict payload: a literal, or a fact scaled by an integer literal. */
    public static final class Produce {
        public final String verdictType;
        public final TypeSpec payloadType;
        public final JsonNode literal;
        public final String mulFactRef;
        public final long mulLiteral;
        public final TypeSpec mulResultType;

        public Produce(String verdictType, TypeSpec payloadType, JsonNode literal,
                       String mulFactRef, long mulLiteral, TypeSpec mulResultType) {
            this.verdictType = verdictType;
            this.payloadType = payloadType;
            this.literal = literal;
            this.mulFactRef = mulFactRef;
            this.mulLiteral = mulLiteral;
            this.mulResultType = mulResultType;
        }

        public boolean isMul() {
            return mulFactRef != null;
        }
    }

    public static final class Rule {
        public final String id;
        public final int stratum;
        public final Predicate condition;
        public final Produce produce;

        public Rule(String id, int stratum, Predicate condition, Produce produce) {
            this.id = id;
            this.stratum = stratum;
            this.condition = condition;
            this.produce = produce;
        }
    }

    public static final class Effect {
        public final String entityId;
        public final String from;
        public final String to;
        public final String outcome;

        public Effect(String entityId, String from, String to, String outcome) {
            this.entityId = entityId;
            this.from = from;
            this.to = to;
            this.outcome = outcome;
        }
    }

    public static final class Operation {
        public final String id;
        public final List<String> allowedPersonas;
        public final Predicate precondition;
        public final List<Effect> effects;
        public final List<String> errorContract;
        public final List<String> outcomes;

        public Operation(String id, List<String> allowedPersonas, Predicate precondition, List<Effect> effects,
                         List<String> errorContract, List<String> outcomes) {
            this.id = id;
            this.allowedPersonas = List.copyOf(allowedPersonas);
            this.precondition = precondition;
            this.effects = List.copyOf(effects);
            this.errorContract = List.copyOf(errorContract);
            this.outcomes = List.copyOf(outcomes);
        }
    }

    public static final class Flow {
        public final String id;
        public final String snapshot;
        public final String entry;
        public final Map<String, FlowStep> steps;

        public Flow(String id, String snapshot, String entry, List<FlowStep> steps) {
            this.id = id;
            this.snapshot = snapshot;
            this.entry = entry;
            this.steps = FlowStep.index(steps);
        }
    }

    public final String id;
    private final Map<String, FactDecl> facts;
    private final Map<String, Entity> entities;
    private final List<Rule> rules;
    private final Map<String, Operation> operations;
    private final Map<String, Flow> flows;
    private final List<String> personas;

    Contract(String id, List<FactDecl> facts, List<Entity> entities, List<Rule> rules,
             List<Operation> operations, List<Flow> flows, List<String> personas) {
        this.id = id;
        Map<String, FactDecl> f = new LinkedHashMap<>();
        for (FactDecl d : facts) f.put(d.id, d);
        Map<String, Entity> e = new LinkedHashMap<>();
        for (Entity d : entities) e.put(d.id, d);
        Map<String, Operation> o = new LinkedHashMap<>();
        for (Operation d : operations) o.put(d.id, d);
        Map<String, Flow> fl = new LinkedHashMap<>();
        for (Flow d : flows) fl.put(d.id, d);
        this.facts = Collections.unmodifiableMap(f);
        this.entities = Collections.unmodifiableMap(e);
        this.rules = List.copyOf(rules);
        this.operations = Collections.unmodifiableMap(o);
        this.flows = Collections.unmodifiableMap(fl);
        this.personas = List.copyOf(personas);
    }

    public Map<String, FactDecl> facts() { return facts; }
    public Map<String, Entity> entities() { return entities; }
    public List<Rule> rules() { return rules; }
    public Map<String, Operation> operations() { return operations; }
    public Map<String, Flow> flows() { return flows; }
    public List<String> personas() { return personas; }

    public FactDecl fact(String id) { return facts.get(id); }
    public Entity entity(String id) { return entities.get(id); }
    public Operation operation(String id) { return operations.get(id); }
    public Flow flow(String id) { return flows.get(id); }
}
