package com.tenor.elaborate.parser;

import java.util.List;
import java.util.Map;

/** Top-level declarations of a contract file, with source provenance. */
public class RawConstruct {

    public abstract static class Construct {
        public final String id;
        public final String file;
        public final int line;

        protected Construct(String id, String file, int line) {
            this.id = id;
            this.file = file;
            this.line = line;
        }

        /** Discriminator used in diagnostics and the bundle, e.g. "Fact". */
        public abstract String kind();
    }

    public static final class Import extends Construct {
        public final String path;

        public Import(String path, String file, int line) {
            super(path, file, line);
            this.path = path;
        }

        @Override public String kind() { return "Import"; }
    }

    public static final class TypeDecl extends Construct {
        public final Map<String, RawType> fields;

        public TypeDecl(String id, Map<String, RawType> fields, String file, int line) {
            super(id, file, line);
            this.fields = fields;
        }

        @Override public String kind() { return "TypeDecl"; }
    }

    /** Fact source: either "system.field" free text, or a declared Source plus a path. */
    public static final class FactSource {
        public final String freetext;
        public final String sourceId;
        public final String path;

        private FactSource(String freetext, String sourceId, String path) {
            this.freetext = freetext;
            this.sourceId = sourceId;
            this.path = path;
        }

        public static FactSource freetext(String s) { return new FactSource(s, null, null); }
        public static FactSource structured(String sourceId, String path) { return new FactSource(null, sourceId, path); }

        public boolean isStructured() { return sourceId != null; }
    }

    public static final class Fact extends Construct {
        public final RawType type;
        public final FactSource source;
        public final RawLiteral defaultValue;

        public Fact(String id, RawType type, FactSource source, RawLiteral defaultValue, String file, int line) {
            super(id, file, line);
            this.type = type;
            this.source = source;
            this.defaultValue = defaultValue;
        }

        public Fact withType(RawType t) {
            return new Fact(id, t, source, defaultValue, file, line);
        }

        @Override public String kind() { return "Fact"; }
    }

    public static final class Transition {
        public final String from;
        public final String to;
        public final int line;

        public Transition(String from, String to, int line) {
            this.from = from;
            this.to = to;
            this.line = line;
        }
    }

    public static final class Entity extends Construct {
        public final List<String> states;
        public final String initial;
        public final int initialLine;
        public final List<Transition> transitions;
        public final String parent;
        public final int parentLine;

        public Entity(String id, List<String> states, String initial, int initialLine,
                      List<Transition> transitions, String parent, int parentLine, String file, int line) {
            super(id, file, line);
            this.states = List.copyOf(states);
            this.initial = initial;
            this.initialLine = initialLine;
            this.transitions = List.copyOf(transitions);
            this.parent = parent;
            this.parentLine = parentLine;
        }

        public boolean hasTransition(String from, String to) {
            for (Transition t : transitions) {
                if (t.from.equals(from) && t.to.equals(to)) return true;
            }
            return false;
        }

        @Override public String kind() { return "Entity"; }
    }

    public static final class Rule extends Construct {
        public final long stratum;
        public final int stratumLine;
        public final RawExpr.ExprNode when;
        public final String verdictType;
        public final RawType payloadType;
        public final RawExpr.Term payloadValue;
        public final int produceLine;

        public Rule(String id, long stratum, int stratumLine, RawExpr.ExprNode when, String verdictType,
                    RawType payloadType, RawExpr.Term payloadValue, int produceLine, String file, int line) {
            super(id, file, line);
            this.stratum = stratum;
            this.stratumLine = stratumLine;
            this.when = when;
            this.verdictType = verdictType;
            this.payloadType = payloadType;
            this.payloadValue = payloadValue;
            this.produceLine = produceLine;
        }

        public Rule withPayloadType(RawType t) {
            return new Rule(id, stratum, stratumLine, when, verdictType, t, payloadValue, produceLine, file, line);
        }

        @Override public String kind() { return "Rule"; }
    }

    public static final class Effect {
        public final String entityId;
        public final String from;
        public final String to;
        public final String outcome;
        public final int line;

        public Effect(String entityId, String from, String to, String outcome, int line) {
            this.entityId = entityId;
            this.from = from;
            this.to = to;
            this.outcome = outcome;
            this.line = line;
        }

        public String display() {
            return "(" + entityId + ", " + from + ", " + to + ")";
        }
    }

    public static final class Operation extends Construct {
        public final List<String> allowedPersonas;
        public final int allowedPersonasLine;
        public final RawExpr.ExprNode precondition;
        public final List<Effect> effects;
        public final List<String> errorContract;
        public final List<String> outcomes;

        public Operation(String id, List<String> allowedPersonas, int allowedPersonasLine,
                         RawExpr.ExprNode precondition, List<Effect> effects, List<String> errorContract,
                         List<String> outcomes, String file, int line) {
            super(id, file, line);
            this.allowedPersonas = List.copyOf(allowedPersonas);
            this.allowedPersonasLine = allowedPersonasLine;
            this.precondition = precondition;
            this.effects = List.copyOf(effects);
            this.errorContract = List.copyOf(errorContract);
            this.outcomes = List.copyOf(outcomes);
        }

        @Override public String kind() { return "Operation"; }
    }

    public static final class Flow extends Construct {
        public final String snapshot;
        public final String entry;
        public final int entryLine;
        /** Steps in declaration order. */
        public final Map<String, RawStep.Step> steps;

        public Flow(String id, String snapshot, String entry, int entryLine,
                    Map<String, RawStep.Step> steps, String file, int line) {
            super(id, file, line);
            this.snapshot = snapshot;
            this.entry = entry;
            this.entryLine = entryLine;
            this.steps = steps;
        }

        @Override public String kind() { return "Flow"; }
    }

    public static final class Persona extends Construct {
        public Persona(String id, String file, int line) {
            super(id, file, line);
        }

        @Override public String kind() { return "Persona"; }
    }

    public static final class Source extends Construct {
        public final String protocol;
        public final Map<String, String> fields;
        public final String description;

        public Source(String id, String protocol, Map<String, String> fields, String description, String file, int line) {
            super(id, file, line);
            this.protocol = protocol;
            this.fields = fields;
            this.description = description;
        }

        @Override public String kind() { return "Source"; }
    }

    public static final class Shared {
        public final String name;
        public final List<String> contracts;

        public Shared(String name, List<String> contracts) {
            this.name = name;
            this.contracts = List.copyOf(contracts);
        }
    }

    public static final class Trigger {
        public final String sourceContract;
        public final String sourceFlow;
        public final String on;
        public final String targetContract;
        public final String targetFlow;
        public final String persona;

        public Trigger(String sourceContract, String sourceFlow, String on,
                       String targetContract, String targetFlow, String persona) {
            this.sourceContract = sourceContract;
            this.sourceFlow = sourceFlow;
            this.on = on;
            this.targetContract = targetContract;
            this.targetFlow = targetFlow;
            this.persona = persona;
        }
    }

    public static final class Member {
        public final String id;
        public final String path;

        public Member(String id, String path) {
            this.id = id;
            this.path = path;
        }
    }

    public static final class SystemDecl extends Construct {
        public final List<Member> members;
        public final List<Shared> sharedPersonas;
        public final List<Shared> sharedEntities;
        public final List<Trigger> triggers;

        public SystemDecl(String id, List<Member> members, List<Shared> sharedPersonas,
                          List<Shared> sharedEntities, List<Trigger> triggers, String file, int line) {
            super(id, file, line);
            this.members = List.copyOf(members);
            this.sharedPersonas = List.copyOf(sharedPersonas);
            this.sharedEntities = List.copyOf(sharedEntities);
            this.triggers = List.copyOf(triggers);
        }

        @Override public String kind() { return "System"; }
    }
}
