package com.tenor.eval;

import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Why an action cannot be taken right now. The set of reasons is closed. */
public abstract class BlockedReason {

    public enum Kind { PERSONA_NOT_AUTHORIZED, PRECONDITION_NOT_MET, ENTITY_NOT_IN_SOURCE_STATE, MISSING_FACTS }

    private BlockedReason() {}

    public abstract Kind kind();

    public abstract ObjectNode toJson();

    public static final class PersonaNotAuthorized extends BlockedReason {
        @Override public Kind kind() { return Kind.PERSONA_NOT_AUTHORIZED; }

        @Override
        public ObjectNode toJson() {
            return JsonNodeFactory.instance.objectNode().put("type", "PersonaNotAuthorized");
        }
    }

    /** Empty {@code missingVerdicts} means the verdicts exist but the precondition is still false. */
    public static final class PreconditionNotMet extends BlockedReason {
        public final List<String> missingVerdicts;

        public PreconditionNotMet(List<String> missingVerdicts) {
            this.missingVerdicts = List.copyOf(missingVerdicts);
        }

        @Override public Kind kind() { return Kind.PRECONDITION_NOT_MET; }

        @Override
        public ObjectNode toJson() {
            ObjectNode o = JsonNodeFactory.instance.objectNode().put("type", "PreconditionNotMet");
            ArrayNode arr = o.putArray("missing_verdicts");
            for (String v : missingVerdicts) arr.add(v);
            return o;
        }
    }

    public static final class EntityNotInSourceState extends BlockedReason {
        public final String entityId;
        public final String currentState;
        public final String requiredState;

        public EntityNotInSourceState(String entityId, String currentState, String requiredState) {
            this.entityId = entityId;
            this.currentState = currentState;
            this.requiredState = requiredState;
        }

        @Override public Kind kind() { return Kind.ENTITY_NOT_IN_SOURCE_STATE; }

        @Override
        public ObjectNode toJson() {
            return JsonNodeFactory.instance.objectNode()
                    .put("type", "EntityNotInSourceState")
                    .put("entity_id", entityId)
                    .put("current_state", currentState)
                    .put("required_state", requiredState);
        }
    }

    public static final class MissingFacts extends BlockedReason {
        public final List<String> factIds;

        public MissingFacts(List<String> factIds) {
            this.factIds = List.copyOf(factIds);
        }

        @Override public Kind kind() { return Kind.MISSING_FACTS; }

        @Override
        public ObjectNode toJson() {
            ObjectNode o = JsonNodeFactory.instance.objectNode().put("type", "MissingFacts");
            ArrayNode arr = o.putArray("fact_ids");
            for (String f : factIds) arr.add(f);
            return o;
        }
    }
}
