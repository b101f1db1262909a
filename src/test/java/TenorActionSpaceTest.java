import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.eval.ActionSpace;
import com.tenor.eval.BlockedReason;
import com.tenor.eval.EntityStateMap;
import com.tenor.eval.Evaluator;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

public class TenorActionSpaceTest {

    private static final String SOURCE = String.join("\n",
            TenorFixtures.orderContract(),
            "",
            "flow dispatch {",
            "  snapshot: at_initiation",
            "  entry: go",
            "  steps: {",
            "    go: OperationStep { op: ship, persona: clerk, outcomes: { success: Terminal(sent) }, on_failure: Terminate(outcome: failed) }",
            "  }",
            "}");

    private final Evaluator evaluator = new Evaluator();
    private final ObjectNode bundle = TenorFixtures.elaborate(SOURCE);

    private static JsonNode amount(int value) {
        return TenorFixtures.json("{\"amount\": " + value + "}");
    }

    @Test
    public void availableAction_carriesVerdictsAndEntities() {
        ActionSpace space = evaluator.computeActionSpace(bundle, amount(100),
                EntityStateMap.single(Map.of("Order", "pending")), "clerk");

        ActionSpace.Action fulfil = space.action("fulfil");
        assertNotNull(fulfil);
        assertEquals("confirm", fulfil.entryOperationId);
        assertEquals("clerk", fulfil.personaId);
        assertEquals(1, fulfil.enablingVerdicts.size());
        assertEquals("approved", fulfil.enablingVerdicts.get(0).verdictType);
        assertEquals("auto_approve", fulfil.enablingVerdicts.get(0).producingRule);
        assertEquals("Order", fulfil.affectedEntities.get(0).entityId);
        assertEquals("pending", fulfil.affectedEntities.get(0).currentState);
        assertEquals(List.of("confirmed", "cancelled"), fulfil.affectedEntities.get(0).possibleTransitions);
        assertEquals("Execute fulfil: confirm transitions Order from pending to confirmed", fulfil.description);

        assertEquals(2, space.currentVerdicts.size());
    }

    @Test
    public void entityInWrongState_blocksWithCurrentAndRequired() {
        ActionSpace space = evaluator.computeActionSpace(bundle, amount(100),
                EntityStateMap.single(Map.of("Order", "pending")), "clerk");

        ActionSpace.BlockedAction dispatch = space.blocked("dispatch");
        assertNotNull(dispatch);
        assertEquals(BlockedReason.Kind.ENTITY_NOT_IN_SOURCE_STATE, dispatch.reason.kind());
        BlockedReason.EntityNotInSourceState reason = (BlockedReason.EntityNotInSourceState) dispatch.reason;
        assertEquals("Order", reason.entityId);
        assertEquals("pending", reason.currentState);
        assertEquals("confirmed", reason.requiredState);
        assertNull(space.action("dispatch"));
    }

    @Test
    public void instanceBindings_listOnlyInstancesInSourceState() {
        EntityStateMap states = new EntityStateMap()
                .set("Order", "ord-1", "pending")
                .set("Order", "ord-2", "shipped")
                .set("Order", "ord-3", "pending");

        ActionSpace space = evaluator.computeActionSpace(bundle, amount(100), states, "clerk");

        ActionSpace.Action fulfil = space.action("fulfil");
        assertNotNull(fulfil);
        assertEquals(new TreeSet<>(Set.of("ord-1", "ord-3")), fulfil.instanceBindings.get("Order"));
    }

    @Test
    public void unknownEntityState_whenNoInstances() {
        ActionSpace space = evaluator.computeActionSpace(bundle, amount(100), new EntityStateMap(), "clerk");
        BlockedReason.EntityNotInSourceState reason =
                (BlockedReason.EntityNotInSourceState) space.blocked("fulfil").reason;
        assertEquals("(unknown)", reason.currentState);
    }

    @Test
    public void wrongPersona_isNotAuthorized() {
        ActionSpace space = evaluator.computeActionSpace(bundle, amount(100),
                EntityStateMap.single(Map.of("Order", "pending")), "buyer");
        assertTrue(space.actions.isEmpty());
        assertEquals(2, space.blockedActions.size());
        assertEquals(BlockedReason.Kind.PERSONA_NOT_AUTHORIZED, space.blocked("fulfil").reason.kind());
    }

    @Test
    public void absentVerdict_isPreconditionNotMet() {
        ActionSpace space = evaluator.computeActionSpace(bundle, amount(900),
                EntityStateMap.single(Map.of("Order", "pending")), "clerk");
        BlockedReason reason = space.blocked("fulfil").reason;
        assertEquals(BlockedReason.Kind.PRECONDITION_NOT_MET, reason.kind());
        assertEquals(List.of("approved"), ((BlockedReason.PreconditionNotMet) reason).missingVerdicts);
    }

    @Test
    public void missingFacts_blockEveryAction() {
        ActionSpace space = evaluator.computeActionSpace(bundle, TenorFixtures.facts(),
                EntityStateMap.single(Map.of("Order", "pending")), "clerk");
        assertTrue(space.actions.isEmpty());
        assertTrue(space.currentVerdicts.isEmpty());
        for (ActionSpace.BlockedAction b : space.blockedActions) {
            assertEquals(BlockedReason.Kind.MISSING_FACTS, b.reason.kind());
            assertEquals(List.of("amount"), ((BlockedReason.MissingFacts) b.reason).factIds);
        }
    }

    @Test
    public void json_hasAllSections() {
        JsonNode json = evaluator.computeActionSpace(bundle, amount(100),
                EntityStateMap.single(Map.of("Order", "pending")), "clerk").toJson();
        assertEquals("clerk", json.get("persona_id").asText());
        assertEquals("fulfil", json.get("actions").get(0).get("flow_id").asText());
        assertEquals("EntityNotInSourceState", json.get("blocked_actions").get(0).get("reason").get("type").asText());
        assertEquals(2, json.get("current_verdicts").size());
    }
}
