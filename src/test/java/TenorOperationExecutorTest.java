import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.eval.EffectRecord;
import com.tenor.eval.EntityStateMap;
import com.tenor.eval.EvalError;
import com.tenor.eval.EvalException;
import com.tenor.eval.Evaluator;
import com.tenor.eval.InstanceBindings;
import com.tenor.eval.OperationError;
import com.tenor.eval.OperationException;
import com.tenor.eval.OperationResult;
import com.tenor.interchange.Contract;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TenorOperationExecutorTest {

    private static final String SETTLEMENT = String.join("\n",
            "persona clerk",
            "persona auditor",
            "fact amount { type: Int(min: 0, max: 10000), source: \"erp.amount\" }",
            "",
            "entity Order { states: [pending, confirmed, shipped], initial: pending,",
            "  transitions: [(pending, confirmed), (confirmed, shipped)] }",
            "entity Invoice { states: [open, paid], initial: open, transitions: [(open, paid)] }",
            "entity Claim { states: [submitted, escalated, approved, denied], initial: submitted,",
            "  transitions: [(submitted, approved), (escalated, denied), (submitted, escalated)] }",
            "",
            "rule ok_amount { stratum: 0, when: amount <= 5000, produce: verdict within_limit { payload: Bool = true } }",
            "",
            "operation confirm {",
            "  allowed_personas: [clerk]",
            "  precondition: verdict_present(within_limit)",
            "  effects: [(Order, pending, confirmed)]",
            "}",
            "operation settle {",
            "  allowed_personas: [clerk]",
            "  precondition: amount > 0",
            "  effects: [(Order, confirmed, shipped), (Invoice, open, paid)]",
            "}",
            "operation review {",
            "  allowed_personas: [auditor]",
            "  precondition: amount >= 0",
            "  effects: [(Claim, submitted, approved, accepted), (Claim, escalated, denied, rejected)]",
            "  outcomes: [accepted, rejected]",
            "}",
            "operation note {",
            "  allowed_personas: [auditor]",
            "  precondition: amount >= 0",
            "  effects: []",
            "  outcomes: [noted]",
            "}");

    private final Evaluator evaluator = new Evaluator();
    private final ObjectNode bundle = TenorFixtures.elaborate(SETTLEMENT);

    private static JsonNode amount(int value) {
        return TenorFixtures.json("{\"amount\": " + value + "}");
    }

    @Test
    public void confirm_appliesTransitionOnDefaultInstance() {
        EntityStateMap states = EntityStateMap.single(Map.of("Order", "pending"));

        OperationResult r = evaluator.executeOperation(bundle, "confirm", "clerk", amount(100), states, null);

        assertEquals("success", r.outcome);
        assertEquals(1, r.effects.size());
        EffectRecord effect = r.effects.get(0);
        assertEquals("Order", effect.entityId);
        assertEquals(InstanceBindings.DEFAULT_INSTANCE_ID, effect.instanceId);
        assertEquals("pending", effect.stateBefore);
        assertEquals("confirmed", effect.stateAfter);
        assertEquals("confirmed", r.entityStates.get("Order", "_default"));

        // caller's map is left alone
        assertEquals("pending", states.get("Order", "_default"));
    }

    @Test
    public void confirm_provenanceNamesVerdictsAndBindings() {
        OperationResult r = evaluator.executeOperation(bundle, "confirm", "clerk", amount(100),
                EntityStateMap.single(Map.of("Order", "pending")), null);
        assertEquals("confirm", r.provenance.operationId);
        assertEquals("clerk", r.provenance.persona);
        assertEquals(List.of("within_limit"), r.provenance.verdictsUsed);
        assertEquals(Map.of("Order", "_default"), r.provenance.instanceBindings);

        JsonNode json = r.toJson();
        assertEquals("success", json.get("outcome").asText());
        assertEquals("pending", json.get("effects").get(0).get("state_before").asText());
    }

    @Test
    public void wrongSourceState_reportsMismatch() {
        EntityStateMap states = EntityStateMap.single(Map.of("Order", "shipped"));

        OperationException e = assertThrows(OperationException.class,
                () -> evaluator.executeOperation(bundle, "confirm", "clerk", amount(100), states, null));

        assertEquals(OperationError.TRANSITION_SOURCE_MISMATCH, e.kind());
        assertEquals("Order", e.entityId());
        assertEquals("_default", e.instanceId());
        assertEquals("shipped", e.currentState());
        assertEquals("pending", e.requiredState());
        assertEquals("shipped", states.get("Order", "_default"));
    }

    @Test
    public void secondEffectFailing_appliesNothing() {
        EntityStateMap states = new EntityStateMap()
                .set("Order", "_default", "confirmed")
                .set("Invoice", "_default", "paid");
        EntityStateMap before = states.copy();

        OperationException e = assertThrows(OperationException.class,
                () -> evaluator.executeOperation(bundle, "settle", "clerk", amount(100), states, null));

        assertEquals(OperationError.TRANSITION_SOURCE_MISMATCH, e.kind());
        assertEquals("Invoice", e.entityId());
        assertEquals(before, states);
        assertEquals("confirmed", states.get("Order", "_default"));
    }

    @Test
    public void bothEffectsApplied_whenAllValid() {
        EntityStateMap states = new EntityStateMap()
                .set("Order", "_default", "confirmed")
                .set("Invoice", "_default", "open");
        OperationResult r = evaluator.executeOperation(bundle, "settle", "clerk", amount(100), states, null);
        assertEquals(2, r.effects.size());
        assertEquals("shipped", r.entityStates.get("Order", "_default"));
        assertEquals("paid", r.entityStates.get("Invoice", "_default"));
    }

    @Test
    public void personaNotAllowed_isRejectedFirst() {
        // wrong state too, but the persona check comes first
        EntityStateMap states = EntityStateMap.single(Map.of("Order", "shipped"));
        OperationException e = assertThrows(OperationException.class,
                () -> evaluator.executeOperation(bundle, "confirm", "auditor", amount(100), states, null));
        assertEquals(OperationError.PERSONA_REJECTED, e.kind());
        assertEquals("auditor", e.persona());
        assertEquals("persona 'auditor' not authorized for operation 'confirm'", e.getMessage());
    }

    @Test
    public void missingVerdict_failsPrecondition() {
        OperationException e = assertThrows(OperationException.class,
                () -> evaluator.executeOperation(bundle, "confirm", "clerk", amount(9000),
                        EntityStateMap.single(Map.of("Order", "pending")), null));
        assertEquals(OperationError.PRECONDITION_FAILED, e.kind());
        assertEquals("confirm", e.operationId());
    }

    @Test
    public void unknownInstance_isEntityNotFound() {
        EntityStateMap states = new EntityStateMap().set("Order", "ord-1", "pending");
        OperationException e = assertThrows(OperationException.class,
                () -> evaluator.executeOperation(bundle, "confirm", "clerk", amount(100), states, Map.of("Order", "ord-9")));
        assertEquals(OperationError.ENTITY_NOT_FOUND, e.kind());
        assertEquals("ord-9", e.instanceId());
    }

    @Test
    public void bindings_targetNamedInstanceOnly() {
        EntityStateMap states = new EntityStateMap()
                .set("Order", "ord-1", "pending")
                .set("Order", "ord-2", "pending");

        OperationResult r = evaluator.executeOperation(bundle, "confirm", "clerk", amount(100), states,
                Map.of("Order", "ord-2"));

        assertEquals("pending", r.entityStates.get("Order", "ord-1"));
        assertEquals("confirmed", r.entityStates.get("Order", "ord-2"));
        assertEquals("ord-2", r.effects.get(0).instanceId);
    }

    @Test
    public void multiOutcome_firstOutcomeWhoseEffectsValidate() {
        OperationResult accepted = evaluator.executeOperation(bundle, "review", "auditor", amount(1),
                EntityStateMap.single(Map.of("Claim", "submitted")), null);
        assertEquals("accepted", accepted.outcome);
        assertEquals("approved", accepted.entityStates.get("Claim", "_default"));

        OperationResult rejected = evaluator.executeOperation(bundle, "review", "auditor", amount(1),
                EntityStateMap.single(Map.of("Claim", "escalated")), null);
        assertEquals("rejected", rejected.outcome);
        assertEquals("denied", rejected.entityStates.get("Claim", "_default"));
    }

    @Test
    public void multiOutcome_noneValidates_reportsFirstFailure() {
        OperationException e = assertThrows(OperationException.class,
                () -> evaluator.executeOperation(bundle, "review", "auditor", amount(1),
                        EntityStateMap.single(Map.of("Claim", "approved")), null));
        assertEquals(OperationError.TRANSITION_SOURCE_MISMATCH, e.kind());
        assertEquals("submitted", e.requiredState());
    }

    @Test
    public void singleDeclaredOutcome_isUsed() {
        OperationResult r = evaluator.executeOperation(bundle, "note", "auditor", amount(1), new EntityStateMap(), null);
        assertEquals("noted", r.outcome);
        assertTrue(r.effects.isEmpty());
    }

    @Test
    public void unknownOperation_isCallerError() {
        assertThrows(IllegalArgumentException.class,
                () -> evaluator.executeOperation(bundle, "teleport", "clerk", amount(1), new EntityStateMap(), null));
    }

    @Test
    public void missingFacts_surfaceAsEvalError() {
        EvalException e = assertThrows(EvalException.class,
                () -> evaluator.executeOperation(bundle, "confirm", "clerk", TenorFixtures.facts(),
                        EntityStateMap.single(Map.of("Order", "pending")), null));
        assertEquals(EvalError.MISSING_FACT, e.kind());
    }

    @Test
    public void instanceBindings_resolveDefaultsPerAffectedEntity() {
        Contract contract = Evaluator.load(bundle);
        Contract.Operation settle = contract.operation("settle");

        Map<String, String> resolved = InstanceBindings.resolve(settle, Map.of("Order", "ord-7", "Unrelated", "x"));

        assertEquals(Map.of("Order", "ord-7", "Invoice", "_default"), resolved);
        assertEquals(Map.of("Order", "_default", "Invoice", "_default"), InstanceBindings.resolve(settle, null));
    }
}
