import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.eval.EntityStateMap;
import com.tenor.eval.EvalError;
import com.tenor.eval.EvalException;
import com.tenor.eval.EvalOptions;
import com.tenor.eval.Evaluator;
import com.tenor.eval.FlowResult;
import com.tenor.eval.StepRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TenorFlowEngineTest {

    private static final String TERMINATE = "on_failure: Terminate(outcome: failed)";

    private static final String SOURCE = String.join("\n",
            "persona clerk",
            "persona manager",
            "fact amount { type: Int(min: 0, max: 10000), source: \"erp.amount\" }",
            "fact express { type: Bool, source: \"erp.express\", default: false }",
            "",
            "entity Order { states: [pending, confirmed, shipped], initial: pending,",
            "  transitions: [(pending, confirmed), (confirmed, shipped)] }",
            "entity Payment { states: [due, captured, refunded], initial: due,",
            "  transitions: [(due, captured), (captured, refunded)] }",
            "entity Shipment { states: [ready, sent], initial: ready, transitions: [(ready, sent)] }",
            "",
            "operation confirm { allowed_personas: [clerk], precondition: amount < 1000, effects: [(Order, pending, confirmed)] }",
            "operation approve_big { allowed_personas: [manager], precondition: amount >= 0, effects: [(Order, pending, confirmed)] }",
            "operation capture { allowed_personas: [clerk], precondition: amount > 0, effects: [(Payment, due, captured)] }",
            "operation refund { allowed_personas: [clerk], precondition: amount >= 0, effects: [(Payment, captured, refunded)] }",
            "operation ship { allowed_personas: [clerk], precondition: amount >= 0, effects: [(Shipment, ready, sent)] }",
            "operation close { allowed_personas: [clerk], precondition: amount >= 0, effects: [(Order, confirmed, shipped)] }",
            "",
            "flow checkout { snapshot: at_initiation, entry: step_confirm, steps: {",
            "  step_confirm: OperationStep { op: confirm, persona: clerk, outcomes: { success: route }, " + TERMINATE + " }",
            "  route: BranchStep { condition: express = true, persona: clerk, if_true: Terminal(expedited), if_false: pay }",
            "  pay: OperationStep { op: capture, persona: clerk, outcomes: { success: Terminal(paid) }, on_failure: Terminate(outcome: payment_failed) }",
            "} }",
            "",
            "flow fan_out { snapshot: at_initiation, entry: par, steps: {",
            "  par: ParallelStep {",
            "    branches: [",
            "      Branch { id: money, entry: c, steps: { c: OperationStep { op: capture, persona: clerk, outcomes: { success: Terminal(captured) }, " + TERMINATE + " } } }",
            "      Branch { id: goods, entry: s, steps: { s: OperationStep { op: ship, persona: clerk, outcomes: { success: Terminal(sent) }, " + TERMINATE + " } } }",
            "    ]",
            "    join: JoinPolicy { on_all_success: finish, on_any_failure: Terminate(outcome: partial), on_all_complete: null }",
            "  }",
            "  finish: OperationStep { op: confirm, persona: clerk, outcomes: { success: Terminal(done) }, " + TERMINATE + " }",
            "} }",
            "",
            "flow fan_out_broken { snapshot: at_initiation, entry: par, steps: {",
            "  par: ParallelStep {",
            "    branches: [",
            "      Branch { id: money, entry: c, steps: { c: OperationStep { op: capture, persona: clerk, outcomes: { success: Terminal(captured) }, " + TERMINATE + " } } }",
            "      Branch { id: goods, entry: s, steps: { s: OperationStep { op: ship, persona: clerk, outcomes: { other: Terminal(sent) }, " + TERMINATE + " } } }",
            "    ]",
            "    join: JoinPolicy { on_all_success: Terminal(done), on_any_failure: Terminate(outcome: partial) }",
            "  }",
            "} }",
            "",
            "flow settle { snapshot: at_initiation, entry: cap, steps: {",
            "  cap: OperationStep { op: capture, persona: clerk, outcomes: { success: send }, " + TERMINATE + " }",
            "  send: OperationStep { op: ship, persona: clerk, outcomes: { success: Terminal(done) },",
            "    on_failure: Compensate(steps: [{op: refund, persona: clerk, on_failure: Terminal(refund_failed)}], then: Terminal(rolled_back)) }",
            "} }",
            "",
            "flow settle_wrong_persona { snapshot: at_initiation, entry: cap, steps: {",
            "  cap: OperationStep { op: capture, persona: clerk, outcomes: { success: send }, " + TERMINATE + " }",
            "  send: OperationStep { op: ship, persona: clerk, outcomes: { success: Terminal(done) },",
            "    on_failure: Compensate(steps: [{op: refund, persona: manager, on_failure: Terminal(refund_failed)}], then: Terminal(rolled_back)) }",
            "} }",
            "",
            "flow escalating { snapshot: at_initiation, entry: attempt, steps: {",
            "  attempt: OperationStep { op: confirm, persona: clerk, outcomes: { success: Terminal(confirmed) },",
            "    on_failure: Escalate(to: manager, next: override) }",
            "  override: OperationStep { op: approve_big, persona: manager, outcomes: { success: Terminal(overridden) }, " + TERMINATE + " }",
            "} }",
            "",
            "flow handover { snapshot: at_initiation, entry: pass, steps: {",
            "  pass: HandoffStep { from_persona: clerk, to_persona: manager, next: act }",
            "  act: OperationStep { op: approve_big, persona: manager, outcomes: { success: Terminal(done) }, " + TERMINATE + " }",
            "} }",
            "",
            "flow confirm_only { snapshot: at_initiation, entry: c, steps: {",
            "  c: OperationStep { op: confirm, persona: clerk, outcomes: { success: Terminal(confirmed) }, " + TERMINATE + " }",
            "} }",
            "",
            "flow outer { snapshot: at_initiation, entry: call, steps: {",
            "  call: SubFlowStep { flow: confirm_only, persona: clerk, on_success: after, on_failure: Terminate(outcome: sub_failed) }",
            "  after: OperationStep { op: close, persona: clerk, outcomes: { success: Terminal(done) }, " + TERMINATE + " }",
            "} }",
            "",
            "flow outer_outer { snapshot: at_initiation, entry: call, steps: {",
            "  call: SubFlowStep { flow: outer, persona: clerk, on_success: Terminal(done), on_failure: Terminate(outcome: too_deep) }",
            "} }",
            "",
            "flow unhandled { snapshot: at_initiation, entry: c, steps: {",
            "  c: OperationStep { op: confirm, persona: clerk, outcomes: { approved: Terminal(done) }, " + TERMINATE + " }",
            "} }",
            "",
            "flow outer_broken { snapshot: at_initiation, entry: call, steps: {",
            "  call: SubFlowStep { flow: unhandled, persona: clerk, on_success: Terminal(done), on_failure: Terminate(outcome: sub_failed) }",
            "} }");

    private final ObjectNode bundle = TenorFixtures.elaborate(SOURCE);
    private final Evaluator evaluator = new Evaluator();

    private static EntityStateMap fresh() {
        return new EntityStateMap()
                .set("Order", "_default", "pending")
                .set("Payment", "_default", "due")
                .set("Shipment", "_default", "ready");
    }

    private static JsonNode facts(int amount, boolean express) {
        return TenorFixtures.json("{\"amount\": " + amount + ", \"express\": " + express + "}");
    }

    private FlowResult run(String flowId, int amount) {
        return evaluator.executeFlow(bundle, flowId, "clerk", facts(amount, false), fresh(), null);
    }

    private static List<String> ids(FlowResult r) {
        List<String> out = new ArrayList<>();
        for (StepRecord s : r.stepsExecuted) out.add(s.stepId);
        return out;
    }

    // ---------------- linear paths and branches ----------------

    @Test
    public void checkout_branchFalseTakesPaymentPath() {
        FlowResult r = run("checkout", 100);

        assertEquals("paid", r.outcome);
        assertEquals("clerk", r.initiatingPersona);
        assertEquals(List.of("step_confirm", "route", "pay"), ids(r));
        assertEquals("false", r.step("route").result);
        assertEquals("branch", r.step("route").stepType);
        assertEquals(2, r.entityStateChanges.size());
        assertEquals("confirmed", r.entityStates.get("Order", "_default"));
        assertEquals("captured", r.entityStates.get("Payment", "_default"));
    }

    @Test
    public void checkout_branchTrueEndsEarly() {
        FlowResult r = evaluator.executeFlow(bundle, "checkout", "clerk", facts(100, true), fresh(), null);
        assertEquals("expedited", r.outcome);
        assertEquals(List.of("step_confirm", "route"), ids(r));
        assertEquals("due", r.entityStates.get("Payment", "_default"));
    }

    @Test
    public void operationFailure_terminates() {
        FlowResult r = run("checkout", 5000);
        assertEquals("failed", r.outcome);
        assertTrue(r.step("step_confirm").result.startsWith("error: "), r.step("step_confirm").result);
        assertTrue(r.entityStateChanges.isEmpty());
    }

    @Test
    public void callerStatesAreNeverMutated() {
        EntityStateMap states = fresh();
        EntityStateMap before = states.copy();
        evaluator.executeFlow(bundle, "checkout", "clerk", facts(100, false), states, null);
        assertEquals(before, states);
    }

    @Test
    public void results_areDeterministic() {
        assertEquals(run("fan_out", 100).toJson().toString(), run("fan_out", 100).toJson().toString());
    }

    @Test
    public void bindings_areRecordedOnOperationSteps() {
        EntityStateMap states = new EntityStateMap()
                .set("Order", "ord-1", "pending")
                .set("Payment", "pay-1", "due");
        FlowResult r = evaluator.executeFlow(bundle, "checkout", "clerk", facts(100, false), states,
                Map.of("Order", "ord-1", "Payment", "pay-1"));
        assertEquals("paid", r.outcome);
        assertEquals(Map.of("Order", "ord-1"), r.step("step_confirm").instanceBindings);
        assertEquals("captured", r.entityStates.get("Payment", "pay-1"));
    }

    // ---------------- parallel ----------------

    @Test
    public void parallel_allSuccessMergesBranchEffects() {
        FlowResult r = run("fan_out", 100);

        assertEquals("done", r.outcome);
        assertEquals(List.of("par", "c", "s", "finish"), ids(r));
        assertEquals("parallel", r.step("par").stepType);
        assertEquals("money:captured, goods:sent", r.step("par").result);
        assertEquals("captured", r.entityStates.get("Payment", "_default"));
        assertEquals("sent", r.entityStates.get("Shipment", "_default"));
        assertEquals("confirmed", r.entityStates.get("Order", "_default"));
        assertEquals(3, r.entityStateChanges.size());
    }

    @Test
    public void parallel_anyFailureUsesHandlerButKeepsSuccessfulBranches() {
        FlowResult r = run("fan_out_broken", 100);

        assertEquals("partial", r.outcome);
        assertTrue(r.step("par").result.contains("goods:error:"), r.step("par").result);
        assertEquals("captured", r.entityStates.get("Payment", "_default"));
        assertEquals("ready", r.entityStates.get("Shipment", "_default"));
    }

    // ---------------- failure handlers ----------------

    @Test
    public void compensation_runsAndRecordsCompStep() {
        EntityStateMap states = fresh().set("Shipment", "_default", "sent");

        FlowResult r = evaluator.executeFlow(bundle, "settle", "clerk", facts(100, false), states, null);

        assertEquals("rolled_back", r.outcome);
        assertEquals(List.of("cap", "send", "comp:refund"), ids(r));
        StepRecord comp = r.step("comp:refund");
        assertEquals("compensation", comp.stepType);
        assertEquals("success", comp.result);
        assertEquals("refunded", r.entityStates.get("Payment", "_default"));
    }

    @Test
    public void compensation_failureEndsWithItsOutcome() {
        EntityStateMap states = fresh().set("Shipment", "_default", "sent");
        FlowResult r = evaluator.executeFlow(bundle, "settle_wrong_persona", "clerk", facts(100, false), states, null);
        assertEquals("refund_failed", r.outcome);
        assertTrue(r.step("comp:refund").result.startsWith("error: "));
        assertEquals("captured", r.entityStates.get("Payment", "_default"));
    }

    @Test
    public void escalation_continuesAtNextStep() {
        FlowResult r = run("escalating", 5000);

        assertEquals("overridden", r.outcome);
        assertEquals(List.of("attempt", "attempt", "override"), ids(r));
        assertEquals("escalation", r.stepsExecuted.get(1).stepType);
        assertEquals("escalated to manager", r.stepsExecuted.get(1).result);
        assertEquals("confirmed", r.entityStates.get("Order", "_default"));
    }

    @Test
    public void handoff_isRecorded() {
        FlowResult r = run("handover", 100);
        assertEquals("done", r.outcome);
        assertEquals("handoff", r.step("pass").stepType);
    }

    // ---------------- sub-flows ----------------

    @Test
    public void subFlow_effectsFlowBackToParent() {
        FlowResult r = run("outer", 100);

        assertEquals("done", r.outcome);
        assertEquals(List.of("call", "c", "after"), ids(r));
        assertEquals("sub_flow", r.step("call").stepType);
        assertEquals("confirmed", r.step("call").result);
        assertEquals("shipped", r.entityStates.get("Order", "_default"));
    }

    @Test
    public void subFlow_errorUsesParentHandler() {
        FlowResult r = run("outer_broken", 100);
        assertEquals("sub_failed", r.outcome);
        assertEquals("pending", r.entityStates.get("Order", "_default"));
        assertTrue(r.step("call").result.contains("operation outcome 'success' not handled in step 'c'"),
                r.step("call").result);
    }

    @Test
    public void subFlow_depthLimit() {
        Evaluator shallow = new Evaluator(EvalOptions.defaults().maxSubFlowDepth(1));
        FlowResult r = shallow.executeFlow(bundle, "outer_outer", "clerk", facts(100, false), fresh(), null);
        assertEquals("too_deep", r.outcome);
        assertTrue(r.step("call").result.contains("sub-flow nesting exceeded maximum depth (1)"), r.step("call").result);
    }

    // ---------------- engine errors ----------------

    @Test
    public void unhandledOutcome_isFlowError() {
        EvalException e = assertThrows(EvalException.class, () -> run("unhandled", 100));
        assertEquals(EvalError.FLOW_ERROR, e.kind());
        assertEquals("unhandled", e.subject());
        assertEquals("flow error in 'unhandled': operation outcome 'success' not handled in step 'c'", e.getMessage());
    }

    @Test
    public void stepLimit_isFlowError() {
        Evaluator tight = new Evaluator(EvalOptions.defaults().maxFlowSteps(2));
        EvalException e = assertThrows(EvalException.class,
                () -> tight.executeFlow(bundle, "checkout", "clerk", facts(100, false), fresh(), null));
        assertEquals(EvalError.FLOW_ERROR, e.kind());
        assertEquals("flow error in 'checkout': exceeded maximum step count (2)", e.getMessage());
    }

    @Test
    public void unknownFlow_isCallerError() {
        assertThrows(IllegalArgumentException.class, () -> run("nope", 100));
    }

    @Test
    public void json_listsStepsAndChanges() {
        JsonNode json = run("checkout", 100).toJson();
        assertEquals("paid", json.get("outcome").asText());
        assertEquals(3, json.get("steps_executed").size());
        assertEquals("Order", json.get("entity_state_changes").get(0).get("entity_id").asText());
        assertEquals("clerk", json.get("initiating_persona").asText());
    }
}
