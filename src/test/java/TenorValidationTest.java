import org.junit.jupiter.api.Test;

import com.tenor.elaborate.ElabError;
import com.tenor.elaborate.ElaborationException;

import static org.junit.jupiter.api.Assertions.*;

public class TenorValidationTest {

    private static ElaborationException rejected(String... lines) {
        return assertThrows(ElaborationException.class, () -> TenorFixtures.elaborate(String.join("\n", lines)));
    }

    private static final String ORDER_ENTITY = String.join("\n",
            "entity Order {",
            "  states: [draft, submitted, approved]",
            "  initial: draft",
            "  transitions: [(draft, submitted), (submitted -> approved)]",
            "}");

    private static final String TRUE_FACT = "fact ready { type: Bool, source: \"sys.ready\" }";

    // ---------------- entities ----------------

    @Test
    public void entity_initialMustBeDeclared() {
        ElabError err = rejected(
                "entity Doc { states: [a, b], initial: c, transitions: [(a, b)] }").error();
        assertEquals(5, err.pass);
        assertEquals("Entity", err.constructKind);
        assertEquals("initial", err.field);
        assertEquals("initial state 'c' is not declared in states: [a, b]", err.message);
    }

    @Test
    public void entity_transitionEndpointMustBeDeclared() {
        ElabError err = rejected(
                "entity Doc { states: [a, b], initial: a, transitions: [(a, z)] }").error();
        assertEquals("transitions", err.field);
        assertEquals("transition endpoint 'z' is not declared in states: [a, b]", err.message);
    }

    @Test
    public void entity_hierarchyCycle() {
        ElabError err = rejected(
                "entity A { states: [s], initial: s, transitions: [], parent: B }",
                "entity B { states: [s], initial: s, transitions: [], parent: A }").error();
        assertEquals("entity hierarchy cycle detected: A → B → A", err.message);
        assertEquals("B", err.constructId);
    }

    @Test
    public void violationsAreCollectedInDeclarationOrder() {
        ElaborationException e = rejected(
                "entity Doc { states: [a, b], initial: c, transitions: [(a, z)] }");
        assertEquals(2, e.all().size());
        assertSame(e.all().get(0), e.error());
        assertEquals("initial", e.all().get(0).field);
        assertEquals("transitions", e.all().get(1).field);
    }

    // ---------------- rules ----------------

    @Test
    public void rule_verdictProducedTwice() {
        ElabError err = rejected(
                TRUE_FACT,
                "rule r1 { stratum: 0, when: ready = true, produce: verdict ok { payload: Bool = true } }",
                "rule r2 { stratum: 0, when: ready = false, produce: verdict ok { payload: Bool = false } }").error();
        assertEquals("r2", err.constructId);
        assertEquals("VerdictType 'ok' is already produced by rule 'r1'. Each VerdictType may be produced by at most one rule",
                err.message);
    }

    @Test
    public void rule_negativeStratum() {
        ElabError err = rejected(
                TRUE_FACT,
                "rule r { stratum: -1, when: ready = true, produce: verdict ok { payload: Bool = true } }").error();
        assertEquals("stratum", err.field);
        assertEquals("stratum must be a non-negative integer; got -1", err.message);
    }

    @Test
    public void rule_unresolvedVerdictReference() {
        ElabError err = rejected(
                TRUE_FACT,
                "rule r { stratum: 1, when: verdict_present(ghost), produce: verdict ok { payload: Bool = true } }").error();
        assertEquals("body.when", err.field);
        assertEquals("unresolved VerdictType reference: 'ghost' is not produced by any rule in this contract", err.message);
    }

    @Test
    public void rule_sameStratumReference_isViolation() {
        ElabError err = rejected(
                TRUE_FACT,
                "rule base { stratum: 0, when: ready = true, produce: verdict first { payload: Bool = true } }",
                "rule next { stratum: 0, when: verdict_present(first), produce: verdict second { payload: Bool = true } }").error();
        assertTrue(err.message.startsWith("stratum violation: rule 'next' at stratum 0 references verdict 'first' "
                + "produced by rule 'base' at stratum 0"), err.message);
    }

    // ---------------- operations ----------------

    @Test
    public void earliestDeclaredConstructIsReportedAcrossValidators() {
        ElaborationException e = rejected(
                TRUE_FACT,
                "operation early { allowed_personas: [], precondition: ready = true, effects: [] }",
                "entity Late { states: [a, b], initial: c, transitions: [(a, b)] }");
        assertEquals("Operation", e.error().constructKind);
        assertEquals("early", e.error().constructId);
        assertEquals(2, e.all().size());
        assertEquals("Late", e.all().get(1).constructId);
        assertTrue(e.all().get(0).line < e.all().get(1).line);
    }

    @Test
    public void operation_emptyPersonas() {
        ElabError err = rejected(
                TRUE_FACT,
                "operation o { allowed_personas: [], precondition: ready = true, effects: [] }").error();
        assertEquals("allowed_personas", err.field);
        assertTrue(err.message.startsWith("allowed_personas must be non-empty"), err.message);
    }

    @Test
    public void operation_undeclaredPersonaWhenPersonasExist() {
        ElabError err = rejected(
                TRUE_FACT,
                "persona clerk",
                "operation o { allowed_personas: [clerk, intruder], precondition: ready = true, effects: [] }").error();
        assertEquals("undeclared persona 'intruder' in allowed_personas", err.message);
    }

    @Test
    public void operation_effectMustBeDeclaredTransition() {
        ElabError err = rejected(
                TRUE_FACT,
                ORDER_ENTITY,
                "operation o { allowed_personas: [p], precondition: ready = true, effects: [(Order, draft, approved)] }").error();
        assertEquals("effects", err.field);
        assertTrue(err.message.endsWith("is not a declared transition in entity Order; declared transitions are: "
                + "[(draft, submitted), (submitted, approved)]"), err.message);
    }

    @Test
    public void operation_effectOnUndeclaredEntity() {
        ElabError err = rejected(
                TRUE_FACT,
                "operation o { allowed_personas: [p], precondition: ready = true, effects: [(Ghost, a, b)] }").error();
        assertEquals("effect references undeclared entity 'Ghost'", err.message);
    }

    @Test
    public void operation_multiOutcomeNeedsEffectLabels() {
        ElabError err = rejected(
                TRUE_FACT,
                ORDER_ENTITY,
                "operation o {",
                "  allowed_personas: [p]",
                "  precondition: ready = true",
                "  effects: [(Order, draft, submitted)]",
                "  outcomes: [accepted, deferred]",
                "}").error();
        assertTrue(err.message.contains("is missing an outcome label"), err.message);
    }

    @Test
    public void operation_outcomesDisjointFromErrorContract() {
        ElabError err = rejected(
                TRUE_FACT,
                "operation o { allowed_personas: [p], precondition: ready = true, effects: [],",
                "  outcomes: [done], error_contract: [done] }").error();
        assertEquals("outcome 'done' conflicts with error_contract; outcomes and error_contract must be disjoint",
                err.message);
    }

    @Test
    public void operation_duplicateOutcome() {
        ElabError err = rejected(
                TRUE_FACT,
                "operation o { allowed_personas: [p], precondition: ready = true, effects: [], outcomes: [done, done] }").error();
        assertEquals("duplicate outcome 'done'; outcome labels must be unique within an Operation", err.message);
    }

    // ---------------- sources ----------------

    @Test
    public void source_httpRequiresBaseUrl() {
        ElabError err = rejected("source billing { protocol: http }").error();
        assertEquals("Source", err.constructKind);
        assertEquals("source 'billing' with protocol 'http' is missing required field 'base_url'", err.message);
    }

    @Test
    public void source_unknownProtocol() {
        ElabError err = rejected("source s { protocol: carrier_pigeon }").error();
        assertEquals("unknown protocol tag 'carrier_pigeon'", err.message);
    }

    @Test
    public void source_structuredFactNeedsDeclaredSource() {
        ElabError err = rejected("fact total { type: Int, source: ledger { path: \"totals.day\" } }").error();
        assertEquals("Fact", err.constructKind);
        assertEquals("fact 'total' references undeclared source 'ledger'", err.message);
    }

    @Test
    public void source_declaredSourceAccepted() {
        TenorFixtures.elaborate(String.join("\n",
                "source ledger { protocol: database, dialect: \"postgres\" }",
                "source feed { protocol: x_internal_feed }",
                "fact total { type: Int, source: ledger { path: \"totals.day\" } }"));
    }

    // ---------------- flows ----------------

    private static String flowOps() {
        return String.join("\n",
                TRUE_FACT,
                "persona p",
                ORDER_ENTITY,
                "operation submit { allowed_personas: [p], precondition: ready = true, effects: [(Order, draft, submitted)] }",
                "operation approve { allowed_personas: [p], precondition: ready = true, effects: [(Order, submitted, approved)] }");
    }

    @Test
    public void flow_entryMustExist() {
        ElabError err = rejected(flowOps(),
                "flow f { snapshot: at_initiation, entry: nowhere, steps: {",
                "  s1: OperationStep { op: submit, persona: p, outcomes: { success: Terminal(done) }, on_failure: Terminate(outcome: failed) }",
                "} }").error();
        assertEquals("Flow", err.constructKind);
        assertEquals("entry", err.field);
        assertEquals("entry step 'nowhere' is not declared in steps", err.message);
    }

    @Test
    public void flow_operationStepNeedsFailureHandler() {
        ElabError err = rejected(flowOps(),
                "flow f { snapshot: at_initiation, entry: s1, steps: {",
                "  s1: OperationStep { op: submit, persona: p, outcomes: { success: Terminal(done) } }",
                "} }").error();
        assertEquals("steps.s1.on_failure", err.field);
        assertEquals("OperationStep 's1' must declare a FailureHandler", err.message);
    }

    @Test
    public void flow_stepCycle() {
        ElabError err = rejected(flowOps(),
                "flow f { snapshot: at_initiation, entry: s1, steps: {",
                "  s1: OperationStep { op: submit, persona: p, outcomes: { success: s2 }, on_failure: Terminate(outcome: failed) }",
                "  s2: OperationStep { op: approve, persona: p, outcomes: { success: s1 }, on_failure: Terminate(outcome: failed) }",
                "} }").error();
        assertEquals("flow step graph is not acyclic: cycle detected: s1 → s2 → s1", err.message);
    }

    @Test
    public void flow_referenceCycle() {
        ElabError err = rejected(flowOps(),
                "flow f1 { snapshot: at_initiation, entry: call, steps: {",
                "  call: SubFlowStep { flow: f2, persona: p, on_success: Terminal(done), on_failure: Terminate(outcome: failed) }",
                "} }",
                "flow f2 { snapshot: at_initiation, entry: call, steps: {",
                "  call: SubFlowStep { flow: f1, persona: p, on_success: Terminal(done), on_failure: Terminate(outcome: failed) }",
                "} }").error();
        assertEquals("f2", err.constructId);
        assertEquals("steps.call.flow", err.field);
        assertEquals("flow reference cycle detected: f1 → f2 → f1", err.message);
    }

    @Test
    public void flow_undeclaredSubFlowAndCompensation() {
        ElaborationException e = rejected(flowOps(),
                "flow f { snapshot: at_initiation, entry: s1, steps: {",
                "  s1: OperationStep { op: submit, persona: p, outcomes: { success: s2 },",
                "      on_failure: Compensate(steps: [{op: refund, persona: p, on_failure: Terminal(stuck)}], then: Terminal(undone)) }",
                "  s2: SubFlowStep { flow: missing, persona: p, on_success: Terminal(done), on_failure: Terminate(outcome: failed) }",
                "} }");
        assertEquals("compensation operation 'refund' is not declared", e.all().get(0).message);
        assertEquals("sub-flow reference 'missing' is not a declared Flow", e.all().get(1).message);
    }

    // ---------------- parallel ----------------

    @Test
    public void parallel_branchesTouchingSameEntity_areRejected() {
        ElabError err = rejected(flowOps(),
                "flow f { snapshot: at_initiation, entry: par, steps: {",
                "  par: ParallelStep {",
                "    branches: [",
                "      Branch { id: left, entry: a, steps: { a: OperationStep { op: submit, persona: p, outcomes: { success: Terminal(done) }, on_failure: Terminate(outcome: failed) } } }",
                "      Branch { id: right, entry: b, steps: { b: OperationStep { op: approve, persona: p, outcomes: { success: Terminal(done) }, on_failure: Terminate(outcome: failed) } } }",
                "    ]",
                "    join: JoinPolicy { on_all_success: Terminal(ok), on_any_failure: Terminate(outcome: failed), on_all_complete: null }",
                "  }",
                "} }").error();
        assertEquals("steps.par.branches", err.field);
        assertEquals("parallel branches 'left' and 'right' both declare effects on entity 'Order'; "
                + "parallel branch entity effect sets must be disjoint", err.message);
    }

    @Test
    public void parallel_transitiveOverlapThroughSubFlow() {
        ElabError err = rejected(flowOps(),
                "flow inner { snapshot: at_initiation, entry: s, steps: {",
                "  s: OperationStep { op: approve, persona: p, outcomes: { success: Terminal(done) }, on_failure: Terminate(outcome: failed) }",
                "} }",
                "flow outer { snapshot: at_initiation, entry: par, steps: {",
                "  par: ParallelStep {",
                "    branches: [",
                "      Branch { id: viaSub, entry: a, steps: { a: SubFlowStep { flow: inner, persona: p, on_success: Terminal(done), on_failure: Terminate(outcome: failed) } } }",
                "      Branch { id: direct, entry: b, steps: { b: OperationStep { op: submit, persona: p, outcomes: { success: Terminal(done) }, on_failure: Terminate(outcome: failed) } } }",
                "    ]",
                "    join: JoinPolicy { on_all_success: Terminal(ok) }",
                "  }",
                "} }").error();
        assertEquals("outer", err.constructId);
        assertEquals("parallel branches 'viaSub' and 'direct' both affect entity 'Order' "
                + "(viaSub transitively through SubFlowStep → inner → approve); "
                + "parallel branch entity effect sets must be disjoint", err.message);
    }

    // ---------------- systems ----------------

    @Test
    public void system_needsMembers() {
        ElabError err = rejected("system s { members: [] }").error();
        assertEquals("System must declare at least one member contract", err.message);
    }

    @Test
    public void system_triggerMustNameMembers() {
        ElabError err = rejected(
                "system s {",
                "  members: [a: \"a.tenor\", b: \"b.tenor\"]",
                "  triggers: [{source: a.f, on: success, target: c.g, persona: p}]",
                "}").error();
        assertEquals("trigger target contract 'c' is not a System member", err.message);
    }
}
