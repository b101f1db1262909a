package com.tenor.eval;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenor.debug.Debug;
import com.tenor.interchange.BundleFormatException;
import com.tenor.interchange.Contract;
import com.tenor.interchange.ContractLoader;

/**
 * Entry points of the evaluation engine.
 *
 * Every call is a pure function of its arguments: inputs are never mutated and
 * no state is kept between calls, so one instance may be shared by concurrent
 * callers. Each method accepts either a bundle as JSON or an already loaded
 * {@link Contract}.
 */
public final class Evaluator {

    private static final String TAG = "tenor.eval";

    private final EvalOptions options;

    public Evaluator() {
        this(EvalOptions.defaults());
    }

    public Evaluator(EvalOptions options) {
        this.options = options;
    }

    public static Contract load(JsonNode bundle) {
        try {
            return ContractLoader.load(bundle);
        } catch (BundleFormatException e) {
            throw new EvalException(EvalError.DESERIALIZE, null, "deserialization error: " + e.getMessage());
        }
    }

    public VerdictSet evaluate(JsonNode bundle, JsonNode facts) {
        return evaluate(load(bundle), facts);
    }

    public VerdictSet evaluate(Contract contract, JsonNode facts) {
        FactSet fs = FactAssembler.assemble(contract, facts);
        VerdictSet vs = RuleEngine.evaluate(contract, fs);
        Debug.get().i(TAG, "bundle '" + contract.id + "': " + vs.size() + " verdicts from " + contract.rules().size() + " rules");
        return vs;
    }

    public ActionSpace computeActionSpace(JsonNode bundle, JsonNode facts, EntityStateMap states, String persona) {
        return computeActionSpace(load(bundle), facts, states, persona);
    }

    public ActionSpace computeActionSpace(Contract contract, JsonNode facts, EntityStateMap states, String persona) {
        return ActionSpace.compute(contract, facts, states, persona);
    }

    /**
     * Runs one operation. The returned result holds the new state map;
     * {@code states} is left as it was, also when the operation fails.
     *
     * @throws OperationException when the operation cannot run
     * @throws EvalException when facts cannot be assembled or rules fail
     */
    public OperationResult executeOperation(JsonNode bundle, String operationId, String persona, JsonNode facts,
                                            EntityStateMap states, Map<String, String> bindings) {
        return executeOperation(load(bundle), operationId, persona, facts, states, bindings);
    }

    public OperationResult executeOperation(Contract contract, String operationId, String persona, JsonNode facts,
                                            EntityStateMap states, Map<String, String> bindings) {
        Contract.Operation op = contract.operation(operationId);
        if (op == null) throw new IllegalArgumentException("unknown operation '" + operationId + "'");
        FactSet fs = FactAssembler.assemble(contract, facts);
        VerdictSet vs = RuleEngine.evaluate(contract, fs);
        return OperationExecutor.execute(op, persona, fs, vs, states, bindings);
    }

    /**
     * Simulates a flow against a snapshot of facts and verdicts taken at the
     * start. {@code bindings} may be null, in which case every entity
     * resolves to its default instance.
     */
    public FlowResult executeFlow(JsonNode bundle, String flowId, String persona, JsonNode facts,
                                  EntityStateMap states, Map<String, String> bindings) {
        return executeFlow(load(bundle), flowId, persona, facts, states, bindings);
    }

    public FlowResult executeFlow(Contract contract, String flowId, String persona, JsonNode facts,
                                  EntityStateMap states, Map<String, String> bindings) {
        Contract.Flow flow = contract.flow(flowId);
        if (flow == null) throw new IllegalArgumentException("unknown flow '" + flowId + "'");
        FactSet fs = FactAssembler.assemble(contract, facts);
        VerdictSet vs = RuleEngine.evaluate(contract, fs);
        return new FlowEngine(contract, fs, vs, options).run(flow, persona, states, bindings);
    }
}
