package com.tenor.interchange;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads an Interchange Bundle into a {@link Contract}.
 *
 * Only the structure is checked here; the bundle is trusted to satisfy every
 * elaboration invariant.
 */
public final class ContractLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContractLoader() {}

    public static Contract load(String json) {
        try {
            return load(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new BundleFormatException("bundle is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Contract load(JsonNode bundle) {
        if (bundle == null || !bundle.isObject()) throw new BundleFormatException("bundle must be a JSON object");
        JsonNode bundleKind = bundle.get("kind");
        if (bundleKind == null || !"Bundle".equals(bundleKind.asText())) {
            throw new BundleFormatException("bundle 'kind' must be \"Bundle\", got " + (bundleKind == null ? "nothing" : bundleKind));
        }
        JsonNode constructs = bundle.get("constructs");
        if (constructs == null || !constructs.isArray()) throw new BundleFormatException("bundle missing 'constructs' array");

        List<Contract.FactDecl> facts = new ArrayList<>();
        List<Contract.Entity> entities = new ArrayList<>();
        List<Contract.Rule> rules = new ArrayList<>();
        List<Contract.Operation> operations = new ArrayList<>();
        List<Contract.Flow> flows = new ArrayList<>();
        List<String> personas = new ArrayList<>();

        for (JsonNode c : constructs) {
            String kind = str(c, "kind");
            switch (kind) {
                case "Fact":
                    facts.add(new Contract.FactDecl(str(c, "id"), TypeSpec.fromJson(c.get("type")), c.get("default")));
                    break;
                case "Entity":
                    entities.add(entity(c));
                    break;
                case "Rule":
                    rules.add(rule(c));
                    break;
                case "Operation":
                    operations.add(operation(c));
                    break;
                case "Flow":
                    flows.add(new Contract.Flow(str(c, "id"), optStr(c, "snapshot"), str(c, "entry"), steps(c.get("steps"))));
                    break;
                case "Persona":
                    personas.add(str(c, "id"));
                    break;
                case "Source":
                case "System":
                case "TypeDecl":
                    break;
                default:
                    throw new BundleFormatException("unknown construct kind: " + kind);
            }
        }
        return new Contract(optStr(bundle, "id"), facts, entities, rules, operations, flows, personas);
    }

    // -------------------------
    // Constructs
    // -------------------------

    private static Contract.Entity entity(JsonNode c) {
        List<Contract.Transition> transitions = new ArrayList<>();
        for (JsonNode t : array(c, "transitions")) transitions.add(new Contract.Transition(str(t, "from"), str(t, "to")));
        return new Contract.Entity(str(c, "id"), strings(c, "states"), str(c, "initial"), transitions, optStr(c, "parent"));
    }

    private static Contract.Rule rule(JsonNode c) {
        String id = str(c, "id");
        JsonNode body = c.get("body");
        if (body == null || !body.has("when")) throw new BundleFormatException("Rule '" + id + "' body missing 'when'");
        JsonNode produce = body.get("produce");
        if (produce == null) throw new BundleFormatException("Rule '" + id + "' body missing 'produce'");
        return new Contract.Rule(id, c.path("stratum").asInt(), predicate(body.get("when")), produce(produce));
    }

    private static Contract.Produce produce(JsonNode p) {
        String verdictType = str(p, "verdict_type");
        JsonNode payload = p.get("payload");
        if (payload == null) throw new BundleFormatException("produce clause missing 'payload'");
        TypeSpec type = TypeSpec.fromJson(payload.get("type"));
        JsonNode value = payload.get("value");
        if (value == null) throw new BundleFormatException("produce payload missing 'value'");

        if (value.isObject() && "*".equals(value.path("op").asText(null))) {
            JsonNode left = value.get("left");
            if (left == null) throw new BundleFormatException("MulExpr missing 'left'");
            if (!value.path("literal").canConvertToLong()) throw new BundleFormatException("MulExpr missing 'literal'");
            if (!value.has("result_type")) throw new BundleFormatException("MulExpr missing 'result_type'");
            return new Contract.Produce(verdictType, type, null, str(left, "fact_ref"),
                    value.get("literal").asLong(), TypeSpec.fromJson(value.get("result_type")));
        }
        return new Contract.Produce(verdictType, type, value, null, 0, null);
    }

    private static Contract.Operation operation(JsonNode c) {
        List<Contract.Effect> effects = new ArrayList<>();
        for (JsonNode e : array(c, "effects")) {
            effects.add(new Contract.Effect(str(e, "entity_id"), str(e, "from"), str(e, "to"), optStr(e, "outcome")));
        }
        Predicate pre = c.has("precondition")
                ? predicate(c.get("precondition"))
                : new Predicate.Literal(MAPPER.getNodeFactory().booleanNode(true), TypeSpec.of("Bool"));
        return new Contract.Operation(str(c, "id"), strings(c, "allowed_personas"), pre, effects,
                strings(c, "error_contract"), strings(c, "outcomes"));
    }

    // -------------------------
    // Predicates
    // -------------------------

    public static Predicate predicate(JsonNode v) {
        if (v == null || !v.isObject()) throw new BundleFormatException("predicate must be an object");
        if (v.has("verdict_present")) {
            return new Predicate.VerdictPresent(textual(v.get("verdict_present"), "verdict_present"));
        }
        if (v.has("fact_ref")) {
            return new Predicate.FactRef(textual(v.get("fact_ref"), "fact_ref"));
        }
        if (v.has("field_ref")) {
            JsonNode f = v.get("field_ref");
            return new Predicate.FieldRef(str(f, "var"), str(f, "field"));
        }
        if (v.has("op")) {
            String op = textual(v.get("op"), "op");
            switch (op) {
                case "and":
                    return new Predicate.And(predicate(required(v, "left", op)), predicate(required(v, "right", op)));
                case "or":
                    return new Predicate.Or(predicate(required(v, "left", op)), predicate(required(v, "right", op)));
                case "not":
                    return new Predicate.Not(predicate(required(v, "operand", op)));
                case "*": {
                    Predicate left = predicate(required(v, "left", "mul"));
                    if (!v.path("literal").canConvertToLong()) throw new BundleFormatException("mul missing 'literal'");
                    TypeSpec rt = TypeSpec.fromJson(required(v, "result_type", "mul"));
                    return new Predicate.Mul(left, v.get("literal").asLong(), rt);
                }
                case "=":
                case "!=":
                case "<":
                case "<=":
                case ">":
                case ">=": {
                    Predicate left = predicate(required(v, "left", "compare"));
                    Predicate right = predicate(required(v, "right", "compare"));
                    TypeSpec ct = v.has("comparison_type") ? TypeSpec.fromJson(v.get("comparison_type")) : null;
                    return new Predicate.Compare(left, op, right, ct);
                }
                default:
                    throw new BundleFormatException("unknown operator: " + op);
            }
        }
        if (v.has("literal")) {
            TypeSpec type = v.has("type") ? TypeSpec.fromJson(v.get("type")) : null;
            return new Predicate.Literal(v.get("literal"), type);
        }
        if (v.has("quantifier")) {
            String q = textual(v.get("quantifier"), "quantifier");
            if (!q.equals("forall") && !q.equals("exists")) throw new BundleFormatException("unknown quantifier: " + q);
            TypeSpec vt = v.has("variable_type") ? TypeSpec.fromJson(v.get("variable_type")) : null;
            return new Predicate.Quantifier(q.equals("forall"), str(v, "variable"), vt,
                    predicate(required(v, "domain", q)), predicate(required(v, "body", q)));
        }
        throw new BundleFormatException("unrecognized predicate expression: " + v);
    }

    // -------------------------
    // Flow steps
    // -------------------------

    private static List<FlowStep> steps(JsonNode arr) {
        List<FlowStep> out = new ArrayList<>();
        if (arr == null) return out;
        if (!arr.isArray()) throw new BundleFormatException("'steps' must be an array");
        for (JsonNode s : arr) out.add(step(s));
        return out;
    }

    private static FlowStep step(JsonNode v) {
        String kind = str(v, "kind");
        String id = str(v, "id");
        switch (kind) {
            case "OperationStep": {
                JsonNode outcomesObj = v.get("outcomes");
                if (outcomesObj == null || !outcomesObj.isObject()) throw new BundleFormatException("OperationStep missing 'outcomes'");
                Map<String, FlowStep.Target> outcomes = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = outcomesObj.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    outcomes.put(e.getKey(), target(e.getValue()));
                }
                return new FlowStep.OperationStep(id, str(v, "op"), str(v, "persona"), outcomes,
                        handler(required(v, "on_failure", kind)));
            }
            case "BranchStep":
                return new FlowStep.BranchStep(id, predicate(required(v, "condition", kind)), str(v, "persona"),
                        target(required(v, "if_true", kind)), target(required(v, "if_false", kind)));
            case "HandoffStep":
                return new FlowStep.HandoffStep(id, str(v, "from_persona"), str(v, "to_persona"), str(v, "next"));
            case "SubFlowStep":
                return new FlowStep.SubFlowStep(id, str(v, "flow"), str(v, "persona"),
                        target(required(v, "on_success", kind)), handler(required(v, "on_failure", kind)));
            case "ParallelStep": {
                List<FlowStep.Branch> branches = new ArrayList<>();
                for (JsonNode b : array(v, "branches")) {
                    branches.add(new FlowStep.Branch(str(b, "id"), str(b, "entry"), steps(b.get("steps"))));
                }
                JsonNode join = required(v, "join", kind);
                return new FlowStep.ParallelStep(id, branches, new FlowStep.JoinPolicy(
                        join.has("on_all_success") ? target(join.get("on_all_success")) : null,
                        join.has("on_any_failure") ? handler(join.get("on_any_failure")) : null,
                        join.has("on_all_complete") ? target(join.get("on_all_complete")) : null));
            }
            default:
                throw new BundleFormatException("unknown step kind: " + kind);
        }
    }

    private static FlowStep.Target target(JsonNode v) {
        if (v.isTextual()) return FlowStep.Target.step(v.asText());
        if (v.isObject()) return FlowStep.Target.terminal(str(v, "outcome"));
        throw new BundleFormatException("invalid step target");
    }

    private static FlowStep.FailureHandler handler(JsonNode v) {
        String kind = str(v, "kind");
        switch (kind) {
            case "Terminate":
                return FlowStep.FailureHandler.terminate(str(v, "outcome"));
            case "Compensate": {
                List<FlowStep.CompStep> steps = new ArrayList<>();
                for (JsonNode s : array(v, "steps")) {
                    steps.add(new FlowStep.CompStep(str(s, "op"), str(s, "persona"),
                            target(required(s, "on_failure", "CompensationStep"))));
                }
                return FlowStep.FailureHandler.compensate(steps, target(required(v, "then", kind)));
            }
            case "Escalate":
                return FlowStep.FailureHandler.escalate(str(v, "to_persona"), str(v, "next"));
            default:
                throw new BundleFormatException("unknown failure handler kind: " + kind);
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static String str(JsonNode obj, String field) {
        JsonNode v = obj.get(field);
        if (v == null || !v.isTextual()) throw new BundleFormatException("missing string field '" + field + "'");
        return v.asText();
    }

    private static String optStr(JsonNode obj, String field) {
        JsonNode v = obj.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static String textual(JsonNode v, String what) {
        if (!v.isTextual()) throw new BundleFormatException(what + " must be a string");
        return v.asText();
    }

    private static JsonNode required(JsonNode obj, String field, String owner) {
        JsonNode v = obj.get(field);
        if (v == null) throw new BundleFormatException(owner + " missing '" + field + "'");
        return v;
    }

    private static JsonNode array(JsonNode obj, String field) {
        JsonNode v = obj.get(field);
        if (v == null) return MAPPER.createArrayNode();
        if (!v.isArray()) throw new BundleFormatException("'" + field + "' must be an array");
        return v;
    }

    private static List<String> strings(JsonNode obj, String field) {
        List<String> out = new ArrayList<>();
        for (JsonNode s : array(obj, field)) out.add(s.asText());
        return out;
    }
}
