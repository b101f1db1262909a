package com.tenor.eval;

import java.util.HashMap;
import java.util.Map;

import com.tenor.interchange.Predicate;

/**
 * Tree-walking evaluator for predicate expressions over a fact set and the
 * verdicts produced so far. Logical nodes short-circuit; quantifiers bind
 * their variable in a child evaluator.
 */
final class PredicateEvaluator implements Predicate.Visitor<Value> {

    private final FactSet facts;
    private final VerdictSet verdicts;
    private final Map<String, Value> bindings;
    private final ProvenanceCollector collector;

    PredicateEvaluator(FactSet facts, VerdictSet verdicts, ProvenanceCollector collector) {
        this(facts, verdicts, Map.of(), collector);
    }

    private PredicateEvaluator(FactSet facts, VerdictSet verdicts, Map<String, Value> bindings, ProvenanceCollector collector) {
        this.facts = facts;
        this.verdicts = verdicts;
        this.bindings = bindings;
        this.collector = collector;
    }

    Value eval(Predicate p) {
        return p.accept(this);
    }

    boolean test(Predicate p) {
        return eval(p).asBool();
    }

    @Override
    public Value visitFactRef(Predicate.FactRef p) {
        Value bound = bindings.get(p.id);
        if (bound != null) return bound;
        collector.fact(p.id);
        Value v = facts.get(p.id);
        if (v == null) throw new EvalException(EvalError.UNKNOWN_FACT, p.id, "unknown fact: " + p.id);
        return v;
    }

    @Override
    public Value visitFieldRef(Predicate.FieldRef p) {
        Value v = bindings.get(p.var);
        if (v == null) {
            // record-typed facts are reached through field_ref as well
            collector.fact(p.var);
            v = facts.get(p.var);
        }
        if (v == null) throw new EvalException(EvalError.UNBOUND_VARIABLE, p.var, "unbound variable: " + p.var);
        if (v.type != Value.Type.RECORD) {
            throw new EvalException(EvalError.NOT_A_RECORD, p.var,
                    "not a record: variable '" + p.var + "' is not a Record, got " + v.typeName());
        }
        Value field = v.asRecord().get(p.field);
        if (field == null) {
            throw new EvalException(EvalError.NOT_A_RECORD, p.var,
                    "not a record: field '" + p.field + "' not found in record variable '" + p.var + "'");
        }
        return field;
    }

    @Override
    public Value visitLiteral(Predicate.Literal p) {
        return p.type == null ? Values.infer(p.value) : Values.parseLiteral(p.value, p.type);
    }

    @Override
    public Value visitVerdictPresent(Predicate.VerdictPresent p) {
        collector.verdict(p.verdictType);
        return Value.bool(verdicts.has(p.verdictType));
    }

    @Override
    public Value visitCompare(Predicate.Compare p) {
        Value l = eval(p.left);
        Value r = eval(p.right);
        return Value.bool(Numeric.compare(l, r, p.op, p.comparisonType));
    }

    @Override
    public Value visitAnd(Predicate.And p) {
        if (!test(p.left)) return Value.bool(false);
        return Value.bool(test(p.right));
    }

    @Override
    public Value visitOr(Predicate.Or p) {
        if (test(p.left)) return Value.bool(true);
        return Value.bool(test(p.right));
    }

    @Override
    public Value visitNot(Predicate.Not p) {
        return Value.bool(!test(p.operand));
    }

    @Override
    public Value visitMul(Predicate.Mul p) {
        return Numeric.multiply(eval(p.left), p.literal, p.resultType);
    }

    @Override
    public Value visitQuantifier(Predicate.Quantifier p) {
        Value domain = eval(p.domain);
        if (domain.type != Value.Type.LIST) {
            throw EvalException.typeError((p.universal ? "forall" : "exists") + " domain must be a List, got " + domain.typeName());
        }
        for (Value elem : domain.asList()) {
            Map<String, Value> inner = new HashMap<>(bindings);
            inner.put(p.variable, elem);
            boolean b = new PredicateEvaluator(facts, verdicts, inner, collector).test(p.body);
            if (p.universal && !b) return Value.bool(false);
            if (!p.universal && b) return Value.bool(true);
        }
        return Value.bool(p.universal);
    }
}
