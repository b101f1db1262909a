package com.tenor.elaborate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawExpr;

/**
 * Stratum well-formedness, verdict references strictly below the referencing
 * rule's stratum, and at most one producing rule per verdict type.
 */
final class RuleValidator {

    private RuleValidator() {}

    static void validate(ConstructIndex index, List<ElabError> errors) {
        Map<String, String> producers = new HashMap<>();
        for (RawConstruct.Rule rule : index.rules.values()) {
            String first = producers.putIfAbsent(rule.verdictType, rule.id);
            if (first != null) {
                errors.add(new ElabError(5, "Rule", rule.id, "produce", rule.file, rule.produceLine,
                        "VerdictType '" + rule.verdictType + "' is already produced by rule '" + first
                                + "'. Each VerdictType may be produced by at most one rule"));
            }
        }

        for (RawConstruct.Rule rule : index.rules.values()) {
            if (rule.stratum < 0) {
                errors.add(new ElabError(5, "Rule", rule.id, "stratum", rule.file, rule.stratumLine,
                        "stratum must be a non-negative integer; got " + rule.stratum));
                continue;
            }
            rule.when.accept(new VerdictRefs(rule, index, errors));
        }
    }

    private static final class VerdictRefs implements RawExpr.ExprVisitor<Void> {
        private final RawConstruct.Rule rule;
        private final ConstructIndex index;
        private final List<ElabError> errors;

        VerdictRefs(RawConstruct.Rule rule, ConstructIndex index, List<ElabError> errors) {
            this.rule = rule;
            this.index = index;
            this.errors = errors;
        }

        @Override
        public Void visitVerdictPresent(RawExpr.VerdictPresent v) {
            RawConstruct.Rule producer = index.verdictProducers.get(v.verdictType);
            if (producer == null) {
                errors.add(new ElabError(5, "Rule", rule.id, "body.when", rule.file, v.line,
                        "unresolved VerdictType reference: '" + v.verdictType
                                + "' is not produced by any rule in this contract"));
            } else if (producer.stratum >= rule.stratum) {
                errors.add(new ElabError(5, "Rule", rule.id, "body.when", rule.file, v.line,
                        "stratum violation: rule '" + rule.id + "' at stratum " + rule.stratum
                                + " references verdict '" + v.verdictType + "' produced by rule '" + producer.id
                                + "' at stratum " + producer.stratum
                                + "; verdict_refs must reference strata strictly less than the referencing rule's stratum"));
            }
            return null;
        }

        @Override
        public Void visitCompare(RawExpr.Compare c) {
            return null;
        }

        @Override
        public Void visitAnd(RawExpr.And a) {
            a.left.accept(this);
            return a.right.accept(this);
        }

        @Override
        public Void visitOr(RawExpr.Or o) {
            o.left.accept(this);
            return o.right.accept(this);
        }

        @Override
        public Void visitNot(RawExpr.Not n) {
            return n.operand.accept(this);
        }

        @Override
        public Void visitQuantifier(RawExpr.Quantifier q) {
            return q.body.accept(this);
        }
    }
}
