package com.tenor.interchange;

import com.fasterxml.jackson.databind.JsonNode;

/** Predicate expression tree of a loaded bundle. */
public abstract class Predicate {

    public interface Visitor<R> {
        R visitFactRef(FactRef p);
        R visitFieldRef(FieldRef p);
        R visitLiteral(Literal p);
        R visitVerdictPresent(VerdictPresent p);
        R visitCompare(Compare p);
        R visitAnd(And p);
        R visitOr(Or p);
        R visitNot(Not p);
        R visitMul(Mul p);
        R visitQuantifier(Quantifier p);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public static final class FactRef extends Predicate {
        public final String id;

        public FactRef(String id) { this.id = id; }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitFactRef(this); }
    }

    public static final class FieldRef extends Predicate {
        public final String var;
        public final String field;

        public FieldRef(String var, String field) {
            this.var = var;
            this.field = field;
        }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitFieldRef(this); }
    }

    /** A literal; {@code type} is null when the bundle leaves it to be inferred. */
    public static final class Literal extends Predicate {
        public final JsonNode value;
        public final TypeSpec type;

        public Literal(JsonNode value, TypeSpec type) {
            this.value = value;
            this.type = type;
        }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitLiteral(this); }
    }

    public static final class VerdictPresent extends Predicate {
        public final String verdictType;

        public VerdictPresent(String verdictType) { this.verdictType = verdictType; }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitVerdictPresent(this); }
    }

    public static final class Compare extends Predicate {
        public final Predicate left;
        public final String op;
        public final Predicate right;
        /** Promoted operand type, when the elaborator computed one. */
        public final TypeSpec comparisonType;

        public Compare(Predicate left, String op, Predicate right, TypeSpec comparisonType) {
            this.left = left;
            this.op = op;
            this.right = right;
            this.comparisonType = comparisonType;
        }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitCompare(this); }
    }

    public static final class And extends Predicate {
        public final Predicate left;
        public final Predicate right;

        public And(Predicate left, Predicate right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitAnd(this); }
    }

    public static final class Or extends Predicate {
        public final Predicate left;
        public final Predicate right;

        public Or(Predicate left, Predicate right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitOr(this); }
    }

    public static final class Not extends Predicate {
        public final Predicate operand;

        public Not(Predicate operand) { this.operand = operand; }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitNot(this); }
    }

    /** {@code left * literal}, checked against {@code resultType} when evaluated. */
    public static final class Mul extends Predicate {
        public final Predicate left;
        public final long literal;
        public final TypeSpec resultType;

        public Mul(Predicate left, long literal, TypeSpec resultType) {
            this.left = left;
            this.literal = literal;
            this.resultType = resultType;
        }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitMul(this); }
    }

    public static final class Quantifier extends Predicate {
        public final boolean universal;
        public final String variable;
        public final TypeSpec variableType;
        public final Predicate domain;
        public final Predicate body;

        public Quantifier(boolean universal, String variable, TypeSpec variableType, Predicate domain, Predicate body) {
            this.universal = universal;
            this.variable = variable;
            this.variableType = variableType;
            this.domain = domain;
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitQuantifier(this); }
    }
}
