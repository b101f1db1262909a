package com.tenor.elaborate.parser;

/** Predicate expressions and the terms they compare. */
public class RawExpr {

    public interface ExprNode {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitCompare(Compare expr);
        R visitAnd(And expr);
        R visitOr(Or expr);
        R visitNot(Not expr);
        R visitQuantifier(Quantifier expr);
        R visitVerdictPresent(VerdictPresent expr);
    }

    // -------------------------
    // Expression nodes
    // -------------------------

    public static final class Compare implements ExprNode {
        public final Term left;
        public final String op;
        public final Term right;
        public final int line;

        public Compare(Term left, String op, Term right, int line) {
            this.left = left;
            this.op = op;
            this.right = right;
            this.line = line;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitCompare(this); }
    }

    public static final class And implements ExprNode {
        public final ExprNode left;
        public final ExprNode right;

        public And(ExprNode left, ExprNode right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitAnd(this); }
    }

    public static final class Or implements ExprNode {
        public final ExprNode left;
        public final ExprNode right;

        public Or(ExprNode left, ExprNode right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitOr(this); }
    }

    public static final class Not implements ExprNode {
        public final ExprNode operand;

        public Not(ExprNode operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitNot(this); }
    }

    public static final class Quantifier implements ExprNode {
        public final boolean universal;
        public final String variable;
        public final String domain;
        public final ExprNode body;
        public final int line;

        public Quantifier(boolean universal, String variable, String domain, ExprNode body, int line) {
            this.universal = universal;
            this.variable = variable;
            this.domain = domain;
            this.body = body;
            this.line = line;
        }

        public String keyword() { return universal ? "forall" : "exists"; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitQuantifier(this); }
    }

    public static final class VerdictPresent implements ExprNode {
        public final String verdictType;
        public final int line;

        public VerdictPresent(String verdictType, int line) {
            this.verdictType = verdictType;
            this.line = line;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitVerdictPresent(this); }
    }

    // -------------------------
    // Terms
    // -------------------------

    public interface Term {}

    /** A bare name: a declared fact, or a variable bound by an enclosing quantifier. */
    public static final class FactRef implements Term {
        public final String name;

        public FactRef(String name) { this.name = name; }
    }

    public static final class FieldRef implements Term {
        public final String var;
        public final String field;

        public FieldRef(String var, String field) {
            this.var = var;
            this.field = field;
        }
    }

    public static final class Literal implements Term {
        public final RawLiteral value;

        public Literal(RawLiteral value) { this.value = value; }
    }

    public static final class Mul implements Term {
        public final Term left;
        public final Term right;

        public Mul(Term left, Term right) {
            this.left = left;
            this.right = right;
        }
    }
}
