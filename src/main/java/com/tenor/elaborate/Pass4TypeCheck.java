package com.tenor.elaborate;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tenor.debug.Debug;
import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawConstruct.Construct;
import com.tenor.elaborate.parser.RawExpr;
import com.tenor.elaborate.parser.RawLiteral;
import com.tenor.elaborate.parser.RawStep;
import com.tenor.elaborate.parser.RawType;

/**
 * Pass 4: inlines type references in facts and rule payloads, then type-checks
 * every predicate (rule conditions, operation preconditions, branch conditions)
 * and every multiplied verdict payload.
 */
final class Pass4TypeCheck {

    private final ConstructIndex index;
    private final Map<String, RawType> typeEnv;
    private final List<ElabError> errors = new ArrayList<>();
    private final Map<String, RawType> factTypes = new HashMap<>();

    private Pass4TypeCheck(ConstructIndex index, Map<String, RawType> typeEnv) {
        this.index = index;
        this.typeEnv = typeEnv;
    }

    /** Returns the construct list with every fact and payload type resolved. */
    static List<Construct> check(ConstructIndex index, Map<String, RawType> typeEnv) {
        return new Pass4TypeCheck(index, typeEnv).run();
    }

    private List<Construct> run() {
        List<Construct> resolved = new ArrayList<>();
        for (Construct c : index.constructs) {
            if (c instanceof RawConstruct.Fact) {
                RawConstruct.Fact f = (RawConstruct.Fact) c;
                RawConstruct.Fact r = f.withType(resolveType(f.type, c, "type"));
                factTypes.put(r.id, r.type);
                resolved.add(r);
            } else if (c instanceof RawConstruct.Rule) {
                RawConstruct.Rule rule = (RawConstruct.Rule) c;
                resolved.add(rule.withPayloadType(resolveType(rule.payloadType, c, "body.produce.payload_type")));
            } else {
                resolved.add(c);
            }
        }
        if (!errors.isEmpty()) throw ElaborationException.of(errors);

        for (Construct c : resolved) {
            if (c instanceof RawConstruct.Rule) {
                RawConstruct.Rule rule = (RawConstruct.Rule) c;
                checkExpr(rule.when, rule, "body.when", new HashSet<>());
                checkProduce(rule);
            } else if (c instanceof RawConstruct.Operation) {
                RawConstruct.Operation op = (RawConstruct.Operation) c;
                checkExpr(op.precondition, op, "precondition", new HashSet<>());
            } else if (c instanceof RawConstruct.Flow) {
                RawConstruct.Flow flow = (RawConstruct.Flow) c;
                checkSteps(flow.steps, flow);
            }
        }
        if (!errors.isEmpty()) throw ElaborationException.of(errors);
        Debug.get().d("tenor.elab", "pass 4: " + factTypes.size() + " fact type(s) checked");
        return resolved;
    }

    private RawType resolveType(RawType t, Construct owner, String field) {
        if (t.is(RawType.Base.REF)) {
            RawType found = typeEnv.get(t.refName);
            if (found == null) {
                errors.add(new ElabError(4, owner.kind(), owner.id, field, owner.file, owner.line,
                        "unknown type reference '" + t.refName + "'"));
                return t;
            }
            return found;
        }
        return t.mapChildren(child -> resolveType(child, owner, field));
    }

    private void checkSteps(Map<String, RawStep.Step> steps, RawConstruct.Flow flow) {
        for (Map.Entry<String, RawStep.Step> e : steps.entrySet()) {
            RawStep.Step step = e.getValue();
            if (step.kind() == RawStep.Kind.BRANCH) {
                RawStep.BranchStep b = (RawStep.BranchStep) step;
                checkExpr(b.condition, flow, "steps." + e.getKey() + ".condition", new HashSet<>());
            } else if (step.kind() == RawStep.Kind.PARALLEL) {
                for (RawStep.Branch br : ((RawStep.ParallelStep) step).branches) checkSteps(br.steps, flow);
            }
        }
    }

    // -------------------------
    // Predicate checks
    // -------------------------

    private void checkExpr(RawExpr.ExprNode expr, Construct owner, String field, Set<String> bound) {
        expr.accept(new RawExpr.ExprVisitor<Void>() {
            @Override
            public Void visitCompare(RawExpr.Compare c) {
                checkCompare(c, owner, field, bound);
                return null;
            }

            @Override
            public Void visitAnd(RawExpr.And a) {
                a.left.accept(this);
                a.right.accept(this);
                return null;
            }

            @Override
            public Void visitOr(RawExpr.Or o) {
                o.left.accept(this);
                o.right.accept(this);
                return null;
            }

            @Override
            public Void visitNot(RawExpr.Not n) {
                n.operand.accept(this);
                return null;
            }

            @Override
            public Void visitQuantifier(RawExpr.Quantifier q) {
                RawType domain = factTypes.get(q.domain);
                if (domain == null) {
                    error(owner, field, q.line, "unresolved fact reference: '" + q.domain + "' is not declared in this contract");
                    return null;
                }
                if (!domain.is(RawType.Base.LIST)) {
                    error(owner, field, q.line, "type error: quantifier domain '" + q.domain + "' has type "
                            + typeName(domain) + "; domain must be List-typed");
                    return null;
                }
                Set<String> inner = new HashSet<>(bound);
                inner.add(q.variable);
                checkExpr(q.body, owner, field, inner);
                return null;
            }

            @Override
            public Void visitVerdictPresent(RawExpr.VerdictPresent v) {
                return null;
            }
        });
    }

    private void checkCompare(RawExpr.Compare c, Construct owner, String field, Set<String> bound) {
        for (RawExpr.Term t : new RawExpr.Term[] { c.left, c.right }) {
            if (t instanceof RawExpr.Mul) {
                RawExpr.Mul m = (RawExpr.Mul) t;
                if (isVariable(m.left, bound) && isVariable(m.right, bound)) {
                    error(owner, field, c.line, "type error: variable × variable multiplication is not permitted in "
                            + "PredicateExpression; only variable × literal_numeric is allowed");
                    return;
                }
            }
        }
        for (RawExpr.Term t : new RawExpr.Term[] { c.left, c.right }) {
            if (t instanceof RawExpr.FactRef) {
                String name = ((RawExpr.FactRef) t).name;
                if (!bound.contains(name) && !factTypes.containsKey(name)) {
                    error(owner, field, c.line, "unresolved fact reference: '" + name + "' is not declared in this contract");
                    return;
                }
            }
        }
        RawType lt = factType(c.left, bound);
        RawType rt = factType(c.right, bound);
        if (lt != null && lt.is(RawType.Base.BOOL) && !c.op.equals("=") && !c.op.equals("!=")) {
            error(owner, field, c.line, "type error: operator '" + c.op + "' not defined for Bool; Bool supports only = and ≠");
        } else if (lt != null && rt != null && lt.is(RawType.Base.MONEY) && rt.is(RawType.Base.MONEY)
                && !lt.currency.equals(rt.currency)) {
            error(owner, field, c.line, "type error: cannot compare Money(currency: " + lt.currency
                    + ") with Money(currency: " + rt.currency + "); Money comparisons require identical currency codes");
        }
    }

    private void checkProduce(RawConstruct.Rule rule) {
        if (!(rule.payloadValue instanceof RawExpr.Mul) || !rule.payloadType.is(RawType.Base.INT)) return;
        RawExpr.Mul m = (RawExpr.Mul) rule.payloadValue;
        long[] l = intRange(m.left);
        long[] r = intRange(m.right);
        if (l == null || r == null) return;

        BigInteger[] products = {
                BigInteger.valueOf(l[0]).multiply(BigInteger.valueOf(r[0])),
                BigInteger.valueOf(l[0]).multiply(BigInteger.valueOf(r[1])),
                BigInteger.valueOf(l[1]).multiply(BigInteger.valueOf(r[0])),
                BigInteger.valueOf(l[1]).multiply(BigInteger.valueOf(r[1])),
        };
        BigInteger lo = products[0];
        BigInteger hi = products[0];
        for (BigInteger p : products) {
            lo = lo.min(p);
            hi = hi.max(p);
        }
        if (lo.compareTo(BigInteger.valueOf(rule.payloadType.min)) < 0
                || hi.compareTo(BigInteger.valueOf(rule.payloadType.max)) > 0) {
            errors.add(new ElabError(4, "Rule", rule.id, "body.produce.payload", rule.file, rule.produceLine,
                    "type error: product range Int(min: " + lo + ", max: " + hi
                            + ") is not contained in declared verdict payload type " + typeName(rule.payloadType)));
        }
    }

    private long[] intRange(RawExpr.Term t) {
        if (t instanceof RawExpr.FactRef) {
            RawType ft = factTypes.get(((RawExpr.FactRef) t).name);
            return ft != null && ft.is(RawType.Base.INT) ? new long[] { ft.min, ft.max } : null;
        }
        if (t instanceof RawExpr.Literal) {
            RawExpr.Literal lit = (RawExpr.Literal) t;
            if (lit.value.kind == RawLiteral.Kind.INT) {
                return new long[] { lit.value.intValue, lit.value.intValue };
            }
        }
        return null;
    }

    private boolean isVariable(RawExpr.Term t, Set<String> bound) {
        if (!(t instanceof RawExpr.FactRef)) return false;
        String name = ((RawExpr.FactRef) t).name;
        return !bound.contains(name) && factTypes.containsKey(name);
    }

    private RawType factType(RawExpr.Term t, Set<String> bound) {
        if (!(t instanceof RawExpr.FactRef)) return null;
        String name = ((RawExpr.FactRef) t).name;
        return bound.contains(name) ? null : factTypes.get(name);
    }

    private void error(Construct owner, String field, int line, String message) {
        errors.add(new ElabError(4, owner.kind(), owner.id, field, owner.file, line, message));
    }

    /** Short type names used in type-error messages. */
    static String typeName(RawType t) {
        switch (t.base) {
            case INT:
            case MONEY:
            case BOOL:
            case DATE:
            case DATETIME:
                return t.display();
            case DECIMAL: return "Decimal";
            case TEXT: return "Text";
            case ENUM: return "Enum";
            case DURATION: return "Duration";
            case LIST: return "List";
            case RECORD: return "Record";
            case TAGGED_UNION: return "TaggedUnion";
            default: return t.refName;
        }
    }
}
