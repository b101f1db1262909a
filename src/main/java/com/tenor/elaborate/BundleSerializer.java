package com.tenor.elaborate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawConstruct.Construct;
import com.tenor.elaborate.parser.RawExpr;
import com.tenor.elaborate.parser.RawLiteral;
import com.tenor.elaborate.parser.RawStep;
import com.tenor.elaborate.parser.RawType;

/**
 * Writes the canonical Interchange Bundle.
 *
 * Constructs are grouped personas, sources, facts, entities, rules (by stratum),
 * operations, flows, systems; each group is sorted by id. Flow steps are listed
 * breadth-first from the entry step, unreachable ones last. Every object is
 * emitted with its keys in sorted order.
 */
public final class BundleSerializer {

    public static final String TENOR_VERSION = "1.0";
    public static final String BUNDLE_VERSION = "1.1.0";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, RawType> factTypes = new HashMap<>();

    private BundleSerializer(List<Construct> constructs) {
        for (Construct c : constructs) {
            if (c instanceof RawConstruct.Fact) factTypes.put(c.id, ((RawConstruct.Fact) c).type);
        }
    }

    static ObjectNode serialize(String bundleId, List<Construct> constructs) {
        return new BundleSerializer(constructs).bundle(bundleId, constructs);
    }

    private ObjectNode bundle(String bundleId, List<Construct> constructs) {
        List<Construct> ordered = new ArrayList<>(constructs);
        ordered.removeIf(c -> groupOf(c) < 0);
        ordered.sort(Comparator.<Construct>comparingInt(BundleSerializer::groupOf)
                .thenComparingLong(c -> c instanceof RawConstruct.Rule ? ((RawConstruct.Rule) c).stratum : 0L)
                .thenComparing(c -> c.id));

        ArrayNode arr = MAPPER.createArrayNode();
        for (Construct c : ordered) arr.add(construct(c));

        ObjectNode b = MAPPER.createObjectNode();
        b.set("constructs", arr);
        b.put("id", bundleId);
        b.put("kind", "Bundle");
        b.put("tenor", TENOR_VERSION);
        b.put("tenor_version", BUNDLE_VERSION);
        return (ObjectNode) canonical(b);
    }

    private static int groupOf(Construct c) {
        if (c instanceof RawConstruct.Persona) return 0;
        if (c instanceof RawConstruct.Source) return 1;
        if (c instanceof RawConstruct.Fact) return 2;
        if (c instanceof RawConstruct.Entity) return 3;
        if (c instanceof RawConstruct.Rule) return 4;
        if (c instanceof RawConstruct.Operation) return 5;
        if (c instanceof RawConstruct.Flow) return 6;
        if (c instanceof RawConstruct.SystemDecl) return 7;
        return -1;
    }

    /** Copy of {@code node} with every object's keys in natural order. */
    static JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                sorted.put(e.getKey(), canonical(e.getValue()));
            }
            ObjectNode out = MAPPER.createObjectNode();
            sorted.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = MAPPER.createArrayNode();
            for (JsonNode child : node) out.add(canonical(child));
            return out;
        }
        return node;
    }

    // -------------------------
    // Constructs
    // -------------------------

    private ObjectNode construct(Construct c) {
        ObjectNode m = MAPPER.createObjectNode();
        m.put("id", c.id);
        m.put("kind", c.kind());
        ObjectNode prov = m.putObject("provenance");
        prov.put("file", c.file);
        prov.put("line", c.line);
        m.put("tenor", TENOR_VERSION);

        if (c instanceof RawConstruct.Persona) {
            return m;
        }
        if (c instanceof RawConstruct.Source) {
            RawConstruct.Source s = (RawConstruct.Source) c;
            if (s.description != null) m.put("description", s.description);
            ObjectNode fields = m.putObject("fields");
            s.fields.forEach(fields::put);
            m.put("protocol", s.protocol);
            return m;
        }
        if (c instanceof RawConstruct.Fact) {
            RawConstruct.Fact f = (RawConstruct.Fact) c;
            if (f.defaultValue != null) m.set("default", factDefault(f.type, f.defaultValue));
            m.set("source", source(f.source));
            m.set("type", type(f.type));
            return m;
        }
        if (c instanceof RawConstruct.Entity) {
            RawConstruct.Entity e = (RawConstruct.Entity) c;
            m.put("initial", e.initial);
            if (e.parent != null) m.put("parent", e.parent);
            ArrayNode states = m.putArray("states");
            e.states.forEach(states::add);
            ArrayNode transitions = m.putArray("transitions");
            for (RawConstruct.Transition t : e.transitions) {
                ObjectNode tn = transitions.addObject();
                tn.put("from", t.from);
                tn.put("to", t.to);
            }
            return m;
        }
        if (c instanceof RawConstruct.Rule) {
            RawConstruct.Rule r = (RawConstruct.Rule) c;
            ObjectNode body = m.putObject("body");
            ObjectNode produce = body.putObject("produce");
            produce.set("payload", payload(r.payloadType, r.payloadValue));
            produce.put("verdict_type", r.verdictType);
            body.set("when", expr(r.when));
            m.put("stratum", r.stratum);
            return m;
        }
        if (c instanceof RawConstruct.Operation) {
            RawConstruct.Operation op = (RawConstruct.Operation) c;
            ArrayNode personas = m.putArray("allowed_personas");
            op.allowedPersonas.forEach(personas::add);
            ArrayNode effects = m.putArray("effects");
            for (RawConstruct.Effect e : op.effects) {
                ObjectNode en = effects.addObject();
                en.put("entity_id", e.entityId);
                en.put("from", e.from);
                if (e.outcome != null) en.put("outcome", e.outcome);
                en.put("to", e.to);
            }
            ArrayNode errors = m.putArray("error_contract");
            op.errorContract.forEach(errors::add);
            if (!op.outcomes.isEmpty()) {
                ArrayNode outcomes = m.putArray("outcomes");
                op.outcomes.forEach(outcomes::add);
            }
            m.set("precondition", expr(op.precondition));
            return m;
        }
        if (c instanceof RawConstruct.Flow) {
            RawConstruct.Flow f = (RawConstruct.Flow) c;
            m.put("entry", f.entry);
            m.put("snapshot", f.snapshot);
            m.set("steps", steps(f.steps, f.entry));
            return m;
        }
        return system((RawConstruct.SystemDecl) c, m);
    }

    private ObjectNode system(RawConstruct.SystemDecl s, ObjectNode m) {
        ArrayNode members = m.putArray("members");
        List<RawConstruct.Member> sortedMembers = new ArrayList<>(s.members);
        sortedMembers.sort(Comparator.comparing(x -> x.id));
        for (RawConstruct.Member mem : sortedMembers) {
            ObjectNode mn = members.addObject();
            mn.put("id", mem.id);
            mn.put("path", mem.path);
        }
        m.set("shared_entities", shared(s.sharedEntities, "entity"));
        m.set("shared_personas", shared(s.sharedPersonas, "persona"));
        List<RawConstruct.Trigger> triggers = new ArrayList<>(s.triggers);
        triggers.sort(Comparator.<RawConstruct.Trigger, String>comparing(t -> t.sourceContract)
                .thenComparing(t -> t.sourceFlow)
                .thenComparing(t -> t.targetContract)
                .thenComparing(t -> t.targetFlow));
        ArrayNode arr = m.putArray("triggers");
        for (RawConstruct.Trigger t : triggers) {
            ObjectNode tn = arr.addObject();
            tn.put("on", t.on);
            tn.put("persona", t.persona);
            tn.put("source_contract", t.sourceContract);
            tn.put("source_flow", t.sourceFlow);
            tn.put("target_contract", t.targetContract);
            tn.put("target_flow", t.targetFlow);
        }
        return m;
    }

    private static ArrayNode shared(List<RawConstruct.Shared> shared, String key) {
        List<RawConstruct.Shared> sorted = new ArrayList<>(shared);
        sorted.sort(Comparator.comparing(x -> x.name));
        ArrayNode arr = MAPPER.createArrayNode();
        for (RawConstruct.Shared s : sorted) {
            ObjectNode n = arr.addObject();
            ArrayNode contracts = n.putArray("contracts");
            s.contracts.stream().sorted().forEach(contracts::add);
            n.put(key, s.name);
        }
        return arr;
    }

    private static JsonNode source(RawConstruct.FactSource src) {
        ObjectNode m = MAPPER.createObjectNode();
        if (src.isStructured()) {
            m.put("path", src.path);
            m.put("source_id", src.sourceId);
            return m;
        }
        int dot = src.freetext.indexOf('.');
        if (dot < 0) return MAPPER.getNodeFactory().textNode(src.freetext);
        m.put("field", src.freetext.substring(dot + 1));
        m.put("system", src.freetext.substring(0, dot));
        return m;
    }

    // -------------------------
    // Types and literals
    // -------------------------

    static ObjectNode type(RawType t) {
        ObjectNode m = MAPPER.createObjectNode();
        switch (t.base) {
            case BOOL: m.put("base", "Bool"); break;
            case DATE: m.put("base", "Date"); break;
            case DATETIME: m.put("base", "DateTime"); break;
            case INT:
                m.put("base", "Int");
                m.put("max", t.max);
                m.put("min", t.min);
                break;
            case DECIMAL:
                m.put("base", "Decimal");
                m.put("precision", t.precision);
                m.put("scale", t.scale);
                break;
            case TEXT:
                m.put("base", "Text");
                m.put("max_length", t.maxLength);
                break;
            case ENUM: {
                m.put("base", "Enum");
                ArrayNode values = m.putArray("values");
                t.values.forEach(values::add);
                break;
            }
            case MONEY:
                m.put("base", "Money");
                m.put("currency", t.currency);
                break;
            case DURATION:
                m.put("base", "Duration");
                m.put("max", t.max);
                m.put("min", t.min);
                m.put("unit", t.unit);
                break;
            case RECORD: {
                m.put("base", "Record");
                ObjectNode fields = m.putObject("fields");
                t.fields.forEach((k, v) -> fields.set(k, type(v)));
                break;
            }
            case LIST:
                m.put("base", "List");
                m.set("element_type", type(t.elementType));
                m.put("max", t.listMax);
                break;
            case TAGGED_UNION: {
                m.put("base", "TaggedUnion");
                ObjectNode variants = m.putObject("variants");
                t.fields.forEach((k, v) -> variants.set(k, type(v)));
                break;
            }
            default:
                m.put("base", "TypeRef");
                m.put("id", t.refName);
        }
        return m;
    }

    private static JsonNode factDefault(RawType type, RawLiteral d) {
        if (type.is(RawType.Base.DECIMAL) && (d.kind == RawLiteral.Kind.FLOAT || d.kind == RawLiteral.Kind.STR)) {
            BigDecimal v = d.kind == RawLiteral.Kind.FLOAT ? d.decimalValue : new BigDecimal(d.text);
            return decimalValue(type.precision, type.scale, v.setScale(type.scale, RoundingMode.HALF_EVEN));
        }
        if (type.is(RawType.Base.MONEY) && d.kind == RawLiteral.Kind.MONEY) {
            return moneyValue(d.decimalValue.setScale(2, RoundingMode.HALF_EVEN), d.text);
        }
        return literal(d);
    }

    private static JsonNode literal(RawLiteral lit) {
        ObjectNode m = MAPPER.createObjectNode();
        switch (lit.kind) {
            case BOOL:
                m.put("kind", "bool_literal");
                m.put("value", lit.boolValue);
                return m;
            case INT:
                m.put("kind", "int_literal");
                m.put("value", lit.intValue);
                return m;
            case FLOAT:
                return decimalValue(precisionOf(lit.decimalValue), Math.max(lit.decimalValue.scale(), 0), lit.decimalValue);
            case STR:
                return MAPPER.getNodeFactory().textNode(lit.text);
            default:
                return moneyValue(lit.decimalValue, lit.text);
        }
    }

    private static ObjectNode decimalValue(int precision, int scale, BigDecimal value) {
        ObjectNode m = MAPPER.createObjectNode();
        m.put("kind", "decimal_value");
        m.put("precision", precision);
        m.put("scale", scale);
        m.put("value", value.toPlainString());
        return m;
    }

    private static ObjectNode moneyValue(BigDecimal amount, String currency) {
        ObjectNode m = MAPPER.createObjectNode();
        m.set("amount", decimalValue(10, 2, amount));
        m.put("currency", currency);
        m.put("kind", "money_value");
        return m;
    }

    /** Integer digits plus scale, as written. */
    private static int precisionOf(BigDecimal d) {
        String plain = d.abs().toPlainString();
        int dot = plain.indexOf('.');
        int intDigits = dot < 0 ? plain.length() : dot;
        return Math.max(intDigits + Math.max(d.scale(), 0), 1);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ObjectNode payload(RawType type, RawExpr.Term value) {
        ObjectNode m = MAPPER.createObjectNode();
        RawType effective = type;
        if (type.is(RawType.Base.TEXT) && type.maxLength == 0 && value instanceof RawExpr.Literal
                && ((RawExpr.Literal) value).value.kind == RawLiteral.Kind.STR) {
            effective = RawType.text(((RawExpr.Literal) value).value.text.length());
        }
        m.set("type", type(effective));
        if (value instanceof RawExpr.Literal) {
            RawLiteral lit = ((RawExpr.Literal) value).value;
            switch (lit.kind) {
                case BOOL: m.put("value", lit.boolValue); break;
                case INT: m.put("value", lit.intValue); break;
                case STR: m.put("value", lit.text); break;
                default: m.set("value", literal(lit));
            }
        } else if (value instanceof RawExpr.Mul) {
            m.set("value", mul((RawExpr.Mul) value));
        } else {
            m.set("value", term(value));
        }
        return m;
    }

    private ObjectNode expr(RawExpr.ExprNode e) {
        return e.accept(new RawExpr.ExprVisitor<ObjectNode>() {
            @Override
            public ObjectNode visitCompare(RawExpr.Compare c) {
                ObjectNode m = MAPPER.createObjectNode();
                RawType ct = comparisonType(c.left, c.right);
                if (ct != null) m.set("comparison_type", type(ct));
                m.set("left", termInContext(c.left));
                m.put("op", c.op);
                RawType leftType = c.left instanceof RawExpr.FactRef ? factTypes.get(((RawExpr.FactRef) c.left).name) : null;
                if (leftType != null && leftType.is(RawType.Base.ENUM) && c.right instanceof RawExpr.Literal
                        && ((RawExpr.Literal) c.right).value.kind == RawLiteral.Kind.STR) {
                    ObjectNode r = m.putObject("right");
                    r.put("literal", ((RawExpr.Literal) c.right).value.text);
                    r.set("type", type(leftType));
                } else {
                    m.set("right", termInContext(c.right));
                }
                return m;
            }

            @Override
            public ObjectNode visitAnd(RawExpr.And a) {
                return binary("and", a.left.accept(this), a.right.accept(this));
            }

            @Override
            public ObjectNode visitOr(RawExpr.Or o) {
                return binary("or", o.left.accept(this), o.right.accept(this));
            }

            @Override
            public ObjectNode visitNot(RawExpr.Not n) {
                ObjectNode m = MAPPER.createObjectNode();
                m.put("op", "not");
                m.set("operand", n.operand.accept(this));
                return m;
            }

            @Override
            public ObjectNode visitQuantifier(RawExpr.Quantifier q) {
                ObjectNode m = MAPPER.createObjectNode();
                m.set("body", q.body.accept(this));
                m.putObject("domain").put("fact_ref", q.domain);
                m.put("quantifier", q.keyword());
                m.put("variable", q.variable);
                RawType domain = factTypes.get(q.domain);
                if (domain != null && domain.is(RawType.Base.LIST)) m.set("variable_type", type(domain.elementType));
                return m;
            }

            @Override
            public ObjectNode visitVerdictPresent(RawExpr.VerdictPresent v) {
                ObjectNode m = MAPPER.createObjectNode();
                m.put("verdict_present", v.verdictType);
                return m;
            }
        });
    }

    private static ObjectNode binary(String op, ObjectNode left, ObjectNode right) {
        ObjectNode m = MAPPER.createObjectNode();
        m.set("left", left);
        m.put("op", op);
        m.set("right", right);
        return m;
    }

    private ObjectNode termInContext(RawExpr.Term t) {
        return t instanceof RawExpr.Mul ? mul((RawExpr.Mul) t) : term(t);
    }

    private static ObjectNode term(RawExpr.Term t) {
        ObjectNode m = MAPPER.createObjectNode();
        if (t instanceof RawExpr.FactRef) {
            m.put("fact_ref", ((RawExpr.FactRef) t).name);
        } else if (t instanceof RawExpr.FieldRef) {
            RawExpr.FieldRef f = (RawExpr.FieldRef) t;
            ObjectNode ref = m.putObject("field_ref");
            ref.put("field", f.field);
            ref.put("var", f.var);
        } else if (t instanceof RawExpr.Mul) {
            RawExpr.Mul mul = (RawExpr.Mul) t;
            m.set("left", term(mul.left));
            m.put("op", "*");
            m.set("right", term(mul.right));
        } else {
            RawLiteral lit = ((RawExpr.Literal) t).value;
            switch (lit.kind) {
                case BOOL:
                    m.put("literal", lit.boolValue);
                    m.set("type", type(RawType.bool()));
                    break;
                case INT:
                    m.put("literal", lit.intValue);
                    m.set("type", type(RawType.integer(lit.intValue, lit.intValue)));
                    break;
                case STR:
                    m.put("literal", lit.text);
                    break;
                case FLOAT: {
                    BigDecimal d = lit.decimalValue;
                    m.put("literal", d.toPlainString());
                    m.set("type", type(RawType.decimal(precisionOf(d), Math.max(d.scale(), 0))));
                    break;
                }
                default: {
                    ObjectNode l = m.putObject("literal");
                    l.set("amount", decimalValue(10, 2, lit.decimalValue));
                    l.put("currency", lit.text);
                    m.set("type", type(RawType.money(lit.text)));
                }
            }
        }
        return m;
    }

    /** Fact × Int literal carries the literal and the product's Int range. */
    private ObjectNode mul(RawExpr.Mul mul) {
        RawExpr.Term factTerm = null;
        Long n = null;
        if (mul.left instanceof RawExpr.FactRef && intLiteral(mul.right) != null) {
            factTerm = mul.left;
            n = intLiteral(mul.right);
        } else if (mul.right instanceof RawExpr.FactRef && intLiteral(mul.left) != null) {
            factTerm = mul.right;
            n = intLiteral(mul.left);
        }
        if (factTerm == null) return term(mul);

        ObjectNode m = MAPPER.createObjectNode();
        m.set("left", term(factTerm));
        m.put("literal", n);
        m.put("op", "*");
        RawType range = scaledRange(factTypes.get(((RawExpr.FactRef) factTerm).name), n);
        if (range != null) m.set("result_type", type(range));
        return m;
    }

    private static Long intLiteral(RawExpr.Term t) {
        if (t instanceof RawExpr.Literal && ((RawExpr.Literal) t).value.kind == RawLiteral.Kind.INT) {
            return ((RawExpr.Literal) t).value.intValue;
        }
        return null;
    }

    private static RawType scaledRange(RawType factType, long n) {
        if (factType == null || !factType.is(RawType.Base.INT)) return null;
        long a = clampMul(factType.min, n);
        long b = clampMul(factType.max, n);
        return RawType.integer(Math.min(a, b), Math.max(a, b));
    }

    private static long clampMul(long a, long b) {
        BigInteger p = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b));
        if (p.bitLength() < 64) return p.longValue();
        return p.signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
    }

    private RawType numericType(RawExpr.Term t) {
        if (t instanceof RawExpr.FactRef) return factTypes.get(((RawExpr.FactRef) t).name);
        Long n = intLiteral(t);
        if (n != null) return RawType.integer(n, n);
        if (t instanceof RawExpr.Mul) {
            RawExpr.Mul mul = (RawExpr.Mul) t;
            if (mul.left instanceof RawExpr.FactRef && intLiteral(mul.right) != null) {
                return scaledRange(factTypes.get(((RawExpr.FactRef) mul.left).name), intLiteral(mul.right));
            }
            if (mul.right instanceof RawExpr.FactRef && intLiteral(mul.left) != null) {
                return scaledRange(factTypes.get(((RawExpr.FactRef) mul.right).name), intLiteral(mul.left));
            }
        }
        return null;
    }

    private RawType comparisonType(RawExpr.Term left, RawExpr.Term right) {
        RawType lt = numericType(left);
        RawType rt = numericType(right);
        if (lt != null && lt.is(RawType.Base.MONEY)) return lt;
        if (rt != null && rt.is(RawType.Base.MONEY)) return rt;
        if (lt == null || rt == null) return null;
        if (lt.is(RawType.Base.INT) && rt.is(RawType.Base.DECIMAL)) {
            return RawType.decimal(Math.max(rt.precision, decimalDigits(lt)) + 1, rt.scale);
        }
        if (lt.is(RawType.Base.DECIMAL) && rt.is(RawType.Base.INT)) {
            return RawType.decimal(Math.max(lt.precision, decimalDigits(rt)) + 1, lt.scale);
        }
        if (lt.is(RawType.Base.INT) && rt.is(RawType.Base.INT) && left instanceof RawExpr.Mul) {
            return RawType.integer(Math.min(lt.min, rt.min), Math.max(lt.max, rt.max));
        }
        return null;
    }

    /** Decimal precision wide enough for every value of an Int range. */
    private static int decimalDigits(RawType intType) {
        BigInteger absMax = BigInteger.valueOf(intType.min).abs().max(BigInteger.valueOf(intType.max).abs());
        if (absMax.signum() == 0) return 1;
        return (int) Math.ceil(Math.log10(absMax.doubleValue())) + 1;
    }

    // -------------------------
    // Flow steps
    // -------------------------

    private ArrayNode steps(Map<String, RawStep.Step> steps, String entry) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (String sid : breadthFirst(steps, entry)) arr.add(step(sid, steps.get(sid)));
        return arr;
    }

    private static List<String> breadthFirst(Map<String, RawStep.Step> steps, String entry) {
        Set<String> order = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        if (steps.containsKey(entry)) {
            queue.add(entry);
            order.add(entry);
        }
        while (!queue.isEmpty()) {
            for (String next : FlowValidator.successors(steps.get(queue.poll()))) {
                if (steps.containsKey(next) && order.add(next)) queue.add(next);
            }
        }
        order.addAll(new TreeMap<>(steps).keySet());
        return new ArrayList<>(order);
    }

    private ObjectNode step(String id, RawStep.Step step) {
        ObjectNode m = MAPPER.createObjectNode();
        m.put("id", id);
        m.put("kind", step.kindName());
        switch (step.kind()) {
            case OPERATION: {
                RawStep.OperationStep s = (RawStep.OperationStep) step;
                if (s.onFailure != null) m.set("on_failure", handler(s.onFailure));
                m.put("op", s.op);
                ObjectNode outcomes = m.putObject("outcomes");
                s.outcomes.forEach((label, t) -> outcomes.set(label, target(t)));
                m.put("persona", s.persona);
                break;
            }
            case BRANCH: {
                RawStep.BranchStep s = (RawStep.BranchStep) step;
                m.set("condition", expr(s.condition));
                m.set("if_false", target(s.ifFalse));
                m.set("if_true", target(s.ifTrue));
                m.put("persona", s.persona);
                break;
            }
            case HANDOFF: {
                RawStep.HandoffStep s = (RawStep.HandoffStep) step;
                m.put("from_persona", s.fromPersona);
                m.put("next", s.next);
                m.put("to_persona", s.toPersona);
                break;
            }
            case SUB_FLOW: {
                RawStep.SubFlowStep s = (RawStep.SubFlowStep) step;
                m.put("flow", s.flow);
                if (s.onFailure != null) m.set("on_failure", handler(s.onFailure));
                m.set("on_success", target(s.onSuccess));
                m.put("persona", s.persona);
                break;
            }
            default: {
                RawStep.ParallelStep s = (RawStep.ParallelStep) step;
                ArrayNode branches = m.putArray("branches");
                for (RawStep.Branch b : s.branches) {
                    ObjectNode bn = branches.addObject();
                    bn.put("entry", b.entry);
                    bn.put("id", b.id);
                    bn.set("steps", steps(b.steps, b.entry));
                }
                ObjectNode join = m.putObject("join");
                if (s.join.onAllSuccess != null) join.set("on_all_success", target(s.join.onAllSuccess));
                if (s.join.onAnyFailure != null) join.set("on_any_failure", handler(s.join.onAnyFailure));
                if (s.join.onAllComplete != null) join.set("on_all_complete", target(s.join.onAllComplete));
            }
        }
        return m;
    }

    private static JsonNode target(RawStep.Target t) {
        if (!t.isTerminal()) return MAPPER.getNodeFactory().textNode(t.stepId);
        return terminal(t.terminal);
    }

    private static ObjectNode terminal(String outcome) {
        ObjectNode m = MAPPER.createObjectNode();
        m.put("kind", "Terminal");
        m.put("outcome", outcome);
        return m;
    }

    private static ObjectNode handler(RawStep.FailureHandler h) {
        ObjectNode m = MAPPER.createObjectNode();
        switch (h.kind) {
            case TERMINATE:
                m.put("kind", "Terminate");
                m.put("outcome", h.outcome);
                break;
            case COMPENSATE: {
                m.put("kind", "Compensate");
                ArrayNode steps = m.putArray("steps");
                for (RawStep.CompStep c : h.steps) {
                    ObjectNode cn = steps.addObject();
                    cn.set("on_failure", terminal(c.onFailure));
                    cn.put("op", c.op);
                    cn.put("persona", c.persona);
                }
                m.set("then", terminal(h.then));
                break;
            }
            default:
                m.put("kind", "Escalate");
                m.put("next", h.next);
                m.put("to_persona", h.toPersona);
        }
        return m;
    }
}
