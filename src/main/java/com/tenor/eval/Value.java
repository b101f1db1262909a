package com.tenor.eval;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Runtime value of a fact, literal or verdict payload. Immutable. */
public final class Value {
    public enum Type { BOOL, INT, DECIMAL, TEXT, DATE, DATETIME, MONEY, DURATION, ENUM, RECORD, LIST, TAGGED_UNION }

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static final class Money {
        public final BigDecimal amount;
        public final String currency;

        Money(BigDecimal amount, String currency) {
            this.amount = amount;
            this.currency = currency;
        }
    }

    public static final class Duration {
        public final long value;
        public final String unit;

        Duration(long value, String unit) {
            this.value = value;
            this.unit = unit;
        }
    }

    public static final class Tagged {
        public final String tag;
        public final Value payload;

        Tagged(String tag, Value payload) {
            this.tag = tag;
            this.payload = payload;
        }
    }

    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value integer(long i) { return new Value(Type.INT, i); }
    public static Value decimal(BigDecimal d) { return new Value(Type.DECIMAL, d); }
    public static Value text(String s) { return new Value(Type.TEXT, s); }
    public static Value date(String s) { return new Value(Type.DATE, s); }
    public static Value dateTime(String s) { return new Value(Type.DATETIME, s); }
    public static Value money(BigDecimal amount, String currency) { return new Value(Type.MONEY, new Money(amount, currency)); }
    public static Value duration(long v, String unit) { return new Value(Type.DURATION, new Duration(v, unit)); }
    public static Value enumeration(String s) { return new Value(Type.ENUM, s); }
    public static Value record(Map<String, Value> fields) {
        return new Value(Type.RECORD, Collections.unmodifiableMap(new TreeMap<>(fields)));
    }
    public static Value list(List<Value> items) { return new Value(Type.LIST, List.copyOf(items)); }
    public static Value tagged(String tag, Value payload) { return new Value(Type.TAGGED_UNION, new Tagged(tag, payload)); }

    public String typeName() {
        switch (type) {
            case BOOL: return "Bool";
            case INT: return "Int";
            case DECIMAL: return "Decimal";
            case TEXT: return "Text";
            case DATE: return "Date";
            case DATETIME: return "DateTime";
            case MONEY: return "Money";
            case DURATION: return "Duration";
            case ENUM: return "Enum";
            case RECORD: return "Record";
            case LIST: return "List";
            default: return "TaggedUnion";
        }
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw EvalException.typeError("expected Bool, got " + typeName());
        return (boolean) value;
    }

    public long asInt() {
        if (type != Type.INT) throw EvalException.typeError("expected Int, got " + typeName());
        return (long) value;
    }

    public BigDecimal asDecimal() {
        if (type != Type.DECIMAL) throw EvalException.typeError("expected Decimal, got " + typeName());
        return (BigDecimal) value;
    }

    /** The string content of Text, Date, DateTime and Enum values. */
    public String asString() {
        switch (type) {
            case TEXT:
            case DATE:
            case DATETIME:
            case ENUM:
                return (String) value;
            default:
                throw EvalException.typeError("expected string-like value, got " + typeName());
        }
    }

    public Money asMoney() {
        if (type != Type.MONEY) throw EvalException.typeError("expected Money, got " + typeName());
        return (Money) value;
    }

    public Duration asDuration() {
        if (type != Type.DURATION) throw EvalException.typeError("expected Duration, got " + typeName());
        return (Duration) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asRecord() {
        if (type != Type.RECORD) throw EvalException.typeError("expected Record, got " + typeName());
        return (Map<String, Value>) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw EvalException.typeError("expected List, got " + typeName());
        return (List<Value>) value;
    }

    public Tagged asTagged() {
        if (type != Type.TAGGED_UNION) throw EvalException.typeError("expected TaggedUnion, got " + typeName());
        return (Tagged) value;
    }

    /** Output form: {@code {"kind": "<x>_value", ...}}. */
    public JsonNode toJson() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode o = f.objectNode();
        switch (type) {
            case BOOL:
                o.put("kind", "bool_value");
                o.put("value", asBool());
                break;
            case INT:
                o.put("kind", "int_value");
                o.put("value", asInt());
                break;
            case DECIMAL:
                o.put("kind", "decimal_value");
                o.put("value", asDecimal().toPlainString());
                break;
            case TEXT:
                o.put("kind", "text_value");
                o.put("value", asString());
                break;
            case DATE:
                o.put("kind", "date_value");
                o.put("value", asString());
                break;
            case DATETIME:
                o.put("kind", "datetime_value");
                o.put("value", asString());
                break;
            case MONEY: {
                Money m = asMoney();
                o.put("kind", "money_value");
                o.put("amount", m.amount.toPlainString());
                o.put("currency", m.currency);
                break;
            }
            case DURATION: {
                Duration d = asDuration();
                o.put("kind", "duration_value");
                o.put("value", d.value);
                o.put("unit", d.unit);
                break;
            }
            case ENUM:
                o.put("kind", "enum_value");
                o.put("value", asString());
                break;
            case RECORD: {
                o.put("kind", "record_value");
                ObjectNode fields = o.putObject("fields");
                for (Map.Entry<String, Value> e : asRecord().entrySet()) fields.set(e.getKey(), e.getValue().toJson());
                break;
            }
            case LIST: {
                o.put("kind", "list_value");
                ArrayNode arr = o.putArray("elements");
                for (Value v : asList()) arr.add(v.toJson());
                break;
            }
            case TAGGED_UNION: {
                Tagged t = asTagged();
                o.put("kind", "tagged_union_value");
                o.put("tag", t.tag);
                o.set("payload", t.payload.toJson());
                break;
            }
        }
        return o;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Value)) return false;
        Value v = (Value) other;
        if (type != v.type) return false;
        switch (type) {
            case DECIMAL:
                return asDecimal().compareTo(v.asDecimal()) == 0;
            case MONEY:
                return asMoney().currency.equals(v.asMoney().currency)
                        && asMoney().amount.compareTo(v.asMoney().amount) == 0;
            case DURATION:
                return asDuration().value == v.asDuration().value && asDuration().unit.equals(v.asDuration().unit);
            case TAGGED_UNION:
                return asTagged().tag.equals(v.asTagged().tag) && asTagged().payload.equals(v.asTagged().payload);
            default:
                return Objects.equals(value, v.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case DECIMAL:
                return Objects.hash(type, asDecimal().stripTrailingZeros());
            case MONEY:
                return Objects.hash(type, asMoney().amount.stripTrailingZeros(), asMoney().currency);
            case DURATION:
                return Objects.hash(type, asDuration().value, asDuration().unit);
            case TAGGED_UNION:
                return Objects.hash(type, asTagged().tag, asTagged().payload);
            default:
                return Objects.hash(type, value);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case TEXT:
            case ENUM:
                return '"' + asString() + '"';
            case DECIMAL:
                return asDecimal().toPlainString();
            case MONEY:
                return asMoney().amount.toPlainString() + " " + asMoney().currency;
            case DURATION:
                return asDuration().value + " " + asDuration().unit;
            case TAGGED_UNION:
                return asTagged().tag + "(" + asTagged().payload + ")";
            default:
                return String.valueOf(value);
        }
    }
}
