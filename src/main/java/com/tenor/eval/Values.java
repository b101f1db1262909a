package com.tenor.eval;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenor.interchange.TypeSpec;

/** Conversion of bundle and fact JSON into {@link Value}s, guided by the declared type. */
final class Values {

    private Values() {}

    /** Defaults may be kind-tagged literals or plain values. */
    static Value parseDefault(JsonNode v, TypeSpec type) {
        String kind = v.isObject() && v.path("kind").isTextual() ? v.get("kind").asText() : null;
        if (kind != null) {
            switch (kind) {
                case "bool_literal":
                    if (!v.path("value").isBoolean()) throw EvalException.deserialize("bool_literal missing 'value'");
                    return Value.bool(v.get("value").asBoolean());
                case "int_literal":
                    if (!v.path("value").canConvertToLong()) throw EvalException.deserialize("int_literal missing 'value'");
                    return Value.integer(v.get("value").asLong());
                case "decimal_value":
                    if (!v.path("value").isTextual()) throw EvalException.deserialize("decimal_value missing 'value'");
                    return Value.decimal(decimal(v.get("value").asText(), "invalid decimal"));
                case "money_value": {
                    if (!v.path("currency").isTextual()) throw EvalException.deserialize("money_value missing 'currency'");
                    JsonNode amount = v.get("amount");
                    if (amount == null) throw EvalException.deserialize("money_value missing 'amount'");
                    if (!amount.path("value").isTextual()) throw EvalException.deserialize("money_value amount missing 'value'");
                    return Value.money(decimal(amount.get("value").asText(), "invalid money amount"), v.get("currency").asText());
                }
                default:
                    break;
            }
        }
        return parsePlain(v, type);
    }

    /** Literals in predicates and verdict payloads. */
    static Value parseLiteral(JsonNode v, TypeSpec type) {
        switch (type.base) {
            case "Bool":
                if (!v.isBoolean()) throw EvalException.deserialize("expected boolean literal");
                return Value.bool(v.asBoolean());
            case "Int":
                if (!v.canConvertToLong() || !v.isIntegralNumber()) throw EvalException.deserialize("expected integer literal");
                return Value.integer(v.asLong());
            case "Text":
                if (!v.isTextual()) throw EvalException.deserialize("expected text literal");
                return Value.text(v.asText());
            case "Enum":
                if (!v.isTextual()) throw EvalException.deserialize("expected enum literal");
                return Value.enumeration(v.asText());
            default:
                return parseDefault(v, type);
        }
    }

    /** Untyped literal: Bool, Int or Text by JSON shape. */
    static Value infer(JsonNode v) {
        if (v.isBoolean()) return Value.bool(v.asBoolean());
        if (v.isIntegralNumber() && v.canConvertToLong()) return Value.integer(v.asLong());
        if (v.isTextual()) return Value.text(v.asText());
        throw EvalException.deserialize("cannot infer type for literal: " + v);
    }

    /** Plain JSON (fact input) by declared base type. */
    static Value parsePlain(JsonNode v, TypeSpec type) {
        switch (type.base) {
            case "Bool":
                if (!v.isBoolean()) throw EvalException.deserialize("expected boolean");
                return Value.bool(v.asBoolean());
            case "Int":
                if (!v.isIntegralNumber() || !v.canConvertToLong()) throw EvalException.deserialize("expected integer");
                return Value.integer(v.asLong());
            case "Decimal": {
                // facts carry decimals as strings; structured decimal_value objects are also accepted
                String s = v.isTextual() ? v.asText() : v.path("value").isTextual() ? v.get("value").asText() : null;
                if (s == null) throw EvalException.deserialize("expected decimal string");
                return Value.decimal(decimal(s, "invalid decimal"));
            }
            case "Money": {
                JsonNode amount = v.get("amount");
                if (amount == null) throw EvalException.deserialize("Money value missing 'amount' field");
                String s;
                if (amount.isTextual()) {
                    s = amount.asText();
                } else if (amount.path("value").isTextual()) {
                    s = amount.get("value").asText();
                } else {
                    throw EvalException.deserialize("Money 'amount' must be a string or structured decimal_value");
                }
                String currency = v.path("currency").isTextual() ? v.get("currency").asText()
                        : type.currency == null ? "" : type.currency;
                return Value.money(decimal(s, "invalid money amount"), currency);
            }
            case "Text":
                if (!v.isTextual()) throw EvalException.deserialize("expected text string");
                return Value.text(v.asText());
            case "Date":
                if (!v.isTextual()) throw EvalException.deserialize("expected date string");
                return Value.date(v.asText());
            case "DateTime":
                if (!v.isTextual()) throw EvalException.deserialize("expected datetime string");
                return Value.dateTime(v.asText());
            case "Duration": {
                if (!v.path("value").isIntegralNumber()) throw EvalException.deserialize("Duration missing 'value'");
                String unit = v.path("unit").isTextual() ? v.get("unit").asText()
                        : type.unit == null ? "seconds" : type.unit;
                return Value.duration(v.get("value").asLong(), unit);
            }
            case "Enum":
                if (!v.isTextual()) throw EvalException.deserialize("expected enum string");
                return Value.enumeration(v.asText());
            case "Record": {
                if (!v.isObject()) throw EvalException.deserialize("expected record object");
                if (type.fields == null) throw EvalException.deserialize("Record type missing 'fields'");
                Map<String, Value> fields = new TreeMap<>();
                for (Map.Entry<String, TypeSpec> e : type.fields.entrySet()) {
                    JsonNode fv = v.get(e.getKey());
                    if (fv == null) throw EvalException.deserialize("Record missing field '" + e.getKey() + "'");
                    fields.put(e.getKey(), parsePlain(fv, e.getValue()));
                }
                return Value.record(fields);
            }
            case "List": {
                if (!v.isArray()) throw EvalException.deserialize("expected list array");
                if (type.elementType == null) throw EvalException.deserialize("List type missing 'element_type'");
                List<Value> items = new ArrayList<>();
                for (JsonNode item : v) items.add(parsePlain(item, type.elementType));
                return Value.list(items);
            }
            case "TaggedUnion": {
                if (!v.isObject()) throw EvalException.deserialize("expected tagged union object");
                if (!v.path("tag").isTextual()) throw EvalException.deserialize("TaggedUnion missing 'tag'");
                JsonNode payload = v.get("payload");
                if (payload == null) throw EvalException.deserialize("TaggedUnion missing 'payload'");
                if (type.variants == null) throw EvalException.deserialize("TaggedUnion type missing 'variants'");
                String tag = v.get("tag").asText();
                TypeSpec vt = type.variants.get(tag);
                if (vt == null) throw EvalException.deserialize("unknown TaggedUnion variant '" + tag + "'");
                return Value.tagged(tag, parsePlain(payload, vt));
            }
            default:
                throw EvalException.deserialize("unsupported type base: " + type.base);
        }
    }

    private static BigDecimal decimal(String s, String what) {
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            throw EvalException.deserialize(what + ": " + s);
        }
    }
}
