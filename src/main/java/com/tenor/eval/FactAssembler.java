package com.tenor.eval;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenor.debug.Debug;
import com.tenor.interchange.Contract;
import com.tenor.interchange.TypeSpec;

/**
 * Builds a {@link FactSet} from caller-supplied JSON.
 *
 * Every declared fact is taken from the input when present (and checked
 * against its declared type), else from its default. A fact with neither is a
 * {@link EvalError#MISSING_FACT}. Undeclared input keys are ignored.
 */
public final class FactAssembler {

    private static final String TAG = "tenor.eval";
    private static final List<String> DURATION_UNITS = List.of("seconds", "minutes", "hours", "days");

    private FactAssembler() {}

    public static FactSet assemble(Contract contract, JsonNode facts) {
        if (facts == null || !facts.isObject()) throw EvalException.deserialize("facts must be a JSON object");

        Map<String, Value> out = new TreeMap<>();
        for (Contract.FactDecl decl : contract.facts().values()) {
            JsonNode supplied = facts.get(decl.id);
            if (supplied != null) {
                out.put(decl.id, typecheck(decl.id, supplied, decl.type));
            } else if (decl.defaultValue != null) {
                out.put(decl.id, Values.parseDefault(decl.defaultValue, decl.type));
            } else {
                Debug.get().d(TAG, "fact '" + decl.id + "' missing with no default");
                throw EvalException.missingFact(decl.id);
            }
        }
        return new FactSet(out);
    }

    /** Declared facts that are neither supplied nor defaulted, in declaration order. */
    public static List<String> missing(Contract contract, JsonNode facts) {
        List<String> out = new ArrayList<>();
        for (Contract.FactDecl decl : contract.facts().values()) {
            boolean supplied = facts != null && facts.has(decl.id);
            if (!supplied && decl.defaultValue == null) out.add(decl.id);
        }
        return out;
    }

    private static Value typecheck(String factId, JsonNode json, TypeSpec type) {
        Value v;
        try {
            v = Values.parsePlain(json, type);
        } catch (EvalException e) {
            throw EvalException.typeMismatch(factId, type.base, jsonTypeName(json));
        }
        validate(factId, v, type);
        return v;
    }

    private static void validate(String factId, Value v, TypeSpec type) {
        switch (v.type) {
            case ENUM:
                if (type.values != null && !type.values.contains(v.asString())) {
                    throw new EvalException(EvalError.INVALID_ENUM, factId,
                            "invalid enum value '" + v.asString() + "' for fact '" + factId + "', valid: " + type.values);
                }
                break;
            case LIST:
                if (type.max != null && v.asList().size() > type.max) {
                    throw new EvalException(EvalError.LIST_OVERFLOW, factId,
                            "list fact '" + factId + "' has " + v.asList().size() + " elements, max is " + type.max);
                }
                break;
            case INT:
                if (type.min != null && type.max != null && (v.asInt() < type.min || v.asInt() > type.max)) {
                    throw EvalException.typeMismatch(factId, "Int(" + type.min + ", " + type.max + ")", String.valueOf(v.asInt()));
                }
                break;
            case TEXT:
                if (type.maxLength != null && v.asString().length() > type.maxLength) {
                    throw EvalException.typeMismatch(factId, "Text(max_length=" + type.maxLength + ")",
                            "text of length " + v.asString().length());
                }
                break;
            case DATE:
                if (!isDate(v.asString())) {
                    throw EvalException.typeError("fact '" + factId + "': invalid Date format '" + v.asString()
                            + "', expected ISO 8601 (YYYY-MM-DD)");
                }
                break;
            case DATETIME:
                if (!isDateTime(v.asString())) {
                    throw EvalException.typeError("fact '" + factId + "': invalid DateTime format '" + v.asString()
                            + "', expected ISO 8601 (YYYY-MM-DDT...)");
                }
                break;
            case DURATION:
                if (!DURATION_UNITS.contains(v.asDuration().unit)) {
                    throw EvalException.typeError("fact '" + factId + "': invalid Duration unit '" + v.asDuration().unit
                            + "', expected one of: " + String.join(", ", DURATION_UNITS));
                }
                break;
            default:
                break;
        }
    }

    static boolean isDate(String s) {
        try {
            LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /** Only the first 19 characters are checked, so zone suffixes pass. */
    static boolean isDateTime(String s) {
        if (s.length() < 19) return false;
        try {
            LocalDateTime.parse(s.substring(0, 19), DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static String jsonTypeName(JsonNode v) {
        if (v.isNull()) return "null";
        if (v.isBoolean()) return "boolean";
        if (v.isNumber()) return "number";
        if (v.isTextual()) return "string";
        if (v.isArray()) return "array";
        return "object";
    }
}
