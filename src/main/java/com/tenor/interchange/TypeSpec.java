package com.tenor.interchange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A declared type as it appears in the bundle. Parameters that do not apply
 * to {@link #base} are null.
 */
public final class TypeSpec {

    public final String base;
    public final Integer precision;
    public final Integer scale;
    public final String currency;
    public final Long min;
    public final Long max;
    public final Integer maxLength;
    public final List<String> values;
    public final Map<String, TypeSpec> fields;
    public final TypeSpec elementType;
    public final String unit;
    public final Map<String, TypeSpec> variants;

    private TypeSpec(String base, Integer precision, Integer scale, String currency, Long min, Long max,
                     Integer maxLength, List<String> values, Map<String, TypeSpec> fields, TypeSpec elementType,
                     String unit, Map<String, TypeSpec> variants) {
        this.base = base;
        this.precision = precision;
        this.scale = scale;
        this.currency = currency;
        this.min = min;
        this.max = max;
        this.maxLength = maxLength;
        this.values = values;
        this.fields = fields;
        this.elementType = elementType;
        this.unit = unit;
        this.variants = variants;
    }

    /** A type with only its base set, used for inferred literals. */
    public static TypeSpec of(String base) {
        return new TypeSpec(base, null, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean is(String b) {
        return base.equals(b);
    }

    public static TypeSpec fromJson(JsonNode n) {
        if (n == null || !n.isObject()) throw new BundleFormatException("type must be an object");
        JsonNode b = n.get("base");
        if (b == null || !b.isTextual()) throw new BundleFormatException("type missing 'base'");

        List<String> values = null;
        if (n.has("values")) {
            values = new ArrayList<>();
            for (JsonNode v : n.get("values")) values.add(v.asText());
            values = Collections.unmodifiableList(values);
        }
        return new TypeSpec(
                b.asText(),
                n.has("precision") ? n.get("precision").asInt() : null,
                n.has("scale") ? n.get("scale").asInt() : null,
                n.has("currency") ? n.get("currency").asText() : null,
                n.has("min") ? n.get("min").asLong() : null,
                n.has("max") ? n.get("max").asLong() : null,
                n.has("max_length") ? n.get("max_length").asInt() : null,
                values,
                n.has("fields") ? typeMap(n.get("fields")) : null,
                n.has("element_type") ? fromJson(n.get("element_type")) : null,
                n.has("unit") ? n.get("unit").asText() : null,
                n.has("variants") ? typeMap(n.get("variants")) : null);
    }

    private static Map<String, TypeSpec> typeMap(JsonNode obj) {
        Map<String, TypeSpec> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), fromJson(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        switch (base) {
            case "Int": return "Int(min: " + min + ", max: " + max + ")";
            case "Decimal": return "Decimal(precision: " + precision + ", scale: " + scale + ")";
            case "Money": return "Money(currency: " + currency + ")";
            default: return base;
        }
    }
}
