package com.tenor.elaborate.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A type expression as written in source. After Pass 3/4 no {@link Base#REF}
 * node remains reachable from a fact, rule payload, or record field.
 */
public final class RawType {

    public enum Base { BOOL, INT, DECIMAL, TEXT, DATE, DATETIME, MONEY, DURATION, ENUM, LIST, RECORD, TAGGED_UNION, REF }

    public final Base base;

    // Int / Duration
    public final long min;
    public final long max;
    // Decimal
    public final int precision;
    public final int scale;
    // Text
    public final int maxLength;
    // Money
    public final String currency;
    // Duration
    public final String unit;
    // Enum
    public final List<String> values;
    // List
    public final RawType elementType;
    public final int listMax;
    // Record fields / TaggedUnion variants, sorted by name
    public final Map<String, RawType> fields;
    // TypeRef
    public final String refName;

    private RawType(Base base, long min, long max, int precision, int scale, int maxLength,
                    String currency, String unit, List<String> values, RawType elementType,
                    int listMax, Map<String, RawType> fields, String refName) {
        this.base = base;
        this.min = min;
        this.max = max;
        this.precision = precision;
        this.scale = scale;
        this.maxLength = maxLength;
        this.currency = currency;
        this.unit = unit;
        this.values = values == null ? List.of() : List.copyOf(values);
        this.elementType = elementType;
        this.listMax = listMax;
        this.fields = fields == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(fields));
        this.refName = refName;
    }

    private static RawType simple(Base base) {
        return new RawType(base, 0, 0, 0, 0, 0, null, null, null, null, 0, null, null);
    }

    public static RawType bool() { return simple(Base.BOOL); }
    public static RawType date() { return simple(Base.DATE); }
    public static RawType dateTime() { return simple(Base.DATETIME); }

    public static RawType integer(long min, long max) {
        return new RawType(Base.INT, min, max, 0, 0, 0, null, null, null, null, 0, null, null);
    }

    public static RawType decimal(int precision, int scale) {
        return new RawType(Base.DECIMAL, 0, 0, precision, scale, 0, null, null, null, null, 0, null, null);
    }

    public static RawType text(int maxLength) {
        return new RawType(Base.TEXT, 0, 0, 0, 0, maxLength, null, null, null, null, 0, null, null);
    }

    public static RawType money(String currency) {
        return new RawType(Base.MONEY, 0, 0, 0, 0, 0, currency, null, null, null, 0, null, null);
    }

    public static RawType duration(String unit, long min, long max) {
        return new RawType(Base.DURATION, min, max, 0, 0, 0, null, unit, null, null, 0, null, null);
    }

    public static RawType enumOf(List<String> values) {
        return new RawType(Base.ENUM, 0, 0, 0, 0, 0, null, null, values, null, 0, null, null);
    }

    public static RawType list(RawType elementType, int max) {
        return new RawType(Base.LIST, 0, 0, 0, 0, 0, null, null, null, elementType, max, null, null);
    }

    public static RawType record(Map<String, RawType> fields) {
        return new RawType(Base.RECORD, 0, 0, 0, 0, 0, null, null, null, null, 0, fields, null);
    }

    public static RawType taggedUnion(Map<String, RawType> variants) {
        return new RawType(Base.TAGGED_UNION, 0, 0, 0, 0, 0, null, null, null, null, 0, variants, null);
    }

    public static RawType ref(String name) {
        return new RawType(Base.REF, 0, 0, 0, 0, 0, null, null, null, null, 0, null, name);
    }

    public boolean is(Base b) {
        return base == b;
    }

    /** Same node with every child rebuilt through {@code f}. */
    public RawType mapChildren(java.util.function.UnaryOperator<RawType> f) {
        switch (base) {
            case LIST:
                return list(f.apply(elementType), listMax);
            case RECORD:
            case TAGGED_UNION: {
                Map<String, RawType> out = new LinkedHashMap<>();
                for (Map.Entry<String, RawType> e : fields.entrySet()) out.put(e.getKey(), f.apply(e.getValue()));
                return base == Base.RECORD ? record(out) : taggedUnion(out);
            }
            default:
                return this;
        }
    }

    /** Source-like rendering used in diagnostics, e.g. {@code Int(min: 0, max: 10)}. */
    public String display() {
        switch (base) {
            case BOOL: return "Bool";
            case DATE: return "Date";
            case DATETIME: return "DateTime";
            case INT: return "Int(min: " + min + ", max: " + max + ")";
            case DECIMAL: return "Decimal(precision: " + precision + ", scale: " + scale + ")";
            case TEXT: return "Text(max_length: " + maxLength + ")";
            case MONEY: return "Money(currency: " + currency + ")";
            case DURATION: return "Duration(unit: " + unit + ")";
            case ENUM: return "Enum(values: " + values + ")";
            case LIST: return "List(element_type: " + elementType.display() + ", max: " + listMax + ")";
            case RECORD: return "Record";
            case TAGGED_UNION: return "TaggedUnion";
            default: return refName;
        }
    }

    @Override
    public String toString() {
        return display();
    }
}
