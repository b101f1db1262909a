package com.tenor.eval;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.tenor.interchange.TypeSpec;

/**
 * Comparison and multiplication over {@link Value}s. Decimal arithmetic is
 * exact with half-even rounding to the declared scale; no floating point.
 */
final class Numeric {

    private Numeric() {}

    static boolean compare(Value left, Value right, String op, TypeSpec comparisonType) {
        if (comparisonType != null) return compareWithPromotion(left, right, op, comparisonType);

        if (left.type == right.type) {
            switch (left.type) {
                case BOOL:
                    return compareBools(left.asBool(), right.asBool(), op);
                case INT:
                    return ordered(Long.compare(left.asInt(), right.asInt()), op);
                case DECIMAL:
                    return ordered(left.asDecimal().compareTo(right.asDecimal()), op);
                case TEXT:
                case ENUM:
                    return equality(left, right, op);
                case MONEY:
                    return compareMoney(left, right, op);
                case DATE:
                case DATETIME:
                    return ordered(left.asString().compareTo(right.asString()), op);
                case DURATION: {
                    Value.Duration l = left.asDuration();
                    Value.Duration r = right.asDuration();
                    if (!l.unit.equals(r.unit)) {
                        throw EvalException.typeError("cannot compare Duration with different units: " + l.unit + " vs "
                                + r.unit + " (cross-unit Duration comparison not supported)");
                    }
                    return ordered(Long.compare(l.value, r.value), op);
                }
                default:
                    break;
            }
        }
        // an untyped string literal infers as Text; let it meet an Enum fact
        if (isTextOrEnum(left) && isTextOrEnum(right)) return equality(left, right, op);

        throw EvalException.typeError("cannot compare " + left.typeName() + " with " + right.typeName());
    }

    private static boolean compareWithPromotion(Value left, Value right, String op, TypeSpec ct) {
        switch (ct.base) {
            case "Decimal":
                return ordered(toDecimal(left, ct).compareTo(toDecimal(right, ct)), op);
            case "Money":
                if (left.type != Value.Type.MONEY) throw EvalException.typeError("cannot coerce " + left.typeName() + " to Money");
                if (right.type != Value.Type.MONEY) throw EvalException.typeError("cannot coerce " + right.typeName() + " to Money");
                return compareMoney(left, right, op);
            case "Int":
                if (left.type != Value.Type.INT) throw EvalException.typeError("cannot coerce " + left.typeName() + " to Int");
                if (right.type != Value.Type.INT) throw EvalException.typeError("cannot coerce " + right.typeName() + " to Int");
                return ordered(Long.compare(left.asInt(), right.asInt()), op);
            default:
                return compare(left, right, op, null);
        }
    }

    /** {@code left * literal}; Int products must fit the result type's range. */
    static Value multiply(Value left, long literal, TypeSpec resultType) {
        switch (left.type) {
            case INT: {
                long product;
                try {
                    product = Math.multiplyExact(left.asInt(), literal);
                } catch (ArithmeticException e) {
                    throw EvalException.overflow("integer multiplication overflow");
                }
                if (resultType.min != null && resultType.max != null
                        && (product < resultType.min || product > resultType.max)) {
                    throw EvalException.overflow("result " + product + " outside declared range ["
                            + resultType.min + ", " + resultType.max + "]");
                }
                return Value.integer(product);
            }
            case DECIMAL: {
                int precision = resultType.precision == null ? 28 : resultType.precision;
                int scale = resultType.scale == null ? 0 : resultType.scale;
                BigDecimal rounded = left.asDecimal().multiply(BigDecimal.valueOf(literal)).setScale(scale, RoundingMode.HALF_EVEN);
                checkPrecision(rounded, precision, scale);
                return Value.decimal(rounded);
            }
            default:
                throw EvalException.typeError("multiplication requires numeric operand, got " + left.typeName());
        }
    }

    private static void checkPrecision(BigDecimal v, int precision, int scale) {
        BigDecimal intPart = v.setScale(0, RoundingMode.DOWN).abs();
        int maxIntDigits = precision - scale;
        if (maxIntDigits <= 0) {
            if (intPart.signum() > 0) throw exceeds(v, precision, scale);
            return;
        }
        if (intPart.compareTo(BigDecimal.TEN.pow(maxIntDigits)) >= 0) throw exceeds(v, precision, scale);
    }

    private static EvalException exceeds(BigDecimal v, int precision, int scale) {
        return EvalException.overflow("result " + v.toPlainString() + " exceeds declared precision(" + precision + ", " + scale + ")");
    }

    private static BigDecimal toDecimal(Value v, TypeSpec target) {
        int scale = target.scale == null ? 0 : target.scale;
        switch (v.type) {
            case DECIMAL:
                return v.asDecimal().setScale(scale, RoundingMode.HALF_EVEN);
            case INT:
                return BigDecimal.valueOf(v.asInt()).setScale(scale, RoundingMode.HALF_EVEN);
            default:
                throw EvalException.typeError("cannot coerce " + v.typeName() + " to Decimal");
        }
    }

    private static boolean compareMoney(Value left, Value right, String op) {
        Value.Money l = left.asMoney();
        Value.Money r = right.asMoney();
        if (!l.currency.equals(r.currency)) {
            throw EvalException.typeError("cannot compare Money with different currencies: " + l.currency + " vs " + r.currency);
        }
        return ordered(l.amount.compareTo(r.amount), op);
    }

    private static boolean compareBools(boolean l, boolean r, String op) {
        switch (op) {
            case "=": return l == r;
            case "!=": return l != r;
            default: throw EvalException.invalidOperator(op);
        }
    }

    private static boolean equality(Value left, Value right, String op) {
        switch (op) {
            case "=": return left.asString().equals(right.asString());
            case "!=": return !left.asString().equals(right.asString());
            default:
                throw EvalException.typeError("operator '" + op + "' not defined for " + left.typeName()
                        + "; " + left.typeName() + " supports only = and !=");
        }
    }

    private static boolean ordered(int cmp, String op) {
        switch (op) {
            case "=": return cmp == 0;
            case "!=": return cmp != 0;
            case "<": return cmp < 0;
            case "<=": return cmp <= 0;
            case ">": return cmp > 0;
            case ">=": return cmp >= 0;
            default: throw EvalException.invalidOperator(op);
        }
    }

    private static boolean isTextOrEnum(Value v) {
        return v.type == Value.Type.TEXT || v.type == Value.Type.ENUM;
    }
}
