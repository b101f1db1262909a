package com.tenor.elaborate.parser;

import java.math.BigDecimal;

/** Literal values: defaults, comparison operands and payload values. */
public final class RawLiteral {

    public enum Kind { BOOL, INT, FLOAT, STR, MONEY }

    public final Kind kind;
    public final boolean boolValue;
    public final long intValue;
    /** FLOAT value, or the MONEY amount. */
    public final BigDecimal decimalValue;
    /** STR value, or the MONEY currency. */
    public final String text;

    private RawLiteral(Kind kind, boolean boolValue, long intValue, BigDecimal decimalValue, String text) {
        this.kind = kind;
        this.boolValue = boolValue;
        this.intValue = intValue;
        this.decimalValue = decimalValue;
        this.text = text;
    }

    public static RawLiteral ofBool(boolean b) { return new RawLiteral(Kind.BOOL, b, 0, null, null); }
    public static RawLiteral ofInt(long i) { return new RawLiteral(Kind.INT, false, i, null, null); }
    public static RawLiteral ofFloat(BigDecimal d) { return new RawLiteral(Kind.FLOAT, false, 0, d, null); }
    public static RawLiteral ofString(String s) { return new RawLiteral(Kind.STR, false, 0, null, s); }

    public static RawLiteral ofMoney(BigDecimal amount, String currency) {
        return new RawLiteral(Kind.MONEY, false, 0, amount, currency);
    }

    @Override
    public String toString() {
        switch (kind) {
            case BOOL: return String.valueOf(boolValue);
            case INT: return String.valueOf(intValue);
            case FLOAT: return decimalValue.toPlainString();
            case STR: return '"' + text + '"';
            default: return "Money { amount: \"" + decimalValue.toPlainString() + "\", currency: \"" + text + "\" }";
        }
    }
}
