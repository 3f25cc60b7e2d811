package com.grim.script.parser;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/** Turns one line of user input into the first variant it parses as: Integer, Float, Boolean, String. */
public final class InputValueParser {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile(
            "[+-]?(\\d+\\.?\\d*([eE][+-]?\\d+)?|\\.\\d+([eE][+-]?\\d+)?|inf|infinity|nan)",
            Pattern.CASE_INSENSITIVE);

    private InputValueParser() {}

    public static Value parse(String line) {
        String text = line.strip();

        if (INTEGER.matcher(text).matches()) {
            BigInteger big = new BigInteger(text);
            // out of 64-bit range falls through to Float
            if (big.bitLength() < 64) return Value.integer(big.longValue());
        }

        if (FLOAT.matcher(text).matches()) {
            return Value.floating(parseFloat(text));
        }

        if ("true".equals(text)) return Value.bool(true);
        if ("false".equals(text)) return Value.bool(false);

        return Value.string(text);
    }

    private static double parseFloat(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        boolean negative = lower.startsWith("-");
        String unsigned = (lower.startsWith("-") || lower.startsWith("+")) ? lower.substring(1) : lower;
        switch (unsigned) {
            case "inf":
            case "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                return Double.parseDouble(text);
        }
    }
}
