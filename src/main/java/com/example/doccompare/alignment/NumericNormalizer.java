package com.example.doccompare.alignment;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Interprets tokens as decimal floating-point literals so that differently formatted numbers
 * ({@code 3.0}, {@code 3.00}, {@code 1_000}, {@code 1e3}) can be recognised as the same value.
 * Decimal digits of any script are accepted.
 */
public final class NumericNormalizer {
    private static final String DIGITS = "\\p{Nd}(?:_?\\p{Nd})*";
    private static final Pattern DECIMAL_LITERAL =
            Pattern.compile(
                    "[+-]?(?:"
                            + DIGITS
                            + "(?:\\.(?:"
                            + DIGITS
                            + ")?)?|\\."
                            + DIGITS
                            + ")(?:[eE][+-]?"
                            + DIGITS
                            + ")?");
    private static final Pattern NON_FINITE = Pattern.compile("([+-]?)(inf|infinity|nan)");

    /** Returns the numeric value of {@code token}, or empty when it is not a decimal literal. */
    public OptionalDouble normalize(String token) {
        if (token == null) {
            return OptionalDouble.empty();
        }
        String candidate = token.strip();
        if (DECIMAL_LITERAL.matcher(candidate).matches()) {
            try {
                return OptionalDouble.of(Double.parseDouble(toAsciiDigits(candidate)));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        var nonFinite = NON_FINITE.matcher(candidate.toLowerCase(Locale.ROOT));
        if (nonFinite.matches()) {
            boolean negative = "-".equals(nonFinite.group(1));
            if ("nan".equals(nonFinite.group(2))) {
                return OptionalDouble.of(Double.NaN);
            }
            return OptionalDouble.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        return OptionalDouble.empty();
    }

    // digits of any script become ASCII, digit group underscores are dropped
    private static String toAsciiDigits(String literal) {
        StringBuilder ascii = new StringBuilder(literal.length());
        literal.codePoints()
                .filter(codePoint -> codePoint != '_')
                .forEach(
                        codePoint -> {
                            if (Character.getType(codePoint) == Character.DECIMAL_DIGIT_NUMBER) {
                                ascii.append((char) ('0' + Character.digit(codePoint, 10)));
                            } else {
                                ascii.appendCodePoint(codePoint);
                            }
                        });
        return ascii.toString();
    }

    /**
     * True when both tokens are numbers of equal value. Tokens without a value never compare equal,
     * and neither does NaN.
     */
    public boolean numericallyEqual(String left, String right) {
        OptionalDouble leftValue = normalize(left);
        if (leftValue.isEmpty()) {
            return false;
        }
        OptionalDouble rightValue = normalize(right);
        return rightValue.isPresent() && leftValue.getAsDouble() == rightValue.getAsDouble();
    }
}
