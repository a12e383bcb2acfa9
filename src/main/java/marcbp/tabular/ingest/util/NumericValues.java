package marcbp.tabular.ingest.util;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Lenient numeric coercion for raw cell text.
 *
 * <p>Accepts plain decimals with an optional sign, fraction and exponent ({@code -1.5e3}, {@code .5},
 * {@code 7.}) and hexadecimal integers ({@code 0x1F}). Surrounding whitespace is ignored. Anything else,
 * including the empty string, {@code NaN} and {@code Infinity}, is not a number. Failures never throw.
 */
public final class NumericValues {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");

    private NumericValues() {}

    public static OptionalDouble parse(String value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
        }
        if (HEX.matcher(trimmed).matches()) {
            try {
                return OptionalDouble.of(Long.parseLong(trimmed.substring(2), 16));
            }
            catch (NumberFormatException e) {
                // wider than a long
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public static boolean isNumeric(String value) {
        return parse(value).isPresent();
    }

    /**
     * Numeric view of an already-typed cell: numbers pass through, text is parsed.
     */
    public static OptionalDouble parseCell(Object value) {
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        if (value instanceof String text) {
            return parse(text);
        }
        return OptionalDouble.empty();
    }
}
