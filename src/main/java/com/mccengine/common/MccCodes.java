package com.mccengine.common;

import com.mccengine.codes.Code;
import com.mccengine.common.exception.InvalidCodeFormatException;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalization of MCC values.
 *
 * Every public operation that accepts a code takes it as a String, a Number or a
 * {@link Code} and funnels it through this class. Values are stringified, trimmed
 * and left-padded with zeros to four characters; the result is a valid MCC only
 * if it then consists of exactly four digits. A null value stringifies to the
 * empty string and therefore pads to "0000".
 */
public final class MccCodes {

    public static final int CODE_LENGTH = 4;

    private static final Pattern NORMALIZED = Pattern.compile("\\d{4}");

    private MccCodes() {
    }

    /**
     * Normalize a value to its 4-digit form.
     *
     * @param value a String, Number or Code
     * @return the zero-padded 4-digit code
     * @throws InvalidCodeFormatException if the padded value is not four digits
     */
    public static String normalize(Object value) {
        return tryNormalize(value).orElseThrow(() -> new InvalidCodeFormatException(value));
    }

    /**
     * Normalize a value, returning empty instead of failing on malformed input.
     */
    public static Optional<String> tryNormalize(Object value) {
        String padded = pad(value);
        return isNormalized(padded) ? Optional.of(padded) : Optional.empty();
    }

    public static boolean isNormalized(String value) {
        return value != null && NORMALIZED.matcher(value).matches();
    }

    /**
     * Stringify, trim and left-pad with zeros. Does not validate.
     */
    public static String pad(Object value) {
        String text = stringify(value).trim();
        if (text.length() >= CODE_LENGTH) {
            return text;
        }
        return "0".repeat(CODE_LENGTH - text.length()) + text;
    }

    private static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Code) {
            return ((Code) value).getMcc();
        }
        return value.toString();
    }
}
