package com.influxgate.core.codec;

import com.influxgate.core.error.InvalidQueryInputException;

/**
 * Quotes identifiers and literal values for one dialect. Every user-supplied name or value
 * interpolated into a query goes through a codec; neither dialect has bind parameters.
 */
public interface ValueCodec {

    /** Renders {@code name} so the dialect reads it as a column, tag, measurement or bucket name. */
    String quoteIdentifier(String name);

    /** Renders {@code value} so the dialect reads it as a string literal and never as syntax. */
    String quoteLiteral(String value);

    /** Rejects input that no quoting form can carry. */
    static String requireEncodable(String input, String what) {
        if (input == null) {
            throw new InvalidQueryInputException(what + " cannot be null");
        }
        for (int i = 0; i < input.length(); i++) {
            if (Character.isISOControl(input.charAt(i))) {
                throw new InvalidQueryInputException(
                        what + " contains a control character at position " + i);
            }
        }
        return input;
    }
}
