package com.influxgate.core.codec;

import com.influxgate.core.error.InvalidQueryInputException;

/**
 * InfluxQL quoting: identifiers in double quotes, string literals in single quotes, backslash
 * and the active quote character escaped with a backslash.
 */
public final class InfluxQlValueCodec implements ValueCodec {

    public static final InfluxQlValueCodec INSTANCE = new InfluxQlValueCodec();

    private InfluxQlValueCodec() {}

    @Override
    public String quoteIdentifier(String name) {
        ValueCodec.requireEncodable(name, "identifier");
        if (name.isEmpty()) {
            throw new InvalidQueryInputException("identifier cannot be empty");
        }
        return quote(name, '"');
    }

    @Override
    public String quoteLiteral(String value) {
        return quote(ValueCodec.requireEncodable(value, "value"), '\'');
    }

    private static String quote(String s, char delimiter) {
        StringBuilder out = new StringBuilder(s.length() + 2).append(delimiter);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == delimiter) {
                out.append('\\');
            }
            out.append(c);
        }
        return out.append(delimiter).toString();
    }
}
