package com.influxgate.core.codec;

import com.influxgate.core.error.InvalidQueryInputException;

/**
 * Flux string literals: double-quoted, with backslash, double quote and the {@code ${}
 * interpolation opener escaped. Identifiers are written as string keys
 * ({@code r["device_id"]}, {@code bucket: "iot"}), so both operations share one form.
 */
public final class FluxValueCodec implements ValueCodec {

    public static final FluxValueCodec INSTANCE = new FluxValueCodec();

    private FluxValueCodec() {}

    @Override
    public String quoteIdentifier(String name) {
        ValueCodec.requireEncodable(name, "identifier");
        if (name.isEmpty()) {
            throw new InvalidQueryInputException("identifier cannot be empty");
        }
        return quote(name);
    }

    @Override
    public String quoteLiteral(String value) {
        return quote(ValueCodec.requireEncodable(value, "value"));
    }

    private static String quote(String s) {
        StringBuilder out = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '$' -> {
                    if (i + 1 < s.length() && s.charAt(i + 1) == '{') {
                        out.append("\\$");
                    } else {
                        out.append('$');
                    }
                }
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }
}
