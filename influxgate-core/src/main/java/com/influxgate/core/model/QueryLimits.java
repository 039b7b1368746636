package com.influxgate.core.model;

/**
 * Row limits shared by every request: the hard ceiling no result may exceed and the limit used
 * when a request names none.
 */
public record QueryLimits(int rowCeiling, int defaultLimit) {

    public static final QueryLimits DEFAULTS = new QueryLimits(10_000, 1_000);

    public QueryLimits {
        if (rowCeiling <= 0) {
            throw new IllegalArgumentException("rowCeiling must be positive");
        }
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be positive");
        }
        defaultLimit = Math.min(defaultLimit, rowCeiling);
    }

    /** The requested limit (or the default) clamped to the ceiling. */
    public int effective(Integer requested) {
        int wanted = requested != null ? requested : defaultLimit;
        return Math.max(1, Math.min(wanted, rowCeiling));
    }
}
