package com.influxgate.core.model;

import com.influxgate.core.error.InvalidQueryInputException;

/**
 * A container reference. {@code telegraf/autogen} names database {@code telegraf} with
 * retention policy {@code autogen}; a plain name leaves the retention policy to the backend.
 */
public record Target(String container, String retentionPolicy) {

    public static Target parse(String target) {
        if (target == null || target.isBlank()) {
            throw new InvalidQueryInputException("target is required");
        }
        int slash = target.indexOf('/');
        if (slash < 0) {
            return new Target(target, null);
        }
        String db = target.substring(0, slash);
        String rp = target.substring(slash + 1);
        if (db.isEmpty()) {
            throw new InvalidQueryInputException("Invalid target: " + target);
        }
        return new Target(db, rp.isEmpty() ? null : rp);
    }
}
