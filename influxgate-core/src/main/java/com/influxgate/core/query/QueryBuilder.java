package com.influxgate.core.query;

import com.influxgate.core.error.InvalidQueryInputException;
import com.influxgate.core.model.QueryModel;
import com.influxgate.core.time.TimeWindows;
import com.influxgate.core.time.TimeWindows.ResolvedRange;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Renders query models into one dialect's text. Builders never execute anything and never see
 * credentials.
 */
public interface QueryBuilder {

    BuiltQuery buildListContainers();

    /** Retention policies of one database, or {@code null} when the dialect has none. */
    BuiltQuery buildListRetentionPolicies(String database);

    BuiltQuery buildListMeasurements(String target);

    BuiltQuery buildListFields(String target, String measurement);

    /** Tag keys of a measurement. */
    BuiltQuery buildListTags(String target, String measurement);

    BuiltQuery buildListTagValues(String target, String measurement, String tagKey, int maxValues);

    BuiltQuery buildSeriesQuery(QueryModel model);

    /** Single most recent row, newest first, filtered by field and tags when given. */
    BuiltQuery buildLastPoint(QueryModel model);

    /**
     * Resolves the model's bounds against {@code clock}. Windowed queries widen the range to
     * whole epoch-aligned windows: start floored, stop ceiled.
     */
    static ResolvedRange effectiveRange(QueryModel model, Clock clock) {
        Instant now = clock.instant();
        Instant start;
        Instant stop;
        try {
            start = model.start().resolve(now);
            stop = model.stop().resolve(now);
        } catch (ArithmeticException | DateTimeException e) {
            throw new InvalidQueryInputException("Time range is out of bounds: " + e.getMessage());
        }
        if (!stop.isAfter(start)) {
            throw new InvalidQueryInputException("stop must be after start");
        }
        if (model.windowed()) {
            return TimeWindows.align(start, stop, model.every().duration());
        }
        return new ResolvedRange(start, stop);
    }

    static String requireField(QueryModel model) {
        if (model.field() == null) {
            throw new InvalidQueryInputException("field is required for time-series queries");
        }
        return model.field();
    }
}
