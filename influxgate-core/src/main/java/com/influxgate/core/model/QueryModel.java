package com.influxgate.core.model;

import com.influxgate.core.error.InvalidQueryInputException;
import com.influxgate.core.time.DurationLiteral;
import com.influxgate.core.time.TimeExpression;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Version-agnostic description of a series or last-point request. Validated on construction
 * and immutable afterwards; builders and parsers only read it.
 *
 * Example:
 *   target=iot-devices measurement=device_status field=rssi
 *   start=-3d stop=now every=1h aggregate=max tags={device_id=xyz-789}
 */
public record QueryModel(
        String target,
        String measurement, // required for series and last point
        String field, // optional
        Map<String, String> tags,
        TimeExpression start,
        TimeExpression stop,
        DurationLiteral every, // optional, implies aggregate
        Aggregate aggregate, // optional, implies every
        Fill fill,
        Integer limit) { // optional, clamped by QueryLimits

    public static final TimeExpression DEFAULT_START = TimeExpression.parse("-1h");

    public QueryModel {
        if (target == null || target.isBlank()) {
            throw new InvalidQueryInputException("target is required");
        }
        if (measurement != null && measurement.isBlank()) {
            measurement = null;
        }
        if (field != null && field.isBlank()) {
            field = null;
        }
        tags = copyTags(tags);
        if (start == null) start = DEFAULT_START;
        if (stop == null) stop = TimeExpression.NOW;
        if (fill == null) fill = Fill.NONE;
        if (every != null && aggregate == null) {
            throw new InvalidQueryInputException("'every' requires an aggregate function");
        }
        if (aggregate != null && every == null) {
            throw new InvalidQueryInputException("aggregate '" + aggregate.functionName() + "' requires 'every'");
        }
        if (every != null && (every.negative() || every.duration().isZero())) {
            throw new InvalidQueryInputException("'every' must be a positive duration");
        }
        if (limit != null && limit <= 0) {
            throw new InvalidQueryInputException("limit must be greater than zero");
        }
        if (start instanceof TimeExpression.Absolute s
                && stop instanceof TimeExpression.Absolute e
                && !e.instant().isAfter(s.instant())) {
            throw new InvalidQueryInputException("stop must be after start");
        }
    }

    public boolean windowed() {
        return every != null;
    }

    public Target parsedTarget() {
        return Target.parse(target);
    }

    /** Measurement, or an {@link InvalidQueryInputException} when absent. */
    public String requireMeasurement() {
        if (measurement == null) {
            throw new InvalidQueryInputException("measurement is required");
        }
        return measurement;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, String> copyTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : tags.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new InvalidQueryInputException("tag key cannot be empty");
            }
            if (e.getValue() == null) {
                throw new InvalidQueryInputException("tag '" + e.getKey() + "' has no value");
            }
            copy.put(e.getKey(), e.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    /** String-typed builder used by the URI parser and the tool surface. */
    public static final class Builder {
        private String target;
        private String measurement;
        private String field;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private TimeExpression start;
        private TimeExpression stop;
        private TimeExpression defaultStart = DEFAULT_START;
        private DurationLiteral every;
        private Aggregate aggregate;
        private Fill fill;
        private Integer limit;

        private Builder() {}

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder measurement(String measurement) {
            this.measurement = measurement;
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        /** Adds or replaces one tag filter; a repeated key keeps the last value. */
        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            if (tags != null) {
                tags.forEach(this::tag);
            }
            return this;
        }

        public Builder start(String start) {
            this.start = start == null || start.isBlank() ? null : TimeExpression.parse(start);
            return this;
        }

        public Builder stop(String stop) {
            this.stop = stop == null || stop.isBlank() ? null : TimeExpression.parse(stop);
            return this;
        }

        /** Lookback applied when no start is given. */
        public Builder defaultStart(String defaultStart) {
            this.defaultStart = TimeExpression.parse(defaultStart);
            return this;
        }

        public Builder every(String every) {
            this.every = every == null || every.isBlank() ? null : DurationLiteral.parsePositive(every);
            return this;
        }

        public Builder aggregate(String aggregate) {
            this.aggregate = aggregate == null || aggregate.isBlank() ? null : Aggregate.fromName(aggregate);
            return this;
        }

        public Builder aggregate(Aggregate aggregate) {
            this.aggregate = aggregate;
            return this;
        }

        public Builder fill(String fill) {
            this.fill = Fill.fromName(fill);
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public QueryModel build() {
            return new QueryModel(
                    target,
                    measurement,
                    field,
                    tags,
                    start != null ? start : defaultStart,
                    stop,
                    every,
                    aggregate,
                    fill,
                    limit);
        }
    }
}
