package com.influxgate.core.engine;

import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.model.QueryLimits;
import com.influxgate.core.normalize.FluxResultNormalizer;
import com.influxgate.core.normalize.InfluxQlResultNormalizer;
import com.influxgate.core.normalize.ResultNormalizer;
import com.influxgate.core.query.FluxQueryBuilder;
import com.influxgate.core.query.InfluxQlQueryBuilder;
import com.influxgate.core.query.QueryBuilder;
import java.time.Clock;

/** The builder and normalizer pair serving one dialect. */
record DialectSupport(QueryBuilder builder, ResultNormalizer normalizer) {

    static DialectSupport flux(Clock clock, QueryLimits limits) {
        return new DialectSupport(new FluxQueryBuilder(clock, limits), FluxResultNormalizer.INSTANCE);
    }

    static DialectSupport influxQl(Clock clock, QueryLimits limits) {
        return new DialectSupport(new InfluxQlQueryBuilder(clock, limits), new InfluxQlResultNormalizer());
    }

    static DialectSupport forDialect(Dialect dialect, DialectSupport flux, DialectSupport influxQl) {
        return switch (dialect) {
            case FLUX -> flux;
            case INFLUXQL -> influxQl;
        };
    }
}
