package com.influxgate.core.normalize;

import com.influxgate.core.query.BuiltQuery;
import com.influxgate.core.result.ContainerInfo;
import com.influxgate.core.result.FieldListing.FieldInfo;
import com.influxgate.core.result.LastPoint;
import com.influxgate.core.result.Series;
import java.util.List;

/**
 * Turns one dialect's raw response body into the dialect-independent result records. Every
 * method throws {@link com.influxgate.core.error.BackendQueryException} when the body carries a
 * backend error or cannot be parsed.
 */
public interface ResultNormalizer {

    List<ContainerInfo> normalizeContainers(String raw);

    /**
     * One entry per retention policy of {@code database}, named {@code db/rp}, or the bare
     * database when it reports none.
     */
    List<ContainerInfo> normalizeRetentionPolicies(String database, String raw);

    List<String> normalizeMeasurements(String raw);

    List<FieldInfo> normalizeFields(String raw);

    /** Tag keys, without the reserved {@code _}-prefixed columns. */
    List<String> normalizeTagKeys(String raw);

    List<String> normalizeTagValues(String raw);

    /** Points in backend order with null values dropped, truncated to {@link BuiltQuery#limit()}. */
    Series normalizeSeries(String raw, BuiltQuery query);

    LastPoint normalizeLastPoint(String raw, BuiltQuery query);

    default List<ContainerInfo> normalizeContainers(String raw, BuiltQuery query) {
        return capped(normalizeContainers(raw), query);
    }

    default List<String> normalizeMeasurements(String raw, BuiltQuery query) {
        return capped(normalizeMeasurements(raw), query);
    }

    default List<FieldInfo> normalizeFields(String raw, BuiltQuery query) {
        return capped(normalizeFields(raw), query);
    }

    default List<String> normalizeTagKeys(String raw, BuiltQuery query) {
        return capped(normalizeTagKeys(raw), query);
    }

    default List<String> normalizeTagValues(String raw, BuiltQuery query) {
        return capped(normalizeTagValues(raw), query);
    }

    /** The first {@link BuiltQuery#limit()} entries of a listing; listing queries carry the row ceiling. */
    static <T> List<T> capped(List<T> listing, BuiltQuery query) {
        if (query == null || listing.size() <= query.limit()) {
            return listing;
        }
        return List.copyOf(listing.subList(0, query.limit()));
    }
}
