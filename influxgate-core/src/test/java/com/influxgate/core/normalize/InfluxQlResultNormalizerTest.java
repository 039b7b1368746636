package com.influxgate.core.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.error.BackendQueryException;
import com.influxgate.core.model.Aggregate;
import com.influxgate.core.query.BuiltQuery;
import com.influxgate.core.result.ContainerInfo;
import com.influxgate.core.result.ContainerKind;
import com.influxgate.core.result.FieldListing.FieldInfo;
import com.influxgate.core.result.LastPoint;
import com.influxgate.core.result.Series;
import com.influxgate.core.result.SeriesPoint;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InfluxQlResultNormalizerTest {

    private final ResultNormalizer normalizer = new InfluxQlResultNormalizer();

    @Test
    void seriesFindsTheAggregateColumnByName() {
        String json = """
                {"results":[{"statement_id":0,"series":[{"name":"device_status",
                  "columns":["time","max"],
                  "values":[["2024-03-10T10:00:00Z",-61.5],["2024-03-10T11:00:00Z",null],["2024-03-10T12:00:00Z",-58]]}]}]}
                """;

        Series series = normalizer.normalizeSeries(json, query(Aggregate.MAX, 100));

        assertThat(series.series()).containsExactly(
                new SeriesPoint("2024-03-10T10:00:00Z", -61.5),
                new SeriesPoint("2024-03-10T12:00:00Z", -58L));
        assertThat(series.stats().pointsReturned()).isEqualTo(2);
        assertThat(series.stats().aggregateFunction()).isEqualTo("max");
        assertThat(series.stats().truncated()).isFalse();
    }

    @Test
    void columnOrderIsNotAssumed() {
        String json = """
                {"results":[{"statement_id":0,"series":[{"name":"cpu",
                  "columns":["usage","time"],
                  "values":[[12.5,"2024-03-10T10:00:00Z"]]}]}]}
                """;

        Series series = normalizer.normalizeSeries(json, query(null, 100));

        assertThat(series.series()).containsExactly(new SeriesPoint("2024-03-10T10:00:00Z", 12.5));
    }

    @Test
    void epochNanosecondTimesAreNormalized() {
        String json = """
                {"results":[{"statement_id":0,"series":[{"name":"cpu","columns":["time","usage"],
                  "values":[[1704067200000000000,1]]}]}]}
                """;

        Series series = normalizer.normalizeSeries(json, query(null, 100));

        assertThat(series.series()).containsExactly(new SeriesPoint("2024-01-01T00:00:00Z", 1L));
    }

    @Test
    void truncatesAcrossSeries() {
        String json = """
                {"results":[{"statement_id":0,"series":[
                  {"name":"cpu","tags":{"host":"a"},"columns":["time","usage"],"values":[["2024-01-01T00:00:00Z",1],["2024-01-01T00:00:01Z",2]]},
                  {"name":"cpu","tags":{"host":"b"},"columns":["time","usage"],"values":[["2024-01-01T00:00:00Z",3]]}]}]}
                """;

        Series series = normalizer.normalizeSeries(json, query(null, 2));

        assertThat(series.series()).extracting(SeriesPoint::value).containsExactly(1L, 2L);
        assertThat(series.stats().truncated()).isTrue();
    }

    @Test
    void statementErrorBecomesBackendQueryException() {
        String json = "{\"results\":[{\"statement_id\":0,\"error\":\"database not found: nope\"}]}";

        assertThatThrownBy(() -> normalizer.normalizeSeries(json, query(null, 10)))
                .isInstanceOf(BackendQueryException.class)
                .hasMessageContaining("database not found: nope");
    }

    @Test
    void rootErrorBecomesBackendQueryException() {
        assertThatThrownBy(() -> normalizer.normalizeMeasurements("{\"error\":\"error parsing query\"}"))
                .isInstanceOf(BackendQueryException.class)
                .hasMessageContaining("error parsing query");
    }

    @Test
    void malformedJsonIsBackendQueryException() {
        assertThatThrownBy(() -> normalizer.normalizeMeasurements("<html>"))
                .isInstanceOf(BackendQueryException.class);
    }

    @Test
    void emptyStatementYieldsEmptySeries() {
        Series series = normalizer.normalizeSeries("{\"results\":[{\"statement_id\":0}]}", query(null, 10));

        assertThat(series.series()).isEmpty();
        assertThat(series.stats().pointsReturned()).isZero();
    }

    @Test
    void lastPointMergesSeriesTagsAndPicksNewest() {
        String json = """
                {"results":[{"statement_id":0,"series":[
                  {"name":"device_status","tags":{"device_id":"abc-123"},"columns":["time","battery"],
                   "values":[["2024-03-10T10:00:00Z",87]]},
                  {"name":"device_status","tags":{"device_id":"def-456"},"columns":["time","battery"],
                   "values":[["2024-03-10T11:00:00Z",42.5]]}]}]}
                """;

        LastPoint last = normalizer.normalizeLastPoint(json, lastQuery("battery"));

        assertThat(last.time()).isEqualTo("2024-03-10T11:00:00Z");
        assertThat(last.value()).isEqualTo(42.5);
        assertThat(last.field()).isEqualTo("battery");
        assertThat(last.tags()).containsExactly(Map.entry("device_id", "def-456"));
    }

    @Test
    void lastPointWithoutFieldTakesFirstNonNullColumnByName() {
        String json = """
                {"results":[{"statement_id":0,"series":[
                  {"name":"device_status","columns":["time","voltage","battery","rssi"],
                   "values":[["2024-03-10T10:00:00Z",3.3,null,-70]]}]}]}
                """;

        LastPoint last = normalizer.normalizeLastPoint(json, lastQuery(null));

        assertThat(last.field()).isEqualTo("rssi");
        assertThat(last.value()).isEqualTo(-70L);
    }

    @Test
    void lastPointWithoutRowsIsNoData() {
        assertThatThrownBy(() -> normalizer.normalizeLastPoint("{\"results\":[{\"statement_id\":0}]}", lastQuery("x")))
                .isInstanceOf(BackendQueryException.class)
                .hasMessageContaining("No data found");
    }

    @Test
    void retentionPoliciesExpandDatabase() {
        String json = """
                {"results":[{"statement_id":0,"series":[{"columns":["name","duration","shardGroupDuration","replicaN","default"],
                  "values":[["autogen","0s","168h0m0s",1,true],["one_week","168h0m0s","24h0m0s",1,false]]}]}]}
                """;

        assertThat(normalizer.normalizeRetentionPolicies("telegraf", json)).containsExactly(
                new ContainerInfo("telegraf/autogen", ContainerKind.DATABASE, "0s/1"),
                new ContainerInfo("telegraf/one_week", ContainerKind.DATABASE, "168h0m0s/1"));
        assertThat(normalizer.normalizeRetentionPolicies("empty", "{\"results\":[{\"statement_id\":0}]}"))
                .containsExactly(new ContainerInfo("empty", ContainerKind.DATABASE, null));
    }

    @Test
    void schemaListings() {
        String databases = """
                {"results":[{"statement_id":0,"series":[{"name":"databases","columns":["name"],"values":[["_internal"],["telegraf"]]}]}]}
                """;
        String fields = """
                {"results":[{"statement_id":0,"series":[{"name":"cpu","columns":["fieldKey","fieldType"],
                  "values":[["usage_idle","float"],["usage_user","float"]]}]}]}
                """;
        String tagValues = """
                {"results":[{"statement_id":0,"series":[{"name":"cpu","columns":["key","value"],
                  "values":[["host","a"],["host","b"]]}]}]}
                """;

        assertThat(normalizer.normalizeContainers(databases)).extracting(ContainerInfo::name)
                .containsExactly("_internal", "telegraf");
        assertThat(normalizer.normalizeFields(fields)).containsExactly(
                new FieldInfo("usage_idle", "float"), new FieldInfo("usage_user", "float"));
        assertThat(normalizer.normalizeTagValues(tagValues)).containsExactly("a", "b");
    }

    @Test
    void listingsAreCappedToTheQueryLimit() {
        StringBuilder values = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            values.append(i == 0 ? "" : ",").append("[\"m").append(i).append("\"]");
        }
        String measurements = "{\"results\":[{\"statement_id\":0,\"series\":[{\"name\":\"measurements\","
                + "\"columns\":[\"name\"],\"values\":[" + values + "]}]}]}";

        assertThat(normalizer.normalizeMeasurements(measurements, BuiltQuery.schema(Dialect.INFLUXQL, "", "iot", 5)))
                .containsExactly("m0", "m1", "m2", "m3", "m4");
    }

    private static BuiltQuery query(Aggregate aggregate, int limit) {
        return new BuiltQuery(
                Dialect.INFLUXQL,
                "",
                "iot",
                null,
                "usage",
                Instant.parse("2024-03-10T09:00:00Z"),
                Instant.parse("2024-03-10T13:00:00Z"),
                aggregate,
                aggregate == null ? null : "1h",
                limit);
    }

    private static BuiltQuery lastQuery(String field) {
        return new BuiltQuery(Dialect.INFLUXQL, "", "iot", null, field, null, Instant.EPOCH, null, null, 1);
    }
}
