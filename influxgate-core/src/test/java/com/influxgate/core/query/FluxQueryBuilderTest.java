package com.influxgate.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.error.InvalidQueryInputException;
import com.influxgate.core.model.QueryLimits;
import com.influxgate.core.model.QueryModel;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class FluxQueryBuilderTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:07:00Z");

    private final FluxQueryBuilder builder =
            new FluxQueryBuilder(Clock.fixed(NOW, ZoneOffset.UTC), QueryLimits.DEFAULTS);

    @Test
    void buildsWindowedPipeline() {
        QueryModel model = QueryModel.builder()
                .target("iot-bucket")
                .measurement("temp")
                .field("value")
                .tag("device", "abc")
                .start("-1h")
                .every("5m")
                .aggregate("mean")
                .build();

        BuiltQuery q = builder.buildSeriesQuery(model);

        assertThat(q.dialect()).isEqualTo(Dialect.FLUX);
        assertThat(q.text()).isEqualTo("from(bucket: \"iot-bucket\")\n"
                + "  |> range(start: -1h, stop: now())\n"
                + "  |> filter(fn: (r) => r[\"_measurement\"] == \"temp\")\n"
                + "  |> filter(fn: (r) => r[\"_field\"] == \"value\")\n"
                + "  |> filter(fn: (r) => r[\"device\"] == \"abc\")\n"
                + "  |> aggregateWindow(every: 5m, fn: mean, createEmpty: false)\n"
                + "  |> limit(n: 1000)\n"
                + "  |> yield(name: \"results\")");
        assertThat(q.every()).isEqualTo("5m");
        assertThat(q.limit()).isEqualTo(1000);
    }

    @Test
    void windowedBoundsAreEpochAligned() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("temp")
                .field("value")
                .start("-3h")
                .every("1h")
                .aggregate("max")
                .build();

        BuiltQuery q = builder.buildSeriesQuery(model);

        assertThat(q.effectiveStart()).isEqualTo(Instant.parse("2024-03-10T09:00:00Z"));
        assertThat(q.effectiveStop()).isEqualTo(Instant.parse("2024-03-10T13:00:00Z"));
    }

    @Test
    void rawBoundsAreResolvedUnaligned() {
        QueryModel model = QueryModel.builder().target("iot").measurement("temp").field("value").start("-3h").build();

        BuiltQuery q = builder.buildSeriesQuery(model);

        assertThat(q.effectiveStart()).isEqualTo(Instant.parse("2024-03-10T09:07:00Z"));
        assertThat(q.effectiveStop()).isEqualTo(NOW);
        assertThat(q.text()).doesNotContain("aggregateWindow");
    }

    @Test
    void absoluteTimesRenderAsTimeLiterals() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("temp")
                .field("value")
                .start("2024-01-01T00:00:00Z")
                .stop("2024-01-02T00:00:00Z")
                .build();

        assertThat(builder.buildSeriesQuery(model).text())
                .contains("range(start: 2024-01-01T00:00:00Z, stop: 2024-01-02T00:00:00Z)");
    }

    @Test
    void fillModesAddTheirStage() {
        QueryModel.Builder base = QueryModel.builder()
                .target("iot")
                .measurement("temp")
                .field("value")
                .every("1m")
                .aggregate("mean");

        assertThat(builder.buildSeriesQuery(base.fill("previous").build()).text())
                .contains("createEmpty: true")
                .contains("|> fill(usePrevious: true)");
        assertThat(builder.buildSeriesQuery(base.fill("linear").build()).text())
                .startsWith("import \"interpolate\"")
                .contains("|> interpolate.linear(every: 1m)");
    }

    @Test
    void limitIsClampedToCeiling() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("temp")
                .field("value")
                .limit(50_000)
                .build();

        BuiltQuery q = builder.buildSeriesQuery(model);

        assertThat(q.limit()).isEqualTo(10_000);
        assertThat(q.text()).contains("|> limit(n: 10000)");
    }

    @Test
    void hostileTagValueIsEscaped() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("temp")
                .field("value")
                .tag("device", "x\") |> drop(columns: [\"_value\"]) //")
                .build();

        assertThat(builder.buildSeriesQuery(model).text())
                .contains("r[\"device\"] == \"x\\\") |> drop(columns: [\\\"_value\\\"]) //\")");
    }

    @Test
    void seriesRequiresMeasurementAndField() {
        assertThatThrownBy(() -> builder.buildSeriesQuery(QueryModel.builder().target("iot").field("v").build()))
                .isInstanceOf(InvalidQueryInputException.class);
        assertThatThrownBy(() -> builder.buildSeriesQuery(QueryModel.builder().target("iot").measurement("m").build()))
                .isInstanceOf(InvalidQueryInputException.class)
                .hasMessageContaining("field");
    }

    @Test
    void relativeStopBeforeStartIsRejected() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("temp")
                .field("value")
                .start("-1h")
                .stop("-2h")
                .build();

        assertThatThrownBy(() -> builder.buildSeriesQuery(model)).isInstanceOf(InvalidQueryInputException.class);
    }

    @Test
    void lastPointTakesNewestRowOfAnyTable() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("device_status")
                .field("battery")
                .tag("device_id", "abc-123")
                .build();

        String flux = builder.buildLastPoint(model).text();

        assertThat(flux).contains("range(start: -365d)")
                .contains("r[\"_field\"] == \"battery\"")
                .contains("r[\"device_id\"] == \"abc-123\"")
                .endsWith("  |> last()\n  |> group()\n  |> sort(columns: [\"_time\"], desc: true)\n  |> limit(n: 1)");
    }

    @Test
    void schemaQueriesUseTheSchemaPackage() {
        assertThat(builder.buildListContainers().text()).isEqualTo("buckets()");
        assertThat(builder.buildListMeasurements("iot").text())
                .isEqualTo("import \"influxdata/influxdb/schema\"\n\nschema.measurements(bucket: \"iot\")");
        assertThat(builder.buildListFields("iot", "temp").text()).contains("schema.measurementFieldKeys(");
        assertThat(builder.buildListTagValues("iot", "temp", "device", 100).text())
                .contains("tag: \"device\"")
                .endsWith("|> limit(n: 100)");
        assertThat(builder.buildListRetentionPolicies("iot")).isNull();
    }

    @Test
    void windowsBeyondTheRepresentableRangeAreInputErrors() {
        QueryModel farFuture = QueryModel.builder()
                .target("iot")
                .measurement("temp")
                .field("value")
                .start("9000-01-01T00:00:00Z")
                .stop("9000-01-02T00:00:00Z")
                .every("1h")
                .aggregate("max")
                .build();

        assertThatThrownBy(() -> builder.buildSeriesQuery(farFuture)).isInstanceOf(InvalidQueryInputException.class);
        assertThatThrownBy(() -> builder.buildSeriesQuery(QueryModel.builder()
                        .target("iot")
                        .measurement("temp")
                        .field("value")
                        .every("20000w")
                        .aggregate("max")
                        .build()))
                .isInstanceOf(InvalidQueryInputException.class);
    }
}
