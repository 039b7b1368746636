package com.influxgate.core.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.model.QueryLimits;
import com.influxgate.core.model.QueryModel;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class InfluxQlQueryBuilderTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final InfluxQlQueryBuilder builder =
            new InfluxQlQueryBuilder(Clock.fixed(NOW, ZoneOffset.UTC), QueryLimits.DEFAULTS);

    @Test
    void buildsWindowedSelect() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("device_status")
                .field("rssi")
                .tag("device_id", "xyz-789")
                .start("-3d")
                .every("1h")
                .aggregate("max")
                .build();

        BuiltQuery q = builder.buildSeriesQuery(model);

        assertThat(q.dialect()).isEqualTo(Dialect.INFLUXQL);
        assertThat(q.database()).isEqualTo("iot");
        assertThat(q.retentionPolicy()).isNull();
        assertThat(q.text()).isEqualTo("SELECT max(\"rssi\") FROM \"device_status\""
                + " WHERE time >= now() - 3d AND time <= now() AND \"device_id\" = 'xyz-789'"
                + " GROUP BY time(1h) fill(none) LIMIT 1000");
    }

    @Test
    void retentionPolicyQualifiesTheMeasurement() {
        QueryModel model = QueryModel.builder()
                .target("telegraf/autogen")
                .measurement("cpu")
                .field("usage_idle")
                .build();

        BuiltQuery q = builder.buildSeriesQuery(model);

        assertThat(q.database()).isEqualTo("telegraf");
        assertThat(q.retentionPolicy()).isEqualTo("autogen");
        assertThat(q.text()).startsWith("SELECT \"usage_idle\" FROM \"autogen\".\"cpu\" WHERE time >= now() - 1h");
    }

    @Test
    void absoluteTimesAreQuotedLiterals() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("cpu")
                .field("v")
                .start("2024-01-01T00:00:00Z")
                .stop("2024-01-02T00:00:00Z")
                .build();

        assertThat(builder.buildSeriesQuery(model).text())
                .contains("WHERE time >= '2024-01-01T00:00:00Z' AND time <= '2024-01-02T00:00:00Z'");
    }

    @Test
    void lastPointOrdersNewestFirst() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("device_status")
                .field("battery")
                .tag("device_id", "abc-123")
                .build();

        BuiltQuery q = builder.buildLastPoint(model);

        assertThat(q.text()).isEqualTo("SELECT \"battery\" FROM \"device_status\""
                + " WHERE \"device_id\" = 'abc-123' GROUP BY * ORDER BY time DESC LIMIT 1");
        assertThat(q.limit()).isEqualTo(1);
    }

    @Test
    void lastPointWithoutFieldSelectsEverything() {
        QueryModel model = QueryModel.builder().target("iot").measurement("device_status").build();

        assertThat(builder.buildLastPoint(model).text())
                .isEqualTo("SELECT * FROM \"device_status\" GROUP BY * ORDER BY time DESC LIMIT 1");
    }

    @Test
    void hostileTagValueCannotEscapeTheLiteral() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .measurement("cpu")
                .field("v")
                .tag("host", "a' OR '1'='1")
                .build();

        assertThat(builder.buildSeriesQuery(model).text()).contains("\"host\" = 'a\\' OR \\'1\\'=\\'1'");
    }

    @Test
    void schemaStatements() {
        assertThat(builder.buildListContainers().text()).isEqualTo("SHOW DATABASES");
        assertThat(builder.buildListRetentionPolicies("telegraf").text())
                .isEqualTo("SHOW RETENTION POLICIES ON \"telegraf\"");
        BuiltQuery measurements = builder.buildListMeasurements("telegraf/autogen");
        assertThat(measurements.text()).isEqualTo("SHOW MEASUREMENTS");
        assertThat(measurements.database()).isEqualTo("telegraf");
        assertThat(builder.buildListFields("telegraf", "cpu").text()).isEqualTo("SHOW FIELD KEYS FROM \"cpu\"");
        assertThat(builder.buildListTags("telegraf", "cpu").text()).isEqualTo("SHOW TAG KEYS FROM \"cpu\"");
        assertThat(builder.buildListTagValues("telegraf", "cpu", "host", 100).text())
                .isEqualTo("SHOW TAG VALUES FROM \"cpu\" WITH KEY = \"host\" LIMIT 100");
    }
}
