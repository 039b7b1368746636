package com.influxgate.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.influxgate.core.error.InvalidQueryInputException;
import com.influxgate.core.time.TimeExpression;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryModelTest {

    @Test
    void appliesDefaults() {
        QueryModel model = QueryModel.builder().target("iot").measurement("temp").build();

        assertThat(model.start()).isEqualTo(QueryModel.DEFAULT_START);
        assertThat(model.stop()).isEqualTo(TimeExpression.NOW);
        assertThat(model.fill()).isEqualTo(Fill.NONE);
        assertThat(model.tags()).isEmpty();
        assertThat(model.windowed()).isFalse();
    }

    @Test
    void configuredLookbackReplacesDefaultStart() {
        QueryModel model = QueryModel.builder().target("iot").defaultStart("-6h").build();

        assertThat(model.start().toString()).isEqualTo("-6h");
    }

    @Test
    void everyWithoutAggregateIsRejected() {
        assertThatThrownBy(() -> QueryModel.builder().target("iot").every("5m").build())
                .isInstanceOf(InvalidQueryInputException.class)
                .hasMessageContaining("requires an aggregate");
    }

    @Test
    void aggregateWithoutEveryIsRejected() {
        assertThatThrownBy(() -> QueryModel.builder().target("iot").aggregate("max").build())
                .isInstanceOf(InvalidQueryInputException.class)
                .hasMessageContaining("requires 'every'");
    }

    @Test
    void unknownAggregateIsRejected() {
        assertThatThrownBy(() -> QueryModel.builder().target("iot").aggregate("avg"))
                .isInstanceOf(InvalidQueryInputException.class)
                .hasMessageContaining("Unsupported aggregate function: avg");
    }

    @Test
    void absoluteStopMustFollowStart() {
        assertThatThrownBy(() -> QueryModel.builder()
                        .target("iot")
                        .start("2024-01-02T00:00:00Z")
                        .stop("2024-01-01T00:00:00Z")
                        .build())
                .isInstanceOf(InvalidQueryInputException.class);
    }

    @Test
    void limitMustBePositive() {
        assertThatThrownBy(() -> QueryModel.builder().target("iot").limit(0).build())
                .isInstanceOf(InvalidQueryInputException.class);
    }

    @Test
    void repeatedTagKeepsLastValueAndTagsAreImmutable() {
        QueryModel model = QueryModel.builder()
                .target("iot")
                .tag("device_id", "a")
                .tag("device_id", "b")
                .build();

        assertThat(model.tags()).containsExactly(Map.entry("device_id", "b"));
        assertThatThrownBy(() -> model.tags().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void targetIsRequired() {
        assertThatThrownBy(() -> QueryModel.builder().build()).isInstanceOf(InvalidQueryInputException.class);
    }

    @Test
    void targetSplitsRetentionPolicy() {
        assertThat(Target.parse("telegraf/autogen")).isEqualTo(new Target("telegraf", "autogen"));
        assertThat(Target.parse("telegraf")).isEqualTo(new Target("telegraf", null));
    }

    @Test
    void limitsClampToCeiling() {
        QueryLimits limits = new QueryLimits(500, 100);

        assertThat(limits.effective(null)).isEqualTo(100);
        assertThat(limits.effective(10_000)).isEqualTo(500);
        assertThat(limits.effective(42)).isEqualTo(42);
    }
}
