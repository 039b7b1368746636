package com.influxgate.core.uri;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.influxgate.core.error.InvalidQueryInputException;
import com.influxgate.core.error.InvalidResourceUriException;
import com.influxgate.core.model.Aggregate;
import com.influxgate.core.model.Fill;
import com.influxgate.core.model.QueryModel;
import com.influxgate.core.time.TimeExpression;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResourceUriParserTest {

    private final ResourceUriParser parser = new ResourceUriParser();

    @Test
    void decodesFullUri() {
        QueryModel model = parser.parse(
                "scheme://iot-devices/device_status?field=rssi&start=-3d&every=1h&aggregate=max&tag.device_id=xyz-789");

        assertThat(model.target()).isEqualTo("iot-devices");
        assertThat(model.measurement()).isEqualTo("device_status");
        assertThat(model.field()).isEqualTo("rssi");
        assertThat(model.start().toString()).isEqualTo("-3d");
        assertThat(model.stop()).isEqualTo(TimeExpression.NOW);
        assertThat(model.every().toFlux()).isEqualTo("1h");
        assertThat(model.aggregate()).isEqualTo(Aggregate.MAX);
        assertThat(model.tags()).containsExactly(Map.entry("device_id", "xyz-789"));
    }

    @Test
    void missingTimesUseModelDefaults() {
        QueryModel model = parser.parse("influxdb://iot/temp?field=value");

        assertThat(model.start()).isEqualTo(QueryModel.DEFAULT_START);
        assertThat(model.stop()).isEqualTo(TimeExpression.NOW);
        assertThat(model.windowed()).isFalse();
    }

    @Test
    void configuredLookbackAppliesWhenStartIsMissing() {
        QueryModel model = new ResourceUriParser("-12h").parse("influxdb://iot/temp?field=value");

        assertThat(model.start().toString()).isEqualTo("-12h");
    }

    @Test
    void middleSegmentsBelongToTheTarget() {
        QueryModel model = parser.parse("influxdb://telegraf/autogen/cpu?field=usage_idle");

        assertThat(model.target()).isEqualTo("telegraf/autogen");
        assertThat(model.measurement()).isEqualTo("cpu");
    }

    @Test
    void lastTagOccurrenceWins() {
        QueryModel model = parser.parse("influxdb://iot/temp?tag.site=a&tag.site=b&tag.room=1");

        assertThat(model.tags()).containsExactly(Map.entry("site", "b"), Map.entry("room", "1"));
    }

    @Test
    void percentEncodingIsDecoded() {
        QueryModel model = parser.parse("influxdb://my%20bucket/temp?tag.site=north%26south&start=2024-01-01T00%3A00%3A00Z");

        assertThat(model.target()).isEqualTo("my bucket");
        assertThat(model.tags()).containsEntry("site", "north&south");
        assertThat(model.start().toString()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    void unknownParametersAreIgnored() {
        QueryModel model = parser.parse("influxdb://iot/temp?field=value&format=csv&device_id=abc");

        assertThat(model.tags()).isEmpty();
        assertThat(model.field()).isEqualTo("value");
    }

    @Test
    void limitAndFillAreRead() {
        QueryModel model = parser.parse("influxdb://iot/temp?field=v&every=5m&aggregate=mean&fill=previous&limit=50");

        assertThat(model.limit()).isEqualTo(50);
        assertThat(model.fill()).isEqualTo(Fill.PREVIOUS);
    }

    @Test
    void missingMeasurementIsRejected() {
        assertThatThrownBy(() -> parser.parse("influxdb://iot"))
                .isInstanceOf(InvalidResourceUriException.class)
                .hasMessageContaining("measurement");
        assertThatThrownBy(() -> parser.parse("influxdb://iot/?field=v"))
                .isInstanceOf(InvalidResourceUriException.class);
    }

    @Test
    void validationFailuresAreWrapped() {
        assertThatThrownBy(() -> parser.parse("influxdb://iot/temp?every=1h"))
                .isInstanceOf(InvalidResourceUriException.class)
                .hasCauseInstanceOf(InvalidQueryInputException.class);
        assertThatThrownBy(() -> parser.parse("influxdb://iot/temp?every=1h&aggregate=avg"))
                .isInstanceOf(InvalidResourceUriException.class)
                .hasMessageContaining("avg");
        assertThatThrownBy(() -> parser.parse("influxdb://iot/temp?start=yesterday"))
                .isInstanceOf(InvalidResourceUriException.class);
        assertThatThrownBy(() -> parser.parse("influxdb://iot/temp?limit=ten"))
                .isInstanceOf(InvalidResourceUriException.class);
        assertThatThrownBy(() -> parser.parse("influxdb://iot/temp?field=v&start=-99999999999999999d"))
                .isInstanceOf(InvalidResourceUriException.class)
                .hasCauseInstanceOf(InvalidQueryInputException.class);
    }

    @Test
    void structurallyBrokenUrisAreRejected() {
        assertThatThrownBy(() -> parser.parse("not a uri")).isInstanceOf(InvalidResourceUriException.class);
        assertThatThrownBy(() -> parser.parse("/iot/temp")).isInstanceOf(InvalidResourceUriException.class);
        assertThatThrownBy(() -> parser.parse("")).isInstanceOf(InvalidResourceUriException.class);
    }
}
