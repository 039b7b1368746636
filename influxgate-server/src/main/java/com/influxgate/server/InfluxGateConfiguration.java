package com.influxgate.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.influxgate.controller.rest.ResourceRenderer;
import com.influxgate.core.detect.VersionDetector;
import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.engine.ConnectivityCheck;
import com.influxgate.core.engine.EngineSettings;
import com.influxgate.core.engine.QueryEngine;
import com.influxgate.core.model.QueryLimits;
import com.influxgate.core.spi.InfluxBackend;
import com.influxgate.core.time.TimeExpression;
import com.influxgate.transport.okhttp.InfluxConnection;
import com.influxgate.transport.okhttp.OkHttpInfluxBackend;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(InfluxGateProperties.class)
public class InfluxGateConfiguration {

    @Bean(destroyMethod = "close")
    public InfluxBackend influxBackend(InfluxGateProperties props) {
        log.info("InfluxGate settings: {}", props);
        InfluxConnection connection = new InfluxConnection(
                props.getUrl(), blankToNull(props.getOrg()), blankToNull(props.getToken()),
                blankToNull(props.getUsername()), blankToNull(props.getPassword()));
        return new OkHttpInfluxBackend(connection, props.getProbeTimeout());
    }

    @Bean
    public VersionDetector versionDetector(InfluxBackend backend, InfluxGateProperties props) {
        Dialect override = Dialect.fromConfigValue(props.getVersion());
        if (override != null) {
            log.info("InfluxDB dialect fixed by configuration: {}", override.wireValue());
        }
        return new VersionDetector(backend, override);
    }

    @Bean
    public EngineSettings engineSettings(InfluxGateProperties props) {
        InfluxGateProperties.Query q = props.getQuery();
        // fail at start-up rather than on the first request
        TimeExpression.parse(q.getDefaultLookback());
        return new EngineSettings(
                new QueryLimits(q.getMaxRows(), q.getDefaultLimit()),
                props.getRequestTimeout(),
                q.getMaxTagValues(),
                q.getDefaultLookback(),
                blankToNull(props.getDefaultBucket()),
                props.defaultDatabaseTarget());
    }

    @Bean
    public QueryEngine queryEngine(
            InfluxBackend backend, VersionDetector detector, EngineSettings settings, Clock clock) {
        return new QueryEngine(backend, detector, settings, clock);
    }

    @Bean
    public ConnectivityCheck connectivityCheck(QueryEngine engine) {
        return new ConnectivityCheck(engine);
    }

    @Bean
    public ResourceRenderer resourceRenderer(ObjectMapper mapper) {
        return new ResourceRenderer(mapper);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
