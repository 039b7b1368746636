package com.influxgate.core.engine;

import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.result.ContainerInfo;
import com.influxgate.core.result.ProbeReport;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolves the dialect and lists a few containers to prove the configured server is usable. */
public final class ConnectivityCheck {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityCheck.class);

    static final int SAMPLE_SIZE = 5;

    private final QueryEngine engine;

    public ConnectivityCheck(QueryEngine engine) {
        this.engine = engine;
    }

    public ProbeReport probe() {
        Dialect dialect = engine.dialect();
        List<ContainerInfo> containers = engine.listBucketsOrDbs().results();
        List<ContainerInfo> sample = containers.subList(0, Math.min(SAMPLE_SIZE, containers.size()));
        log.info("Connected to InfluxDB ({}); {} containers visible", dialect.wireValue(), containers.size());
        return new ProbeReport(dialect, sample);
    }
}
