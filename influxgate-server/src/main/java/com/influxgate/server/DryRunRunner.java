package com.influxgate.server;

import com.influxgate.core.engine.ConnectivityCheck;
import com.influxgate.core.result.ContainerInfo;
import com.influxgate.core.result.ProbeReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * With {@code --dry-run}, checks connectivity once at start-up and logs what it found. A failure
 * propagates and aborts the start-up.
 */
@Slf4j
@Component
public class DryRunRunner implements ApplicationRunner {

    static final String OPTION = "dry-run";

    private final ConnectivityCheck connectivity;

    public DryRunRunner(ConnectivityCheck connectivity) {
        this.connectivity = connectivity;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION)) {
            return;
        }
        log.info("Dry run: checking InfluxDB connectivity");
        ProbeReport report = connectivity.probe();
        log.info("Dry run OK: dialect {}", report.dialect().wireValue());
        for (ContainerInfo container : report.sampleContainers()) {
            log.info("  {} ({})", container.name(), container.kind().wireValue());
        }
    }
}
