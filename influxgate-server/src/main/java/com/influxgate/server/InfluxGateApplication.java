package com.influxgate.server;

import java.util.Arrays;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/** Serves the query tools over REST. {@code --dry-run} only checks connectivity and exits. */
@SpringBootApplication(scanBasePackages = {"com.influxgate.server", "com.influxgate.controller"})
public class InfluxGateApplication {

    public static void main(String[] args) {
        boolean dryRun = Arrays.asList(args).contains("--" + DryRunRunner.OPTION);
        SpringApplication app = new SpringApplication(InfluxGateApplication.class);
        if (dryRun) {
            app.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = app.run(args);
        if (dryRun) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
