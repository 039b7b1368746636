package com.influxgate.controller.rest;

import com.influxgate.core.engine.ConnectivityCheck;
import com.influxgate.core.engine.QueryEngine;
import com.influxgate.core.result.ProbeReport;
import com.influxgate.core.result.Series;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ResourceController {

    private final QueryEngine engine;
    private final ConnectivityCheck connectivity;
    private final ResourceRenderer renderer;

    public ResourceController(QueryEngine engine, ConnectivityCheck connectivity, ResourceRenderer renderer) {
        this.engine = engine;
        this.connectivity = connectivity;
        this.renderer = renderer;
    }

    /** Reads an addressable query URI and renders it as text. */
    @GetMapping(path = "/resource", produces = MediaType.TEXT_PLAIN_VALUE)
    public String readResource(@RequestParam String uri) {
        Series series = engine.readResource(uri);
        return renderer.render(uri, series);
    }

    @GetMapping(path = "/probe", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProbeReport probe() {
        return connectivity.probe();
    }
}
