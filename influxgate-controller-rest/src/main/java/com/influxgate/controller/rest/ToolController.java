package com.influxgate.controller.rest;

import com.influxgate.core.engine.QueryEngine;
import com.influxgate.core.model.QueryModel;
import com.influxgate.core.result.ContainerListing;
import com.influxgate.core.result.FieldListing;
import com.influxgate.core.result.LastPoint;
import com.influxgate.core.result.MeasurementListing;
import com.influxgate.core.result.Series;
import com.influxgate.core.result.TagListing;
import com.influxgate.core.result.WindowStats;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** One endpoint per tool. Listing tools are GETs, query tools take a JSON body. */
@RestController
@RequestMapping(path = "/api/tools", produces = MediaType.APPLICATION_JSON_VALUE)
public class ToolController {

    private final QueryEngine engine;

    public ToolController(QueryEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/buckets")
    public ContainerListing listBucketsOrDbs() {
        return engine.listBucketsOrDbs();
    }

    @GetMapping("/measurements")
    public MeasurementListing listMeasurements(@RequestParam(required = false) String target) {
        return engine.listMeasurements(target);
    }

    @GetMapping("/fields")
    public FieldListing listFields(@RequestParam(required = false) String target, @RequestParam String measurement) {
        return engine.listFields(target, measurement);
    }

    @GetMapping("/tags")
    public TagListing listTags(@RequestParam(required = false) String target, @RequestParam String measurement) {
        return engine.listTags(target, measurement);
    }

    @PostMapping(path = "/last-point", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LastPoint lastPoint(@Valid @RequestBody LastPointRequest request) {
        QueryModel model = QueryModel.builder()
                .target(engine.target(request.target()))
                .measurement(request.measurement())
                .field(request.field())
                .tags(request.tags())
                .build();
        return engine.lastPoint(model);
    }

    @PostMapping(path = "/query-timeseries", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Series queryTimeseries(@Valid @RequestBody QueryTimeseriesRequest request) {
        return engine.queryTimeseries(
                request.toModel(engine.target(request.target()), engine.settings().defaultLookback()));
    }

    @PostMapping(path = "/window-stats", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WindowStats windowStats(@Valid @RequestBody WindowStatsRequest request) {
        return engine.windowStats(
                request.target(), request.measurement(), request.field(), request.window(), request.tags());
    }
}
