package com.influxgate.core.engine;

import com.influxgate.core.detect.VersionDetector;
import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.error.InvalidQueryInputException;
import com.influxgate.core.model.Aggregate;
import com.influxgate.core.model.QueryModel;
import com.influxgate.core.normalize.ResultNormalizer;
import com.influxgate.core.query.BuiltQuery;
import com.influxgate.core.result.ContainerInfo;
import com.influxgate.core.result.ContainerListing;
import com.influxgate.core.result.FieldListing;
import com.influxgate.core.result.LastPoint;
import com.influxgate.core.result.MeasurementListing;
import com.influxgate.core.result.Series;
import com.influxgate.core.result.SeriesPoint;
import com.influxgate.core.result.TagListing;
import com.influxgate.core.result.TagListing.TagInfo;
import com.influxgate.core.result.WindowStats;
import com.influxgate.core.spi.InfluxBackend;
import com.influxgate.core.time.DurationLiteral;
import com.influxgate.core.time.Timestamps;
import com.influxgate.core.uri.ResourceUriParser;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tool surface of the engine. Every operation validates its input, resolves the dialect, builds
 * the query, executes it through the backend with the configured timeout and normalizes the
 * response. Validation failures never reach the backend.
 */
public final class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final InfluxBackend backend;
    private final VersionDetector detector;
    private final EngineSettings settings;
    private final Clock clock;
    private final DialectSupport flux;
    private final DialectSupport influxQl;
    private final ResourceUriParser uriParser;

    public QueryEngine(InfluxBackend backend, VersionDetector detector, EngineSettings settings, Clock clock) {
        this.backend = backend;
        this.detector = detector;
        this.settings = settings;
        this.clock = clock;
        this.flux = DialectSupport.flux(clock, settings.limits());
        this.influxQl = DialectSupport.influxQl(clock, settings.limits());
        this.uriParser = new ResourceUriParser(settings.defaultLookback());
    }

    public Dialect dialect() {
        return detector.resolve();
    }

    /**
     * {@code requested} when given, otherwise the configured default for the active dialect.
     * Throws {@link InvalidQueryInputException} when neither exists.
     */
    public String target(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        String fallback = switch (detector.resolve()) {
            case FLUX -> settings.defaultBucket();
            case INFLUXQL -> settings.defaultDatabase();
        };
        if (fallback == null || fallback.isBlank()) {
            throw new InvalidQueryInputException("target is required");
        }
        return fallback;
    }

    /** Buckets, or databases expanded to one {@code db/rp} entry per retention policy. */
    public ContainerListing listBucketsOrDbs() {
        DialectSupport support = support();
        BuiltQuery query = support.builder().buildListContainers();
        List<ContainerInfo> containers = support.normalizer().normalizeContainers(run(query), query);
        if (detector.resolve() == Dialect.FLUX) {
            return new ContainerListing(containers);
        }
        List<ContainerInfo> expanded = new ArrayList<>();
        for (ContainerInfo db : containers) {
            BuiltQuery rps = support.builder().buildListRetentionPolicies(db.name());
            expanded.addAll(support.normalizer().normalizeRetentionPolicies(db.name(), run(rps)));
        }
        return new ContainerListing(ResultNormalizer.capped(expanded, query));
    }

    public MeasurementListing listMeasurements(String target) {
        target = target(target);
        DialectSupport support = support();
        BuiltQuery query = support.builder().buildListMeasurements(target);
        return new MeasurementListing(support.normalizer().normalizeMeasurements(run(query), query));
    }

    public FieldListing listFields(String target, String measurement) {
        requireText(measurement, "measurement");
        target = target(target);
        DialectSupport support = support();
        BuiltQuery query = support.builder().buildListFields(target, measurement);
        return new FieldListing(support.normalizer().normalizeFields(run(query), query));
    }

    /** Tag keys, each with up to {@link EngineSettings#maxTagValues()} sample values. */
    public TagListing listTags(String target, String measurement) {
        requireText(measurement, "measurement");
        target = target(target);
        DialectSupport support = support();
        BuiltQuery keyQuery = support.builder().buildListTags(target, measurement);
        List<String> keys = support.normalizer().normalizeTagKeys(run(keyQuery), keyQuery);
        List<TagInfo> tags = new ArrayList<>(keys.size());
        for (String key : keys) {
            BuiltQuery values = support.builder().buildListTagValues(target, measurement, key, settings.maxTagValues());
            List<String> sample = support.normalizer().normalizeTagValues(run(values), values);
            tags.add(new TagInfo(key, sample.size() > settings.maxTagValues()
                    ? sample.subList(0, settings.maxTagValues())
                    : sample));
        }
        return new TagListing(tags);
    }

    public LastPoint lastPoint(QueryModel model) {
        DialectSupport support = support(model);
        BuiltQuery query = support.builder().buildLastPoint(model);
        return support.normalizer().normalizeLastPoint(run(query), query);
    }

    public Series queryTimeseries(QueryModel model) {
        DialectSupport support = support(model);
        BuiltQuery query = support.builder().buildSeriesQuery(model);
        Series series = support.normalizer().normalizeSeries(run(query), query);
        if (series.stats().truncated()) {
            log.info("Series for {}/{} truncated to {} points", model.target(), model.measurement(), query.limit());
        }
        return series;
    }

    /**
     * Mean, min, max, last and count of one field over the trailing {@code window} (for example
     * {@code -24h}). Each statistic is one windowed aggregate query; the windows it returns are
     * folded into a single value.
     */
    public WindowStats windowStats(
            String target, String measurement, String field, String window, Map<String, String> tags) {
        requireText(measurement, "measurement");
        requireText(field, "field");
        requireText(window, "window");
        DurationLiteral span = DurationLiteral.parse(window);
        if (span.duration().isZero()) {
            throw new InvalidQueryInputException("window must be a non-zero duration");
        }
        Instant stop = clock.instant();
        Instant start = stop.minus(span.duration());
        QueryModel.Builder base = QueryModel.builder()
                .target(target(target))
                .measurement(measurement)
                .field(field)
                .tags(tags)
                .start(Timestamps.format(start))
                .stop(Timestamps.format(stop))
                .every(span.magnitude());

        List<SeriesPoint> counts = windows(base, Aggregate.COUNT);
        List<SeriesPoint> means = windows(base, Aggregate.MEAN);
        List<SeriesPoint> mins = windows(base, Aggregate.MIN);
        List<SeriesPoint> maxes = windows(base, Aggregate.MAX);
        List<SeriesPoint> lasts = windows(base, Aggregate.LAST);

        return new WindowStats(
                WindowFolding.mean(means, counts),
                WindowFolding.extreme(mins, true),
                WindowFolding.extreme(maxes, false),
                lasts.isEmpty() ? null : lasts.get(lasts.size() - 1).value(),
                WindowFolding.total(counts),
                Timestamps.format(start),
                Timestamps.format(stop));
    }

    public Series readResource(String uri) {
        return queryTimeseries(uriParser.parse(uri));
    }

    public EngineSettings settings() {
        return settings;
    }

    private List<SeriesPoint> windows(QueryModel.Builder base, Aggregate aggregate) {
        return queryTimeseries(base.aggregate(aggregate).build()).series();
    }

    private DialectSupport support() {
        return DialectSupport.forDialect(detector.resolve(), flux, influxQl);
    }

    /** The model is validated at construction, so resolution only runs for well-formed input. */
    private DialectSupport support(QueryModel model) {
        if (model == null) {
            throw new InvalidQueryInputException("query is required");
        }
        model.requireMeasurement();
        return support();
    }

    private String run(BuiltQuery query) {
        if (log.isDebugEnabled()) {
            log.debug("Executing {} query (db={}, rp={}):\n{}", query.dialect().wireValue(), query.database(),
                    query.retentionPolicy(), query.text());
        }
        return backend.execute(query, settings.requestTimeout());
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidQueryInputException(name + " is required");
        }
    }
}
