package com.influxgate.core.uri;

import com.influxgate.core.error.InfluxGateException;
import com.influxgate.core.error.InvalidResourceUriException;
import com.influxgate.core.model.QueryModel;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes addressable query URIs into {@link QueryModel}s.
 *
 *   influxdb://iot-devices/device_status?field=rssi&start=-3d&every=1h&aggregate=max&tag.device_id=xyz-789
 *
 * The authority and every path segment but the last form the target; the last segment is the
 * measurement. Recognised parameters: field, start, stop, every, aggregate, limit, fill and
 * {@code tag.<key>}. Unknown parameters are ignored, and a repeated tag key keeps its last value.
 */
public final class ResourceUriParser {

    private static final String TAG_PREFIX = "tag.";

    private final String defaultLookback;

    public ResourceUriParser() {
        this(QueryModel.DEFAULT_START.toString());
    }

    /** @param defaultLookback start applied when the URI names none, e.g. {@code -1h} */
    public ResourceUriParser(String defaultLookback) {
        this.defaultLookback = defaultLookback;
    }

    public QueryModel parse(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new InvalidResourceUriException("Resource URI cannot be empty");
        }
        URI parsed;
        try {
            parsed = new URI(uri.trim());
        } catch (URISyntaxException e) {
            throw new InvalidResourceUriException("Malformed resource URI: " + e.getReason(), e);
        }
        if (parsed.getScheme() == null || parsed.getRawAuthority() == null || parsed.getRawAuthority().isEmpty()) {
            throw new InvalidResourceUriException("Resource URI must look like scheme://<target>/<measurement>");
        }

        List<String> segments = new ArrayList<>();
        segments.add(decode(parsed.getRawAuthority()));
        String path = parsed.getRawPath() == null ? "" : parsed.getRawPath();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(decode(segment));
            }
        }
        if (segments.size() < 2) {
            throw new InvalidResourceUriException("Resource URI is missing the measurement segment");
        }
        String measurement = segments.remove(segments.size() - 1);
        String target = String.join("/", segments);

        try {
            QueryModel.Builder builder = QueryModel.builder()
                    .target(target)
                    .measurement(measurement)
                    .defaultStart(defaultLookback);
            applyParameters(builder, parsed.getRawQuery());
            return builder.build();
        } catch (InvalidResourceUriException e) {
            throw e;
        } catch (InfluxGateException e) {
            throw new InvalidResourceUriException("Invalid resource URI: " + e.getMessage(), e);
        }
    }

    private static void applyParameters(QueryModel.Builder builder, String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            if (name.startsWith(TAG_PREFIX)) {
                String key = name.substring(TAG_PREFIX.length());
                if (key.isEmpty()) {
                    throw new InvalidResourceUriException("Tag parameter is missing its key: " + name);
                }
                builder.tag(key, value);
                continue;
            }
            switch (name) {
                case "field" -> builder.field(value);
                case "start" -> builder.start(value);
                case "stop" -> builder.stop(value);
                case "every" -> builder.every(value);
                case "aggregate" -> builder.aggregate(value);
                case "fill" -> builder.fill(value);
                case "limit" -> builder.limit(parseLimit(value));
                default -> {
                    // unknown parameters are ignored
                }
            }
        }
    }

    private static Integer parseLimit(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new InvalidResourceUriException("limit must be an integer: " + value, e);
        }
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidResourceUriException("Bad percent-encoding in resource URI", e);
        }
    }
}
