package com.influxgate.transport.okhttp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.influxgate.core.error.BackendAuthException;
import com.influxgate.core.error.BackendConnectionException;
import com.influxgate.core.error.BackendQueryException;
import com.influxgate.core.error.BackendTimeoutException;
import com.influxgate.core.query.BuiltQuery;
import com.influxgate.core.spi.InfluxBackend;
import com.influxgate.core.spi.ProbeEndpoint;
import com.influxgate.core.spi.ProbeStatus;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OkHttp transport. Flux goes to {@code POST /api/v2/query} as JSON and comes back as annotated
 * CSV; InfluxQL goes to {@code POST /query} as a form and comes back as JSON.
 *
 * <p>Credentials are attached as headers only. Exception messages name the endpoint path and
 * the backend's own error text, never the request headers.
 */
public class OkHttpInfluxBackend implements InfluxBackend {
    private static final Logger log = LoggerFactory.getLogger(OkHttpInfluxBackend.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int MAX_ERROR_TEXT = 500;

    private final InfluxConnection connection;
    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    /**
     * Socket read and write timeouts are disabled so each call's own deadline is the only one
     * that applies; {@code probeTimeout} bounds connects and probe calls.
     */
    public OkHttpInfluxBackend(InfluxConnection connection, Duration probeTimeout) {
        this(connection, defaultClient(probeTimeout), new ObjectMapper());
    }

    public OkHttpInfluxBackend(InfluxConnection connection, OkHttpClient client, ObjectMapper mapper) {
        this.connection = connection;
        this.baseUrl = HttpUrl.parse(connection.url());
        if (baseUrl == null) {
            throw new IllegalArgumentException("Invalid InfluxDB url");
        }
        this.client = client;
        this.mapper = mapper;
    }

    static OkHttpClient defaultClient(Duration probeTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(probeTimeout)
                .readTimeout(Duration.ZERO)
                .writeTimeout(Duration.ZERO)
                .callTimeout(probeTimeout)
                .build();
    }

    @Override
    public ProbeStatus probe(ProbeEndpoint endpoint) {
        Request request = switch (endpoint) {
            case FLUX_READY -> new Request.Builder().url(url("api/v2/ready").build()).get().build();
            case FLUX_BUCKETS -> withToken(new Request.Builder()
                            .url(url("api/v2/buckets").addQueryParameter("limit", "1").build()))
                    .get()
                    .build();
            case INFLUXQL_PING -> new Request.Builder().url(url("ping").build()).get().build();
            case INFLUXQL_DATABASES -> withBasicAuth(new Request.Builder()
                            .url(url("query").addQueryParameter("q", "SHOW DATABASES").build()))
                    .get()
                    .build();
        };
        try (Response r = execute(client.newCall(request), request)) {
            return ProbeStatus.fromHttpStatus(r.code());
        }
    }

    @Override
    public String execute(BuiltQuery query, Duration timeout) {
        Request request = switch (query.dialect()) {
            case FLUX -> fluxRequest(query);
            case INFLUXQL -> influxQlRequest(query);
        };
        Call call = client.newCall(request);
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try (Response r = execute(call, request)) {
            String body = r.body() != null ? r.body().string() : "";
            if (r.code() == 401 || r.code() == 403) {
                throw new BackendAuthException(
                        "InfluxDB rejected the configured credentials (HTTP " + r.code() + ")", r.code());
            }
            if (!r.isSuccessful()) {
                log.warn("Query {} {} failed with status {}", request.method(), request.url().encodedPath(), r.code());
                throw new BackendQueryException(
                        "InfluxDB returned HTTP " + r.code() + ": " + errorText(body), r.code());
            }
            return body;
        } catch (InterruptedIOException e) {
            throw timeout(request, e);
        } catch (IOException e) {
            throw unreachable(request, e);
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private Response execute(Call call, Request request) {
        try {
            return call.execute();
        } catch (InterruptedIOException e) {
            throw timeout(request, e);
        } catch (IOException e) {
            throw unreachable(request, e);
        }
    }

    private Request fluxRequest(BuiltQuery query) {
        ObjectNode body = mapper.createObjectNode();
        body.put("query", query.text());
        body.put("type", "flux");
        ObjectNode dialect = body.putObject("dialect");
        dialect.put("header", true);
        dialect.put("delimiter", ",");
        dialect.putArray("annotations").add("datatype").add("group").add("default");

        HttpUrl.Builder url = url("api/v2/query");
        if (connection.org() != null && !connection.org().isBlank()) {
            url.addQueryParameter("org", connection.org());
        }
        return withToken(new Request.Builder().url(url.build()))
                .header("Accept", "application/csv")
                .post(RequestBody.create(body.toString(), JSON))
                .build();
    }

    private Request influxQlRequest(BuiltQuery query) {
        HttpUrl.Builder url = url("query");
        if (query.database() != null) {
            url.addQueryParameter("db", query.database());
        }
        if (query.retentionPolicy() != null) {
            url.addQueryParameter("rp", query.retentionPolicy());
        }
        url.addQueryParameter("epoch", "ns");
        FormBody form = new FormBody.Builder().add("q", query.text()).build();
        return withBasicAuth(new Request.Builder().url(url.build()))
                .header("Accept", "application/json")
                .post(form)
                .build();
    }

    private HttpUrl.Builder url(String path) {
        return baseUrl.newBuilder().addPathSegments(path);
    }

    private Request.Builder withToken(Request.Builder builder) {
        if (connection.hasToken()) {
            builder.header("Authorization", "Token " + connection.token());
        }
        return builder;
    }

    private Request.Builder withBasicAuth(Request.Builder builder) {
        if (connection.hasBasicAuth()) {
            String password = connection.password() == null ? "" : connection.password();
            builder.header("Authorization", Credentials.basic(connection.username(), password));
        }
        return builder;
    }

    /** The backend's own message: {@code message} (2.x) or {@code error} (1.x), else the raw text. */
    private String errorText(String body) {
        if (body == null || body.isBlank()) {
            return "no response body";
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node.hasNonNull("message")) {
                return node.get("message").asText();
            }
            if (node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body.length() > MAX_ERROR_TEXT ? body.substring(0, MAX_ERROR_TEXT) + "..." : body;
    }

    private static BackendTimeoutException timeout(Request request, IOException e) {
        return new BackendTimeoutException(
                "InfluxDB request " + request.method() + " " + request.url().encodedPath() + " timed out", e);
    }

    private BackendConnectionException unreachable(Request request, IOException e) {
        return new BackendConnectionException(
                "Cannot reach InfluxDB at " + baseUrl.host() + ":" + baseUrl.port() + request.url().encodedPath()
                        + ": " + e.getMessage(),
                e);
    }
}
