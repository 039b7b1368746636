package com.influxgate.server;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Connection and query settings. {@link #toString()} masks the token and password. */
@Validated
@ConfigurationProperties(prefix = "influxgate")
public class InfluxGateProperties {

    @NotBlank
    private String url;

    /** {@code auto}, {@code 1}/{@code influxql} or {@code 2}/{@code flux}. */
    private String version = "auto";

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration probeTimeout = Duration.ofSeconds(5);

    private String org;
    private String token;
    private String defaultBucket;
    private String username;
    private String password;
    private String defaultDb;
    private String defaultRp;

    @Valid
    private Query query = new Query();

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public String getOrg() {
        return org;
    }

    public void setOrg(String org) {
        this.org = org;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getDefaultBucket() {
        return defaultBucket;
    }

    public void setDefaultBucket(String defaultBucket) {
        this.defaultBucket = defaultBucket;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getDefaultDb() {
        return defaultDb;
    }

    public void setDefaultDb(String defaultDb) {
        this.defaultDb = defaultDb;
    }

    public String getDefaultRp() {
        return defaultRp;
    }

    public void setDefaultRp(String defaultRp) {
        this.defaultRp = defaultRp;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    /** {@code db/rp} when both are set, {@code db} alone, or null. */
    public String defaultDatabaseTarget() {
        if (isBlank(defaultDb)) {
            return null;
        }
        return isBlank(defaultRp) ? defaultDb : defaultDb + "/" + defaultRp;
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return "InfluxGateProperties{url=" + url
                + ", version=" + version
                + ", requestTimeout=" + requestTimeout
                + ", org=" + org
                + ", token=" + mask(token)
                + ", defaultBucket=" + defaultBucket
                + ", username=" + username
                + ", password=" + mask(password)
                + ", defaultDb=" + defaultDb
                + ", defaultRp=" + defaultRp
                + ", query=" + query + "}";
    }

    private static String mask(String secret) {
        return isBlank(secret) ? null : "***";
    }

    public static class Query {
        @Min(1)
        private int maxRows = 10_000;

        @Min(1)
        private int defaultLimit = 1_000;

        private String defaultLookback = "-1h";

        @Min(1)
        private int maxTagValues = 100;

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public String getDefaultLookback() {
            return defaultLookback;
        }

        public void setDefaultLookback(String defaultLookback) {
            this.defaultLookback = defaultLookback;
        }

        public int getMaxTagValues() {
            return maxTagValues;
        }

        public void setMaxTagValues(int maxTagValues) {
            this.maxTagValues = maxTagValues;
        }

        @Override
        public String toString() {
            return "{maxRows=" + maxRows
                    + ", defaultLimit=" + defaultLimit
                    + ", defaultLookback=" + defaultLookback
                    + ", maxTagValues=" + maxTagValues + "}";
        }
    }
}
