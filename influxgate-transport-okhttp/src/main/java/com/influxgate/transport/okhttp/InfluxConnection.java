package com.influxgate.transport.okhttp;

/**
 * Where and how to reach the server. Token auth is used for the Flux endpoints, basic auth
 * (when a username is set) for the InfluxQL ones. {@link #toString()} never prints secrets.
 */
public record InfluxConnection(String url, String org, String token, String username, String password) {

    public InfluxConnection {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    public boolean hasBasicAuth() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return "InfluxConnection[url=" + url
                + ", org=" + org
                + ", token=" + (hasToken() ? "***" : null)
                + ", username=" + username
                + ", password=" + (password != null && !password.isEmpty() ? "***" : null) + "]";
    }
}
