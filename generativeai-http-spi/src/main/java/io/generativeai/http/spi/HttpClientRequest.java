package io.generativeai.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents an HTTP request to be sent by an {@link HttpClientAdapter}.
 * This is an immutable value type with a fluent builder API.
 */
public final class HttpClientRequest {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_JSON = "application/json";

    private final URI uri;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(URI uri, String method, Map<String, String> headers, byte[] body, Duration timeout) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.method = Objects.requireNonNull(method, "method");
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
        this.timeout = timeout;
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public URI uri() { return uri; }
    public String method() { return method; }
    /** Headers in insertion order. */
    public Map<String, String> headers() { return headers; }
    public byte[] body() { return body; }
    /** Upper bound for the whole exchange, or {@code null} for the adapter's default. */
    public Duration timeout() { return timeout; }

    /**
     * Returns the value of a header, matching the name case-insensitively.
     */
    public String header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    public static Builder get(URI uri) { return new Builder(uri, "GET"); }
    public static Builder post(URI uri) { return new Builder(uri, "POST"); }

    @Override
    public String toString() {
        // headers may carry credentials
        return method + " " + uri;
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private Map<String, String> headers;
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (headers == null) headers = new LinkedHashMap<>();
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        /** Sets the body and a JSON {@code Content-Type}. */
        public Builder jsonBody(byte[] body) {
            header(CONTENT_TYPE, APPLICATION_JSON);
            return body(body);
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(uri, method, headers, body, timeout);
        }
    }
}
