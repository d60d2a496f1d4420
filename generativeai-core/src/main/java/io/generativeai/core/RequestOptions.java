package io.generativeai.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-client request configuration.
 *
 * @param timeout deadline for a whole call, measured from the moment the call starts
 * @param apiVersion API surface to target, used as a path segment (e.g. {@code v1beta})
 * @param endpoint base URL of the service
 * @param streamFormat framing requested for streaming calls
 */
public record RequestOptions(Duration timeout, String apiVersion, String endpoint, StreamFormat streamFormat) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public RequestOptions {
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        apiVersion = apiVersion == null ? Protocol.DEFAULT_API_VERSION : apiVersion;
        endpoint = endpoint == null ? Protocol.DEFAULT_ENDPOINT : endpoint;
        streamFormat = streamFormat == null ? StreamFormat.JSON_ARRAY : streamFormat;
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (apiVersion.isBlank()) {
            throw new IllegalArgumentException("apiVersion must not be blank");
        }
        if (endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint must not be blank");
        }
    }

    public RequestOptions(Duration timeout) {
        this(timeout, null, null, null);
    }

    public static RequestOptions defaults() {
        return new RequestOptions(null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration timeout;
        private String apiVersion;
        private String endpoint;
        private StreamFormat streamFormat;

        private Builder() {}

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            return this;
        }

        public Builder streamFormat(StreamFormat streamFormat) {
            this.streamFormat = Objects.requireNonNull(streamFormat, "streamFormat");
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(timeout, apiVersion, endpoint, streamFormat);
        }
    }
}
