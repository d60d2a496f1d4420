package io.generativeai.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds method URLs of the form {@code {endpoint}/{apiVersion}/{modelPath}:{method}}.
 */
public final class Urls {
    private Urls() {}

    /**
     * Resolves the resource path of a model.
     *
     * <p>An identifier that already contains a {@code /} is used verbatim (including a leading slash);
     * anything else is placed under {@code models/}.
     */
    public static String modelPath(String model) {
        Objects.requireNonNull(model, "model");
        if (model.isEmpty()) {
            throw new IllegalArgumentException("model must not be empty");
        }
        return model.contains("/") ? model : Protocol.MODELS_PREFIX + model;
    }

    public static URI methodUrl(String endpoint, String apiVersion, String model, String method) {
        return methodUrl(endpoint, apiVersion, model, method, Map.of());
    }

    public static URI methodUrl(String endpoint, String apiVersion, String model, String method, Map<String, String> query) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(apiVersion, "apiVersion");
        Objects.requireNonNull(method, "method");

        StringBuilder sb = new StringBuilder(trimTrailingSlashes(endpoint));
        sb.append('/').append(apiVersion).append('/').append(modelPath(model)).append(':').append(method);
        return withQuery(URI.create(sb.toString()), query);
    }

    /** Appends query parameters with lexicographically sorted keys. */
    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    private static String trimTrailingSlashes(String endpoint) {
        int end = endpoint.length();
        while (end > 0 && endpoint.charAt(end - 1) == '/') end--;
        return endpoint.substring(0, end);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
