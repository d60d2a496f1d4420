package io.generativeai.core.response;

import java.util.Map;

/**
 * One entry of {@link ErrorBody#details()}.
 *
 * @param typeUrl type of the detail; written as {@code @type}
 * @param reason machine-readable reason (e.g. {@code API_KEY_INVALID})
 * @param domain reason domain
 * @param metadata additional key/value context
 */
public record ErrorDetail(String typeUrl, String reason, String domain, Map<String, String> metadata) {
}
