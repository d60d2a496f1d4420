package io.generativeai.core.response;

/**
 * A span of a candidate attributed to a source.
 *
 * @param startIndex start of the attributed segment, in bytes
 * @param endIndex end of the attributed segment (exclusive), in bytes
 * @param uri source URI
 * @param license source license
 */
public record CitationSource(Integer startIndex, Integer endIndex, String uri, String license) {
}
