package io.generativeai.core.response;

import java.util.List;

public record CitationMetadata(List<CitationSource> citationSources) {
    public CitationMetadata {
        citationSources = citationSources == null ? List.of() : List.copyOf(citationSources);
    }
}
