package com.williamcallahan.research_engine.model;

import java.util.List;

/**
 * A paper as one provider reported it, before deduplication.
 *
 * @param provenance the provider this record came from ({@link Provenance#OPENALEX} or
 *                   {@link Provenance#SEMANTIC_SCHOLAR})
 */
public record ProviderRecord(
    String title,
    List<String> authors,
    Integer year,
    String venue,
    String doi,
    String url,
    String pdfUrl,
    Integer citationCount,
    Integer influentialCitationCount,
    String abstractText,
    String openAccessUrl,
    Provenance provenance
) {
    public ProviderRecord {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }
}
