package com.williamcallahan.research_engine.service.provider;

import java.util.List;

/**
 * Bibliographic metadata Crossref holds for one DOI.
 *
 * @param type Crossref work type, e.g. {@code journal-article}
 */
public record CrossrefWork(String title, List<String> authors, Integer year, String venue, String doi,
                           String url, String type) {

    public CrossrefWork {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }
}
