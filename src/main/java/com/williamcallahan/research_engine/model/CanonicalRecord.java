/**
 * Merged form of one or more provider records that share a dedup key
 *
 * Features:
 * - Carries the canonical bibliographic fields plus provenance
 * - Later annotated with relevance notes and a display source label
 * - Serialized with snake_case keys into the sources pack artifact
 */
package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CanonicalRecord {

    private String title;
    private List<String> authors = new ArrayList<>();
    private Integer year;
    private String venue;
    private String doi;
    private String url;
    private String pdfUrl;
    private Integer citedByCount;
    private Integer influentialCitationCount;
    @JsonProperty("abstract")
    private String abstractText;
    private String openAccessUrl;
    private Provenance provenance;
    /** Human-readable provider label, e.g. "OpenAlex + Semantic Scholar" */
    private String source;
    private String whyRelevant;
    private String credibilityNotes;

    public static CanonicalRecord from(ProviderRecord record) {
        CanonicalRecord canonical = new CanonicalRecord();
        canonical.title = record.title();
        canonical.authors = new ArrayList<>(record.authors());
        canonical.year = record.year();
        canonical.venue = record.venue();
        canonical.doi = record.doi();
        canonical.url = record.url();
        canonical.pdfUrl = record.pdfUrl();
        canonical.citedByCount = record.citationCount();
        canonical.influentialCitationCount = record.influentialCitationCount();
        canonical.abstractText = record.abstractText();
        canonical.openAccessUrl = record.openAccessUrl();
        canonical.provenance = record.provenance();
        return canonical;
    }

    public CanonicalRecord copy() {
        CanonicalRecord copy = new CanonicalRecord();
        copy.title = title;
        copy.authors = authors != null ? new ArrayList<>(authors) : new ArrayList<>();
        copy.year = year;
        copy.venue = venue;
        copy.doi = doi;
        copy.url = url;
        copy.pdfUrl = pdfUrl;
        copy.citedByCount = citedByCount;
        copy.influentialCitationCount = influentialCitationCount;
        copy.abstractText = abstractText;
        copy.openAccessUrl = openAccessUrl;
        copy.provenance = provenance;
        copy.source = source;
        copy.whyRelevant = whyRelevant;
        copy.credibilityNotes = credibilityNotes;
        return copy;
    }
}
