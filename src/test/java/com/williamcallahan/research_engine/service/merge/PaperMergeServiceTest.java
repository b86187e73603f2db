/**
 * Tests for PaperMergeService
 * - Dedup by DOI and by title when DOI is missing
 * - Enrichment rules for citations, abstracts and locators
 * - Provenance tagging and citation ordering
 * - Argument order decides which present values survive
 *
 * @author William Callahan
 */
package com.williamcallahan.research_engine.service.merge;

import com.williamcallahan.research_engine.model.CanonicalRecord;
import com.williamcallahan.research_engine.model.Provenance;
import com.williamcallahan.research_engine.model.ProviderRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PaperMergeServiceTest {

    private final PaperMergeService mergeService = new PaperMergeService();

    private static ProviderRecord openAlex(String title, String doi, Integer citations) {
        return new ProviderRecord(title, List.of("A. Author"), 2020, "Venue", doi, "https://openalex.org/" + title.hashCode(),
            null, citations, null, null, null, Provenance.OPENALEX);
    }

    private static ProviderRecord semanticScholar(String title, String doi, Integer citations, String abstractText) {
        return new ProviderRecord(title, List.of("B. Author"), 2021, null, doi, "https://semanticscholar.org/" + title.hashCode(),
            "https://arxiv.org/pdf/" + title.hashCode(), citations, 40, abstractText, null, Provenance.SEMANTIC_SCHOLAR);
    }

    @Test
    void mergesRecordsSharingDoiAndFillsGaps() {
        ProviderRecord primary = new ProviderRecord("Deep Learning", List.of(), null, null,
            "https://doi.org/10.1038/NATURE14539", null, null, 0, null, null, null, Provenance.OPENALEX);
        ProviderRecord secondary = semanticScholar("Deep learning (Nature)", "10.1038/nature14539", 50000, "Deep learning allows...");

        List<CanonicalRecord> merged = mergeService.merge(List.of(primary), List.of(secondary));

        assertThat(merged).hasSize(1);
        CanonicalRecord record = merged.get(0);
        assertThat(record.getTitle()).isEqualTo("Deep Learning");
        assertThat(record.getDoi()).isEqualTo("10.1038/nature14539");
        assertThat(record.getCitedByCount()).isEqualTo(50000);
        assertThat(record.getInfluentialCitationCount()).isEqualTo(40);
        assertThat(record.getAbstractText()).isEqualTo("Deep learning allows...");
        assertThat(record.getUrl()).startsWith("https://semanticscholar.org/");
        assertThat(record.getPdfUrl()).startsWith("https://arxiv.org/pdf/");
        assertThat(record.getYear()).isEqualTo(2021);
        assertThat(record.getAuthors()).containsExactly("B. Author");
        assertThat(record.getProvenance()).isEqualTo(Provenance.BOTH);
    }

    @Test
    void keepsPrimaryValuesWhenAlreadyPresent() {
        ProviderRecord primary = openAlex("Graph Attention Networks", "10.1/gat", 900);
        ProviderRecord secondary = semanticScholar("Graph Attention Networks", "10.1/gat", 1200, "Abstract");

        CanonicalRecord record = mergeService.merge(List.of(primary), List.of(secondary)).get(0);

        assertThat(record.getCitedByCount()).isEqualTo(900);
        assertThat(record.getUrl()).startsWith("https://openalex.org/");
        assertThat(record.getVenue()).isEqualTo("Venue");
        assertThat(record.getYear()).isEqualTo(2020);
    }

    @Test
    void fallsBackToTitleKeyWithoutDoi() {
        ProviderRecord primary = openAlex("BERT: Pre-training of Deep Bidirectional Transformers", null, 100);
        ProviderRecord secondary = semanticScholar("bert pre-training of deep bidirectional transformers!", null, 300, null);

        List<CanonicalRecord> merged = mergeService.merge(List.of(primary), List.of(secondary));

        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).getProvenance()).isEqualTo(Provenance.BOTH);
    }

    @Test
    void sortsByCitationsAndDropsUnkeyedRecords() {
        ProviderRecord lowCited = openAlex("Low", "10.1/low", 5);
        ProviderRecord uncited = openAlex("Uncited", "10.1/none", null);
        ProviderRecord highCited = semanticScholar("High", "10.1/high", 500, null);
        ProviderRecord noKey = new ProviderRecord("?!", List.of(), null, null, " ", null, null, 999, null, null, null,
            Provenance.OPENALEX);

        List<CanonicalRecord> merged = mergeService.merge(List.of(lowCited, uncited, noKey), List.of(highCited));

        assertThat(merged).extracting(CanonicalRecord::getTitle).containsExactly("High", "Low", "Uncited");
        assertThat(merged).extracting(CanonicalRecord::getProvenance)
            .containsExactly(Provenance.SEMANTIC_SCHOLAR, Provenance.OPENALEX, Provenance.OPENALEX);
    }

    @Test
    void firstRecordWinsForRepeatedKeyWithinOneProvider() {
        ProviderRecord first = openAlex("Same Paper", "10.1/same", 10);
        ProviderRecord repeat = openAlex("Same Paper (duplicate)", "10.1/SAME", 99);

        List<CanonicalRecord> merged = mergeService.merge(List.of(first, repeat), List.of());

        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).getCitedByCount()).isEqualTo(10);
        assertThat(merged.get(0).getProvenance()).isEqualTo(Provenance.OPENALEX);
    }

    @Test
    void mergeIsDeterministicAndLeavesInputsUntouched() {
        List<ProviderRecord> primary = List.of(openAlex("One", "10.1/one", 1), openAlex("Two", "10.1/two", null));
        List<ProviderRecord> secondary = List.of(semanticScholar("Two", "10.1/two", 7, "abs"));

        List<CanonicalRecord> first = mergeService.merge(primary, secondary);
        List<CanonicalRecord> second = mergeService.merge(primary, secondary);

        assertThat(first).extracting(CanonicalRecord::getTitle).containsExactly("Two", "One");
        assertThat(second).extracting(CanonicalRecord::getTitle).containsExactly("Two", "One");
        assertThat(primary.get(1).citationCount()).isNull();
        assertThat(first.get(0)).isNotSameAs(second.get(0));
        assertThat(mergeService.merge(null, null)).isEmpty();
    }

    @Test
    void secondaryRecordIsAbsorbedEvenWhenBothListsShareATag() {
        ProviderRecord primary = new ProviderRecord("Scaling Laws", List.of(), null, null, "10.1/X", null, null,
            null, null, null, null, Provenance.OPENALEX);
        ProviderRecord secondary = new ProviderRecord("Scaling Laws", List.of("J. Kaplan"), 2020, null, "10.1/x",
            "https://openalex.org/W42", null, 42, null, "We study scaling...", null, Provenance.OPENALEX);

        List<CanonicalRecord> merged = mergeService.merge(List.of(primary), List.of(secondary));

        assertThat(merged).hasSize(1);
        CanonicalRecord record = merged.get(0);
        assertThat(record.getCitedByCount()).isEqualTo(42);
        assertThat(record.getUrl()).isEqualTo("https://openalex.org/W42");
        assertThat(record.getAbstractText()).isEqualTo("We study scaling...");
        assertThat(record.getProvenance()).isEqualTo(Provenance.BOTH);
    }

    @Test
    void untaggedRecordsWithSharedKeyAreMerged() {
        ProviderRecord primary = new ProviderRecord("Untagged", List.of(), null, null, "10.1/untagged", null, null,
            null, null, null, null, null);
        ProviderRecord secondary = new ProviderRecord("Untagged", List.of(), null, null, "10.1/untagged",
            "https://example.org/untagged", null, 7, null, null, null, null);

        CanonicalRecord record = mergeService.merge(List.of(primary), List.of(secondary)).get(0);

        assertThat(record.getCitedByCount()).isEqualTo(7);
        assertThat(record.getUrl()).isEqualTo("https://example.org/untagged");
        assertThat(record.getProvenance()).isEqualTo(Provenance.BOTH);
    }

    @Test
    void firstRecordWinsForRepeatedKeyWithinSecondary() {
        ProviderRecord first = semanticScholar("Only Secondary", "10.1/sec", 3, null);
        ProviderRecord repeat = semanticScholar("Only Secondary", "10.1/SEC", 300, "late abstract");

        List<CanonicalRecord> merged = mergeService.merge(List.of(), List.of(first, repeat));

        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).getCitedByCount()).isEqualTo(3);
        assertThat(merged.get(0).getAbstractText()).isNull();
        assertThat(merged.get(0).getProvenance()).isEqualTo(Provenance.SEMANTIC_SCHOLAR);
    }

    @Test
    void swappingArgumentsChangesWhichValuesSurvive() {
        ProviderRecord openAlexRecord = openAlex("Graph Attention Networks", "10.1/gat", 900);
        ProviderRecord semanticScholarRecord = semanticScholar("Graph Attention Networks", "10.1/gat", 1200, "Abstract");

        CanonicalRecord openAlexFirst = mergeService.merge(List.of(openAlexRecord), List.of(semanticScholarRecord)).get(0);
        CanonicalRecord semanticScholarFirst = mergeService.merge(List.of(semanticScholarRecord), List.of(openAlexRecord)).get(0);

        assertThat(openAlexFirst.getCitedByCount()).isEqualTo(900);
        assertThat(semanticScholarFirst.getCitedByCount()).isEqualTo(1200);
        assertThat(openAlexFirst.getUrl()).startsWith("https://openalex.org/");
        assertThat(semanticScholarFirst.getUrl()).startsWith("https://semanticscholar.org/");
        assertThat(openAlexFirst.getYear()).isEqualTo(2020);
        assertThat(semanticScholarFirst.getYear()).isEqualTo(2021);
        assertThat(openAlexFirst.getAuthors()).isNotEqualTo(semanticScholarFirst.getAuthors());
        assertThat(openAlexFirst.getProvenance()).isEqualTo(Provenance.BOTH);
        assertThat(semanticScholarFirst.getProvenance()).isEqualTo(Provenance.BOTH);
    }
}
