/**
 * Tests for PaperRankingService
 * - Annotations from the collaborator are applied onto merged records
 * - Unparseable answers fall back to database order with default annotations
 * - Provenance survives ranking
 *
 * @author William Callahan
 */
package com.williamcallahan.research_engine.service.generation;

import com.williamcallahan.research_engine.config.AppConfigurationProperties;
import com.williamcallahan.research_engine.model.CanonicalRecord;
import com.williamcallahan.research_engine.model.Provenance;
import com.williamcallahan.research_engine.testutil.ResearchFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaperRankingServiceTest {

    @Mock
    private TextGenerationClient generationClient;

    private PaperRankingService service;
    private List<CanonicalRecord> merged;

    @BeforeEach
    void setUp() {
        service = new PaperRankingService(generationClient, new JsonResponseParser(ResearchFixtures.objectMapper()),
            ResearchFixtures.objectMapper(), new AppConfigurationProperties());
        merged = List.of(
            ResearchFixtures.paper("Highly Accurate Protein Structure Prediction with AlphaFold", "10.1038/s41586-021-03819-2", 20000, Provenance.BOTH),
            ResearchFixtures.paper("Attention Is All You Need", null, 90000, Provenance.SEMANTIC_SCHOLAR),
            ResearchFixtures.paper("Unrelated Survey of Crop Yields", "10.1/crops", 10, Provenance.OPENALEX)
        );
    }

    @Test
    void appliesAnnotationsAndKeepsMergedLocators() {
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("""
            {"papers": [
              {"title": "attention is all you need", "url": "https://rewritten.example", "why_relevant": "Introduces the transformer.",
               "credibility_notes": "peer-reviewed"},
              {"title": "Highly Accurate Protein Structure Prediction with AlphaFold"},
              {"title": "A Paper Nobody Found", "authors": ["X"], "year": 2024, "url": "https://example.org/new"},
              {"why_relevant": "missing title is skipped"}
            ]}
            """));

        StepVerifier.create(service.rank(ResearchFixtures.brief(), merged))
            .assertNext(ranked -> {
                assertThat(ranked).extracting(CanonicalRecord::getTitle).containsExactly(
                    "Attention Is All You Need",
                    "Highly Accurate Protein Structure Prediction with AlphaFold",
                    "A Paper Nobody Found");

                CanonicalRecord attention = ranked.get(0);
                assertThat(attention.getUrl()).isEqualTo(merged.get(1).getUrl());
                assertThat(attention.getWhyRelevant()).isEqualTo("Introduces the transformer.");
                assertThat(attention.getCredibilityNotes()).isEqualTo("peer-reviewed");
                assertThat(attention.getProvenance()).isEqualTo(Provenance.SEMANTIC_SCHOLAR);
                assertThat(attention.getSource()).isEqualTo("Semantic Scholar");

                CanonicalRecord alphaFold = ranked.get(1);
                assertThat(alphaFold.getWhyRelevant()).isEqualTo(PaperRankingService.DEFAULT_WHY_RELEVANT);
                assertThat(alphaFold.getCredibilityNotes()).isEqualTo(PaperRankingService.DEFAULT_CREDIBILITY);
                assertThat(alphaFold.getSource()).isEqualTo("OpenAlex + Semantic Scholar");

                CanonicalRecord invented = ranked.get(2);
                assertThat(invented.getYear()).isEqualTo(2024);
                assertThat(invented.getProvenance()).isNull();
                assertThat(invented.getSource()).isEqualTo(Provenance.UNKNOWN_LABEL);
            })
            .verifyComplete();

        assertThat(merged.get(1).getWhyRelevant()).isNull();
    }

    @Test
    void unparseableAnswerFallsBackToDatabaseOrder() {
        List<CanonicalRecord> many = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            many.add(ResearchFixtures.paper("Paper " + i, "10.1/p" + i, 100 - i, Provenance.OPENALEX));
        }
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("no json here"));

        StepVerifier.create(service.rank(ResearchFixtures.brief(), many))
            .assertNext(ranked -> {
                assertThat(ranked).hasSize(10);
                assertThat(ranked.get(0).getTitle()).isEqualTo("Paper 0");
                assertThat(ranked).allSatisfy(paper -> {
                    assertThat(paper.getWhyRelevant()).isEqualTo(PaperRankingService.DEFAULT_WHY_RELEVANT);
                    assertThat(paper.getSource()).isEqualTo("OpenAlex");
                });
            })
            .verifyComplete();
    }

    @Test
    void answerWithoutPapersArrayFallsBack() {
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("{\"ranking\": \"done\"}"));

        StepVerifier.create(service.rank(ResearchFixtures.brief(), merged))
            .assertNext(ranked -> assertThat(ranked).hasSize(3))
            .verifyComplete();
    }

    @Test
    void transportFailurePropagates() {
        when(generationClient.generate(anyString(), anyString(), anyDouble()))
            .thenReturn(Mono.error(new GenerationException("Text generation call failed: timeout")));

        StepVerifier.create(service.rank(ResearchFixtures.brief(), merged))
            .expectError(GenerationException.class)
            .verify();
    }

    @Test
    void emptyInputMakesNoCall() {
        StepVerifier.create(service.rank(ResearchFixtures.brief(), List.of()))
            .assertNext(ranked -> assertThat(ranked).isEmpty())
            .verifyComplete();
        verify(generationClient, never()).generate(anyString(), anyString(), anyDouble());
    }

    @Test
    void promptTruncatesAuthorsAndListsCandidates() {
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("{\"papers\": []}"));

        service.rank(ResearchFixtures.brief(), merged).block();

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generationClient).generate(anyString(), prompt.capture(), anyDouble());
        assertThat(prompt.getValue())
            .contains("Topic: \"Attention-Based Protein Structure Prediction\"")
            .contains("## Papers found (3 total)")
            .contains("\"C. Three\"")
            .doesNotContain("D. Four");
    }
}
