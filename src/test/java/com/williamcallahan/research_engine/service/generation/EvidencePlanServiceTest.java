package com.williamcallahan.research_engine.service.generation;

import com.williamcallahan.research_engine.model.EvidencePlan;
import com.williamcallahan.research_engine.model.ResultBundle;
import com.williamcallahan.research_engine.testutil.ResearchFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvidencePlanServiceTest {

    @Mock
    private TextGenerationClient generationClient;

    private EvidencePlanService service;
    private ResultBundle sources;

    @BeforeEach
    void setUp() {
        service = new EvidencePlanService(generationClient, new JsonResponseParser(ResearchFixtures.objectMapper()),
            ResearchFixtures.objectMapper());
        sources = new ResultBundle(null, List.of(ResearchFixtures.paper("P", "10.1/p", 1, null)), List.of(), List.of(), List.of());
    }

    @Test
    void mapsAnswerOntoPlan() {
        Instant before = Instant.now();
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("""
            {"evidence_type": "secondary",
             "collection_strategy": ["Step 1: download CASP targets", "Step 2: run baselines"],
             "inclusion_exclusion": {"include": ["structures after 2018"]},
             "analysis_overview": "Compare GDT scores.",
             "expected_outputs": ["benchmark table"],
             "extra_field": true}
            """));

        StepVerifier.create(service.plan(ResearchFixtures.brief(), sources))
            .assertNext(plan -> {
                assertThat(plan.evidenceType()).isEqualTo("secondary");
                assertThat(plan.collectionStrategy()).hasSize(2);
                assertThat(plan.inclusionExclusion().include()).containsExactly("structures after 2018");
                assertThat(plan.inclusionExclusion().exclude()).isEmpty();
                assertThat(plan.analysisOverview()).isEqualTo("Compare GDT scores.");
                assertThat(plan.metadata().createdAt()).isAfterOrEqualTo(before);
            })
            .verifyComplete();
    }

    @Test
    void missingFieldsTakeDefaults() {
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("{}"));

        StepVerifier.create(service.plan(ResearchFixtures.brief(), sources))
            .assertNext(plan -> {
                assertThat(plan.evidenceType()).isEqualTo("unknown");
                assertThat(plan.collectionStrategy()).isEmpty();
                assertThat(plan.expectedOutputs()).isEmpty();
                assertThat(plan.metadata()).isNotNull();
            })
            .verifyComplete();
    }

    @Test
    void unparseableAnswerIsAnError() {
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("Here is my plan: first..."));

        StepVerifier.create(service.plan(ResearchFixtures.brief(), sources))
            .expectError(GenerationParseException.class)
            .verify();
    }

    @Test
    void wrongShapeIsAParseError() {
        when(generationClient.generate(anyString(), anyString(), anyDouble()))
            .thenReturn(Mono.just("{\"collection_strategy\": {\"step\": 1}}"));

        StepVerifier.create(service.plan(ResearchFixtures.brief(), sources))
            .expectError(GenerationParseException.class)
            .verify();
    }

    @Test
    void promptCountsResources() {
        String prompt = service.buildPrompt(ResearchFixtures.brief(), sources);

        assertThat(prompt)
            .contains("Approach: Public Dataset Analysis")
            .contains("Time Budget: months")
            .contains("- 1 academic papers found")
            .contains("- 0 datasets identified");
    }

    @Test
    void planSerializesWithSnakeCaseKeys() throws Exception {
        EvidencePlan plan = new EvidencePlan("primary", List.of("a"), null, "x", List.of(), null)
            .withCreatedAt(Instant.parse("2025-01-01T00:00:00Z"));

        String json = ResearchFixtures.objectMapper().writeValueAsString(plan);

        assertThat(json).contains("\"evidence_type\":\"primary\"").contains("\"created_at\":\"2025-01-01T00:00:00Z\"");
    }
}
