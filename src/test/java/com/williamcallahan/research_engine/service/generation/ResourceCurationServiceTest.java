package com.williamcallahan.research_engine.service.generation;

import com.williamcallahan.research_engine.model.DatasetEntry;
import com.williamcallahan.research_engine.model.LearningResourceEntry;
import com.williamcallahan.research_engine.model.ToolEntry;
import com.williamcallahan.research_engine.model.WebHit;
import com.williamcallahan.research_engine.testutil.ResearchFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceCurationServiceTest {

    @Mock
    private TextGenerationClient generationClient;

    private ResourceCurationService service;
    private List<WebHit> candidates;

    @BeforeEach
    void setUp() {
        service = new ResourceCurationService(generationClient, new JsonResponseParser(ResearchFixtures.objectMapper()),
            ResearchFixtures.objectMapper());
        candidates = List.of(
            ResearchFixtures.hit("Protein Data Bank", "https://www.rcsb.org/"),
            ResearchFixtures.hit("Why datasets matter", "https://blog.example.com/datasets")
        );
    }

    @Test
    void keepsOnlyDatasetsWithNameAndUrl() {
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("""
            ```json
            {"datasets": [
              {"name": "Protein Data Bank", "domain": "structural biology", "url": "https://www.rcsb.org/",
               "why_relevant": "Ground-truth structures.", "license": null},
              {"name": "Nameless", "domain": "misc"},
              {"url": "https://example.org/no-name"},
              "not an object"
            ]}
            ```
            """));

        StepVerifier.create(service.selectDatasets(ResearchFixtures.brief(), candidates))
            .assertNext(datasets -> assertThat(datasets).containsExactly(new DatasetEntry(
                "Protein Data Bank", "structural biology", "https://www.rcsb.org/", "Ground-truth structures.", null)))
            .verifyComplete();
    }

    @Test
    void learningResourceNotesAreShortened() {
        String longNote = "This lecture series walks through attention mechanisms and then applies them to protein "
            + "structure prediction in a long detailed way that keeps going well past any reasonable length for a note";
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just(
            "{\"resources\": [{\"name\": \"Lecture\", \"url\": \"https://youtube.com/watch?v=1\", \"why_useful\": \""
                + longNote + "\", \"source\": \"youtube.com\"}]}"));

        StepVerifier.create(service.selectLearningResources(ResearchFixtures.brief(), candidates))
            .assertNext(resources -> {
                assertThat(resources).hasSize(1);
                LearningResourceEntry entry = resources.get(0);
                assertThat(entry.whyUseful()).endsWith("...").hasSizeLessThanOrEqualTo(153);
                assertThat(entry.source()).isEqualTo("youtube.com");
            })
            .verifyComplete();
    }

    @Test
    void unparseableAnswerLeavesCategoryEmpty() {
        when(generationClient.generate(anyString(), anyString(), anyDouble())).thenReturn(Mono.just("I found no tools."));

        StepVerifier.create(service.selectTools(ResearchFixtures.brief(), candidates))
            .assertNext(tools -> assertThat(tools).isEmpty())
            .verifyComplete();
    }

    @Test
    void transportFailurePropagates() {
        when(generationClient.generate(anyString(), anyString(), anyDouble()))
            .thenReturn(Mono.error(new GenerationException("Text generation call failed: 503")));

        StepVerifier.create(service.selectTools(ResearchFixtures.brief(), candidates))
            .expectError(GenerationException.class)
            .verify();
    }

    @Test
    void noCandidatesMeansNoCall() {
        StepVerifier.create(service.selectDatasets(ResearchFixtures.brief(), List.of()))
            .assertNext(datasets -> assertThat(datasets).isEmpty())
            .verifyComplete();
        StepVerifier.create(service.selectLearningResources(ResearchFixtures.brief(), List.of()))
            .assertNext(resources -> assertThat(resources).isEmpty())
            .verifyComplete();
        StepVerifier.create(service.selectTools(ResearchFixtures.brief(), List.of()))
            .assertNext(tools -> assertThat(tools).isEmpty())
            .verifyComplete();

        verify(generationClient, never()).generate(anyString(), anyString(), anyDouble());
    }

    @Test
    void toolPromptIncludesOutlineBullets() {
        when(generationClient.generate(anyString(), anyString(), anyDouble()))
            .thenReturn(Mono.just("{\"tools\": [{\"name\": \"PyTorch\", \"type\": \"library\", \"url\": \"https://pytorch.org\"}]}"));

        List<ToolEntry> tools = service.selectTools(ResearchFixtures.brief(), candidates).block();

        assertThat(tools).extracting(ToolEntry::name).containsExactly("PyTorch");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generationClient).generate(anyString(), prompt.capture(), anyDouble());
        assertThat(prompt.getValue())
            .contains("- Methods: Data; Model; Evaluation")
            .doesNotContain("Ablations")
            .contains("\"url\" : \"https://www.rcsb.org/\"");
    }
}
