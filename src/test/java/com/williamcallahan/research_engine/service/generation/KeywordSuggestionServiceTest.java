package com.williamcallahan.research_engine.service.generation;

import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.testutil.ResearchFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KeywordSuggestionServiceTest {

    @Mock
    private TextGenerationClient generationClient;

    private KeywordSuggestionService service;

    @BeforeEach
    void setUp() {
        service = new KeywordSuggestionService(generationClient, new JsonResponseParser(ResearchFixtures.objectMapper()));
    }

    @Test
    void returnsTrimmedKeywords() {
        when(generationClient.generate(anyString(), anyString(), eq(KeywordSuggestionService.TEMPERATURE)))
            .thenReturn(Mono.just("{\"keywords\": [\" alphafold \", \"\", 42, \"protein structure prediction\"]}"));

        StepVerifier.create(service.suggestKeywords(ResearchFixtures.brief()))
            .assertNext(keywords -> assertThat(keywords).containsExactly("alphafold", "protein structure prediction"))
            .verifyComplete();
    }

    @Test
    void fallsBackToTopicTitleWhenNoKeywords() {
        when(generationClient.generate(anyString(), anyString(), eq(KeywordSuggestionService.TEMPERATURE)))
            .thenReturn(Mono.just("Here you go: {\"keywords\": []}"));

        StepVerifier.create(service.suggestKeywords(ResearchFixtures.brief()))
            .assertNext(keywords -> assertThat(keywords).containsExactly("Transformer models for protein folding"))
            .verifyComplete();
    }

    @Test
    void unparseableAnswerIsAnError() {
        when(generationClient.generate(anyString(), anyString(), eq(KeywordSuggestionService.TEMPERATURE)))
            .thenReturn(Mono.just("Sorry, I cannot help with that."));

        StepVerifier.create(service.suggestKeywords(ResearchFixtures.brief()))
            .expectError(GenerationParseException.class)
            .verify();
    }

    @Test
    void promptCarriesContextAndFeedback() {
        when(generationClient.generate(anyString(), anyString(), eq(KeywordSuggestionService.TEMPERATURE)))
            .thenReturn(Mono.just("{\"keywords\": [\"x\"]}"));
        ResearchBrief brief = ResearchFixtures.brief("Too many biology papers, focus on machine learning");

        service.suggestKeywords(brief).block();

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generationClient).generate(anyString(), prompt.capture(), eq(KeywordSuggestionService.TEMPERATURE));
        assertThat(prompt.getValue())
            .contains("Topic: \"Transformer models for protein folding\"")
            .contains("Keywords: protein folding, transformers")
            .contains("Research approach: Public Dataset Analysis")
            .contains("Outline sections: Introduction; Methods")
            .contains("User feedback on previous results:\n\"Too many biology papers, focus on machine learning\"");
    }

    @Test
    void promptWithoutOutlineOrFeedback() {
        ResearchBrief bare = new ResearchBrief("Topic", null, null, null, "Survey", null, null, null);

        String prompt = service.buildPrompt(bare);

        assertThat(prompt).contains("Outline sections: No sections").contains("Keywords: N/A")
            .doesNotContain("User feedback");
    }
}
