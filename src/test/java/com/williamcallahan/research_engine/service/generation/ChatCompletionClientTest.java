package com.williamcallahan.research_engine.service.generation;

import com.williamcallahan.research_engine.config.AppConfigurationProperties;
import com.williamcallahan.research_engine.monitoring.ApiRequestMonitor;
import com.williamcallahan.research_engine.testutil.StubExchangeFunction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ChatCompletionClientTest {

    private StubExchangeFunction transport;
    private AppConfigurationProperties properties;
    private ApiRequestMonitor monitor;

    @BeforeEach
    void setUp() {
        transport = new StubExchangeFunction();
        properties = new AppConfigurationProperties();
        properties.getGeneration().setBaseUrl("https://llm.example.org/v1");
        properties.getGeneration().setApiKey("test-key");
        monitor = new ApiRequestMonitor(new SimpleMeterRegistry());
    }

    private ChatCompletionClient client() {
        return new ChatCompletionClient(transport.builder(), properties, monitor);
    }

    @Test
    void returnsFirstChoiceContent() {
        transport.respond(HttpStatus.OK, "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"{\\\"keywords\\\": []}\"}}]}");

        StepVerifier.create(client().generate("system", "user", 0.3))
            .expectNext("{\"keywords\": []}")
            .verifyComplete();

        assertThat(transport.requests()).hasSize(1);
        assertThat(transport.requests().get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(transport.requests().get(0).url().toString()).isEqualTo("https://llm.example.org/v1/chat/completions");
        assertThat(transport.requests().get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer test-key");
        assertThat(monitor.getMetricsMap()).containsEntry("total_successful", 1L);
    }

    @Test
    void failsWithoutApiKey() {
        properties.getGeneration().setApiKey("");

        StepVerifier.create(client().generate("system", "user", 0.3))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("API key"))
            .verify();

        assertThat(transport.requests()).isEmpty();
    }

    @Test
    void mapsHttpErrorsToGenerationException() {
        transport.respond(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\": \"overloaded\"}");

        StepVerifier.create(client().generate("system", "user", 0.3))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(GenerationException.class)
                .isNotInstanceOf(GenerationParseException.class))
            .verify();

        assertThat(monitor.getMetricsMap()).containsEntry("total_failed", 1L);
    }

    @Test
    void failsOnEmptyContent() {
        transport.respond(HttpStatus.OK, "{\"choices\": []}");

        StepVerifier.create(client().generate("system", "user", 0.3))
            .expectError(GenerationException.class)
            .verify();
    }
}
