package com.williamcallahan.research_engine.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.research_engine.config.ProviderConfigurationProperties;
import com.williamcallahan.research_engine.model.WebHit;
import com.williamcallahan.research_engine.monitoring.ApiRequestMonitor;
import com.williamcallahan.research_engine.service.fetch.ResilientFetchClient;
import com.williamcallahan.research_engine.testutil.StubExchangeFunction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class TavilySearchServiceTest {

    private StubExchangeFunction transport;
    private ProviderConfigurationProperties properties;
    private TavilySearchService service;

    @BeforeEach
    void setUp() {
        transport = new StubExchangeFunction();
        properties = new ProviderConfigurationProperties();
        properties.getTavily().setApiKey("tvly-test");
        ResilientFetchClient client = new ResilientFetchClient(transport.builder(), properties,
            new ApiRequestMonitor(new SimpleMeterRegistry()));
        service = new TavilySearchService(client, new ObjectMapper(), properties);
    }

    @Test
    void searchWeb_returnsCleanedHits() {
        transport.respond(HttpStatus.OK, """
            {"results": [
              {"title": "COVID-19 Open Research Dataset", "url": "https://www.kaggle.com/datasets/cord19",
               "content": "![banner](https://x/y.png) A [free](https://k) <em>dataset</em> of papers"},
              {"url": "https://github.com/example/tool"}
            ]}
            """);

        StepVerifier.create(service.searchWeb("covid dataset", 5))
            .assertNext(hits -> {
                assertThat(hits).hasSize(2);
                WebHit first = hits.get(0);
                assertThat(first.snippet()).isEqualTo("A free dataset of papers");
                assertThat(first.domain()).isEqualTo("www.kaggle.com");
                assertThat(hits.get(1).title()).isEmpty();
                assertThat(hits.get(1).domain()).isEqualTo("github.com");
            })
            .verifyComplete();

        assertThat(transport.requests().get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(transport.requests().get(0).url().getPath()).isEqualTo("/search");
    }

    @Test
    void searchWeb_disabledWithoutApiKey() {
        properties.getTavily().setApiKey("");

        StepVerifier.create(service.searchWeb("covid dataset", 5))
            .assertNext(hits -> assertThat(hits).isEmpty())
            .verifyComplete();
        assertThat(transport.requests()).isEmpty();
    }

    @Test
    void searchWeb_emptyOnServerError() {
        properties.getFetch().setMaxRetries(0);
        transport.respond(HttpStatus.INTERNAL_SERVER_ERROR, "");
        ResilientFetchClient noRetry = new ResilientFetchClient(transport.builder(), properties,
            new ApiRequestMonitor(new SimpleMeterRegistry()));
        TavilySearchService oneShot = new TavilySearchService(noRetry, new ObjectMapper(), properties);

        StepVerifier.create(oneShot.searchWeb("covid dataset", 5))
            .assertNext(hits -> assertThat(hits).isEmpty())
            .verifyComplete();
    }
}
