/**
 * Configuration for WebClient
 * - Defines the builder used by the evidence providers
 * - Defines a separate builder for the text-generation endpoint, whose responses take far longer
 *
 * @author William Callahan
 */
package com.williamcallahan.research_engine.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Scope;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE = 10 * 1024 * 1024; // 10MB

    /**
     * Builder for provider calls
     * - Connect timeout from providers.fetch.connect-timeout-millis (5000ms)
     * - Read and response timeout from providers.fetch.read-timeout-seconds (15s)
     * - Prototype scoped so each adapter can set its own base URL and headers
     */
    @Bean
    @Primary
    @Scope("prototype")
    public WebClient.Builder webClientBuilder(ProviderConfigurationProperties providerProperties) {
        ProviderConfigurationProperties.Fetch fetch = providerProperties.getFetch();
        return builderWithTimeouts(fetch.getConnectTimeoutMillis(), fetch.getReadTimeoutSeconds());
    }

    /**
     * Builder for the chat-completions endpoint, using app.generation.timeout-seconds for reads
     */
    @Bean("generationWebClientBuilder")
    @Scope("prototype")
    public WebClient.Builder generationWebClientBuilder(AppConfigurationProperties appProperties,
                                                        ProviderConfigurationProperties providerProperties) {
        return builderWithTimeouts(providerProperties.getFetch().getConnectTimeoutMillis(),
            appProperties.getGeneration().getTimeoutSeconds());
    }

    private WebClient.Builder builderWithTimeouts(int connectTimeoutMillis, int readTimeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_IN_MEMORY_SIZE))
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
