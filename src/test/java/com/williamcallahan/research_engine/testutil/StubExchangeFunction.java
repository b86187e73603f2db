package com.williamcallahan.research_engine.testutil;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Scripted WebClient transport for tests. Responses are served in order and the last one
 * repeats; every request is recorded.
 */
public class StubExchangeFunction implements ExchangeFunction {

    private final Deque<Supplier<Mono<ClientResponse>>> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    public StubExchangeFunction respond(HttpStatus status, String body) {
        return respond(status, body, null, null);
    }

    public StubExchangeFunction respond(HttpStatus status, String body, String headerName, String headerValue) {
        responses.add(() -> {
            ClientResponse.Builder builder = ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body);
            if (headerName != null) {
                builder.header(headerName, headerValue);
            }
            return Mono.just(builder.build());
        });
        return this;
    }

    public StubExchangeFunction fail(Throwable error) {
        responses.add(() -> Mono.error(error));
        return this;
    }

    @Override
    public synchronized Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        if (responses.isEmpty()) {
            return Mono.error(new IllegalStateException("No stubbed response for " + request.url()));
        }
        Supplier<Mono<ClientResponse>> next = responses.size() > 1 ? responses.poll() : responses.peek();
        return next.get();
    }

    public List<ClientRequest> requests() {
        return requests;
    }

    public WebClient.Builder builder() {
        return WebClient.builder().exchangeFunction(this);
    }
}
