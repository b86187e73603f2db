package com.williamcallahan.research_engine.service.fetch;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.net.URI;

/**
 * One outbound provider request.
 *
 * @param endpointName stable label for logs and metrics, e.g. {@code openalex/works}
 * @param method       HTTP method
 * @param uri          absolute request URI including query string
 * @param headers      extra request headers
 * @param body         JSON-serializable body, or {@code null}
 */
public record FetchRequest(String endpointName, HttpMethod method, URI uri, HttpHeaders headers, Object body) {

    public static FetchRequest get(String endpointName, URI uri) {
        return new FetchRequest(endpointName, HttpMethod.GET, uri, new HttpHeaders(), null);
    }

    public static FetchRequest post(String endpointName, URI uri, Object body) {
        return new FetchRequest(endpointName, HttpMethod.POST, uri, new HttpHeaders(), body);
    }

    public FetchRequest withHeader(String name, String value) {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(headers);
        copy.set(name, value);
        return new FetchRequest(endpointName, method, uri, copy, body);
    }
}
