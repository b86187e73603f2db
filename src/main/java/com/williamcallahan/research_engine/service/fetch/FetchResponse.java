package com.williamcallahan.research_engine.service.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.util.Optional;

/**
 * Successful (2xx) provider response with its raw body.
 */
public record FetchResponse(int status, String body, HttpHeaders headers) {

    private static final Logger logger = LoggerFactory.getLogger(FetchResponse.class);

    /**
     * Decodes the body as a JSON tree; empty when the body is blank or not JSON.
     */
    public Optional<JsonNode> json(ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            logger.debug("Response body is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
