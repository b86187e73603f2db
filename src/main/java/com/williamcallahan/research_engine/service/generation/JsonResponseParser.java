/**
 * Pulls a JSON object out of free-form generated text
 *
 * @author William Callahan
 *
 * Features:
 * - Accepts a bare JSON object as-is
 * - Otherwise returns the first well-formed object embedded in surrounding prose or code fences
 * - Fails with {@link GenerationParseException} when no object can be recovered
 */

package com.williamcallahan.research_engine.service.generation;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class JsonResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(JsonResponseParser.class);
    private static final int PREVIEW_LENGTH = 120;

    private final ObjectMapper objectMapper;

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param raw generated text
     * @return the recovered JSON object
     * @throws GenerationParseException when the text holds no well-formed object
     */
    public JsonNode parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new GenerationParseException("Generated response was empty");
        }
        String text = raw.trim();
        try {
            JsonNode direct = objectMapper.readTree(text);
            if (direct != null && direct.isObject()) {
                return direct;
            }
        } catch (JsonProcessingException e) {
            logger.debug("Generated response is not bare JSON, scanning for an embedded object: {}", e.getOriginalMessage());
        }

        for (int start = text.indexOf('{'); start >= 0; start = text.indexOf('{', start + 1)) {
            JsonNode candidate = readObjectAt(text, start);
            if (candidate != null) {
                return candidate;
            }
        }
        throw new GenerationParseException("No JSON object found in generated response: " + preview(text));
    }

    /**
     * Reads the first JSON value starting at {@code start}; trailing text is ignored.
     */
    private JsonNode readObjectAt(String text, int start) {
        try (JsonParser parser = objectMapper.getFactory().createParser(text.substring(start))) {
            JsonNode node = objectMapper.readTree(parser);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            logger.trace("No well-formed object at offset {}: {}", start, e.getMessage());
            return null;
        }
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
