package com.williamcallahan.research_engine.service.generation;

/**
 * Raised when a generated answer contains no recoverable JSON object.
 */
public class GenerationParseException extends GenerationException {

    public GenerationParseException(String message) {
        super(message);
    }
}
