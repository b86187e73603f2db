package com.williamcallahan.research_engine.service.generation;

/**
 * Raised when the text-generation collaborator cannot produce a usable answer.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
