package com.williamcallahan.research_engine.service.generation;

import reactor.core.publisher.Mono;

/**
 * Text-generation collaborator: takes a system context and user content and returns raw text.
 * Implementations signal transport problems as {@link GenerationException}.
 */
public interface TextGenerationClient {

    Mono<String> generate(String systemContext, String userContent, double temperature);
}
