/**
 * Asks the text-generation collaborator for academic search keywords
 *
 * @author William Callahan
 *
 * Features:
 * - Builds the prompt from topic, description, topic keywords, approach and outline sections
 * - Threads user feedback from a previous pass into the prompt
 * - Falls back to the topic title when the answer carries no keywords
 * - An unparseable answer is fatal to the calling step
 */

package com.williamcallahan.research_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.research_engine.model.OutlineSection;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class KeywordSuggestionService {

    private static final Logger logger = LoggerFactory.getLogger(KeywordSuggestionService.class);

    static final double TEMPERATURE = 0.3;
    private static final int OUTLINE_SECTION_LIMIT = 6;
    private static final String SYSTEM_CONTEXT = "You are a research librarian expert at crafting search queries. "
        + "Generate specific, targeted keywords for academic database searches.";

    private final TextGenerationClient generationClient;
    private final JsonResponseParser jsonResponseParser;

    public KeywordSuggestionService(TextGenerationClient generationClient, JsonResponseParser jsonResponseParser) {
        this.generationClient = generationClient;
        this.jsonResponseParser = jsonResponseParser;
    }

    /**
     * @param brief project context
     * @return Mono emitting at least one keyword; errors with {@link GenerationParseException}
     *         when the answer holds no JSON object
     */
    public Mono<List<String>> suggestKeywords(ResearchBrief brief) {
        return generationClient.generate(SYSTEM_CONTEXT, buildPrompt(brief), TEMPERATURE)
            .map(jsonResponseParser::parseObject)
            .map(root -> extractKeywords(root, brief.topicTitle()));
    }

    List<String> extractKeywords(JsonNode root, String topicTitle) {
        List<String> keywords = new ArrayList<>();
        for (JsonNode keyword : root.path("keywords")) {
            if (keyword.isTextual() && !keyword.asText().isBlank()) {
                keywords.add(keyword.asText().trim());
            }
        }
        if (keywords.isEmpty()) {
            logger.info("No keywords in generated answer, searching by topic title '{}'", topicTitle);
            return List.of(topicTitle);
        }
        return List.copyOf(keywords);
    }

    String buildPrompt(ResearchBrief brief) {
        String sections = brief.outlineSections().isEmpty()
            ? "No sections"
            : brief.outlineSections().stream()
                .limit(OUTLINE_SECTION_LIMIT)
                .map(OutlineSection::name)
                .collect(Collectors.joining("; "));
        String topicKeywords = brief.topicKeywords().isEmpty() ? "N/A" : String.join(", ", brief.topicKeywords());

        StringBuilder prompt = new StringBuilder()
            .append("Generate 5-10 targeted search keywords/phrases for finding academic papers related to this research.\n\n")
            .append("Topic: \"").append(brief.topicTitle()).append("\"\n")
            .append("Description: ").append(brief.topicDescription()).append('\n')
            .append("Keywords: ").append(topicKeywords).append('\n')
            .append("Research approach: ").append(brief.approachLabel()).append('\n')
            .append("Outline sections: ").append(sections).append('\n');
        if (ValidationUtils.hasText(brief.feedback())) {
            prompt.append("\nUser feedback on previous results:\n\"").append(brief.feedback()).append("\"\n")
                .append("Adjust your keyword selection accordingly.\n");
        }
        prompt.append("\nRespond ONLY with valid JSON:\n")
            .append("{\n  \"keywords\": [\"keyword1\", \"keyword2\", ...]\n}\n")
            .append("No markdown, no extra text.");
        return prompt.toString();
    }
}
