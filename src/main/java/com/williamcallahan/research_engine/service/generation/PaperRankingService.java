/**
 * Ranks and annotates merged papers through the text-generation collaborator
 *
 * @author William Callahan
 *
 * Features:
 * - Sends the top merged papers (authors truncated) for relevance ranking
 * - Keeps the merged record's locators and DOI for every paper the answer names
 * - Unparseable answers fall back to the first papers with default annotations
 * - Re-attaches provider provenance and display labels after ranking
 */

package com.williamcallahan.research_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.research_engine.config.AppConfigurationProperties;
import com.williamcallahan.research_engine.model.CanonicalRecord;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.service.merge.ProvenanceReattacher;
import com.williamcallahan.research_engine.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class PaperRankingService {

    private static final Logger logger = LoggerFactory.getLogger(PaperRankingService.class);

    static final String DEFAULT_WHY_RELEVANT = "Found via academic database search";
    static final String DEFAULT_CREDIBILITY = "unknown";
    private static final double TEMPERATURE = 0.3;
    private static final int AUTHOR_LIMIT = 3;
    private static final String SYSTEM_CONTEXT = "You are a research resource evaluator. Rank and annotate papers. "
        + "You MUST preserve all original URLs and DOIs exactly. Respond with JSON only.";

    private final TextGenerationClient generationClient;
    private final JsonResponseParser jsonResponseParser;
    private final ObjectMapper objectMapper;
    private final AppConfigurationProperties.Aggregation settings;

    public PaperRankingService(TextGenerationClient generationClient,
                               JsonResponseParser jsonResponseParser,
                               ObjectMapper objectMapper,
                               AppConfigurationProperties appProperties) {
        this.generationClient = generationClient;
        this.jsonResponseParser = jsonResponseParser;
        this.objectMapper = objectMapper;
        this.settings = appProperties.getAggregation();
    }

    /**
     * @param brief  project context
     * @param merged merged papers, best first
     * @return Mono emitting ranked, annotated papers with provenance restored
     */
    public Mono<List<CanonicalRecord>> rank(ResearchBrief brief, List<CanonicalRecord> merged) {
        if (merged.isEmpty()) {
            return Mono.just(List.of());
        }
        List<CanonicalRecord> candidates = merged.subList(0, Math.min(settings.getRankingInputLimit(), merged.size()));

        return generationClient.generate(SYSTEM_CONTEXT, buildPrompt(brief, candidates), TEMPERATURE)
            .map(raw -> annotate(jsonResponseParser.parseObject(raw), merged))
            .onErrorResume(GenerationParseException.class, e -> {
                logger.warn("Paper ranking answer was unparseable, keeping database order: {}", e.getMessage());
                return Mono.just(fallback(merged));
            })
            .map(ranked -> ProvenanceReattacher.reattach(ranked, merged));
    }

    List<CanonicalRecord> annotate(JsonNode root, List<CanonicalRecord> merged) {
        JsonNode papers = root.path("papers");
        if (!papers.isArray()) {
            throw new GenerationParseException("Ranking answer has no papers array");
        }
        Map<String, CanonicalRecord> byTitle = new HashMap<>();
        for (CanonicalRecord record : merged) {
            byTitle.putIfAbsent(TextUtils.normalizeTitleKey(record.getTitle()), record);
        }

        List<CanonicalRecord> ranked = new ArrayList<>();
        for (JsonNode paper : papers) {
            String title = text(paper, "title");
            if (title == null) {
                continue;
            }
            CanonicalRecord known = byTitle.get(TextUtils.normalizeTitleKey(title));
            CanonicalRecord annotated = known != null ? known.copy() : fromAnswer(paper);
            String whyRelevant = text(paper, "why_relevant");
            String credibility = text(paper, "credibility_notes");
            annotated.setWhyRelevant(whyRelevant != null ? whyRelevant : DEFAULT_WHY_RELEVANT);
            annotated.setCredibilityNotes(credibility != null ? credibility : DEFAULT_CREDIBILITY);
            ranked.add(annotated);
        }
        return ranked;
    }

    List<CanonicalRecord> fallback(List<CanonicalRecord> merged) {
        List<CanonicalRecord> result = new ArrayList<>();
        for (CanonicalRecord record : merged.subList(0, Math.min(settings.getRankingFallbackCount(), merged.size()))) {
            CanonicalRecord copy = record.copy();
            copy.setWhyRelevant(DEFAULT_WHY_RELEVANT);
            copy.setCredibilityNotes(DEFAULT_CREDIBILITY);
            result.add(copy);
        }
        return result;
    }

    /**
     * A paper the answer named that is not in the merged set; only its own fields are known.
     */
    private CanonicalRecord fromAnswer(JsonNode paper) {
        CanonicalRecord record = new CanonicalRecord();
        record.setTitle(text(paper, "title"));
        List<String> authors = new ArrayList<>();
        for (JsonNode author : paper.path("authors")) {
            if (author.isTextual()) {
                authors.add(author.asText());
            }
        }
        record.setAuthors(authors);
        record.setYear(paper.path("year").isInt() ? paper.path("year").asInt() : null);
        record.setVenue(text(paper, "venue"));
        record.setDoi(text(paper, "doi"));
        record.setUrl(text(paper, "url"));
        record.setPdfUrl(text(paper, "pdf_url"));
        return record;
    }

    String buildPrompt(ResearchBrief brief, List<CanonicalRecord> candidates) {
        ArrayNode papers = objectMapper.createArrayNode();
        for (CanonicalRecord record : candidates) {
            ObjectNode paper = papers.addObject();
            paper.put("title", orEmpty(record.getTitle()));
            ArrayNode authors = paper.putArray("authors");
            record.getAuthors().stream().limit(AUTHOR_LIMIT).forEach(authors::add);
            if (record.getYear() != null) {
                paper.put("year", record.getYear());
            } else {
                paper.putNull("year");
            }
            paper.put("venue", orEmpty(record.getVenue()));
            paper.put("doi", orEmpty(record.getDoi()));
            paper.put("url", orEmpty(record.getUrl()));
            paper.put("pdf_url", orEmpty(record.getPdfUrl()));
            paper.put("cited_by_count", record.getCitedByCount() != null ? record.getCitedByCount() : 0);
        }

        return "You are ranking academic papers for relevance to this research project.\n\n"
            + "Topic: \"" + brief.selectedTitle() + "\"\n"
            + "Approach: " + brief.approachLabel() + "\n"
            + "Description: " + brief.topicDescription() + "\n\n"
            + "## Papers found (" + candidates.size() + " total):\n"
            + papers.toPrettyString() + "\n\n"
            + "For each paper:\n"
            + "1. Add \"why_relevant\" - one sentence explaining relevance\n"
            + "2. Add \"credibility_notes\" - one of: \"peer-reviewed\", \"preprint\", \"report\", \"unknown\"\n"
            + "3. IMPORTANT: Preserve ALL original fields exactly (title, authors, year, venue, doi, url, pdf_url)\n\n"
            + "Remove clearly irrelevant papers. Keep the rest sorted by relevance.\n\n"
            + "Respond ONLY with valid JSON:\n"
            + "{\n  \"papers\": [{ \"title\": \"...\", \"authors\": [...], \"year\": N, \"venue\": \"...\", \"doi\": \"...\", "
            + "\"url\": \"...\", \"pdf_url\": \"...\", \"why_relevant\": \"...\", \"credibility_notes\": \"...\" }]\n}\n"
            + "No markdown, no extra text.";
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
