/**
 * Filters raw web hits into datasets, learning resources and tools via the text-generation collaborator
 *
 * @author William Callahan
 *
 * Features:
 * - One classification call per category; a category with no candidates makes no call
 * - Keeps only entries that name both a resource and its link
 * - Usefulness notes are cleaned and cut to a short sentence
 * - An unparseable answer leaves that category empty without failing the job
 */

package com.williamcallahan.research_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.research_engine.model.DatasetEntry;
import com.williamcallahan.research_engine.model.LearningResourceEntry;
import com.williamcallahan.research_engine.model.OutlineSection;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.model.ToolEntry;
import com.williamcallahan.research_engine.model.WebHit;
import com.williamcallahan.research_engine.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

@Service
public class ResourceCurationService {

    private static final Logger logger = LoggerFactory.getLogger(ResourceCurationService.class);

    private static final double TEMPERATURE = 0.3;
    private static final int NOTE_LENGTH = 150;
    private static final int TOOL_SNIPPET_LENGTH = 200;
    private static final int OUTLINE_SECTION_LIMIT = 6;
    private static final int OUTLINE_BULLET_LIMIT = 3;

    private static final String DATASET_CONTEXT = "You are a dataset curator. Only select actual datasets from search results. "
        + "Be strict: articles and papers are NOT datasets.";
    private static final String LEARNING_CONTEXT = "You are a learning resources curator. Select only resources that are directly "
        + "relevant to the full research topic. Be strict about relevance: each resource must be about the whole topic, "
        + "not a tangentially related concept.";
    private static final String TOOL_CONTEXT = "You are a research tools curator. Select only actual software tools, libraries, "
        + "and platforms from search results that are specifically useful for the given research project. Be strict: "
        + "articles about tools are NOT tools. Only include results where the URL leads to the actual tool/library.";

    private final TextGenerationClient generationClient;
    private final JsonResponseParser jsonResponseParser;
    private final ObjectMapper objectMapper;

    public ResourceCurationService(TextGenerationClient generationClient,
                                   JsonResponseParser jsonResponseParser,
                                   ObjectMapper objectMapper) {
        this.generationClient = generationClient;
        this.jsonResponseParser = jsonResponseParser;
        this.objectMapper = objectMapper;
    }

    public Mono<List<DatasetEntry>> selectDatasets(ResearchBrief brief, List<WebHit> candidates) {
        if (candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        String prompt = "You are a research data expert. From the following web search results, identify which ones are "
            + "ACTUAL DATASETS or direct links to dataset repositories.\n\n"
            + "Topic: \"" + brief.selectedTitle() + "\"\n"
            + "Research approach: " + brief.approachLabel() + "\n\n"
            + "Search results:\n" + summarize(candidates, NOTE_LENGTH, false) + "\n\n"
            + "Rules:\n"
            + "- ONLY include results that are actual datasets, data repositories, or direct links to downloadable data\n"
            + "- Exclude articles ABOUT data, blog posts, tutorials, or papers; those are NOT datasets\n"
            + "- Look for URLs from: kaggle.com, huggingface.co, zenodo.org, data.gov, github.com, archive.ics.uci.edu, "
            + "figshare.com, dataverse, etc.\n"
            + "- For each real dataset, provide: name, domain (topic area), url (from the search result), "
            + "why_relevant (one sentence), and license if apparent\n"
            + "- If NONE of the results are actual datasets, return an empty array\n\n"
            + "Respond ONLY with valid JSON:\n"
            + "{\n  \"datasets\": [{\"name\": \"...\", \"domain\": \"...\", \"url\": \"https://...\", "
            + "\"why_relevant\": \"one sentence\", \"license\": \"if known or null\"}]\n}\n"
            + "No markdown, no extra text.";

        return classify("datasets", DATASET_CONTEXT, prompt, "datasets", item -> new DatasetEntry(
            text(item, "name"),
            text(item, "domain"),
            text(item, "url"),
            text(item, "why_relevant"),
            text(item, "license")
        ), entry -> entry.name() != null && entry.url() != null);
    }

    public Mono<List<LearningResourceEntry>> selectLearningResources(ResearchBrief brief, List<WebHit> candidates) {
        if (candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        String prompt = "You are a research learning resources curator. From the following web search results, select the "
            + "ones that are genuinely useful learning resources for this research topic.\n\n"
            + "Full research topic: \"" + brief.selectedTitle() + "\"\n"
            + "Description: " + brief.topicDescription() + "\n"
            + "Research approach: " + brief.approachLabel() + "\n\n"
            + "Search results:\n" + summarize(candidates, NOTE_LENGTH, true) + "\n\n"
            + "Rules:\n"
            + "- Select 8-12 resources that are DIRECTLY relevant to the FULL research topic \"" + brief.selectedTitle() + "\"\n"
            + "- A resource must be about the topic as a whole, not just matching a single word from the title\n"
            + "- KEEP: tutorials, online courses, YouTube videos/lectures, blog posts, Wikipedia articles, guides, educational content\n"
            + "- REMOVE: product pages, job listings, news unrelated to the topic, duplicate content, low-quality pages\n"
            + "- For each resource use the EXACT url from the search result (do not modify URLs)\n"
            + "- Extract the source domain from the URL (e.g. \"youtube.com\", \"coursera.org\", \"wikipedia.org\")\n"
            + "- Write a concise why_useful (max 1 sentence, under 150 characters)\n\n"
            + "Respond ONLY with valid JSON:\n"
            + "{\n  \"resources\": [{\"name\": \"...\", \"url\": \"https://...\", \"why_useful\": \"one short sentence\", "
            + "\"source\": \"domain.com\"}]\n}\n"
            + "No markdown, no extra text.";

        return classify("learning resources", LEARNING_CONTEXT, prompt, "resources", item -> new LearningResourceEntry(
            text(item, "name"),
            text(item, "url"),
            TextUtils.cleanSnippet(text(item, "why_useful"), NOTE_LENGTH),
            text(item, "source")
        ), entry -> entry.name() != null && entry.url() != null);
    }

    public Mono<List<ToolEntry>> selectTools(ResearchBrief brief, List<WebHit> candidates) {
        if (candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        String prompt = "You are a research tools expert. From the following web search results, identify actual software "
            + "tools, libraries, platforms or frameworks that would help carry out this research.\n\n"
            + "Research topic: \"" + brief.selectedTitle() + "\"\n"
            + "Description: " + brief.topicDescription() + "\n"
            + "Research approach: " + brief.approachLabel() + "\n\n"
            + "Outline:\n" + outlineContext(brief) + "\n\n"
            + "Search results:\n" + summarize(candidates, TOOL_SNIPPET_LENGTH, false) + "\n\n"
            + "Rules:\n"
            + "- ONLY include results whose URL leads to the actual tool, library, platform or its repository\n"
            + "- Exclude listicles, comparison articles, news and tutorials about tools\n"
            + "- Each tool must be useful for a concrete task in the outline above\n"
            + "- Use the EXACT url from the search result\n"
            + "- If NONE of the results are actual tools, return an empty array\n\n"
            + "Respond ONLY with valid JSON:\n"
            + "{\n  \"tools\": [{\"name\": \"...\", \"type\": \"library|platform|api|instrument|framework|dataset_tool\", "
            + "\"url\": \"https://...\", \"why_useful\": \"Helps with [specific task] in this project\"}]\n}\n"
            + "No markdown, no extra text.";

        return classify("tools", TOOL_CONTEXT, prompt, "tools", item -> new ToolEntry(
            text(item, "name"),
            text(item, "type"),
            text(item, "url"),
            TextUtils.cleanSnippet(text(item, "why_useful"), NOTE_LENGTH)
        ), entry -> entry.name() != null && entry.url() != null);
    }

    private <T> Mono<List<T>> classify(String category,
                                       String systemContext,
                                       String prompt,
                                       String arrayField,
                                       Function<JsonNode, T> mapper,
                                       Predicate<T> usable) {
        return generationClient.generate(systemContext, prompt, TEMPERATURE)
            .map(raw -> {
                JsonNode root = jsonResponseParser.parseObject(raw);
                List<T> entries = new ArrayList<>();
                for (JsonNode item : root.path(arrayField)) {
                    if (!item.isObject()) {
                        continue;
                    }
                    T entry = mapper.apply(item);
                    if (usable.test(entry)) {
                        entries.add(entry);
                    }
                }
                return List.copyOf(entries);
            })
            .onErrorResume(GenerationParseException.class, e -> {
                logger.warn("Unparseable {} selection, leaving category empty: {}", category, e.getMessage());
                return Mono.just(List.of());
            });
    }

    String summarize(List<WebHit> candidates, int snippetLength, boolean includeDomain) {
        ArrayNode summary = objectMapper.createArrayNode();
        for (WebHit hit : candidates) {
            ObjectNode item = summary.addObject();
            item.put("title", hit.title());
            item.put("url", hit.url());
            item.put("snippet", TextUtils.cleanSnippet(hit.snippet(), snippetLength));
            if (includeDomain) {
                item.put("domain", hit.domain());
            }
        }
        return summary.toPrettyString();
    }

    String outlineContext(ResearchBrief brief) {
        List<String> lines = new ArrayList<>();
        for (OutlineSection section : brief.outlineSections().stream().limit(OUTLINE_SECTION_LIMIT).toList()) {
            if (section.bullets().isEmpty()) {
                lines.add("- " + section.name());
            } else {
                lines.add("- " + section.name() + ": "
                    + String.join("; ", section.bullets().subList(0, Math.min(OUTLINE_BULLET_LIMIT, section.bullets().size()))));
            }
        }
        return lines.isEmpty() ? "N/A" : String.join("\n", lines);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
