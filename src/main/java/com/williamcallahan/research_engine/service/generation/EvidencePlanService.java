/**
 * Drafts the evidence collection plan for the chosen research approach
 *
 * @author William Callahan
 *
 * Features:
 * - Prompts with the approach, practical constraints and counts of discovered resources
 * - Maps the answer onto the typed {@link EvidencePlan} and stamps its creation time
 * - An unparseable answer is fatal to the calling step
 */

package com.williamcallahan.research_engine.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.research_engine.model.EvidencePlan;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.model.ResearchConstraints;
import com.williamcallahan.research_engine.model.ResultBundle;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Service
public class EvidencePlanService {

    private static final double TEMPERATURE = 0.4;
    private static final String SYSTEM_CONTEXT = """
        You are an expert research methodology advisor. Generate a detailed evidence collection plan tailored to the selected research approach.

        The plan must be specific to the approach type:
        - Survey / Questionnaire: survey design, sampling, distribution, response analysis
        - Controlled Experiment: variables, control/treatment groups, measurement, protocols
        - Interview / Qualitative Study: participant selection, interview guide, coding, thematic analysis
        - Public Dataset Analysis: dataset selection criteria, preprocessing, statistical methods
        - Systematic Literature Review: database search strategy, screening criteria, synthesis method
        - Comparative Evaluation: criteria definition, scoring rubric, comparison framework

        Respond ONLY with valid JSON:
        {
          "evidence_type": "primary|secondary",
          "collection_strategy": ["Step 1: ...", "Step 2: ...", "Step 3: ..."],
          "inclusion_exclusion": {
            "include": ["criteria 1", "criteria 2"],
            "exclude": ["criteria 1", "criteria 2"]
          },
          "analysis_overview": "Description of how data/evidence will be analyzed",
          "expected_outputs": ["output 1", "output 2"]
        }
        No markdown, no extra text.""";

    private final TextGenerationClient generationClient;
    private final JsonResponseParser jsonResponseParser;
    private final ObjectMapper objectMapper;

    public EvidencePlanService(TextGenerationClient generationClient,
                               JsonResponseParser jsonResponseParser,
                               ObjectMapper objectMapper) {
        this.generationClient = generationClient;
        this.jsonResponseParser = jsonResponseParser;
        this.objectMapper = objectMapper;
    }

    /**
     * @param brief   project context
     * @param sources resources found by aggregation
     * @return Mono emitting the plan; errors with {@link GenerationParseException} when the
     *         answer holds no usable plan object
     */
    public Mono<EvidencePlan> plan(ResearchBrief brief, ResultBundle sources) {
        return generationClient.generate(SYSTEM_CONTEXT, buildPrompt(brief, sources), TEMPERATURE)
            .map(raw -> toPlan(raw).withCreatedAt(Instant.now()));
    }

    private EvidencePlan toPlan(String raw) {
        try {
            return objectMapper.treeToValue(jsonResponseParser.parseObject(raw), EvidencePlan.class);
        } catch (JsonProcessingException e) {
            throw new GenerationParseException("Evidence plan did not match the expected shape: " + e.getOriginalMessage());
        }
    }

    String buildPrompt(ResearchBrief brief, ResultBundle sources) {
        ResearchConstraints constraints = brief.constraints();
        return "Generate an evidence collection plan for this research project.\n\n"
            + "Title: \"" + brief.selectedTitle() + "\"\n"
            + "Approach: " + brief.approachLabel() + "\n"
            + "Time Budget: " + constraints.timeBudget() + "\n"
            + "Data Availability: " + constraints.dataAvailability() + "\n"
            + "User Level: " + constraints.userLevel() + "\n\n"
            + "Available Resources:\n"
            + "- " + sources.papers().size() + " academic papers found\n"
            + "- " + sources.datasets().size() + " datasets identified\n"
            + "- " + sources.tools().size() + " tools/software identified\n\n"
            + "Create a realistic, actionable plan that fits the constraints and leverages the available resources.";
    }
}
