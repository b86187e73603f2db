/**
 * Request body that starts source discovery for a run
 *
 * @author William Callahan
 *
 * Features:
 * - Accepted topic, candidate approaches and the index of the chosen one
 * - Optional outline, constraints and feedback from an earlier pass
 * - Validates and converts itself into a {@link ResearchBrief}
 */

package com.williamcallahan.research_engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.research_engine.model.OutlineSection;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.model.ResearchConstraints;
import com.williamcallahan.research_engine.util.ValidationUtils;

import java.util.List;

public record SourceDiscoveryRequest(
    Topic topic,
    List<Approach> approaches,
    @JsonProperty("selected_approach_index") Integer selectedApproachIndex,
    List<Section> outline,
    Constraints constraints,
    String feedback
) {

    public record Topic(String title, String description, List<String> keywords) {
    }

    public record Approach(String label, String title) {
    }

    public record Section(String name, List<String> bullets) {
    }

    public record Constraints(
        @JsonProperty("time_budget") String timeBudget,
        @JsonProperty("data_availability") String dataAvailability,
        @JsonProperty("user_level") String userLevel
    ) {
    }

    /**
     * @throws IllegalArgumentException when the topic title is blank, there are no approaches,
     *                                  or the selected index does not point at one
     */
    public ResearchBrief toBrief() {
        if (topic == null || !ValidationUtils.hasText(topic.title())) {
            throw new IllegalArgumentException("topic.title is required");
        }
        if (ValidationUtils.isNullOrEmpty(approaches)) {
            throw new IllegalArgumentException("approaches must contain at least one approach");
        }
        if (selectedApproachIndex == null) {
            throw new IllegalArgumentException("selected_approach_index (integer) is required");
        }
        if (selectedApproachIndex < 0 || selectedApproachIndex >= approaches.size()) {
            throw new IllegalArgumentException("selected_approach_index must be between 0 and " + (approaches.size() - 1));
        }
        Approach selected = approaches.get(selectedApproachIndex);
        if (selected == null || !ValidationUtils.hasText(selected.label())) {
            throw new IllegalArgumentException("selected approach must have a label");
        }

        List<OutlineSection> sections = outline == null ? List.of() : outline.stream()
            .filter(section -> section != null && ValidationUtils.hasText(section.name()))
            .map(section -> new OutlineSection(section.name().trim(), section.bullets()))
            .toList();
        ResearchConstraints researchConstraints = constraints == null
            ? ResearchConstraints.defaults()
            : new ResearchConstraints(constraints.timeBudget(), constraints.dataAvailability(), constraints.userLevel());

        return new ResearchBrief(
            topic.title().trim(),
            topic.description(),
            topic.keywords() == null ? List.of() : topic.keywords().stream().filter(ValidationUtils::hasText).toList(),
            selected.title(),
            selected.label().trim(),
            sections,
            researchConstraints,
            ValidationUtils.nullIfBlank(feedback)
        );
    }
}
