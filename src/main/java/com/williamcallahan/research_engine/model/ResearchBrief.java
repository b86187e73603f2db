/**
 * Everything known about a research project when source discovery starts
 *
 * Features:
 * - The accepted topic with its own keywords
 * - The chosen study approach and the working title that goes with it
 * - Outline sections, practical constraints and optional feedback from a previous pass
 */
package com.williamcallahan.research_engine.model;

import java.util.List;

public record ResearchBrief(
    String topicTitle,
    String topicDescription,
    List<String> topicKeywords,
    String selectedTitle,
    String approachLabel,
    List<OutlineSection> outlineSections,
    ResearchConstraints constraints,
    String feedback
) {
    public ResearchBrief {
        topicDescription = topicDescription == null ? "" : topicDescription;
        topicKeywords = topicKeywords == null ? List.of() : List.copyOf(topicKeywords);
        selectedTitle = selectedTitle == null || selectedTitle.isBlank() ? topicTitle : selectedTitle;
        approachLabel = approachLabel == null ? "" : approachLabel;
        outlineSections = outlineSections == null ? List.of() : List.copyOf(outlineSections);
        constraints = constraints == null ? ResearchConstraints.defaults() : constraints;
    }
}
