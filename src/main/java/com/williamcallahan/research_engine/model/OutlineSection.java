package com.williamcallahan.research_engine.model;

import java.util.List;

/**
 * One section of the accepted outline, used as context when choosing keywords and tools.
 */
public record OutlineSection(String name, List<String> bullets) {

    public OutlineSection {
        name = name == null ? "" : name;
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
    }
}
